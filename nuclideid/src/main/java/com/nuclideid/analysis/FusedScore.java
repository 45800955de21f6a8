/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.nuclideid.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nuclideid.isotopes.Nuclide;

/**
 * A nuclide's combined confidence, with the scores it was combined from.  A side that did not report the nuclide
 * is null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FusedScore {
  @JsonProperty("isotope")
  private final Nuclide isotope;

  @JsonProperty("confidence")
  private final double confidence;

  @JsonProperty("peak_matching_confidence")
  private final Double peakMatchingConfidence;

  @JsonProperty("external_confidence")
  private final Double externalConfidence;

  public FusedScore(Nuclide isotope, double confidence, Double peakMatchingConfidence, Double externalConfidence) {
    this.isotope = isotope;
    this.confidence = confidence;
    this.peakMatchingConfidence = peakMatchingConfidence;
    this.externalConfidence = externalConfidence;
  }

  public Nuclide getIsotope() {
    return isotope;
  }

  public double getConfidence() {
    return confidence;
  }

  public Double getPeakMatchingConfidence() {
    return peakMatchingConfidence;
  }

  public Double getExternalConfidence() {
    return externalConfidence;
  }

  @Override
  public String toString() {
    return String.format("%s: %.1f", isotope, confidence);
  }
}
