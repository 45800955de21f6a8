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

package com.nuclideid.isotopes;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nuclideid.peaks.Peak;

/**
 * An expected gamma line together with the detected peak that matched it.
 */
public class LineMatch {
  @JsonProperty("expected_kev")
  private final double expectedKeV;

  @JsonProperty("intensity")
  private final double intensity;

  @JsonProperty("observed_kev")
  private final double observedKeV;

  @JsonProperty("observed_counts")
  private final double observedCounts;

  @JsonProperty("difference_kev")
  private final double differenceKeV;

  public LineMatch(IsotopeLine line, Peak peak) {
    this.expectedKeV = line.getEnergyKeV();
    this.intensity = line.getIntensity();
    this.observedKeV = peak.getEnergyKeV();
    this.observedCounts = peak.getCounts();
    this.differenceKeV = Math.abs(peak.getEnergyKeV() - line.getEnergyKeV());
  }

  public double getExpectedKeV() {
    return expectedKeV;
  }

  public double getIntensity() {
    return intensity;
  }

  public double getObservedKeV() {
    return observedKeV;
  }

  public double getObservedCounts() {
    return observedCounts;
  }

  public double getDifferenceKeV() {
    return differenceKeV;
  }
}
