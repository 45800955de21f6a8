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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nuclideid.isotopes.Nuclide;

/**
 * A confidence (0-100) assigned to a nuclide by a scorer outside this library, such as a trained classifier.
 */
public class ExternalScore {
  @JsonProperty("isotope")
  private final Nuclide isotope;

  @JsonProperty("confidence")
  private final double confidence;

  @JsonCreator
  public ExternalScore(@JsonProperty("isotope") Nuclide isotope,
                       @JsonProperty("confidence") double confidence) {
    if (!(confidence >= 0.0 && confidence <= 100.0)) {
      throw new IllegalArgumentException(String.format(
          "External confidence for %s must lie in [0, 100], got %f", isotope, confidence));
    }
    this.isotope = isotope;
    this.confidence = confidence;
  }

  public Nuclide getIsotope() {
    return isotope;
  }

  public double getConfidence() {
    return confidence;
  }
}
