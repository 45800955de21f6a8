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

package com.nuclideid.chains;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nuclideid.isotopes.Nuclide;

/**
 * The secular-equilibrium diagnostic for one parent/daughter pair: the ratio of the counts in the strongest peak
 * matched to each.  In equilibrium both members have equal activity, so the ratio stays within a broad band around
 * one once both peaks carry enough counts.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EquilibriumCheck {
  public static final double MIN_PEAK_COUNTS = 100.0;
  public static final double MIN_RATIO = 0.3;
  public static final double MAX_RATIO = 3.0;

  @JsonProperty("parent")
  private final Nuclide parent;

  @JsonProperty("daughter")
  private final Nuclide daughter;

  @JsonProperty("parent_counts")
  private final double parentCounts;

  @JsonProperty("daughter_counts")
  private final double daughterCounts;

  // Daughter over parent; null when either peak is too weak to judge.
  @JsonProperty("ratio")
  private final Double ratio;

  @JsonProperty("status")
  private final EquilibriumStatus status;

  public EquilibriumCheck(Nuclide parent, Nuclide daughter, double parentCounts, double daughterCounts) {
    this.parent = parent;
    this.daughter = daughter;
    this.parentCounts = parentCounts;
    this.daughterCounts = daughterCounts;

    if (parentCounts > MIN_PEAK_COUNTS && daughterCounts > MIN_PEAK_COUNTS) {
      this.ratio = daughterCounts / parentCounts;
      this.status = ratio >= MIN_RATIO && ratio <= MAX_RATIO ?
          EquilibriumStatus.IN_EQUILIBRIUM : EquilibriumStatus.OUT_OF_EQUILIBRIUM;
    } else {
      this.ratio = null;
      this.status = EquilibriumStatus.UNKNOWN;
    }
  }

  public Nuclide getParent() {
    return parent;
  }

  public Nuclide getDaughter() {
    return daughter;
  }

  public double getParentCounts() {
    return parentCounts;
  }

  public double getDaughterCounts() {
    return daughterCounts;
  }

  public Double getRatio() {
    return ratio;
  }

  public EquilibriumStatus getStatus() {
    return status;
  }
}
