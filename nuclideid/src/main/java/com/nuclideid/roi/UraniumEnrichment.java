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

package com.nuclideid.roi;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Uranium enrichment estimate from the net counts of the U-235 186 keV line relative to the Th-234 93 keV line.
 * Natural uranium gives a ratio of roughly 30 to 100 percent with these lines.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UraniumEnrichment {
  public static final double NATURAL_THRESHOLD_PERCENT = 30.0;
  public static final double ENRICHED_THRESHOLD_PERCENT = 100.0;

  public enum Category {
    DEPLETED,
    NATURAL,
    ENRICHED,
    INDETERMINATE, // No net Th-234 counts to compare against.
    ;

    public static Category forRatio(double ratioPercent) {
      if (ratioPercent >= ENRICHED_THRESHOLD_PERCENT) {
        return ENRICHED;
      }
      if (ratioPercent >= NATURAL_THRESHOLD_PERCENT) {
        return NATURAL;
      }
      return DEPLETED;
    }
  }

  @JsonProperty("u235")
  private final RoiResult u235;

  @JsonProperty("th234")
  private final RoiResult th234;

  @JsonProperty("ratio_percent")
  private final Double ratioPercent;

  @JsonProperty("ratio_uncertainty_percent")
  private final Double ratioUncertaintyPercent;

  @JsonProperty("category")
  private final Category category;

  public UraniumEnrichment(RoiResult u235, RoiResult th234) {
    this.u235 = u235;
    this.th234 = th234;
    if (th234.getNetCounts() > 0.0) {
      double ratio = u235.getNetCounts() / th234.getNetCounts() * 100.0;
      double uncertainty = 0.0;
      if (u235.getNetCounts() > 0.0) {
        double u235Relative = u235.getUncertaintySigma() / u235.getNetCounts();
        double th234Relative = th234.getUncertaintySigma() / th234.getNetCounts();
        uncertainty = ratio * Math.sqrt(u235Relative * u235Relative + th234Relative * th234Relative);
      }
      this.ratioPercent = ratio;
      this.ratioUncertaintyPercent = uncertainty;
      this.category = Category.forRatio(ratio);
    } else {
      this.ratioPercent = null;
      this.ratioUncertaintyPercent = null;
      this.category = Category.INDETERMINATE;
    }
  }

  public RoiResult getU235() {
    return u235;
  }

  public RoiResult getTh234() {
    return th234;
  }

  public Double getRatioPercent() {
    return ratioPercent;
  }

  public Double getRatioUncertaintyPercent() {
    return ratioUncertaintyPercent;
  }

  public Category getCategory() {
    return category;
  }
}
