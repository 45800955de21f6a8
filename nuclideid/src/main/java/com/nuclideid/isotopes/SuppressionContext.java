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

import com.nuclideid.chains.DecaySeries;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The decay series confirmed by chain analysis, and what that implies for other candidates.  Natural-mineral and
 * artificial-source hypotheses are treated as mutually exclusive for one sample: once the U-238 or Th-232 series is
 * confirmed, every nuclide outside the confirmed series is scaled down, except standalone natural nuclides such as
 * K-40.
 */
public class SuppressionContext {
  public static final double DEFAULT_FACTOR = 0.5;
  public static final String REASON_NATURAL_SERIES = "incompatible_with_natural_chain";

  private static final SuppressionContext NONE = new SuppressionContext(EnumSet.noneOf(DecaySeries.class), 1.0);

  private final Set<DecaySeries> confirmedSeries;
  private final double factor;

  public SuppressionContext(Set<DecaySeries> confirmedSeries, double factor) {
    if (!(factor >= 0.0 && factor <= 1.0)) {
      throw new IllegalArgumentException(String.format("Suppression factor must lie in [0, 1], got %f", factor));
    }
    this.confirmedSeries = confirmedSeries.isEmpty() ?
        EnumSet.noneOf(DecaySeries.class) : EnumSet.copyOf(confirmedSeries);
    this.factor = factor;
  }

  public static SuppressionContext none() {
    return NONE;
  }

  public Set<DecaySeries> getConfirmedSeries() {
    return Collections.unmodifiableSet(confirmedSeries);
  }

  public double getFactor() {
    return factor;
  }

  /**
   * @return True if a confirmed series marks the sample as natural material.
   */
  public boolean isActive() {
    for (DecaySeries series : confirmedSeries) {
      if (series.suppressesArtificialSources()) {
        return true;
      }
    }
    return false;
  }

  public boolean suppresses(IsotopeRecord record) {
    if (!isActive() || record.isStandaloneNatural()) {
      return false;
    }
    return record.getChain() == null || !confirmedSeries.contains(record.getChain());
  }
}
