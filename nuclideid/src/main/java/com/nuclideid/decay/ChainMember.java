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

package com.nuclideid.decay;

import com.nuclideid.isotopes.Nuclide;

/**
 * One step of a linear decay sequence: a nuclide, its half-life if known, and the fraction of its decays that feed
 * the next member.
 */
public class ChainMember {
  private static final double LN_2 = Math.log(2.0);

  private final Nuclide nuclide;
  private final Double halfLifeSeconds;
  private final double branchingToNext;

  public ChainMember(Nuclide nuclide, Double halfLifeSeconds, double branchingToNext) {
    if (halfLifeSeconds != null && !(halfLifeSeconds > 0.0 && Double.isFinite(halfLifeSeconds))) {
      throw new IllegalArgumentException(String.format(
          "Half-life of %s must be positive and finite, got %s", nuclide, halfLifeSeconds));
    }
    if (!(branchingToNext >= 0.0 && branchingToNext <= 1.0)) {
      throw new IllegalArgumentException(String.format(
          "Branching fraction of %s must lie in [0, 1], got %s", nuclide, branchingToNext));
    }
    this.nuclide = nuclide;
    this.halfLifeSeconds = halfLifeSeconds;
    this.branchingToNext = branchingToNext;
  }

  public Nuclide getNuclide() {
    return nuclide;
  }

  public Double getHalfLifeSeconds() {
    return halfLifeSeconds;
  }

  public boolean hasKnownHalfLife() {
    return halfLifeSeconds != null;
  }

  /**
   * @return ln(2) / half-life in 1/s, or 0 if the half-life is unknown.
   */
  public double getDecayConstant() {
    return halfLifeSeconds == null ? 0.0 : LN_2 / halfLifeSeconds;
  }

  public double getBranchingToNext() {
    return branchingToNext;
  }

  @Override
  public String toString() {
    return String.format("%s (t1/2 %s s, b %.4f)", nuclide, halfLifeSeconds == null ? "?" : halfLifeSeconds,
        branchingToNext);
  }
}
