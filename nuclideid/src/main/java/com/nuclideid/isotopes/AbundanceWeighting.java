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

/**
 * A soft prior on natural abundance.  An abundance weight w (relative to the U-238 series) scales a confidence by
 * 1 + (w - 1) * 0.5, so rare series are damped and abundant ones lifted without ever turning a score negative.
 */
public final class AbundanceWeighting {
  public static final double PRIOR_STRENGTH = 0.5;

  private AbundanceWeighting() {

  }

  public static double factor(double abundanceWeight) {
    return Math.max(0.0, 1.0 + (abundanceWeight - 1.0) * PRIOR_STRENGTH);
  }

  public static double apply(double confidence, double abundanceWeight) {
    return confidence * factor(abundanceWeight);
  }
}
