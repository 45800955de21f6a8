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

import java.util.Arrays;

/**
 * Closed-form solution of the Bateman equations for a linear chain 1 -> 2 -> ... -> n with only the first member
 * present at t = 0:
 * <pre>
 *   N_k(t) = N_1(0) * prod_{j&lt;k}(b_j * l_j) * sum_{i&lt;=k} exp(-l_i t) / prod_{j&lt;=k, j!=i}(l_j - l_i)
 * </pre>
 * where l_j are decay constants and b_j the fraction of member j's decays that feed member j + 1.
 *
 * The sum is singular when two members share a decay constant.  Near-equal constants are separated by a relative
 * offset of 1e-6 per earlier near-equal member, which converges on the limiting form (for two equal constants,
 * N_2 = N_1(0) * l * t * exp(-l t)) to well within the accuracy of the nuclear data.
 */
public class BatemanSolver {
  public static final double DEGENERACY_TOLERANCE = 1e-6;

  /**
   * Compute the number of atoms of every member at time {@code t}.
   * @param decayConstants Decay constants, 1/s, parent first; all must be positive.
   * @param branching Fraction of each member's decays that feed the next member; the last entry is ignored.
   * @param initialAtoms Atoms of the first member at t = 0.
   * @param t Elapsed time, s.
   * @return Atoms per member, never negative.
   */
  public double[] atoms(double[] decayConstants, double[] branching, double initialAtoms, double t) {
    int n = decayConstants.length;
    if (n == 0) {
      return new double[0];
    }
    if (branching.length < n - 1) {
      throw new IllegalArgumentException(String.format(
          "Need %d branching fractions for %d members, got %d", n - 1, n, branching.length));
    }
    for (double lambda : decayConstants) {
      if (!(lambda > 0.0) || Double.isInfinite(lambda)) {
        throw new IllegalArgumentException(String.format("Decay constants must be positive and finite, got %s",
            Arrays.toString(decayConstants)));
      }
    }

    if (!(t >= 0.0)) {
      throw new IllegalArgumentException(String.format("Elapsed time must be non-negative, got %s", t));
    }

    double[] atoms = new double[n];
    if (t == 0.0) {
      atoms[0] = initialAtoms;
      return atoms;
    }

    double[] lambdas = separate(decayConstants);
    double prefactor = initialAtoms;
    for (int k = 0; k < n; k++) {
      if (k > 0) {
        prefactor *= branching[k - 1] * lambdas[k - 1];
      }
      double sum = 0.0;
      for (int i = 0; i <= k; i++) {
        double denominator = 1.0;
        for (int j = 0; j <= k; j++) {
          if (j != i) {
            denominator *= lambdas[j] - lambdas[i];
          }
        }
        sum += Math.exp(-lambdas[i] * t) / denominator;
      }
      // Cancellation in the alternating sum can leave a tiny negative residue.
      atoms[k] = Math.max(0.0, prefactor * sum);
    }
    return atoms;
  }

  /**
   * Compute the activity (Bq) of every member at time {@code t}, starting from {@code initialActivity} Bq of the
   * first member.
   */
  public double[] activities(double[] decayConstants, double[] branching, double initialActivity, double t) {
    if (decayConstants.length == 0) {
      return new double[0];
    }
    double[] lambdas = separate(decayConstants);
    double[] atoms = atoms(decayConstants, branching, initialActivity / decayConstants[0], t);
    double[] activities = new double[atoms.length];
    for (int k = 0; k < atoms.length; k++) {
      activities[k] = lambdas[k] * atoms[k];
    }
    return activities;
  }

  /**
   * Return a copy of {@code decayConstants} in which every constant within {@link #DEGENERACY_TOLERANCE} (relative)
   * of an earlier one is raised by that tolerance times the number of such earlier constants.
   */
  static double[] separate(double[] decayConstants) {
    double[] separated = Arrays.copyOf(decayConstants, decayConstants.length);
    for (int i = 1; i < decayConstants.length; i++) {
      int nearEqual = 0;
      for (int j = 0; j < i; j++) {
        double scale = Math.max(Math.abs(decayConstants[i]), Math.abs(decayConstants[j]));
        if (Math.abs(decayConstants[i] - decayConstants[j]) <= DEGENERACY_TOLERANCE * scale) {
          nearEqual++;
        }
      }
      if (nearEqual > 0) {
        separated[i] = decayConstants[i] * (1.0 + nearEqual * DEGENERACY_TOLERANCE);
      }
    }
    return separated;
  }
}
