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

package com.nuclideid.background;

import com.nuclideid.spectrum.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Estimates the slowly varying continuum under a gamma spectrum with the SNIP (Sensitive Nonlinear Iterative Peak)
 * clipping algorithm of Ryan et al., Nucl. Instr. Meth. B34 (1988) 396.
 *
 * Counts are first compressed with the log-log-square-root transform v = ln(ln(sqrt(c + 1) + 1) + 1).  Each clipping
 * pass with half-width p then replaces v[i] by the mean of v[i - p] and v[i + p] wherever that mean is lower, for
 * every i in [p, n - p).  Narrow peaks are eroded pass by pass while a locally linear continuum survives.  The
 * clipped curve is mapped back with the inverse transform and clamped at zero.
 *
 * Too few iterations leave peak residue in the background; too many erode broad real features.
 */
public class SnipBackgroundEstimator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SnipBackgroundEstimator.class);

  public static final int DEFAULT_ITERATIONS = 24;

  public enum ClippingOrder {
    // p = 1, 2, ..., iterations
    INCREASING,
    // p = iterations, ..., 2, 1
    DECREASING,
  }

  private final int iterations;
  private final ClippingOrder order;

  public SnipBackgroundEstimator(int iterations, ClippingOrder order) {
    if (iterations < 0) {
      throw new IllegalArgumentException(String.format("SNIP iterations must be non-negative, got %d", iterations));
    }
    if (order == null) {
      throw new IllegalArgumentException("SNIP clipping order must be specified");
    }
    this.iterations = iterations;
    this.order = order;
  }

  public SnipBackgroundEstimator(int iterations) {
    this(iterations, ClippingOrder.INCREASING);
  }

  public SnipBackgroundEstimator() {
    this(DEFAULT_ITERATIONS);
  }

  public int getIterations() {
    return iterations;
  }

  public ClippingOrder getOrder() {
    return order;
  }

  public BackgroundEstimate estimate(Spectrum spectrum) {
    return estimate(spectrum.getCountsAsDoubles());
  }

  public BackgroundEstimate estimate(double[] counts) {
    double[] gross = counts.clone();
    double[] background = background(gross);
    LOGGER.debug("SNIP background over %d channels with %d %s passes", gross.length, iterations, order);
    return new BackgroundEstimate(gross, background, BackgroundEstimate.Algorithm.SNIP, iterations);
  }

  /**
   * Compute the clamped background curve alone.
   */
  public double[] background(double[] counts) {
    int n = counts.length;
    double[] v = new double[n];
    for (int i = 0; i < n; i++) {
      v[i] = compress(counts[i]);
    }

    for (int pass = 1; pass <= iterations; pass++) {
      int p = order == ClippingOrder.INCREASING ? pass : iterations - pass + 1;
      // Updates are in place, so later channels in a pass see already-clipped neighbours.
      for (int i = p; i < n - p; i++) {
        double mean = 0.5 * (v[i - p] + v[i + p]);
        if (v[i] > mean) {
          v[i] = mean;
        }
      }
    }

    double[] background = new double[n];
    for (int i = 0; i < n; i++) {
      background[i] = Math.max(expand(v[i]), 0.0);
    }
    return background;
  }

  static double compress(double count) {
    return Math.log(Math.log(Math.sqrt(count + 1.0) + 1.0) + 1.0);
  }

  static double expand(double value) {
    double root = Math.exp(Math.exp(value) - 1.0) - 1.0;
    return root * root - 1.0;
  }
}
