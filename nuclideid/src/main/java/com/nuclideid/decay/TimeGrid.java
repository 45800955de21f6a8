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
 * The time points, in seconds from t = 0, at which a prediction is evaluated.
 */
public class TimeGrid {
  public static final double SECONDS_PER_DAY = 86400.0;
  // First non-zero point of a logarithmic grid, as a fraction of its duration.
  public static final double LOG_GRID_START_FRACTION = 1e-6;

  private final double[] points;

  private TimeGrid(double[] points) {
    this.points = points;
  }

  /**
   * {@code steps} evenly spaced points from 0 to {@code durationSeconds} inclusive.
   */
  public static TimeGrid linear(double durationSeconds, int steps) {
    checkArguments(durationSeconds, steps);
    double[] points = new double[steps];
    for (int i = 0; i < steps; i++) {
      points[i] = durationSeconds * i / (steps - 1);
    }
    // Pin the end point against rounding.
    points[steps - 1] = durationSeconds;
    return new TimeGrid(points);
  }

  /**
   * t = 0 followed by {@code steps - 1} geometrically spaced points from {@code durationSeconds * 1e-6} to
   * {@code durationSeconds}, which resolves short-lived daughters growing in under a long-lived parent.
   */
  public static TimeGrid logarithmic(double durationSeconds, int steps) {
    checkArguments(durationSeconds, steps);
    double[] points = new double[steps];
    points[0] = 0.0;
    int geometric = steps - 1;
    if (geometric == 1) {
      points[1] = durationSeconds;
      return new TimeGrid(points);
    }
    double logStart = Math.log10(durationSeconds * LOG_GRID_START_FRACTION);
    double logEnd = Math.log10(durationSeconds);
    for (int i = 0; i < geometric; i++) {
      points[i + 1] = Math.pow(10.0, logStart + (logEnd - logStart) * i / (geometric - 1));
    }
    points[steps - 1] = durationSeconds;
    return new TimeGrid(points);
  }

  public static TimeGrid of(double... pointsSeconds) {
    double previous = -1.0;
    for (double t : pointsSeconds) {
      if (!(t >= 0.0) || Double.isInfinite(t) || t <= previous) {
        throw new IllegalArgumentException(String.format(
            "Time points must be finite, non-negative and strictly increasing: %s", Arrays.toString(pointsSeconds)));
      }
      previous = t;
    }
    return new TimeGrid(Arrays.copyOf(pointsSeconds, pointsSeconds.length));
  }

  private static void checkArguments(double durationSeconds, int steps) {
    if (!(durationSeconds > 0.0) || Double.isInfinite(durationSeconds)) {
      throw new IllegalArgumentException(String.format("Duration must be positive and finite, got %s s",
          durationSeconds));
    }
    if (steps < 2) {
      throw new IllegalArgumentException(String.format("A time grid needs at least 2 points, got %d", steps));
    }
  }

  public double[] getPoints() {
    return Arrays.copyOf(points, points.length);
  }

  public double get(int index) {
    return points[index];
  }

  public int size() {
    return points.length;
  }
}
