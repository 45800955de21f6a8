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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Subtracts a measured background spectrum, scaled (usually by the ratio of live times), from a source spectrum.
 */
public class BackgroundSubtractor {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BackgroundSubtractor.class);

  private final double scalingFactor;

  public BackgroundSubtractor(double scalingFactor) {
    if (!(scalingFactor >= 0.0) || Double.isInfinite(scalingFactor)) {
      throw new IllegalArgumentException(String.format(
          "Background scaling factor must be finite and non-negative, got %f", scalingFactor));
    }
    this.scalingFactor = scalingFactor;
  }

  /**
   * Build a subtractor that normalizes a background acquired over {@code backgroundLiveTime} seconds to a source
   * acquired over {@code sourceLiveTime} seconds.
   */
  public static BackgroundSubtractor forLiveTimes(double sourceLiveTime, double backgroundLiveTime) {
    if (backgroundLiveTime <= 0.0) {
      throw new IllegalArgumentException(String.format(
          "Background live time must be positive, got %f s", backgroundLiveTime));
    }
    return new BackgroundSubtractor(sourceLiveTime / backgroundLiveTime);
  }

  public double getScalingFactor() {
    return scalingFactor;
  }

  /**
   * Subtract {@code backgroundCounts} times the scaling factor from {@code sourceCounts}.  When the two differ in
   * length, both are trimmed to the shorter one.
   */
  public BackgroundEstimate subtract(double[] sourceCounts, double[] backgroundCounts) {
    int length = Math.min(sourceCounts.length, backgroundCounts.length);
    if (sourceCounts.length != backgroundCounts.length) {
      LOGGER.warn("Source has %d channels and background %d, trimming both to %d",
          sourceCounts.length, backgroundCounts.length, length);
    }

    double[] gross = Arrays.copyOf(sourceCounts, length);
    double[] background = new double[length];
    for (int i = 0; i < length; i++) {
      background[i] = backgroundCounts[i] * scalingFactor;
    }
    return new BackgroundEstimate(gross, background, BackgroundEstimate.Algorithm.SUBTRACTION, null);
  }
}
