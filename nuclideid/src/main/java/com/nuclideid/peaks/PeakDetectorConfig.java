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

package com.nuclideid.peaks;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tuning for {@link PeakDetector}.  The factors are fractions of the spectrum's maximum count, so thresholds scale
 * with the spectrum instead of being fixed counts.
 */
public class PeakDetectorConfig {
  public static final double DEFAULT_PROMINENCE_FACTOR = 0.01;
  public static final double DEFAULT_HEIGHT_FACTOR = 0.003;
  public static final int DEFAULT_DISTANCE = 10;
  public static final double DEFAULT_MIN_HEIGHT = 5.0;
  public static final int DEFAULT_MAX_PEAKS = 20;

  @JsonProperty("prominence_factor")
  private double prominenceFactor = DEFAULT_PROMINENCE_FACTOR;

  @JsonProperty("height_factor")
  private double heightFactor = DEFAULT_HEIGHT_FACTOR;

  // Minimum separation, in channels, between accepted peaks
  @JsonProperty("distance")
  private int distance = DEFAULT_DISTANCE;

  // Absolute floor under the relative height threshold
  @JsonProperty("min_height")
  private double minHeight = DEFAULT_MIN_HEIGHT;

  @JsonProperty("max_peaks")
  private int maxPeaks = DEFAULT_MAX_PEAKS;

  public PeakDetectorConfig() {

  }

  public PeakDetectorConfig(double prominenceFactor, int distance, double heightFactor) {
    this.prominenceFactor = prominenceFactor;
    this.distance = distance;
    this.heightFactor = heightFactor;
    validate();
  }

  public void validate() {
    if (prominenceFactor < 0.0 || heightFactor < 0.0) {
      throw new IllegalArgumentException(String.format(
          "Peak threshold factors must be non-negative (prominence %f, height %f)", prominenceFactor, heightFactor));
    }
    if (distance < 1) {
      throw new IllegalArgumentException(String.format("Peak distance must be at least 1 channel, got %d", distance));
    }
    if (maxPeaks < 1) {
      throw new IllegalArgumentException(String.format("Peak cap must be at least 1, got %d", maxPeaks));
    }
  }

  public double getProminenceFactor() {
    return prominenceFactor;
  }

  public double getHeightFactor() {
    return heightFactor;
  }

  public int getDistance() {
    return distance;
  }

  public double getMinHeight() {
    return minHeight;
  }

  public int getMaxPeaks() {
    return maxPeaks;
  }

  public PeakDetectorConfig copy() {
    PeakDetectorConfig copy = new PeakDetectorConfig();
    copy.prominenceFactor = prominenceFactor;
    copy.heightFactor = heightFactor;
    copy.distance = distance;
    copy.minHeight = minHeight;
    copy.maxPeaks = maxPeaks;
    return copy;
  }
}
