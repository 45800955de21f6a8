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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

/**
 * The result of removing a continuum from a spectrum: the estimated background and the remaining net counts, which
 * are never negative and never exceed the gross counts.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BackgroundEstimate {
  public enum Algorithm {
    SNIP,
    SUBTRACTION,
  }

  @JsonProperty("net_counts")
  private final double[] netCounts;

  @JsonProperty("background")
  private final double[] background;

  @JsonProperty("gross_counts")
  private final double[] grossCounts;

  @JsonProperty("algorithm")
  private final Algorithm algorithm;

  // Only set for SNIP estimates
  @JsonProperty("iterations")
  private final Integer iterations;

  BackgroundEstimate(double[] grossCounts, double[] background, Algorithm algorithm, Integer iterations) {
    if (grossCounts.length != background.length) {
      throw new IllegalArgumentException(String.format(
          "Gross and background arrays differ in length: %d vs %d", grossCounts.length, background.length));
    }
    this.grossCounts = grossCounts;
    this.background = background;
    this.algorithm = algorithm;
    this.iterations = iterations;

    this.netCounts = new double[grossCounts.length];
    for (int i = 0; i < grossCounts.length; i++) {
      netCounts[i] = Math.max(grossCounts[i] - background[i], 0.0);
    }
  }

  public double[] getNetCounts() {
    return Arrays.copyOf(netCounts, netCounts.length);
  }

  public double[] getBackground() {
    return Arrays.copyOf(background, background.length);
  }

  public double[] getGrossCounts() {
    return Arrays.copyOf(grossCounts, grossCounts.length);
  }

  public Algorithm getAlgorithm() {
    return algorithm;
  }

  public Integer getIterations() {
    return iterations;
  }

  public int size() {
    return netCounts.length;
  }
}
