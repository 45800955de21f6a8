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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nuclideid.isotopes.Nuclide;

import java.util.Arrays;

/**
 * Activity of one chain member over a time grid.  A degraded series was evolved as a lone exponential because the
 * member, or a member above it, has no known half-life.
 */
public class ActivityTimeSeries {
  @JsonProperty("isotope")
  private final Nuclide isotope;

  @JsonProperty("time_points_s")
  private final double[] timePointsSeconds;

  @JsonProperty("activities_bq")
  private final double[] activitiesBq;

  @JsonProperty("degraded")
  private final boolean degraded;

  public ActivityTimeSeries(Nuclide isotope, double[] timePointsSeconds, double[] activitiesBq, boolean degraded) {
    if (timePointsSeconds.length != activitiesBq.length) {
      throw new IllegalArgumentException(String.format("%s has %d time points but %d activities",
          isotope, timePointsSeconds.length, activitiesBq.length));
    }
    this.isotope = isotope;
    this.timePointsSeconds = Arrays.copyOf(timePointsSeconds, timePointsSeconds.length);
    this.activitiesBq = Arrays.copyOf(activitiesBq, activitiesBq.length);
    this.degraded = degraded;
  }

  public Nuclide getIsotope() {
    return isotope;
  }

  public double[] getTimePointsSeconds() {
    return Arrays.copyOf(timePointsSeconds, timePointsSeconds.length);
  }

  public double[] getActivitiesBq() {
    return Arrays.copyOf(activitiesBq, activitiesBq.length);
  }

  public double getActivity(int index) {
    return activitiesBq[index];
  }

  public int size() {
    return activitiesBq.length;
  }

  public boolean isDegraded() {
    return degraded;
  }
}
