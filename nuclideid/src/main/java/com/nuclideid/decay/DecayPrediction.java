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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nuclideid.isotopes.Nuclide;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Activity curves for every member of a decay sequence.
 */
public class DecayPrediction {
  public enum Status {
    OK,
    DEGRADED, // At least one member lacked a half-life and was evolved on its own.
    UNKNOWN_ISOTOPE, // Nothing is known about the starting nuclide; there are no curves.
    ;
  }

  @JsonProperty("start")
  private final Nuclide start;

  @JsonProperty("status")
  private final Status status;

  @JsonProperty("time_points_s")
  private final double[] timePointsSeconds;

  @JsonProperty("series")
  private final List<ActivityTimeSeries> series;

  public DecayPrediction(Nuclide start, Status status, double[] timePointsSeconds, List<ActivityTimeSeries> series) {
    this.start = start;
    this.status = status;
    this.timePointsSeconds = timePointsSeconds;
    this.series = Collections.unmodifiableList(series);
  }

  public static DecayPrediction unknown(Nuclide start, double[] timePointsSeconds) {
    return new DecayPrediction(start, Status.UNKNOWN_ISOTOPE, timePointsSeconds, Collections.emptyList());
  }

  public Nuclide getStart() {
    return start;
  }

  public Status getStatus() {
    return status;
  }

  public double[] getTimePointsSeconds() {
    return timePointsSeconds.clone();
  }

  public List<ActivityTimeSeries> getSeries() {
    return series;
  }

  public Optional<ActivityTimeSeries> getSeries(Nuclide isotope) {
    return series.stream().filter(s -> s.getIsotope().equals(isotope)).findFirst();
  }

  @JsonIgnore
  public boolean isEmpty() {
    return series.isEmpty();
  }

  /**
   * @return The summed activity of all members at time point {@code index}.
   */
  public double getTotalActivity(int index) {
    double total = 0.0;
    for (ActivityTimeSeries s : series) {
      total += s.getActivity(index);
    }
    return total;
  }
}
