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

package com.nuclideid.roi;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Everything one ROI run produced.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoiReport {
  @JsonProperty("detector")
  private final String detector;

  @JsonProperty("live_time_s")
  private final double liveTimeSeconds;

  @JsonProperty("regions")
  private final List<RoiResult> regions;

  @JsonProperty("uranium_enrichment")
  private final UraniumEnrichment uraniumEnrichment;

  @JsonProperty("projection_days")
  private final Double projectionDays;

  // Region name to the activity (Bq) of every chain member after projection_days.
  @JsonProperty("projected_activities_bq")
  private final Map<String, Map<String, Double>> projectedActivities;

  public RoiReport(String detector, double liveTimeSeconds, List<RoiResult> regions,
                   UraniumEnrichment uraniumEnrichment, Double projectionDays,
                   Map<String, Map<String, Double>> projectedActivities) {
    this.detector = detector;
    this.liveTimeSeconds = liveTimeSeconds;
    this.regions = Collections.unmodifiableList(regions);
    this.uraniumEnrichment = uraniumEnrichment;
    this.projectionDays = projectionDays;
    this.projectedActivities = projectedActivities == null ? null : Collections.unmodifiableMap(projectedActivities);
  }

  public String getDetector() {
    return detector;
  }

  public double getLiveTimeSeconds() {
    return liveTimeSeconds;
  }

  public List<RoiResult> getRegions() {
    return regions;
  }

  public UraniumEnrichment getUraniumEnrichment() {
    return uraniumEnrichment;
  }

  public Double getProjectionDays() {
    return projectionDays;
  }

  public Map<String, Map<String, Double>> getProjectedActivities() {
    return projectedActivities;
  }
}
