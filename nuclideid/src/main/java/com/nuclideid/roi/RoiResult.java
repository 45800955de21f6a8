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
import com.nuclideid.isotopes.Nuclide;

/**
 * Counts, activity and detection limit for one region of interest.  Activities are null when they cannot be
 * derived: no efficiency at the line energy, or no positive live time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoiResult {
  @JsonProperty("region")
  private final String region;

  @JsonProperty("nuclide")
  private final Nuclide nuclide;

  @JsonProperty("energy_kev")
  private final double energyKeV;

  @JsonProperty("roi_window")
  private final EnergyWindow roiWindow;

  @JsonProperty("gross_counts")
  private final double grossCounts;

  @JsonProperty("background_counts")
  private final double backgroundCounts;

  // Gross minus background, never negative.
  @JsonProperty("net_counts")
  private final double netCounts;

  // One sigma counting uncertainty, sqrt(gross + background).
  @JsonProperty("uncertainty_sigma")
  private final double uncertaintySigma;

  @JsonProperty("detector")
  private final String detector;

  @JsonProperty("live_time_s")
  private final double liveTimeSeconds;

  @JsonProperty("efficiency_percent")
  private final double efficiencyPercent;

  @JsonProperty("branching_ratio")
  private final double branchingRatio;

  @JsonProperty("activity_bq")
  private final Double activityBq;

  @JsonProperty("activity_uncertainty_bq")
  private final Double activityUncertaintyBq;

  @JsonProperty("activity_uci")
  private final Double activityMicroCuries;

  // Currie detection limit in counts.
  @JsonProperty("detection_limit_counts")
  private final double detectionLimitCounts;

  @JsonProperty("mda_bq")
  private final Double minimumDetectableActivityBq;

  public RoiResult(RoiDefinition region, String detector, double liveTimeSeconds, double grossCounts,
                   double backgroundCounts, double netCounts, double uncertaintySigma, double efficiency,
                   Double activityBq, Double activityUncertaintyBq, Double activityMicroCuries,
                   double detectionLimitCounts, Double minimumDetectableActivityBq) {
    this.region = region.getName();
    this.nuclide = region.getNuclide();
    this.energyKeV = region.getEnergyKeV();
    this.roiWindow = region.getRoiWindow();
    this.branchingRatio = region.getBranchingRatio();
    this.detector = detector;
    this.liveTimeSeconds = liveTimeSeconds;
    this.grossCounts = grossCounts;
    this.backgroundCounts = backgroundCounts;
    this.netCounts = netCounts;
    this.uncertaintySigma = uncertaintySigma;
    this.efficiencyPercent = efficiency * 100.0;
    this.activityBq = activityBq;
    this.activityUncertaintyBq = activityUncertaintyBq;
    this.activityMicroCuries = activityMicroCuries;
    this.detectionLimitCounts = detectionLimitCounts;
    this.minimumDetectableActivityBq = minimumDetectableActivityBq;
  }

  public String getRegion() {
    return region;
  }

  public Nuclide getNuclide() {
    return nuclide;
  }

  public double getEnergyKeV() {
    return energyKeV;
  }

  public EnergyWindow getRoiWindow() {
    return roiWindow;
  }

  public double getGrossCounts() {
    return grossCounts;
  }

  public double getBackgroundCounts() {
    return backgroundCounts;
  }

  public double getNetCounts() {
    return netCounts;
  }

  public double getUncertaintySigma() {
    return uncertaintySigma;
  }

  public String getDetector() {
    return detector;
  }

  public double getLiveTimeSeconds() {
    return liveTimeSeconds;
  }

  public double getEfficiencyPercent() {
    return efficiencyPercent;
  }

  public double getBranchingRatio() {
    return branchingRatio;
  }

  public Double getActivityBq() {
    return activityBq;
  }

  public Double getActivityUncertaintyBq() {
    return activityUncertaintyBq;
  }

  public Double getActivityMicroCuries() {
    return activityMicroCuries;
  }

  public double getDetectionLimitCounts() {
    return detectionLimitCounts;
  }

  public Double getMinimumDetectableActivityBq() {
    return minimumDetectableActivityBq;
  }

  public boolean hasActivity() {
    return activityBq != null;
  }
}
