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

import com.nuclideid.spectrum.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Quantifies gamma lines by region-of-interest integration:
 * <ul>
 *   <li>net counts = gross counts in the window - side band counts scaled to the window's width, floored at 0</li>
 *   <li>activity (Bq) = net counts / (efficiency * live time * branching ratio)</li>
 *   <li>minimum detectable activity from Currie's detection limit, L_D = 2.71 + 4.65 * sqrt(background)</li>
 * </ul>
 * Activities derived here are what the decay predictor is usually seeded with.
 */
public class RoiAnalyzer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RoiAnalyzer.class);

  public static final double BQ_PER_MICROCURIE = 37000.0;
  // Currie (1968) at 95% confidence.
  public static final double CURRIE_CONSTANT_COUNTS = 2.71;
  public static final double CURRIE_SQRT_COEFFICIENT = 4.65;

  public static final String U235_REGION = "U-235 (186 keV)";
  public static final String TH234_REGION = "Th-234 (93 keV)";

  private final DetectorEfficiency detector;

  public RoiAnalyzer(DetectorEfficiency detector) {
    this.detector = detector;
  }

  public DetectorEfficiency getDetector() {
    return detector;
  }

  public RoiResult analyze(Spectrum spectrum, RoiDefinition region, double liveTimeSeconds) {
    return analyze(spectrum.getEnergies(), spectrum.getCountsAsDoubles(), region, liveTimeSeconds);
  }

  /**
   * Quantify one region.
   * @param energies Energy (keV) of every channel.
   * @param counts Counts of every channel.
   * @param region The line to quantify.
   * @param liveTimeSeconds Acquisition live time; activities are left out unless it is positive.
   */
  public RoiResult analyze(double[] energies, double[] counts, RoiDefinition region, double liveTimeSeconds) {
    if (energies.length != counts.length) {
      throw new IllegalArgumentException(String.format(
          "Energy and count arrays differ in length: %d vs %d", energies.length, counts.length));
    }

    double gross = region.getRoiWindow().sum(energies, counts);
    double background = region.getBackgroundRegion().sum(energies, counts) *
        region.getRoiWindow().getWidthKeV() / region.getBackgroundRegion().getWidthKeV();
    double net = Math.max(0.0, gross - background);
    double sigma = Math.sqrt(gross + background);
    double detectionLimit = CURRIE_CONSTANT_COUNTS + CURRIE_SQRT_COEFFICIENT * Math.sqrt(background);

    double efficiency = detector.efficiencyAt(region.getEnergyKeV());
    Double activity = null, activityUncertainty = null, activityMicroCuries = null, mda = null;
    if (efficiency > 0.0 && liveTimeSeconds > 0.0) {
      double sensitivity = efficiency * liveTimeSeconds * region.getBranchingRatio();
      activity = net / sensitivity;
      activityUncertainty = sigma / sensitivity;
      activityMicroCuries = activity / BQ_PER_MICROCURIE;
      mda = detectionLimit / sensitivity;
    } else {
      LOGGER.warn("Cannot derive an activity for %s: efficiency %.4f at %.1f keV, live time %.1f s",
          region.getName(), efficiency, region.getEnergyKeV(), liveTimeSeconds);
    }

    LOGGER.debug("%s: gross %.1f, background %.1f, net %.1f +/- %.1f counts",
        region.getName(), gross, background, net, sigma);
    return new RoiResult(region, detector.getName(), liveTimeSeconds, gross, background, net, sigma, efficiency,
        activity, activityUncertainty, activityMicroCuries, detectionLimit, mda);
  }

  /**
   * Compare the U-235 186 keV and Th-234 93 keV regions to classify the uranium as depleted, natural or enriched.
   */
  public UraniumEnrichment analyzeEnrichment(double[] energies, double[] counts, RoiDefinition u235,
                                             RoiDefinition th234, double liveTimeSeconds) {
    UraniumEnrichment enrichment = new UraniumEnrichment(
        analyze(energies, counts, u235, liveTimeSeconds), analyze(energies, counts, th234, liveTimeSeconds));
    LOGGER.info("U-235/Th-234 ratio %s%%: %s",
        enrichment.getRatioPercent() == null ? "n/a" : String.format("%.1f", enrichment.getRatioPercent()),
        enrichment.getCategory());
    return enrichment;
  }

  public UraniumEnrichment analyzeEnrichment(Spectrum spectrum, RoiDefinition u235, RoiDefinition th234,
                                             double liveTimeSeconds) {
    return analyzeEnrichment(spectrum.getEnergies(), spectrum.getCountsAsDoubles(), u235, th234, liveTimeSeconds);
  }
}
