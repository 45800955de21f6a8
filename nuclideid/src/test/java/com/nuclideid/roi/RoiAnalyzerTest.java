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

import com.nuclideid.isotopes.Nuclide;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class RoiAnalyzerTest {
  private static final int CHANNELS = 1024;

  private static final RoiDefinition CS137 = new RoiDefinition("Cs-137 (662 keV)", Nuclide.of("Cs-137"), 661.7,
      new EnergyWindow(620.0, 700.0), new EnergyWindow(700.0, 750.0), 0.851);
  private static final RoiDefinition U235 = new RoiDefinition(RoiAnalyzer.U235_REGION, Nuclide.of("U-235"), 185.7,
      new EnergyWindow(165.0, 205.0), new EnergyWindow(210.0, 250.0), 0.572);
  private static final RoiDefinition TH234 = new RoiDefinition(RoiAnalyzer.TH234_REGION, Nuclide.of("Th-234"), 92.6,
      new EnergyWindow(75.0, 110.0), new EnergyWindow(55.0, 75.0), 0.055);

  private static DetectorEfficiency flatDetector(double percent) {
    Map<Double, Double> table = new HashMap<>();
    table.put(20.0, percent);
    table.put(3000.0, percent);
    return new DetectorEfficiency("flat", "CsI(Tl)", null, table);
  }

  // One keV per channel, centred on each half keV.
  private static double[] energies() {
    double[] energies = new double[CHANNELS];
    for (int i = 0; i < CHANNELS; i++) {
      energies[i] = i + 0.5;
    }
    return energies;
  }

  private static double[] addGaussian(double[] counts, double area, double center, double sigma) {
    double[] energies = energies();
    for (int i = 0; i < counts.length; i++) {
      double z = (energies[i] - center) / sigma;
      counts[i] += area / (sigma * Math.sqrt(2.0 * Math.PI)) * Math.exp(-0.5 * z * z);
    }
    return counts;
  }

  private static double[] flat(double level) {
    double[] counts = new double[CHANNELS];
    for (int i = 0; i < CHANNELS; i++) {
      counts[i] = level;
    }
    return counts;
  }

  @Test
  public void testKnownAreaGaussianIsRecovered() {
    double[] counts = addGaussian(flat(10.0), 10000.0, 661.7, 8.0);
    RoiResult result = new RoiAnalyzer(flatDetector(4.0)).analyze(energies(), counts, CS137, 100.0);

    assertEquals("80 channels of continuum plus the full peak", 10799.9908, result.getGrossCounts(), 1e-3);
    assertEquals("50 side band channels scaled by 80/50", 800.0133, result.getBackgroundCounts(), 1e-3);
    assertEquals("Net counts recover the peak area", 10000.0, result.getNetCounts(), 0.05);
    assertEquals(107.7033, result.getUncertaintySigma(), 1e-3);
    assertEquals(134.2330, result.getDetectionLimitCounts(), 1e-3);

    assertTrue(result.hasActivity());
    assertEquals(4.0, result.getEfficiencyPercent(), 1e-12);
    assertEquals(2937.7137, result.getActivityBq(), 1e-3);
    assertEquals(31.6402, result.getActivityUncertaintyBq(), 1e-3);
    assertEquals(0.0793977, result.getActivityMicroCuries(), 1e-6);
    assertEquals(39.4339, result.getMinimumDetectableActivityBq(), 1e-3);
    assertEquals(Nuclide.of("Cs-137"), result.getNuclide());
    assertEquals("flat", result.getDetector());
  }

  @Test
  public void testActivityNeedsLiveTime() {
    double[] counts = addGaussian(flat(10.0), 10000.0, 661.7, 8.0);
    RoiResult result = new RoiAnalyzer(flatDetector(4.0)).analyze(energies(), counts, CS137, 0.0);

    assertEquals(10000.0, result.getNetCounts(), 0.05);
    assertFalse(result.hasActivity());
    assertNull(result.getActivityBq());
    assertNull(result.getActivityMicroCuries());
    assertNull(result.getMinimumDetectableActivityBq());
  }

  @Test
  public void testActivityNeedsEfficiency() {
    RoiAnalyzer analyzer = new RoiAnalyzer(new DetectorEfficiency("custom", null, null, null));
    RoiResult result = analyzer.analyze(energies(), addGaussian(flat(0.0), 500.0, 661.7, 8.0), CS137, 100.0);

    assertEquals(500.0, result.getNetCounts(), 0.05);
    assertNull(result.getActivityBq());
  }

  @Test
  public void testNetCountsAreFlooredAtZero() {
    double[] counts = flat(1.0);
    // A hot side band: 10 counts per keV next to a flat window at 1.
    for (int i = 700; i <= 749; i++) {
      counts[i] = 10.0;
    }
    RoiResult result = new RoiAnalyzer(flatDetector(4.0)).analyze(energies(), counts, CS137, 100.0);

    assertTrue(result.getBackgroundCounts() > result.getGrossCounts());
    assertEquals(0.0, result.getNetCounts(), 0.0);
    assertEquals(0.0, result.getActivityBq(), 0.0);
    assertTrue("A detection limit is still reported", result.getMinimumDetectableActivityBq() > 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMismatchedArraysAreRejected() {
    new RoiAnalyzer(flatDetector(4.0)).analyze(new double[10], new double[11], CS137, 100.0);
  }

  @Test
  public void testNaturalUranium() {
    double[] counts = addGaussian(addGaussian(new double[CHANNELS], 3000.0, 185.7, 3.0), 6000.0, 92.6, 3.0);
    UraniumEnrichment enrichment =
        new RoiAnalyzer(flatDetector(13.0)).analyzeEnrichment(energies(), counts, U235, TH234, 600.0);

    assertEquals(3000.0, enrichment.getU235().getNetCounts(), 1e-3);
    assertEquals(6000.0, enrichment.getTh234().getNetCounts(), 1e-3);
    assertEquals(50.0, enrichment.getRatioPercent(), 1e-4);
    assertEquals(1.11803, enrichment.getRatioUncertaintyPercent(), 1e-4);
    assertEquals(UraniumEnrichment.Category.NATURAL, enrichment.getCategory());
  }

  @Test
  public void testEnrichedUranium() {
    double[] counts = addGaussian(addGaussian(new double[CHANNELS], 6000.0, 185.7, 3.0), 3000.0, 92.6, 3.0);
    UraniumEnrichment enrichment =
        new RoiAnalyzer(flatDetector(13.0)).analyzeEnrichment(energies(), counts, U235, TH234, 600.0);

    assertEquals(200.0, enrichment.getRatioPercent(), 1e-3);
    assertEquals(UraniumEnrichment.Category.ENRICHED, enrichment.getCategory());
  }

  @Test
  public void testEnrichmentWithoutThoriumLineIsIndeterminate() {
    double[] counts = addGaussian(new double[CHANNELS], 3000.0, 185.7, 3.0);
    UraniumEnrichment enrichment =
        new RoiAnalyzer(flatDetector(13.0)).analyzeEnrichment(energies(), counts, U235, TH234, 600.0);

    assertEquals(UraniumEnrichment.Category.INDETERMINATE, enrichment.getCategory());
    assertNull(enrichment.getRatioPercent());
    assertNull(enrichment.getRatioUncertaintyPercent());
  }

  @Test
  public void testCategoryThresholds() {
    assertEquals(UraniumEnrichment.Category.DEPLETED, UraniumEnrichment.Category.forRatio(29.9));
    assertEquals(UraniumEnrichment.Category.NATURAL, UraniumEnrichment.Category.forRatio(30.0));
    assertEquals(UraniumEnrichment.Category.NATURAL, UraniumEnrichment.Category.forRatio(99.9));
    assertEquals(UraniumEnrichment.Category.ENRICHED, UraniumEnrichment.Category.forRatio(100.0));
  }
}
