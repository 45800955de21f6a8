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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nuclideid.decay.DecayDataTable;
import com.nuclideid.decay.DecayPredictor;
import com.nuclideid.spectrum.SpectrumDocument;
import com.nuclideid.spectrum.SyntheticSpectra;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RoiAnalysisRunnerTest {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  // Cs-137 half-life in days.
  private static final double CS137_HALF_LIFE_DAYS = 952093000.0 / 86400.0;

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();

  private static RoiResult withActivity(RoiDefinition region, Double activityBq) {
    return new RoiResult(region, "test", 100.0, 0.0, 0.0, 0.0, 0.0, 0.04, activityBq, null, null, 0.0, null);
  }

  @Test
  public void testProjectionFollowsTheDecayChain() throws Exception {
    RoiLibrary library = RoiLibrary.loadBundled();
    RoiDefinition cs137 = library.getRegion("Cs-137 (662 keV)").get();
    RoiDefinition co60 = library.getRegion("Co-60 (1173 keV)").get();
    DecayPredictor predictor = new DecayPredictor(DecayDataTable.loadBundled());

    Map<String, Map<String, Double>> projections = RoiAnalysisRunner.project(predictor,
        Arrays.asList(withActivity(cs137, 1000.0), withActivity(co60, null)), CS137_HALF_LIFE_DAYS);

    assertEquals("Regions without an activity are not projected", Collections.singleton(cs137.getName()),
        projections.keySet());
    Map<String, Double> chain = projections.get(cs137.getName());
    assertEquals("One half-life halves the parent", 500.0, chain.get("Cs-137"), 1e-6);
    assertEquals("Ba-137m is in equilibrium with its 94.6% branch", 0.946 * 500.0, chain.get("Ba-137m"), 0.01);
  }

  @Test
  public void testWritesQuantifiedRegions() throws Exception {
    int[] counts = SyntheticSpectra.addLine(SyntheticSpectra.flat(SyntheticSpectra.CHANNELS, 5), 661.7, 1000.0);
    File input = temp.newFile("spectrum.json");
    OBJECT_MAPPER.writeValue(input, new SpectrumDocument(counts, SyntheticSpectra.THREE_KEV_PER_CHANNEL, 300.0,
        "synthetic"));

    File output = new File(temp.getRoot(), "roi.json");
    RoiAnalysisRunner.main(new String[]{
        "-i", input.getPath(), "-o", output.getPath(), "-r", "Cs-137 (662 keV), Co-60 (1332 keV)",
        "-e", "-P", "30"});

    JsonNode tree = OBJECT_MAPPER.readTree(output);
    assertEquals(RoiLibrary.DEFAULT_DETECTOR, tree.get("detector").asText());
    assertEquals(300.0, tree.get("live_time_s").asDouble(), 0.0);

    JsonNode regions = tree.get("regions");
    assertEquals(2, regions.size());
    JsonNode cs137 = regions.get(0);
    assertEquals("Cs-137 (662 keV)", cs137.get("region").asText());
    assertEquals("Cs-137", cs137.get("nuclide").asText());
    assertTrue("The line stands above the continuum", cs137.get("net_counts").asDouble() > 4000.0);
    assertTrue(cs137.get("activity_bq").asDouble() > 0.0);
    assertEquals(cs137.get("activity_bq").asDouble() / RoiAnalyzer.BQ_PER_MICROCURIE,
        cs137.get("activity_uci").asDouble(), 1e-12);
    assertEquals(2, cs137.get("roi_window").size());

    JsonNode co60 = regions.get(1);
    assertEquals("Flat continuum leaves nothing in the Co-60 window", 0.0, co60.get("net_counts").asDouble(), 0.0);

    JsonNode enrichment = tree.get("uranium_enrichment");
    assertEquals("INDETERMINATE", enrichment.get("category").asText());
    assertFalse(enrichment.has("ratio_percent"));

    assertEquals(30.0, tree.get("projection_days").asDouble(), 0.0);
    JsonNode projected = tree.get("projected_activities_bq").get("Cs-137 (662 keV)");
    double decayed = projected.get("Cs-137").asDouble();
    assertTrue(decayed < cs137.get("activity_bq").asDouble());
    assertEquals(cs137.get("activity_bq").asDouble() * Math.pow(0.5, 30.0 / CS137_HALF_LIFE_DAYS), decayed, 1e-6);
    assertTrue(projected.has("Ba-137m"));
  }
}
