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

package com.nuclideid.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nuclideid.spectrum.EnergyCalibration;
import com.nuclideid.spectrum.SpectrumDocument;
import com.nuclideid.spectrum.SyntheticSpectra;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.FileWriter;
import java.io.Writer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SpectrumAnalysisRunnerTest {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();

  private static SpectrumDocument document(Double liveTime) {
    return new SpectrumDocument(new int[]{1, 2, 3}, new EnergyCalibration(3.0, 0.0), liveTime, null);
  }

  @Test
  public void testScalingFactorIsTheLiveTimeRatio() {
    assertEquals(0.5, SpectrumAnalysisRunner.scalingFactor(document(300.0), document(600.0)), 1e-12);
  }

  @Test
  public void testScalingFactorWithoutLiveTimes() {
    assertEquals(1.0, SpectrumAnalysisRunner.scalingFactor(document(null), document(600.0)), 0.0);
    assertEquals(1.0, SpectrumAnalysisRunner.scalingFactor(document(300.0), document(0.0)), 0.0);
  }

  @Test
  public void testFixtureParses() throws Exception {
    SpectrumDocument document = SpectrumDocument.read(
        new File(getClass().getResource("cs137_spectrum.json").toURI()));
    assertEquals(64, document.getCounts().length);
    assertEquals(300.0, document.getLiveTimeSeconds(), 0.0);
  }

  @Test
  public void testWritesReportAndFusedScores() throws Exception {
    int[] counts = SyntheticSpectra.addLine(SyntheticSpectra.flat(SyntheticSpectra.CHANNELS, 5), 661.7, 1000.0);
    File input = temp.newFile("spectrum.json");
    OBJECT_MAPPER.writeValue(input, new SpectrumDocument(counts, SyntheticSpectra.THREE_KEV_PER_CHANNEL, 300.0,
        "synthetic"));

    File scores = temp.newFile("scores.json");
    try (Writer writer = new FileWriter(scores)) {
      writer.write("[{\"isotope\": \"Cs-137\", \"confidence\": 90.0}]");
    }

    File report = new File(temp.getRoot(), "report.json");
    File fused = new File(temp.getRoot(), "fused.json");
    SpectrumAnalysisRunner.main(new String[]{
        "-i", input.getPath(), "-o", report.getPath(), "-m", "strict",
        "-x", scores.getPath(), "-F", fused.getPath()});

    JsonNode tree = OBJECT_MAPPER.readTree(report);
    assertEquals("STRICT", tree.get("mode").asText());
    JsonNode candidates = tree.get("identification_candidates");
    assertEquals(1, candidates.size());
    assertEquals("Cs-137", candidates.get(0).get("isotope").asText());
    assertEquals(60.0, candidates.get(0).get("confidence").asDouble(), 1e-9);
    assertFalse("Fits were not requested", tree.has("fitted_peaks"));
    assertTrue(tree.get("chain_candidates").isArray());

    JsonNode fusedTree = OBJECT_MAPPER.readTree(fused);
    assertEquals("Cs-137", fusedTree.get(0).get("isotope").asText());
    assertEquals(0.6 * 60.0 + 0.4 * 90.0, fusedTree.get(0).get("confidence").asDouble(), 1e-9);
  }
}
