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

import com.nuclideid.background.BackgroundEstimate;
import com.nuclideid.chains.ChainCandidate;
import com.nuclideid.chains.ChainConfidenceLevel;
import com.nuclideid.chains.DecaySeries;
import com.nuclideid.chains.EquilibriumStatus;
import com.nuclideid.isotopes.IdentificationCandidate;
import com.nuclideid.isotopes.IsotopeRegistry;
import com.nuclideid.isotopes.Nuclide;
import com.nuclideid.isotopes.SuppressionContext;
import com.nuclideid.peaks.FittedPeak;
import com.nuclideid.spectrum.Spectrum;
import com.nuclideid.spectrum.SyntheticSpectra;
import org.junit.BeforeClass;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class SpectrumAnalyzerTest {
  private static final double[] URANIUM_ORE_LINES = {186.2, 241.0, 295.2, 351.9, 609.3, 1120.3, 1764.5};

  private static IsotopeRegistry registry;

  @BeforeClass
  public static void loadRegistry() throws Exception {
    registry = IsotopeRegistry.loadBundled();
  }

  private static Spectrum linesOnFlatBackground(double... energies) throws Exception {
    int[] counts = SyntheticSpectra.flat(SyntheticSpectra.CHANNELS, 5);
    for (double energy : energies) {
      SyntheticSpectra.addLine(counts, energy, 1000.0);
    }
    return SyntheticSpectra.spectrum(counts);
  }

  private static IdentificationCandidate find(List<IdentificationCandidate> candidates, String name) {
    for (IdentificationCandidate candidate : candidates) {
      if (candidate.getIsotope().equals(Nuclide.of(name))) {
        return candidate;
      }
    }
    return null;
  }

  private static List<String> names(List<IdentificationCandidate> candidates) {
    List<String> names = new ArrayList<>();
    for (IdentificationCandidate candidate : candidates) {
      names.add(candidate.getIsotope().getName());
    }
    return names;
  }

  @Test
  public void testCesiumSourceInStrictMode() throws Exception {
    AnalysisReport report = new SpectrumAnalyzer(registry, AnalysisMode.STRICT)
        .analyze(linesOnFlatBackground(661.7));

    assertEquals(AnalysisMode.STRICT, report.getMode());
    assertEquals(AnalysisProfile.DEFAULT_VERSION, report.getProfileVersion());
    assertEquals(1, report.getPeaks().size());
    assertEquals(663.0, report.getPeaks().get(0).getEnergyKeV(), 1e-9);

    assertEquals(Collections.singletonList("Cs-137"), names(report.getIdentificationCandidates()));
    IdentificationCandidate cs = report.getIdentificationCandidates().get(0);
    assertEquals("One line never scores above 60", 60.0, cs.getConfidence(), 1e-9);
    assertEquals(1, cs.getMatchedLines());

    assertTrue(report.getChainCandidates().isEmpty());
    assertTrue(report.getConfirmedSeries().isEmpty());
    assertNull("No background step was requested", report.getBackground());
    assertNull(report.getFittedPeaks());
  }

  @Test
  public void testUraniumOreSuppressesArtificialSources() throws Exception {
    double[] energies = Arrays.copyOf(URANIUM_ORE_LINES, URANIUM_ORE_LINES.length + 1);
    energies[URANIUM_ORE_LINES.length] = 661.7;
    AnalysisReport report = new SpectrumAnalyzer(registry, AnalysisMode.STRICT)
        .analyze(linesOnFlatBackground(energies));

    assertEquals(8, report.getPeaks().size());

    ChainCandidate u238 = report.getChainCandidates().get(0);
    assertEquals(DecaySeries.U238, u238.getSeries());
    assertEquals(ChainConfidenceLevel.MEDIUM, u238.getConfidenceLevel());
    assertEquals(0.52, u238.getWeightedConfidence(), 1e-9);
    assertEquals(EquilibriumStatus.IN_EQUILIBRIUM, u238.getEquilibrium());
    for (ChainCandidate chain : report.getChainCandidates().subList(1, report.getChainCandidates().size())) {
      assertEquals(String.format("%s is not confirmed", chain.getSeries()),
          ChainConfidenceLevel.LOW, chain.getConfidenceLevel());
    }
    assertEquals(Collections.singleton(DecaySeries.U238), report.getConfirmedSeries());

    assertEquals("Strict mode keeps the top five",
        Arrays.asList("Bi-214", "Pb-214", "Pb-212", "Ra-226", "Ba-133"), names(report.getIdentificationCandidates()));

    IdentificationCandidate cs = find(report.getRawCandidates(), "Cs-137");
    assertTrue(cs.isSuppressed());
    assertEquals(SuppressionContext.REASON_NATURAL_SERIES, cs.getSuppressionReason());
    assertEquals(30.0, cs.getConfidence(), 1e-9);
    assertEquals(60.0, cs.getRawConfidence(), 1e-9);

    assertEquals(35.0, find(report.getIdentificationCandidates(), "Ba-133").getConfidence(), 1e-9);
    assertFalse(find(report.getIdentificationCandidates(), "Bi-214").isSuppressed());
    assertFalse(find(report.getIdentificationCandidates(), "Ra-226").isSuppressed());
    assertTrue("Thorium series members are suppressed too",
        find(report.getIdentificationCandidates(), "Pb-212").isSuppressed());
  }

  @Test
  public void testRobustModeHasNoCap() throws Exception {
    double[] energies = Arrays.copyOf(URANIUM_ORE_LINES, URANIUM_ORE_LINES.length + 1);
    energies[URANIUM_ORE_LINES.length] = 661.7;
    AnalysisReport report = new SpectrumAnalyzer(registry, AnalysisMode.ROBUST)
        .analyze(linesOnFlatBackground(energies));

    assertEquals(AnalysisMode.ROBUST, report.getMode());
    assertTrue(report.getIdentificationCandidates().size() > 5);
    for (IdentificationCandidate candidate : report.getIdentificationCandidates()) {
      assertTrue(candidate.getConfidence() >= 20.0);
    }
  }

  @Test
  public void testEmptySpectrum() throws Exception {
    AnalysisReport report = new SpectrumAnalyzer(registry, AnalysisMode.STRICT)
        .analyze(SyntheticSpectra.spectrum(new int[SyntheticSpectra.CHANNELS]));
    assertTrue(report.getPeaks().isEmpty());
    assertTrue(report.getIdentificationCandidates().isEmpty());
    assertTrue(report.getRawCandidates().isEmpty());
    assertTrue(report.getChainCandidates().isEmpty());
  }

  @Test
  public void testSnipContinuumRemoval() throws Exception {
    AnalysisProfile profile = AnalysisMode.STRICT.defaultProfile();
    profile.setSubtractBackground(true);
    AnalysisReport report = new SpectrumAnalyzer(registry, profile).analyze(linesOnFlatBackground(661.7));

    BackgroundEstimate background = report.getBackground();
    assertNotNull(background);
    assertEquals(BackgroundEstimate.Algorithm.SNIP, background.getAlgorithm());
    assertEquals(SyntheticSpectra.CHANNELS, background.size());
    assertEquals("Cs-137", report.getIdentificationCandidates().get(0).getIsotope().getName());
    assertTrue("Peak height is measured above the continuum", report.getPeaks().get(0).getCounts() < 1005.0);
  }

  @Test
  public void testMeasuredBackgroundSubtraction() throws Exception {
    Spectrum measured = SyntheticSpectra.spectrum(SyntheticSpectra.flat(SyntheticSpectra.CHANNELS, 10));
    AnalysisReport report = new SpectrumAnalyzer(registry, AnalysisMode.STRICT)
        .analyze(linesOnFlatBackground(661.7), measured, 0.5);

    assertEquals(BackgroundEstimate.Algorithm.SUBTRACTION, report.getBackground().getAlgorithm());
    assertEquals(1000.0, report.getPeaks().get(0).getCounts(), 1e-9);
    assertEquals("Cs-137", report.getIdentificationCandidates().get(0).getIsotope().getName());
  }

  @Test
  public void testPeakFitting() throws Exception {
    AnalysisProfile profile = AnalysisMode.STRICT.defaultProfile();
    profile.setFitPeaks(true);
    AnalysisReport report = new SpectrumAnalyzer(registry, profile).analyze(linesOnFlatBackground(661.7));

    List<FittedPeak> fitted = report.getFittedPeaks();
    assertEquals(1, fitted.size());
    assertEquals(663.0, fitted.get(0).getCentroidKeV(), 0.5);
  }

  @Test
  public void testAnalyzerKeepsItsOwnCopyOfTheProfile() {
    AnalysisProfile profile = AnalysisMode.STRICT.defaultProfile();
    SpectrumAnalyzer analyzer = new SpectrumAnalyzer(registry, profile);
    profile.setFitPeaks(true);
    assertFalse(analyzer.getProfile().isFitPeaks());
  }
}
