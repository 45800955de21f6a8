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
import com.nuclideid.background.BackgroundSubtractor;
import com.nuclideid.background.SnipBackgroundEstimator;
import com.nuclideid.chains.ChainCandidate;
import com.nuclideid.chains.DecayChainAnalyzer;
import com.nuclideid.chains.DecaySeries;
import com.nuclideid.isotopes.IdentificationCandidate;
import com.nuclideid.isotopes.IsotopeMatcher;
import com.nuclideid.isotopes.IsotopeRegistry;
import com.nuclideid.isotopes.SuppressionContext;
import com.nuclideid.peaks.FittedPeak;
import com.nuclideid.peaks.GaussianPeakFitter;
import com.nuclideid.peaks.PeakDetector;
import com.nuclideid.peaks.PeakList;
import com.nuclideid.spectrum.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Runs the full identification pipeline over one spectrum.
 *
 * Isotope scoring and chain analysis feed each other, so they run as exactly two matcher passes:
 * <ol>
 *   <li>score every nuclide with no suppression</li>
 *   <li>build decay-series hypotheses from those scores</li>
 *   <li>if a natural series is confirmed, score again with suppression; otherwise keep the first pass</li>
 * </ol>
 * Chain hypotheses are never recomputed from second-pass scores.
 *
 * Instances hold only read-only state and can be shared between threads.
 */
public class SpectrumAnalyzer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumAnalyzer.class);

  private final IsotopeRegistry registry;
  private final AnalysisProfile profile;
  private final IsotopeMatcher matcher;
  private final DecayChainAnalyzer chainAnalyzer;
  private final PeakDetector peakDetector;

  public SpectrumAnalyzer(IsotopeRegistry registry, AnalysisProfile profile) {
    profile.validate();
    this.registry = registry;
    this.profile = profile.copy();
    this.matcher = new IsotopeMatcher(registry, this.profile.getEnergyTolerance(), this.profile.getLibraryTier());
    this.chainAnalyzer = new DecayChainAnalyzer(this.profile.getChainMemberFloor());
    this.peakDetector = new PeakDetector(this.profile.getPeakDetector());
  }

  public SpectrumAnalyzer(IsotopeRegistry registry, AnalysisMode mode) {
    this(registry, mode.defaultProfile());
  }

  public AnalysisProfile getProfile() {
    return profile.copy();
  }

  public IsotopeRegistry getRegistry() {
    return registry;
  }

  /**
   * Analyze a spectrum, estimating its continuum with SNIP when the profile asks for it.
   */
  public AnalysisReport analyze(Spectrum spectrum) {
    BackgroundEstimate background = null;
    if (profile.isSubtractBackground()) {
      background = new SnipBackgroundEstimator(profile.getSnipIterations()).estimate(spectrum);
    }
    return analyze(spectrum, background);
  }

  /**
   * Analyze a spectrum after subtracting a measured background, scaled by {@code scalingFactor}.
   */
  public AnalysisReport analyze(Spectrum spectrum, Spectrum measuredBackground, double scalingFactor) {
    BackgroundEstimate background = new BackgroundSubtractor(scalingFactor).subtract(
        spectrum.getCountsAsDoubles(), measuredBackground.getCountsAsDoubles());
    return analyze(spectrum, background);
  }

  private AnalysisReport analyze(Spectrum spectrum, BackgroundEstimate background) {
    double[] counts = background == null ? spectrum.getCountsAsDoubles() : background.getNetCounts();
    double[] energies = spectrum.getCalibration().energies(counts.length);

    PeakList peaks = peakDetector.detect(energies, counts);
    LOGGER.info("Found %d peaks in a %d channel spectrum", peaks.size(), spectrum.size());

    List<FittedPeak> fitted = null;
    if (profile.isFitPeaks()) {
      fitted = new GaussianPeakFitter().fit(energies, counts, peaks);
    }

    List<IdentificationCandidate> unsuppressed = matcher.score(peaks, SuppressionContext.none());
    List<ChainCandidate> chains = chainAnalyzer.analyze(unsuppressed);

    Set<DecaySeries> confirmed = EnumSet.noneOf(DecaySeries.class);
    for (ChainCandidate chain : chains) {
      if (chain.isConfirmed()) {
        confirmed.add(chain.getSeries());
      }
    }
    SuppressionContext suppression = new SuppressionContext(confirmed, profile.getSuppressionFactor());

    List<IdentificationCandidate> scored = unsuppressed;
    if (suppression.isActive()) {
      LOGGER.info("Confirmed %s; rescoring with suppression factor %.2f", confirmed, suppression.getFactor());
      scored = matcher.score(peaks, suppression);
    }

    List<IdentificationCandidate> selected =
        IsotopeMatcher.select(scored, profile.getIsotopeFloor(), profile.getResultCap());
    LOGGER.info("%d of %d candidates pass the %s floor of %.0f", selected.size(), scored.size(),
        profile.getMode(), profile.getIsotopeFloor());

    return new AnalysisReport(profile.getMode(), profile.getVersion(), peaks.getAllPeaks(), fitted, selected,
        scored, chains, confirmed, background);
  }
}
