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

import com.nuclideid.isotopes.IdentificationCandidate;
import com.nuclideid.isotopes.Nuclide;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Blends peak-matching confidences with an external scorer's as a fixed weighted sum.  A nuclide reported by only
 * one side keeps just that side's weighted share.
 */
public class HybridScoreFusion {
  private static final Logger LOGGER = LogManager.getFormatterLogger(HybridScoreFusion.class);

  public static final double DEFAULT_PEAK_MATCHING_WEIGHT = 0.6;
  public static final double DEFAULT_EXTERNAL_WEIGHT = 0.4;

  private static final Comparator<FusedScore> RANKING =
      Comparator.comparingDouble(FusedScore::getConfidence).reversed().
          thenComparing(FusedScore::getIsotope);

  private final double peakMatchingWeight;
  private final double externalWeight;

  public HybridScoreFusion(double peakMatchingWeight, double externalWeight) {
    if (peakMatchingWeight < 0.0 || externalWeight < 0.0 ||
        Math.abs(peakMatchingWeight + externalWeight - 1.0) > 1e-9) {
      throw new IllegalArgumentException(String.format(
          "Fusion weights must be non-negative and sum to 1, got %f and %f", peakMatchingWeight, externalWeight));
    }
    this.peakMatchingWeight = peakMatchingWeight;
    this.externalWeight = externalWeight;
  }

  public HybridScoreFusion() {
    this(DEFAULT_PEAK_MATCHING_WEIGHT, DEFAULT_EXTERNAL_WEIGHT);
  }

  /**
   * @param rawCandidates Peak-matching candidates, normally {@link AnalysisReport#getRawCandidates()}.
   * @param externalScores The external scorer's output.  Duplicate nuclides keep their highest score.
   * @return Fused scores, strongest first.
   */
  public List<FusedScore> fuse(List<IdentificationCandidate> rawCandidates, List<ExternalScore> externalScores) {
    Map<Nuclide, Double> peakScores = new HashMap<>();
    for (IdentificationCandidate candidate : rawCandidates) {
      peakScores.merge(candidate.getIsotope(), candidate.getConfidence(), Math::max);
    }
    Map<Nuclide, Double> external = new HashMap<>();
    for (ExternalScore score : externalScores) {
      external.merge(score.getIsotope(), score.getConfidence(), Math::max);
    }

    Set<Nuclide> isotopes = new LinkedHashSet<>(peakScores.keySet());
    isotopes.addAll(external.keySet());

    List<FusedScore> fused = new ArrayList<>(isotopes.size());
    for (Nuclide isotope : isotopes) {
      Double peak = peakScores.get(isotope);
      Double ext = external.get(isotope);
      double confidence = (peak == null ? 0.0 : peakMatchingWeight * peak) + (ext == null ? 0.0 : externalWeight * ext);
      fused.add(new FusedScore(isotope, confidence, peak, ext));
    }
    fused.sort(RANKING);
    LOGGER.debug("Fused %d peak-matching and %d external scores into %d", peakScores.size(), external.size(),
        fused.size());
    return fused;
  }
}
