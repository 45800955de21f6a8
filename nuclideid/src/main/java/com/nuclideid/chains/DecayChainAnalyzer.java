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

package com.nuclideid.chains;

import com.nuclideid.isotopes.AbundanceWeighting;
import com.nuclideid.isotopes.IdentificationCandidate;
import com.nuclideid.isotopes.IsotopeMatcher;
import com.nuclideid.isotopes.Nuclide;
import org.apache.commons.lang3.tuple.Pair;
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
 * Aggregates isotope scores into decay-series hypotheses.  For each series:
 * <ul>
 *   <li>detected members are the members scoring above the member floor</li>
 *   <li>the weighted confidence is the mean, over the key members and the detected members, of each member's
 *   pre-weighting score (as a fraction) scaled by the series' abundance prior and clamped to [0, 1]</li>
 *   <li>the level is LOW below a weighted confidence of 0.15; otherwise HIGH with four or more detected members,
 *   MEDIUM with three or with a weighted confidence of at least 0.6, and LOW otherwise</li>
 * </ul>
 * The input must be the unsuppressed scores; suppression computed from these results never flows back in here.
 */
public class DecayChainAnalyzer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DecayChainAnalyzer.class);

  public static final double LOW_WEIGHTED_CEILING = 0.15;
  public static final double MEDIUM_WEIGHTED_THRESHOLD = 0.6;
  public static final int HIGH_MIN_MEMBERS = 4;
  public static final int MEDIUM_MIN_MEMBERS = 3;

  private static final Comparator<ChainCandidate> RANKING =
      Comparator.comparing(ChainCandidate::getConfidenceLevel).reversed().
          thenComparing(Comparator.comparingDouble(ChainCandidate::getWeightedConfidence).reversed()).
          thenComparing(ChainCandidate::getSeries);

  private final double memberFloor;

  /**
   * @param memberFloor A member counts as detected when its score exceeds this value.
   */
  public DecayChainAnalyzer(double memberFloor) {
    if (memberFloor < 0.0 || memberFloor > IsotopeMatcher.MAX_CONFIDENCE) {
      throw new IllegalArgumentException(String.format("Member floor must lie in [0, 100], got %f", memberFloor));
    }
    this.memberFloor = memberFloor;
  }

  public double getMemberFloor() {
    return memberFloor;
  }

  /**
   * Build a hypothesis for every series with at least one detected member.
   * @param unsuppressed Isotope candidates scored without any suppression.
   * @return The hypotheses, strongest first.
   */
  public List<ChainCandidate> analyze(List<IdentificationCandidate> unsuppressed) {
    Map<Nuclide, IdentificationCandidate> byIsotope = new HashMap<>();
    for (IdentificationCandidate candidate : unsuppressed) {
      byIsotope.put(candidate.getIsotope(), candidate);
    }

    List<ChainCandidate> chains = new ArrayList<>();
    for (DecaySeries series : DecaySeries.values()) {
      ChainCandidate chain = analyze(series, byIsotope);
      if (chain.getDetectedMemberCount() > 0) {
        LOGGER.debug("%s", chain);
        chains.add(chain);
      }
    }
    chains.sort(RANKING);
    return chains;
  }

  ChainCandidate analyze(DecaySeries series, Map<Nuclide, IdentificationCandidate> byIsotope) {
    Set<Nuclide> detected = new LinkedHashSet<>();
    for (Nuclide member : series.getMembers()) {
      IdentificationCandidate candidate = byIsotope.get(member);
      if (candidate != null && candidate.getConfidence() > memberFloor) {
        detected.add(member);
      }
    }

    Set<Nuclide> averaged = new LinkedHashSet<>(series.getKeyMembers());
    averaged.addAll(detected);
    double sum = 0.0;
    for (Nuclide member : averaged) {
      IdentificationCandidate candidate = byIsotope.get(member);
      if (candidate != null) {
        double weighted = AbundanceWeighting.apply(
            candidate.getRawConfidence() / IsotopeMatcher.MAX_CONFIDENCE, series.getAbundanceWeight());
        sum += Math.max(0.0, Math.min(weighted, 1.0));
      }
    }
    double weightedConfidence = averaged.isEmpty() ? 0.0 : sum / averaged.size();

    List<EquilibriumCheck> checks = new ArrayList<>();
    for (Pair<Nuclide, Nuclide> pair : series.getEquilibriumPairs()) {
      checks.add(new EquilibriumCheck(pair.getLeft(), pair.getRight(),
          strongestCounts(byIsotope, pair.getLeft()), strongestCounts(byIsotope, pair.getRight())));
    }

    return new ChainCandidate(series, detected, levelFor(detected.size(), weightedConfidence), weightedConfidence,
        overallEquilibrium(checks), checks);
  }

  /**
   * Assign a level.  A high weighted confidence alone can reach MEDIUM but never HIGH, which always needs four
   * detected members.
   */
  static ChainConfidenceLevel levelFor(int detectedMembers, double weightedConfidence) {
    if (weightedConfidence < LOW_WEIGHTED_CEILING) {
      return ChainConfidenceLevel.LOW;
    }
    if (detectedMembers >= HIGH_MIN_MEMBERS) {
      return ChainConfidenceLevel.HIGH;
    }
    if (detectedMembers >= MEDIUM_MIN_MEMBERS || weightedConfidence >= MEDIUM_WEIGHTED_THRESHOLD) {
      return ChainConfidenceLevel.MEDIUM;
    }
    return ChainConfidenceLevel.LOW;
  }

  /**
   * Any pair out of equilibrium puts the series out of equilibrium; otherwise one pair in equilibrium suffices.
   */
  static EquilibriumStatus overallEquilibrium(List<EquilibriumCheck> checks) {
    EquilibriumStatus status = EquilibriumStatus.UNKNOWN;
    for (EquilibriumCheck check : checks) {
      if (check.getStatus() == EquilibriumStatus.OUT_OF_EQUILIBRIUM) {
        return EquilibriumStatus.OUT_OF_EQUILIBRIUM;
      }
      if (check.getStatus() == EquilibriumStatus.IN_EQUILIBRIUM) {
        status = EquilibriumStatus.IN_EQUILIBRIUM;
      }
    }
    return status;
  }

  private static double strongestCounts(Map<Nuclide, IdentificationCandidate> byIsotope, Nuclide member) {
    IdentificationCandidate candidate = byIsotope.get(member);
    return candidate == null ? 0.0 : candidate.getStrongestMatchedCounts();
  }
}
