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

package com.nuclideid.isotopes;

import com.nuclideid.peaks.Peak;
import com.nuclideid.peaks.PeakList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Scores registry nuclides against a list of detected peaks.  A line matches if a peak lies within the energy
 * tolerance of it; the confidence for a nuclide with m of n lines matched is computed as:
 * <ol>
 *   <li>base = 100 * m / n</li>
 *   <li>single-line nuclides are capped at 60, even on an exact match</li>
 *   <li>multi-line nuclides gain 10 when 3 or more lines match and lose 30 when only one of several does</li>
 *   <li>the result, floored at 0, is scaled by the natural-abundance prior of {@link AbundanceWeighting}</li>
 *   <li>nuclides ruled out by a {@link SuppressionContext} are scaled by its factor</li>
 *   <li>the score is clamped to [0, 100], and single-line nuclides to [0, 60]</li>
 * </ol>
 */
public class IsotopeMatcher {
  private static final Logger LOGGER = LogManager.getFormatterLogger(IsotopeMatcher.class);

  public static final double MAX_CONFIDENCE = 100.0;
  public static final double SINGLE_LINE_CEILING = 60.0;
  public static final int MULTI_LINE_BONUS_MIN_MATCHES = 3;
  public static final double MULTI_LINE_BONUS = 10.0;
  public static final double PARTIAL_MATCH_PENALTY = 30.0;

  // Strongest first; more matched lines, then name, break ties so output order is deterministic.
  public static final Comparator<IdentificationCandidate> RANKING =
      Comparator.comparingDouble(IdentificationCandidate::getConfidence).reversed().
          thenComparing(Comparator.comparingInt(IdentificationCandidate::getMatchedLines).reversed()).
          thenComparing(IdentificationCandidate::getIsotope);

  private final IsotopeRegistry registry;
  private final EnergyTolerance tolerance;
  private final LibraryTier tier;

  public IsotopeMatcher(IsotopeRegistry registry, EnergyTolerance tolerance, LibraryTier tier) {
    this.registry = registry;
    this.tolerance = tolerance;
    this.tier = tier;
  }

  public EnergyTolerance getTolerance() {
    return tolerance;
  }

  public LibraryTier getTier() {
    return tier;
  }

  /**
   * Score every nuclide with at least one matched line.
   * @param peaks The detected peaks.
   * @param suppression The chain context to apply; use {@link SuppressionContext#none()} for unsuppressed scores.
   * @return All candidates, ranked, without any confidence floor or result cap applied.
   */
  public List<IdentificationCandidate> score(PeakList peaks, SuppressionContext suppression) {
    List<IdentificationCandidate> candidates = new ArrayList<>();
    if (peaks.isEmpty()) {
      return candidates;
    }

    for (IsotopeRecord record : registry.getRecords(tier)) {
      IdentificationCandidate candidate = score(record, peaks, suppression);
      if (candidate != null) {
        candidates.add(candidate);
      }
    }

    candidates.sort(RANKING);
    LOGGER.debug("%d of %d nuclides matched at least one line", candidates.size(), registry.size());
    return candidates;
  }

  /**
   * Score one record.
   * @return The candidate, or null if none of its lines matched.
   */
  IdentificationCandidate score(IsotopeRecord record, PeakList peaks, SuppressionContext suppression) {
    List<LineMatch> matches = new ArrayList<>();
    double totalIntensity = 0.0;
    double matchedIntensity = 0.0;
    for (IsotopeLine line : record.getLines()) {
      totalIntensity += line.getIntensity();
      Optional<Peak> peak = peaks.getClosestPeak(line.getEnergyKeV(), tolerance.at(line.getEnergyKeV()));
      if (peak.isPresent()) {
        matches.add(new LineMatch(line, peak.get()));
        matchedIntensity += line.getIntensity();
      }
    }
    if (matches.isEmpty()) {
      return null;
    }

    int totalLines = record.getLineCount();
    double raw = baseConfidence(matches.size(), totalLines);
    double confidence = AbundanceWeighting.apply(raw, record.getAbundanceWeight());

    String suppressionReason = null;
    if (suppression.suppresses(record)) {
      confidence *= suppression.getFactor();
      suppressionReason = SuppressionContext.REASON_NATURAL_SERIES;
    }

    double ceiling = totalLines == 1 ? SINGLE_LINE_CEILING : MAX_CONFIDENCE;
    confidence = Math.max(0.0, Math.min(confidence, ceiling));

    double intensityFraction = totalIntensity > 0.0 ? matchedIntensity / totalIntensity : 0.0;

    LOGGER.debug("%s: %d/%d lines, raw %.1f, final %.1f%s", record.getName(), matches.size(), totalLines,
        raw, confidence, suppressionReason == null ? "" : " (suppressed)");
    return new IdentificationCandidate(record.getName(), confidence, raw, totalLines, intensityFraction,
        record.getAbundanceWeight(), record.getCategory(), suppressionReason, matches);
  }

  /**
   * The match-count part of the score, before any weighting: the matched fraction with the single-line cap and the
   * multi-line bonus or penalty applied, clamped to [0, 100].
   */
  static double baseConfidence(int matchedLines, int totalLines) {
    if (matchedLines <= 0 || totalLines <= 0) {
      return 0.0;
    }
    double confidence = MAX_CONFIDENCE * matchedLines / totalLines;
    if (totalLines == 1) {
      confidence = Math.min(confidence, SINGLE_LINE_CEILING);
    } else if (matchedLines >= MULTI_LINE_BONUS_MIN_MATCHES) {
      confidence += MULTI_LINE_BONUS;
    } else if (matchedLines == 1) {
      confidence -= PARTIAL_MATCH_PENALTY;
    }
    return Math.max(0.0, Math.min(confidence, MAX_CONFIDENCE));
  }

  /**
   * Keep candidates scoring at least {@code floor}, in ranked order, truncated to {@code cap} when one is given.
   */
  public static List<IdentificationCandidate> select(List<IdentificationCandidate> candidates, double floor,
                                                     Integer cap) {
    List<IdentificationCandidate> selected = candidates.stream().
        filter(candidate -> candidate.getConfidence() >= floor).
        sorted(RANKING).
        collect(Collectors.toList());
    if (cap != null && selected.size() > cap) {
      return new ArrayList<>(selected.subList(0, cap));
    }
    return selected;
  }
}
