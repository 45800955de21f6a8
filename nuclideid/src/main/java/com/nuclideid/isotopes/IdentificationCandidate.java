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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * A nuclide scored against a peak list.  {@code confidence} is the final score in [0, 100];
 * {@code raw_confidence} is the score before abundance weighting and suppression.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IdentificationCandidate {

  @JsonProperty("isotope")
  private final Nuclide isotope;

  @JsonProperty("confidence")
  private final double confidence;

  @JsonProperty("raw_confidence")
  private final double rawConfidence;

  @JsonProperty("matched_lines")
  private final int matchedLines;

  @JsonProperty("total_lines")
  private final int totalLines;

  // Matched intensity over total intensity of the nuclide's lines.
  @JsonProperty("matched_intensity_fraction")
  private final double matchedIntensityFraction;

  @JsonProperty("abundance_weight")
  private final double abundanceWeight;

  @JsonProperty("category")
  private final IsotopeCategory category;

  @JsonProperty("suppressed")
  private final boolean suppressed;

  @JsonProperty("suppression_reason")
  private final String suppressionReason;

  @JsonProperty("matches")
  private final List<LineMatch> matches;

  public IdentificationCandidate(Nuclide isotope, double confidence, double rawConfidence, int totalLines,
                                 double matchedIntensityFraction, double abundanceWeight, IsotopeCategory category,
                                 String suppressionReason, List<LineMatch> matches) {
    this.isotope = isotope;
    this.confidence = confidence;
    this.rawConfidence = rawConfidence;
    this.matchedLines = matches.size();
    this.totalLines = totalLines;
    this.matchedIntensityFraction = matchedIntensityFraction;
    this.abundanceWeight = abundanceWeight;
    this.category = category;
    this.suppressed = suppressionReason != null;
    this.suppressionReason = suppressionReason;
    this.matches = Collections.unmodifiableList(matches);
  }

  public Nuclide getIsotope() {
    return isotope;
  }

  public double getConfidence() {
    return confidence;
  }

  public double getRawConfidence() {
    return rawConfidence;
  }

  public int getMatchedLines() {
    return matchedLines;
  }

  public int getTotalLines() {
    return totalLines;
  }

  public double getMatchedIntensityFraction() {
    return matchedIntensityFraction;
  }

  public double getAbundanceWeight() {
    return abundanceWeight;
  }

  public IsotopeCategory getCategory() {
    return category;
  }

  public boolean isSuppressed() {
    return suppressed;
  }

  public String getSuppressionReason() {
    return suppressionReason;
  }

  public List<LineMatch> getMatches() {
    return matches;
  }

  /**
   * @return The counts of the strongest peak matched to any of this nuclide's lines, or 0 if none matched.
   */
  @JsonIgnore
  public double getStrongestMatchedCounts() {
    return matches.stream().mapToDouble(LineMatch::getObservedCounts).max().orElse(0.0);
  }

  @Override
  public String toString() {
    return String.format("%s: %.1f%% (%d/%d lines%s)", isotope, confidence, matchedLines, totalLines,
        suppressed ? ", suppressed" : "");
  }
}
