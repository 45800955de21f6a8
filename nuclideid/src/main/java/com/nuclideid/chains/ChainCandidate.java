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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nuclideid.isotopes.Nuclide;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A decay-series hypothesis built from the unsuppressed isotope scores.
 */
public class ChainCandidate {
  @JsonProperty("chain")
  private final DecaySeries series;

  @JsonProperty("detected_members")
  private final Set<Nuclide> detectedMembers;

  @JsonProperty("confidence_level")
  private final ChainConfidenceLevel confidenceLevel;

  // Abundance-weighted mean member confidence, in [0, 1].
  @JsonProperty("weighted_confidence")
  private final double weightedConfidence;

  @JsonProperty("equilibrium")
  private final EquilibriumStatus equilibrium;

  @JsonProperty("equilibrium_checks")
  private final List<EquilibriumCheck> equilibriumChecks;

  public ChainCandidate(DecaySeries series, Set<Nuclide> detectedMembers, ChainConfidenceLevel confidenceLevel,
                        double weightedConfidence, EquilibriumStatus equilibrium,
                        List<EquilibriumCheck> equilibriumChecks) {
    this.series = series;
    this.detectedMembers = Collections.unmodifiableSet(new TreeSet<>(detectedMembers));
    this.confidenceLevel = confidenceLevel;
    this.weightedConfidence = weightedConfidence;
    this.equilibrium = equilibrium;
    this.equilibriumChecks = Collections.unmodifiableList(equilibriumChecks);
  }

  public DecaySeries getSeries() {
    return series;
  }

  public Set<Nuclide> getDetectedMembers() {
    return detectedMembers;
  }

  @JsonIgnore
  public int getDetectedMemberCount() {
    return detectedMembers.size();
  }

  public ChainConfidenceLevel getConfidenceLevel() {
    return confidenceLevel;
  }

  public double getWeightedConfidence() {
    return weightedConfidence;
  }

  public EquilibriumStatus getEquilibrium() {
    return equilibrium;
  }

  public List<EquilibriumCheck> getEquilibriumChecks() {
    return equilibriumChecks;
  }

  @JsonIgnore
  public boolean isConfirmed() {
    return confidenceLevel.isAtLeast(ChainConfidenceLevel.MEDIUM);
  }

  @Override
  public String toString() {
    return String.format("%s: %s (%d members, weighted %.2f)", series, confidenceLevel, detectedMembers.size(),
        weightedConfidence);
  }
}
