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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nuclideid.background.BackgroundEstimate;
import com.nuclideid.chains.ChainCandidate;
import com.nuclideid.chains.DecaySeries;
import com.nuclideid.isotopes.IdentificationCandidate;
import com.nuclideid.peaks.FittedPeak;
import com.nuclideid.peaks.Peak;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Everything one spectrum analysis produced.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisReport {
  @JsonProperty("mode")
  private final AnalysisMode mode;

  @JsonProperty("profile_version")
  private final String profileVersion;

  @JsonProperty("peaks")
  private final List<Peak> peaks;

  @JsonProperty("fitted_peaks")
  private final List<FittedPeak> fittedPeaks;

  // Above the profile's floor and within its cap, suppression applied.
  @JsonProperty("identification_candidates")
  private final List<IdentificationCandidate> identificationCandidates;

  // Every matched nuclide before the floor and cap, for fusion with external scorers.
  @JsonProperty("raw_candidates")
  private final List<IdentificationCandidate> rawCandidates;

  @JsonProperty("chain_candidates")
  private final List<ChainCandidate> chainCandidates;

  @JsonProperty("confirmed_series")
  private final Set<DecaySeries> confirmedSeries;

  @JsonProperty("background")
  private final BackgroundEstimate background;

  public AnalysisReport(AnalysisMode mode, String profileVersion, List<Peak> peaks, List<FittedPeak> fittedPeaks,
                        List<IdentificationCandidate> identificationCandidates,
                        List<IdentificationCandidate> rawCandidates, List<ChainCandidate> chainCandidates,
                        Set<DecaySeries> confirmedSeries, BackgroundEstimate background) {
    this.mode = mode;
    this.profileVersion = profileVersion;
    this.peaks = Collections.unmodifiableList(peaks);
    this.fittedPeaks = fittedPeaks == null ? null : Collections.unmodifiableList(fittedPeaks);
    this.identificationCandidates = Collections.unmodifiableList(identificationCandidates);
    this.rawCandidates = Collections.unmodifiableList(rawCandidates);
    this.chainCandidates = Collections.unmodifiableList(chainCandidates);
    this.confirmedSeries = Collections.unmodifiableSet(new TreeSet<>(confirmedSeries));
    this.background = background;
  }

  public AnalysisMode getMode() {
    return mode;
  }

  public String getProfileVersion() {
    return profileVersion;
  }

  public List<Peak> getPeaks() {
    return peaks;
  }

  public List<FittedPeak> getFittedPeaks() {
    return fittedPeaks;
  }

  public List<IdentificationCandidate> getIdentificationCandidates() {
    return identificationCandidates;
  }

  public List<IdentificationCandidate> getRawCandidates() {
    return rawCandidates;
  }

  public List<ChainCandidate> getChainCandidates() {
    return chainCandidates;
  }

  public Set<DecaySeries> getConfirmedSeries() {
    return confirmedSeries;
  }

  public BackgroundEstimate getBackground() {
    return background;
  }
}
