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

package com.nuclideid.peaks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * An ordered, read-only collection of detected peaks (strongest first, as produced by {@link PeakDetector}).
 */
public class PeakList {

  private final List<Peak> peaks;

  public PeakList(List<Peak> peaks) {
    this.peaks = Collections.unmodifiableList(new ArrayList<>(peaks));
  }

  public static PeakList empty() {
    return new PeakList(Collections.emptyList());
  }

  public List<Peak> getAllPeaks() {
    return peaks;
  }

  public List<Peak> getPeaks(Predicate<Peak> filter) {
    return peaks.stream().filter(filter).collect(Collectors.toList());
  }

  /*
   * The following are all expressed through getPeaks.
   */

  public List<Peak> getPeaksNearEnergy(double energyKeV, double toleranceKeV) {
    return getPeaks(peak -> peak.matchesEnergy(energyKeV, toleranceKeV));
  }

  /**
   * Find the peak closest in energy to an expected line, if any lies within tolerance.
   */
  public Optional<Peak> getClosestPeak(double energyKeV, double toleranceKeV) {
    return getPeaksNearEnergy(energyKeV, toleranceKeV).stream().
        min(Comparator.comparingDouble(peak -> Math.abs(peak.getEnergyKeV() - energyKeV)));
  }

  public int size() {
    return peaks.size();
  }

  public boolean isEmpty() {
    return peaks.isEmpty();
  }
}
