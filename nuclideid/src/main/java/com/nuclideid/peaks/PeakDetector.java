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

import com.nuclideid.spectrum.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds significant local maxima in a spectrum.  A maximum is kept only if it strictly exceeds both thresholds, which
 * are derived from the spectrum itself:
 * <ul>
 *   <li>prominence threshold = max(counts) * prominence factor</li>
 *   <li>height threshold = max(min height, max(counts) * height factor)</li>
 *   <li>accepted peaks are at least {@code distance} channels apart; the higher peak wins</li>
 * </ul>
 * The result is sorted by counts, strongest first, and capped.
 */
public class PeakDetector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PeakDetector.class);

  private final PeakDetectorConfig config;

  public PeakDetector(PeakDetectorConfig config) {
    config.validate();
    this.config = config.copy();
  }

  public PeakDetector() {
    this(new PeakDetectorConfig());
  }

  public PeakList detect(Spectrum spectrum) {
    return detect(spectrum.getEnergies(), spectrum.getCountsAsDoubles());
  }

  /**
   * Detect peaks in parallel energy/count arrays, e.g. background-subtracted net counts.
   * @param energies Energy (keV) of every channel.
   * @param counts Counts of every channel.
   * @return The accepted peaks, strongest first; empty for empty or all-zero input.
   */
  public PeakList detect(double[] energies, double[] counts) {
    if (energies.length != counts.length) {
      throw new IllegalArgumentException(String.format(
          "Energy and count arrays differ in length: %d vs %d", energies.length, counts.length));
    }

    double maxCount = 0.0;
    for (double c : counts) {
      maxCount = Math.max(maxCount, c);
    }
    if (counts.length < 3 || maxCount <= 0.0) {
      LOGGER.debug("Spectrum is empty or all zero, no peaks to detect");
      return PeakList.empty();
    }

    double prominenceThreshold = maxCount * config.getProminenceFactor();
    double heightThreshold = Math.max(config.getMinHeight(), maxCount * config.getHeightFactor());

    List<Peak> candidates = new ArrayList<>();
    for (Integer index : findLocalMaxima(counts)) {
      if (counts[index] <= heightThreshold) {
        continue;
      }
      double prominence = prominenceOf(counts, index);
      if (prominence <= prominenceThreshold) {
        continue;
      }
      candidates.add(new Peak(energies[index], index, counts[index], prominence));
    }

    // Higher peaks claim their neighbourhood first; equal heights fall back to the lower channel.
    candidates.sort(Comparator.comparingDouble(Peak::getCounts).reversed().
        thenComparingInt(Peak::getChannel));

    List<Peak> accepted = new ArrayList<>();
    for (Peak candidate : candidates) {
      if (accepted.size() >= config.getMaxPeaks()) {
        break;
      }
      boolean isolated = true;
      for (Peak peak : accepted) {
        if (Math.abs(peak.getChannel() - candidate.getChannel()) < config.getDistance()) {
          isolated = false;
          break;
        }
      }
      if (isolated) {
        accepted.add(candidate);
      }
    }

    LOGGER.debug("Accepted %d of %d candidate maxima (prominence > %.1f, height > %.1f)",
        accepted.size(), candidates.size(), prominenceThreshold, heightThreshold);
    return new PeakList(accepted);
  }

  /**
   * Locate local maxima.  A flat run of equal values bounded by lower values on both sides is reported once, at
   * its middle channel.  The first and last channels are never maxima.
   */
  static List<Integer> findLocalMaxima(double[] counts) {
    List<Integer> maxima = new ArrayList<>();
    int last = counts.length - 1;
    int i = 1;
    while (i < last) {
      if (counts[i - 1] < counts[i]) {
        int ahead = i + 1;
        while (ahead < last && counts[ahead] == counts[i]) {
          ahead++;
        }
        if (counts[ahead] < counts[i]) {
          maxima.add((i + ahead - 1) / 2);
          i = ahead;
        }
      }
      i++;
    }
    return maxima;
  }

  /**
   * Topographic prominence: walk outward on each side until a strictly higher channel (or the array edge), keeping
   * the lowest value seen; the peak's prominence is its height above the higher of the two minima.
   */
  static double prominenceOf(double[] counts, int index) {
    double height = counts[index];

    double leftMin = height;
    for (int j = index - 1; j >= 0; j--) {
      if (counts[j] > height) {
        break;
      }
      leftMin = Math.min(leftMin, counts[j]);
    }

    double rightMin = height;
    for (int j = index + 1; j < counts.length; j++) {
      if (counts[j] > height) {
        break;
      }
      rightMin = Math.min(rightMin, counts[j]);
    }

    return height - Math.max(leftMin, rightMin);
  }
}
