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

package com.nuclideid.spectrum;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * An immutable channel/count gamma spectrum with its linear energy calibration.  Instances are created once per
 * acquisition and are safe to share between threads.
 */
public class Spectrum {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Spectrum.class);

  public static final int DEFAULT_CHANNEL_COUNT = 1024;

  private final int[] counts;
  private final EnergyCalibration calibration;

  private Spectrum(int[] counts, EnergyCalibration calibration) {
    this.counts = counts;
    this.calibration = calibration;
  }

  /**
   * Build a spectrum from raw counts, rejecting negative counts and non-monotonic calibrations.
   */
  public static Spectrum of(int[] counts, EnergyCalibration calibration) throws SpectrumValidationException {
    if (counts == null) {
      throw new SpectrumValidationException("Spectrum has no counts array");
    }
    if (calibration == null) {
      throw new SpectrumValidationException("Spectrum has no energy calibration");
    }
    calibration.validate();
    for (int i = 0; i < counts.length; i++) {
      if (counts[i] < 0) {
        throw new SpectrumValidationException(String.format("Negative count %d in channel %d", counts[i], i));
      }
    }
    return new Spectrum(Arrays.copyOf(counts, counts.length), calibration);
  }

  /**
   * Build a spectrum of exactly {@code channelCount} channels.  Shorter inputs are zero-padded at the high-energy
   * end and longer inputs are truncated; both recoveries are logged.
   */
  public static Spectrum conform(int[] counts, EnergyCalibration calibration, int channelCount)
      throws SpectrumValidationException {
    if (channelCount <= 0) {
      throw new SpectrumValidationException(String.format("Channel count must be positive, got %d", channelCount));
    }
    if (counts == null) {
      throw new SpectrumValidationException("Spectrum has no counts array");
    }
    if (counts.length < channelCount) {
      LOGGER.warn("Spectrum has %d channels, zero-padding to %d", counts.length, channelCount);
    } else if (counts.length > channelCount) {
      LOGGER.warn("Spectrum has %d channels, truncating to %d", counts.length, channelCount);
    }
    return of(Arrays.copyOf(counts, channelCount), calibration);
  }

  public int size() {
    return counts.length;
  }

  public int getCount(int channel) {
    return counts[channel];
  }

  public int[] getCounts() {
    return Arrays.copyOf(counts, counts.length);
  }

  public double[] getCountsAsDoubles() {
    double[] values = new double[counts.length];
    for (int i = 0; i < counts.length; i++) {
      values[i] = counts[i];
    }
    return values;
  }

  public EnergyCalibration getCalibration() {
    return calibration;
  }

  public double[] getEnergies() {
    return calibration.energies(counts.length);
  }

  public int getMaxCount() {
    int max = 0;
    for (int c : counts) {
      max = Math.max(max, c);
    }
    return max;
  }

  public long getTotalCounts() {
    long total = 0L;
    for (int c : counts) {
      total += c;
    }
    return total;
  }

  public boolean isEmpty() {
    return getMaxCount() == 0;
  }

  // Equality covers every count and the calibration, so spectra can key memoized analyses.
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    Spectrum spectrum = (Spectrum) o;
    return Arrays.equals(counts, spectrum.counts) && calibration.equals(spectrum.calibration);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(counts) + calibration.hashCode();
  }
}
