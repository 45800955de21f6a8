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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.io.Serializable;

/**
 * A linear channel to energy mapping: E(keV) = slope * channel + intercept.
 */
public class EnergyCalibration implements Serializable {
  private static final long serialVersionUID = -2209186632374402127L;

  private static final int MIN_REFERENCE_POINTS = 2;

  @JsonProperty("slope")
  private final double slope;

  @JsonProperty("intercept")
  private final double intercept;

  @JsonCreator
  public EnergyCalibration(@JsonProperty("slope") double slope, @JsonProperty("intercept") double intercept) {
    this.slope = slope;
    this.intercept = intercept;
  }

  /**
   * Fit a calibration line through known (channel, energy) reference points by least squares.
   * @param channels The channels at which reference lines were observed.
   * @param energiesKeV The known energies of those lines, in keV.
   * @return A validated calibration.
   * @throws SpectrumValidationException If fewer than two points are given or the fitted slope is not positive.
   */
  public static EnergyCalibration fit(double[] channels, double[] energiesKeV) throws SpectrumValidationException {
    if (channels.length != energiesKeV.length) {
      throw new SpectrumValidationException(String.format(
          "Reference channel and energy lists differ in size: %d vs %d", channels.length, energiesKeV.length));
    }
    if (channels.length < MIN_REFERENCE_POINTS) {
      throw new SpectrumValidationException(String.format(
          "At least %d reference points are needed for a linear calibration, got %d",
          MIN_REFERENCE_POINTS, channels.length));
    }

    SimpleRegression regression = new SimpleRegression(true);
    for (int i = 0; i < channels.length; i++) {
      regression.addData(channels[i], energiesKeV[i]);
    }

    EnergyCalibration calibration = new EnergyCalibration(regression.getSlope(), regression.getIntercept());
    calibration.validate();
    return calibration;
  }

  /**
   * Energies must increase with channel, so the slope has to be positive and both coefficients finite.
   */
  public void validate() throws SpectrumValidationException {
    if (!Double.isFinite(slope) || !Double.isFinite(intercept)) {
      throw new SpectrumValidationException(String.format(
          "Calibration coefficients must be finite (slope %s, intercept %s)", slope, intercept));
    }
    if (slope <= 0.0) {
      throw new SpectrumValidationException(String.format(
          "Calibration slope must be positive for monotonically increasing energies, got %f", slope));
    }
  }

  public double getSlope() {
    return slope;
  }

  public double getIntercept() {
    return intercept;
  }

  public double energyOf(int channel) {
    return slope * channel + intercept;
  }

  public int channelOf(double energyKeV) {
    return (int) Math.round((energyKeV - intercept) / slope);
  }

  public double[] energies(int channelCount) {
    double[] energies = new double[channelCount];
    for (int i = 0; i < channelCount; i++) {
      energies[i] = energyOf(i);
    }
    return energies;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    EnergyCalibration that = (EnergyCalibration) o;
    return Double.compare(that.slope, slope) == 0 && Double.compare(that.intercept, intercept) == 0;
  }

  @Override
  public int hashCode() {
    int result = Double.hashCode(slope);
    result = 31 * result + Double.hashCode(intercept);
    return result;
  }

  @Override
  public String toString() {
    return String.format("E = %.6f * ch + %.6f", slope, intercept);
  }
}
