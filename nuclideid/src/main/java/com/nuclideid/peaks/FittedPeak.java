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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A Gaussian fitted to the neighbourhood of a detected peak, on top of a flat baseline.
 */
public class FittedPeak {
  public static final double SIGMA_TO_FWHM = 2.355;

  @JsonProperty("energy_kev")
  private final double centroidKeV;

  @JsonProperty("fwhm_kev")
  private final double fwhmKeV;

  @JsonProperty("amplitude")
  private final double amplitude;

  @JsonProperty("net_area")
  private final double netArea;

  @JsonProperty("baseline")
  private final double baseline;

  @JsonProperty("resolution_percent")
  private final double resolutionPercent;

  @JsonProperty("reduced_chi_squared")
  private final double reducedChiSquared;

  public FittedPeak(double centroidKeV, double sigmaKeV, double amplitude, double baseline, double reducedChiSquared) {
    this.centroidKeV = centroidKeV;
    this.fwhmKeV = SIGMA_TO_FWHM * Math.abs(sigmaKeV);
    this.amplitude = amplitude;
    this.netArea = amplitude * Math.abs(sigmaKeV) * Math.sqrt(2.0 * Math.PI);
    this.baseline = baseline;
    this.resolutionPercent = centroidKeV > 0.0 ? fwhmKeV / centroidKeV * 100.0 : 0.0;
    this.reducedChiSquared = reducedChiSquared;
  }

  public double getCentroidKeV() {
    return centroidKeV;
  }

  public double getFwhmKeV() {
    return fwhmKeV;
  }

  public double getAmplitude() {
    return amplitude;
  }

  public double getNetArea() {
    return netArea;
  }

  public double getBaseline() {
    return baseline;
  }

  public double getResolutionPercent() {
    return resolutionPercent;
  }

  public double getReducedChiSquared() {
    return reducedChiSquared;
  }

  @Override
  public String toString() {
    return String.format("FittedPeak{%.2f keV, FWHM %.2f keV (%.1f%%), area %.0f}",
        centroidKeV, fwhmKeV, resolutionPercent, netArea);
  }
}
