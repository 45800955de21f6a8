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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A gamma line: its energy and its emission intensity (photons per decay, capped at 1).
 */
public class IsotopeLine {
  public static final double DEFAULT_INTENSITY = 1.0;

  @JsonProperty("energy_kev")
  private final double energyKeV;

  @JsonProperty("intensity")
  private final double intensity;

  @JsonCreator
  public IsotopeLine(@JsonProperty("energy_kev") double energyKeV,
                     @JsonProperty("intensity") Double intensity) {
    if (!Double.isFinite(energyKeV) || energyKeV <= 0.0) {
      throw new IllegalArgumentException(String.format("Gamma line energy must be positive, got %s", energyKeV));
    }
    double value = intensity == null ? DEFAULT_INTENSITY : intensity;
    if (!(value >= 0.0 && value <= 1.0)) {
      throw new IllegalArgumentException(String.format(
          "Gamma line intensity must lie in [0, 1], got %s at %.1f keV", value, energyKeV));
    }
    this.energyKeV = energyKeV;
    this.intensity = value;
  }

  public IsotopeLine(double energyKeV) {
    this(energyKeV, DEFAULT_INTENSITY);
  }

  public double getEnergyKeV() {
    return energyKeV;
  }

  public double getIntensity() {
    return intensity;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    IsotopeLine that = (IsotopeLine) o;
    return Double.compare(that.energyKeV, energyKeV) == 0 && Double.compare(that.intensity, intensity) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(energyKeV) + Double.hashCode(intensity);
  }

  @Override
  public String toString() {
    return String.format("%.1f keV (%.3f)", energyKeV, intensity);
  }
}
