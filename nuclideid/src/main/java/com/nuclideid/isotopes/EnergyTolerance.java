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

/**
 * How far (in keV) an observed peak may sit from an expected gamma line and still count as a match.
 */
public abstract class EnergyTolerance {

  /**
   * @return The matching half-window, in keV, for a line at {@code energyKeV}.
   */
  public abstract double at(double energyKeV);

  public static EnergyTolerance fixed(double toleranceKeV) {
    return new Fixed(toleranceKeV);
  }

  public static EnergyTolerance resolutionScaled(double baseResolution, double minimumKeV) {
    return new ResolutionScaled(baseResolution, minimumKeV);
  }

  /**
   * The same window at every energy.
   */
  public static class Fixed extends EnergyTolerance {
    private final double toleranceKeV;

    public Fixed(double toleranceKeV) {
      if (!(toleranceKeV > 0.0) || Double.isInfinite(toleranceKeV)) {
        throw new IllegalArgumentException(
            String.format("Energy tolerance must be positive, got %f keV", toleranceKeV));
      }
      this.toleranceKeV = toleranceKeV;
    }

    @Override
    public double at(double energyKeV) {
      return toleranceKeV;
    }

    @Override
    public String toString() {
      return String.format("+/- %.1f keV", toleranceKeV);
    }
  }

  /**
   * A window that follows scintillator resolution: FWHM(E) = R * E * sqrt(E_ref / E) with E_ref = 662 keV, so the
   * relative resolution R is quoted at the Cs-137 line.  The window is 1.5 FWHM and never narrower than a minimum.
   */
  public static class ResolutionScaled extends EnergyTolerance {
    public static final double REFERENCE_ENERGY_KEV = 662.0;
    public static final double FWHM_MULTIPLIER = 1.5;

    private final double baseResolution;
    private final double minimumKeV;

    public ResolutionScaled(double baseResolution, double minimumKeV) {
      if (!(baseResolution > 0.0) || !(minimumKeV > 0.0)) {
        throw new IllegalArgumentException(String.format(
            "Resolution and minimum tolerance must be positive, got %f and %f keV", baseResolution, minimumKeV));
      }
      this.baseResolution = baseResolution;
      this.minimumKeV = minimumKeV;
    }

    public double fwhmAt(double energyKeV) {
      if (energyKeV <= 0.0) {
        return 0.0;
      }
      return baseResolution * energyKeV * Math.sqrt(REFERENCE_ENERGY_KEV / energyKeV);
    }

    @Override
    public double at(double energyKeV) {
      return Math.max(minimumKeV, FWHM_MULTIPLIER * fwhmAt(energyKeV));
    }

    @Override
    public String toString() {
      return String.format("1.5 FWHM at %.1f%% resolution (min %.1f keV)", baseResolution * 100.0, minimumKeV);
    }
  }
}
