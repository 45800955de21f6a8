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

package com.nuclideid.roi;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A closed energy interval [low, high] in keV, written in JSON as a two element array.
 */
public class EnergyWindow {
  private final double lowKeV;
  private final double highKeV;

  public EnergyWindow(double lowKeV, double highKeV) {
    if (!Double.isFinite(lowKeV) || !Double.isFinite(highKeV) || !(lowKeV < highKeV)) {
      throw new IllegalArgumentException(String.format(
          "Energy window needs finite bounds with low < high, got [%s, %s]", lowKeV, highKeV));
    }
    this.lowKeV = lowKeV;
    this.highKeV = highKeV;
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static EnergyWindow fromArray(double[] bounds) {
    if (bounds == null || bounds.length != 2) {
      throw new IllegalArgumentException("Energy window must be given as [low, high]");
    }
    return new EnergyWindow(bounds[0], bounds[1]);
  }

  @JsonValue
  public double[] toArray() {
    return new double[]{lowKeV, highKeV};
  }

  public double getLowKeV() {
    return lowKeV;
  }

  public double getHighKeV() {
    return highKeV;
  }

  public double getWidthKeV() {
    return highKeV - lowKeV;
  }

  public boolean contains(double energyKeV) {
    return energyKeV >= lowKeV && energyKeV <= highKeV;
  }

  /**
   * Sum the counts of every channel whose energy lies in this window.
   */
  public double sum(double[] energies, double[] counts) {
    double total = 0.0;
    for (int i = 0; i < energies.length; i++) {
      if (contains(energies[i])) {
        total += counts[i];
      }
    }
    return total;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    EnergyWindow that = (EnergyWindow) o;
    return Double.compare(that.lowKeV, lowKeV) == 0 && Double.compare(that.highKeV, highKeV) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(lowKeV) + Double.hashCode(highKeV);
  }

  @Override
  public String toString() {
    return String.format("[%.1f, %.1f] keV", lowKeV, highKeV);
  }
}
