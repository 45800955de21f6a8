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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A statistically significant local maximum found in a spectrum.
 */
public class Peak implements Serializable {
  private static final long serialVersionUID = 2854061938412096301L;

  // Energy of the peak channel, from the spectrum's calibration
  @JsonProperty("energy_kev")
  private final double energyKeV;

  @JsonProperty("channel")
  private final int channel;

  // Raw (or background-subtracted) counts at the peak channel
  @JsonProperty("counts")
  private final double counts;

  // Height above the highest saddle separating this peak from higher terrain
  @JsonProperty("prominence")
  private final double prominence;

  @JsonCreator
  public Peak(@JsonProperty("energy_kev") double energyKeV,
              @JsonProperty("channel") int channel,
              @JsonProperty("counts") double counts,
              @JsonProperty("prominence") double prominence) {
    this.energyKeV = energyKeV;
    this.channel = channel;
    this.counts = counts;
    this.prominence = prominence;
  }

  public double getEnergyKeV() {
    return energyKeV;
  }

  public int getChannel() {
    return channel;
  }

  public double getCounts() {
    return counts;
  }

  public double getProminence() {
    return prominence;
  }

  /**
   * Test whether an expected line energy falls within {@code toleranceKeV} of this peak (bounds inclusive).
   */
  public boolean matchesEnergy(double expectedKeV, double toleranceKeV) {
    return Math.abs(energyKeV - expectedKeV) <= toleranceKeV;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    Peak peak = (Peak) o;
    if (channel != peak.channel) return false;
    if (Double.compare(peak.energyKeV, energyKeV) != 0) return false;
    if (Double.compare(peak.counts, counts) != 0) return false;
    return Double.compare(peak.prominence, prominence) == 0;
  }

  @Override
  public int hashCode() {
    int result = Double.hashCode(energyKeV);
    result = 31 * result + channel;
    result = 31 * result + Double.hashCode(counts);
    result = 31 * result + Double.hashCode(prominence);
    return result;
  }

  @Override
  public String toString() {
    return String.format("Peak{%.1f keV, ch %d, counts %.0f, prominence %.0f}", energyKeV, channel, counts, prominence);
  }
}
