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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Full-energy peak efficiency of one detector, tabulated in percent at a few reference energies.  Efficiencies
 * between reference energies are interpolated linearly; outside the table the nearest end point is used.
 */
public class DetectorEfficiency {
  @JsonProperty("name")
  private final String name;

  @JsonProperty("crystal")
  private final String crystal;

  // FWHM as a fraction of 662 keV; null when the vendor gives none.
  @JsonProperty("resolution_662")
  private final Double resolutionAt662;

  @JsonProperty("efficiency_percent")
  private final NavigableMap<Double, Double> efficiencyPercent;

  @JsonCreator
  public DetectorEfficiency(@JsonProperty("name") String name,
                            @JsonProperty("crystal") String crystal,
                            @JsonProperty("resolution_662") Double resolutionAt662,
                            @JsonProperty("efficiency_percent") Map<Double, Double> efficiencyPercent) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("A detector needs a name");
    }
    TreeMap<Double, Double> table = new TreeMap<>();
    if (efficiencyPercent != null) {
      for (Map.Entry<Double, Double> point : efficiencyPercent.entrySet()) {
        Double value = point.getValue();
        if (!(point.getKey() > 0.0) || value == null || !(value >= 0.0 && value <= 100.0)) {
          throw new IllegalArgumentException(String.format(
              "Detector %s has an invalid efficiency point %s keV -> %s%%", name, point.getKey(), value));
        }
        table.put(point.getKey(), value);
      }
    }
    this.name = name;
    this.crystal = crystal;
    this.resolutionAt662 = resolutionAt662;
    this.efficiencyPercent = Collections.unmodifiableNavigableMap(table);
  }

  /**
   * Get the efficiency at an energy.
   * @return Efficiency as a fraction in [0, 1]; 0 if the detector has no efficiency table.
   */
  public double efficiencyAt(double energyKeV) {
    if (efficiencyPercent.isEmpty()) {
      return 0.0;
    }
    Map.Entry<Double, Double> below = efficiencyPercent.floorEntry(energyKeV);
    Map.Entry<Double, Double> above = efficiencyPercent.ceilingEntry(energyKeV);
    if (below == null) {
      return above.getValue() / 100.0;
    }
    if (above == null || below.getKey().equals(above.getKey())) {
      return below.getValue() / 100.0;
    }
    double fraction = (energyKeV - below.getKey()) / (above.getKey() - below.getKey());
    return (below.getValue() + fraction * (above.getValue() - below.getValue())) / 100.0;
  }

  public String getName() {
    return name;
  }

  public String getCrystal() {
    return crystal;
  }

  public Double getResolutionAt662() {
    return resolutionAt662;
  }

  public NavigableMap<Double, Double> getEfficiencyPercent() {
    return efficiencyPercent;
  }

  @Override
  public String toString() {
    return name;
  }
}
