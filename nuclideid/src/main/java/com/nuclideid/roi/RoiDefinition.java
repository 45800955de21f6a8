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
import com.nuclideid.isotopes.Nuclide;

/**
 * A region of interest around one gamma line: the window its counts are summed over, a nearby line-free side band
 * that stands in for the continuum under it, and the line's emission probability.
 */
public class RoiDefinition {
  @JsonProperty("name")
  private final String name;

  @JsonProperty("nuclide")
  private final Nuclide nuclide;

  @JsonProperty("energy_kev")
  private final double energyKeV;

  @JsonProperty("roi_window")
  private final EnergyWindow roiWindow;

  @JsonProperty("background_region")
  private final EnergyWindow backgroundRegion;

  @JsonProperty("branching_ratio")
  private final double branchingRatio;

  @JsonCreator
  public RoiDefinition(@JsonProperty("name") String name,
                       @JsonProperty("nuclide") Nuclide nuclide,
                       @JsonProperty("energy_kev") double energyKeV,
                       @JsonProperty("roi_window") EnergyWindow roiWindow,
                       @JsonProperty("background_region") EnergyWindow backgroundRegion,
                       @JsonProperty("branching_ratio") double branchingRatio) {
    if (name == null || nuclide == null || roiWindow == null || backgroundRegion == null) {
      throw new IllegalArgumentException(String.format(
          "Region %s needs a name, a nuclide, a window and a background region", name));
    }
    if (!roiWindow.contains(energyKeV)) {
      throw new IllegalArgumentException(String.format(
          "Region %s: line energy %.1f keV lies outside its window %s", name, energyKeV, roiWindow));
    }
    if (!(branchingRatio > 0.0 && branchingRatio <= 1.0)) {
      throw new IllegalArgumentException(String.format(
          "Region %s: branching ratio must lie in (0, 1], got %s", name, branchingRatio));
    }
    this.name = name;
    this.nuclide = nuclide;
    this.energyKeV = energyKeV;
    this.roiWindow = roiWindow;
    this.backgroundRegion = backgroundRegion;
    this.branchingRatio = branchingRatio;
  }

  public String getName() {
    return name;
  }

  public Nuclide getNuclide() {
    return nuclide;
  }

  public double getEnergyKeV() {
    return energyKeV;
  }

  public EnergyWindow getRoiWindow() {
    return roiWindow;
  }

  public EnergyWindow getBackgroundRegion() {
    return backgroundRegion;
  }

  public double getBranchingRatio() {
    return branchingRatio;
  }

  @Override
  public String toString() {
    return name;
  }
}
