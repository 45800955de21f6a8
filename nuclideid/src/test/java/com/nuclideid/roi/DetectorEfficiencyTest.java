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

import org.junit.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;

public class DetectorEfficiencyTest {

  private static DetectorEfficiency detector(double... energyPercentPairs) {
    Map<Double, Double> table = new HashMap<>();
    for (int i = 0; i < energyPercentPairs.length; i += 2) {
      table.put(energyPercentPairs[i], energyPercentPairs[i + 1]);
    }
    return new DetectorEfficiency("test", "CsI(Tl)", null, table);
  }

  @Test
  public void testEfficiencyIsInterpolatedLinearly() {
    DetectorEfficiency detector = detector(352.0, 7.5, 511.0, 5.5, 609.0, 4.5, 662.0, 4.0);

    assertEquals("Reference points are exact", 0.045, detector.efficiencyAt(609.0), 1e-12);
    assertEquals("Halfway between 352 and 511 keV", 0.065, detector.efficiencyAt(431.5), 1e-12);
    assertEquals(0.0689622641509434, detector.efficiencyAt(400.0), 1e-12);
  }

  @Test
  public void testEfficiencyIsClampedOutsideTheTable() {
    DetectorEfficiency detector = detector(60.0, 22.0, 2614.0, 0.8);

    assertEquals("Below the table the lowest point is used", 0.22, detector.efficiencyAt(10.0), 1e-12);
    assertEquals("Above the table the highest point is used", 0.008, detector.efficiencyAt(3000.0), 1e-12);
  }

  @Test
  public void testDetectorWithoutTableHasNoEfficiency() {
    DetectorEfficiency detector = new DetectorEfficiency("custom", "Custom", null, Collections.emptyMap());
    assertEquals(0.0, detector.efficiencyAt(662.0), 0.0);
    assertEquals(0.0, new DetectorEfficiency("custom", null, null, null).efficiencyAt(662.0), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEfficiencyAboveOneHundredPercentIsRejected() {
    detector(662.0, 140.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveReferenceEnergyIsRejected() {
    detector(0.0, 10.0);
  }
}
