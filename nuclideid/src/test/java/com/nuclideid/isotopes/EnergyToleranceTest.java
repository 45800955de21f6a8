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

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class EnergyToleranceTest {

  @Test
  public void testFixedWindow() {
    EnergyTolerance tolerance = EnergyTolerance.fixed(20.0);
    assertEquals(20.0, tolerance.at(59.5), 0.0);
    assertEquals(20.0, tolerance.at(2614.5), 0.0);
  }

  @Test
  public void testResolutionScaledWindow() {
    EnergyTolerance.ResolutionScaled tolerance = new EnergyTolerance.ResolutionScaled(0.075, 5.0);
    assertEquals("FWHM at the reference energy is R * E", 0.075 * 662.0, tolerance.fwhmAt(662.0), 1e-9);
    assertEquals("Window is 1.5 FWHM", 1.5 * 0.075 * 662.0, tolerance.at(662.0), 1e-9);
    assertEquals("FWHM grows as the square root of energy", 2.0 * tolerance.fwhmAt(662.0), tolerance.fwhmAt(2648.0),
        1e-9);
  }

  @Test
  public void testResolutionScaledWindowHasFloor() {
    EnergyTolerance tolerance = EnergyTolerance.resolutionScaled(0.075, 5.0);
    assertEquals("Non-positive energies fall back to the minimum", 5.0, tolerance.at(0.0), 0.0);
    assertEquals(5.0, tolerance.at(-10.0), 0.0);
    assertEquals("Very low energies use the minimum", 5.0, tolerance.at(1.0), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFixedWindowMustBePositive() {
    EnergyTolerance.fixed(0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testResolutionMustBePositive() {
    EnergyTolerance.resolutionScaled(-0.05, 5.0);
  }
}
