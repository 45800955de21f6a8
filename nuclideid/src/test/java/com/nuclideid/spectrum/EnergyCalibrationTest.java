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

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class EnergyCalibrationTest {

  @Test
  public void testFitRecoversExactLine() throws Exception {
    EnergyCalibration calibration = EnergyCalibration.fit(
        new double[]{20.0, 220.0, 444.0}, new double[]{62.0, 662.0, 1334.0});
    assertEquals("Slope of an exact line is recovered", 3.0, calibration.getSlope(), 1e-9);
    assertEquals("Intercept of an exact line is recovered", 2.0, calibration.getIntercept(), 1e-9);
  }

  @Test
  public void testFitAveragesNoisyPoints() throws Exception {
    EnergyCalibration calibration = EnergyCalibration.fit(
        new double[]{0.0, 1.0, 2.0, 3.0}, new double[]{0.1, 2.9, 6.1, 8.9});
    assertEquals("Least-squares slope", 2.96, calibration.getSlope(), 1e-9);
    assertEquals("Least-squares intercept", 0.06, calibration.getIntercept(), 1e-9);
  }

  @Test(expected = SpectrumValidationException.class)
  public void testFitNeedsTwoPoints() throws Exception {
    EnergyCalibration.fit(new double[]{220.0}, new double[]{662.0});
  }

  @Test(expected = SpectrumValidationException.class)
  public void testFitRejectsMismatchedLists() throws Exception {
    EnergyCalibration.fit(new double[]{1.0, 2.0}, new double[]{3.0});
  }

  @Test(expected = SpectrumValidationException.class)
  public void testDecreasingCalibrationIsRejected() throws Exception {
    EnergyCalibration.fit(new double[]{100.0, 200.0}, new double[]{600.0, 300.0});
  }

  @Test(expected = SpectrumValidationException.class)
  public void testNonFiniteSlopeIsRejected() throws Exception {
    new EnergyCalibration(Double.NaN, 0.0).validate();
  }

  @Test
  public void testEnergiesAndChannelsAreInverse() throws Exception {
    EnergyCalibration calibration = new EnergyCalibration(3.0, 1.5);
    assertArrayEquals("Energies follow slope * channel + intercept",
        new double[]{1.5, 4.5, 7.5}, calibration.energies(3), 1e-12);
    assertEquals("Channel of a channel's energy is that channel",
        220, calibration.channelOf(calibration.energyOf(220)));
    assertEquals("Channel lookup rounds to nearest", 220, calibration.channelOf(662.5));
  }
}
