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

package com.nuclideid.background;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class BackgroundSubtractorTest {

  @Test
  public void testScaledSubtractionClampsAtZero() {
    BackgroundEstimate estimate = new BackgroundSubtractor(2.0).subtract(
        new double[]{10.0, 20.0, 5.0}, new double[]{2.0, 5.0, 4.0});
    assertArrayEquals("Background is scaled", new double[]{4.0, 10.0, 8.0}, estimate.getBackground(), 1e-9);
    assertArrayEquals("Net counts never go negative", new double[]{6.0, 10.0, 0.0}, estimate.getNetCounts(), 1e-9);
    assertEquals(BackgroundEstimate.Algorithm.SUBTRACTION, estimate.getAlgorithm());
    assertNull("Subtraction has no iteration count", estimate.getIterations());
  }

  @Test
  public void testMismatchedLengthsAreTrimmed() {
    BackgroundEstimate estimate = new BackgroundSubtractor(1.0).subtract(
        new double[]{10.0, 20.0, 30.0, 40.0}, new double[]{1.0, 2.0});
    assertEquals("Both spectra are trimmed to the shorter", 2, estimate.size());
    assertArrayEquals(new double[]{9.0, 18.0}, estimate.getNetCounts(), 1e-9);
  }

  @Test
  public void testLiveTimeScaling() {
    assertEquals("A 600 s background is halved for a 300 s source",
        0.5, BackgroundSubtractor.forLiveTimes(300.0, 600.0).getScalingFactor(), 1e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroBackgroundLiveTimeIsRejected() {
    BackgroundSubtractor.forLiveTimes(300.0, 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeScalingIsRejected() {
    new BackgroundSubtractor(-1.0);
  }
}
