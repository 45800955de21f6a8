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

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class SpectrumTest {
  private static final EnergyCalibration CALIBRATION = new EnergyCalibration(3.0, 0.0);

  private static InputStream json(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test(expected = SpectrumValidationException.class)
  public void testNegativeCountsAreRejected() throws Exception {
    Spectrum.of(new int[]{1, 2, -3, 4}, CALIBRATION);
  }

  @Test(expected = SpectrumValidationException.class)
  public void testMissingCalibrationIsRejected() throws Exception {
    Spectrum.of(new int[]{1, 2, 3}, null);
  }

  @Test(expected = SpectrumValidationException.class)
  public void testZeroSlopeIsRejected() throws Exception {
    Spectrum.of(new int[]{1, 2, 3}, new EnergyCalibration(0.0, 10.0));
  }

  @Test
  public void testConformPadsAndTruncates() throws Exception {
    Spectrum padded = Spectrum.conform(new int[]{4, 5, 6}, CALIBRATION, 5);
    assertArrayEquals("Short spectra are zero-padded at the high end", new int[]{4, 5, 6, 0, 0}, padded.getCounts());

    Spectrum truncated = Spectrum.conform(new int[]{4, 5, 6, 7, 8, 9}, CALIBRATION, 4);
    assertArrayEquals("Long spectra are truncated", new int[]{4, 5, 6, 7}, truncated.getCounts());
  }

  @Test
  public void testSummaryAccessors() throws Exception {
    Spectrum spectrum = Spectrum.of(new int[]{0, 7, 3, 0}, CALIBRATION);
    assertEquals(4, spectrum.size());
    assertEquals(7, spectrum.getMaxCount());
    assertEquals(10L, spectrum.getTotalCounts());
    assertFalse(spectrum.isEmpty());
    assertTrue("All-zero spectra are empty", Spectrum.of(new int[4], CALIBRATION).isEmpty());
    assertArrayEquals(new double[]{0.0, 3.0, 6.0, 9.0}, spectrum.getEnergies(), 1e-12);
  }

  @Test
  public void testCountsAreCopied() throws Exception {
    int[] counts = {1, 2, 3};
    Spectrum spectrum = Spectrum.of(counts, CALIBRATION);
    counts[0] = 100;
    spectrum.getCounts()[1] = 100;
    assertArrayEquals("Spectrum is unaffected by changes to input or output arrays",
        new int[]{1, 2, 3}, spectrum.getCounts());
  }

  @Test
  public void testEqualityCoversCountsAndCalibration() throws Exception {
    Spectrum a = Spectrum.of(new int[]{1, 2, 3}, CALIBRATION);
    assertEquals(a, Spectrum.of(new int[]{1, 2, 3}, new EnergyCalibration(3.0, 0.0)));
    assertEquals(a.hashCode(), Spectrum.of(new int[]{1, 2, 3}, new EnergyCalibration(3.0, 0.0)).hashCode());
    assertNotEquals(a, Spectrum.of(new int[]{1, 2, 4}, CALIBRATION));
    assertNotEquals(a, Spectrum.of(new int[]{1, 2, 3}, new EnergyCalibration(3.0, 1.0)));
  }

  @Test
  public void testDocumentIsReadIntoSpectrum() throws Exception {
    SpectrumDocument document = SpectrumDocument.read(json(
        "{\"counts\": [0, 5, 9, 2], \"calibration\": {\"slope\": 2.5, \"intercept\": 1.0}, " +
            "\"live_time_s\": 300.0, \"source\": \"detector-1\", \"extra\": true}"));
    assertEquals(Double.valueOf(300.0), document.getLiveTimeSeconds());
    assertEquals("detector-1", document.getSource());

    Spectrum spectrum = document.toSpectrum();
    assertArrayEquals(new int[]{0, 5, 9, 2}, spectrum.getCounts());
    assertEquals(new EnergyCalibration(2.5, 1.0), spectrum.getCalibration());

    assertEquals("Documents can be conformed to a channel count", 8, document.toSpectrum(8).size());
  }

  @Test(expected = SpectrumValidationException.class)
  public void testDocumentWithFractionalCountsIsRejected() throws Exception {
    SpectrumDocument.read(json("{\"counts\": [0, 5.5, 9], \"calibration\": {\"slope\": 3.0, \"intercept\": 0.0}}"));
  }

  @Test(expected = SpectrumValidationException.class)
  public void testDocumentWithTextCountsIsRejected() throws Exception {
    SpectrumDocument.read(json("{\"counts\": [0, \"x\", 9], \"calibration\": {\"slope\": 3.0, \"intercept\": 0.0}}"));
  }

  @Test(expected = SpectrumValidationException.class)
  public void testDocumentWithNegativeCountsIsRejectedOnConversion() throws Exception {
    SpectrumDocument.read(json("{\"counts\": [0, -5, 9], \"calibration\": {\"slope\": 3.0, \"intercept\": 0.0}}"))
        .toSpectrum();
  }
}
