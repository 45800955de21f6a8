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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * The canonical JSON form of a spectrum, as handed over by the file parsers and device drivers:
 * <pre>
 *   {"counts": [0, 3, 7, ...], "calibration": {"slope": 3.0, "intercept": 0.0}, "live_time_s": 300.0}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpectrumDocument {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      // Fractional counts are a validation failure, not something to round away.
      .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

  @JsonProperty("counts")
  private int[] counts;

  @JsonProperty("calibration")
  private EnergyCalibration calibration;

  @JsonProperty("live_time_s")
  private Double liveTimeSeconds;

  @JsonProperty("source")
  private String source;

  protected SpectrumDocument() {

  }

  public SpectrumDocument(int[] counts, EnergyCalibration calibration, Double liveTimeSeconds, String source) {
    this.counts = counts;
    this.calibration = calibration;
    this.liveTimeSeconds = liveTimeSeconds;
    this.source = source;
  }

  public static SpectrumDocument read(File file) throws IOException, SpectrumValidationException {
    try {
      return OBJECT_MAPPER.readValue(file, SpectrumDocument.class);
    } catch (MismatchedInputException e) {
      throw new SpectrumValidationException(
          String.format("Spectrum document %s is malformed: %s", file.getPath(), e.getOriginalMessage()), e);
    }
  }

  public static SpectrumDocument read(InputStream in) throws IOException, SpectrumValidationException {
    try {
      return OBJECT_MAPPER.readValue(in, SpectrumDocument.class);
    } catch (MismatchedInputException e) {
      throw new SpectrumValidationException(
          String.format("Spectrum document is malformed: %s", e.getOriginalMessage()), e);
    }
  }

  /**
   * Convert to a spectrum of {@code channelCount} channels, padding or truncating as documented on
   * {@link Spectrum#conform}.
   */
  public Spectrum toSpectrum(int channelCount) throws SpectrumValidationException {
    return Spectrum.conform(counts, calibration, channelCount);
  }

  /**
   * Convert to a spectrum that keeps the document's own channel count.
   */
  public Spectrum toSpectrum() throws SpectrumValidationException {
    return Spectrum.of(counts, calibration);
  }

  public int[] getCounts() {
    return counts;
  }

  public EnergyCalibration getCalibration() {
    return calibration;
  }

  public Double getLiveTimeSeconds() {
    return liveTimeSeconds;
  }

  public String getSource() {
    return source;
  }
}
