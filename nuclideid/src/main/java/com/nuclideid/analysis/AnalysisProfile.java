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

package com.nuclideid.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.nuclideid.background.SnipBackgroundEstimator;
import com.nuclideid.isotopes.EnergyTolerance;
import com.nuclideid.isotopes.LibraryTier;
import com.nuclideid.isotopes.SuppressionContext;
import com.nuclideid.peaks.PeakDetectorConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;

/**
 * Every threshold one analysis runs with.  Profiles start from an {@link AnalysisMode}'s defaults and may be
 * overridden field by field from a JSON file, e.g.
 * <pre>
 *   {"version": "site-7", "tolerance_kev": 15.0, "peak_detector": {"distance": 6}}
 * </pre>
 * Fields absent from the file keep the mode's values.
 */
public class AnalysisProfile {
  private static final Logger LOGGER = LogManager.getFormatterLogger(AnalysisProfile.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  public static final String DEFAULT_VERSION = "v1";
  public static final double DEFAULT_BASE_RESOLUTION = 0.075;
  public static final double DEFAULT_DYNAMIC_MIN_TOLERANCE_KEV = 5.0;

  @JsonProperty(value = "mode", access = JsonProperty.Access.READ_ONLY)
  private AnalysisMode mode;

  @JsonProperty("version")
  private String version = DEFAULT_VERSION;

  @JsonProperty("tolerance_kev")
  private double toleranceKeV;

  // When set, the window follows detector resolution instead of tolerance_kev.
  @JsonProperty("dynamic_tolerance")
  private boolean dynamicTolerance = false;

  @JsonProperty("base_resolution")
  private double baseResolution = DEFAULT_BASE_RESOLUTION;

  @JsonProperty("dynamic_min_tolerance_kev")
  private double dynamicMinToleranceKeV = DEFAULT_DYNAMIC_MIN_TOLERANCE_KEV;

  @JsonProperty("isotope_floor")
  private double isotopeFloor;

  @JsonProperty("chain_member_floor")
  private double chainMemberFloor;

  // Null means no cap.
  @JsonProperty("result_cap")
  private Integer resultCap;

  @JsonProperty("suppression_factor")
  private double suppressionFactor = SuppressionContext.DEFAULT_FACTOR;

  @JsonProperty("library_tier")
  private LibraryTier libraryTier;

  @JsonMerge
  @JsonProperty("peak_detector")
  private PeakDetectorConfig peakDetector = new PeakDetectorConfig();

  @JsonProperty("subtract_background")
  private boolean subtractBackground = false;

  @JsonProperty("snip_iterations")
  private int snipIterations = SnipBackgroundEstimator.DEFAULT_ITERATIONS;

  @JsonProperty("fit_peaks")
  private boolean fitPeaks = false;

  private AnalysisProfile() {

  }

  AnalysisProfile(AnalysisMode mode, double toleranceKeV, double isotopeFloor, double chainMemberFloor,
                  Integer resultCap, LibraryTier libraryTier) {
    this.mode = mode;
    this.toleranceKeV = toleranceKeV;
    this.isotopeFloor = isotopeFloor;
    this.chainMemberFloor = chainMemberFloor;
    this.resultCap = resultCap;
    this.libraryTier = libraryTier;
  }

  /**
   * Apply the overrides in {@code file} on top of this profile.
   * @return This profile, updated and validated.
   */
  public AnalysisProfile override(File file) throws IOException {
    try {
      OBJECT_MAPPER.readerForUpdating(this).readValue(file);
    } catch (MismatchedInputException e) {
      throw new IOException(String.format("Profile override %s is malformed: %s",
          file.getPath(), e.getOriginalMessage()), e);
    }
    validate();
    LOGGER.info("Applied profile overrides from %s to %s profile, now version %s", file.getPath(), mode, version);
    return this;
  }

  public void validate() {
    if (!(toleranceKeV > 0.0)) {
      throw new IllegalArgumentException(String.format("Tolerance must be positive, got %f keV", toleranceKeV));
    }
    if (!(baseResolution > 0.0) || !(dynamicMinToleranceKeV > 0.0)) {
      throw new IllegalArgumentException(String.format(
          "Dynamic tolerance settings must be positive (resolution %f, minimum %f keV)",
          baseResolution, dynamicMinToleranceKeV));
    }
    if (isotopeFloor < 0.0 || chainMemberFloor < 0.0) {
      throw new IllegalArgumentException(String.format(
          "Confidence floors must be non-negative (isotope %f, chain member %f)", isotopeFloor, chainMemberFloor));
    }
    if (resultCap != null && resultCap < 1) {
      throw new IllegalArgumentException(String.format("Result cap must be at least 1, got %d", resultCap));
    }
    if (!(suppressionFactor >= 0.0 && suppressionFactor <= 1.0)) {
      throw new IllegalArgumentException(String.format(
          "Suppression factor must lie in [0, 1], got %f", suppressionFactor));
    }
    if (libraryTier == null) {
      throw new IllegalArgumentException("A library tier is required");
    }
    if (snipIterations < 0) {
      throw new IllegalArgumentException(String.format("SNIP iterations must be non-negative, got %d",
          snipIterations));
    }
    peakDetector.validate();
  }

  @JsonIgnore
  public EnergyTolerance getEnergyTolerance() {
    if (dynamicTolerance) {
      return EnergyTolerance.resolutionScaled(baseResolution, dynamicMinToleranceKeV);
    }
    return EnergyTolerance.fixed(toleranceKeV);
  }

  public AnalysisMode getMode() {
    return mode;
  }

  public String getVersion() {
    return version;
  }

  public double getToleranceKeV() {
    return toleranceKeV;
  }

  public boolean isDynamicTolerance() {
    return dynamicTolerance;
  }

  public void setDynamicTolerance(boolean dynamicTolerance) {
    this.dynamicTolerance = dynamicTolerance;
  }

  public double getBaseResolution() {
    return baseResolution;
  }

  public double getIsotopeFloor() {
    return isotopeFloor;
  }

  public double getChainMemberFloor() {
    return chainMemberFloor;
  }

  public Integer getResultCap() {
    return resultCap;
  }

  public double getSuppressionFactor() {
    return suppressionFactor;
  }

  public LibraryTier getLibraryTier() {
    return libraryTier;
  }

  public PeakDetectorConfig getPeakDetector() {
    return peakDetector;
  }

  public boolean isSubtractBackground() {
    return subtractBackground;
  }

  public void setSubtractBackground(boolean subtractBackground) {
    this.subtractBackground = subtractBackground;
  }

  public int getSnipIterations() {
    return snipIterations;
  }

  public boolean isFitPeaks() {
    return fitPeaks;
  }

  public void setFitPeaks(boolean fitPeaks) {
    this.fitPeaks = fitPeaks;
  }

  public AnalysisProfile copy() {
    AnalysisProfile copy = new AnalysisProfile();
    copy.mode = mode;
    copy.version = version;
    copy.toleranceKeV = toleranceKeV;
    copy.dynamicTolerance = dynamicTolerance;
    copy.baseResolution = baseResolution;
    copy.dynamicMinToleranceKeV = dynamicMinToleranceKeV;
    copy.isotopeFloor = isotopeFloor;
    copy.chainMemberFloor = chainMemberFloor;
    copy.resultCap = resultCap;
    copy.suppressionFactor = suppressionFactor;
    copy.libraryTier = libraryTier;
    copy.peakDetector = peakDetector.copy();
    copy.subtractBackground = subtractBackground;
    copy.snipIterations = snipIterations;
    copy.fitPeaks = fitPeaks;
    return copy;
  }
}
