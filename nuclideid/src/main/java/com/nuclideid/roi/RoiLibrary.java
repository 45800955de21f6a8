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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nuclideid.isotopes.RegistryLoadException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detector efficiency tables and region-of-interest definitions for quantitative analysis.  Read-only once loaded.
 */
public class RoiLibrary {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RoiLibrary.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final String BUNDLED_LIBRARY_RESOURCE = "/roi_library.json";
  public static final String DEFAULT_DETECTOR = "AlphaHound CsI(Tl)";

  private final Map<String, DetectorEfficiency> detectors;
  private final Map<String, RoiDefinition> regions;

  public RoiLibrary(List<DetectorEfficiency> detectors, List<RoiDefinition> regions) {
    Map<String, DetectorEfficiency> detectorsByName = new LinkedHashMap<>();
    for (DetectorEfficiency detector : detectors) {
      if (detectorsByName.put(detector.getName(), detector) != null) {
        throw new IllegalArgumentException(String.format("Detector %s is defined twice", detector.getName()));
      }
    }
    Map<String, RoiDefinition> regionsByName = new LinkedHashMap<>();
    for (RoiDefinition region : regions) {
      if (regionsByName.put(region.getName(), region) != null) {
        throw new IllegalArgumentException(String.format("Region %s is defined twice", region.getName()));
      }
    }
    this.detectors = Collections.unmodifiableMap(detectorsByName);
    this.regions = Collections.unmodifiableMap(regionsByName);
  }

  public static RoiLibrary loadBundled() throws RegistryLoadException {
    try (InputStream in = RoiLibrary.class.getResourceAsStream(BUNDLED_LIBRARY_RESOURCE)) {
      if (in == null) {
        throw new RegistryLoadException(
            String.format("Bundled ROI library %s is missing from the classpath", BUNDLED_LIBRARY_RESOURCE));
      }
      return load(in, BUNDLED_LIBRARY_RESOURCE);
    } catch (IOException e) {
      throw new RegistryLoadException(
          String.format("Unable to read ROI library %s", BUNDLED_LIBRARY_RESOURCE), e);
    }
  }

  public static RoiLibrary load(InputStream in, String source) throws IOException, RegistryLoadException {
    LibraryDocument document;
    try {
      document = OBJECT_MAPPER.readValue(in, LibraryDocument.class);
    } catch (JsonProcessingException e) {
      throw new RegistryLoadException(
          String.format("ROI library %s is malformed: %s", source, e.getOriginalMessage()), e);
    }
    if (document.detectors == null || document.regions == null) {
      throw new RegistryLoadException(
          String.format("ROI library %s needs both 'detectors' and 'regions'", source));
    }

    try {
      RoiLibrary library = new RoiLibrary(document.detectors, document.regions);
      LOGGER.info("Loaded %d detectors and %d regions of interest from %s",
          library.detectors.size(), library.regions.size(), source);
      return library;
    } catch (IllegalArgumentException e) {
      throw new RegistryLoadException(String.format("ROI library %s is invalid: %s", source, e.getMessage()), e);
    }
  }

  public Optional<DetectorEfficiency> getDetector(String name) {
    return Optional.ofNullable(detectors.get(name));
  }

  public Collection<DetectorEfficiency> getDetectors() {
    return detectors.values();
  }

  public Optional<RoiDefinition> getRegion(String name) {
    return Optional.ofNullable(regions.get(name));
  }

  public Collection<RoiDefinition> getRegions() {
    return regions.values();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static class LibraryDocument {
    @JsonProperty("detectors")
    private List<DetectorEfficiency> detectors;

    @JsonProperty("regions")
    private List<RoiDefinition> regions;
  }
}
