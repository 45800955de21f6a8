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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The read-only map of nuclide to gamma data used by every analysis.  A registry is built once, from the bundled
 * library optionally merged with user-defined entries, and never changes afterwards; it can be shared freely between
 * threads.
 */
public class IsotopeRegistry {
  private static final Logger LOGGER = LogManager.getFormatterLogger(IsotopeRegistry.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final String BUNDLED_LIBRARY_RESOURCE = "/isotope_library.json";

  private final Map<Nuclide, IsotopeRecord> records;

  public IsotopeRegistry(Collection<IsotopeRecord> records) {
    Map<Nuclide, IsotopeRecord> byName = new LinkedHashMap<>();
    for (IsotopeRecord record : records) {
      byName.put(record.getName(), record);
    }
    this.records = Collections.unmodifiableMap(byName);
  }

  /**
   * Load the library bundled with this package.
   */
  public static IsotopeRegistry loadBundled() throws RegistryLoadException {
    try (InputStream in = IsotopeRegistry.class.getResourceAsStream(BUNDLED_LIBRARY_RESOURCE)) {
      if (in == null) {
        throw new RegistryLoadException(
            String.format("Bundled isotope library %s is missing from the classpath", BUNDLED_LIBRARY_RESOURCE));
      }
      IsotopeRegistry registry = new IsotopeRegistry(readRecords(in, BUNDLED_LIBRARY_RESOURCE));
      LOGGER.info("Loaded %d isotopes from the bundled library", registry.size());
      return registry;
    } catch (IOException e) {
      throw new RegistryLoadException(
          String.format("Unable to read bundled isotope library %s", BUNDLED_LIBRARY_RESOURCE), e);
    }
  }

  /**
   * Load the bundled library and merge the user-defined entries in {@code userFile} over it, if a file is given.
   */
  public static IsotopeRegistry load(File userFile) throws RegistryLoadException {
    IsotopeRegistry bundled = loadBundled();
    return userFile == null ? bundled : bundled.mergeUserDefined(userFile);
  }

  /**
   * Build a new registry with the entries of a user-defined isotope file added.  A user entry replaces a bundled
   * entry of the same name.
   * @param userFile A JSON document of the form {"isotopes": [{"name": ..., "lines": [...], "category": ...}]}.
   */
  public IsotopeRegistry mergeUserDefined(File userFile) throws RegistryLoadException {
    List<IsotopeRecord> userRecords;
    try (InputStream in = new FileInputStream(userFile)) {
      userRecords = readRecords(in, userFile.getPath());
    } catch (IOException e) {
      throw new RegistryLoadException(String.format("Unable to read user isotope file %s", userFile.getPath()), e);
    }
    return mergeUserDefined(userRecords);
  }

  public IsotopeRegistry mergeUserDefined(List<IsotopeRecord> userRecords) {
    Map<Nuclide, IsotopeRecord> merged = new LinkedHashMap<>(records);
    for (IsotopeRecord record : userRecords) {
      if (merged.containsKey(record.getName())) {
        LOGGER.warn("User-defined entry for %s overrides the bundled one", record.getName());
      }
      merged.put(record.getName(), record.asUserDefined());
    }
    LOGGER.info("Merged %d user-defined isotopes, registry now holds %d", userRecords.size(), merged.size());
    return new IsotopeRegistry(merged.values());
  }

  private static List<IsotopeRecord> readRecords(InputStream in, String source)
      throws IOException, RegistryLoadException {
    LibraryDocument document;
    try {
      document = OBJECT_MAPPER.readValue(in, LibraryDocument.class);
    } catch (JsonProcessingException e) {
      throw new RegistryLoadException(
          String.format("Isotope library %s is malformed: %s", source, e.getOriginalMessage()), e);
    }
    if (document.isotopes == null) {
      throw new RegistryLoadException(String.format("Isotope library %s has no 'isotopes' list", source));
    }

    List<IsotopeRecord> records = new ArrayList<>(document.isotopes.size());
    for (IsotopeRecord record : document.isotopes) {
      if (record == null) {
        throw new RegistryLoadException(String.format("Isotope library %s contains a null entry", source));
      }
      // Pure beta emitters and the like have nothing to match against.
      if (!record.hasLines()) {
        LOGGER.warn("Skipping %s from %s: no gamma lines", record.getName(), source);
        continue;
      }
      records.add(record);
    }
    return records;
  }

  public Optional<IsotopeRecord> get(Nuclide name) {
    return Optional.ofNullable(records.get(name));
  }

  public boolean contains(Nuclide name) {
    return records.containsKey(name);
  }

  public Collection<IsotopeRecord> getRecords() {
    return records.values();
  }

  /**
   * Get the records an analysis restricted to {@code tier} may use.
   */
  public List<IsotopeRecord> getRecords(LibraryTier tier) {
    return records.values().stream().
        filter(record -> tier.includes(record.getTier())).
        collect(Collectors.toList());
  }

  public int size() {
    return records.size();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static class LibraryDocument {
    @JsonProperty("version")
    private String version;

    @JsonProperty("isotopes")
    private List<IsotopeRecord> isotopes;
  }
}
