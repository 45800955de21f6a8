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

package com.nuclideid.decay;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nuclideid.isotopes.Nuclide;
import com.nuclideid.isotopes.RegistryLoadException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Half-lives and linear decay sequences used by the decay predictor.  Read-only once built.
 */
public class DecayDataTable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DecayDataTable.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final String BUNDLED_DATA_RESOURCE = "/decay_data.json";

  private final Map<Nuclide, Double> halfLivesSeconds;
  // Sequence name to its members, parent first.
  private final Map<String, List<ChainMember>> sequences;

  public DecayDataTable(Map<Nuclide, Double> halfLivesSeconds, Map<String, List<Nuclide>> sequences,
                        Map<Nuclide, Double> branchingToNext) {
    this.halfLivesSeconds = Collections.unmodifiableMap(new LinkedHashMap<>(halfLivesSeconds));

    Map<String, List<ChainMember>> built = new LinkedHashMap<>();
    for (Map.Entry<String, List<Nuclide>> entry : sequences.entrySet()) {
      List<ChainMember> members = new ArrayList<>(entry.getValue().size());
      for (Nuclide nuclide : entry.getValue()) {
        members.add(new ChainMember(
            nuclide, halfLivesSeconds.get(nuclide), branchingToNext.getOrDefault(nuclide, 1.0)));
      }
      built.put(entry.getKey(), Collections.unmodifiableList(members));
    }
    this.sequences = Collections.unmodifiableMap(built);
  }

  public static DecayDataTable loadBundled() throws RegistryLoadException {
    try (InputStream in = DecayDataTable.class.getResourceAsStream(BUNDLED_DATA_RESOURCE)) {
      if (in == null) {
        throw new RegistryLoadException(
            String.format("Bundled decay data %s is missing from the classpath", BUNDLED_DATA_RESOURCE));
      }
      return load(in, BUNDLED_DATA_RESOURCE);
    } catch (IOException e) {
      throw new RegistryLoadException(String.format("Unable to read decay data %s", BUNDLED_DATA_RESOURCE), e);
    }
  }

  public static DecayDataTable load(InputStream in, String source) throws IOException, RegistryLoadException {
    DataDocument document;
    try {
      document = OBJECT_MAPPER.readValue(in, DataDocument.class);
    } catch (JsonProcessingException e) {
      throw new RegistryLoadException(
          String.format("Decay data %s is malformed: %s", source, e.getOriginalMessage()), e);
    }
    if (document.halfLives == null || document.chains == null) {
      throw new RegistryLoadException(String.format("Decay data %s needs both 'half_lives_s' and 'chains'", source));
    }

    Map<String, List<Nuclide>> sequences = new LinkedHashMap<>();
    Map<Nuclide, Double> branching = new LinkedHashMap<>();
    for (SequenceDocument chain : document.chains) {
      if (chain.name == null || chain.sequence == null || chain.sequence.isEmpty()) {
        throw new RegistryLoadException(String.format("Decay data %s has an unnamed or empty chain", source));
      }
      List<Nuclide> members = new ArrayList<>(chain.sequence.size());
      for (MemberDocument member : chain.sequence) {
        if (member == null || member.nuclide == null) {
          throw new RegistryLoadException(String.format("Chain %s in %s has a member without a nuclide",
              chain.name, source));
        }
        members.add(member.nuclide);
        if (member.branchingToNext != null) {
          branching.put(member.nuclide, member.branchingToNext);
        }
      }
      sequences.put(chain.name, members);
    }

    try {
      Map<Nuclide, Double> halfLives = new LinkedHashMap<>();
      for (Map.Entry<String, Double> entry : document.halfLives.entrySet()) {
        halfLives.put(Nuclide.of(entry.getKey()), entry.getValue());
      }
      DecayDataTable table = new DecayDataTable(halfLives, sequences, branching);
      LOGGER.info("Loaded %d half-lives and %d decay sequences from %s",
          table.halfLivesSeconds.size(), table.sequences.size(), source);
      return table;
    } catch (IllegalArgumentException e) {
      throw new RegistryLoadException(String.format("Decay data %s is invalid: %s", source, e.getMessage()), e);
    }
  }

  public Optional<Double> getHalfLifeSeconds(Nuclide nuclide) {
    return Optional.ofNullable(halfLivesSeconds.get(nuclide));
  }

  public Map<String, List<ChainMember>> getSequences() {
    return sequences;
  }

  /**
   * Get the decay sequence that starts at {@code start}: the tail of the first sequence containing it, or a single
   * member when it belongs to no sequence but has a known half-life.
   * @return The members from {@code start} onwards, or an empty list if nothing is known about the nuclide.
   */
  public List<ChainMember> sequenceFrom(Nuclide start) {
    for (List<ChainMember> members : sequences.values()) {
      for (int i = 0; i < members.size(); i++) {
        if (members.get(i).getNuclide().equals(start)) {
          return members.subList(i, members.size());
        }
      }
    }
    Double halfLife = halfLivesSeconds.get(start);
    if (halfLife != null) {
      return Collections.singletonList(new ChainMember(start, halfLife, 1.0));
    }
    return Collections.emptyList();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static class DataDocument {
    @JsonProperty("half_lives_s")
    private Map<String, Double> halfLives;

    @JsonProperty("chains")
    private List<SequenceDocument> chains;
  }

  private static class SequenceDocument {
    @JsonProperty("name")
    private String name;

    @JsonProperty("sequence")
    private List<MemberDocument> sequence;
  }

  private static class MemberDocument {
    @JsonProperty("nuclide")
    private Nuclide nuclide;

    // Absent for the last member of a sequence.
    @JsonProperty("branching_to_next")
    private Double branchingToNext;
  }
}
