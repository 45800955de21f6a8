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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nuclideid.chains.DecaySeries;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Authoritative gamma data for one nuclide.  Lines keep their library order; a repeated energy keeps its first entry.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IsotopeRecord {

  @JsonProperty("name")
  private final Nuclide name;

  @JsonProperty("lines")
  private final List<IsotopeLine> lines;

  @JsonProperty("category")
  private final IsotopeCategory category;

  @JsonProperty("tier")
  private final LibraryTier tier;

  // Null for nuclides outside the natural decay series.
  @JsonProperty("chain")
  private final DecaySeries chain;

  @JsonIgnore
  private final boolean userDefined;

  @JsonCreator
  public IsotopeRecord(@JsonProperty("name") Nuclide name,
                       @JsonProperty("lines") List<IsotopeLine> lines,
                       @JsonProperty("category") IsotopeCategory category,
                       @JsonProperty("tier") LibraryTier tier,
                       @JsonProperty("chain") DecaySeries chain) {
    this(name, lines, category, tier, chain, false);
  }

  private IsotopeRecord(Nuclide name, List<IsotopeLine> lines, IsotopeCategory category, LibraryTier tier,
                        DecaySeries chain, boolean userDefined) {
    if (name == null) {
      throw new IllegalArgumentException("Isotope record has no name");
    }
    if (category == null) {
      throw new IllegalArgumentException(String.format("Isotope record %s has no category", name));
    }
    if (chain != null && !chain.isMember(name)) {
      throw new IllegalArgumentException(String.format("%s is not a member of the %s", name, chain));
    }

    Map<Double, IsotopeLine> byEnergy = new LinkedHashMap<>();
    if (lines != null) {
      for (IsotopeLine line : lines) {
        byEnergy.putIfAbsent(line.getEnergyKeV(), line);
      }
    }

    this.name = name;
    this.lines = Collections.unmodifiableList(new ArrayList<>(byEnergy.values()));
    this.category = category;
    this.tier = tier == null ? LibraryTier.COMMON : tier;
    this.chain = chain;
    this.userDefined = userDefined;
  }

  /**
   * Mark a record as coming from a user-defined isotope file.
   */
  public IsotopeRecord asUserDefined() {
    return new IsotopeRecord(name, lines, category, tier, chain, true);
  }

  public Nuclide getName() {
    return name;
  }

  public List<IsotopeLine> getLines() {
    return lines;
  }

  public int getLineCount() {
    return lines.size();
  }

  public boolean hasLines() {
    return !lines.isEmpty();
  }

  public IsotopeCategory getCategory() {
    return category;
  }

  public LibraryTier getTier() {
    return tier;
  }

  public DecaySeries getChain() {
    return chain;
  }

  public boolean isUserDefined() {
    return userDefined;
  }

  /**
   * Natural nuclides that belong to none of the decay series, like K-40.  They occur in every sample regardless of
   * which series are present.
   */
  @JsonIgnore
  public boolean isStandaloneNatural() {
    return category == IsotopeCategory.NATURAL && chain == null;
  }

  /**
   * The nuclide's natural abundance relative to the U-238 series: its series' weight, or 1 outside the series.
   */
  @JsonIgnore
  public double getAbundanceWeight() {
    return chain == null ? 1.0 : chain.getAbundanceWeight();
  }

  @Override
  public String toString() {
    return String.format("IsotopeRecord{%s, %d lines, %s, %s}", name, lines.size(), category, tier);
  }
}
