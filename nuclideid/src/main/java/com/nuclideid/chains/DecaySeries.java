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

package com.nuclideid.chains;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.nuclideid.isotopes.Nuclide;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The three natural decay series.  Each carries its members in decay order (parent to stable end product), the
 * gamma energies of the members that serve as its key indicators, its abundance weight relative to the U-238 series,
 * and the parent/daughter pairs whose peak ratio indicates secular equilibrium.
 */
public enum DecaySeries {
  U238("U-238", 1.0, true,
      "U-238", "Th-234", "Pa-234m", "U-234", "Th-230", "Ra-226", "Rn-222", "Po-218", "Pb-214", "Bi-214",
      "Po-214", "Pb-210", "Bi-210", "Po-210", "Pb-206"),
  // Actinium series; 0.72% of natural uranium.
  U235("U-235", 0.0072, false,
      "U-235", "Th-231", "Pa-231", "Ac-227", "Th-227", "Ra-223", "Rn-219", "Po-215", "Pb-211", "Bi-211",
      "Tl-207", "Pb-207"),
  // Thorium is about 3.5 times as abundant as uranium in the crust.
  TH232("Th-232", 3.55, true,
      "Th-232", "Ra-228", "Ac-228", "Th-228", "Ra-224", "Rn-220", "Po-216", "Pb-212", "Bi-212", "Tl-208",
      "Po-212", "Pb-208"),
  ;

  static {
    U238.keyIndicator("Bi-214", 609.3, 1120.3, 1764.5)
        .keyIndicator("Pb-214", 351.9, 295.2, 241.0)
        .keyIndicator("Th-234", 63.3, 92.4)
        .keyIndicator("Pa-234m", 1001.0, 766.4)
        .keyIndicator("Ra-226", 186.2)
        .equilibriumPair("Pb-214", "Bi-214");

    U235.keyIndicator("U-235", 185.7, 143.8)
        .keyIndicator("Th-227", 236.0)
        .keyIndicator("Ra-223", 144.2)
        .keyIndicator("Th-231", 84.2, 163.3);

    TH232.keyIndicator("Tl-208", 2614.5, 583.2)
        .keyIndicator("Ac-228", 911.2, 968.9)
        .keyIndicator("Pb-212", 238.6)
        .keyIndicator("Bi-212", 727.0, 1621.0)
        .equilibriumPair("Ac-228", "Pb-212")
        .equilibriumPair("Bi-212", "Tl-208");
  }

  private final Nuclide parent;
  private final double abundanceWeight;
  // Whether confirming this series marks a sample as natural material for contextual suppression.
  private final boolean suppressesArtificialSources;
  private final List<Nuclide> members;
  private final Map<Nuclide, List<Double>> keyEnergies = new LinkedHashMap<>();
  private final List<Pair<Nuclide, Nuclide>> equilibriumPairs = new ArrayList<>();

  DecaySeries(String parent, double abundanceWeight, boolean suppressesArtificialSources, String... members) {
    this.parent = Nuclide.of(parent);
    this.abundanceWeight = abundanceWeight;
    this.suppressesArtificialSources = suppressesArtificialSources;
    this.members = Collections.unmodifiableList(
        Arrays.stream(members).map(Nuclide::of).collect(Collectors.toList()));
  }

  private DecaySeries keyIndicator(String member, Double... energiesKeV) {
    keyEnergies.put(Nuclide.of(member), Collections.unmodifiableList(Arrays.asList(energiesKeV)));
    return this;
  }

  private DecaySeries equilibriumPair(String parentMember, String daughterMember) {
    equilibriumPairs.add(Pair.of(Nuclide.of(parentMember), Nuclide.of(daughterMember)));
    return this;
  }

  /**
   * The name of the series' parent nuclide, which is also how series are named in JSON documents.
   */
  @JsonValue
  public String getName() {
    return parent.getName();
  }

  public Nuclide getParent() {
    return parent;
  }

  public double getAbundanceWeight() {
    return abundanceWeight;
  }

  public boolean suppressesArtificialSources() {
    return suppressesArtificialSources;
  }

  public List<Nuclide> getMembers() {
    return members;
  }

  public boolean isMember(Nuclide nuclide) {
    return members.contains(nuclide);
  }

  public Set<Nuclide> getKeyMembers() {
    return Collections.unmodifiableSet(keyEnergies.keySet());
  }

  public List<Double> getKeyEnergies(Nuclide member) {
    return keyEnergies.getOrDefault(member, Collections.emptyList());
  }

  public List<Pair<Nuclide, Nuclide>> getEquilibriumPairs() {
    return Collections.unmodifiableList(equilibriumPairs);
  }

  /**
   * Find the series whose parent is named {@code name}.
   * @throws IllegalArgumentException If no series has that parent.
   */
  @JsonCreator
  public static DecaySeries fromName(String name) {
    for (DecaySeries series : values()) {
      if (series.getName().equals(name)) {
        return series;
      }
    }
    throw new IllegalArgumentException(String.format("Unknown decay series: %s", name));
  }

  /**
   * Find the series a nuclide belongs to.  The three series are disjoint, so there is at most one.
   */
  public static Optional<DecaySeries> containing(Nuclide nuclide) {
    for (DecaySeries series : values()) {
      if (series.isMember(nuclide)) {
        return Optional.of(series);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return getName() + " series";
  }
}
