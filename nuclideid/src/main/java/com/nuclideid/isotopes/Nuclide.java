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
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A validated, interned nuclide identifier such as {@code Cs-137} or {@code Pa-234m}.  Two handles for the same name
 * are the same object, so they may be compared with either {@code ==} or {@link #equals}.
 */
public final class Nuclide implements Comparable<Nuclide>, Serializable {
  private static final long serialVersionUID = 6031729215845203371L;

  // Element symbol, a dash, the mass number and an optional metastable marker.
  private static final Pattern NAME_PATTERN = Pattern.compile("^([A-Z][a-z]?)-(\\d{1,3})(m?)$");

  private static final Map<String, Nuclide> INTERNED = new ConcurrentHashMap<>();

  private final String name;
  private final String element;
  private final int massNumber;
  private final boolean metastable;

  private Nuclide(String name, String element, int massNumber, boolean metastable) {
    this.name = name;
    this.element = element;
    this.massNumber = massNumber;
    this.metastable = metastable;
  }

  /**
   * Get the handle for a nuclide name.
   * @throws IllegalArgumentException If the name is not of the form Symbol-A or Symbol-Am.
   */
  @JsonCreator
  public static Nuclide of(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Nuclide name must not be null");
    }
    Nuclide existing = INTERNED.get(name);
    if (existing != null) {
      return existing;
    }

    Matcher matcher = NAME_PATTERN.matcher(name);
    if (!matcher.matches()) {
      throw new IllegalArgumentException(String.format("Invalid nuclide name: '%s'", name));
    }
    Nuclide nuclide = new Nuclide(name, matcher.group(1), Integer.parseInt(matcher.group(2)),
        !matcher.group(3).isEmpty());
    return INTERNED.computeIfAbsent(name, k -> nuclide);
  }

  public static boolean isValidName(String name) {
    return name != null && NAME_PATTERN.matcher(name).matches();
  }

  @JsonValue
  public String getName() {
    return name;
  }

  public String getElement() {
    return element;
  }

  public int getMassNumber() {
    return massNumber;
  }

  public boolean isMetastable() {
    return metastable;
  }

  @Override
  public int compareTo(Nuclide o) {
    return name.compareTo(o.name);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    return name.equals(((Nuclide) o).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }

  private Object readResolve() {
    return of(name);
  }
}
