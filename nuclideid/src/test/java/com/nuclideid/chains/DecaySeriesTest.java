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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nuclideid.isotopes.Nuclide;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class DecaySeriesTest {

  @Test
  public void testLookupByName() {
    assertEquals(DecaySeries.TH232, DecaySeries.fromName("Th-232"));
    assertEquals(Nuclide.of("U-238"), DecaySeries.fromName("U-238").getParent());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMemberIsNotASeriesName() {
    DecaySeries.fromName("Th-231");
  }

  @Test
  public void testContaining() {
    assertEquals(DecaySeries.U238, DecaySeries.containing(Nuclide.of("Pb-214")).get());
    assertEquals(DecaySeries.U235, DecaySeries.containing(Nuclide.of("Ra-223")).get());
    assertEquals(DecaySeries.TH232, DecaySeries.containing(Nuclide.of("Tl-208")).get());
    assertFalse(DecaySeries.containing(Nuclide.of("Cs-137")).isPresent());
    assertFalse(DecaySeries.containing(Nuclide.of("K-40")).isPresent());
  }

  @Test
  public void testMembersStartWithTheParent() {
    for (DecaySeries series : DecaySeries.values()) {
      assertEquals(series.getParent(), series.getMembers().get(0));
      for (Nuclide key : series.getKeyMembers()) {
        assertTrue(String.format("Key member %s belongs to %s", key, series), series.isMember(key));
        assertFalse(series.getKeyEnergies(key).isEmpty());
      }
    }
  }

  @Test
  public void testOnlyAbundantSeriesSuppress() {
    assertTrue(DecaySeries.U238.suppressesArtificialSources());
    assertTrue(DecaySeries.TH232.suppressesArtificialSources());
    assertFalse(DecaySeries.U235.suppressesArtificialSources());
  }

  @Test
  public void testJsonUsesTheParentName() throws Exception {
    ObjectMapper mapper = new ObjectMapper();
    assertEquals("\"Th-232\"", mapper.writeValueAsString(DecaySeries.TH232));
    assertEquals(DecaySeries.U235, mapper.readValue("\"U-235\"", DecaySeries.class));
  }
}
