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

package com.twentyn.bigsmiles.chemistry;

import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ElementTableTest {
  private ElementTable table;

  @Before
  public void setUp() throws Exception {
    table = ElementTable.getInstance();
  }

  @Test
  public void testLookup() throws Exception {
    Element carbon = table.lookup("C").get();
    assertEquals(Integer.valueOf(6), carbon.getAtomicNumber());
    assertEquals(carbon, table.lookup("c").get());
    assertTrue(table.isAromaticSymbol("c"));
    assertFalse(table.isAromaticSymbol("C"));
    assertFalse(table.lookup("Xx").isPresent());
    assertTrue(table.lookup("Og").isPresent());
  }

  @Test
  public void testOrganicSymbolsLongestFirst() throws Exception {
    List<String> organic = table.getOrganicSymbols();
    assertTrue(organic.contains("Cl"));
    assertTrue(organic.contains("Br"));
    assertFalse(organic.contains("Na"));
    assertTrue(organic.indexOf("Cl") < organic.indexOf("C"));
    assertTrue(table.getOrganicAromaticSymbols().contains("c"));
    assertFalse(table.getOrganicAromaticSymbols().contains("se"));
    assertTrue(table.getAllSymbols().contains("se"));
  }

  @Test
  public void testResolveValence() throws Exception {
    Element nitrogen = table.lookup("N").get();
    assertEquals(3, nitrogen.resolveValence(1.0));
    assertEquals(5, nitrogen.resolveValence(4.0));
    assertEquals("Falls back to the largest valence", 5, nitrogen.resolveValence(6.0));
    assertEquals(0, table.lookup("Fe").get().resolveValence(2.0));
  }

  @Test
  public void testLoadFromStream() throws Exception {
    String json = "{\"elements\": [" +
        "{\"symbol\": \"C\", \"atomic_number\": 6, \"atomic_mass\": 12.011, \"valences\": [4], " +
        "\"organic\": true, \"aromatic\": true}]}";
    InputStream stream = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    ElementTable loaded = ElementTable.load(stream);
    assertEquals(1, loaded.size());
    assertEquals(12.011, loaded.lookup("c").get().getAtomicMass(), 1e-9);
  }
}
