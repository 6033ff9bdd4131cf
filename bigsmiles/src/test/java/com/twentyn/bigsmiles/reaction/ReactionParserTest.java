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

package com.twentyn.bigsmiles.reaction;

import com.twentyn.bigsmiles.config.ParseConfig;
import com.twentyn.bigsmiles.errors.ReactionParseException;
import com.twentyn.bigsmiles.errors.UnbalancedScopeException;
import com.twentyn.bigsmiles.model.ArrowKind;
import com.twentyn.bigsmiles.model.Reaction;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ReactionParserTest {
  private ReactionParser parser;

  @Before
  public void setUp() throws Exception {
    parser = new ReactionParser();
  }

  @Test
  public void testTwoPartReaction() throws Exception {
    Reaction reaction = parser.parseReaction("CC>>CCO");
    assertEquals(ArrowKind.TWO_PART, reaction.getArrowKind());
    assertEquals(1, reaction.getReactants().size());
    assertTrue(reaction.getAgents().isEmpty());
    assertEquals(1, reaction.getProducts().size());
    assertEquals(3, reaction.getProducts().get(0).getAtoms().size());
  }

  @Test
  public void testThreePartReaction() throws Exception {
    Reaction reaction = parser.parseReaction("CC,O>[Pt]>CCO");
    assertEquals(ArrowKind.THREE_PART, reaction.getArrowKind());
    assertEquals(2, reaction.getReactants().size());
    assertEquals(1, reaction.getAgents().size());
    assertEquals("Pt", reaction.getAgents().get(0).getAtom(0).getSymbol());
    assertEquals(1, reaction.getProducts().size());
  }

  @Test
  public void testCommaInsideStochasticObjectIsNotASpeciesSeparator() throws Exception {
    Reaction reaction = parser.parseReaction("{[>][<]CC[>],[<]CC(C)[>][<]}>>C");
    assertEquals(1, reaction.getReactants().size());
    assertEquals(2, reaction.getReactants().get(0).getStochasticObject(0).getFragments().size());
  }

  @Test
  public void testEmptyPartsAreAllowed() throws Exception {
    Reaction reaction = parser.parseReaction(">>CCO");
    assertTrue(reaction.getReactants().isEmpty());
    assertEquals(1, reaction.getProducts().size());

    reaction = parser.parseReaction("C>>C");
    assertTrue(reaction.getAgents().isEmpty());
  }

  @Test
  public void testDisconnectedSpeciesAreSplit() throws Exception {
    assertEquals(2, parser.parseReaction("CCO.O>>CC").getReactants().size());
    assertEquals("Charged fragments stay together",
        1, parser.parseReaction("[Na+].[Cl-]>>C").getReactants().size());

    ReactionParser unsplit = new ReactionParser(new ParseConfig(true, false));
    assertEquals(1, unsplit.parseReaction("CCO.O>>CC").getReactants().size());
  }

  @Test
  public void testBadArrows() throws Exception {
    for (String text : Arrays.asList("CC", "C>C", "C>>C>>C", "C>C>C>C", "C>>C>C")) {
      try {
        parser.parseReaction(text);
        fail(String.format("Expected a ReactionParseException for '%s'", text));
      } catch (ReactionParseException e) {
        assertTrue(e.getMessage().contains("arrows"));
      }
    }
  }

  @Test(expected = ReactionParseException.class)
  public void testEmptySpecies() throws Exception {
    parser.parseReaction("CC,,O>>C");
  }

  @Test
  public void testSpeciesErrorIsWrapped() throws Exception {
    try {
      parser.parseReaction("C(C>>C");
      fail("Expected a ReactionParseException");
    } catch (ReactionParseException e) {
      assertEquals("C(C", e.getSegment());
      assertTrue(e.getCause() instanceof UnbalancedScopeException);
    }
  }
}
