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

package com.twentyn.bigsmiles.render;

import com.twentyn.bigsmiles.config.RenderConfig;
import com.twentyn.bigsmiles.construction.BigSmilesParser;
import com.twentyn.bigsmiles.model.Graph;
import com.twentyn.bigsmiles.model.Reaction;
import com.twentyn.bigsmiles.reaction.ReactionParser;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BigSmilesWriterTest {
  private static final List<String> CANONICAL_INPUTS = Arrays.asList(
      "CC{[>][<]CC(C)[>][<]}CC(C)=C",
      "C1CCCCC1",
      "c1ccccc1",
      "[13C@H+:1]C",
      "F/C=C/F",
      "CC.O",
      "C=1CCCCC1",
      "{[][$]CC[$][]}",
      "CC(=O)O",
      "C%12CCCCC%12",
      "[Fe+2]",
      "[H]{[>1][<1]CC[>1][<1]}[H]",
      "[H]{[<][<]CC[>],[<]C(Cl)C[>],[<]C[>][>]}[H]"
  );

  private BigSmilesParser parser;
  private BigSmilesWriter writer;

  @Before
  public void setUp() throws Exception {
    parser = new BigSmilesParser();
    writer = new BigSmilesWriter();
  }

  @Test
  public void testCanonicalInputsWriteBackUnchanged() throws Exception {
    for (String input : CANONICAL_INPUTS) {
      assertEquals(input, writer.render(parser.parse(input)));
    }
  }

  @Test
  public void testWritingReachesFixpoint() throws Exception {
    String once = writer.render(parser.parse("[Fe++]"));
    assertEquals("[Fe+2]", once);
    assertEquals(once, writer.render(parser.parse(once)));

    String renumbered = writer.render(parser.parse("C1CC1C1CC1"));
    assertEquals("C1CC1C2CC2", renumbered);
    assertEquals(renumbered, writer.render(parser.parse(renumbered)));

    String capped = writer.render(parser.parse("{[<][<]CC[>][>]}"));
    assertEquals("[H]{[<][<]CC[>][>]}[H]", capped);
    assertEquals(capped, writer.render(parser.parse(capped)));

    String flattened = writer.render(parser.parse("CCC(C(CC))"));
    assertEquals("CCCCCC", flattened);
    assertEquals(flattened, writer.render(parser.parse(flattened)));
  }

  @Test
  public void testChargeFormatting() throws Exception {
    assertEquals("", BigSmilesWriter.formatCharge(0));
    assertEquals("+", BigSmilesWriter.formatCharge(1));
    assertEquals("-", BigSmilesWriter.formatCharge(-1));
    assertEquals("-3", BigSmilesWriter.formatCharge(-3));
    assertEquals("%10", BigSmilesWriter.formatRingIndex(10));
    assertEquals("9", BigSmilesWriter.formatRingIndex(9));
  }

  @Test
  public void testShowBondDescriptorOneIndex() throws Exception {
    RenderConfig config = new RenderConfig(false, true, false, false);
    assertEquals("[H]{[<1][<1]CC[>1][>1]}[H]", BigSmilesWriter.write(parser.parse("{[<][<]CC[>][>]}"), config));
    assertEquals("Implicit end groups have no index",
        "{[][$1]CC[$1][]}", BigSmilesWriter.write(parser.parse("{[][$]CC[$][]}"), config));
  }

  @Test
  public void testShowAromaticBond() throws Exception {
    RenderConfig config = new RenderConfig(false, false, true, false);
    assertEquals("c:1:c:c:c:c:c:1", BigSmilesWriter.write(parser.parse("c1ccccc1"), config));
    assertEquals("CC", BigSmilesWriter.write(parser.parse("CC"), config));
  }

  @Test
  public void testShowMultiBondsOnBothRingIndex() throws Exception {
    RenderConfig config = new RenderConfig(false, false, false, true);
    assertEquals("C=1CCCCC=1", BigSmilesWriter.write(parser.parse("C=1CCCCC1"), config));
    assertEquals("C1CCCCC1", BigSmilesWriter.write(parser.parse("C1CCCCC1"), config));
  }

  @Test
  public void testColorOutput() throws Exception {
    RenderConfig config = new RenderConfig(true, false, false, false);
    String colored = BigSmilesWriter.write(parser.parse("C{[>][<]CC[>][<]}"), config);
    assertTrue(colored.contains("\u001b["));
    assertFalse(writer.render(parser.parse("C{[>][<]CC[>][<]}")).contains("\u001b["));
    assertEquals(TerminalColors.CYAN.wrap("C") + TerminalColors.CYAN.wrap("O"),
        BigSmilesWriter.write(parser.parse("CO"), config));
  }

  @Test
  public void testReactionRoundTrip() throws Exception {
    ReactionParser reactionParser = new ReactionParser();
    for (String input : Arrays.asList("CC,O>[Pt]>CCO", "CC>>CCO", "C>>")) {
      Reaction reaction = reactionParser.parseReaction(input);
      assertEquals(input, writer.render(reaction));
    }
  }

  @Test
  public void testEmptyGraph() throws Exception {
    assertEquals("", writer.render(new Graph("")));
  }
}
