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

package com.twentyn.bigsmiles.construction;

import com.twentyn.bigsmiles.config.ParseConfig;
import com.twentyn.bigsmiles.errors.ConstructionException;
import com.twentyn.bigsmiles.errors.UnbalancedScopeException;
import com.twentyn.bigsmiles.errors.UnmatchedRingException;
import com.twentyn.bigsmiles.model.Atom;
import com.twentyn.bigsmiles.model.Bond;
import com.twentyn.bigsmiles.model.BondOrder;
import com.twentyn.bigsmiles.model.BondStereo;
import com.twentyn.bigsmiles.model.Branch;
import com.twentyn.bigsmiles.model.Endpoint;
import com.twentyn.bigsmiles.model.Graph;
import com.twentyn.bigsmiles.model.Node;
import com.twentyn.bigsmiles.model.StochasticObject;
import com.twentyn.bigsmiles.model.ValidationStatus;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class BigSmilesParserTest {
  private BigSmilesParser parser;

  @Before
  public void setUp() throws Exception {
    parser = new BigSmilesParser();
  }

  @Test
  public void testSixMemberedRing() throws Exception {
    Graph graph = parser.parse("C1CCCCC1");
    assertEquals(6, graph.getAtoms().size());
    assertEquals(6, graph.getBonds().size());

    List<Bond> rings = graph.getRings();
    assertEquals("Exactly one ring bond", 1, rings.size());
    Bond ring = rings.get(0);
    assertFalse("Ring bond is complete", ring.isPending());
    assertEquals(Endpoint.atom(0), ring.getFirst());
    assertEquals(Endpoint.atom(5), ring.getSecond());
    assertEquals(Integer.valueOf(1), ring.getRingIndex().get());
    for (Atom atom : graph.getAtoms()) {
      assertEquals("Every ring carbon carries two hydrogens", 2, atom.getImplicitHydrogens());
    }
  }

  @Test
  public void testEveryBondEndpointResolves() throws Exception {
    Graph graph = parser.parse("CC{[>][<]CC(C)[>][<]}CC(C)=C");
    for (Bond bond : graph.getBonds()) {
      assertTrue(graph.isValid(bond.getFirst()));
      assertTrue(graph.isValid(bond.getSecond()));
    }
  }

  @Test(expected = UnbalancedScopeException.class)
  public void testUnclosedBranch() throws Exception {
    parser.parse("CC(C");
  }

  @Test(expected = UnbalancedScopeException.class)
  public void testUnopenedBranch() throws Exception {
    parser.parse("CC)C");
  }

  @Test(expected = UnbalancedScopeException.class)
  public void testUnopenedStochasticObject() throws Exception {
    parser.parse("CC}");
  }

  @Test(expected = UnbalancedScopeException.class)
  public void testUnclosedStochasticObject() throws Exception {
    parser.parse("{[<][<]CC[>]");
  }

  @Test(expected = UnmatchedRingException.class)
  public void testUnmatchedRing() throws Exception {
    parser.parse("C1CC");
  }

  @Test
  public void testUnmatchedRingWithoutRenumbering() throws Exception {
    BigSmilesParser plainParser = new BigSmilesParser(new ParseConfig(false, true));
    try {
      plainParser.parse("C1CC");
      fail("Expected an UnmatchedRingException");
    } catch (UnmatchedRingException e) {
      assertEquals(1, e.getRingIndex());
    }
  }

  @Test(expected = UnmatchedRingException.class)
  public void testRingCannotSpanStochasticFragments() throws Exception {
    parser.parse("{[<][<]C1CC[>],[<]C1CC[>][>]}");
  }

  @Test
  public void testReusedRingIndex() throws Exception {
    Graph graph = parser.parse("C1CC1C1CC1");
    assertEquals(2, graph.getRings().size());
    assertEquals(Integer.valueOf(2), graph.getRings().get(1).getRingIndex().get());
  }

  @Test
  public void testImplicitHydrogens() throws Exception {
    assertEquals(4, parser.parse("C").getAtom(0).getImplicitHydrogens());

    Graph ethene = parser.parse("C=C");
    assertEquals(2, ethene.getAtom(0).getImplicitHydrogens());
    assertEquals(2, ethene.getAtom(1).getImplicitHydrogens());

    Graph aceticAcid = parser.parse("CC(=O)O");
    assertEquals(3, aceticAcid.getAtom(0).getImplicitHydrogens());
    assertEquals(0, aceticAcid.getAtom(1).getImplicitHydrogens());
    assertEquals(0, aceticAcid.getAtom(2).getImplicitHydrogens());
    assertEquals(1, aceticAcid.getAtom(3).getImplicitHydrogens());
  }

  @Test
  public void testHigherValenceIsChosen() throws Exception {
    Graph sulfonicAcid = parser.parse("S(=O)(=O)O");
    assertEquals("Bond sum 5 rounds up to sulfur valence 6", 1, sulfonicAcid.getAtom(0).getImplicitHydrogens());
  }

  @Test
  public void testAromaticRing() throws Exception {
    Graph benzene = parser.parse("c1ccccc1");
    for (Atom atom : benzene.getAtoms()) {
      assertTrue(atom.isAromatic());
      assertEquals(1, atom.getImplicitHydrogens());
    }
    for (Bond bond : benzene.getBonds()) {
      assertEquals(BondOrder.AROMATIC, bond.getOrder());
      assertFalse(bond.isExplicit());
    }
  }

  @Test
  public void testExtendedAtomHydrogens() throws Exception {
    Atom ammonium = parser.parse("[NH4+]").getAtom(0);
    assertTrue(ammonium.isExtended());
    assertEquals(0, ammonium.getImplicitHydrogens());
    assertEquals(4, ammonium.getHydrogenCount());
    assertEquals(1, ammonium.getCharge());
  }

  @Test
  public void testRingClosureOrder() throws Exception {
    Graph graph = parser.parse("C=1CCCCC1");
    Bond ring = graph.getRings().get(0);
    assertEquals("Explicit order on the opening side wins", BondOrder.DOUBLE, ring.getOrder());
    assertEquals("=", ring.getOpeningSymbol());
    assertEquals("", ring.getClosingSymbol());
    assertEquals(1, graph.getAtom(0).getImplicitHydrogens());
  }

  @Test(expected = ConstructionException.class)
  public void testRingBetweenBondedAtoms() throws Exception {
    parser.parse("C12CC12");
  }

  @Test(expected = ConstructionException.class)
  public void testRingOnItself() throws Exception {
    parser.parse("C11");
  }

  @Test
  public void testDisconnect() throws Exception {
    Graph graph = parser.parse("CC.O");
    Bond disconnect = graph.getBond(1);
    assertEquals(BondOrder.ZERO, disconnect.getOrder());
    assertEquals(3, graph.getAtom(1).getImplicitHydrogens());
    assertEquals(2, graph.getAtom(2).getImplicitHydrogens());
  }

  @Test
  public void testDirectionalBonds() throws Exception {
    Graph graph = parser.parse("F/C=C\\F");
    assertEquals(BondStereo.UP, graph.getBond(0).getStereo());
    assertEquals(BondOrder.SINGLE, graph.getBond(0).getOrder());
    assertEquals(BondStereo.DOWN, graph.getBond(2).getStereo());
  }

  @Test
  public void testEmptyBranchIsDropped() throws Exception {
    Graph graph = parser.parse("C()C");
    assertEquals(3, graph.getNodes().size());
    assertEquals(1, graph.getBonds().size());
  }

  @Test
  public void testStochasticObject() throws Exception {
    Graph graph = parser.parse("CC{[>][<]CC(C)[>][<]}CC(C)=C");
    assertEquals(9, graph.getAtoms().size());
    assertEquals(2, graph.getDescriptorAtoms().size());
    assertEquals(1, graph.getStochasticObjects().size());

    StochasticObject stochasticObject = graph.getStochasticObject(0);
    assertEquals(1, stochasticObject.getFragments().size());
    assertEquals(">", stochasticObject.getLeftEndGroup().getSymbol());
    assertEquals("<", stochasticObject.getRightEndGroup().getSymbol());
    assertTrue(stochasticObject.getLeftBondId().isPresent());
    assertTrue(stochasticObject.getRightBondId().isPresent());
    assertEquals(2, stochasticObject.getRegistry().getDescriptors().size());
    assertEquals(ValidationStatus.State.VALID, graph.getStatus().getState());
    assertTrue(graph.isFrozen());
  }

  @Test
  public void testRightBondIsFirstBondAfterObject() throws Exception {
    Graph graph = parser.parse("{[<][<]CC[>][>]}(C)C");
    StochasticObject stochasticObject = graph.getStochasticObject(0);
    Bond branchBond = graph.getBond(stochasticObject.getRightBondId().get());
    assertEquals(Endpoint.stochasticObject(0), branchBond.getFirst());
    assertEquals("The branch bond is kept over the chain bond", Endpoint.atom(2), branchBond.getSecond());
    assertEquals(Endpoint.stochasticObject(0), graph.getBond(4).getFirst());
    assertEquals(Endpoint.atom(3), graph.getBond(4).getSecond());
    assertEquals("Only the left end is capped", 5, graph.getAtoms().size());
  }

  @Test
  public void testStochasticObjectAtBothEndsIsCapped() throws Exception {
    Graph graph = parser.parse("{[<][<]CC[>][>]}");
    assertEquals(4, graph.getAtoms().size());
    Atom left = (Atom) graph.getNodes().get(0);
    Atom right = (Atom) graph.getNodes().get(graph.getNodes().size() - 1);
    for (Atom cap : new Atom[]{left, right}) {
      assertEquals("H", cap.getSymbol());
      assertTrue(cap.isExtended());
      assertEquals(0, cap.getHydrogenCount());
    }
    StochasticObject stochasticObject = graph.getStochasticObject(0);
    assertEquals(Endpoint.atom(left.getId()), graph.getBond(stochasticObject.getLeftBondId().get()).getFirst());
    assertEquals(Endpoint.atom(right.getId()), graph.getBond(stochasticObject.getRightBondId().get()).getSecond());
  }

  @Test
  public void testOnlyOpenObjectEndsAreCapped() throws Exception {
    assertEquals(4, parser.parse("C{[<][<]CC[>][>]}C").getAtoms().size());
    Graph rightOpen = parser.parse("C{[<][<]CC[>][>]}");
    assertEquals(4, rightOpen.getAtoms().size());
    assertEquals("H", rightOpen.getAtom(3).getSymbol());
    assertEquals("Implicit end groups suppress capping", 2, parser.parse("{[][<]CC[>][>]}").getAtoms().size());
  }

  @Test(expected = ConstructionException.class)
  public void testDoubleBondOutOfUncappedObject() throws Exception {
    parser.parse("{[<][<]=CC=[>][>]}");
  }

  @Test
  public void testTrailingBranchesAreFlattened() throws Exception {
    Graph graph = parser.parse("CCC(C(CC))");
    assertEquals(6, graph.getAtoms().size());
    for (Node node : graph.getNodes()) {
      assertFalse(node instanceof Branch);
    }
    assertEquals(11, graph.getNodes().size());

    Graph inFragment = parser.parse("C{[>][<]CC(C[>])[<]}C");
    for (Node node : inFragment.getStochasticObject(0).getFragments().get(0).getNodes()) {
      assertFalse(node instanceof Branch);
    }
    assertEquals("Branches before the end of a scope stay",
        6, parser.parse("CC(O)C").getNodes().size());
  }

  @Test
  public void testRingAcrossDisconnect() throws Exception {
    Graph graph = parser.parse("C1.C1");
    assertEquals(1, graph.getRings().size());
    assertEquals(BondOrder.SINGLE, graph.getRings().get(0).getOrder());
    assertEquals(3, graph.getAtom(0).getImplicitHydrogens());
  }

  @Test
  public void testImplicitEndGroupsAtStringEnds() throws Exception {
    Graph graph = parser.parse("{[][$]CC[$][]}");
    assertEquals(2, graph.getAtoms().size());
    StochasticObject stochasticObject = graph.getStochasticObject(0);
    assertTrue(stochasticObject.getLeftEndGroup().isImplicit());
    assertTrue(stochasticObject.getRightEndGroup().isImplicit());
    assertEquals(ValidationStatus.State.VALID, graph.getStatus().getState());
  }

  @Test(expected = ConstructionException.class)
  public void testImplicitEndGroupInInterior() throws Exception {
    parser.parse("CC{[][<]CC[>][]}");
  }

  @Test
  public void testMissingComplementIsWarning() throws Exception {
    Graph graph = parser.parse("{[][<]CC[<][]}");
    assertEquals(ValidationStatus.State.VALID_WITH_WARNINGS, graph.getStatus().getState());
    assertEquals(1, graph.getStatus().getWarnings().size());
    assertEquals("<", graph.getStatus().getWarnings().get(0).getDescriptor().getSymbol());
  }

  @Test
  public void testLoneNonDirectionalDescriptorIsWarning() throws Exception {
    Graph graph = parser.parse("{[][$]CC[]}");
    assertEquals(ValidationStatus.State.VALID_WITH_WARNINGS, graph.getStatus().getState());
  }

  @Test(expected = ConstructionException.class)
  public void testConflictingDescriptorBondOrders() throws Exception {
    parser.parse("{[][$]=CC[$][]}");
  }

  @Test(expected = ConstructionException.class)
  public void testMixedSeparators() throws Exception {
    parser.parse("{[<][<]CC[>],[<]CC[>];[<]CCC[>][>]}");
  }

  @Test(expected = ConstructionException.class)
  public void testFragmentWithoutDescriptor() throws Exception {
    parser.parse("{[$]CC[$]}");
  }

  @Test(expected = ConstructionException.class)
  public void testDescriptorOutsideStochasticObject() throws Exception {
    parser.parse("C[<]C");
  }

  @Test(expected = ConstructionException.class)
  public void testBondFirst() throws Exception {
    parser.parse("=CC");
  }

  @Test(expected = ConstructionException.class)
  public void testBondLast() throws Exception {
    parser.parse("CC=");
  }

  @Test(expected = ConstructionException.class)
  public void testBondBeforeBranch() throws Exception {
    parser.parse("C=(C)C");
  }

  @Test(expected = ConstructionException.class)
  public void testStringStartsWithBranch() throws Exception {
    parser.parse("(C)C");
  }

  @Test(expected = ConstructionException.class)
  public void testBranchStartsWithBranch() throws Exception {
    parser.parse("C((C))");
  }

  @Test(expected = ConstructionException.class)
  public void testReactionArrowNeedsReactionParser() throws Exception {
    parser.parse("CC>>CC");
  }

  @Test(expected = ConstructionException.class)
  public void testEmptyString() throws Exception {
    parser.parse("  ");
  }

  @Test
  public void testParseFragment() throws Exception {
    Graph fragment = parser.parseFragment("[<]CC[>]");
    assertTrue(fragment.isFragmentMode());
    assertEquals(2, fragment.getDescriptorAtoms().size());
    assertEquals(2, fragment.getRootRegistry().getDescriptors().size());
    assertFalse(fragment.getDescriptorAtom(0).getStochasticObjectId().isPresent());
  }

  @Test(expected = ConstructionException.class)
  public void testParseFragmentNeedsDescriptor() throws Exception {
    parser.parseFragment("CC");
  }
}
