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

import com.twentyn.bigsmiles.config.RenderConfig;
import com.twentyn.bigsmiles.errors.ConstructionException;
import com.twentyn.bigsmiles.errors.UnbalancedScopeException;
import com.twentyn.bigsmiles.errors.UnknownElementException;
import com.twentyn.bigsmiles.model.Atom;
import com.twentyn.bigsmiles.model.Bond;
import com.twentyn.bigsmiles.model.BondDescriptorAtom;
import com.twentyn.bigsmiles.model.BondOrder;
import com.twentyn.bigsmiles.model.Endpoint;
import com.twentyn.bigsmiles.model.Graph;
import com.twentyn.bigsmiles.model.StochasticObject;
import com.twentyn.bigsmiles.model.ValidationStatus;
import com.twentyn.bigsmiles.render.BigSmilesWriter;
import com.twentyn.bigsmiles.tokenizer.AtomFields;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class GraphBuilderTest {
  private static final AtomFields CARBON = AtomFields.privileged("C");
  private static final AtomFields OXYGEN = AtomFields.privileged("O");

  private BigSmilesParser parser;
  private RenderConfig renderConfig;

  @Before
  public void setUp() throws Exception {
    parser = new BigSmilesParser();
    renderConfig = new RenderConfig();
  }

  private String write(Graph graph) {
    return BigSmilesWriter.write(graph, renderConfig);
  }

  @Test
  public void testBuildChainWithBranch() throws Exception {
    GraphBuilder builder = new GraphBuilder("CC(=O)O");
    builder.addAtom(CARBON);
    builder.addAtom(CARBON);
    builder.openBranch();
    builder.setPendingBond("=");
    builder.addAtom(OXYGEN);
    builder.closeBranch();
    builder.addAtom(OXYGEN);
    Graph graph = builder.exitConstruction();

    assertEquals("CC(=O)O", write(graph));
    assertEquals(BondOrder.DOUBLE, graph.getBond(1).getOrder());
    assertEquals(Arrays.asList(0, 1, 2), graph.getAtom(1).getBondIds());
  }

  @Test(expected = ConstructionException.class)
  public void testTwoPendingBonds() throws Exception {
    GraphBuilder builder = new GraphBuilder("C==C");
    builder.addAtom(CARBON);
    builder.setPendingBond("=");
    builder.setPendingBond("=");
  }

  @Test(expected = ConstructionException.class)
  public void testPendingBondWithoutAtom() throws Exception {
    new GraphBuilder("-C").setPendingBond("-");
  }

  @Test(expected = UnbalancedScopeException.class)
  public void testCloseBranchWithoutOpen() throws Exception {
    GraphBuilder builder = new GraphBuilder("C)");
    builder.addAtom(CARBON);
    builder.closeBranch();
  }

  @Test(expected = ConstructionException.class)
  public void testCloseBranchWithPendingBond() throws Exception {
    GraphBuilder builder = new GraphBuilder("C(=)");
    builder.addAtom(CARBON);
    builder.openBranch();
    builder.setPendingBond("=");
    builder.closeBranch();
  }

  @Test
  public void testUnknownElementCarriesOffset() throws Exception {
    GraphBuilder builder = new GraphBuilder("C[Xx]");
    builder.addAtom(CARBON);
    try {
      builder.at(1).addAtom(AtomFields.extended("Xx", null, 0));
      fail("Expected an UnknownElementException");
    } catch (UnknownElementException e) {
      assertEquals(1, e.getOffset());
      assertEquals("Xx", e.getSymbol());
    }
  }

  @Test(expected = IllegalStateException.class)
  public void testExitConstructionOnlyOnce() throws Exception {
    GraphBuilder builder = new GraphBuilder("C");
    builder.addAtom(CARBON);
    builder.exitConstruction();
    builder.exitConstruction();
  }

  @Test
  public void testStochasticObjectOperations() throws Exception {
    GraphBuilder builder = new GraphBuilder("{[<][<]CC[>],[<]C[>][>]}");
    builder.openStochasticObject("<", 1);
    builder.openStochasticFragment();
    builder.addBondingDescriptorAtom("<", 1);
    builder.addAtom(CARBON);
    builder.addAtom(CARBON);
    builder.addBondingDescriptorAtom(">", 1);
    builder.nextStochasticFragment(",");
    builder.addBondingDescriptorAtom("<", 1);
    builder.addAtom(CARBON);
    builder.addBondingDescriptorAtom(">", 1);
    builder.closeStochasticFragment();
    builder.closeStochasticObject(">", 1);
    Graph graph = builder.exitConstruction();

    StochasticObject stochasticObject = graph.getStochasticObject(0);
    assertEquals(2, stochasticObject.getFragments().size());
    assertEquals(",", stochasticObject.getSeparator().get());
    assertEquals(3, stochasticObject.getRegistry().get("<", 1).get().getUseCount());
    assertEquals("Both open ends are capped", "[H]{[<][<]CC[>],[<]C[>][>]}[H]", write(graph));
    assertEquals(5, graph.getAtoms().size());
    assertTrue(stochasticObject.getLeftBondId().isPresent());
    assertTrue(stochasticObject.getRightBondId().isPresent());
    assertEquals(ValidationStatus.State.VALID, graph.getStatus().getState());
  }

  @Test(expected = ConstructionException.class)
  public void testCloseObjectWithoutFragments() throws Exception {
    GraphBuilder builder = new GraphBuilder("{[<][>]}");
    builder.openStochasticObject("<", 1);
    builder.closeStochasticObject(">", 1);
  }

  @Test(expected = ConstructionException.class)
  public void testCloseObjectWithFragmentOpen() throws Exception {
    GraphBuilder builder = new GraphBuilder("{[<][<]C[>]");
    builder.openStochasticObject("<", 1);
    builder.openStochasticFragment();
    builder.addBondingDescriptorAtom("<", 1);
    builder.addAtom(CARBON);
    builder.closeStochasticObject(">", 1);
  }

  @Test
  public void testAppendGraph() throws Exception {
    GraphBuilder builder = new GraphBuilder("CC=OC");
    builder.addAtom(CARBON);
    builder.addAtom(CARBON);
    builder.appendGraph(parser.parse("OC"), "=");
    Graph graph = builder.exitConstruction();

    assertEquals(4, graph.getAtoms().size());
    assertEquals("CC=OC", write(graph));
    // Donor bonds are copied before the joint bond is created.
    Bond joint = graph.getBond(2);
    assertEquals(BondOrder.DOUBLE, joint.getOrder());
    assertEquals(Endpoint.atom(1), joint.getFirst());
    assertEquals(Endpoint.atom(2), joint.getSecond());
    assertEquals(Arrays.asList(1, 2), graph.getAtom(2).getBondIds());
    assertEquals(3, graph.getAtom(3).getImplicitHydrogens());
  }

  @Test
  public void testAppendGraphWithStochasticObject() throws Exception {
    GraphBuilder builder = new GraphBuilder("CC{[>][<]CC[>][<]}CC");
    builder.addAtom(CARBON);
    builder.appendGraph(parser.parse("C{[>][<]CC[>][<]}C"), "");
    builder.addAtom(CARBON);
    Graph graph = builder.exitConstruction();

    assertEquals("CC{[>][<]CC[>][<]}CC", write(graph));
    StochasticObject stochasticObject = graph.getStochasticObject(0);
    assertTrue(stochasticObject.getLeftBondId().isPresent());
    assertTrue(stochasticObject.getRightBondId().isPresent());
    for (BondDescriptorAtom descriptorAtom : graph.getDescriptorAtoms()) {
      assertEquals(Integer.valueOf(0), descriptorAtom.getStochasticObjectId().get());
    }
  }

  @Test
  public void testAttachBranch() throws Exception {
    GraphBuilder builder = new GraphBuilder("C(C)(O)C");
    builder.addAtom(CARBON);
    builder.openBranch();
    builder.addAtom(CARBON);
    builder.closeBranch();
    builder.addAtom(CARBON);
    builder.attachBranch(0, "", parser.parse("O"));
    Graph graph = builder.exitConstruction();

    assertEquals("New branch goes after the existing one", "C(C)(O)C", write(graph));
    assertEquals(1, graph.getAtom(0).getImplicitHydrogens());
    assertEquals(1, graph.getAtom(3).getImplicitHydrogens());
  }

  @Test
  public void testInsertAtomIntoBond() throws Exception {
    GraphBuilder builder = new GraphBuilder("COC");
    builder.addAtom(CARBON);
    builder.addAtom(CARBON);
    Atom oxygen = builder.insertAtomIntoBond(0, OXYGEN);
    Graph graph = builder.exitConstruction();

    assertEquals("COC", write(graph));
    assertEquals(2, oxygen.getId());
    assertEquals(Arrays.asList(0, 1), oxygen.getBondIds());
    assertEquals(Endpoint.atom(2), graph.getBond(0).getSecond());
    assertEquals(Endpoint.atom(1), graph.getBond(1).getSecond());
    assertEquals(Arrays.asList(1), graph.getAtom(1).getBondIds());
    assertEquals(0, oxygen.getImplicitHydrogens());
    assertEquals(3, graph.getAtom(1).getImplicitHydrogens());
  }

  @Test(expected = ConstructionException.class)
  public void testInsertAtomIntoRingBond() throws Exception {
    GraphBuilder builder = new GraphBuilder("C1CC1");
    builder.addAtom(CARBON);
    builder.addRing(1);
    builder.addAtom(CARBON);
    builder.addAtom(CARBON);
    builder.addRing(1);
    builder.insertAtomIntoBond(0, OXYGEN);
  }

  @Test
  public void testAddGraphAsStochasticFragment() throws Exception {
    GraphBuilder builder = new GraphBuilder("C{[>][<]CC[>],[<]CC(C)[>][<]}");
    builder.addAtom(CARBON);
    builder.openStochasticObject(">", 1);
    builder.addGraphAsStochasticFragment(parser.parseFragment("[<]CC[>]"));
    builder.addGraphAsStochasticFragment(parser.parseFragment("[<]CC(C)[>]"));
    builder.closeStochasticObject("<", 1);
    Graph graph = builder.exitConstruction();

    assertEquals("C{[>][<]CC[>],[<]CC(C)[>][<]}[H]", write(graph));
    StochasticObject stochasticObject = graph.getStochasticObject(0);
    assertEquals(2, stochasticObject.getFragments().size());
    assertEquals("Descriptors are re-registered with the host object",
        2, stochasticObject.getRegistry().getDescriptors().size());
    assertEquals(3, stochasticObject.getRegistry().get("<", 1).get().getUseCount());
    for (BondDescriptorAtom descriptorAtom : graph.getDescriptorAtoms()) {
      assertEquals(Integer.valueOf(0), descriptorAtom.getStochasticObjectId().get());
    }
    assertEquals(ValidationStatus.State.VALID, graph.getStatus().getState());
  }

  @Test
  public void testAppendedRingsAreRenumbered() throws Exception {
    GraphBuilder builder = new GraphBuilder("C1CC2CC2C1");
    builder.addAtom(CARBON);
    builder.addRing(1);
    builder.addAtom(CARBON);
    builder.appendGraph(parser.parse("C1CC1"), "");
    builder.addAtom(CARBON);
    builder.addRing(1);
    Graph graph = builder.exitConstruction();

    assertEquals(2, graph.getRings().size());
    assertEquals(Integer.valueOf(1), graph.getRings().get(0).getRingIndex().get());
    assertEquals(Endpoint.atom(5), graph.getRings().get(0).getSecond());
    assertEquals(Integer.valueOf(2), graph.getRings().get(1).getRingIndex().get());
    assertEquals(Endpoint.atom(2), graph.getRings().get(1).getFirst());
    assertEquals(Endpoint.atom(4), graph.getRings().get(1).getSecond());

    String written = write(graph);
    assertEquals("C1CC2CC2C1", written);
    Graph reparsed = parser.parse(written);
    assertEquals(2, reparsed.getRings().size());
    assertEquals(written, write(reparsed));
  }

  @Test
  public void testAttachedBranchRingsAreRenumbered() throws Exception {
    GraphBuilder builder = new GraphBuilder("C1C(C2CC2)C1");
    builder.addAtom(CARBON);
    builder.addRing(1);
    builder.addAtom(CARBON);
    builder.addAtom(CARBON);
    builder.addRing(1);
    builder.attachBranch(1, "", parser.parse("C1CC1"));
    Graph graph = builder.exitConstruction();

    String written = write(graph);
    assertEquals("C1C(C2CC2)C1", written);
    assertEquals(written, write(parser.parse(written)));
  }

  @Test
  public void testInsertAtomIntoBondOfOpenBranch() throws Exception {
    GraphBuilder builder = new GraphBuilder("C(COC)C");
    builder.addAtom(CARBON);
    builder.openBranch();
    builder.addAtom(CARBON);
    builder.addAtom(CARBON);
    Atom oxygen = builder.insertAtomIntoBond(1, OXYGEN);
    builder.closeBranch();
    builder.addAtom(CARBON);
    Graph graph = builder.exitConstruction();

    assertEquals("C(COC)C", write(graph));
    assertEquals(Arrays.asList(1, 2), oxygen.getBondIds());
    assertEquals(Arrays.asList(2), graph.getAtom(2).getBondIds());
    assertEquals(3, graph.getAtom(2).getImplicitHydrogens());
  }

  @Test
  public void testAttachBranchInsideOpenBranch() throws Exception {
    GraphBuilder builder = new GraphBuilder("C(C(=O)C)C");
    builder.addAtom(CARBON);
    builder.openBranch();
    builder.addAtom(CARBON);
    builder.addAtom(CARBON);
    builder.attachBranch(1, "=", parser.parse("O"));
    builder.closeBranch();
    builder.addAtom(CARBON);
    Graph graph = builder.exitConstruction();

    assertEquals("C(C(=O)C)C", write(graph));
    assertEquals(0, graph.getAtom(1).getImplicitHydrogens());
  }

  @Test
  public void testInsertAtomIntoOpenStochasticFragment() throws Exception {
    GraphBuilder builder = new GraphBuilder("C{[>][<]COC[>][<]}C");
    builder.addAtom(CARBON);
    builder.openStochasticObject(">", 1);
    builder.openStochasticFragment();
    builder.addBondingDescriptorAtom("<", 1);
    builder.addAtom(CARBON);
    builder.addAtom(CARBON);
    builder.insertAtomIntoBond(2, OXYGEN);
    builder.addBondingDescriptorAtom(">", 1);
    builder.closeStochasticFragment();
    builder.closeStochasticObject("<", 1);
    builder.addAtom(CARBON);
    Graph graph = builder.exitConstruction();

    assertEquals("C{[>][<]COC[>][<]}C", write(graph));
  }

  @Test
  public void testMultipleBondOutOfUncappedObject() throws Exception {
    GraphBuilder builder = new GraphBuilder("C{[>][<]=CC=[>][<]}");
    builder.addAtom(CARBON);
    builder.openStochasticObject(">", 1);
    builder.openStochasticFragment();
    builder.addBondingDescriptorAtom("<", 1);
    builder.setPendingBond("=");
    builder.addAtom(CARBON);
    builder.addAtom(CARBON);
    builder.setPendingBond("=");
    builder.addBondingDescriptorAtom(">", 1);
    builder.closeStochasticFragment();
    builder.closeStochasticObject("<", 1);
    try {
      builder.exitConstruction();
      fail("Expected a ConstructionException");
    } catch (ConstructionException e) {
      assertTrue(e.getMessage().contains("explicit end atom"));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAddNonFragmentGraphAsFragment() throws Exception {
    GraphBuilder builder = new GraphBuilder("{[<]CC[>]}");
    builder.openStochasticObject("<", 1);
    builder.addGraphAsStochasticFragment(parser.parse("CC"));
  }

  @Test(expected = ConstructionException.class)
  public void testAddFragmentWithoutOpenObject() throws Exception {
    GraphBuilder builder = new GraphBuilder("C");
    builder.addAtom(CARBON);
    builder.addGraphAsStochasticFragment(parser.parseFragment("[<]CC[>]"));
  }

  @Test
  public void testBuilderGraphIsOpenUntilExit() throws Exception {
    GraphBuilder builder = new GraphBuilder("C");
    builder.addAtom(CARBON);
    assertFalse(builder.getGraph().isFrozen());
    builder.exitConstruction();
    assertTrue(builder.getGraph().isFrozen());
  }
}
