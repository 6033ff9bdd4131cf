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

package com.twentyn.bigsmiles.formula;

import com.twentyn.bigsmiles.construction.BigSmilesParser;
import com.twentyn.bigsmiles.model.Graph;
import com.twentyn.bigsmiles.model.StochasticFragment;
import org.junit.Before;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class MolecularFormulaTest {
  private static final double MASS_DELTA = 1e-3;

  private BigSmilesParser parser;

  @Before
  public void setUp() throws Exception {
    parser = new BigSmilesParser();
  }

  @Test
  public void testEthanol() throws Exception {
    MolecularFormula formula = MolecularFormulaCalculator.compute(parser.parse("CCO"));
    assertEquals("C2H6O", formula.getFormula());
    assertEquals(46.069, formula.getMolarMass(), MASS_DELTA);
    assertEquals(6, formula.getCount("H"));
    assertEquals(0, formula.getCount("N"));
    assertFalse(formula.containsStochasticObject());
  }

  @Test
  public void testHillOrderWithoutCarbon() throws Exception {
    assertEquals("H2O", MolecularFormulaCalculator.compute(parser.parse("O")).getFormula());
    assertEquals("H4N", MolecularFormulaCalculator.compute(parser.parse("[NH4+]")).getFormula());
    assertEquals("ClNa", MolecularFormulaCalculator.compute(parser.parse("[Na+].[Cl-]")).getFormula());
  }

  @Test
  public void testAromaticAtomsCountAsTheirElement() throws Exception {
    assertEquals("C6H6", MolecularFormulaCalculator.compute(parser.parse("c1ccccc1")).getFormula());
  }

  @Test
  public void testStochasticObjectsArePlaceholders() throws Exception {
    Graph graph = parser.parse("CC{[>][<]CC(C)[>][<]}CC(C)=C");
    MolecularFormula formula = MolecularFormulaCalculator.compute(graph);
    assertEquals("C6H12{}", formula.getFormula());
    assertTrue(formula.containsStochasticObject());

    StochasticFragment repeatUnit = graph.getStochasticObject(0).getFragments().get(0);
    assertEquals("C3H6", MolecularFormulaCalculator.compute(graph, repeatUnit).getFormula());
  }

  @Test
  public void testEndCapsAreCounted() throws Exception {
    MolecularFormula formula = MolecularFormulaCalculator.compute(parser.parse("{[<][<]CC[>][>]}"));
    assertEquals("H2{}", formula.getFormula());
  }

  @Test
  public void testPlaceholderCount() throws Exception {
    Map<String, Integer> counts = new HashMap<>();
    counts.put("C", 2);
    counts.put("H", 4);
    assertEquals("C2H4{}2", new MolecularFormula(counts, 2).getFormula());
  }

  @Test
  public void testElementalAnalysis() throws Exception {
    Map<String, Double> analysis = MolecularFormulaCalculator.compute(parser.parse("O")).getElementalAnalysis();
    assertEquals(2 * 1.008 / 18.015, analysis.get("H"), MASS_DELTA);
    assertEquals(15.999 / 18.015, analysis.get("O"), MASS_DELTA);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testGraphMustBeFinalized() throws Exception {
    MolecularFormulaCalculator.compute(new Graph("C"));
  }
}
