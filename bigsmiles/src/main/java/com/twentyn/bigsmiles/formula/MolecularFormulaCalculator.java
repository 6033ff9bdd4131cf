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

import com.twentyn.bigsmiles.model.Atom;
import com.twentyn.bigsmiles.model.Bond;
import com.twentyn.bigsmiles.model.BondDescriptorAtom;
import com.twentyn.bigsmiles.model.Branch;
import com.twentyn.bigsmiles.model.Graph;
import com.twentyn.bigsmiles.model.Node;
import com.twentyn.bigsmiles.model.NodeContainer;
import com.twentyn.bigsmiles.model.NodeVisitor;
import com.twentyn.bigsmiles.model.StochasticFragment;
import com.twentyn.bigsmiles.model.StochasticObject;

import java.util.HashMap;
import java.util.Map;

public class MolecularFormulaCalculator {

  /**
   * Formula of a finalized graph, counting nested stochastic objects as placeholders.
   */
  public static MolecularFormula compute(Graph graph) {
    checkFinalized(graph);
    return computeFor(graph);
  }

  /**
   * Formula of one repeat unit. Atoms only; descriptors add nothing.
   */
  public static MolecularFormula compute(Graph graph, StochasticFragment fragment) {
    checkFinalized(graph);
    return computeFor(fragment);
  }

  private static void checkFinalized(Graph graph) {
    if (!graph.isFrozen()) {
      throw new IllegalArgumentException("Hydrogen counts are only known once the graph is finalized");
    }
  }

  private static MolecularFormula computeFor(NodeContainer container) {
    CountingVisitor visitor = new CountingVisitor();
    for (Node node : container.getNodes()) {
      node.accept(visitor);
    }
    return new MolecularFormula(visitor.counts, visitor.stochasticObjects);
  }

  private static class CountingVisitor implements NodeVisitor<Void> {
    private final Map<String, Integer> counts = new HashMap<>();
    private int stochasticObjects = 0;

    @Override
    public Void visitAtom(Atom atom) {
      counts.merge(atom.getElement().getSymbol(), 1, Integer::sum);
      int hydrogens = atom.getHydrogenCount();
      if (hydrogens > 0) {
        counts.merge(MolecularFormula.HYDROGEN, hydrogens, Integer::sum);
      }
      return null;
    }

    @Override
    public Void visitBond(Bond bond) {
      return null;
    }

    @Override
    public Void visitDescriptorAtom(BondDescriptorAtom descriptorAtom) {
      return null;
    }

    @Override
    public Void visitBranch(Branch branch) {
      for (Node node : branch.getNodes()) {
        node.accept(this);
      }
      return null;
    }

    @Override
    public Void visitStochasticObject(StochasticObject stochasticObject) {
      stochasticObjects++;
      return null;
    }

    @Override
    public Void visitStochasticFragment(StochasticFragment fragment) {
      for (Node node : fragment.getNodes()) {
        node.accept(this);
      }
      return null;
    }
  }
}
