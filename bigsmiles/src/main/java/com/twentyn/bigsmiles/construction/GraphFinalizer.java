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

import com.twentyn.bigsmiles.errors.ConstructionException;
import com.twentyn.bigsmiles.model.Atom;
import com.twentyn.bigsmiles.model.Bond;
import com.twentyn.bigsmiles.model.Branch;
import com.twentyn.bigsmiles.model.DescriptorMismatchWarning;
import com.twentyn.bigsmiles.model.Endpoint;
import com.twentyn.bigsmiles.model.Graph;
import com.twentyn.bigsmiles.model.Node;
import com.twentyn.bigsmiles.model.NodeContainer;
import com.twentyn.bigsmiles.model.StochasticFragment;
import com.twentyn.bigsmiles.model.StochasticObject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * The last step of construction: global checks, hydrogen inference and descriptor pairing, then freezing.
 */
final class GraphFinalizer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GraphFinalizer.class);

  private GraphFinalizer() {
  }

  static void finalizeGraph(Graph graph) throws ConstructionException {
    flattenTrailingBranches(graph);
    checkImplicitEndGroups(graph);
    checkStructure(graph);
    ValenceCalculator.assignImplicitHydrogens(graph);
    for (DescriptorMismatchWarning warning : DescriptorChecker.check(graph)) {
      graph.getStatus().addWarning(warning);
    }
    graph.freeze();
    LOGGER.debug("Finalized %s with status %s", graph, graph.getStatus().getState());
  }

  /**
   * A branch that ends its scope needs no parentheses: "CCC(C(CC))" is written "CCCCCC". Inner scopes are
   * flattened first, stochastic fragments included.
   */
  static void flattenTrailingBranches(NodeContainer container) {
    for (Node node : container.getNodes()) {
      if (node instanceof Branch) {
        flattenTrailingBranches((Branch) node);
      } else if (node instanceof StochasticObject) {
        for (StochasticFragment fragment : ((StochasticObject) node).getFragments()) {
          flattenTrailingBranches(fragment);
        }
      }
    }
    List<Node> nodes = container.getNodes();
    if (!nodes.isEmpty() && nodes.get(nodes.size() - 1) instanceof Branch) {
      Branch branch = (Branch) nodes.get(nodes.size() - 1);
      container.removeNode(branch);
      container.addNodes(branch.getNodes());
      LOGGER.debug("Flattened trailing branch %d", branch.getId());
    }
  }

  /**
   * The implicit end group "[]" may only stand on the open side of a stochastic object that starts or ends the
   * string.
   */
  private static void checkImplicitEndGroups(Graph graph) throws ConstructionException {
    List<Node> nodes = graph.getNodes();
    for (StochasticObject stochasticObject : graph.getStochasticObjects()) {
      if (stochasticObject.getLeftEndGroup().isImplicit() &&
          (nodes.get(0) != stochasticObject || stochasticObject.getLeftBondId().isPresent())) {
        throw new ConstructionException(String.format(
            "Implicit end group '[]' of stochastic object %d is only allowed at the start of the string",
            stochasticObject.getId()));
      }
      if (stochasticObject.getRightEndGroup().isImplicit() &&
          (nodes.get(nodes.size() - 1) != stochasticObject || stochasticObject.getRightBondId().isPresent())) {
        throw new ConstructionException(String.format(
            "Implicit end group '[]' of stochastic object %d is only allowed at the end of the string",
            stochasticObject.getId()));
      }
    }
  }

  private static void checkStructure(Graph graph) {
    for (Bond bond : graph.getBonds()) {
      if (bond.isPending() || !graph.isValid(bond.getFirst()) || !graph.isValid(bond.getSecond())) {
        throw new IllegalStateException(String.format("Bond %d does not resolve to two endpoints", bond.getId()));
      }
    }
    for (StochasticObject stochasticObject : graph.getStochasticObjects()) {
      if (stochasticObject.getFragments().isEmpty() || stochasticObject.getLeftEndGroup() == null ||
          stochasticObject.getRightEndGroup() == null) {
        throw new IllegalStateException(
            String.format("Stochastic object %d is incomplete", stochasticObject.getId()));
      }
    }
    for (Atom atom : graph.getAtoms()) {
      for (Integer bondId : atom.getBondIds()) {
        if (!graph.getBond(bondId).connects(Endpoint.atom(atom.getId()))) {
          throw new IllegalStateException(
              String.format("Atom %d lists bond %d, which does not touch it", atom.getId(), bondId));
        }
      }
    }
  }
}
