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

import com.twentyn.bigsmiles.model.Atom;
import com.twentyn.bigsmiles.model.Graph;

/**
 * Infers implicit hydrogens on privileged (bracket-free) atoms.
 *
 * The bond-order sum counts aromatic bonds as 1.5 and disconnects as 0; bonds to bonding descriptors and stochastic
 * objects count with their order. The hydrogen count fills the gap to the smallest allowed valence that is at least
 * the sum, rounded down and never negative.
 */
final class ValenceCalculator {
  private ValenceCalculator() {
  }

  static void assignImplicitHydrogens(Graph graph) {
    for (Atom atom : graph.getAtoms()) {
      if (atom.isExtended()) {
        continue;
      }
      atom.setImplicitHydrogens(implicitHydrogens(graph, atom));
    }
  }

  static int implicitHydrogens(Graph graph, Atom atom) {
    double bondSum = bondOrderSum(graph, atom);
    int valence = atom.getElement().resolveValence(bondSum);
    return Math.max(0, (int) Math.floor(valence - bondSum));
  }

  static double bondOrderSum(Graph graph, Atom atom) {
    double sum = 0.0;
    for (Integer bondId : atom.getBondIds()) {
      sum += graph.getBond(bondId).getOrder().getOrder();
    }
    return sum;
  }
}
