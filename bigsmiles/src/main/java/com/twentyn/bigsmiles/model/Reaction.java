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

package com.twentyn.bigsmiles.model;

import java.util.Collections;
import java.util.List;

public class Reaction {
  private final List<Graph> reactants;
  private final List<Graph> agents;
  private final List<Graph> products;
  private final ArrowKind arrowKind;

  public Reaction(List<Graph> reactants, List<Graph> agents, List<Graph> products, ArrowKind arrowKind) {
    if (arrowKind == ArrowKind.TWO_PART && !agents.isEmpty()) {
      throw new IllegalArgumentException("A two-part reaction cannot carry agents");
    }
    this.reactants = Collections.unmodifiableList(reactants);
    this.agents = Collections.unmodifiableList(agents);
    this.products = Collections.unmodifiableList(products);
    this.arrowKind = arrowKind;
  }

  public List<Graph> getReactants() {
    return reactants;
  }

  public List<Graph> getAgents() {
    return agents;
  }

  public List<Graph> getProducts() {
    return products;
  }

  public ArrowKind getArrowKind() {
    return arrowKind;
  }

  @Override
  public String toString() {
    return String.format("Reaction[%d reactants, %d agents, %d products]",
        reactants.size(), agents.size(), products.size());
  }
}
