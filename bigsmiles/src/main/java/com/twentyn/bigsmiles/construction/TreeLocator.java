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

import com.twentyn.bigsmiles.model.Branch;
import com.twentyn.bigsmiles.model.Node;
import com.twentyn.bigsmiles.model.NodeContainer;
import com.twentyn.bigsmiles.model.StochasticFragment;
import com.twentyn.bigsmiles.model.StochasticObject;

import java.util.List;

/**
 * Finds where a node sits in a graph's node tree.
 */
final class TreeLocator {
  static final class Location {
    private final NodeContainer container;
    private final int position;

    private Location(NodeContainer container, int position) {
      this.container = container;
      this.position = position;
    }

    NodeContainer getContainer() {
      return container;
    }

    int getPosition() {
      return position;
    }
  }

  private TreeLocator() {
  }

  /**
   * @return The container holding the node and its position there, or null if the node is not in the tree.
   */
  static Location locate(NodeContainer root, Node target) {
    List<Node> nodes = root.getNodes();
    for (int i = 0; i < nodes.size(); i++) {
      Node node = nodes.get(i);
      if (node == target) {
        return new Location(root, i);
      }
      Location found = null;
      if (node instanceof Branch) {
        found = locate((Branch) node, target);
      } else if (node instanceof StochasticObject) {
        for (StochasticFragment fragment : ((StochasticObject) node).getFragments()) {
          found = locate(fragment, target);
          if (found != null) {
            break;
          }
        }
      }
      if (found != null) {
        return found;
      }
    }
    return null;
  }
}
