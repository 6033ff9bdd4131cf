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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base of the scopes that hold an ordered list of child nodes.
 */
public abstract class NodeContainer {
  private final List<Node> nodes = new ArrayList<>();
  private boolean frozen = false;

  public List<Node> getNodes() {
    return Collections.unmodifiableList(nodes);
  }

  public void addNode(Node node) {
    checkMutable();
    nodes.add(node);
  }

  public void addNodes(List<Node> newNodes) {
    checkMutable();
    nodes.addAll(newNodes);
  }

  public void insertNode(int position, Node node) {
    checkMutable();
    nodes.add(position, node);
  }

  public boolean removeNode(Node node) {
    checkMutable();
    return nodes.remove(node);
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public boolean isFrozen() {
    return frozen;
  }

  void freeze() {
    frozen = true;
  }

  protected void checkMutable() {
    if (frozen) {
      throw new IllegalStateException(
          String.format("%s is finalized and cannot be modified", getClass().getSimpleName()));
    }
  }
}
