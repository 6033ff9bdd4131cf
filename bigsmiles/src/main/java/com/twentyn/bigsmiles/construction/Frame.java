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

import com.twentyn.bigsmiles.model.Endpoint;
import com.twentyn.bigsmiles.model.NodeContainer;
import com.twentyn.bigsmiles.model.StochasticObject;

import java.util.Map;

/**
 * One open scope on the builder's stack.
 */
class Frame {
  enum Kind {
    ROOT,
    BRANCH,
    STOCHASTIC_OBJECT,
    STOCHASTIC_FRAGMENT,
  }

  private final Kind kind;
  // Null for STOCHASTIC_OBJECT frames, whose children are fragments.
  private final NodeContainer container;
  // The object owning this frame's descriptors, if any.
  private final StochasticObject stochasticObject;
  // Ring index -> id of the half-open bond. Branches share their parent's table.
  private final Map<Integer, Integer> rings;
  private final int openedAt;
  private Endpoint current;
  private int descriptorCount = 0;

  Frame(Kind kind, NodeContainer container, StochasticObject stochasticObject, Map<Integer, Integer> rings,
        Endpoint current, int openedAt) {
    this.kind = kind;
    this.container = container;
    this.stochasticObject = stochasticObject;
    this.rings = rings;
    this.current = current;
    this.openedAt = openedAt;
  }

  Kind getKind() {
    return kind;
  }

  boolean is(Kind other) {
    return kind == other;
  }

  NodeContainer getContainer() {
    return container;
  }

  StochasticObject getStochasticObject() {
    return stochasticObject;
  }

  Map<Integer, Integer> getRings() {
    return rings;
  }

  int getOpenedAt() {
    return openedAt;
  }

  Endpoint getCurrent() {
    return current;
  }

  void setCurrent(Endpoint current) {
    this.current = current;
  }

  int getDescriptorCount() {
    return descriptorCount;
  }

  void addDescriptors(int count) {
    descriptorCount += count;
  }
}
