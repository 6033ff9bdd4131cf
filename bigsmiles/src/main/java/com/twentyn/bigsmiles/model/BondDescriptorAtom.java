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

import java.util.Optional;

/**
 * One written occurrence of a bonding descriptor inside a stochastic fragment.
 */
public class BondDescriptorAtom implements Node {
  private final int id;
  private final BondDescriptor descriptor;
  private final boolean indexExplicit;
  // Null when the occurrence sits in the root of a graph parsed as a fragment.
  private final Integer stochasticObjectId;
  private Integer bondId;
  private boolean frozen = false;

  public BondDescriptorAtom(int id, BondDescriptor descriptor, boolean indexExplicit, Integer stochasticObjectId) {
    this.id = id;
    this.descriptor = descriptor;
    this.indexExplicit = indexExplicit;
    this.stochasticObjectId = stochasticObjectId;
  }

  public int getId() {
    return id;
  }

  public BondDescriptor getDescriptor() {
    return descriptor;
  }

  public boolean isIndexExplicit() {
    return indexExplicit;
  }

  public Optional<Integer> getStochasticObjectId() {
    return Optional.ofNullable(stochasticObjectId);
  }

  public Optional<Integer> getBondId() {
    return Optional.ofNullable(bondId);
  }

  public void setBond(int bondId) {
    if (frozen || this.bondId != null) {
      throw new IllegalStateException(String.format("Bonding descriptor atom %d is already bonded", id));
    }
    this.bondId = bondId;
  }

  /**
   * Points this occurrence at a different bond, used when its bond is split.
   */
  public void rebind(int newBondId) {
    if (frozen || this.bondId == null) {
      throw new IllegalStateException(String.format("Bonding descriptor atom %d has no bond to rebind", id));
    }
    this.bondId = newBondId;
  }

  void freeze() {
    frozen = true;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitDescriptorAtom(this);
  }

  @Override
  public String toString() {
    return String.format("BondDescriptorAtom[%d: %s]", id, descriptor);
  }
}
