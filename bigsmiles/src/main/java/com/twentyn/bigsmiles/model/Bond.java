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
 * A bond between two endpoints. Ring bonds are created half-open at the first occurrence of their ring index and
 * completed at the second; all other bonds are complete on creation.
 */
public class Bond implements Node {
  private final int id;
  private BondOrder order;
  private boolean explicit;
  private final BondStereo stereo;
  private final Endpoint first;
  private Endpoint second;

  private Integer ringIndex;
  private String openingSymbol = "";
  private String closingSymbol = "";
  private boolean frozen = false;

  public Bond(int id, BondOrder order, boolean explicit, BondStereo stereo, Endpoint first, Endpoint second) {
    this.id = id;
    this.order = order;
    this.explicit = explicit;
    this.stereo = stereo;
    this.first = first;
    this.second = second;
  }

  public static Bond openRing(int id, int ringIndex, BondOrder order, String openingSymbol, Endpoint first) {
    Bond bond = new Bond(id, order, !openingSymbol.isEmpty(), BondStereo.fromSymbol(openingSymbol), first, null);
    bond.ringIndex = ringIndex;
    bond.openingSymbol = openingSymbol;
    return bond;
  }

  public Bond copy(int newId, int atomOffset, int descriptorAtomOffset, int stochasticObjectOffset) {
    return copy(newId, atomOffset, descriptorAtomOffset, stochasticObjectOffset, ringIndex);
  }

  /**
   * Copies this bond under a new id and shifted endpoints, writing ring bonds under {@code newRingIndex}.
   */
  public Bond copy(int newId, int atomOffset, int descriptorAtomOffset, int stochasticObjectOffset,
                   Integer newRingIndex) {
    if (newRingIndex != null && ringIndex == null) {
      throw new IllegalArgumentException(String.format("Bond %d is not a ring bond", id));
    }
    if (isPending()) {
      throw new IllegalStateException(String.format("Cannot copy pending ring bond %d", id));
    }
    Bond bond = new Bond(newId, order, explicit, stereo,
        first.shift(atomOffset, descriptorAtomOffset, stochasticObjectOffset),
        second.shift(atomOffset, descriptorAtomOffset, stochasticObjectOffset));
    bond.ringIndex = newRingIndex;
    bond.openingSymbol = openingSymbol;
    bond.closingSymbol = closingSymbol;
    return bond;
  }

  /**
   * Closes a ring bond at its second endpoint.
   *
   * @param endpoint The closing endpoint.
   * @param closedOrder The order resolved from both sides of the ring closure.
   * @param closingSymbol The bond symbol written before the closing ring index, or "".
   */
  public void completeRing(Endpoint endpoint, BondOrder closedOrder, String closingSymbol) {
    if (frozen || !isPending()) {
      throw new IllegalStateException(String.format("Bond %d is already complete", id));
    }
    this.second = endpoint;
    this.order = closedOrder;
    this.closingSymbol = closingSymbol;
    this.explicit = explicit || !closingSymbol.isEmpty();
  }

  public int getId() {
    return id;
  }

  public BondOrder getOrder() {
    return order;
  }

  public boolean isExplicit() {
    return explicit;
  }

  public BondStereo getStereo() {
    return stereo;
  }

  public Endpoint getFirst() {
    return first;
  }

  public Endpoint getSecond() {
    return second;
  }

  public boolean isPending() {
    return second == null;
  }

  public boolean isRing() {
    return ringIndex != null;
  }

  public Optional<Integer> getRingIndex() {
    return Optional.ofNullable(ringIndex);
  }

  public String getOpeningSymbol() {
    return openingSymbol;
  }

  public String getClosingSymbol() {
    return closingSymbol;
  }

  public boolean connects(Endpoint endpoint) {
    return first.equals(endpoint) || endpoint.equals(second);
  }

  public Endpoint getOther(Endpoint endpoint) {
    if (first.equals(endpoint)) {
      return second;
    }
    if (endpoint.equals(second)) {
      return first;
    }
    throw new IllegalArgumentException(String.format("Bond %d does not touch %s", id, endpoint));
  }

  /**
   * The text written for this bond in a chain: the stereo marker if any, else the order symbol.
   */
  public String getSymbol() {
    if (stereo != BondStereo.NONE) {
      return stereo.getSymbol();
    }
    return order.getSymbol();
  }

  void freeze() {
    frozen = true;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitBond(this);
  }

  @Override
  public String toString() {
    return String.format("Bond[%d: %s %s %s]", id, first, getSymbol(), second);
  }
}
