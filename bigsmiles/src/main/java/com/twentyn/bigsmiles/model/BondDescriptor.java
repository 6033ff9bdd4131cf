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
import java.util.Objects;

/**
 * A bonding descriptor of one stochastic object, keyed by symbol and index. All occurrences with the same key share
 * one instance.
 */
public class BondDescriptor {
  public static final String IMPLICIT_SYMBOL = "";
  public static final String HEAD_SYMBOL = "<";
  public static final String TAIL_SYMBOL = ">";
  public static final String NON_DIRECTIONAL_SYMBOL = "$";

  private final String symbol;
  private final int index;
  private final List<Integer> occurrences = new ArrayList<>();
  private int endGroupUses = 0;
  private BondOrder bondOrder;
  private boolean frozen = false;

  public BondDescriptor(String symbol, int index) {
    if (!IMPLICIT_SYMBOL.equals(symbol) && !HEAD_SYMBOL.equals(symbol) && !TAIL_SYMBOL.equals(symbol) &&
        !NON_DIRECTIONAL_SYMBOL.equals(symbol)) {
      throw new IllegalArgumentException(String.format("Invalid bonding descriptor symbol '%s'", symbol));
    }
    this.symbol = symbol;
    this.index = index;
  }

  public static BondDescriptor implicit() {
    return new BondDescriptor(IMPLICIT_SYMBOL, 1);
  }

  public String getSymbol() {
    return symbol;
  }

  public int getIndex() {
    return index;
  }

  public boolean isImplicit() {
    return IMPLICIT_SYMBOL.equals(symbol);
  }

  public String getKey() {
    return key(symbol, index);
  }

  public static String key(String symbol, int index) {
    return symbol + index;
  }

  /**
   * The symbol that pairs with this one: '<' and '>' complement each other, '$' complements itself.
   */
  public String getComplementSymbol() {
    switch (symbol) {
      case HEAD_SYMBOL:
        return TAIL_SYMBOL;
      case TAIL_SYMBOL:
        return HEAD_SYMBOL;
      default:
        return symbol;
    }
  }

  public boolean isComplement(BondDescriptor other) {
    return !isImplicit() && index == other.index && getComplementSymbol().equals(other.symbol);
  }

  public List<Integer> getOccurrences() {
    return Collections.unmodifiableList(occurrences);
  }

  public void addOccurrence(int descriptorAtomId) {
    checkMutable();
    occurrences.add(descriptorAtomId);
  }

  public int getEndGroupUses() {
    return endGroupUses;
  }

  public void addEndGroupUse() {
    checkMutable();
    endGroupUses++;
  }

  public int getUseCount() {
    return occurrences.size() + endGroupUses;
  }

  public BondOrder getBondOrder() {
    return bondOrder;
  }

  /**
   * Records the order of a bond made through one of this descriptor's occurrences.
   *
   * @return False if an earlier occurrence was bonded with a different order.
   */
  public boolean recordBondOrder(BondOrder order) {
    checkMutable();
    if (bondOrder == null) {
      bondOrder = order;
      return true;
    }
    return bondOrder == order;
  }

  void freeze() {
    frozen = true;
  }

  private void checkMutable() {
    if (frozen) {
      throw new IllegalStateException(String.format("Bonding descriptor %s belongs to a finalized graph", this));
    }
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof BondDescriptor)) {
      return false;
    }
    BondDescriptor other = (BondDescriptor) o;
    return index == other.index && symbol.equals(other.symbol);
  }

  @Override
  public int hashCode() {
    return Objects.hash(symbol, index);
  }

  @Override
  public String toString() {
    return String.format("[%s%d]", symbol, index);
  }
}
