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

import java.util.Objects;

/**
 * Reference to something a bond can end at: an atom, a bonding descriptor occurrence or a stochastic object (for
 * end-group bonds). It is an index into the owning graph's arena of that kind, never the object itself.
 */
public final class Endpoint {
  public enum Kind {
    ATOM,
    DESCRIPTOR_ATOM,
    STOCHASTIC_OBJECT,
  }

  private final Kind kind;
  private final int index;

  private Endpoint(Kind kind, int index) {
    if (index < 0) {
      throw new IllegalArgumentException(String.format("Negative endpoint index %d", index));
    }
    this.kind = kind;
    this.index = index;
  }

  public static Endpoint atom(int index) {
    return new Endpoint(Kind.ATOM, index);
  }

  public static Endpoint descriptorAtom(int index) {
    return new Endpoint(Kind.DESCRIPTOR_ATOM, index);
  }

  public static Endpoint stochasticObject(int index) {
    return new Endpoint(Kind.STOCHASTIC_OBJECT, index);
  }

  public Kind getKind() {
    return kind;
  }

  public int getIndex() {
    return index;
  }

  public boolean isAtom() {
    return kind == Kind.ATOM;
  }

  public Endpoint shift(int atomOffset, int descriptorAtomOffset, int stochasticObjectOffset) {
    switch (kind) {
      case ATOM:
        return atom(index + atomOffset);
      case DESCRIPTOR_ATOM:
        return descriptorAtom(index + descriptorAtomOffset);
      case STOCHASTIC_OBJECT:
        return stochasticObject(index + stochasticObjectOffset);
      default:
        throw new IllegalStateException(String.format("Unhandled endpoint kind %s", kind));
    }
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Endpoint)) {
      return false;
    }
    Endpoint other = (Endpoint) o;
    return kind == other.kind && index == other.index;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, index);
  }

  @Override
  public String toString() {
    return String.format("%s#%d", kind, index);
  }
}
