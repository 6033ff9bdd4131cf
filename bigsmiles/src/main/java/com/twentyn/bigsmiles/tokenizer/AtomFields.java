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

package com.twentyn.bigsmiles.tokenizer;

import java.util.Objects;
import java.util.Optional;

/**
 * The fields of an atom as written in the notation. Bracketed atoms carry up to six fields, bare (privileged) atoms
 * only a symbol.
 */
public class AtomFields {
  private final Integer isotope;
  private final String symbol;
  private final String stereo;
  private final Integer hydrogens;
  private final int charge;
  private final Integer atomClass;
  private final boolean bracketed;

  public AtomFields(Integer isotope, String symbol, String stereo, Integer hydrogens, int charge,
                    Integer atomClass, boolean bracketed) {
    if (symbol == null || symbol.isEmpty()) {
      throw new IllegalArgumentException("Atom symbol must not be empty");
    }
    this.isotope = isotope;
    this.symbol = symbol;
    this.stereo = stereo;
    this.hydrogens = hydrogens;
    this.charge = charge;
    this.atomClass = atomClass;
    this.bracketed = bracketed;
  }

  public static AtomFields privileged(String symbol) {
    return new AtomFields(null, symbol, null, null, 0, null, false);
  }

  public static AtomFields extended(String symbol, Integer hydrogens, int charge) {
    return new AtomFields(null, symbol, null, hydrogens, charge, null, true);
  }

  public Optional<Integer> getIsotope() {
    return Optional.ofNullable(isotope);
  }

  public String getSymbol() {
    return symbol;
  }

  public Optional<String> getStereo() {
    return Optional.ofNullable(stereo);
  }

  public Optional<Integer> getHydrogens() {
    return Optional.ofNullable(hydrogens);
  }

  public int getCharge() {
    return charge;
  }

  public Optional<Integer> getAtomClass() {
    return Optional.ofNullable(atomClass);
  }

  public boolean isBracketed() {
    return bracketed;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof AtomFields)) {
      return false;
    }
    AtomFields other = (AtomFields) o;
    return Objects.equals(isotope, other.isotope) && symbol.equals(other.symbol) &&
        Objects.equals(stereo, other.stereo) && Objects.equals(hydrogens, other.hydrogens) &&
        charge == other.charge && Objects.equals(atomClass, other.atomClass) && bracketed == other.bracketed;
  }

  @Override
  public int hashCode() {
    return Objects.hash(isotope, symbol, stereo, hydrogens, charge, atomClass, bracketed);
  }

  @Override
  public String toString() {
    return String.format("{isotope: %s, symbol: %s, stereo: %s, hydrogens: %s, charge: %d, class: %s}",
        isotope, symbol, stereo, hydrogens, charge, atomClass);
  }
}
