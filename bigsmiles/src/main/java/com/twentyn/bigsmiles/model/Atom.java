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

import com.twentyn.bigsmiles.chemistry.Element;
import com.twentyn.bigsmiles.tokenizer.AtomFields;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public class Atom implements Node {
  private final int id;
  private final Element element;
  private final String symbol;
  private final boolean extended;
  private final boolean aromatic;
  private final Integer isotope;
  private final String stereo;
  private final Integer explicitHydrogens;
  private final int charge;
  private final Integer atomClass;
  private final List<Integer> bondIds = new ArrayList<>();
  private int implicitHydrogens = 0;
  private boolean frozen = false;

  public Atom(int id, AtomFields fields, Element element, boolean aromatic) {
    this(id, element, fields.getSymbol(), fields.isBracketed(), aromatic, fields.getIsotope().orElse(null),
        fields.getStereo().orElse(null), fields.getHydrogens().orElse(null), fields.getCharge(),
        fields.getAtomClass().orElse(null));
  }

  private Atom(int id, Element element, String symbol, boolean extended, boolean aromatic, Integer isotope,
               String stereo, Integer explicitHydrogens, int charge, Integer atomClass) {
    this.id = id;
    this.element = element;
    this.symbol = symbol;
    this.extended = extended;
    this.aromatic = aromatic;
    this.isotope = isotope;
    this.stereo = stereo;
    this.explicitHydrogens = explicitHydrogens;
    this.charge = charge;
    this.atomClass = atomClass;
  }

  /**
   * Copies this atom under a new id, shifting its bond references by the given offset.
   */
  public Atom copy(int newId, int bondOffset) {
    Atom atom = new Atom(newId, element, symbol, extended, aromatic, isotope, stereo, explicitHydrogens, charge,
        atomClass);
    for (Integer bondId : bondIds) {
      atom.bondIds.add(bondId + bondOffset);
    }
    atom.implicitHydrogens = implicitHydrogens;
    return atom;
  }

  public int getId() {
    return id;
  }

  public Element getElement() {
    return element;
  }

  /**
   * The symbol as written: lower case for aromatic atoms.
   */
  public String getSymbol() {
    return symbol;
  }

  public boolean isExtended() {
    return extended;
  }

  public boolean isAromatic() {
    return aromatic;
  }

  public Optional<Integer> getIsotope() {
    return Optional.ofNullable(isotope);
  }

  public Optional<String> getStereo() {
    return Optional.ofNullable(stereo);
  }

  public Optional<Integer> getExplicitHydrogens() {
    return Optional.ofNullable(explicitHydrogens);
  }

  public int getCharge() {
    return charge;
  }

  public Optional<Integer> getAtomClass() {
    return Optional.ofNullable(atomClass);
  }

  public List<Integer> getBondIds() {
    return Collections.unmodifiableList(bondIds);
  }

  public void addBond(int bondId) {
    checkMutable();
    bondIds.add(bondId);
  }

  public void replaceBond(int oldBondId, int newBondId) {
    checkMutable();
    int position = bondIds.indexOf(oldBondId);
    if (position < 0) {
      throw new IllegalArgumentException(String.format("Atom %d has no bond %d", id, oldBondId));
    }
    bondIds.set(position, newBondId);
  }

  public int getImplicitHydrogens() {
    return implicitHydrogens;
  }

  public void setImplicitHydrogens(int implicitHydrogens) {
    checkMutable();
    if (implicitHydrogens < 0) {
      throw new IllegalArgumentException(
          String.format("Negative implicit hydrogen count %d on atom %d", implicitHydrogens, id));
    }
    this.implicitHydrogens = implicitHydrogens;
  }

  /**
   * Hydrogens carried by this atom: the written count for extended atoms, the inferred one otherwise.
   */
  public int getHydrogenCount() {
    if (extended) {
      return explicitHydrogens == null ? 0 : explicitHydrogens;
    }
    return implicitHydrogens;
  }

  void freeze() {
    frozen = true;
  }

  private void checkMutable() {
    if (frozen) {
      throw new IllegalStateException(String.format("Atom %d belongs to a finalized graph", id));
    }
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitAtom(this);
  }

  @Override
  public String toString() {
    return String.format("Atom[%d: %s]", id, symbol);
  }
}
