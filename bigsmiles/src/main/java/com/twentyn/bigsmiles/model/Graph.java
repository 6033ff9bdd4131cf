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
import java.util.stream.Collectors;

/**
 * Root of a parsed BigSMILES string.
 *
 * The graph owns flat arenas of atoms, bonds, bonding descriptor atoms and stochastic objects; every entity's id is
 * its index in the arena of its kind, and entities refer to each other only through such indices. The node tree
 * rooted at {@link #getNodes()} gives the written structure (branches, stochastic objects and fragments).
 *
 * A graph is filled by the construction package and frozen by {@link #freeze()}; afterwards only
 * {@link StochasticObject#attachDistribution(Distribution)} may change it.
 */
public class Graph extends NodeContainer {
  private final String text;
  private final boolean fragmentMode;
  // Descriptors written at the root of a graph parsed as a stochastic fragment.
  private final DescriptorRegistry rootRegistry = new DescriptorRegistry();

  private final List<Atom> atoms = new ArrayList<>();
  private final List<Bond> bonds = new ArrayList<>();
  private final List<BondDescriptorAtom> descriptorAtoms = new ArrayList<>();
  private final List<StochasticObject> stochasticObjects = new ArrayList<>();
  private final List<Integer> ringBondIds = new ArrayList<>();
  private int containerCount = 0;

  private final ValidationStatus status = new ValidationStatus();

  public Graph(String text) {
    this(text, false);
  }

  public Graph(String text, boolean fragmentMode) {
    this.text = text;
    this.fragmentMode = fragmentMode;
  }

  public String getText() {
    return text;
  }

  public boolean isFragmentMode() {
    return fragmentMode;
  }

  public DescriptorRegistry getRootRegistry() {
    return rootRegistry;
  }

  public List<Atom> getAtoms() {
    return Collections.unmodifiableList(atoms);
  }

  public Atom getAtom(int id) {
    return atoms.get(id);
  }

  public List<Bond> getBonds() {
    return Collections.unmodifiableList(bonds);
  }

  public Bond getBond(int id) {
    return bonds.get(id);
  }

  public List<BondDescriptorAtom> getDescriptorAtoms() {
    return Collections.unmodifiableList(descriptorAtoms);
  }

  public BondDescriptorAtom getDescriptorAtom(int id) {
    return descriptorAtoms.get(id);
  }

  public List<StochasticObject> getStochasticObjects() {
    return Collections.unmodifiableList(stochasticObjects);
  }

  public StochasticObject getStochasticObject(int id) {
    return stochasticObjects.get(id);
  }

  /**
   * Ring-closure bonds, in order of their opening.
   */
  public List<Bond> getRings() {
    return ringBondIds.stream().map(bonds::get).collect(Collectors.toList());
  }

  public ValidationStatus getStatus() {
    return status;
  }

  /**
   * Marks the graph validated and freezes it together with every entity and scope it owns.
   */
  @Override
  public void freeze() {
    checkMutable();
    status.markValidated();
    atoms.forEach(Atom::freeze);
    bonds.forEach(Bond::freeze);
    descriptorAtoms.forEach(BondDescriptorAtom::freeze);
    stochasticObjects.forEach(StochasticObject::freeze);
    rootRegistry.freeze();
    freezeScopes(this);
    super.freeze();
  }

  private static void freezeScopes(NodeContainer container) {
    for (Node node : container.getNodes()) {
      if (node instanceof Branch) {
        freezeScopes((Branch) node);
        ((Branch) node).freeze();
      } else if (node instanceof StochasticObject) {
        for (StochasticFragment fragment : ((StochasticObject) node).getFragments()) {
          freezeScopes(fragment);
          fragment.freeze();
        }
      }
    }
  }

  public Node resolve(Endpoint endpoint) {
    switch (endpoint.getKind()) {
      case ATOM:
        return atoms.get(endpoint.getIndex());
      case DESCRIPTOR_ATOM:
        return descriptorAtoms.get(endpoint.getIndex());
      case STOCHASTIC_OBJECT:
        return stochasticObjects.get(endpoint.getIndex());
      default:
        throw new IllegalStateException(String.format("Unhandled endpoint kind %s", endpoint.getKind()));
    }
  }

  public boolean isValid(Endpoint endpoint) {
    int size;
    switch (endpoint.getKind()) {
      case ATOM:
        size = atoms.size();
        break;
      case DESCRIPTOR_ATOM:
        size = descriptorAtoms.size();
        break;
      default:
        size = stochasticObjects.size();
        break;
    }
    return endpoint.getIndex() < size;
  }

  /**
   * Whether the endpoint is an aromatic atom. Other endpoint kinds are never aromatic.
   */
  public boolean isAromatic(Endpoint endpoint) {
    return endpoint.isAtom() && atoms.get(endpoint.getIndex()).isAromatic();
  }

  public int nextAtomId() {
    return atoms.size();
  }

  public int nextBondId() {
    return bonds.size();
  }

  public int nextDescriptorAtomId() {
    return descriptorAtoms.size();
  }

  public int nextStochasticObjectId() {
    return stochasticObjects.size();
  }

  /**
   * Hands out ids for branches and fragments, which live only in the node tree.
   */
  public int nextContainerId() {
    return containerCount++;
  }

  public void appendAtom(Atom atom) {
    checkArenaId(atom.getId(), atoms.size(), "atom");
    atoms.add(atom);
  }

  public void appendBond(Bond bond) {
    checkArenaId(bond.getId(), bonds.size(), "bond");
    bonds.add(bond);
    if (bond.isRing()) {
      ringBondIds.add(bond.getId());
    }
  }

  /**
   * Swaps the bond stored under an existing id, used when a bond is split in two.
   */
  public void replaceBond(Bond bond) {
    checkMutable();
    if (bond.getId() >= bonds.size()) {
      throw new IllegalArgumentException(String.format("No bond with id %d", bond.getId()));
    }
    bonds.set(bond.getId(), bond);
  }

  public void appendDescriptorAtom(BondDescriptorAtom descriptorAtom) {
    checkArenaId(descriptorAtom.getId(), descriptorAtoms.size(), "bonding descriptor atom");
    descriptorAtoms.add(descriptorAtom);
  }

  public void appendStochasticObject(StochasticObject stochasticObject) {
    checkArenaId(stochasticObject.getId(), stochasticObjects.size(), "stochastic object");
    stochasticObjects.add(stochasticObject);
  }

  private void checkArenaId(int id, int expected, String kind) {
    checkMutable();
    if (id != expected) {
      throw new IllegalArgumentException(String.format("Expected %s id %d, got %d", kind, expected, id));
    }
  }

  @Override
  public String toString() {
    return String.format("Graph[%s: %d atoms, %d bonds]", text, atoms.size(), bonds.size());
  }
}
