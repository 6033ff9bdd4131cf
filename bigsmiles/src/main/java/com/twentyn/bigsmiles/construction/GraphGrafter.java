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

import com.twentyn.bigsmiles.errors.ConstructionException;
import com.twentyn.bigsmiles.model.Atom;
import com.twentyn.bigsmiles.model.Bond;
import com.twentyn.bigsmiles.model.BondDescriptor;
import com.twentyn.bigsmiles.model.BondDescriptorAtom;
import com.twentyn.bigsmiles.model.Branch;
import com.twentyn.bigsmiles.model.DescriptorRegistry;
import com.twentyn.bigsmiles.model.Endpoint;
import com.twentyn.bigsmiles.model.Graph;
import com.twentyn.bigsmiles.model.Node;
import com.twentyn.bigsmiles.model.NodeVisitor;
import com.twentyn.bigsmiles.model.StochasticFragment;
import com.twentyn.bigsmiles.model.StochasticObject;

import com.twentyn.bigsmiles.tokenizer.RingIndexNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Copies a finished graph into a host graph that is still under construction.
 *
 * Arena entities are appended in the donor's order, so every donor index maps to the host index plus a fixed
 * per-arena offset. Descriptors are re-registered: those inside the donor's stochastic objects with the copied
 * objects, those at the donor's root (fragment graphs) with the registry supplied by the caller.
 */
class GraphGrafter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GraphGrafter.class);

  static final class Grafted {
    private final List<Node> nodes;
    private final int rootDescriptorCount;

    private Grafted(List<Node> nodes, int rootDescriptorCount) {
      this.nodes = Collections.unmodifiableList(nodes);
      this.rootDescriptorCount = rootDescriptorCount;
    }

    List<Node> getNodes() {
      return nodes;
    }

    int getRootDescriptorCount() {
      return rootDescriptorCount;
    }
  }

  private final Graph host;
  private int atomOffset;
  private int bondOffset;
  private int descriptorAtomOffset;
  private int stochasticObjectOffset;

  GraphGrafter(Graph host) {
    this.host = host;
  }

  /**
   * @param donor A finalized graph.
   * @param rootRegistry Receives descriptors written at the donor's root; may be null if there are none.
   * @param rootOwnerId The stochastic object owning rootRegistry, or null for a fragment-mode host root.
   * @return The host copies of the donor's top-level nodes, not yet placed in any container.
   */
  Grafted graft(Graph donor, DescriptorRegistry rootRegistry, Integer rootOwnerId) throws ConstructionException {
    Map<Integer, Integer> ringIndices = renumberRings(donor);
    atomOffset = host.nextAtomId();
    bondOffset = host.nextBondId();
    descriptorAtomOffset = host.nextDescriptorAtomId();
    stochasticObjectOffset = host.nextStochasticObjectId();

    for (StochasticObject donorObject : donor.getStochasticObjects()) {
      host.appendStochasticObject(copyShell(donorObject));
    }

    int rootDescriptorCount = 0;
    for (BondDescriptorAtom donorAtom : donor.getDescriptorAtoms()) {
      DescriptorRegistry registry;
      Integer ownerId;
      if (donorAtom.getStochasticObjectId().isPresent()) {
        ownerId = donorAtom.getStochasticObjectId().get() + stochasticObjectOffset;
        registry = host.getStochasticObject(ownerId).getRegistry();
      } else {
        if (rootRegistry == null) {
          throw new IllegalArgumentException("Grafted graph has root bonding descriptors but no registry to take them");
        }
        registry = rootRegistry;
        ownerId = rootOwnerId;
        rootDescriptorCount++;
      }
      host.appendDescriptorAtom(copyDescriptorAtom(donorAtom, registry, ownerId));
    }

    for (Atom donorAtom : donor.getAtoms()) {
      host.appendAtom(donorAtom.copy(donorAtom.getId() + atomOffset, bondOffset));
    }
    for (Bond donorBond : donor.getBonds()) {
      Integer ringIndex = donorBond.getRingIndex().map(ringIndices::get).orElse(null);
      host.appendBond(donorBond.copy(donorBond.getId() + bondOffset, atomOffset, descriptorAtomOffset,
          stochasticObjectOffset, ringIndex));
    }

    return new Grafted(copyNodes(donor.getNodes()), rootDescriptorCount);
  }

  /**
   * Maps each donor ring index to the index its copies are written with. Indices already used by the host's ring
   * bonds, open or closed, move to the lowest index used by neither graph, so that the copied rings can neither
   * close a host ring nor be closed by one.
   */
  private Map<Integer, Integer> renumberRings(Graph donor) throws ConstructionException {
    Set<Integer> hostIndices = new HashSet<>();
    for (Bond bond : host.getRings()) {
      hostIndices.add(bond.getRingIndex().get());
    }
    Set<Integer> taken = new HashSet<>(hostIndices);
    Map<Integer, Integer> mapping = new HashMap<>();
    for (Bond bond : donor.getRings()) {
      taken.add(bond.getRingIndex().get());
    }
    int candidate = 1;
    for (Bond bond : donor.getRings()) {
      int index = bond.getRingIndex().get();
      if (mapping.containsKey(index)) {
        continue;
      }
      if (!hostIndices.contains(index)) {
        mapping.put(index, index);
        continue;
      }
      while (taken.contains(candidate)) {
        candidate++;
      }
      if (candidate > RingIndexNormalizer.MAX_RING_INDEX) {
        throw new ConstructionException(
            String.format("No free ring index left to renumber grafted ring %d", index));
      }
      LOGGER.debug("Renumbering grafted ring %d to %d", index, candidate);
      mapping.put(index, candidate);
      taken.add(candidate);
    }
    return mapping;
  }

  private StochasticObject copyShell(StochasticObject donorObject) {
    StochasticObject copy = new StochasticObject(donorObject.getId() + stochasticObjectOffset);
    copy.setLeftEndGroup(copyEndGroup(copy, donorObject.getLeftEndGroup()), donorObject.isLeftIndexExplicit());
    copy.setRightEndGroup(copyEndGroup(copy, donorObject.getRightEndGroup()), donorObject.isRightIndexExplicit());
    donorObject.getSeparator().ifPresent(copy::setSeparator);
    donorObject.getLeftBondId().ifPresent(id -> copy.setLeftBondId(id + bondOffset));
    donorObject.getRightBondId().ifPresent(id -> copy.setRightBondId(id + bondOffset));
    return copy;
  }

  private static BondDescriptor copyEndGroup(StochasticObject owner, BondDescriptor endGroup) {
    if (endGroup.isImplicit()) {
      return BondDescriptor.implicit();
    }
    BondDescriptor descriptor = owner.getRegistry().getOrCreate(endGroup.getSymbol(), endGroup.getIndex());
    descriptor.addEndGroupUse();
    return descriptor;
  }

  private BondDescriptorAtom copyDescriptorAtom(BondDescriptorAtom donorAtom, DescriptorRegistry registry,
                                                Integer ownerId) throws ConstructionException {
    BondDescriptor donorDescriptor = donorAtom.getDescriptor();
    BondDescriptor descriptor = registry.getOrCreate(donorDescriptor.getSymbol(), donorDescriptor.getIndex());
    if (donorAtom.getBondId().isPresent() && !descriptor.recordBondOrder(donorDescriptor.getBondOrder())) {
      throw new ConstructionException(
          String.format("Bonding descriptor %s is used with bond orders '%s' and '%s'", descriptor,
              descriptor.getBondOrder().getSymbol(), donorDescriptor.getBondOrder().getSymbol()));
    }
    BondDescriptorAtom copy = new BondDescriptorAtom(donorAtom.getId() + descriptorAtomOffset, descriptor,
        donorAtom.isIndexExplicit(), ownerId);
    descriptor.addOccurrence(copy.getId());
    donorAtom.getBondId().ifPresent(id -> copy.setBond(id + bondOffset));
    return copy;
  }

  private List<Node> copyNodes(List<Node> donorNodes) {
    NodeCopier copier = new NodeCopier();
    List<Node> copies = new ArrayList<>(donorNodes.size());
    for (Node node : donorNodes) {
      copies.add(node.accept(copier));
    }
    return copies;
  }

  private class NodeCopier implements NodeVisitor<Node> {
    @Override
    public Node visitAtom(Atom atom) {
      return host.getAtom(atom.getId() + atomOffset);
    }

    @Override
    public Node visitBond(Bond bond) {
      return host.getBond(bond.getId() + bondOffset);
    }

    @Override
    public Node visitDescriptorAtom(BondDescriptorAtom descriptorAtom) {
      return host.getDescriptorAtom(descriptorAtom.getId() + descriptorAtomOffset);
    }

    @Override
    public Node visitBranch(Branch branch) {
      Branch copy = new Branch(host.nextContainerId(),
          branch.getAttachment().shift(atomOffset, descriptorAtomOffset, stochasticObjectOffset));
      copy.addNodes(copyNodes(branch.getNodes()));
      return copy;
    }

    @Override
    public Node visitStochasticObject(StochasticObject stochasticObject) {
      StochasticObject copy = host.getStochasticObject(stochasticObject.getId() + stochasticObjectOffset);
      for (StochasticFragment fragment : stochasticObject.getFragments()) {
        copy.addFragment((StochasticFragment) fragment.accept(this));
      }
      return copy;
    }

    @Override
    public Node visitStochasticFragment(StochasticFragment fragment) {
      StochasticFragment copy = new StochasticFragment(host.nextContainerId(),
          fragment.getStochasticObjectId() + stochasticObjectOffset);
      copy.addNodes(copyNodes(fragment.getNodes()));
      return copy;
    }
  }

  /**
   * The endpoint a bond uses to reach this node, or null for nodes that cannot carry a chain bond.
   */
  static Endpoint endpointOf(Node node) {
    if (node instanceof Atom) {
      return Endpoint.atom(((Atom) node).getId());
    }
    if (node instanceof StochasticObject) {
      return Endpoint.stochasticObject(((StochasticObject) node).getId());
    }
    if (node instanceof BondDescriptorAtom) {
      return Endpoint.descriptorAtom(((BondDescriptorAtom) node).getId());
    }
    return null;
  }

  static Endpoint lastEndpointOf(List<Node> nodes) {
    for (int i = nodes.size() - 1; i >= 0; i--) {
      Endpoint endpoint = endpointOf(nodes.get(i));
      if (endpoint != null) {
        return endpoint;
      }
    }
    return null;
  }
}
