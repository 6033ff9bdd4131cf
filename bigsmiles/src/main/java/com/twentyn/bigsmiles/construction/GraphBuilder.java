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

import com.twentyn.bigsmiles.chemistry.Element;
import com.twentyn.bigsmiles.chemistry.ElementTable;
import com.twentyn.bigsmiles.errors.BigSmilesException;
import com.twentyn.bigsmiles.errors.ConstructionException;
import com.twentyn.bigsmiles.errors.MalformedFieldException;
import com.twentyn.bigsmiles.errors.UnbalancedScopeException;
import com.twentyn.bigsmiles.errors.UnknownElementException;
import com.twentyn.bigsmiles.errors.UnmatchedRingException;
import com.twentyn.bigsmiles.model.Atom;
import com.twentyn.bigsmiles.model.Bond;
import com.twentyn.bigsmiles.model.BondDescriptor;
import com.twentyn.bigsmiles.model.BondDescriptorAtom;
import com.twentyn.bigsmiles.model.BondOrder;
import com.twentyn.bigsmiles.model.BondStereo;
import com.twentyn.bigsmiles.model.Branch;
import com.twentyn.bigsmiles.model.DescriptorRegistry;
import com.twentyn.bigsmiles.model.Endpoint;
import com.twentyn.bigsmiles.model.Graph;
import com.twentyn.bigsmiles.model.Node;
import com.twentyn.bigsmiles.model.NodeContainer;
import com.twentyn.bigsmiles.model.StochasticFragment;
import com.twentyn.bigsmiles.model.StochasticObject;
import com.twentyn.bigsmiles.tokenizer.AtomFields;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The state machine that turns a sequence of structural operations into a {@link Graph}.
 *
 * The builder keeps a stack of open scopes. The root, branches and stochastic fragments hold child nodes; a
 * stochastic object frame sits between its fragments. Each frame tracks the node that the next bond starts from.
 * A bond symbol is buffered until the next atom, descriptor, stochastic object or ring closure consumes it.
 *
 * Operations fail fast with a {@link BigSmilesException} subclass carrying the offset last set through
 * {@link #at(int)}. A builder is single use: {@link #exitConstruction()} validates and freezes the graph.
 */
public class GraphBuilder {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GraphBuilder.class);

  public static final int MAX_ABS_CHARGE = 9;
  public static final String DEFAULT_SEPARATOR = ",";
  private static final AtomFields HYDROGEN_CAP = AtomFields.extended("H", null, 0);

  private final Graph graph;
  private final ElementTable elementTable;
  private final Deque<Frame> frames = new ArrayDeque<>();
  private final Frame rootFrame;

  private String pendingBond = null;
  private int offset = BigSmilesException.NO_OFFSET;
  private boolean exited = false;

  public GraphBuilder(String text) {
    this(new Graph(text, false), ElementTable.getInstance());
  }

  GraphBuilder(Graph graph, ElementTable elementTable) {
    this.graph = graph;
    this.elementTable = elementTable;
    this.rootFrame = new Frame(Frame.Kind.ROOT, graph, null, new HashMap<>(), null, 0);
    frames.push(rootFrame);
  }

  /**
   * A builder whose root scope behaves as a stochastic fragment: bonding descriptors are allowed at the top level.
   * Graphs built this way are meant for {@link #addGraphAsStochasticFragment(Graph)}.
   */
  public static GraphBuilder forFragment(String text) {
    return new GraphBuilder(new Graph(text, true), ElementTable.getInstance());
  }

  /**
   * Sets the input offset reported by errors raised from the following operations.
   */
  public GraphBuilder at(int offset) {
    this.offset = offset;
    return this;
  }

  public Graph getGraph() {
    return graph;
  }

  public boolean isInsideStochasticObject() {
    for (Frame frame : frames) {
      if (frame.is(Frame.Kind.STOCHASTIC_FRAGMENT) || frame.is(Frame.Kind.STOCHASTIC_OBJECT)) {
        return true;
      }
    }
    return false;
  }

  public boolean hasPendingBond() {
    return pendingBond != null;
  }

  public Atom addAtom(AtomFields fields) throws BigSmilesException {
    checkOpen();
    Frame frame = requireContainerFrame("Atoms");
    Element element = elementTable.lookup(fields.getSymbol()).orElseThrow(
        () -> new UnknownElementException(fields.getSymbol(), offset));
    if (Math.abs(fields.getCharge()) > MAX_ABS_CHARGE) {
      throw new MalformedFieldException(
          String.format("Charge %d on atom '%s' is out of range", fields.getCharge(), fields.getSymbol()), offset);
    }

    Atom atom = new Atom(graph.nextAtomId(), fields, element, elementTable.isAromaticSymbol(fields.getSymbol()));
    graph.appendAtom(atom);
    Endpoint endpoint = Endpoint.atom(atom.getId());
    bondFromCurrent(frame, endpoint);
    frame.getContainer().addNode(atom);
    frame.setCurrent(endpoint);
    LOGGER.debug("Added atom %d (%s)", atom.getId(), fields.getSymbol());
    return atom;
  }

  public void setPendingBond(String symbol) throws ConstructionException {
    checkOpen();
    if (pendingBond != null) {
      throw new ConstructionException(
          String.format("Bond '%s' directly follows bond '%s'", symbol, pendingBond), offset);
    }
    if (frames.peek().getCurrent() == null) {
      throw new ConstructionException(String.format("Bond '%s' has nothing to bond from", symbol), offset);
    }
    if (!BondOrder.fromSymbol(symbol).isPresent()) {
      throw new ConstructionException(String.format("Unknown bond symbol '%s'", symbol), offset);
    }
    pendingBond = symbol;
  }

  public Branch openBranch() throws ConstructionException {
    checkOpen();
    Frame parent = frames.peek();
    if (parent.getCurrent() == null) {
      throw new ConstructionException("Branch has no atom to attach to", offset);
    }
    if (pendingBond != null) {
      throw new ConstructionException(String.format("Bond '%s' cannot precede '('", pendingBond), offset);
    }
    Branch branch = new Branch(graph.nextContainerId(), parent.getCurrent());
    frames.push(new Frame(Frame.Kind.BRANCH, branch, parent.getStochasticObject(), parent.getRings(),
        parent.getCurrent(), offset));
    return branch;
  }

  public void closeBranch() throws BigSmilesException {
    checkOpen();
    Frame frame = frames.peek();
    if (!frame.is(Frame.Kind.BRANCH)) {
      throw new UnbalancedScopeException("')' without a matching '('", offset);
    }
    if (pendingBond != null) {
      throw new ConstructionException(String.format("Bond '%s' cannot precede ')'", pendingBond), offset);
    }
    frames.pop();
    Branch branch = (Branch) frame.getContainer();
    if (branch.isEmpty()) {
      LOGGER.debug("Dropping empty branch opened at %d", frame.getOpenedAt());
      return;
    }
    // The parent's current node is still the attachment atom.
    frames.peek().getContainer().addNode(branch);
  }

  public StochasticObject openStochasticObject(String symbol, int index) throws ConstructionException {
    return openStochasticObject(symbol, index, index != 1);
  }

  /**
   * Opens a stochastic object with its left end group.
   *
   * @param symbol The left end group symbol, or "" for the implicit end group "[]".
   * @param index The left end group index.
   * @param indexExplicit Whether the index was written out.
   */
  public StochasticObject openStochasticObject(String symbol, int index, boolean indexExplicit)
      throws ConstructionException {
    checkOpen();
    Frame parent = requireContainerFrame("Stochastic objects");
    StochasticObject stochasticObject = new StochasticObject(graph.nextStochasticObjectId());
    graph.appendStochasticObject(stochasticObject);
    stochasticObject.setLeftEndGroup(endGroup(stochasticObject, symbol, index), indexExplicit);

    Endpoint endpoint = Endpoint.stochasticObject(stochasticObject.getId());
    bondFromCurrent(parent, endpoint);
    parent.getContainer().addNode(stochasticObject);
    frames.push(new Frame(Frame.Kind.STOCHASTIC_OBJECT, null, stochasticObject, null, null, offset));
    LOGGER.debug("Opened stochastic object %d", stochasticObject.getId());
    return stochasticObject;
  }

  public StochasticFragment openStochasticFragment() throws ConstructionException {
    checkOpen();
    Frame frame = frames.peek();
    if (!frame.is(Frame.Kind.STOCHASTIC_OBJECT)) {
      throw new ConstructionException("A stochastic fragment can only open directly inside a stochastic object",
          offset);
    }
    StochasticObject stochasticObject = frame.getStochasticObject();
    StochasticFragment fragment = new StochasticFragment(graph.nextContainerId(), stochasticObject.getId());
    frames.push(new Frame(Frame.Kind.STOCHASTIC_FRAGMENT, fragment, stochasticObject, new HashMap<>(), null, offset));
    return fragment;
  }

  public void closeStochasticFragment() throws BigSmilesException {
    checkOpen();
    Frame frame = frames.peek();
    if (frame.is(Frame.Kind.BRANCH)) {
      throw new UnbalancedScopeException(
          String.format("Branch opened at %d is still open at the end of the stochastic fragment",
              frame.getOpenedAt()), offset);
    }
    if (frame.is(Frame.Kind.ROOT)) {
      throw new UnbalancedScopeException("'}' without a matching '{'", offset);
    }
    if (!frame.is(Frame.Kind.STOCHASTIC_FRAGMENT)) {
      throw new ConstructionException("No stochastic fragment is open", offset);
    }
    if (pendingBond != null) {
      throw new ConstructionException(
          String.format("Bond '%s' cannot end a stochastic fragment", pendingBond), offset);
    }
    checkNoLiveRings(frame, "stochastic fragment");
    if (frame.getDescriptorCount() == 0) {
      throw new ConstructionException("Stochastic fragment must contain at least one bonding descriptor", offset);
    }
    frames.pop();
    frame.getStochasticObject().addFragment((StochasticFragment) frame.getContainer());
  }

  /**
   * Closes the open fragment and opens the next one of the same stochastic object.
   *
   * @param separator The separator written between the two fragments.
   */
  public StochasticFragment nextStochasticFragment(String separator) throws BigSmilesException {
    closeStochasticFragment();
    StochasticObject stochasticObject = frames.peek().getStochasticObject();
    useSeparator(stochasticObject, separator);
    return openStochasticFragment();
  }

  public StochasticObject closeStochasticObject(String symbol, int index) throws BigSmilesException {
    return closeStochasticObject(symbol, index, index != 1);
  }

  /**
   * Closes the open stochastic object with its right end group. The last fragment must already be closed.
   */
  public StochasticObject closeStochasticObject(String symbol, int index, boolean indexExplicit)
      throws BigSmilesException {
    checkOpen();
    Frame frame = frames.peek();
    if (frame.is(Frame.Kind.ROOT)) {
      throw new UnbalancedScopeException("'}' without a matching '{'", offset);
    }
    if (frame.is(Frame.Kind.BRANCH)) {
      throw new UnbalancedScopeException(
          String.format("Branch opened at %d is still open at the end of the stochastic object",
              frame.getOpenedAt()), offset);
    }
    if (frame.is(Frame.Kind.STOCHASTIC_FRAGMENT)) {
      throw new ConstructionException("Stochastic fragment is still open", offset);
    }
    StochasticObject stochasticObject = frame.getStochasticObject();
    if (stochasticObject.getFragments().isEmpty()) {
      throw new ConstructionException("Stochastic object must contain at least one stochastic fragment", offset);
    }
    stochasticObject.setRightEndGroup(endGroup(stochasticObject, symbol, index), indexExplicit);
    frames.pop();
    frames.peek().setCurrent(Endpoint.stochasticObject(stochasticObject.getId()));
    LOGGER.debug("Closed stochastic object %d with %d fragments",
        stochasticObject.getId(), stochasticObject.getFragments().size());
    return stochasticObject;
  }

  /**
   * Records a ring index at the current atom. The first occurrence leaves a half-open bond, the second completes it.
   */
  public Bond addRing(int index) throws ConstructionException {
    checkOpen();
    Frame frame = frames.peek();
    Endpoint current = frame.getCurrent();
    if (current == null || !current.isAtom()) {
      throw new ConstructionException(String.format("Ring index %d must follow an atom", index), offset);
    }
    String symbol = pendingBond == null ? "" : pendingBond;
    pendingBond = null;

    Map<Integer, Integer> rings = frame.getRings();
    Atom atom = graph.getAtom(current.getIndex());
    if (!rings.containsKey(index)) {
      BondOrder order = symbol.isEmpty() ? BondOrder.SINGLE : BondOrder.fromSymbol(symbol).get();
      Bond bond = Bond.openRing(graph.nextBondId(), index, order, symbol, current);
      graph.appendBond(bond);
      atom.addBond(bond.getId());
      rings.put(index, bond.getId());
      return bond;
    }

    Bond bond = graph.getBond(rings.remove(index));
    Endpoint opener = bond.getFirst();
    if (opener.equals(current)) {
      throw new ConstructionException(String.format("Ring %d closes on the atom that opened it", index), offset);
    }
    if (areBonded(opener, current)) {
      throw new ConstructionException(
          String.format("Ring %d joins atoms %d and %d, which are already bonded",
              index, opener.getIndex(), current.getIndex()), offset);
    }
    bond.completeRing(current, resolveRingOrder(bond.getOpeningSymbol(), symbol, opener, current), symbol);
    atom.addBond(bond.getId());
    LOGGER.debug("Closed ring %d between atoms %d and %d", index, opener.getIndex(), current.getIndex());
    return bond;
  }

  public BondDescriptorAtom addBondingDescriptorAtom(String symbol, int index) throws ConstructionException {
    return addBondingDescriptorAtom(symbol, index, index != 1);
  }

  public BondDescriptorAtom addBondingDescriptorAtom(String symbol, int index, boolean indexExplicit)
      throws ConstructionException {
    checkOpen();
    if (BondDescriptor.IMPLICIT_SYMBOL.equals(symbol)) {
      throw new ConstructionException("The implicit end group '[]' can only end a stochastic object", offset);
    }
    Frame frame = requireContainerFrame("Bonding descriptors");
    Frame scope = findDescriptorScope();
    StochasticObject owner = scope.getStochasticObject();
    DescriptorRegistry registry = owner == null ? graph.getRootRegistry() : owner.getRegistry();

    BondDescriptor descriptor = registry.getOrCreate(symbol, index);
    BondDescriptorAtom descriptorAtom = new BondDescriptorAtom(graph.nextDescriptorAtomId(), descriptor,
        indexExplicit, owner == null ? null : owner.getId());
    graph.appendDescriptorAtom(descriptorAtom);
    descriptor.addOccurrence(descriptorAtom.getId());
    scope.addDescriptors(1);

    Endpoint endpoint = Endpoint.descriptorAtom(descriptorAtom.getId());
    bondFromCurrent(frame, endpoint);
    frame.getContainer().addNode(descriptorAtom);
    frame.setCurrent(endpoint);
    return descriptorAtom;
  }

  /**
   * Validates and freezes the graph: checks that every scope is closed, caps stochastic objects at the ends of the
   * string, checks implicit end groups, infers implicit hydrogens and pairs bonding descriptors.
   */
  public Graph exitConstruction() throws BigSmilesException {
    checkOpen();
    if (pendingBond != null) {
      throw new ConstructionException(String.format("Bond '%s' cannot end the input", pendingBond), offset);
    }
    if (frames.size() > 1) {
      Frame frame = frames.peek();
      String scope = frame.is(Frame.Kind.BRANCH) ? "Branch" : "Stochastic object";
      throw new UnbalancedScopeException(
          String.format("%s opened at %d was never closed", scope, frame.getOpenedAt()), offset);
    }
    checkNoLiveRings(rootFrame, "input");
    if (graph.isFragmentMode() && rootFrame.getDescriptorCount() == 0) {
      throw new ConstructionException("Stochastic fragment must contain at least one bonding descriptor", offset);
    }

    if (!graph.isFragmentMode()) {
      capStochasticEnds();
    }
    GraphFinalizer.finalizeGraph(graph);
    exited = true;
    return graph;
  }

  /**
   * Bonds an explicit "[H]" to a stochastic object that starts or ends the string, unless the object has an implicit
   * end group. A multiple bond out of such an object needs a written end atom instead.
   */
  private void capStochasticEnds() throws BigSmilesException {
    List<Node> nodes = graph.getNodes();
    if (nodes.isEmpty()) {
      return;
    }
    Node first = nodes.get(0);
    if (first instanceof StochasticObject && !hasImplicitEndGroup((StochasticObject) first)) {
      StochasticObject stochasticObject = (StochasticObject) first;
      checkCappable(stochasticObject, stochasticObject.getLeftEndGroup());
      Atom hydrogen = newAtom(HYDROGEN_CAP);
      graph.appendAtom(hydrogen);
      Bond bond = createBond("", Endpoint.atom(hydrogen.getId()),
          Endpoint.stochasticObject(stochasticObject.getId()));
      graph.insertNode(0, hydrogen);
      graph.insertNode(1, bond);
      LOGGER.debug("Capped the left end of stochastic object %d with atom %d", stochasticObject.getId(),
          hydrogen.getId());
    }

    Node last = nodes.get(nodes.size() - 1);
    if (last instanceof StochasticObject && !hasImplicitEndGroup((StochasticObject) last) &&
        !((StochasticObject) last).getRightBondId().isPresent()) {
      StochasticObject stochasticObject = (StochasticObject) last;
      checkCappable(stochasticObject, stochasticObject.getRightEndGroup());
      Atom hydrogen = addAtom(HYDROGEN_CAP);
      LOGGER.debug("Capped the right end of stochastic object %d with atom %d", stochasticObject.getId(),
          hydrogen.getId());
    }
  }

  private static boolean hasImplicitEndGroup(StochasticObject stochasticObject) {
    return stochasticObject.getLeftEndGroup().isImplicit() || stochasticObject.getRightEndGroup().isImplicit();
  }

  private void checkCappable(StochasticObject stochasticObject, BondDescriptor endGroup)
      throws ConstructionException {
    BondOrder order = endGroup.getBondOrder();
    if (order != null && order.getOrder() > 1.0) {
      throw new ConstructionException(String.format(
          "Bond '%s' out of stochastic object %d needs an explicit end atom", order.getSymbol(),
          stochasticObject.getId()), offset);
    }
  }

  private Atom newAtom(AtomFields fields) throws UnknownElementException {
    Element element = elementTable.lookup(fields.getSymbol()).orElseThrow(
        () -> new UnknownElementException(fields.getSymbol(), offset));
    return new Atom(graph.nextAtomId(), fields, element, elementTable.isAromaticSymbol(fields.getSymbol()));
  }

  /**
   * Appends a finished graph to the current scope, bonded from the current node to the donor's first node.
   *
   * @param donor A finalized graph whose first node is an atom or a stochastic object.
   * @param bondSymbol The bond symbol to join with, or "" for the default bond.
   */
  public void appendGraph(Graph donor, String bondSymbol) throws BigSmilesException {
    checkOpen();
    Frame frame = requireContainerFrame("Appended graphs");
    if (pendingBond != null) {
      throw new ConstructionException(
          String.format("Bond '%s' is pending; pass the bond symbol to appendGraph instead", pendingBond), offset);
    }
    checkDonorStart(donor);
    Frame scope = donor.isFragmentMode() ? findDescriptorScope() : null;
    List<Node> nodes = graft(donor, scope).getNodes();
    Endpoint target = GraphGrafter.endpointOf(nodes.get(0));

    if (frame.getCurrent() != null && StringUtils.isNotEmpty(bondSymbol)) {
      setPendingBond(bondSymbol);
    }
    bondFromCurrent(frame, target);
    frame.getContainer().addNodes(nodes);
    frame.setCurrent(GraphGrafter.lastEndpointOf(nodes));
  }

  /**
   * Attaches a finished graph as a new branch of an existing atom, after that atom's other branches.
   */
  public Branch attachBranch(int atomIndex, String bondSymbol, Graph donor) throws BigSmilesException {
    checkOpen();
    if (atomIndex < 0 || atomIndex >= graph.getAtoms().size()) {
      throw new IllegalArgumentException(String.format("No atom with index %d", atomIndex));
    }
    if (donor.isFragmentMode()) {
      throw new IllegalArgumentException("Branches cannot be grafted from fragment graphs");
    }
    Atom host = graph.getAtom(atomIndex);
    TreeLocator.Location location = locate(host);
    if (location == null) {
      throw new IllegalStateException(String.format("Atom %d is not in the node tree", atomIndex));
    }

    checkDonorStart(donor);
    GraphGrafter.Grafted grafted = graft(donor, null);
    Endpoint target = GraphGrafter.endpointOf(grafted.getNodes().get(0));

    Endpoint attachment = Endpoint.atom(atomIndex);
    Branch branch = new Branch(graph.nextContainerId(), attachment);
    branch.addNode(createBond(StringUtils.defaultString(bondSymbol), attachment, target));
    branch.addNodes(grafted.getNodes());

    NodeContainer container = location.getContainer();
    int position = location.getPosition() + 1;
    List<Node> siblings = container.getNodes();
    while (position < siblings.size() && siblings.get(position) instanceof Branch &&
        ((Branch) siblings.get(position)).getAttachment().equals(attachment)) {
      position++;
    }
    container.insertNode(position, branch);
    return branch;
  }

  /**
   * Splits the non-ring bond A-B into A-X-B, with the same order on both halves.
   */
  public Atom insertAtomIntoBond(int bondIndex, AtomFields fields) throws BigSmilesException {
    checkOpen();
    if (bondIndex < 0 || bondIndex >= graph.getBonds().size()) {
      throw new IllegalArgumentException(String.format("No bond with index %d", bondIndex));
    }
    Bond bond = graph.getBond(bondIndex);
    if (bond.isRing()) {
      throw new ConstructionException(String.format("Cannot insert an atom into ring bond %d", bondIndex), offset);
    }
    TreeLocator.Location location = locate(bond);
    if (location == null) {
      throw new IllegalStateException(String.format("Bond %d is not in the node tree", bondIndex));
    }
    Atom inserted = newAtom(fields);
    graph.appendAtom(inserted);
    Endpoint middle = Endpoint.atom(inserted.getId());
    Endpoint right = bond.getSecond();

    Bond leftHalf = new Bond(bondIndex, bond.getOrder(), bond.isExplicit(), bond.getStereo(), bond.getFirst(), middle);
    graph.replaceBond(leftHalf);
    Bond rightHalf = new Bond(graph.nextBondId(), bond.getOrder(), bond.isExplicit(), BondStereo.NONE, middle, right);
    graph.appendBond(rightHalf);
    inserted.addBond(leftHalf.getId());
    inserted.addBond(rightHalf.getId());
    rebind(right, bondIndex, rightHalf.getId());

    location.getContainer().insertNode(location.getPosition() + 1, inserted);
    location.getContainer().insertNode(location.getPosition() + 2, rightHalf);
    // The bond object was replaced in the arena; swap the tree node too.
    location.getContainer().removeNode(bond);
    location.getContainer().insertNode(location.getPosition(), leftHalf);
    return inserted;
  }

  /**
   * Adds a graph built with {@link #forFragment(String)} as the next fragment of the open stochastic object. Its
   * bonding descriptors are re-registered with the host object.
   */
  public StochasticFragment addGraphAsStochasticFragment(Graph donor) throws BigSmilesException {
    checkOpen();
    if (!donor.isFragmentMode()) {
      throw new IllegalArgumentException("Graph was not built as a stochastic fragment");
    }
    Frame frame = frames.peek();
    if (!frame.is(Frame.Kind.STOCHASTIC_OBJECT)) {
      throw new ConstructionException("No stochastic object is open to receive a fragment", offset);
    }
    StochasticObject stochasticObject = frame.getStochasticObject();
    if (!stochasticObject.getFragments().isEmpty()) {
      useSeparator(stochasticObject, DEFAULT_SEPARATOR);
    }
    StochasticFragment fragment = new StochasticFragment(graph.nextContainerId(), stochasticObject.getId());
    GraphGrafter.Grafted grafted = new GraphGrafter(graph).graft(donor, stochasticObject.getRegistry(),
        stochasticObject.getId());
    fragment.addNodes(grafted.getNodes());
    stochasticObject.addFragment(fragment);
    return fragment;
  }

  private GraphGrafter.Grafted graft(Graph donor, Frame scope) throws ConstructionException {
    GraphGrafter grafter = new GraphGrafter(graph);
    if (scope == null) {
      return grafter.graft(donor, null, null);
    }
    StochasticObject owner = scope.getStochasticObject();
    GraphGrafter.Grafted grafted = owner == null ?
        grafter.graft(donor, graph.getRootRegistry(), null) :
        grafter.graft(donor, owner.getRegistry(), owner.getId());
    scope.addDescriptors(grafted.getRootDescriptorCount());
    return grafted;
  }

  /**
   * Finds a node in the placed tree or in one of the open scopes, which join their parents only when closed.
   */
  private TreeLocator.Location locate(Node node) {
    TreeLocator.Location location = TreeLocator.locate(graph, node);
    for (Frame frame : frames) {
      if (location != null) {
        break;
      }
      if (frame.getContainer() != null && frame.getContainer() != graph) {
        location = TreeLocator.locate(frame.getContainer(), node);
      }
    }
    return location;
  }

  private static void checkDonorStart(Graph donor) {
    if (!donor.isFrozen()) {
      throw new IllegalArgumentException("Only finalized graphs can be grafted");
    }
    if (donor.isEmpty() || !(donor.getNodes().get(0) instanceof Atom ||
        donor.getNodes().get(0) instanceof StochasticObject)) {
      throw new IllegalArgumentException("Grafted graph must start with an atom or a stochastic object");
    }
  }

  private void useSeparator(StochasticObject stochasticObject, String separator) throws ConstructionException {
    String existing = stochasticObject.getSeparator().orElse(null);
    if (existing != null && !existing.equals(separator)) {
      throw new ConstructionException(
          String.format("Stochastic object %d mixes separators '%s' and '%s'",
              stochasticObject.getId(), existing, separator), offset);
    }
    stochasticObject.setSeparator(separator);
  }

  private BondDescriptor endGroup(StochasticObject stochasticObject, String symbol, int index) {
    if (BondDescriptor.IMPLICIT_SYMBOL.equals(symbol)) {
      return BondDescriptor.implicit();
    }
    BondDescriptor descriptor = stochasticObject.getRegistry().getOrCreate(symbol, index);
    descriptor.addEndGroupUse();
    return descriptor;
  }

  private Frame findDescriptorScope() throws ConstructionException {
    for (Frame frame : frames) {
      if (frame.is(Frame.Kind.STOCHASTIC_FRAGMENT)) {
        return frame;
      }
      if (frame.is(Frame.Kind.STOCHASTIC_OBJECT)) {
        throw new ConstructionException("Bonding descriptors must be inside a stochastic fragment", offset);
      }
    }
    if (graph.isFragmentMode()) {
      return rootFrame;
    }
    throw new ConstructionException("Bonding descriptor found outside of a stochastic object", offset);
  }

  private Frame requireContainerFrame(String what) throws ConstructionException {
    Frame frame = frames.peek();
    if (frame.is(Frame.Kind.STOCHASTIC_OBJECT)) {
      throw new ConstructionException(
          String.format("%s must be inside a stochastic fragment, not directly in a stochastic object", what),
          offset);
    }
    return frame;
  }

  private void checkNoLiveRings(Frame frame, String scope) throws UnmatchedRingException {
    if (!frame.getRings().isEmpty()) {
      int index = frame.getRings().keySet().iterator().next();
      throw new UnmatchedRingException(index,
          String.format("Ring %d is still open at the end of the %s", index, scope), offset);
    }
  }

  private void checkOpen() {
    if (exited) {
      throw new IllegalStateException("Construction has already finished");
    }
  }

  /**
   * Bonds the frame's current node to the target, consuming the pending bond symbol. Does nothing when the frame
   * has no current node.
   */
  private Bond bondFromCurrent(Frame frame, Endpoint target) throws ConstructionException {
    Endpoint current = frame.getCurrent();
    if (current == null) {
      return null;
    }
    String symbol = pendingBond == null ? "" : pendingBond;
    pendingBond = null;
    Bond bond = createBond(symbol, current, target);
    frame.getContainer().addNode(bond);
    return bond;
  }

  private Bond createBond(String symbol, Endpoint from, Endpoint to) throws ConstructionException {
    if (from.getKind() == Endpoint.Kind.DESCRIPTOR_ATOM && to.getKind() == Endpoint.Kind.DESCRIPTOR_ATOM) {
      throw new ConstructionException("Two bonding descriptors cannot bond to each other", offset);
    }
    BondOrder order;
    boolean explicit = !symbol.isEmpty();
    if (explicit) {
      order = BondOrder.fromSymbol(symbol).orElseThrow(
          () -> new ConstructionException(String.format("Unknown bond symbol '%s'", symbol), offset));
    } else {
      order = graph.isAromatic(from) && graph.isAromatic(to) ? BondOrder.AROMATIC : BondOrder.SINGLE;
    }
    Bond bond = new Bond(graph.nextBondId(), order, explicit, BondStereo.fromSymbol(symbol), from, to);
    // Endpoints are checked before the bond enters the arena so a failure leaves no dangling bond.
    checkDescriptorEndpoint(from, order);
    checkDescriptorEndpoint(to, order);
    graph.appendBond(bond);
    registerBond(from, bond, true);
    registerBond(to, bond, false);
    return bond;
  }

  private void checkDescriptorEndpoint(Endpoint endpoint, BondOrder order) throws ConstructionException {
    if (endpoint.getKind() != Endpoint.Kind.DESCRIPTOR_ATOM) {
      return;
    }
    BondDescriptorAtom descriptorAtom = graph.getDescriptorAtom(endpoint.getIndex());
    if (descriptorAtom.getBondId().isPresent()) {
      throw new ConstructionException(
          String.format("Bonding descriptor %s can only bond to one atom", descriptorAtom.getDescriptor()), offset);
    }
    if (!descriptorAtom.getDescriptor().recordBondOrder(order)) {
      throw new ConstructionException(
          String.format("Bonding descriptor %s is used with bond orders '%s' and '%s'",
              descriptorAtom.getDescriptor(), descriptorAtom.getDescriptor().getBondOrder().getSymbol(),
              order.getSymbol()), offset);
    }
  }

  private void registerBond(Endpoint endpoint, Bond bond, boolean isFirst) {
    switch (endpoint.getKind()) {
      case ATOM:
        graph.getAtom(endpoint.getIndex()).addBond(bond.getId());
        break;
      case DESCRIPTOR_ATOM:
        graph.getDescriptorAtom(endpoint.getIndex()).setBond(bond.getId());
        break;
      case STOCHASTIC_OBJECT:
        StochasticObject stochasticObject = graph.getStochasticObject(endpoint.getIndex());
        if (isFirst) {
          if (!stochasticObject.getRightBondId().isPresent()) {
            stochasticObject.setRightBondId(bond.getId());
          }
        } else {
          stochasticObject.setLeftBondId(bond.getId());
        }
        break;
      default:
        throw new IllegalStateException(String.format("Unhandled endpoint kind %s", endpoint.getKind()));
    }
  }

  private void rebind(Endpoint endpoint, int oldBondId, int newBondId) {
    switch (endpoint.getKind()) {
      case ATOM:
        graph.getAtom(endpoint.getIndex()).replaceBond(oldBondId, newBondId);
        break;
      case DESCRIPTOR_ATOM:
        graph.getDescriptorAtom(endpoint.getIndex()).rebind(newBondId);
        break;
      case STOCHASTIC_OBJECT:
        graph.getStochasticObject(endpoint.getIndex()).setLeftBondId(newBondId);
        break;
      default:
        throw new IllegalStateException(String.format("Unhandled endpoint kind %s", endpoint.getKind()));
    }
  }

  /**
   * Whether a real bond joins the two atoms. A '.' disconnection does not count, so "C1.C1" may close a ring.
   */
  private boolean areBonded(Endpoint a, Endpoint b) {
    for (Integer bondId : graph.getAtom(a.getIndex()).getBondIds()) {
      Bond bond = graph.getBond(bondId);
      if (!bond.isPending() && bond.getOrder() != BondOrder.ZERO && bond.connects(b)) {
        return true;
      }
    }
    return false;
  }

  /**
   * The higher of the explicit orders written at either end wins; with none written, two aromatic atoms close an
   * aromatic bond and anything else a single bond.
   */
  private BondOrder resolveRingOrder(String openingSymbol, String closingSymbol, Endpoint opener, Endpoint closer) {
    BondOrder order = null;
    for (String symbol : new String[]{openingSymbol, closingSymbol}) {
      if (symbol.isEmpty()) {
        continue;
      }
      BondOrder candidate = BondOrder.fromSymbol(symbol).get();
      if (order == null || candidate.getOrder() > order.getOrder()) {
        order = candidate;
      }
    }
    if (order != null) {
      return order;
    }
    return graph.isAromatic(opener) && graph.isAromatic(closer) ? BondOrder.AROMATIC : BondOrder.SINGLE;
  }
}
