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

package com.twentyn.bigsmiles.render;

import com.twentyn.bigsmiles.config.RenderConfig;
import com.twentyn.bigsmiles.model.ArrowKind;
import com.twentyn.bigsmiles.model.Atom;
import com.twentyn.bigsmiles.model.Bond;
import com.twentyn.bigsmiles.model.BondDescriptor;
import com.twentyn.bigsmiles.model.BondDescriptorAtom;
import com.twentyn.bigsmiles.model.BondOrder;
import com.twentyn.bigsmiles.model.Branch;
import com.twentyn.bigsmiles.model.Endpoint;
import com.twentyn.bigsmiles.model.Graph;
import com.twentyn.bigsmiles.model.Node;
import com.twentyn.bigsmiles.model.NodeVisitor;
import com.twentyn.bigsmiles.model.Reaction;
import com.twentyn.bigsmiles.model.StochasticFragment;
import com.twentyn.bigsmiles.model.StochasticObject;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes graphs and reactions back to line notation.
 *
 * Bond symbols, descriptor indices and ring-closure symbols are written where the input wrote them, so text in
 * canonical form comes back token for token. Charges are always written in the "+2" form.
 */
public class BigSmilesWriter {
  private final RenderConfig config;

  public BigSmilesWriter() {
    this(RenderConfig.defaults());
  }

  public BigSmilesWriter(RenderConfig config) {
    this.config = config;
  }

  public static String write(Graph graph, RenderConfig config) {
    return new BigSmilesWriter(config).render(graph);
  }

  public static String write(Reaction reaction, RenderConfig config) {
    return new BigSmilesWriter(config).render(reaction);
  }

  public String render(Graph graph) {
    RenderVisitor visitor = new RenderVisitor(graph);
    for (Node node : graph.getNodes()) {
      node.accept(visitor);
    }
    return visitor.builder.toString();
  }

  public String render(Reaction reaction) {
    List<String> parts = new ArrayList<>();
    parts.add(renderGroup(reaction.getReactants()));
    if (!reaction.getAgents().isEmpty() || reaction.getArrowKind() == ArrowKind.THREE_PART) {
      parts.add(renderGroup(reaction.getAgents()));
    }
    parts.add(renderGroup(reaction.getProducts()));
    return StringUtils.join(parts, reaction.getArrowKind().getSymbol());
  }

  private String renderGroup(List<Graph> graphs) {
    List<String> species = new ArrayList<>(graphs.size());
    for (Graph graph : graphs) {
      species.add(render(graph));
    }
    return StringUtils.join(species, ",");
  }

  static String formatCharge(int charge) {
    if (charge == 0) {
      return "";
    }
    String sign = charge > 0 ? "+" : "-";
    return Math.abs(charge) == 1 ? sign : sign + Math.abs(charge);
  }

  static String formatRingIndex(int index) {
    return index < 10 ? Integer.toString(index) : "%" + index;
  }

  private String color(TerminalColors color, String text) {
    if (!config.getColorOutput() || text.isEmpty()) {
      return text;
    }
    return color.wrap(text);
  }

  private class RenderVisitor implements NodeVisitor<Void> {
    private final Graph graph;
    private final StringBuilder builder = new StringBuilder();

    RenderVisitor(Graph graph) {
      this.graph = graph;
    }

    @Override
    public Void visitAtom(Atom atom) {
      builder.append(color(TerminalColors.CYAN, atomText(atom)));
      Endpoint self = Endpoint.atom(atom.getId());
      for (Integer bondId : atom.getBondIds()) {
        Bond bond = graph.getBond(bondId);
        if (!bond.isRing()) {
          continue;
        }
        String symbol = bond.getFirst().equals(self) ? bond.getOpeningSymbol() : bond.getClosingSymbol();
        if (symbol.isEmpty() && showImplicitSymbol(bond)) {
          symbol = bond.getOrder().getSymbol();
        }
        builder.append(color(TerminalColors.YELLOW, symbol));
        builder.append(color(TerminalColors.GREEN, formatRingIndex(bond.getRingIndex().get())));
      }
      return null;
    }

    private boolean showImplicitSymbol(Bond bond) {
      BondOrder order = bond.getOrder();
      if (order == BondOrder.AROMATIC) {
        return config.getShowAromaticBond();
      }
      return config.getShowMultiBondsOnBothRingIndex() && bond.isExplicit() && order.getOrder() > 1.0;
    }

    private String atomText(Atom atom) {
      if (!atom.isExtended()) {
        return atom.getSymbol();
      }
      StringBuilder text = new StringBuilder("[");
      atom.getIsotope().ifPresent(text::append);
      text.append(atom.getSymbol());
      atom.getStereo().ifPresent(text::append);
      atom.getExplicitHydrogens().ifPresent(h -> text.append(h == 1 ? "H" : "H" + h));
      text.append(formatCharge(atom.getCharge()));
      atom.getAtomClass().ifPresent(c -> text.append(':').append(c));
      return text.append(']').toString();
    }

    @Override
    public Void visitBond(Bond bond) {
      if (bond.isExplicit() || (bond.getOrder() == BondOrder.AROMATIC && config.getShowAromaticBond())) {
        builder.append(color(TerminalColors.YELLOW, bond.getSymbol()));
      }
      return null;
    }

    @Override
    public Void visitDescriptorAtom(BondDescriptorAtom descriptorAtom) {
      builder.append(descriptorText(descriptorAtom.getDescriptor(), descriptorAtom.isIndexExplicit()));
      return null;
    }

    private String descriptorText(BondDescriptor descriptor, boolean indexExplicit) {
      String text = "[" + descriptor.getSymbol();
      if (!descriptor.isImplicit() &&
          (indexExplicit || descriptor.getIndex() != 1 || config.getShowBondDescriptorOneIndex())) {
        text += descriptor.getIndex();
      }
      return color(TerminalColors.BLUE, text + "]");
    }

    @Override
    public Void visitBranch(Branch branch) {
      builder.append('(');
      for (Node node : branch.getNodes()) {
        node.accept(this);
      }
      builder.append(')');
      return null;
    }

    @Override
    public Void visitStochasticObject(StochasticObject stochasticObject) {
      builder.append(color(TerminalColors.MAGENTA, "{"));
      builder.append(descriptorText(stochasticObject.getLeftEndGroup(), stochasticObject.isLeftIndexExplicit()));
      String separator = stochasticObject.getSeparator().orElse(",");
      boolean first = true;
      for (StochasticFragment fragment : stochasticObject.getFragments()) {
        if (!first) {
          builder.append(separator);
        }
        fragment.accept(this);
        first = false;
      }
      builder.append(descriptorText(stochasticObject.getRightEndGroup(), stochasticObject.isRightIndexExplicit()));
      builder.append(color(TerminalColors.MAGENTA, "}"));
      return null;
    }

    @Override
    public Void visitStochasticFragment(StochasticFragment fragment) {
      for (Node node : fragment.getNodes()) {
        node.accept(this);
      }
      return null;
    }
  }
}
