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
import java.util.Optional;

/**
 * A stochastic object: an ensemble of repeat units written between braces, "{[<]CC[>]}".
 */
public class StochasticObject implements Node {
  private final int id;
  private final List<StochasticFragment> fragments = new ArrayList<>();
  private final DescriptorRegistry registry = new DescriptorRegistry();

  private BondDescriptor leftEndGroup;
  private boolean leftIndexExplicit;
  private BondDescriptor rightEndGroup;
  private boolean rightIndexExplicit;
  private String separator;
  private Integer leftBondId;
  private Integer rightBondId;
  private Distribution distribution;
  private boolean frozen = false;

  public StochasticObject(int id) {
    this.id = id;
  }

  public int getId() {
    return id;
  }

  public List<StochasticFragment> getFragments() {
    return Collections.unmodifiableList(fragments);
  }

  public void addFragment(StochasticFragment fragment) {
    checkMutable();
    fragments.add(fragment);
  }

  public DescriptorRegistry getRegistry() {
    return registry;
  }

  public BondDescriptor getLeftEndGroup() {
    return leftEndGroup;
  }

  public boolean isLeftIndexExplicit() {
    return leftIndexExplicit;
  }

  public void setLeftEndGroup(BondDescriptor leftEndGroup, boolean indexExplicit) {
    checkMutable();
    this.leftEndGroup = leftEndGroup;
    this.leftIndexExplicit = indexExplicit;
  }

  public BondDescriptor getRightEndGroup() {
    return rightEndGroup;
  }

  public boolean isRightIndexExplicit() {
    return rightIndexExplicit;
  }

  public void setRightEndGroup(BondDescriptor rightEndGroup, boolean indexExplicit) {
    checkMutable();
    this.rightEndGroup = rightEndGroup;
    this.rightIndexExplicit = indexExplicit;
  }

  public boolean isClosed() {
    return rightEndGroup != null;
  }

  public Optional<String> getSeparator() {
    return Optional.ofNullable(separator);
  }

  public void setSeparator(String separator) {
    checkMutable();
    this.separator = separator;
  }

  public Optional<Integer> getLeftBondId() {
    return Optional.ofNullable(leftBondId);
  }

  public void setLeftBondId(Integer leftBondId) {
    checkMutable();
    this.leftBondId = leftBondId;
  }

  /**
   * The first bond written after the closing brace. Later bonds to this object, such as a chain continuing after a
   * branch, are reachable through the bonds' endpoints only.
   */
  public Optional<Integer> getRightBondId() {
    return Optional.ofNullable(rightBondId);
  }

  public void setRightBondId(Integer rightBondId) {
    checkMutable();
    this.rightBondId = rightBondId;
  }

  public Optional<Distribution> getDistribution() {
    return Optional.ofNullable(distribution);
  }

  /**
   * Attaches a distribution. Only one attachment is allowed per object.
   */
  public void attachDistribution(Distribution distribution) {
    if (distribution == null) {
      throw new IllegalArgumentException("Distribution must not be null");
    }
    if (this.distribution != null) {
      throw new IllegalStateException(String.format("Stochastic object %d already has a distribution", id));
    }
    this.distribution = distribution;
  }

  /**
   * Freezes the object and its descriptors. {@link #attachDistribution(Distribution)} stays available.
   */
  void freeze() {
    frozen = true;
    registry.freeze();
  }

  private void checkMutable() {
    if (frozen) {
      throw new IllegalStateException(String.format("Stochastic object %d belongs to a finalized graph", id));
    }
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitStochasticObject(this);
  }

  @Override
  public String toString() {
    return String.format("StochasticObject[%d: %d fragments]", id, fragments.size());
  }
}
