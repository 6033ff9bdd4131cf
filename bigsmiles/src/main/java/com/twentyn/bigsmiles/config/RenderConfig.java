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

package com.twentyn.bigsmiles.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

public class RenderConfig {
  public static final String DEFAULT_RESOURCE = "render_config.json";

  // Wrap atoms, bonds and descriptors in ANSI color codes.  Only useful on a terminal.
  @JsonProperty(value = "color_output")
  @JsonSetter(nulls = Nulls.SKIP)
  boolean colorOutput = false;

  // Write "[<1]" instead of "[<]" for descriptors with the default index.
  @JsonProperty(value = "show_bond_descriptor_one_index")
  @JsonSetter(nulls = Nulls.SKIP)
  boolean showBondDescriptorOneIndex = false;

  // Write ':' between aromatic atoms even where the input left it implicit.
  @JsonProperty(value = "show_aromatic_bond")
  @JsonSetter(nulls = Nulls.SKIP)
  boolean showAromaticBond = false;

  // Repeat a ring bond's order symbol on both of its ring indices ("C=1CCCC=1").
  @JsonProperty(value = "show_multi_bonds_on_both_ring_index")
  @JsonSetter(nulls = Nulls.SKIP)
  boolean showMultiBondsOnBothRingIndex = false;

  public RenderConfig() {
  }

  public RenderConfig(boolean colorOutput, boolean showBondDescriptorOneIndex, boolean showAromaticBond,
                      boolean showMultiBondsOnBothRingIndex) {
    this.colorOutput = colorOutput;
    this.showBondDescriptorOneIndex = showBondDescriptorOneIndex;
    this.showAromaticBond = showAromaticBond;
    this.showMultiBondsOnBothRingIndex = showMultiBondsOnBothRingIndex;
  }

  public static RenderConfig defaults() {
    return ConfigLoader.loadResource(DEFAULT_RESOURCE, RenderConfig.class);
  }

  public boolean getColorOutput() {
    return colorOutput;
  }

  public void setColorOutput(boolean colorOutput) {
    this.colorOutput = colorOutput;
  }

  public boolean getShowBondDescriptorOneIndex() {
    return showBondDescriptorOneIndex;
  }

  public void setShowBondDescriptorOneIndex(boolean showBondDescriptorOneIndex) {
    this.showBondDescriptorOneIndex = showBondDescriptorOneIndex;
  }

  public boolean getShowAromaticBond() {
    return showAromaticBond;
  }

  public void setShowAromaticBond(boolean showAromaticBond) {
    this.showAromaticBond = showAromaticBond;
  }

  public boolean getShowMultiBondsOnBothRingIndex() {
    return showMultiBondsOnBothRingIndex;
  }

  public void setShowMultiBondsOnBothRingIndex(boolean showMultiBondsOnBothRingIndex) {
    this.showMultiBondsOnBothRingIndex = showMultiBondsOnBothRingIndex;
  }
}
