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

public class ParseConfig {
  public static final String DEFAULT_RESOURCE = "parse_config.json";

  // Give every repeated pair of a re-used ring index ("C1CC1C1CC1") its own fresh index before construction.
  @JsonProperty(value = "renumber_duplicate_rings")
  @JsonSetter(nulls = Nulls.SKIP)
  boolean renumberDuplicateRings = true;

  // Split reaction species joined by '.' into separate graphs where the cut is charge-balanced.
  @JsonProperty(value = "split_disconnected_reaction_species")
  @JsonSetter(nulls = Nulls.SKIP)
  boolean splitDisconnectedReactionSpecies = true;

  public ParseConfig() {
  }

  public ParseConfig(boolean renumberDuplicateRings, boolean splitDisconnectedReactionSpecies) {
    this.renumberDuplicateRings = renumberDuplicateRings;
    this.splitDisconnectedReactionSpecies = splitDisconnectedReactionSpecies;
  }

  public static ParseConfig defaults() {
    return ConfigLoader.loadResource(DEFAULT_RESOURCE, ParseConfig.class);
  }

  public boolean getRenumberDuplicateRings() {
    return renumberDuplicateRings;
  }

  public void setRenumberDuplicateRings(boolean renumberDuplicateRings) {
    this.renumberDuplicateRings = renumberDuplicateRings;
  }

  public boolean getSplitDisconnectedReactionSpecies() {
    return splitDisconnectedReactionSpecies;
  }

  public void setSplitDisconnectedReactionSpecies(boolean splitDisconnectedReactionSpecies) {
    this.splitDisconnectedReactionSpecies = splitDisconnectedReactionSpecies;
  }
}
