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

package com.twentyn.bigsmiles.chemistry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One entry of the periodic table, as read from the bundled elements resource.
 */
public class Element {

  @JsonProperty("symbol")
  private String symbol;

  @JsonProperty("atomic_number")
  private Integer atomicNumber;

  @JsonProperty("atomic_mass")
  private Double atomicMass;

  // Allowed valences in increasing order; empty for elements that may only appear in brackets.
  @JsonProperty("valences")
  private List<Integer> valences;

  @JsonProperty("organic")
  private boolean organic;

  @JsonProperty("aromatic")
  private boolean aromatic;

  @JsonCreator
  public Element(@JsonProperty("symbol") String symbol,
                 @JsonProperty("atomic_number") Integer atomicNumber,
                 @JsonProperty("atomic_mass") Double atomicMass,
                 @JsonProperty("valences") List<Integer> valences,
                 @JsonProperty("organic") boolean organic,
                 @JsonProperty("aromatic") boolean aromatic) {
    this.symbol = symbol;
    this.atomicNumber = atomicNumber;
    this.atomicMass = atomicMass;
    this.valences = valences == null ? new ArrayList<>() : new ArrayList<>(valences);
    Collections.sort(this.valences);
    this.organic = organic;
    this.aromatic = aromatic;
  }

  public String getSymbol() {
    return symbol;
  }

  public Integer getAtomicNumber() {
    return atomicNumber;
  }

  public Double getAtomicMass() {
    return atomicMass;
  }

  public List<Integer> getValences() {
    return Collections.unmodifiableList(valences);
  }

  /**
   * True if the element belongs to the organic subset and may be written without brackets.
   */
  public boolean isOrganic() {
    return organic;
  }

  /**
   * True if the element has a lower-case aromatic form.
   */
  public boolean isAromatic() {
    return aromatic;
  }

  public String getAromaticSymbol() {
    return symbol.toLowerCase();
  }

  /**
   * Picks the smallest allowed valence that can hold the given bond sum.
   * Falls back to the largest allowed valence when none is big enough, and to 0 for elements without valences.
   */
  public int resolveValence(double bondSum) {
    if (valences.isEmpty()) {
      return 0;
    }
    for (Integer valence : valences) {
      if (valence >= bondSum) {
        return valence;
      }
    }
    return valences.get(valences.size() - 1);
  }

  @Override
  public boolean equals(Object o) {
    return (o instanceof Element) && symbol.equals(((Element) o).getSymbol());
  }

  @Override
  public int hashCode() {
    return symbol.hashCode();
  }

  @Override
  public String toString() {
    return symbol;
  }
}
