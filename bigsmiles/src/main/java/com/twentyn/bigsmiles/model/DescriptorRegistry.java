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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bonding descriptors of one stochastic object, in order of first use.
 */
public class DescriptorRegistry {
  private final Map<String, BondDescriptor> descriptors = new LinkedHashMap<>();
  private boolean frozen = false;

  public BondDescriptor getOrCreate(String symbol, int index) {
    BondDescriptor descriptor = descriptors.get(BondDescriptor.key(symbol, index));
    if (descriptor != null) {
      return descriptor;
    }
    if (frozen) {
      throw new IllegalStateException(
          String.format("Cannot add bonding descriptor [%s%d] to a finalized graph", symbol, index));
    }
    descriptor = new BondDescriptor(symbol, index);
    descriptors.put(descriptor.getKey(), descriptor);
    return descriptor;
  }

  public Optional<BondDescriptor> get(String symbol, int index) {
    return Optional.ofNullable(descriptors.get(BondDescriptor.key(symbol, index)));
  }

  public List<BondDescriptor> getDescriptors() {
    return new ArrayList<>(descriptors.values());
  }

  public boolean isEmpty() {
    return descriptors.isEmpty();
  }

  void freeze() {
    frozen = true;
    descriptors.values().forEach(BondDescriptor::freeze);
  }
}
