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

import com.twentyn.bigsmiles.model.BondDescriptor;
import com.twentyn.bigsmiles.model.DescriptorMismatchWarning;
import com.twentyn.bigsmiles.model.Graph;
import com.twentyn.bigsmiles.model.StochasticObject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that every bonding descriptor of a stochastic object has a partner: '<n' needs '>n' and the reverse, '$n'
 * needs a second '$n'. End groups count. Nothing is bonded here; misses become warnings.
 */
final class DescriptorChecker {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DescriptorChecker.class);

  private DescriptorChecker() {
  }

  static List<DescriptorMismatchWarning> check(Graph graph) {
    List<DescriptorMismatchWarning> warnings = new ArrayList<>();
    for (StochasticObject stochasticObject : graph.getStochasticObjects()) {
      for (BondDescriptor descriptor : stochasticObject.getRegistry().getDescriptors()) {
        String problem = findProblem(stochasticObject, descriptor);
        if (problem == null) {
          continue;
        }
        String msg = String.format("Stochastic object %d: %s", stochasticObject.getId(), problem);
        LOGGER.warn(msg);
        warnings.add(new DescriptorMismatchWarning(stochasticObject.getId(), descriptor, msg));
      }
    }
    return warnings;
  }

  private static String findProblem(StochasticObject stochasticObject, BondDescriptor descriptor) {
    if (descriptor.isImplicit()) {
      return null;
    }
    if (BondDescriptor.NON_DIRECTIONAL_SYMBOL.equals(descriptor.getSymbol())) {
      if (descriptor.getUseCount() < 2) {
        return String.format("bonding descriptor %s appears only once and has nothing to bond with", descriptor);
      }
      return null;
    }
    if (!stochasticObject.getRegistry().get(descriptor.getComplementSymbol(), descriptor.getIndex()).isPresent()) {
      return String.format("bonding descriptor %s has no complementary '%s%d'", descriptor,
          descriptor.getComplementSymbol(), descriptor.getIndex());
    }
    return null;
  }
}
