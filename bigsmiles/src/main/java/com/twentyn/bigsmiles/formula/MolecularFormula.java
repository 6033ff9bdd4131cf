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

package com.twentyn.bigsmiles.formula;

import com.twentyn.bigsmiles.chemistry.Element;
import com.twentyn.bigsmiles.chemistry.ElementTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Element counts of a molecule or of one stochastic fragment.
 *
 * Stochastic objects nested in the counted structure are not expanded; they are counted as "{}" placeholders and
 * written at the end of the formula string ("C2H4{}2"). Masses ignore the placeholders.
 */
public class MolecularFormula {
  public static final String CARBON = "C";
  public static final String HYDROGEN = "H";
  public static final String STOCHASTIC_PLACEHOLDER = "{}";

  private final Map<String, Integer> elementCounts;
  private final int stochasticObjectCount;

  public MolecularFormula(Map<String, Integer> elementCounts, int stochasticObjectCount) {
    this.elementCounts = Collections.unmodifiableMap(new TreeMap<>(elementCounts));
    this.stochasticObjectCount = stochasticObjectCount;
  }

  public Map<String, Integer> getElementCounts() {
    return elementCounts;
  }

  public int getCount(String symbol) {
    return elementCounts.getOrDefault(symbol, 0);
  }

  public int getStochasticObjectCount() {
    return stochasticObjectCount;
  }

  public boolean containsStochasticObject() {
    return stochasticObjectCount > 0;
  }

  /**
   * The formula in Hill order: carbon, then hydrogen, then the rest alphabetically. Without carbon every element,
   * hydrogen included, is alphabetical.
   */
  public String getFormula() {
    List<String> order = new ArrayList<>(elementCounts.keySet());
    if (elementCounts.containsKey(CARBON)) {
      order.remove(CARBON);
      order.remove(HYDROGEN);
      order.add(0, CARBON);
      if (elementCounts.containsKey(HYDROGEN)) {
        order.add(1, HYDROGEN);
      }
    }

    StringBuilder formula = new StringBuilder();
    for (String symbol : order) {
      formula.append(symbol);
      int count = elementCounts.get(symbol);
      if (count != 1) {
        formula.append(count);
      }
    }
    if (stochasticObjectCount > 0) {
      formula.append(STOCHASTIC_PLACEHOLDER);
      if (stochasticObjectCount != 1) {
        formula.append(stochasticObjectCount);
      }
    }
    return formula.toString();
  }

  /**
   * Average molar mass in g/mol.
   */
  public double getMolarMass() {
    double mass = 0.0;
    for (Map.Entry<String, Integer> entry : elementCounts.entrySet()) {
      mass += atomicMass(entry.getKey()) * entry.getValue();
    }
    return mass;
  }

  /**
   * Mass fraction of every element.
   */
  public Map<String, Double> getElementalAnalysis() {
    double molarMass = getMolarMass();
    Map<String, Double> fractions = new LinkedHashMap<>();
    for (Map.Entry<String, Integer> entry : elementCounts.entrySet()) {
      fractions.put(entry.getKey(), atomicMass(entry.getKey()) * entry.getValue() / molarMass);
    }
    return fractions;
  }

  private static double atomicMass(String symbol) {
    Element element = ElementTable.getInstance().lookup(symbol).orElseThrow(
        () -> new IllegalStateException(String.format("Unknown element %s in formula", symbol)));
    return element.getAtomicMass();
  }

  @Override
  public String toString() {
    return getFormula();
  }
}
