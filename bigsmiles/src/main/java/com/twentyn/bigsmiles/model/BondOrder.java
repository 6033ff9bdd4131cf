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

import java.util.Optional;

/**
 * Bond orders and the symbols that write them. ZERO is the '.' disconnect.
 */
public enum BondOrder {
  ZERO(".", 0.0),
  SINGLE("-", 1.0),
  DOUBLE("=", 2.0),
  TRIPLE("#", 3.0),
  QUADRUPLE("$", 4.0),
  AROMATIC(":", 1.5),
  ;

  private final String symbol;
  private final double order;

  BondOrder(String symbol, double order) {
    this.symbol = symbol;
    this.order = order;
  }

  public String getSymbol() {
    return symbol;
  }

  public double getOrder() {
    return order;
  }

  /**
   * Maps a written bond symbol to its order. The directional markers '/' and '\' are single bonds.
   */
  public static Optional<BondOrder> fromSymbol(String symbol) {
    if (BondStereo.fromSymbol(symbol) != BondStereo.NONE) {
      return Optional.of(SINGLE);
    }
    for (BondOrder bondOrder : values()) {
      if (bondOrder.symbol.equals(symbol)) {
        return Optional.of(bondOrder);
      }
    }
    return Optional.empty();
  }
}
