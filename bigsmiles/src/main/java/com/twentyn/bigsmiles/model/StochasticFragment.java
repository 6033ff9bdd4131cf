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

public class StochasticFragment extends NodeContainer implements Node {
  private final int id;
  private final int stochasticObjectId;

  public StochasticFragment(int id, int stochasticObjectId) {
    this.id = id;
    this.stochasticObjectId = stochasticObjectId;
  }

  public int getId() {
    return id;
  }

  public int getStochasticObjectId() {
    return stochasticObjectId;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitStochasticFragment(this);
  }

  @Override
  public String toString() {
    return String.format("StochasticFragment[%d of %d]", id, stochasticObjectId);
  }
}
