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

package com.twentyn.bigsmiles.errors;

/**
 * Base class of every fatal parse or construction failure.
 * The offset is the position in the input text where the problem was detected, or -1 when it is not tied to one.
 */
public class BigSmilesException extends Exception {
  public static final int NO_OFFSET = -1;

  private final int offset;

  public BigSmilesException(String msg) {
    this(msg, NO_OFFSET);
  }

  public BigSmilesException(String msg, int offset) {
    super(msg);
    this.offset = offset;
  }

  public BigSmilesException(String msg, int offset, Throwable cause) {
    super(msg, cause);
    this.offset = offset;
  }

  public int getOffset() {
    return offset;
  }

  public boolean hasOffset() {
    return offset != NO_OFFSET;
  }
}
