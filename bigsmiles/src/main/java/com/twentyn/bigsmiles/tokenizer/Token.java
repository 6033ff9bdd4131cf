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

package com.twentyn.bigsmiles.tokenizer;

import java.util.Objects;

/**
 * A classified piece of the input. Equality ignores the offset, so token sequences of differently spaced strings
 * compare equal.
 */
public class Token {
  private final TokenKind kind;
  private final String value;
  private final int offset;

  public Token(TokenKind kind, String value, int offset) {
    this.kind = kind;
    this.value = value;
    this.offset = offset;
  }

  public TokenKind getKind() {
    return kind;
  }

  public String getValue() {
    return value;
  }

  public int getOffset() {
    return offset;
  }

  public boolean is(TokenKind other) {
    return kind == other;
  }

  /**
   * Ring index carried by a RING or RING2 token.
   */
  public int getRingIndex() {
    if (kind != TokenKind.RING && kind != TokenKind.RING2) {
      throw new IllegalStateException(String.format("Token %s is not a ring token", this));
    }
    return Integer.parseInt(value.replace("%", ""));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Token)) {
      return false;
    }
    Token other = (Token) o;
    return kind == other.kind && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }

  @Override
  public String toString() {
    return String.format("%s: %s", kind, value);
  }
}
