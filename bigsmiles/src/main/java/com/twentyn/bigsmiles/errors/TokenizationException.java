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

import org.apache.commons.lang3.StringUtils;

/**
 * Thrown when no token pattern matches the input at some offset.
 */
public class TokenizationException extends BigSmilesException {
  private final String snippet;

  public TokenizationException(String text, int offset) {
    super(buildMessage(text, offset), offset);
    this.snippet = text.substring(offset, Math.min(text.length(), offset + 10));
  }

  public String getSnippet() {
    return snippet;
  }

  private static String buildMessage(String text, int offset) {
    return String.format("Invalid symbol (or group of symbols) starting with '%s' at index %d\n%s\n%s^",
        text.charAt(offset), offset, text, StringUtils.repeat(' ', offset));
  }
}
