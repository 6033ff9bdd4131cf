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

package com.twentyn.bigsmiles.reaction;

import com.twentyn.bigsmiles.errors.BigSmilesException;
import com.twentyn.bigsmiles.tokenizer.Token;
import com.twentyn.bigsmiles.tokenizer.TokenKind;
import com.twentyn.bigsmiles.tokenizer.Tokenizer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits a reaction species written with '.' disconnects ("CCO.O") into separate species.
 *
 * A cut is only made at a top-level '.' where everything to its left is charge-neutral and no ring index is open,
 * so salts such as "[Na+].[Cl-]" stay together.
 */
public class DisconnectSplitter {

  public List<String> split(String species) throws BigSmilesException {
    List<Token> tokens = Tokenizer.tokenize(species);
    List<String> parts = new ArrayList<>();
    Set<Integer> openRings = new HashSet<>();
    int depth = 0;
    int charge = 0;
    int start = 0;

    for (Token token : tokens) {
      switch (token.getKind()) {
        case BRANCH_START:
        case STOCHASTIC_START:
          depth++;
          break;
        case BRANCH_END:
        case STOCHASTIC_END:
          depth--;
          break;
        case EXTENDED_ATOM:
          charge += Tokenizer.tokenizeAtomSymbol(token.getValue()).getCharge();
          break;
        case RING:
        case RING2:
          if (!openRings.remove(token.getRingIndex())) {
            openRings.add(token.getRingIndex());
          }
          break;
        case DISCONNECT:
          if (depth == 0 && charge == 0 && openRings.isEmpty()) {
            parts.add(species.substring(start, token.getOffset()).trim());
            start = token.getOffset() + token.getValue().length();
          }
          break;
        default:
          break;
      }
    }
    parts.add(species.substring(start).trim());
    return parts;
  }

  static boolean hasDisconnect(List<Token> tokens) {
    for (Token token : tokens) {
      if (token.is(TokenKind.DISCONNECT)) {
        return true;
      }
    }
    return false;
  }
}
