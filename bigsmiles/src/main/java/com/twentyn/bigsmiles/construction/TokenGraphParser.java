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

import com.twentyn.bigsmiles.errors.BigSmilesException;
import com.twentyn.bigsmiles.errors.ConstructionException;
import com.twentyn.bigsmiles.errors.MalformedFieldException;
import com.twentyn.bigsmiles.errors.UnbalancedScopeException;
import com.twentyn.bigsmiles.errors.UnknownElementException;
import com.twentyn.bigsmiles.tokenizer.AtomFields;
import com.twentyn.bigsmiles.tokenizer.Token;
import com.twentyn.bigsmiles.tokenizer.TokenKind;
import com.twentyn.bigsmiles.tokenizer.Tokenizer;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Folds a token list into {@link GraphBuilder} operations.
 */
class TokenGraphParser {
  // Tokens a bond symbol may not directly precede.
  private static final Set<TokenKind> NOT_AFTER_BOND = EnumSet.of(TokenKind.BRANCH_START, TokenKind.BRANCH_END,
      TokenKind.STOCHASTIC_SEPARATOR, TokenKind.DISCONNECT, TokenKind.STOCHASTIC_END, TokenKind.BOND);

  private final List<Token> tokens;
  private final GraphBuilder builder;

  TokenGraphParser(List<Token> tokens, GraphBuilder builder) {
    this.tokens = tokens;
    this.builder = builder;
  }

  void run() throws BigSmilesException {
    int i = 0;
    while (i < tokens.size()) {
      Token token = tokens.get(i);
      Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
      builder.at(token.getOffset());
      switch (token.getKind()) {
        case ATOM:
        case EXTENDED_ATOM:
          builder.addAtom(atomFields(token));
          break;
        case BOND:
        case DISCONNECT:
          checkBondPosition(i, token, next);
          builder.setPendingBond(token.getValue());
          break;
        case BRANCH_START:
          if (i == 0) {
            throw new ConstructionException("A string cannot start with '('", token.getOffset());
          }
          if (tokens.get(i - 1).is(TokenKind.BRANCH_START)) {
            throw new ConstructionException("A branch cannot start with '('", token.getOffset());
          }
          builder.openBranch();
          break;
        case BRANCH_END:
          builder.closeBranch();
          break;
        case RING:
        case RING2:
          if (i == 0) {
            throw new ConstructionException("A ring index cannot be the first symbol", token.getOffset());
          }
          builder.addRing(token.getRingIndex());
          break;
        case STOCHASTIC_START:
          if (next == null || !(next.is(TokenKind.BONDING_DESCRIPTOR) || next.is(TokenKind.IMPLICIT_END_GROUP))) {
            throw new ConstructionException("'{' must be followed by a bonding descriptor or '[]'",
                token.getOffset());
          }
          Pair<String, Integer> left = descriptor(next);
          builder.openStochasticObject(left.getLeft(), left.getRight(), hasExplicitIndex(next));
          builder.openStochasticFragment();
          i++;
          break;
        case BONDING_DESCRIPTOR:
        case IMPLICIT_END_GROUP:
          Pair<String, Integer> descriptor = descriptor(token);
          if (next != null && next.is(TokenKind.STOCHASTIC_END)) {
            builder.closeStochasticFragment();
            builder.closeStochasticObject(descriptor.getLeft(), descriptor.getRight(), hasExplicitIndex(token));
            i++;
          } else {
            builder.addBondingDescriptorAtom(descriptor.getLeft(), descriptor.getRight(), hasExplicitIndex(token));
          }
          break;
        case STOCHASTIC_SEPARATOR:
          builder.nextStochasticFragment(token.getValue());
          break;
        case STOCHASTIC_END:
          if (!builder.isInsideStochasticObject()) {
            throw new UnbalancedScopeException("'}' without a matching '{'", token.getOffset());
          }
          throw new ConstructionException("A stochastic object must end with a bonding descriptor before '}'",
              token.getOffset());
        case REACTION_ARROW:
          throw new ConstructionException(
              String.format("Reaction arrow '%s' found; parse reactions with ReactionParser", token.getValue()),
              token.getOffset());
        default:
          throw new ConstructionException(String.format("Unexpected token %s", token), token.getOffset());
      }
      i++;
    }
  }

  private void checkBondPosition(int i, Token token, Token next) throws ConstructionException {
    if (i == 0) {
      throw new ConstructionException(String.format("Bond '%s' cannot be the first symbol", token.getValue()),
          token.getOffset());
    }
    if (next == null) {
      throw new ConstructionException(String.format("Bond '%s' cannot end the input", token.getValue()),
          token.getOffset());
    }
    if (NOT_AFTER_BOND.contains(next.getKind())) {
      throw new ConstructionException(
          String.format("Bond '%s' cannot precede '%s'", token.getValue(), next.getValue()), token.getOffset());
    }
  }

  private static AtomFields atomFields(Token token) throws BigSmilesException {
    try {
      return Tokenizer.tokenizeAtomSymbol(token.getValue());
    } catch (UnknownElementException e) {
      throw new UnknownElementException(e.getSymbol(), token.getOffset());
    } catch (MalformedFieldException e) {
      throw new MalformedFieldException(e.getMessage(), token.getOffset());
    }
  }

  private static Pair<String, Integer> descriptor(Token token) throws MalformedFieldException {
    try {
      return Tokenizer.tokenizeBondingDescriptor(token.getValue());
    } catch (MalformedFieldException e) {
      throw new MalformedFieldException(e.getMessage(), token.getOffset());
    }
  }

  private static boolean hasExplicitIndex(Token token) {
    return StringUtils.containsAny(token.getValue(), "0123456789");
  }
}
