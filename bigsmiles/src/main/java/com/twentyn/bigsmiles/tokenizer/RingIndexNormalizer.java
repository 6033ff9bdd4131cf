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

import com.twentyn.bigsmiles.errors.ConstructionException;
import com.twentyn.bigsmiles.errors.UnmatchedRingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Renumbers re-used ring indices so that every index appears exactly twice in a token list.
 * "C1CC1C1CC1" becomes "C1CC1C2CC2": occurrences are paired in input order and every pair after the first gets the
 * lowest index not used anywhere in the input.
 */
public class RingIndexNormalizer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RingIndexNormalizer.class);

  public static final int MAX_RING_INDEX = 99;

  public List<Token> normalize(List<Token> tokens) throws UnmatchedRingException, ConstructionException {
    TreeMap<Integer, List<Integer>> positionsByIndex = new TreeMap<>();
    for (int i = 0; i < tokens.size(); i++) {
      Token token = tokens.get(i);
      if (token.is(TokenKind.RING) || token.is(TokenKind.RING2)) {
        positionsByIndex.computeIfAbsent(token.getRingIndex(), k -> new ArrayList<>()).add(i);
      }
    }
    if (positionsByIndex.isEmpty()) {
      return tokens;
    }

    List<Token> result = new ArrayList<>(tokens);
    Set<Integer> taken = new HashSet<>(positionsByIndex.keySet());
    int nextFreeIndex = 1;
    for (Map.Entry<Integer, List<Integer>> entry : positionsByIndex.entrySet()) {
      List<Integer> positions = entry.getValue();
      if (positions.size() == 2) {
        continue;
      }
      if (positions.size() % 2 != 0) {
        Token last = tokens.get(positions.get(positions.size() - 1));
        throw new UnmatchedRingException(entry.getKey(),
            String.format("Ring index %d appears %d times; ring indices must come in pairs",
                entry.getKey(), positions.size()), last.getOffset());
      }

      LOGGER.warn("Duplicate ring index %d detected and renumbered", entry.getKey());
      // The first pair keeps its index.
      for (int i = 2; i < positions.size(); i += 2) {
        while (taken.contains(nextFreeIndex)) {
          nextFreeIndex++;
        }
        if (nextFreeIndex > MAX_RING_INDEX) {
          throw new ConstructionException("Ran out of ring indices while renumbering duplicates",
              tokens.get(positions.get(i)).getOffset());
        }
        for (int pos : new int[]{positions.get(i), positions.get(i + 1)}) {
          result.set(pos, ringToken(nextFreeIndex, tokens.get(pos).getOffset()));
        }
        taken.add(nextFreeIndex);
      }
    }
    return result;
  }

  private static Token ringToken(int index, int offset) {
    if (index < 10) {
      return new Token(TokenKind.RING, Integer.toString(index), offset);
    }
    return new Token(TokenKind.RING2, "%" + index, offset);
  }
}
