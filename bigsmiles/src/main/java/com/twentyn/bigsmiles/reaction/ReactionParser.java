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

import com.twentyn.bigsmiles.config.ParseConfig;
import com.twentyn.bigsmiles.construction.BigSmilesParser;
import com.twentyn.bigsmiles.errors.BigSmilesException;
import com.twentyn.bigsmiles.errors.ReactionParseException;
import com.twentyn.bigsmiles.model.ArrowKind;
import com.twentyn.bigsmiles.model.Graph;
import com.twentyn.bigsmiles.model.Reaction;
import com.twentyn.bigsmiles.tokenizer.Token;
import com.twentyn.bigsmiles.tokenizer.TokenKind;
import com.twentyn.bigsmiles.tokenizer.Tokenizer;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses reaction strings: "reactants>>products" or "reactants>agents>products". Species within a part are
 * separated by top-level commas; each one is parsed on its own.
 */
public class ReactionParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ReactionParser.class);

  private final ParseConfig config;
  private final BigSmilesParser parser;
  private final DisconnectSplitter disconnectSplitter = new DisconnectSplitter();

  public ReactionParser() {
    this(ParseConfig.defaults());
  }

  public ReactionParser(ParseConfig config) {
    this.config = config;
    this.parser = new BigSmilesParser(config);
  }

  public Reaction parseReaction(String text) throws BigSmilesException {
    List<Token> tokens = Tokenizer.tokenize(text);
    List<Token> arrows = new ArrayList<>();
    for (Token token : tokens) {
      if (token.is(TokenKind.REACTION_ARROW)) {
        arrows.add(token);
      }
    }

    ArrowKind arrowKind = arrowKind(arrows);
    List<List<Token>> parts = splitOn(tokens, arrows);
    List<List<Graph>> groups = new ArrayList<>(parts.size());
    for (List<Token> part : parts) {
      groups.add(parseGroup(text, part));
    }

    if (arrowKind == ArrowKind.TWO_PART) {
      return new Reaction(groups.get(0), new ArrayList<>(), groups.get(1), arrowKind);
    }
    return new Reaction(groups.get(0), groups.get(1), groups.get(2), arrowKind);
  }

  private static ArrowKind arrowKind(List<Token> arrows) throws ReactionParseException {
    int doubleArrows = 0;
    int singleArrows = 0;
    for (Token arrow : arrows) {
      if (ArrowKind.TWO_PART.getSymbol().equals(arrow.getValue())) {
        doubleArrows++;
      } else {
        singleArrows++;
      }
    }
    if (doubleArrows == 1 && singleArrows == 0) {
      return ArrowKind.TWO_PART;
    }
    if (doubleArrows == 0 && singleArrows == 2) {
      return ArrowKind.THREE_PART;
    }
    throw new ReactionParseException(String.format(
        "A reaction needs one '>>' or two '>' arrows, found %d '>>' and %d '>'", doubleArrows, singleArrows));
  }

  /**
   * Splits tokens at the given separator tokens, which are dropped.
   */
  private static List<List<Token>> splitOn(List<Token> tokens, List<Token> separators) {
    List<List<Token>> parts = new ArrayList<>();
    List<Token> current = new ArrayList<>();
    for (Token token : tokens) {
      // Identity, since token equality ignores offsets.
      if (separators.stream().anyMatch(s -> s == token)) {
        parts.add(current);
        current = new ArrayList<>();
      } else {
        current.add(token);
      }
    }
    parts.add(current);
    return parts;
  }

  private List<Graph> parseGroup(String text, List<Token> part) throws ReactionParseException {
    List<Graph> graphs = new ArrayList<>();
    if (part.isEmpty()) {
      return graphs;
    }

    List<Token> commas = new ArrayList<>();
    int depth = 0;
    for (Token token : part) {
      if (token.is(TokenKind.STOCHASTIC_START)) {
        depth++;
      } else if (token.is(TokenKind.STOCHASTIC_END)) {
        depth--;
      } else if (depth == 0 && token.is(TokenKind.STOCHASTIC_SEPARATOR)) {
        commas.add(token);
      }
    }

    for (List<Token> segmentTokens : splitOn(part, commas)) {
      if (segmentTokens.isEmpty()) {
        throw new ReactionParseException(String.format("Empty species in reaction '%s'", text));
      }
      Token first = segmentTokens.get(0);
      Token last = segmentTokens.get(segmentTokens.size() - 1);
      String segment = text.substring(first.getOffset(), last.getOffset() + last.getValue().length());
      try {
        graphs.addAll(parseSegment(segment, segmentTokens));
      } catch (BigSmilesException e) {
        LOGGER.error("Unable to parse reaction species '%s': %s", segment, e.getMessage());
        throw new ReactionParseException(segment, e);
      }
    }
    return graphs;
  }

  private List<Graph> parseSegment(String segment, List<Token> segmentTokens) throws BigSmilesException {
    List<Graph> graphs = new ArrayList<>();
    if (!config.getSplitDisconnectedReactionSpecies() || !DisconnectSplitter.hasDisconnect(segmentTokens)) {
      graphs.add(parser.parse(segment));
      return graphs;
    }
    for (String species : disconnectSplitter.split(segment)) {
      if (StringUtils.isNotBlank(species)) {
        graphs.add(parser.parse(species));
      }
    }
    return graphs;
  }
}
