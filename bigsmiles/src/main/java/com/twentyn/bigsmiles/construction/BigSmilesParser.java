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

import com.twentyn.bigsmiles.config.ParseConfig;
import com.twentyn.bigsmiles.errors.BigSmilesException;
import com.twentyn.bigsmiles.errors.ConstructionException;
import com.twentyn.bigsmiles.model.Graph;
import com.twentyn.bigsmiles.tokenizer.RingIndexNormalizer;
import com.twentyn.bigsmiles.tokenizer.Token;
import com.twentyn.bigsmiles.tokenizer.Tokenizer;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Entry point for turning BigSMILES text into a finalized {@link Graph}.
 *
 * A parser holds only its configuration and can be shared between threads; every call runs its own builder.
 */
public class BigSmilesParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BigSmilesParser.class);

  private final ParseConfig config;
  private final RingIndexNormalizer ringIndexNormalizer = new RingIndexNormalizer();

  public BigSmilesParser() {
    this(ParseConfig.defaults());
  }

  public BigSmilesParser(ParseConfig config) {
    this.config = config;
  }

  public ParseConfig getConfig() {
    return config;
  }

  /**
   * Parses a BigSMILES string.
   *
   * @param text The BigSMILES text.
   * @return A finalized graph; descriptor mismatches are reported on its status.
   * @throws BigSmilesException on any lexical or structural error.
   */
  public Graph parse(String text) throws BigSmilesException {
    return build(text, new GraphBuilder(text));
  }

  /**
   * Parses text whose top level is a stochastic fragment, such as "[<]CC[>]". The result can be added to a stochastic
   * object with {@link GraphBuilder#addGraphAsStochasticFragment(Graph)}.
   */
  public Graph parseFragment(String text) throws BigSmilesException {
    return build(text, GraphBuilder.forFragment(text));
  }

  private Graph build(String text, GraphBuilder builder) throws BigSmilesException {
    if (StringUtils.isBlank(text)) {
      throw new ConstructionException("Cannot parse an empty BigSMILES string");
    }
    try {
      List<Token> tokens = Tokenizer.tokenize(text);
      if (config.getRenumberDuplicateRings()) {
        tokens = ringIndexNormalizer.normalize(tokens);
      }
      new TokenGraphParser(tokens, builder).run();
      return builder.exitConstruction();
    } catch (BigSmilesException e) {
      LOGGER.debug("Failed to parse '%s': %s", text, e.getMessage());
      throw e;
    }
  }
}
