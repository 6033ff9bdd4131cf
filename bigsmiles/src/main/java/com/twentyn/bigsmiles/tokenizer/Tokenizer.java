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

import com.twentyn.bigsmiles.chemistry.ElementTable;
import com.twentyn.bigsmiles.errors.MalformedFieldException;
import com.twentyn.bigsmiles.errors.TokenizationException;
import com.twentyn.bigsmiles.errors.UnknownElementException;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits BigSMILES text into classified tokens.
 *
 * A tokenizer is a cursor over one input string: tokens are produced on demand by {@link #next()}, and
 * {@link #reset()} restarts the sequence from the beginning. Patterns are tried in a fixed order so that the longest
 * candidate wins (bracketed descriptors before bracket atoms, "Cl" before "C", "%NN" before a single digit,
 * ">>" before ">"). Spaces and tabs are skipped.
 */
public class Tokenizer {
  public static final int DEFAULT_BONDING_DESCRIPTOR_INDEX = 1;

  private static final Pattern WHITESPACE_PATTERN = Pattern.compile("[ \\t]+");

  // Insertion order is match priority.
  private static final Map<TokenKind, Pattern> TOKEN_PATTERNS = buildTokenPatterns();

  private static final Pattern DESCRIPTOR_BODY_PATTERN = Pattern.compile("^([$<>]?)(\\d{1,2})?$");

  private static final String ISOTOPE_PATTERN = "(?<isotope>\\d{1,3})?";
  private static final String STEREO_PATTERN = "(?<stereo>@{1,2})?";
  private static final String HYDROGEN_PATTERN = "(?<hydrogens>H\\d?)?";
  private static final String CHARGE_PATTERN = "(?<charge>\\+{2,3}|\\+\\d?|-{2,3}|-\\d?)?";
  private static final String CLASS_PATTERN = "(?<atomClass>:\\d{1,3})?";

  private static final Pattern ATOM_BODY_PATTERN = Pattern.compile("^" + ISOTOPE_PATTERN +
      "(?<element>" + StringUtils.join(ElementTable.getInstance().getAllSymbols(), "|") + ")" +
      STEREO_PATTERN + HYDROGEN_PATTERN + CHARGE_PATTERN + CLASS_PATTERN + "$");

  // Same shape with any element-like symbol; used to tell unknown elements from malformed bodies.
  private static final Pattern GENERIC_ATOM_BODY_PATTERN = Pattern.compile("^" + ISOTOPE_PATTERN +
      "(?<element>[A-Z][a-z]?|[a-z]{1,2})" +
      STEREO_PATTERN + HYDROGEN_PATTERN + CHARGE_PATTERN + CLASS_PATTERN + "$");

  private final String text;
  private final Matcher matcher;
  private int position;

  public Tokenizer(String text) {
    this.text = text;
    this.matcher = WHITESPACE_PATTERN.matcher(text);
    this.position = 0;
  }

  private static Map<TokenKind, Pattern> buildTokenPatterns() {
    ElementTable table = ElementTable.getInstance();
    List<String> atomSymbols = new ArrayList<>(table.getOrganicSymbols());
    atomSymbols.addAll(table.getOrganicAromaticSymbols());

    Map<TokenKind, Pattern> patterns = new LinkedHashMap<>();
    patterns.put(TokenKind.IMPLICIT_END_GROUP, Pattern.compile("\\[\\]"));
    patterns.put(TokenKind.BONDING_DESCRIPTOR, Pattern.compile("\\[[$<>]\\d{0,2}\\]"));
    patterns.put(TokenKind.EXTENDED_ATOM, Pattern.compile("\\[[^\\[\\]{}()]+\\]"));
    patterns.put(TokenKind.REACTION_ARROW, Pattern.compile(">>|>"));
    patterns.put(TokenKind.ATOM, Pattern.compile(StringUtils.join(atomSymbols, "|")));
    patterns.put(TokenKind.BOND, Pattern.compile("[-=#$:/\\\\]"));
    patterns.put(TokenKind.BRANCH_START, Pattern.compile("\\("));
    patterns.put(TokenKind.BRANCH_END, Pattern.compile("\\)"));
    patterns.put(TokenKind.RING2, Pattern.compile("%\\d{2}"));
    patterns.put(TokenKind.RING, Pattern.compile("\\d"));
    patterns.put(TokenKind.DISCONNECT, Pattern.compile("\\."));
    patterns.put(TokenKind.STOCHASTIC_SEPARATOR, Pattern.compile("[,;]"));
    patterns.put(TokenKind.STOCHASTIC_START, Pattern.compile("\\{"));
    patterns.put(TokenKind.STOCHASTIC_END, Pattern.compile("\\}"));
    return Collections.unmodifiableMap(patterns);
  }

  /**
   * Tokenizes the whole text.
   *
   * @param text BigSMILES text.
   * @return The tokens in input order; the END sentinel is not included.
   * @throws TokenizationException if some part of the text matches no token pattern.
   */
  public static List<Token> tokenize(String text) throws TokenizationException {
    Tokenizer tokenizer = new Tokenizer(text);
    List<Token> tokens = new ArrayList<>();
    while (tokenizer.hasNext()) {
      tokens.add(tokenizer.next());
    }
    return tokens;
  }

  public boolean hasNext() {
    skipWhitespace();
    return position < text.length();
  }

  /**
   * Produces the next token, or the END sentinel once the text is exhausted.
   */
  public Token next() throws TokenizationException {
    skipWhitespace();
    if (position >= text.length()) {
      return new Token(TokenKind.END, "", text.length());
    }

    for (Map.Entry<TokenKind, Pattern> entry : TOKEN_PATTERNS.entrySet()) {
      Matcher m = entry.getValue().matcher(text);
      m.region(position, text.length());
      if (m.lookingAt()) {
        Token token = new Token(entry.getKey(), m.group(), position);
        position = m.end();
        return token;
      }
    }
    throw new TokenizationException(text, position);
  }

  public void reset() {
    position = 0;
  }

  public String getText() {
    return text;
  }

  private void skipWhitespace() {
    matcher.region(position, text.length());
    if (matcher.lookingAt()) {
      position = matcher.end();
    }
  }

  /**
   * Decomposes an atom into its fields. Accepts a bracketed body ("[13C@H+:1]") or a bare symbol ("Cl", "c").
   *
   * @param symbol The atom text.
   * @return The decomposed fields.
   * @throws MalformedFieldException if the body does not follow the bracket atom grammar.
   * @throws UnknownElementException if the element symbol is not in the periodic table.
   */
  public static AtomFields tokenizeAtomSymbol(String symbol) throws MalformedFieldException, UnknownElementException {
    boolean bracketed = symbol.startsWith("[") && symbol.endsWith("]") && symbol.length() >= 2;
    String body = bracketed ? symbol.substring(1, symbol.length() - 1) : symbol;
    if (body.isEmpty()) {
      throw new MalformedFieldException(String.format("Empty atom body in '%s'", symbol));
    }

    ElementTable table = ElementTable.getInstance();
    if (!bracketed) {
      if (!table.lookup(body).isPresent()) {
        throw new UnknownElementException(body);
      }
      return AtomFields.privileged(body);
    }

    Matcher m = ATOM_BODY_PATTERN.matcher(body);
    if (!m.matches()) {
      Matcher generic = GENERIC_ATOM_BODY_PATTERN.matcher(body);
      if (generic.matches()) {
        throw new UnknownElementException(generic.group("element"));
      }
      throw new MalformedFieldException(String.format("Issue tokenizing atom: %s", symbol));
    }

    Integer isotope = null;
    if (m.group("isotope") != null) {
      isotope = Integer.parseInt(m.group("isotope"));
      if (isotope <= 0) {
        throw new MalformedFieldException(String.format("Isotope must be positive in atom: %s", symbol));
      }
    }

    Integer hydrogens = null;
    String hydrogenText = m.group("hydrogens");
    if (hydrogenText != null) {
      hydrogens = hydrogenText.length() == 1 ? 1 : Integer.parseInt(hydrogenText.substring(1));
    }

    Integer atomClass = null;
    if (m.group("atomClass") != null) {
      // Index 0 is the ':' separator.
      atomClass = Integer.parseInt(m.group("atomClass").substring(1));
    }

    return new AtomFields(isotope, m.group("element"), m.group("stereo"), hydrogens,
        parseCharge(m.group("charge")), atomClass, true);
  }

  private static int parseCharge(String charge) {
    if (charge == null) {
      return 0;
    }
    int sign = charge.charAt(0) == '+' ? 1 : -1;
    if (charge.length() == 1) {
      return sign;
    }
    if (Character.isDigit(charge.charAt(1))) {
      return sign * Integer.parseInt(charge.substring(1));
    }
    // Repeated signs: "++" is +2, "---" is -3.
    return sign * charge.length();
  }

  /**
   * Decomposes a bonding descriptor into its symbol and index. "[$1]" gives ("$", 1), "[<]" gives ("<", 1) and the
   * implicit end group "[]" gives ("", 1).
   *
   * @param descriptor The descriptor text, with or without brackets.
   * @return A pair of the descriptor symbol and its index.
   * @throws MalformedFieldException if the body is not a valid descriptor.
   */
  public static Pair<String, Integer> tokenizeBondingDescriptor(String descriptor) throws MalformedFieldException {
    String body = descriptor;
    if (body.startsWith("[") && body.endsWith("]") && body.length() >= 2) {
      body = body.substring(1, body.length() - 1);
    }

    Matcher m = DESCRIPTOR_BODY_PATTERN.matcher(body);
    if (!m.matches() || (m.group(1).isEmpty() && m.group(2) != null)) {
      throw new MalformedFieldException(String.format("Issue tokenizing bonding descriptor: %s", descriptor));
    }

    int index = m.group(2) == null ? DEFAULT_BONDING_DESCRIPTOR_INDEX : Integer.parseInt(m.group(2));
    return Pair.of(m.group(1), index);
  }
}
