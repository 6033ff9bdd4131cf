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

package com.twentyn.bigsmiles.chemistry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The periodic table, loaded once from the bundled elements.json resource.
 * Instances are read-only and shared by every parse.
 */
public class ElementTable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ElementTable.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final String ELEMENTS_FILE_NAME = "elements.json";

  private static class Holder {
    private static final ElementTable INSTANCE = loadDefault();
  }

  // Jackson target for the resource layout.
  static class ElementList {
    @JsonProperty("elements")
    List<Element> elements;
  }

  private final Map<String, Element> bySymbol;
  private final Map<String, Element> byAromaticSymbol;

  public ElementTable(List<Element> elements) {
    Map<String, Element> symbols = new HashMap<>();
    Map<String, Element> aromaticSymbols = new HashMap<>();
    for (Element element : elements) {
      symbols.put(element.getSymbol(), element);
      if (element.isAromatic()) {
        aromaticSymbols.put(element.getAromaticSymbol(), element);
      }
    }
    this.bySymbol = Collections.unmodifiableMap(symbols);
    this.byAromaticSymbol = Collections.unmodifiableMap(aromaticSymbols);
  }

  public static ElementTable getInstance() {
    return Holder.INSTANCE;
  }

  public static ElementTable load(InputStream elementsStream) throws IOException {
    ElementList list = OBJECT_MAPPER.readValue(elementsStream, ElementList.class);
    return new ElementTable(list.elements);
  }

  private static ElementTable loadDefault() {
    try (InputStream stream = ElementTable.class.getClassLoader().getResourceAsStream(ELEMENTS_FILE_NAME)) {
      if (stream == null) {
        throw new IllegalStateException(String.format("Resource %s not found on the class path", ELEMENTS_FILE_NAME));
      }
      ElementTable table = load(stream);
      LOGGER.debug("Loaded %d elements from %s", table.size(), ELEMENTS_FILE_NAME);
      return table;
    } catch (IOException e) {
      String msg = String.format("Unable to read element table from %s", ELEMENTS_FILE_NAME);
      LOGGER.error(msg);
      throw new RuntimeException(msg, e);
    }
  }

  public int size() {
    return bySymbol.size();
  }

  /**
   * Looks up an element by its regular or aromatic (lower-case) symbol.
   */
  public Optional<Element> lookup(String symbol) {
    Element element = bySymbol.get(symbol);
    if (element == null) {
      element = byAromaticSymbol.get(symbol);
    }
    return Optional.ofNullable(element);
  }

  public boolean isAromaticSymbol(String symbol) {
    return byAromaticSymbol.containsKey(symbol);
  }

  /**
   * Symbols that may be written outside brackets, longest first so "Cl" is tried before "C".
   */
  public List<String> getOrganicSymbols() {
    return sortLongestFirst(bySymbol.values().stream()
        .filter(Element::isOrganic).map(Element::getSymbol).collect(Collectors.toList()));
  }

  /**
   * Aromatic symbols of organic elements, the only lower-case atoms allowed outside brackets.
   */
  public List<String> getOrganicAromaticSymbols() {
    return sortLongestFirst(byAromaticSymbol.values().stream()
        .filter(Element::isOrganic).map(Element::getAromaticSymbol).collect(Collectors.toList()));
  }

  public List<String> getAllSymbols() {
    Set<String> symbols = new LinkedHashSet<>(bySymbol.keySet());
    symbols.addAll(byAromaticSymbol.keySet());
    return sortLongestFirst(new ArrayList<>(symbols));
  }

  private static List<String> sortLongestFirst(List<String> symbols) {
    symbols.sort(Comparator.comparing(String::length).reversed().thenComparing(Comparator.naturalOrder()));
    return symbols;
  }
}
