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

package com.twentyn.balancer.elements;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Symbol-keyed lookups over {@link ChemicalElement}.  The formula parser only needs {@link #isValidElement}; the
 * molar mass calculator uses {@link #getAtomicMass}.
 */
public class PeriodicTable {

  private static final Map<String, Element> ELEMENTS_BY_SYMBOL;
  static {
    Map<String, Element> elements = new HashMap<>();
    for (ChemicalElement element : ChemicalElement.values()) {
      elements.put(element.getSymbol(), element);
    }
    ELEMENTS_BY_SYMBOL = Collections.unmodifiableMap(elements);
  }

  private PeriodicTable() {
  }

  public static boolean isValidElement(String symbol) {
    return symbol != null && ELEMENTS_BY_SYMBOL.containsKey(symbol);
  }

  public static Optional<Element> getElement(String symbol) {
    return Optional.ofNullable(ELEMENTS_BY_SYMBOL.get(symbol));
  }

  /**
   * @param symbol an element symbol, for example "Fe"
   * @return the standard atomic weight in g/mol, or empty if the symbol is not an element
   */
  public static Optional<Double> getAtomicMass(String symbol) {
    return getElement(symbol).map(Element::getAtomicMass);
  }

  public static Set<String> getSymbols() {
    return ELEMENTS_BY_SYMBOL.keySet();
  }
}
