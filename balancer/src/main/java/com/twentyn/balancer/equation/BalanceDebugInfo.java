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

package com.twentyn.balancer.equation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.balancer.formula.ElementCounts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the balancer saw and produced: every symbol involved (charge included), the parsed counts of each molecule and
 * the per-symbol totals on each side under the final coefficients.
 */
public class BalanceDebugInfo {
  @JsonProperty("elements")
  private List<String> elements;

  @JsonProperty("reactants")
  private Map<String, ElementCounts> reactants;

  @JsonProperty("products")
  private Map<String, ElementCounts> products;

  @JsonProperty("balance_check")
  private Map<String, BalanceCheck> balanceCheck;

  private BalanceDebugInfo() {
  }

  public BalanceDebugInfo(List<String> elements,
                          LinkedHashMap<String, ElementCounts> reactants,
                          LinkedHashMap<String, ElementCounts> products,
                          LinkedHashMap<String, BalanceCheck> balanceCheck) {
    this.elements = Collections.unmodifiableList(elements);
    this.reactants = Collections.unmodifiableMap(reactants);
    this.products = Collections.unmodifiableMap(products);
    this.balanceCheck = Collections.unmodifiableMap(balanceCheck);
  }

  public List<String> getElements() {
    return elements;
  }

  public Map<String, ElementCounts> getReactants() {
    return reactants;
  }

  public Map<String, ElementCounts> getProducts() {
    return products;
  }

  public Map<String, BalanceCheck> getBalanceCheck() {
    return balanceCheck;
  }
}
