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

package com.twentyn.balancer.calculator;

import com.twentyn.balancer.elements.PeriodicTable;
import com.twentyn.balancer.errors.CalculationException;
import com.twentyn.balancer.formula.ElementCounts;
import com.twentyn.balancer.formula.FormulaParser;
import com.twentyn.balancer.i18n.LocalizedMessages;
import com.twentyn.balancer.i18n.MessageFormatter;
import com.twentyn.balancer.i18n.MessageKey;

import java.util.LinkedHashMap;

/**
 * Computes molar masses (g/mol) from formulas using standard atomic masses.  Charge is ignored, so Fe^3+ weighs the
 * same as Fe.
 */
public class MolarMassCalculator {
  private final MessageFormatter messages;
  private final FormulaParser parser;

  public MolarMassCalculator() {
    this(LocalizedMessages.english());
  }

  public MolarMassCalculator(MessageFormatter messages) {
    this(messages, new FormulaParser(messages));
  }

  public MolarMassCalculator(MessageFormatter messages, FormulaParser parser) {
    this.messages = messages;
    this.parser = parser;
  }

  public double calculateMolarMass(String formula) {
    return calculateMolarMassDetailed(formula).getMolarMass();
  }

  /**
   * @throws com.twentyn.balancer.errors.FormulaParseException if the formula does not parse.
   * @throws CalculationException if an element has no known atomic mass.
   */
  public MolarMassResult calculateMolarMassDetailed(String formula) {
    ElementCounts counts = parser.parse(formula);
    LinkedHashMap<String, ElementMass> breakdown = new LinkedHashMap<>();
    double total = 0.0;
    for (String element : counts.getElementSymbols()) {
      double atomicMass = PeriodicTable.getAtomicMass(element).orElseThrow(() ->
          new CalculationException(messages.format(MessageKey.UNKNOWN_ELEMENT_MOLAR_MASS, element)));
      int count = counts.get(element);
      double elementTotal = atomicMass * count;
      breakdown.put(element, new ElementMass(count, atomicMass, Amounts.round(elementTotal)));
      total += elementTotal;
    }
    return new MolarMassResult(Amounts.round(total), breakdown);
  }
}
