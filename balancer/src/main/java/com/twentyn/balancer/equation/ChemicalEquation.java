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

import com.twentyn.balancer.errors.EquationSyntaxException;
import com.twentyn.balancer.formula.FormulaParser;
import com.twentyn.balancer.i18n.MessageFormatter;
import com.twentyn.balancer.i18n.MessageKey;
import org.apache.commons.lang3.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An unbalanced equation split into reactant and product sides.
 */
public class ChemicalEquation {
  // Alternation order matters: at a given position "=>" must be tried before "=".
  private static final Pattern SEPARATOR_PATTERN = Pattern.compile("->|=>|=|→|⇌");

  private final ReactionSide reactants;
  private final ReactionSide products;

  public ChemicalEquation(ReactionSide reactants, ReactionSide products) {
    this.reactants = reactants;
    this.products = products;
  }

  /**
   * Parse an equation such as "Fe + O2 -> Fe2O3".  Exactly one separator may occur.
   * @throws EquationSyntaxException if the equation is blank, has no or several separators, or has an empty side.
   * @throws com.twentyn.balancer.errors.FormulaParseException if a molecule does not parse.
   */
  public static ChemicalEquation parse(String equation, FormulaParser parser, MessageFormatter messages) {
    if (StringUtils.isBlank(equation)) {
      throw new EquationSyntaxException(messages.format(MessageKey.EMPTY_EQUATION));
    }

    Matcher separatorMatcher = SEPARATOR_PATTERN.matcher(equation);
    if (!separatorMatcher.find()) {
      throw new EquationSyntaxException(messages.format(MessageKey.MISSING_SEPARATOR));
    }
    String separator = separatorMatcher.group();
    String[] sides = StringUtils.splitByWholeSeparatorPreserveAllTokens(equation, separator);
    // A second separator of any kind, e.g. "A -> B = C", is a syntax error rather than part of a formula.
    if (sides.length != 2 || SEPARATOR_PATTERN.matcher(sides[0]).find() ||
        SEPARATOR_PATTERN.matcher(sides[1]).find()) {
      throw new EquationSyntaxException(messages.format(MessageKey.MULTIPLE_SEPARATORS));
    }

    ReactionSide reactants = ReactionSide.parse(sides[0], parser);
    ReactionSide products = ReactionSide.parse(sides[1], parser);
    if (reactants.isEmpty() || products.isEmpty()) {
      throw new EquationSyntaxException(messages.format(MessageKey.MISSING_REACTANTS_OR_PRODUCTS));
    }
    return new ChemicalEquation(reactants, products);
  }

  public ReactionSide getReactants() {
    return reactants;
  }

  public ReactionSide getProducts() {
    return products;
  }

  @Override
  public String toString() {
    return reactants + " -> " + products;
  }
}
