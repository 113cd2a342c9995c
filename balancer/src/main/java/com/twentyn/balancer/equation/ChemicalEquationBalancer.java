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

import com.twentyn.balancer.errors.BalanceException;
import com.twentyn.balancer.errors.ChemicalEquationException;
import com.twentyn.balancer.errors.ConservationException;
import com.twentyn.balancer.formula.ElementCounts;
import com.twentyn.balancer.formula.FormulaParser;
import com.twentyn.balancer.i18n.LocalizedMessages;
import com.twentyn.balancer.i18n.MessageFormatter;
import com.twentyn.balancer.i18n.MessageKey;
import com.twentyn.balancer.solver.SolverConfig;
import com.twentyn.balancer.solver.StoichiometrySolver;
import org.apache.commons.math3.fraction.BigFraction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Balances equations written as text, e.g. "Fe + O2 -> Fe2O3" becomes "4Fe + 3O2 -> 2Fe2O3".
 *
 * Coefficients the user writes in front of molecules are treated as hints: if every hinted molecule asks for the same
 * positive integer multiple of the minimal solution, the whole solution is scaled by it ("8Fe + O2 -> Fe2O3" gives
 * "8Fe + 6O2 -> 4Fe2O3"); otherwise all hints are dropped.
 *
 * {@link #balance(String)} never throws: every failure becomes an error result carrying a localized message.
 */
public class ChemicalEquationBalancer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ChemicalEquationBalancer.class);

  private static final String SIDE_SEPARATOR = " -> ";

  private final MessageFormatter messages;
  private final FormulaParser parser;
  private final StoichiometrySolver solver;

  public ChemicalEquationBalancer() {
    this(LocalizedMessages.english(), SolverConfig.defaults());
  }

  public ChemicalEquationBalancer(MessageFormatter messages) {
    this(messages, SolverConfig.defaults());
  }

  public ChemicalEquationBalancer(MessageFormatter messages, SolverConfig config) {
    this.messages = messages;
    this.parser = new FormulaParser(messages);
    this.solver = new StoichiometrySolver(config, messages);
  }

  public MessageFormatter getMessages() {
    return messages;
  }

  public FormulaParser getParser() {
    return parser;
  }

  public BalancedResult balance(String equation) {
    try {
      return doBalance(equation);
    } catch (ChemicalEquationException e) {
      LOGGER.debug("Unable to balance '%s': %s", equation, e.getMessage());
      return BalancedResult.error(e.getCode(), e.getMessage());
    }
  }

  private BalancedResult doBalance(String equation) {
    ChemicalEquation parsed = ChemicalEquation.parse(equation, parser, messages);
    ReactionSide reactants = parsed.getReactants();
    ReactionSide products = parsed.getProducts();

    checkConservation(reactants, products);

    int[] coefficients = solver.solve(reactants.getCounts(), products.getCounts());
    checkNonZero(coefficients, reactants, products);
    checkConserved(coefficients, reactants, products);
    coefficients = applyHints(coefficients, reactants, products);

    int[] reactantCoefficients = Arrays.copyOfRange(coefficients, 0, reactants.size());
    int[] productCoefficients = Arrays.copyOfRange(coefficients, reactants.size(), coefficients.length);

    LinkedHashMap<String, Integer> coefficientMap = new LinkedHashMap<>();
    for (int i = 0; i < reactants.size(); i++) {
      coefficientMap.put(reactants.getMolecules().get(i).getFormula(), reactantCoefficients[i]);
    }
    for (int i = 0; i < products.size(); i++) {
      coefficientMap.put(products.getMolecules().get(i).getFormula(), productCoefficients[i]);
    }

    String balancedString =
        reactants.format(reactantCoefficients) + SIDE_SEPARATOR + products.format(productCoefficients);
    BalanceDebugInfo debug = buildDebugInfo(reactants, reactantCoefficients, products, productCoefficients);
    return BalancedResult.success(coefficientMap, balancedString, debug);
  }

  /**
   * Every element used on one side must appear on the other; charge may legitimately appear on one side only.
   */
  private void checkConservation(ReactionSide reactants, ReactionSide products) {
    SortedSet<String> reactantElements = new TreeSet<>(reactants.getElementSymbols());
    SortedSet<String> productElements = new TreeSet<>(products.getElementSymbols());
    for (String element : reactantElements) {
      if (!productElements.contains(element)) {
        throw new ConservationException(messages.format(MessageKey.ELEMENT_MISSING_IN_PRODUCTS, element), element);
      }
    }
    for (String element : productElements) {
      if (!reactantElements.contains(element)) {
        throw new ConservationException(messages.format(MessageKey.ELEMENT_MISSING_IN_REACTANTS, element), element);
      }
    }
  }

  private void checkNonZero(int[] coefficients, ReactionSide reactants, ReactionSide products) {
    if (Arrays.stream(coefficients).allMatch(c -> c == 0)) {
      throw new BalanceException(messages.format(MessageKey.NO_SOLUTION));
    }
    for (int i = 0; i < coefficients.length; i++) {
      if (coefficients[i] == 0) {
        Molecule molecule = i < reactants.size() ?
            reactants.getMolecules().get(i) : products.getMolecules().get(i - reactants.size());
        throw new BalanceException(messages.format(MessageKey.ZERO_COEFFICIENT, molecule.getFormula()));
      }
    }
  }

  /**
   * The solver falls back to a plain sum of its basis when no weighted combination is non-negative.  Such a vector
   * need not lie in the null space, so every symbol, charge included, is checked before the result is accepted.
   */
  private void checkConserved(int[] coefficients, ReactionSide reactants, ReactionSide products) {
    int[] reactantCoefficients = Arrays.copyOfRange(coefficients, 0, reactants.size());
    int[] productCoefficients = Arrays.copyOfRange(coefficients, reactants.size(), coefficients.length);
    SortedSet<String> symbols = new TreeSet<>();
    reactants.getMolecules().forEach(m -> symbols.addAll(m.getCounts().getSymbols()));
    products.getMolecules().forEach(m -> symbols.addAll(m.getCounts().getSymbols()));
    for (String symbol : symbols) {
      long left = total(reactants, reactantCoefficients, symbol);
      long right = total(products, productCoefficients, symbol);
      if (left != right) {
        LOGGER.debug("Solver returned %s, which leaves %s at %d/%d", Arrays.toString(coefficients), symbol, left, right);
        throw new BalanceException(messages.format(MessageKey.NO_POSITIVE_SOLUTION));
      }
    }
  }

  /**
   * Scale the minimal solution by the factor the user's coefficients agree on, if they agree on a positive integer.
   */
  private int[] applyHints(int[] coefficients, ReactionSide reactants, ReactionSide products) {
    List<Molecule> molecules = new ArrayList<>(reactants.getMolecules());
    molecules.addAll(products.getMolecules());

    BigFraction scale = null;
    for (int i = 0; i < molecules.size(); i++) {
      Integer hint = molecules.get(i).getCoefficientHint().orElse(null);
      if (hint == null) {
        continue;
      }
      BigFraction ratio = new BigFraction(hint, coefficients[i]);
      if (scale == null) {
        scale = ratio;
      } else if (!scale.equals(ratio)) {
        LOGGER.debug("Coefficient hints disagree (%s vs %s), ignoring them", scale, ratio);
        return coefficients;
      }
    }

    if (scale == null || scale.getNumerator().signum() <= 0 || !BigInteger.ONE.equals(scale.getDenominator())) {
      return coefficients;
    }

    int factor;
    int[] scaled = new int[coefficients.length];
    try {
      factor = scale.getNumerator().intValueExact();
      for (int i = 0; i < coefficients.length; i++) {
        scaled[i] = Math.multiplyExact(coefficients[i], factor);
      }
    } catch (ArithmeticException e) {
      throw new BalanceException(messages.format(MessageKey.COEFFICIENT_OVERFLOW), e);
    }
    return scaled;
  }

  private BalanceDebugInfo buildDebugInfo(ReactionSide reactants, int[] reactantCoefficients,
                                          ReactionSide products, int[] productCoefficients) {
    SortedSet<String> symbols = new TreeSet<>();
    LinkedHashMap<String, ElementCounts> reactantCounts = new LinkedHashMap<>();
    for (Molecule molecule : reactants.getMolecules()) {
      reactantCounts.put(molecule.getFormula(), molecule.getCounts());
      symbols.addAll(molecule.getCounts().getSymbols());
    }
    LinkedHashMap<String, ElementCounts> productCounts = new LinkedHashMap<>();
    for (Molecule molecule : products.getMolecules()) {
      productCounts.put(molecule.getFormula(), molecule.getCounts());
      symbols.addAll(molecule.getCounts().getSymbols());
    }

    LinkedHashMap<String, BalanceCheck> balanceCheck = new LinkedHashMap<>();
    for (String symbol : symbols) {
      balanceCheck.put(symbol, new BalanceCheck(
          total(reactants, reactantCoefficients, symbol), total(products, productCoefficients, symbol)));
    }
    return new BalanceDebugInfo(new ArrayList<>(symbols), reactantCounts, productCounts, balanceCheck);
  }

  private static long total(ReactionSide side, int[] coefficients, String symbol) {
    long total = 0L;
    for (int i = 0; i < side.size(); i++) {
      total += (long) side.getMolecules().get(i).getCounts().get(symbol) * coefficients[i];
    }
    return total;
  }
}
