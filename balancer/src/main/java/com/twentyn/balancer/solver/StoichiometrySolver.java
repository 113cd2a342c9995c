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

package com.twentyn.balancer.solver;

import com.twentyn.balancer.errors.BalanceException;
import com.twentyn.balancer.formula.ElementCounts;
import com.twentyn.balancer.i18n.LocalizedMessages;
import com.twentyn.balancer.i18n.MessageFormatter;
import com.twentyn.balancer.i18n.MessageKey;
import org.apache.commons.math3.fraction.BigFraction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

/**
 * Finds integer stoichiometric coefficients for a reaction by computing the null space of its
 * {@link StoichiometricMatrix}.
 *
 * When the null space is one-dimensional its single basis vector is scaled to the smallest integers.  When it has
 * several dimensions (e.g. C + O2 -> CO + CO2) every basis vector is given an integer weight between 1 and
 * {@link SolverConfig#getMaxWeight()}, and the weighted sums are searched for one whose entries are all non-negative,
 * preferring those with the fewest zeros.  The search stops at the first combination with no zeros at all.
 */
public class StoichiometrySolver {
  private static final Logger LOGGER = LogManager.getFormatterLogger(StoichiometrySolver.class);

  private final SolverConfig config;
  private final MessageFormatter messages;

  public StoichiometrySolver() {
    this(SolverConfig.defaults(), LocalizedMessages.english());
  }

  public StoichiometrySolver(SolverConfig config, MessageFormatter messages) {
    this.config = config;
    this.messages = messages;
  }

  public SolverConfig getConfig() {
    return config;
  }

  /**
   * Solve for coefficients.
   * @param reactants element counts of each reactant, in equation order.
   * @param products element counts of each product, in equation order.
   * @return one non-negative coefficient per molecule, reactants first, with no common factor.  All zeros when the
   *   reaction admits no balancing at all.
   * @throws BalanceException if a coefficient does not fit in an int.
   */
  public int[] solve(List<ElementCounts> reactants, List<ElementCounts> products) {
    StoichiometricMatrix matrix = new StoichiometricMatrix(reactants, products);
    LOGGER.debug("Solving %d x %d system over symbols %s", matrix.getRowCount(), matrix.getColumnCount(),
        matrix.getSymbols());
    matrix.reduce();
    LOGGER.debug("Pivot columns: %s, free columns: %s", matrix.getPivotColumns(), matrix.getFreeColumns());

    List<BigFraction[]> basis = matrix.nullSpaceBasis();
    if (basis.isEmpty()) {
      LOGGER.debug("Null space is trivial");
      return new int[matrix.getColumnCount()];
    }
    if (basis.size() == 1) {
      return normalize(basis.get(0));
    }

    LOGGER.debug("Null space has %d dimensions, searching weighted combinations", basis.size());
    if (basis.size() > config.getMaxBasisVectors()) {
      LOGGER.debug("More than %d basis vectors, skipping search", config.getMaxBasisVectors());
      return normalize(sumOf(basis, matrix.getColumnCount()));
    }

    WeightSearch search = new WeightSearch(basis, matrix.getColumnCount());
    search.run();
    if (search.best != null) {
      LOGGER.debug("Search settled on %s after %d combinations", Arrays.toString(search.best), search.evaluated);
      return normalize(search.best);
    }
    LOGGER.debug("No non-negative combination in %d tries, using the plain sum of the basis", search.evaluated);
    return normalize(sumOf(basis, matrix.getColumnCount()));
  }

  private static BigFraction[] sumOf(List<BigFraction[]> basis, int size) {
    BigFraction[] sum = zeros(size);
    for (BigFraction[] vector : basis) {
      for (int i = 0; i < size; i++) {
        sum[i] = sum[i].add(vector[i]);
      }
    }
    return sum;
  }

  private static BigFraction[] zeros(int size) {
    BigFraction[] vector = new BigFraction[size];
    Arrays.fill(vector, BigFraction.ZERO);
    return vector;
  }

  /**
   * Scale a rational vector to the smallest integers with the same ratios.  Signs are dropped: callers only ever pass
   * vectors that are either all non-negative or that stand for a balancing with some sides swapped.
   */
  int[] normalize(BigFraction[] vector) {
    BigInteger lcm = BigInteger.ONE;
    for (BigFraction value : vector) {
      BigInteger denominator = value.getDenominator();
      lcm = lcm.divide(lcm.gcd(denominator)).multiply(denominator);
    }

    BigInteger[] integers = new BigInteger[vector.length];
    BigInteger gcd = BigInteger.ZERO;
    for (int i = 0; i < vector.length; i++) {
      integers[i] = vector[i].multiply(lcm).getNumerator().abs();
      gcd = gcd.gcd(integers[i]);
    }

    int[] result = new int[vector.length];
    try {
      for (int i = 0; i < vector.length; i++) {
        result[i] = (gcd.signum() == 0 ? integers[i] : integers[i].divide(gcd)).intValueExact();
      }
    } catch (ArithmeticException e) {
      throw new BalanceException(messages.format(MessageKey.COEFFICIENT_OVERFLOW), e);
    }
    return result;
  }

  private static int zeroCount(BigFraction[] vector) {
    int zeros = 0;
    for (BigFraction value : vector) {
      if (StoichiometricMatrix.isZero(value)) {
        zeros++;
      }
    }
    return zeros;
  }

  /**
   * Depth-first walk over weight assignments, one basis vector per level.
   */
  private class WeightSearch {
    private final List<BigFraction[]> basis;
    private final int size;

    private BigFraction[] best = null;
    private int bestZeros = Integer.MAX_VALUE;
    private long evaluated = 0;

    WeightSearch(List<BigFraction[]> basis, int size) {
      this.basis = basis;
      this.size = size;
    }

    void run() {
      search(0, zeros(size));
    }

    private boolean isDone() {
      return (best != null && bestZeros == 0) || evaluated >= config.getMaxSearchIterations();
    }

    private void search(int index, BigFraction[] current) {
      if (index == basis.size()) {
        evaluated++;
        evaluate(current);
        return;
      }

      BigFraction[] vector = basis.get(index);
      for (int weight = 1; weight <= config.getMaxWeight(); weight++) {
        BigFraction[] next = new BigFraction[size];
        for (int i = 0; i < size; i++) {
          next[i] = current[i].add(vector[i].multiply(weight));
        }
        search(index + 1, next);
        if (isDone()) {
          return;
        }
      }
    }

    private void evaluate(BigFraction[] candidate) {
      for (BigFraction value : candidate) {
        if (value.getNumerator().signum() < 0) {
          return;
        }
      }
      int zeros = zeroCount(candidate);
      // Strictly fewer zeros: the first candidate found wins ties.
      if (zeros < bestZeros) {
        best = candidate;
        bestZeros = zeros;
      }
    }
  }
}
