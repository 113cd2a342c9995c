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

import com.twentyn.balancer.formula.ElementCounts;
import org.apache.commons.math3.fraction.BigFraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The conservation system of a reaction: one row per symbol (charge included), one column per molecule, reactants
 * first.  Reactant entries are positive and product entries negative, so any coefficient vector in the null space
 * conserves every row.  All arithmetic is exact.
 *
 * The matrix is mutable: {@link #reduce()} brings it to reduced row echelon form in place, after which pivot and free
 * columns and the null space basis can be read off.
 */
public class StoichiometricMatrix {
  private final List<String> symbols;
  private final int columnCount;
  private final BigFraction[][] rows;

  private final List<Integer> pivotColumns = new ArrayList<>();
  private final List<Integer> freeColumns = new ArrayList<>();
  private boolean reduced = false;

  public StoichiometricMatrix(List<ElementCounts> reactants, List<ElementCounts> products) {
    SortedSet<String> allSymbols = new TreeSet<>();
    reactants.forEach(counts -> allSymbols.addAll(counts.getSymbols()));
    products.forEach(counts -> allSymbols.addAll(counts.getSymbols()));

    this.symbols = Collections.unmodifiableList(new ArrayList<>(allSymbols));
    this.columnCount = reactants.size() + products.size();
    this.rows = new BigFraction[symbols.size()][columnCount];

    for (int r = 0; r < symbols.size(); r++) {
      String symbol = symbols.get(r);
      int c = 0;
      for (ElementCounts counts : reactants) {
        rows[r][c++] = new BigFraction(counts.get(symbol));
      }
      for (ElementCounts counts : products) {
        rows[r][c++] = new BigFraction(-counts.get(symbol));
      }
    }
  }

  public List<String> getSymbols() {
    return symbols;
  }

  public int getRowCount() {
    return rows.length;
  }

  public int getColumnCount() {
    return columnCount;
  }

  public BigFraction get(int row, int column) {
    return rows[row][column];
  }

  /**
   * Gauss-Jordan elimination to reduced row echelon form, then classification of every column as pivot or free.
   * Calling this more than once has no further effect.
   */
  public void reduce() {
    if (reduced) {
      return;
    }
    int lead = 0;
    for (int r = 0; r < rows.length && lead < columnCount; r++) {
      // Find the next column, starting at lead, that has a non-zero entry at or below row r.
      int i = r;
      while (isZero(rows[i][lead])) {
        i++;
        if (i == rows.length) {
          i = r;
          lead++;
          if (lead == columnCount) {
            break;
          }
        }
      }
      if (lead == columnCount) {
        break;
      }

      BigFraction[] swap = rows[i];
      rows[i] = rows[r];
      rows[r] = swap;

      BigFraction pivot = rows[r][lead];
      for (int j = 0; j < columnCount; j++) {
        rows[r][j] = rows[r][j].divide(pivot);
      }

      for (int k = 0; k < rows.length; k++) {
        if (k == r) {
          continue;
        }
        BigFraction factor = rows[k][lead];
        if (isZero(factor)) {
          continue;
        }
        for (int j = 0; j < columnCount; j++) {
          rows[k][j] = rows[k][j].subtract(factor.multiply(rows[r][j]));
        }
      }
      lead++;
    }

    int r = 0;
    for (int c = 0; c < columnCount; c++) {
      if (r < rows.length && !isZero(rows[r][c])) {
        pivotColumns.add(c);
        r++;
      } else {
        freeColumns.add(c);
      }
    }
    reduced = true;
  }

  public List<Integer> getPivotColumns() {
    requireReduced();
    return Collections.unmodifiableList(pivotColumns);
  }

  public List<Integer> getFreeColumns() {
    requireReduced();
    return Collections.unmodifiableList(freeColumns);
  }

  /**
   * One null space vector per free column: that free variable is 1, the other free variables are 0, and pivot
   * variables are solved by back-substitution from the last pivot row upwards.
   * @return the basis, in free column order; empty when the only solution is the zero vector.
   */
  public List<BigFraction[]> nullSpaceBasis() {
    requireReduced();
    List<BigFraction[]> basis = new ArrayList<>(freeColumns.size());
    for (Integer freeColumn : freeColumns) {
      BigFraction[] solution = new BigFraction[columnCount];
      for (int j = 0; j < columnCount; j++) {
        solution[j] = BigFraction.ZERO;
      }
      solution[freeColumn] = BigFraction.ONE;

      for (int i = pivotColumns.size() - 1; i >= 0; i--) {
        int pivotColumn = pivotColumns.get(i);
        BigFraction sum = BigFraction.ZERO;
        for (int j = pivotColumn + 1; j < columnCount; j++) {
          sum = sum.add(rows[i][j].multiply(solution[j]));
        }
        solution[pivotColumn] = sum.negate();
      }
      basis.add(solution);
    }
    return basis;
  }

  private void requireReduced() {
    if (!reduced) {
      throw new IllegalStateException("Matrix must be reduced before its columns can be classified");
    }
  }

  static boolean isZero(BigFraction value) {
    return value.getNumerator().signum() == 0;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int r = 0; r < rows.length; r++) {
      // Row labels only mean something before reduction swaps rows around.
      sb.append(reduced ? "" : symbols.get(r) + ": ");
      for (int c = 0; c < columnCount; c++) {
        sb.append(c == 0 ? "" : "\t").append(rows[r][c]);
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
