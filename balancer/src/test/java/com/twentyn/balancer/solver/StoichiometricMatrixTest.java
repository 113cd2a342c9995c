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
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class StoichiometricMatrixTest {

  private static ElementCounts counts(Object... symbolsAndCounts) {
    Map<String, Integer> map = new HashMap<>();
    for (int i = 0; i < symbolsAndCounts.length; i += 2) {
      map.put((String) symbolsAndCounts[i], (Integer) symbolsAndCounts[i + 1]);
    }
    return ElementCounts.of(map);
  }

  private StoichiometricMatrix waterMatrix() {
    return new StoichiometricMatrix(
        Arrays.asList(counts("H", 2), counts("O", 2)),
        Collections.singletonList(counts("H", 2, "O", 1)));
  }

  @Test
  public void testConstructionSignsReactantsAndProducts() {
    StoichiometricMatrix matrix = waterMatrix();
    assertEquals(Arrays.asList("H", "O"), matrix.getSymbols());
    assertEquals(2, matrix.getRowCount());
    assertEquals(3, matrix.getColumnCount());
    assertEquals(new BigFraction(2), matrix.get(0, 0));
    assertEquals(BigFraction.ZERO, matrix.get(0, 1));
    assertEquals("Product entries are negated", new BigFraction(-2), matrix.get(0, 2));
    assertEquals(new BigFraction(-1), matrix.get(1, 2));
  }

  @Test
  public void testChargeRowSortsLast() {
    StoichiometricMatrix matrix = new StoichiometricMatrix(
        Collections.singletonList(counts("Fe", 1, ElementCounts.CHARGE, 3)),
        Arrays.asList(counts("Fe", 1, ElementCounts.CHARGE, 2), counts(ElementCounts.CHARGE, -1)));
    assertEquals(Arrays.asList("Fe", ElementCounts.CHARGE), matrix.getSymbols());
  }

  @Test
  public void testReduceClassifiesColumns() {
    StoichiometricMatrix matrix = waterMatrix();
    matrix.reduce();
    assertEquals(Arrays.asList(0, 1), matrix.getPivotColumns());
    assertEquals(Collections.singletonList(2), matrix.getFreeColumns());
    assertEquals(BigFraction.ONE, matrix.get(0, 0));
    assertEquals(new BigFraction(-1, 2), matrix.get(1, 2));
  }

  @Test
  public void testNullSpaceBasis() {
    StoichiometricMatrix matrix = waterMatrix();
    matrix.reduce();
    List<BigFraction[]> basis = matrix.nullSpaceBasis();
    assertEquals(1, basis.size());
    assertArrayEquals(new BigFraction[]{BigFraction.ONE, new BigFraction(1, 2), BigFraction.ONE}, basis.get(0));
  }

  @Test
  public void testTwoDimensionalNullSpace() {
    // C + O2 -> CO + CO2
    StoichiometricMatrix matrix = new StoichiometricMatrix(
        Arrays.asList(counts("C", 1), counts("O", 2)),
        Arrays.asList(counts("C", 1, "O", 1), counts("C", 1, "O", 2)));
    matrix.reduce();
    assertEquals(Arrays.asList(2, 3), matrix.getFreeColumns());

    List<BigFraction[]> basis = matrix.nullSpaceBasis();
    assertEquals(2, basis.size());
    assertArrayEquals(new BigFraction[]{BigFraction.ONE, new BigFraction(1, 2), BigFraction.ONE, BigFraction.ZERO},
        basis.get(0));
    assertArrayEquals(new BigFraction[]{BigFraction.ONE, BigFraction.ONE, BigFraction.ZERO, BigFraction.ONE},
        basis.get(1));
  }

  @Test
  public void testFullRankHasEmptyBasis() {
    StoichiometricMatrix matrix = new StoichiometricMatrix(
        Collections.singletonList(counts("H", 2)), Collections.singletonList(counts("O", 2)));
    matrix.reduce();
    assertEquals(0, matrix.nullSpaceBasis().size());
  }

  @Test(expected = IllegalStateException.class)
  public void testBasisRequiresReduction() {
    waterMatrix().nullSpaceBasis();
  }
}
