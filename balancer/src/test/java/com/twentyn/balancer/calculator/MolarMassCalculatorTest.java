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

import com.twentyn.balancer.errors.FormulaParseException;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class MolarMassCalculatorTest {

  private static final double DELTA = 0.01;

  private MolarMassCalculator calculator;

  @Before
  public void setup() {
    calculator = new MolarMassCalculator();
  }

  @Test
  public void testCommonMolecules() {
    assertEquals(18.015, calculator.calculateMolarMass("H2O"), DELTA);
    assertEquals(58.44, calculator.calculateMolarMass("NaCl"), DELTA);
    assertEquals(180.16, calculator.calculateMolarMass("C6H12O6"), DELTA);
    assertEquals(74.09, calculator.calculateMolarMass("Ca(OH)2"), DELTA);
    assertEquals(98.08, calculator.calculateMolarMass("H2SO4"), DELTA);
    assertEquals("Hydrate water counts", 249.68, calculator.calculateMolarMass("CuSO4.5H2O"), 0.1);
  }

  @Test
  public void testResultIsRoundedToThreeDecimals() {
    assertEquals(180.156, calculator.calculateMolarMass("C6H12O6"), 0.0);
  }

  @Test
  public void testBreakdown() {
    MolarMassResult result = calculator.calculateMolarMassDetailed("Ca3(PO4)2");
    assertEquals(310.18, result.getMolarMass(), DELTA);
    assertEquals(3, result.getBreakdown().get("Ca").getCount());
    assertEquals(2, result.getBreakdown().get("P").getCount());
    assertEquals(8, result.getBreakdown().get("O").getCount());
    assertEquals(40.08, result.getBreakdown().get("Ca").getMass(), 0.0);
    assertEquals(120.24, result.getBreakdown().get("Ca").getTotal(), 0.0001);
  }

  @Test
  public void testChargeIsIgnored() {
    assertEquals(calculator.calculateMolarMass("Fe"), calculator.calculateMolarMass("Fe^3+"), 0.0);
    assertFalse("Charge has no breakdown entry",
        calculator.calculateMolarMassDetailed("SO4^2-").getBreakdown().containsKey("_Q"));
  }

  @Test(expected = FormulaParseException.class)
  public void testUnknownElement() {
    calculator.calculateMolarMass("Xx2O");
  }
}
