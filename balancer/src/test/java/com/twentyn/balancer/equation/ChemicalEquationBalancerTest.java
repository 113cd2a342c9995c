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

import com.twentyn.balancer.errors.ErrorCode;
import com.twentyn.balancer.formula.ElementCounts;
import com.twentyn.balancer.i18n.LocalizedMessages;
import com.twentyn.balancer.i18n.MessageFormatter;
import com.twentyn.balancer.i18n.MessageKey;
import org.apache.commons.lang3.StringUtils;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ChemicalEquationBalancerTest {

  private static final String MONSTER =
      "(Cr(N2H4CO)6)4(Cr(CN)6)3 + KMnO4 + H2SO4 -> K2Cr2O7 + MnSO4 + CO2 + KNO3 + K2SO4 + H2O";
  private static final List<Integer> MONSTER_COEFFICIENTS =
      Arrays.asList(10, 1176, 1399, 35, 1176, 420, 660, 223, 1879);

  private ChemicalEquationBalancer balancer;

  @Before
  public void setup() {
    balancer = new ChemicalEquationBalancer();
  }

  private void assertBalancesTo(String equation, String expected) {
    BalancedResult result = balancer.balance(equation);
    assertEquals(String.format("Balancing %s should succeed: %s", equation, result.getMessage()),
        BalancedResult.Status.SUCCESS, result.getStatus());
    assertEquals(String.format("Balanced form of %s", equation), expected, result.getBalancedString());
    for (Map.Entry<String, BalanceCheck> entry : result.getDebug().getBalanceCheck().entrySet()) {
      assertTrue(String.format("%s is conserved in %s (%s)", entry.getKey(), equation, entry.getValue()),
          entry.getValue().isBalanced());
    }
  }

  private BalancedResult assertFails(String equation, ErrorCode code) {
    BalancedResult result = balancer.balance(equation);
    assertEquals(String.format("Balancing %s should fail", equation), BalancedResult.Status.ERROR, result.getStatus());
    assertEquals(code, result.getErrorCode());
    assertNull("Failed results have no coefficients", result.getCoefficients());
    return result;
  }

  @Test
  public void testSimpleEquations() {
    assertBalancesTo("H2 + O2 -> H2O", "2H2 + O2 -> 2H2O");
    assertBalancesTo("Fe + O2 -> Fe2O3", "4Fe + 3O2 -> 2Fe2O3");
    assertBalancesTo("KClO3 -> KCl + O2", "2KClO3 -> 2KCl + 3O2");
    assertBalancesTo("CH4 + O2 -> CO2 + H2O", "CH4 + 2O2 -> CO2 + 2H2O");
  }

  @Test
  public void testAllSeparators() {
    assertBalancesTo("H2 + O2 = H2O", "2H2 + O2 -> 2H2O");
    assertBalancesTo("H2 + O2 => H2O", "2H2 + O2 -> 2H2O");
    assertBalancesTo("H2 + O2 → H2O", "2H2 + O2 -> 2H2O");
    assertBalancesTo("H2 + O2 ⇌ H2O", "2H2 + O2 -> 2H2O");
  }

  @Test
  public void testCoefficientsAndDebugInfo() {
    BalancedResult result = balancer.balance("H2 + O2 -> H2O");
    assertEquals(new ArrayList<>(Arrays.asList("H2", "O2", "H2O")), new ArrayList<>(result.getCoefficients().keySet()));
    assertEquals(Integer.valueOf(2), result.getCoefficients().get("H2"));
    assertEquals(Integer.valueOf(1), result.getCoefficients().get("O2"));
    assertEquals(Integer.valueOf(2), result.getCoefficients().get("H2O"));

    BalanceDebugInfo debug = result.getDebug();
    assertEquals(Arrays.asList("H", "O"), debug.getElements());
    assertEquals(2, debug.getReactants().get("H2").get("H"));
    assertEquals(1, debug.getProducts().get("H2O").get("O"));
    assertEquals(new BalanceCheck(4, 4), debug.getBalanceCheck().get("H"));
    assertEquals(new BalanceCheck(2, 2), debug.getBalanceCheck().get("O"));
  }

  @Test
  public void testMonsterEquation() {
    BalancedResult result = balancer.balance(MONSTER);
    assertTrue(result.getMessage(), result.isSuccess());
    assertEquals(MONSTER_COEFFICIENTS, new ArrayList<>(result.getCoefficients().values()));
    assertEquals(
        "10(Cr(N2H4CO)6)4(Cr(CN)6)3 + 1176KMnO4 + 1399H2SO4 -> " +
            "35K2Cr2O7 + 1176MnSO4 + 420CO2 + 660KNO3 + 223K2SO4 + 1879H2O",
        result.getBalancedString());
  }

  @Test
  public void testMonsterEquationWithSquareBrackets() {
    BalancedResult result = balancer.balance(MONSTER.replace("(Cr(N2H4CO)6)4(Cr(CN)6)3", "[Cr(N2H4CO)6]4[Cr(CN)6]3"));
    assertTrue(result.getMessage(), result.isSuccess());
    assertEquals(MONSTER_COEFFICIENTS, new ArrayList<>(result.getCoefficients().values()));
  }

  @Test
  public void testCoefficientsAreMinimal() {
    for (String equation : Arrays.asList(MONSTER, "Fe + O2 -> Fe2O3", "C + O2 -> CO + CO2",
        "K4Fe(CN)6 + KMnO4 + H2SO4 -> KHSO4 + Fe2(SO4)3 + MnSO4 + HNO3 + CO2 + H2O")) {
      BigInteger gcd = BigInteger.ZERO;
      for (Integer coefficient : balancer.balance(equation).getCoefficients().values()) {
        assertTrue("Coefficients are positive", coefficient > 0);
        gcd = gcd.gcd(BigInteger.valueOf(coefficient));
      }
      assertEquals(String.format("Coefficients of %s share no factor", equation), BigInteger.ONE, gcd);
    }
  }

  @Test
  public void testMultiDimensionalNullSpaces() {
    assertBalancesTo("C + O2 -> CO + CO2", "4C + 3O2 -> 2CO + 2CO2");
    assertBalancesTo("K2S + KMnO4 + H2SO4 -> S + MnSO4 + K2SO4 + H2O",
        "2K2S + 2KMnO4 + 4H2SO4 -> S + 2MnSO4 + 3K2SO4 + 4H2O");
    assertBalancesTo("K2S + KMnO4 + H2SO4 -> S + MnO4 + K2SO4 + H2O",
        "K2S + 4KMnO4 + 4H2SO4 -> 2S + 4MnO4 + 3K2SO4 + 4H2O");
  }

  @Test
  public void testConsistentHintsScaleTheSolution() {
    assertBalancesTo("8Fe + O2 -> Fe2O3", "8Fe + 6O2 -> 4Fe2O3");
  }

  @Test
  public void testInconsistentHintsAreIgnored() {
    assertBalancesTo("100Fe + 100O2 -> 1Fe2O3", "4Fe + 3O2 -> 2Fe2O3");
  }

  @Test
  public void testBalancingIsIdempotent() {
    assertBalancesTo("4Fe + 3O2 -> 2Fe2O3", "4Fe + 3O2 -> 2Fe2O3");
    assertBalancesTo("2H2 + O2 -> 2H2O", "2H2 + O2 -> 2H2O");
  }

  @Test
  public void testIonicEquations() {
    assertBalancesTo("Cl2 + OH- -> Cl- + ClO3- + H2O", "3Cl2 + 6OH- -> 5Cl- + ClO3- + 3H2O");
    assertBalancesTo("MnO4- + C2O4^2- + H+ -> Mn^2+ + CO2 + H2O",
        "2MnO4- + 5C2O4^2- + 16H+ -> 2Mn^2+ + 10CO2 + 8H2O");
    assertBalancesTo("Na+ + Cl- -> NaCl", "Na+ + Cl- -> NaCl");
  }

  @Test
  public void testHalfReactions() {
    assertBalancesTo("Fe^3+ + e- -> Fe^2+", "Fe^3+ + e- -> Fe^2+");
    assertBalancesTo("Cu -> Cu^2+ + e-", "Cu -> Cu^2+ + 2e-");
    assertBalancesTo("MnO4- + H+ + e- -> Mn^2+ + H2O", "MnO4- + 8H+ + 5e- -> Mn^2+ + 4H2O");
    assertBalancesTo("Cr2O7^2- + H+ + e- -> Cr^3+ + H2O", "Cr2O7^2- + 14H+ + 6e- -> 2Cr^3+ + 7H2O");

    BalancedResult result = balancer.balance("Cu -> Cu^2+ + e-");
    assertTrue("Charge is listed among the debug symbols",
        result.getDebug().getElements().contains(ElementCounts.CHARGE));
    assertEquals(new BalanceCheck(0, 0), result.getDebug().getBalanceCheck().get(ElementCounts.CHARGE));
  }

  @Test
  public void testHydrates() {
    assertBalancesTo("CuSO4.5H2O -> CuSO4 + H2O", "CuSO4.5H2O -> CuSO4 + 5H2O");
    assertBalancesTo("FeSO4 + (NH4)2SO4 + H2O -> Fe(NH4)2(SO4)2.6H2O",
        "FeSO4 + (NH4)2SO4 + 6H2O -> Fe(NH4)2(SO4)2.6H2O");
  }

  @Test
  public void testRedoxEquations() {
    assertBalancesTo("K4Fe(CN)6 + KMnO4 + H2SO4 -> KHSO4 + Fe2(SO4)3 + MnSO4 + HNO3 + CO2 + H2O",
        "10K4Fe(CN)6 + 122KMnO4 + 299H2SO4 -> 162KHSO4 + 5Fe2(SO4)3 + 122MnSO4 + 60HNO3 + 60CO2 + 188H2O");
    assertBalancesTo("Fe + HNO3 -> Fe(NO3)3 + N2 + H2O", "10Fe + 36HNO3 -> 10Fe(NO3)3 + 3N2 + 18H2O");
    assertBalancesTo("CuS2 + HNO3 -> Cu(NO3)2 + H2SO4 + N2O + H2O",
        "4CuS2 + 22HNO3 -> 4Cu(NO3)2 + 8H2SO4 + 7N2O + 3H2O");
    assertBalancesTo("Mg + HNO3 -> Mg(NO3)2 + NH4NO3 + H2O", "4Mg + 10HNO3 -> 4Mg(NO3)2 + NH4NO3 + 3H2O");
  }

  @Test
  public void testStateAnnotationsArePreserved() {
    assertBalancesTo("H2(g) + O2(g) -> H2O(l)", "2H2(g) + O2(g) -> 2H2O(l)");
  }

  @Test
  public void testSyntaxErrors() {
    assertEquals("Empty equation", assertFails("", ErrorCode.INVALID_EQUATION).getMessage());
    assertEquals("Empty equation", assertFails("   ", ErrorCode.INVALID_EQUATION).getMessage());
    assertEquals("Invalid equation syntax: missing separator (->, =>, =)",
        assertFails("H2 + O2", ErrorCode.INVALID_EQUATION).getMessage());
    assertEquals("Invalid equation syntax: multiple separators found",
        assertFails("H2 -> H -> H2", ErrorCode.INVALID_EQUATION).getMessage());
    assertEquals("Mixed separators count as multiple separators",
        "Invalid equation syntax: multiple separators found",
        assertFails("H2 -> H = H2", ErrorCode.INVALID_EQUATION).getMessage());
    assertEquals("Missing reactants or products", assertFails(" -> H2O", ErrorCode.INVALID_EQUATION).getMessage());
    assertEquals("Missing reactants or products", assertFails("H2 + O2 -> ", ErrorCode.INVALID_EQUATION).getMessage());
  }

  @Test
  public void testParseErrorsBecomeResults() {
    assertEquals("Unknown element 'Xx' in formula 'H2Xx'",
        assertFails("H2 + Xx -> H2Xx", ErrorCode.PARSE_ERROR).getMessage());
    assertTrue(assertFails("h2 + O2 -> H2O", ErrorCode.PARSE_ERROR).getMessage().startsWith("Invalid characters"));
  }

  @Test
  public void testDeeplyNestedGroupsAreParseErrors() {
    String nested = StringUtils.repeat("(", 20000) + "H" + StringUtils.repeat(")", 20000);
    BalancedResult result = assertFails("H2 -> " + nested, ErrorCode.PARSE_ERROR);
    assertTrue(result.getMessage(), result.getMessage().startsWith("Invalid formula syntax"));
  }

  @Test
  public void testNonConservingBasisSumIsRejected() {
    // Each of these has a mixed-sign null space basis whose sum does not balance every element.
    for (String equation : Arrays.asList(
        "H5 + CH6 + H7 -> H4C6 + C4",
        "O8 + C7H2 + C -> C3 + C7H6 + H4O3",
        "H3 + C4 + OH -> C4 + H5O9")) {
      assertEquals(equation, "No balancing with all coefficients positive was found",
          assertFails(equation, ErrorCode.BALANCE_ERROR).getMessage());
    }
  }

  @Test
  public void testConservationViolations() {
    assertEquals("Element 'H' is present in reactants but missing in products",
        assertFails("H2 -> O2", ErrorCode.CONSERVATION_ERROR).getMessage());
    assertEquals("Element 'Cl' is present in products but missing in reactants",
        assertFails("Na -> NaCl", ErrorCode.CONSERVATION_ERROR).getMessage());
  }

  @Test
  public void testDegenerateSolutions() {
    assertEquals("Equation has no non-trivial solution",
        assertFails("H2O -> H2O2", ErrorCode.BALANCE_ERROR).getMessage());
    assertEquals("No solution with a positive coefficient for 'e-'",
        assertFails("Na + Cl -> NaCl + e-", ErrorCode.BALANCE_ERROR).getMessage());
  }

  @Test
  public void testVietnameseMessages() {
    ChemicalEquationBalancer vietnamese = new ChemicalEquationBalancer(LocalizedMessages.forLanguageTag("vi"));
    assertEquals("Nguyên tố 'H' có trong chất phản ứng nhưng thiếu trong sản phẩm",
        vietnamese.balance("H2 -> O2").getMessage());
    assertEquals("Phương trình rỗng", vietnamese.balance("").getMessage());
    assertEquals("Language only affects messages", "2H2 + O2 -> 2H2O",
        vietnamese.balance("H2 + O2 -> H2O").getBalancedString());
  }

  @Test
  public void testMessagesComeFromInjectedFormatter() {
    MessageFormatter messages = Mockito.mock(MessageFormatter.class);
    Mockito.when(messages.format(MessageKey.MISSING_SEPARATOR)).thenReturn("where is the arrow?");

    BalancedResult result = new ChemicalEquationBalancer(messages).balance("H2 + O2");
    assertEquals("where is the arrow?", result.getMessage());
    Mockito.verify(messages).format(MessageKey.MISSING_SEPARATOR);
  }
}
