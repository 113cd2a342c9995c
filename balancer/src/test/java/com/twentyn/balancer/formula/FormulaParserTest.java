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

package com.twentyn.balancer.formula;

import com.twentyn.balancer.errors.ErrorCode;
import com.twentyn.balancer.errors.FormulaParseException;
import com.twentyn.balancer.i18n.MessageFormatter;
import com.twentyn.balancer.i18n.MessageKey;
import org.apache.commons.lang3.StringUtils;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class FormulaParserTest {

  private FormulaParser parser;

  @Before
  public void setup() {
    parser = new FormulaParser();
  }

  private static ElementCounts counts(Object... symbolsAndCounts) {
    Map<String, Integer> map = new HashMap<>();
    for (int i = 0; i < symbolsAndCounts.length; i += 2) {
      map.put((String) symbolsAndCounts[i], (Integer) symbolsAndCounts[i + 1]);
    }
    return ElementCounts.of(map);
  }

  private String parseFailureMessage(String formula) {
    try {
      parser.parse(formula);
    } catch (FormulaParseException e) {
      assertEquals("Parse failures carry the parse error code", ErrorCode.PARSE_ERROR, e.getCode());
      return e.getMessage();
    }
    fail(String.format("Expected %s to fail to parse", formula));
    return null;
  }

  @Test
  public void testSimpleFormulas() {
    assertEquals(counts("H", 2, "O", 1), parser.parse("H2O"));
    assertEquals(counts("Na", 1, "Cl", 1), parser.parse("NaCl"));
    assertEquals(counts("C", 6, "H", 12, "O", 6), parser.parse("C6H12O6"));
    assertEquals("Repeated symbols are summed", counts("C", 2, "H", 6, "O", 1), parser.parse("CH3CH2OH"));
  }

  @Test
  public void testGroups() {
    assertEquals(counts("Mg", 1, "O", 2, "H", 2), parser.parse("Mg(OH)2"));
    assertEquals(counts("Ca", 1, "N", 2, "O", 6), parser.parse("Ca(NO3)2"));
    assertEquals(counts("K", 4, "Fe", 1, "C", 6, "N", 6), parser.parse("K4Fe(CN)6"));
    assertEquals("Groups without a multiplier count once", counts("C", 1, "H", 4, "O", 1), parser.parse("(CH3)OH"));
  }

  @Test
  public void testNestedAndSquareBracketGroups() {
    ElementCounts expected = counts("Cr", 7, "N", 66, "H", 96, "C", 42, "O", 24);
    assertEquals(expected, parser.parse("(Cr(N2H4CO)6)4(Cr(CN)6)3"));
    assertEquals("Square brackets group like parentheses", expected, parser.parse("[Cr(N2H4CO)6]4[Cr(CN)6]3"));
  }

  @Test
  public void testHydrates() {
    assertEquals(counts("Cu", 1, "S", 1, "O", 9, "H", 10), parser.parse("CuSO4.5H2O"));
    assertEquals("A hydrate part without a multiplier counts once",
        counts("Ca", 1, "S", 1, "O", 5, "H", 2), parser.parse("CaSO4.H2O"));
    assertEquals(counts("Fe", 1, "N", 2, "H", 20, "S", 2, "O", 14), parser.parse("Fe(NH4)2(SO4)2.6H2O"));
  }

  @Test
  public void testCharges() {
    assertEquals(counts("Fe", 1, ElementCounts.CHARGE, 3), parser.parse("Fe^3+"));
    assertEquals(counts("S", 1, "O", 4, ElementCounts.CHARGE, -2), parser.parse("SO4^2-"));
    assertEquals("Without a caret the digit is a subscript",
        counts("N", 1, "H", 4, ElementCounts.CHARGE, 1), parser.parse("NH4+"));
    assertEquals(counts("O", 1, "H", 1, ElementCounts.CHARGE, -1), parser.parse("OH-"));
    assertEquals("A caret without magnitude means a unit charge",
        counts("Na", 1, ElementCounts.CHARGE, 1), parser.parse("Na^+"));
  }

  @Test
  public void testElectrons() {
    ElementCounts electron = counts(ElementCounts.CHARGE, -1);
    assertEquals(electron, parser.parse("e"));
    assertEquals(electron, parser.parse("e-"));
    assertEquals(electron, parser.parse("e^-"));
  }

  @Test
  public void testLeadingCoefficientAndWhitespaceAreIgnored() {
    assertEquals(counts("H", 2, "O", 1), parser.parse("2H2O"));
    assertEquals(counts("H", 2, "O", 1), parser.parse("H 2 O"));
  }

  @Test
  public void testEmptyFormulaHasNoElements() {
    assertTrue(parser.parse("").isEmpty());
  }

  @Test
  public void testStateAnnotations() {
    ParsedFormula water = parser.parseWithState("H2O(l)");
    assertEquals(counts("H", 2, "O", 1), water.getElements());
    assertEquals(Optional.of(MatterState.LIQUID), water.getState());

    assertEquals(Optional.of(MatterState.AQUEOUS), parser.parseWithState("NaCl(aq)").getState());
    assertEquals(Optional.of(MatterState.GAS), parser.parseWithState("CO2 (g)").getState());
    assertEquals(Optional.of(MatterState.SOLID), parser.parseWithState("Fe(s)").getState());
    assertFalse("No annotation means no state", parser.parseWithState("CO2").getState().isPresent());

    assertEquals("parse drops the state", counts("H", 2), parser.parse("H2(g)"));
  }

  @Test
  public void testInvalidCharacters() {
    assertEquals("Invalid characters at end of formula 'h2o': 'h2o'", parseFailureMessage("h2o"));
    assertEquals("Invalid characters in formula 'H2$O': '$'", parseFailureMessage("H2$O"));
    assertEquals("Invalid characters at end of formula 'H2O!': '!'", parseFailureMessage("H2O!"));
    assertEquals("A stray closing bracket is reported as invalid characters",
        "Invalid characters at end of formula 'Ca)2': ')2'", parseFailureMessage("Ca)2"));
    assertTrue("Digits inside an empty position are invalid",
        parseFailureMessage("H(2)").startsWith("Invalid characters"));
  }

  @Test
  public void testMalformedGroups() {
    assertEquals("Invalid formula syntax (unbalanced or malformed parentheses): Ca(OH",
        parseFailureMessage("Ca(OH"));
    assertTrue(parseFailureMessage("Ca(OH]2").startsWith("Invalid formula syntax"));
    assertTrue(parseFailureMessage("()").startsWith("Invalid formula syntax"));
  }

  @Test
  public void testGroupNestingLimit() {
    int limit = FormulaParser.MAX_GROUP_DEPTH;
    assertEquals(counts("H", 1), parser.parse(StringUtils.repeat("(", limit) + "H" + StringUtils.repeat(")", limit)));
    assertTrue(parseFailureMessage(StringUtils.repeat("(", limit + 1) + "H" + StringUtils.repeat(")", limit + 1))
        .startsWith("Invalid formula syntax"));
    assertTrue("Very deep nesting fails cleanly",
        parseFailureMessage(StringUtils.repeat("[", 50000) + "O" + StringUtils.repeat("]", 50000))
            .startsWith("Invalid formula syntax"));
  }

  @Test
  public void testUnknownElement() {
    assertEquals("Unknown element 'Xx' in formula 'Xx2O'", parseFailureMessage("Xx2O"));
  }

  @Test
  public void testExceptionCarriesFormula() {
    try {
      parser.parse("Qq");
      fail("Qq is not an element");
    } catch (FormulaParseException e) {
      assertEquals("Qq", e.getFormula());
    }
  }

  @Test
  public void testMessagesComeFromInjectedFormatter() {
    MessageFormatter messages = Mockito.mock(MessageFormatter.class);
    Mockito.when(messages.format(MessageKey.UNKNOWN_ELEMENT, "Xx", "Xx2O")).thenReturn("no such element");
    FormulaParser mockedParser = new FormulaParser(messages);

    try {
      mockedParser.parse("Xx2O");
      fail("Xx2O should not parse");
    } catch (FormulaParseException e) {
      assertEquals("no such element", e.getMessage());
    }
    Mockito.verify(messages).format(MessageKey.UNKNOWN_ELEMENT, "Xx", "Xx2O");
  }
}
