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

import com.twentyn.balancer.elements.PeriodicTable;
import com.twentyn.balancer.errors.FormulaParseException;
import com.twentyn.balancer.i18n.LocalizedMessages;
import com.twentyn.balancer.i18n.MessageFormatter;
import com.twentyn.balancer.i18n.MessageKey;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses chemical formula strings into element counts.
 * Example: "H2O" -> {H: 2, O: 1}
 * Example: "Ca(OH)2" -> {Ca: 1, H: 2, O: 2}
 * Example: "CuSO4.5H2O" -> {Cu: 1, H: 10, O: 9, S: 1}
 * Example: "Fe^3+" -> {Fe: 1, _Q: 3}
 *
 * The steps below run in a fixed order, each one working on what the previous one left:
 * 1) whitespace is removed;
 * 2) a trailing state annotation, (s) (l) (g) or (aq), is removed and recorded;
 * 3) hydrate parts are split on '.', parts after the first taking a leading integer as multiplier;
 * 4) a leading coefficient is stripped from each part;
 * 5) a trailing charge (^N+, ^N-, + or -) is removed and recorded, electrons being e, e- or e^-;
 * 6) what is left is parsed by recursive descent into atoms and (bracketed) groups.
 *
 * Instances only hold their message formatter and can be shared.
 */
public class FormulaParser {

  private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");
  private static final Pattern STATE_PATTERN = Pattern.compile("\\((s|l|g|aq)\\)$");
  private static final Pattern HYDRATE_MULTIPLIER_PATTERN = Pattern.compile("^(\\d+)(.+)$");
  private static final Pattern LEADING_COEFFICIENT_PATTERN = Pattern.compile("^\\d+");
  private static final Pattern CARET_CHARGE_PATTERN = Pattern.compile("\\^(\\d*)([+-])$");
  private static final Pattern UNIT_CHARGE_PATTERN = Pattern.compile("([+-])$");

  // Groups nested deeper than this are rejected as malformed rather than risking the parser's stack.
  public static final int MAX_GROUP_DEPTH = 256;

  private final MessageFormatter messages;

  public FormulaParser() {
    this(LocalizedMessages.english());
  }

  public FormulaParser(MessageFormatter messages) {
    this.messages = messages;
  }

  /**
   * Parse a formula, discarding any state annotation.
   * @param formula a formula such as "K4Fe(CN)6" or "SO4^2-"
   * @return the element counts, charge included under {@link ElementCounts#CHARGE}
   * @throws FormulaParseException if the formula is malformed or names an unknown element
   */
  public ElementCounts parse(String formula) {
    return parseWithState(formula).getElements();
  }

  /**
   * Parse a formula and keep its state annotation, e.g. "H2O(l)" -> ({H: 2, O: 1}, LIQUID).
   * @throws FormulaParseException if the formula is malformed or names an unknown element
   */
  public ParsedFormula parseWithState(String formula) {
    try {
      return parseFormulaWithState(formula);
    } catch (ArithmeticException e) {
      // Counts that overflow an int can only come from absurd subscripts.
      throw new FormulaParseException(messages.format(MessageKey.INVALID_FORMULA_SYNTAX, formula), formula);
    }
  }

  private ParsedFormula parseFormulaWithState(String formula) {
    String cleanFormula = WHITESPACE_PATTERN.matcher(formula).replaceAll("");

    MatterState state = null;
    Matcher stateMatcher = STATE_PATTERN.matcher(cleanFormula);
    if (stateMatcher.find()) {
      state = MatterState.fromAnnotation(stateMatcher.group(1)).orElse(null);
      cleanFormula = cleanFormula.substring(0, stateMatcher.start());
    }

    if (!cleanFormula.contains(".")) {
      return new ParsedFormula(parseStandardFormula(cleanFormula), state);
    }

    // Hydrates, e.g. CuSO4.5H2O: every part after the first may carry its own multiplier.
    String[] parts = cleanFormula.split("\\.", -1);
    ElementCounts.Builder total = ElementCounts.builder();
    for (int i = 0; i < parts.length; i++) {
      String subFormula = parts[i];
      int multiplier = 1;
      if (i > 0) {
        Matcher multiplierMatcher = HYDRATE_MULTIPLIER_PATTERN.matcher(subFormula);
        if (multiplierMatcher.matches()) {
          multiplier = parseCount(multiplierMatcher.group(1), formula);
          subFormula = multiplierMatcher.group(2);
        }
      }
      total.addAll(parseStandardFormula(subFormula), multiplier);
    }
    return new ParsedFormula(total.build(), state);
  }

  /**
   * Parses a formula that contains no hydrate dots.
   */
  private ElementCounts parseStandardFormula(String formula) {
    String cleanFormula = LEADING_COEFFICIENT_PATTERN.matcher(formula).replaceFirst("");

    if (cleanFormula.equals("e") || cleanFormula.equals("e-") || cleanFormula.equals("e^-")) {
      return ElementCounts.builder().add(ElementCounts.CHARGE, -1).build();
    }

    /* A charge needs a caret as soon as it has a magnitude (Fe^3+), since in "NH4+" the 4 is a subscript.  Bare
     * + and - are unit charges. */
    int charge = 0;
    Matcher caretMatcher = CARET_CHARGE_PATTERN.matcher(cleanFormula);
    if (caretMatcher.find()) {
      int magnitude = caretMatcher.group(1).isEmpty() ? 1 : parseCount(caretMatcher.group(1), formula);
      charge = "+".equals(caretMatcher.group(2)) ? magnitude : -magnitude;
      cleanFormula = cleanFormula.substring(0, caretMatcher.start());
    } else {
      Matcher unitMatcher = UNIT_CHARGE_PATTERN.matcher(cleanFormula);
      if (unitMatcher.find()) {
        charge = "+".equals(unitMatcher.group(1)) ? 1 : -1;
        cleanFormula = cleanFormula.substring(0, unitMatcher.start());
      }
    }

    ElementCounts.Builder counts = ElementCounts.builder();
    if (charge != 0) {
      counts.add(ElementCounts.CHARGE, charge);
    }
    if (!cleanFormula.isEmpty()) {
      counts.addAll(FormulaNode.evaluate(new Scanner(cleanFormula).parseFormula()), 1);
    }
    return counts.build();
  }

  private int parseCount(String digits, String formula) {
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      throw new FormulaParseException(messages.format(MessageKey.INVALID_CHARACTERS, formula, digits), formula);
    }
  }

  /**
   * Recursive descent over a flat formula string:
   *   formula  := item*
   *   item     := atom | group
   *   atom     := Upper lower? digits?
   *   group    := ( '(' formula ')' | '[' formula ']' ) digits?
   * Groups must be non-empty and nest at most {@link #MAX_GROUP_DEPTH} deep.
   */
  private class Scanner {
    private final String formula;
    private int pos = 0;
    private int depth = 0;

    Scanner(String formula) {
      this.formula = formula;
    }

    List<FormulaNode> parseFormula() {
      List<FormulaNode> nodes = parseSequence(null);
      if (pos < formula.length()) {
        // Only a closing bracket with no opening partner stops the top-level sequence early.
        throw invalidCharacters();
      }
      return nodes;
    }

    private List<FormulaNode> parseSequence(Character closing) {
      List<FormulaNode> nodes = new ArrayList<>();
      while (pos < formula.length()) {
        char c = formula.charAt(pos);
        if (c == '(' || c == '[') {
          nodes.add(parseGroup(c == '(' ? ')' : ']'));
        } else if (c == ')' || c == ']') {
          if (closing == null) {
            return nodes;
          }
          if (c != closing) {
            throw syntaxError();
          }
          return nodes;
        } else if (Character.isUpperCase(c)) {
          nodes.add(parseAtom());
        } else {
          throw invalidCharacters();
        }
      }
      if (closing != null) {
        throw syntaxError();
      }
      return nodes;
    }

    private FormulaNode parseGroup(char closing) {
      if (++depth > MAX_GROUP_DEPTH) {
        throw syntaxError();
      }
      pos++;
      List<FormulaNode> children = parseSequence(closing);
      if (children.isEmpty()) {
        throw syntaxError();
      }
      pos++;
      depth--;
      return new FormulaNode.Group(children, readCount());
    }

    private FormulaNode parseAtom() {
      int start = pos++;
      if (pos < formula.length() && Character.isLowerCase(formula.charAt(pos))) {
        pos++;
      }
      String symbol = formula.substring(start, pos);
      if (!PeriodicTable.isValidElement(symbol)) {
        throw new FormulaParseException(messages.format(MessageKey.UNKNOWN_ELEMENT, symbol, formula), formula);
      }
      return new FormulaNode.Atom(symbol, readCount());
    }

    private int readCount() {
      int start = pos;
      while (pos < formula.length() && Character.isDigit(formula.charAt(pos))) {
        pos++;
      }
      return start == pos ? 1 : parseCount(formula.substring(start, pos), formula);
    }

    /**
     * Reports the run of characters from the current position up to the next place an atom or group could start.
     */
    private FormulaParseException invalidCharacters() {
      int end = pos + 1;
      while (end < formula.length() && !startsItem(formula.charAt(end))) {
        end++;
      }
      String chars = formula.substring(pos, end);
      MessageKey key = end == formula.length() ? MessageKey.INVALID_CHARACTERS_END : MessageKey.INVALID_CHARACTERS;
      return new FormulaParseException(messages.format(key, formula, chars), formula);
    }

    private FormulaParseException syntaxError() {
      return new FormulaParseException(messages.format(MessageKey.INVALID_FORMULA_SYNTAX, formula), formula);
    }

    private boolean startsItem(char c) {
      return Character.isUpperCase(c) || c == '(' || c == '[';
    }
  }
}
