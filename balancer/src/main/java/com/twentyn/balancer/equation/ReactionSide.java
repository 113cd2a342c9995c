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

import com.twentyn.balancer.formula.ElementCounts;
import com.twentyn.balancer.formula.FormulaParser;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The ordered molecules on one side of an equation.
 */
public class ReactionSide {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ReactionSide.class);

  // The spaces matter: the plus in Na+ or Fe^3+ is a charge, not a separator.
  public static final String MOLECULE_SEPARATOR = " + ";
  private static final Pattern COEFFICIENT_HINT_PATTERN = Pattern.compile("^(\\d+)(.+)$");

  private final List<Molecule> molecules;

  public ReactionSide(List<Molecule> molecules) {
    this.molecules = Collections.unmodifiableList(new ArrayList<>(molecules));
  }

  /**
   * Split one side of an equation into molecules and parse each of them.  Empty terms are dropped, so a side made
   * only of whitespace yields no molecules.
   * @throws com.twentyn.balancer.errors.FormulaParseException if any molecule does not parse.
   */
  public static ReactionSide parse(String side, FormulaParser parser) {
    List<Molecule> molecules = new ArrayList<>();
    for (String term : StringUtils.splitByWholeSeparatorPreserveAllTokens(side, MOLECULE_SEPARATOR)) {
      String token = term.trim();
      if (token.isEmpty()) {
        continue;
      }

      Integer hint = null;
      Matcher hintMatcher = COEFFICIENT_HINT_PATTERN.matcher(token);
      if (hintMatcher.matches()) {
        token = hintMatcher.group(2).trim();
        try {
          hint = Integer.valueOf(hintMatcher.group(1));
        } catch (NumberFormatException e) {
          LOGGER.debug("Ignoring coefficient %s on %s, it does not fit in an int", hintMatcher.group(1), token);
        }
      }
      molecules.add(new Molecule(token, parser.parse(token), hint));
    }
    return new ReactionSide(molecules);
  }

  public List<Molecule> getMolecules() {
    return molecules;
  }

  public List<ElementCounts> getCounts() {
    return molecules.stream().map(Molecule::getCounts).collect(Collectors.toList());
  }

  public int size() {
    return molecules.size();
  }

  public boolean isEmpty() {
    return molecules.isEmpty();
  }

  /**
   * Element symbols occurring anywhere on this side, excluding charge.
   */
  public Set<String> getElementSymbols() {
    Set<String> symbols = new TreeSet<>();
    molecules.forEach(m -> symbols.addAll(m.getCounts().getElementSymbols()));
    return symbols;
  }

  /**
   * Render this side with the given coefficients, leaving out coefficients equal to 1.
   */
  public String format(int[] coefficients) {
    List<String> terms = new ArrayList<>(molecules.size());
    for (int i = 0; i < molecules.size(); i++) {
      terms.add((coefficients[i] == 1 ? "" : String.valueOf(coefficients[i])) + molecules.get(i).getFormula());
    }
    return StringUtils.join(terms, MOLECULE_SEPARATOR);
  }

  @Override
  public String toString() {
    return StringUtils.join(molecules, MOLECULE_SEPARATOR);
  }
}
