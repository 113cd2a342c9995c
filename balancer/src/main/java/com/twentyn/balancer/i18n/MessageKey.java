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

package com.twentyn.balancer.i18n;

/**
 * Keys of the message catalogs under {@code com/twentyn/balancer/i18n/messages*.properties}.  Catalog entries are
 * {@link String#format} patterns; the javadoc of each key lists its arguments in order.
 */
public enum MessageKey {
  /** no arguments */
  EMPTY_EQUATION("error.empty_equation"),
  /** no arguments */
  MISSING_SEPARATOR("error.missing_separator"),
  /** no arguments */
  MULTIPLE_SEPARATORS("error.multiple_separators"),
  /** no arguments */
  MISSING_REACTANTS_OR_PRODUCTS("error.missing_reactants_or_products"),
  /** element */
  ELEMENT_MISSING_IN_PRODUCTS("error.element_missing_in_products"),
  /** element */
  ELEMENT_MISSING_IN_REACTANTS("error.element_missing_in_reactants"),
  /** formula */
  INVALID_FORMULA_SYNTAX("error.invalid_formula_syntax"),
  /** formula, offending characters */
  INVALID_CHARACTERS("error.invalid_characters"),
  /** formula, offending characters */
  INVALID_CHARACTERS_END("error.invalid_characters_end"),
  /** element, formula */
  UNKNOWN_ELEMENT("error.unknown_element"),
  /** element */
  UNKNOWN_ELEMENT_MOLAR_MASS("error.unknown_element_molar_mass"),
  /** underlying message */
  BALANCE_FAILED("error.balance_failed"),
  /** molecule */
  MOLECULE_NOT_FOUND("error.molecule_not_found"),
  /** no arguments */
  NO_SOLUTION("error.no_solution"),
  /** no arguments */
  NO_POSITIVE_SOLUTION("error.no_positive_solution"),
  /** molecule */
  ZERO_COEFFICIENT("error.zero_coefficient"),
  /** no arguments */
  COEFFICIENT_OVERFLOW("error.coefficient_overflow"),

  /** balanced equation */
  STEP_BALANCED_EQUATION("step.balanced_equation"),
  /** given molecule, given coefficient, target molecule, target coefficient */
  STEP_COEFFICIENTS("step.coefficients"),
  /** amount, molecule */
  STEP_GIVEN_MOL("step.given_mol"),
  /** amount, molecule, molar mass, moles */
  STEP_CONVERT_TO_MOL("step.convert_to_mol"),
  /** given moles, target coefficient, given coefficient, target moles, target molecule */
  STEP_MOLE_RATIO("step.mole_ratio"),
  /** moles, molar mass, grams */
  STEP_CONVERT_TO_GRAMS("step.convert_to_grams"),
  /** limiting molecule, number of complete reactions */
  STEP_LIMITING_EXPLANATION("step.limiting_explanation"),
  ;

  private final String key;

  MessageKey(String key) {
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
