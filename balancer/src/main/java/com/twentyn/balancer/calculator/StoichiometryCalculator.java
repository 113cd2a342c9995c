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

import com.twentyn.balancer.equation.BalancedResult;
import com.twentyn.balancer.equation.ChemicalEquationBalancer;
import com.twentyn.balancer.i18n.MessageKey;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a known amount of one molecule of an equation into the amount of another, through the mole ratio of the
 * balanced equation.  For example 2 mol H2 in "H2 + O2 -> H2O" yields 36.03 g H2O.
 */
public class StoichiometryCalculator extends BalancedEquationSupport {

  public StoichiometryCalculator() {
    this(new ChemicalEquationBalancer());
  }

  public StoichiometryCalculator(ChemicalEquationBalancer balancer) {
    super(balancer);
  }

  /**
   * @throws com.twentyn.balancer.errors.CalculationException if the equation does not balance or a molecule is not
   *   part of it.
   */
  public StoichiometryResult calculate(StoichiometryInput input) {
    List<String> steps = new ArrayList<>();
    ReagentAmount given = input.getGiven();
    String find = input.getFindMolecule();

    BalancedResult balanced = balance(input.getEquation());
    steps.add(messages.format(MessageKey.STEP_BALANCED_EQUATION, balanced.getBalancedString()));

    int givenCoefficient = coefficientOf(balanced, given.getMolecule());
    int findCoefficient = coefficientOf(balanced, find);
    steps.add(messages.format(MessageKey.STEP_COEFFICIENTS,
        given.getMolecule(), givenCoefficient, find, findCoefficient));

    double givenMoles = toMoles(given);
    if (given.getUnit() == AmountUnit.GRAM) {
      double molarMass = molarMassCalculator.calculateMolarMass(given.getMolecule());
      steps.add(messages.format(MessageKey.STEP_CONVERT_TO_MOL, Amounts.plain(given.getAmount()),
          given.getMolecule(), Amounts.plain(molarMass), Amounts.fixed(givenMoles)));
    } else {
      steps.add(messages.format(MessageKey.STEP_GIVEN_MOL, Amounts.plain(given.getAmount()), given.getMolecule()));
    }

    double findMoles = givenMoles * findCoefficient / givenCoefficient;
    steps.add(messages.format(MessageKey.STEP_MOLE_RATIO, Amounts.fixed(givenMoles), findCoefficient,
        givenCoefficient, Amounts.fixed(findMoles), find));

    double result = findMoles;
    if (input.getFindUnit() == AmountUnit.GRAM) {
      double molarMass = molarMassCalculator.calculateMolarMass(find);
      result = findMoles * molarMass;
      steps.add(messages.format(MessageKey.STEP_CONVERT_TO_GRAMS,
          Amounts.fixed(findMoles), Amounts.plain(molarMass), Amounts.fixed(result)));
    }

    return new StoichiometryResult(Amounts.round(result), input.getFindUnit(), balanced.getBalancedString(), steps);
  }
}
