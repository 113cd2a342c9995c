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
import com.twentyn.balancer.errors.CalculationException;
import com.twentyn.balancer.errors.ErrorCode;
import com.twentyn.balancer.i18n.MessageFormatter;
import com.twentyn.balancer.i18n.MessageKey;

/**
 * Shared plumbing for calculators that start by balancing an equation and converting amounts to moles.
 */
abstract class BalancedEquationSupport {
  protected final ChemicalEquationBalancer balancer;
  protected final MessageFormatter messages;
  protected final MolarMassCalculator molarMassCalculator;

  protected BalancedEquationSupport(ChemicalEquationBalancer balancer) {
    this.balancer = balancer;
    this.messages = balancer.getMessages();
    this.molarMassCalculator = new MolarMassCalculator(messages, balancer.getParser());
  }

  /**
   * @throws CalculationException if the equation does not balance.
   */
  protected BalancedResult balance(String equation) {
    BalancedResult result = balancer.balance(equation);
    if (!result.isSuccess()) {
      throw new CalculationException(messages.format(MessageKey.BALANCE_FAILED, result.getMessage()));
    }
    return result;
  }

  /**
   * @throws CalculationException if the molecule is not written in the balanced equation.
   */
  protected int coefficientOf(BalancedResult result, String molecule) {
    Integer coefficient = result.getCoefficients().get(molecule);
    if (coefficient == null) {
      throw new CalculationException(ErrorCode.MOLECULE_NOT_FOUND,
          messages.format(MessageKey.MOLECULE_NOT_FOUND, molecule));
    }
    return coefficient;
  }

  protected double toMoles(ReagentAmount reagent) {
    return reagent.getUnit() == AmountUnit.GRAM ?
        reagent.getAmount() / molarMassCalculator.calculateMolarMass(reagent.getMolecule()) :
        reagent.getAmount();
  }
}
