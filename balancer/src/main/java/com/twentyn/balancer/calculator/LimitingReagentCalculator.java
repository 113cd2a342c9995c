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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds which reagent runs out first.  Each reagent supports {@code moles / coefficient} complete reactions; the one
 * supporting the fewest is limiting, and every other reagent keeps what that many reactions do not consume.
 */
public class LimitingReagentCalculator extends BalancedEquationSupport {
  // Leftovers at or below this many moles are rounding noise.
  public static final double EXCESS_THRESHOLD = 0.0001;

  public LimitingReagentCalculator() {
    this(new ChemicalEquationBalancer());
  }

  public LimitingReagentCalculator(ChemicalEquationBalancer balancer) {
    super(balancer);
  }

  /**
   * @param equation the equation, balanced or not.
   * @param reagents amounts of the reagents to compare; a molecule listed twice keeps its last amount.
   * @throws com.twentyn.balancer.errors.CalculationException if the equation does not balance or a reagent is not
   *   part of it.
   */
  public LimitingReagentResult findLimitingReagent(String equation, List<ReagentAmount> reagents) {
    if (reagents.isEmpty()) {
      throw new IllegalArgumentException("At least one reagent amount is required");
    }
    BalancedResult balanced = balance(equation);

    Map<String, Double> moles = new LinkedHashMap<>();
    for (ReagentAmount reagent : reagents) {
      moles.put(reagent.getMolecule(), toMoles(reagent));
    }

    String limiting = null;
    double minReactions = Double.POSITIVE_INFINITY;
    for (Map.Entry<String, Double> entry : moles.entrySet()) {
      double reactions = entry.getValue() / coefficientOf(balanced, entry.getKey());
      if (reactions < minReactions) {
        minReactions = reactions;
        limiting = entry.getKey();
      }
    }

    List<ExcessReagent> excess = new ArrayList<>();
    for (Map.Entry<String, Double> entry : moles.entrySet()) {
      if (entry.getKey().equals(limiting)) {
        continue;
      }
      double remaining = entry.getValue() - minReactions * coefficientOf(balanced, entry.getKey());
      if (remaining > EXCESS_THRESHOLD) {
        excess.add(new ExcessReagent(entry.getKey(), Amounts.round(remaining)));
      }
    }

    String explanation = messages.format(MessageKey.STEP_LIMITING_EXPLANATION, limiting, Amounts.fixed(minReactions));
    return new LimitingReagentResult(limiting, excess, balanced.getBalancedString(), explanation);
  }
}
