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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

public class StoichiometryResult {
  @JsonProperty("amount")
  private double amount;

  @JsonProperty("unit")
  private AmountUnit unit;

  @JsonProperty("balanced_equation")
  private String balancedEquation;

  @JsonProperty("steps")
  private List<String> steps;

  private StoichiometryResult() {
  }

  public StoichiometryResult(double amount, AmountUnit unit, String balancedEquation, List<String> steps) {
    this.amount = amount;
    this.unit = unit;
    this.balancedEquation = balancedEquation;
    this.steps = Collections.unmodifiableList(steps);
  }

  /**
   * @return the computed amount, rounded to three decimals.
   */
  public double getAmount() {
    return amount;
  }

  public AmountUnit getUnit() {
    return unit;
  }

  public String getBalancedEquation() {
    return balancedEquation;
  }

  /**
   * @return a human readable, localized line per calculation step.
   */
  public List<String> getSteps() {
    return steps;
  }
}
