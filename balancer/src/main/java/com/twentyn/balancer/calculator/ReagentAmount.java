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

/**
 * A known quantity of one molecule of an equation, in moles or grams.
 */
public class ReagentAmount {
  @JsonProperty("molecule")
  private String molecule;

  @JsonProperty("amount")
  private double amount;

  @JsonProperty("unit")
  private AmountUnit unit;

  private ReagentAmount() {
  }

  public ReagentAmount(String molecule, double amount, AmountUnit unit) {
    this.molecule = molecule;
    this.amount = amount;
    this.unit = unit;
  }

  public static ReagentAmount moles(String molecule, double amount) {
    return new ReagentAmount(molecule, amount, AmountUnit.MOL);
  }

  public static ReagentAmount grams(String molecule, double amount) {
    return new ReagentAmount(molecule, amount, AmountUnit.GRAM);
  }

  public String getMolecule() {
    return molecule;
  }

  public double getAmount() {
    return amount;
  }

  public AmountUnit getUnit() {
    return unit;
  }

  @Override
  public String toString() {
    return String.format("%s %s %s", Amounts.plain(amount), unit.getSymbol(), molecule);
  }
}
