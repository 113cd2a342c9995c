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
 * Moles of a reagent left over once the limiting reagent is used up.
 */
public class ExcessReagent {
  @JsonProperty("molecule")
  private String molecule;

  @JsonProperty("remaining")
  private double remaining;

  private ExcessReagent() {
  }

  public ExcessReagent(String molecule, double remaining) {
    this.molecule = molecule;
    this.remaining = remaining;
  }

  public String getMolecule() {
    return molecule;
  }

  public double getRemaining() {
    return remaining;
  }

  @JsonProperty("unit")
  public AmountUnit getUnit() {
    return AmountUnit.MOL;
  }

  @Override
  public String toString() {
    return String.format("%s mol %s", Amounts.plain(remaining), molecule);
  }
}
