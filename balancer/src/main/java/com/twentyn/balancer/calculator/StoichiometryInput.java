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
 * A stoichiometry question: given this much of one molecule, how much of another does the equation involve?
 */
public class StoichiometryInput {
  @JsonProperty("equation")
  private String equation;

  @JsonProperty("given")
  private ReagentAmount given;

  @JsonProperty("find_molecule")
  private String findMolecule;

  @JsonProperty("find_unit")
  private AmountUnit findUnit;

  private StoichiometryInput() {
  }

  /**
   * @param equation the equation, balanced or not.
   * @param given the known amount of one of its molecules.
   * @param findMolecule the molecule whose amount is wanted.
   * @param findUnit the unit to report it in.
   */
  public StoichiometryInput(String equation, ReagentAmount given, String findMolecule, AmountUnit findUnit) {
    this.equation = equation;
    this.given = given;
    this.findMolecule = findMolecule;
    this.findUnit = findUnit;
  }

  public String getEquation() {
    return equation;
  }

  public ReagentAmount getGiven() {
    return given;
  }

  public String getFindMolecule() {
    return findMolecule;
  }

  public AmountUnit getFindUnit() {
    return findUnit;
  }
}
