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
import java.util.LinkedHashMap;
import java.util.Map;

public class MolarMassResult {
  @JsonProperty("molar_mass")
  private double molarMass;

  @JsonProperty("breakdown")
  private Map<String, ElementMass> breakdown;

  private MolarMassResult() {
  }

  public MolarMassResult(double molarMass, LinkedHashMap<String, ElementMass> breakdown) {
    this.molarMass = molarMass;
    this.breakdown = Collections.unmodifiableMap(breakdown);
  }

  /**
   * @return the molar mass in g/mol, rounded to three decimals.
   */
  public double getMolarMass() {
    return molarMass;
  }

  /**
   * @return element symbol -> contribution, in symbol order.
   */
  public Map<String, ElementMass> getBreakdown() {
    return breakdown;
  }
}
