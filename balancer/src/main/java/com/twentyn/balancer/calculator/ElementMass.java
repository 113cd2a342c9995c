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
 * The contribution of one element to a molar mass: how many atoms, the atomic mass of one atom and their product.
 */
public class ElementMass {
  @JsonProperty("count")
  private int count;

  @JsonProperty("mass")
  private double mass;

  @JsonProperty("total")
  private double total;

  private ElementMass() {
  }

  public ElementMass(int count, double mass, double total) {
    this.count = count;
    this.mass = mass;
    this.total = total;
  }

  public int getCount() {
    return count;
  }

  public double getMass() {
    return mass;
  }

  public double getTotal() {
    return total;
  }

  @Override
  public String toString() {
    return String.format("%d x %s = %s", count, Amounts.plain(mass), Amounts.plain(total));
  }
}
