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

package com.twentyn.balancer.equation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Total amount of one symbol on each side of a balanced equation.
 */
public class BalanceCheck {
  @JsonProperty("left")
  private long left;

  @JsonProperty("right")
  private long right;

  private BalanceCheck() {
  }

  public BalanceCheck(long left, long right) {
    this.left = left;
    this.right = right;
  }

  public long getLeft() {
    return left;
  }

  public long getRight() {
    return right;
  }

  @JsonIgnore
  public boolean isBalanced() {
    return left == right;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    BalanceCheck that = (BalanceCheck) o;
    return left == that.left && right == that.right;
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(left) + Long.hashCode(right);
  }

  @Override
  public String toString() {
    return left + "/" + right;
  }
}
