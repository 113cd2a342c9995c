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

package com.twentyn.balancer.formula;

import java.util.Collections;
import java.util.List;

/**
 * Parse tree of a formula without charge or hydrate parts.  A formula is a sequence of atoms and groups; a group is a
 * bracketed sequence with a multiplier.  Counts are computed bottom-up by {@link #accumulate}.
 */
public interface FormulaNode {

  /**
   * Add this node's element counts, scaled by {@code multiplier}, to {@code builder}.
   */
  void accumulate(ElementCounts.Builder builder, int multiplier);

  static ElementCounts evaluate(List<FormulaNode> nodes) {
    ElementCounts.Builder builder = ElementCounts.builder();
    for (FormulaNode node : nodes) {
      node.accumulate(builder, 1);
    }
    return builder.build();
  }

  final class Atom implements FormulaNode {
    private final String symbol;
    private final int count;

    public Atom(String symbol, int count) {
      this.symbol = symbol;
      this.count = count;
    }

    public String getSymbol() {
      return symbol;
    }

    public int getCount() {
      return count;
    }

    @Override
    public void accumulate(ElementCounts.Builder builder, int multiplier) {
      builder.add(symbol, Math.multiplyExact(count, multiplier));
    }

    @Override
    public String toString() {
      return count == 1 ? symbol : symbol + count;
    }
  }

  final class Group implements FormulaNode {
    private final List<FormulaNode> children;
    private final int multiplier;

    public Group(List<FormulaNode> children, int multiplier) {
      this.children = Collections.unmodifiableList(children);
      this.multiplier = multiplier;
    }

    public List<FormulaNode> getChildren() {
      return children;
    }

    public int getMultiplier() {
      return multiplier;
    }

    @Override
    public void accumulate(ElementCounts.Builder builder, int outerMultiplier) {
      int scale = Math.multiplyExact(multiplier, outerMultiplier);
      for (FormulaNode child : children) {
        child.accumulate(builder, scale);
      }
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("(");
      children.forEach(sb::append);
      sb.append(')');
      if (multiplier != 1) {
        sb.append(multiplier);
      }
      return sb.toString();
    }
  }
}
