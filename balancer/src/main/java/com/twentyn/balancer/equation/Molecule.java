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

import com.twentyn.balancer.formula.ElementCounts;

import java.util.Objects;
import java.util.Optional;

/**
 * One term of an equation: the formula as the user wrote it (minus any leading coefficient), its parsed counts and the
 * coefficient the user put in front of it, if any.
 */
public class Molecule {
  private final String formula;
  private final ElementCounts counts;
  private final Integer coefficientHint;

  public Molecule(String formula, ElementCounts counts, Integer coefficientHint) {
    this.formula = formula;
    this.counts = counts;
    this.coefficientHint = coefficientHint;
  }

  public Molecule(String formula, ElementCounts counts) {
    this(formula, counts, null);
  }

  public String getFormula() {
    return formula;
  }

  public ElementCounts getCounts() {
    return counts;
  }

  public Optional<Integer> getCoefficientHint() {
    return Optional.ofNullable(coefficientHint);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Molecule that = (Molecule) o;
    return formula.equals(that.formula) &&
        counts.equals(that.counts) &&
        Objects.equals(coefficientHint, that.coefficientHint);
  }

  @Override
  public int hashCode() {
    return Objects.hash(formula, counts, coefficientHint);
  }

  @Override
  public String toString() {
    return coefficientHint == null ? formula : coefficientHint + formula;
  }
}
