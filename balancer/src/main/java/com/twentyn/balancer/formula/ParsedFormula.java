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

import java.util.Objects;
import java.util.Optional;

/**
 * Element counts of a formula together with its state annotation, if it had one.
 */
public class ParsedFormula {
  private final ElementCounts elements;
  private final MatterState state;

  public ParsedFormula(ElementCounts elements, MatterState state) {
    this.elements = elements;
    this.state = state;
  }

  public ElementCounts getElements() {
    return elements;
  }

  public Optional<MatterState> getState() {
    return Optional.ofNullable(state);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ParsedFormula that = (ParsedFormula) o;
    return elements.equals(that.elements) && state == that.state;
  }

  @Override
  public int hashCode() {
    return Objects.hash(elements, state);
  }

  @Override
  public String toString() {
    return state == null ? elements.toString() : elements + "(" + state.getAnnotation() + ")";
  }
}
