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

import java.util.Optional;

/**
 * Physical state annotations that may trail a formula, as in H2O(l) or NaCl(aq).
 */
public enum MatterState {
  SOLID("s"),
  LIQUID("l"),
  GAS("g"),
  AQUEOUS("aq"),
  ;

  private final String annotation;

  MatterState(String annotation) {
    this.annotation = annotation;
  }

  public String getAnnotation() {
    return annotation;
  }

  public static Optional<MatterState> fromAnnotation(String annotation) {
    for (MatterState state : values()) {
      if (state.annotation.equals(annotation)) {
        return Optional.of(state);
      }
    }
    return Optional.empty();
  }
}
