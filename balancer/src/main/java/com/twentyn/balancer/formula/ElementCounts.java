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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * An immutable multiset of element symbols, e.g. Ca(OH)2 -> {Ca: 1, H: 2, O: 2}.  The net ionic charge of a formula
 * is stored alongside the atoms under the reserved {@link #CHARGE} key so that the solver can conserve it like any
 * other element.  Entries are kept in symbol order; zero counts are never stored.
 */
public final class ElementCounts {

  /**
   * Pseudo-symbol carrying net ionic charge.  It sorts after every element symbol.
   */
  public static final String CHARGE = "_Q";

  private static final ElementCounts EMPTY = new ElementCounts(new TreeMap<>());

  private final SortedMap<String, Integer> counts;

  private ElementCounts(SortedMap<String, Integer> counts) {
    this.counts = Collections.unmodifiableSortedMap(counts);
  }

  public static ElementCounts empty() {
    return EMPTY;
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static ElementCounts of(Map<String, Integer> counts) {
    Builder builder = new Builder();
    counts.forEach(builder::add);
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Get the count for a symbol, or 0 if it does not occur.
   */
  public int get(String symbol) {
    return counts.getOrDefault(symbol, 0);
  }

  public int getCharge() {
    return get(CHARGE);
  }

  public boolean hasCharge() {
    return counts.containsKey(CHARGE);
  }

  public boolean isEmpty() {
    return counts.isEmpty();
  }

  /**
   * All symbols present, charge included.
   */
  public Set<String> getSymbols() {
    return counts.keySet();
  }

  /**
   * Symbols of real elements, i.e. everything but the charge.
   */
  public Set<String> getElementSymbols() {
    return counts.keySet().stream()
        .filter(symbol -> !CHARGE.equals(symbol))
        .collect(Collectors.toCollection(TreeSet::new));
  }

  @JsonValue
  public Map<String, Integer> asMap() {
    return counts;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return counts.equals(((ElementCounts) o).counts);
  }

  @Override
  public int hashCode() {
    return counts.hashCode();
  }

  @Override
  public String toString() {
    return counts.toString();
  }

  /**
   * Accumulates counts; several additions of the same symbol are summed.
   */
  public static class Builder {
    private final TreeMap<String, Integer> counts = new TreeMap<>();

    private Builder() {
    }

    public Builder add(String symbol, int count) {
      counts.merge(symbol, count, Math::addExact);
      return this;
    }

    /**
     * Add every entry of {@code other}, each multiplied by {@code multiplier}.
     */
    public Builder addAll(ElementCounts other, int multiplier) {
      for (Map.Entry<String, Integer> entry : other.counts.entrySet()) {
        add(entry.getKey(), Math.multiplyExact(entry.getValue(), multiplier));
      }
      return this;
    }

    public ElementCounts build() {
      TreeMap<String, Integer> copy = new TreeMap<>();
      for (Map.Entry<String, Integer> entry : counts.entrySet()) {
        if (entry.getValue() != 0) {
          copy.put(entry.getKey(), entry.getValue());
        }
      }
      return copy.isEmpty() ? EMPTY : new ElementCounts(copy);
    }
  }
}
