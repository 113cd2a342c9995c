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

package com.twentyn.balancer.solver;

/**
 * Bounds on the weighted search the solver runs when a reaction has more than one independent balancing.  Instances
 * are immutable; use the {@code with...} methods to derive a modified copy.
 */
public final class SolverConfig {
  public static final int DEFAULT_MAX_WEIGHT = 6;
  public static final int DEFAULT_MAX_BASIS_VECTORS = 8;
  public static final long DEFAULT_MAX_SEARCH_ITERATIONS = 1_000_000L;

  private static final SolverConfig DEFAULTS =
      new SolverConfig(DEFAULT_MAX_WEIGHT, DEFAULT_MAX_BASIS_VECTORS, DEFAULT_MAX_SEARCH_ITERATIONS);

  private final int maxWeight;
  private final int maxBasisVectors;
  private final long maxSearchIterations;

  private SolverConfig(int maxWeight, int maxBasisVectors, long maxSearchIterations) {
    if (maxWeight < 1) {
      throw new IllegalArgumentException(String.format("Max weight must be at least 1, got %d", maxWeight));
    }
    if (maxBasisVectors < 1) {
      throw new IllegalArgumentException(
          String.format("Max basis vector count must be at least 1, got %d", maxBasisVectors));
    }
    if (maxSearchIterations < 1) {
      throw new IllegalArgumentException(
          String.format("Max search iterations must be at least 1, got %d", maxSearchIterations));
    }
    this.maxWeight = maxWeight;
    this.maxBasisVectors = maxBasisVectors;
    this.maxSearchIterations = maxSearchIterations;
  }

  public static SolverConfig defaults() {
    return DEFAULTS;
  }

  /**
   * Largest integer weight tried per basis vector.
   */
  public int getMaxWeight() {
    return maxWeight;
  }

  /**
   * Null spaces of higher dimension than this skip the search entirely.
   */
  public int getMaxBasisVectors() {
    return maxBasisVectors;
  }

  /**
   * Number of complete weight combinations evaluated before the search gives up.
   */
  public long getMaxSearchIterations() {
    return maxSearchIterations;
  }

  public SolverConfig withMaxWeight(int maxWeight) {
    return new SolverConfig(maxWeight, maxBasisVectors, maxSearchIterations);
  }

  public SolverConfig withMaxBasisVectors(int maxBasisVectors) {
    return new SolverConfig(maxWeight, maxBasisVectors, maxSearchIterations);
  }

  public SolverConfig withMaxSearchIterations(long maxSearchIterations) {
    return new SolverConfig(maxWeight, maxBasisVectors, maxSearchIterations);
  }

  @Override
  public String toString() {
    return String.format("SolverConfig{maxWeight=%d, maxBasisVectors=%d, maxSearchIterations=%d}",
        maxWeight, maxBasisVectors, maxSearchIterations);
  }
}
