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

import org.apache.commons.math3.util.Precision;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Rounding and rendering of the floating point amounts the calculators report.
 */
final class Amounts {
  static final int RESULT_SCALE = 3;

  private Amounts() {
  }

  /**
   * Round a reported result, e.g. a molar mass or a final amount, to three decimal places.
   */
  static double round(double value) {
    return Precision.round(value, RESULT_SCALE);
  }

  /**
   * Render an intermediate value in a calculation step with four fixed decimals.
   */
  static String fixed(double value) {
    return String.format(Locale.ROOT, "%.4f", value);
  }

  /**
   * Render a user supplied or looked-up value without trailing zeros: 2.0 -> "2", 18.015 -> "18.015".
   */
  static String plain(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
