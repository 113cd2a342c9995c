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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.balancer.errors.ErrorCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The outcome of balancing one equation.  A successful result carries coefficients (reactants then products, in
 * equation order), the balanced equation string and debug information; an error result carries a message and the
 * code of the failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BalancedResult {
  public enum Status {
    SUCCESS,
    ERROR,
  }

  @JsonProperty("status")
  private Status status;

  @JsonProperty("coefficients")
  private Map<String, Integer> coefficients;

  @JsonProperty("balanced_string")
  private String balancedString;

  @JsonProperty("error_code")
  private ErrorCode errorCode;

  @JsonProperty("message")
  private String message;

  @JsonProperty("debug")
  private BalanceDebugInfo debug;

  private BalancedResult() {
  }

  private BalancedResult(Status status, Map<String, Integer> coefficients, String balancedString,
                         ErrorCode errorCode, String message, BalanceDebugInfo debug) {
    this.status = status;
    this.coefficients = coefficients;
    this.balancedString = balancedString;
    this.errorCode = errorCode;
    this.message = message;
    this.debug = debug;
  }

  public static BalancedResult success(LinkedHashMap<String, Integer> coefficients, String balancedString,
                                       BalanceDebugInfo debug) {
    return new BalancedResult(Status.SUCCESS, Collections.unmodifiableMap(coefficients), balancedString,
        null, null, debug);
  }

  public static BalancedResult error(ErrorCode errorCode, String message) {
    return new BalancedResult(Status.ERROR, null, null, errorCode, message, null);
  }

  public Status getStatus() {
    return status;
  }

  @JsonIgnore
  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }

  /**
   * @return formula -> coefficient, or null for an error result.
   */
  public Map<String, Integer> getCoefficients() {
    return coefficients;
  }

  public String getBalancedString() {
    return balancedString;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  public String getMessage() {
    return message;
  }

  public BalanceDebugInfo getDebug() {
    return debug;
  }

  @Override
  public String toString() {
    return isSuccess() ? balancedString : "ERROR: " + message;
  }
}
