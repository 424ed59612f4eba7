// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.bitunits.common.quantity;

/**
 * Thrown when a unit symbol is not part of the unit family being converted to or parsed from.
 */
public class UnknownUnitException extends IllegalArgumentException {

  private final String symbol;

  public UnknownUnitException(String symbol, Iterable<?> options) {
    super(String.format("No unit found matching '%s', options: %s", symbol, options));
    this.symbol = symbol;
  }

  /**
   * Returns the symbol that failed to resolve.
   */
  public String getSymbol() {
    return symbol;
  }
}
