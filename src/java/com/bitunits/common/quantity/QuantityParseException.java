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
 * Thrown when a string cannot be parsed into a quantity.  The {@link Reason} tells which half of
 * the input was at fault.
 */
public class QuantityParseException extends IllegalArgumentException {

  /**
   * Which part of a quantity string was rejected.
   */
  public enum Reason {
    INVALID_NUMBER("invalid numeric portion"),
    UNRECOGNIZED_UNIT("unrecognized unit");

    private final String description;

    private Reason(String description) {
      this.description = description;
    }

    @Override
    public String toString() {
      return description;
    }
  }

  private final Reason reason;
  private final String input;

  public QuantityParseException(Reason reason, String input) {
    this(reason, input, null);
  }

  public QuantityParseException(Reason reason, String input, Throwable cause) {
    super(String.format("Failed to parse '%s': %s", input, reason), cause);
    this.reason = reason;
    this.input = input;
  }

  public Reason getReason() {
    return reason;
  }

  public String getInput() {
    return input;
  }
}
