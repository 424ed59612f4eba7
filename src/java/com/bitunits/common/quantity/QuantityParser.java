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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.apache.commons.lang.StringUtils;

import com.bitunits.common.base.MorePreconditions;
import com.bitunits.common.quantity.QuantityParseException.Reason;

/**
 * Normalizes quantity operands to a canonical magnitude.  Operands may be an instance of the
 * quantity type itself, a {@link Number} already expressed in canonical units, or a string such
 * as {@code 1.5 kB}, {@code 100Mbps} or {@code 2048}.
 *
 * <p>Strings are trimmed and then must be consumed whole: either a plain number, taken as a
 * canonical magnitude, or a number followed by optional whitespace and a unit symbol of at most
 * {@value #MAX_SYMBOL_LENGTH} letters from this parser's {@link UnitTable}.
 *
 * @param <U> the unit type of the quantities parsed
 */
public final class QuantityParser<U extends Unit<U>> {

  static final int MAX_SYMBOL_LENGTH = 4;

  private static final Pattern NUMBER = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)");
  private static final Pattern QUANTITY = Pattern.compile("([^\\sA-Za-z]+)\\s*([A-Za-z]+)");

  private final UnitTable<U> units;
  private final Class<?> quantityType;

  /**
   * Creates a parser for one quantity type.
   *
   * @param units the units strings may be expressed in
   * @param quantityType the quantity type whose instances pass through as their own value
   */
  public QuantityParser(UnitTable<U> units, Class<? extends Quantity<?, U>> quantityType) {
    this.units = Preconditions.checkNotNull(units);
    this.quantityType = Preconditions.checkNotNull(quantityType);
  }

  /**
   * Returns the units this parser recognizes.
   */
  public UnitTable<U> units() {
    return units;
  }

  /**
   * Parses an operand of any supported type.
   *
   * @param operand a quantity of this parser's type, a {@link Number} or a {@link CharSequence}
   * @return the canonical magnitude of the operand
   * @throws QuantityParseException if a string operand is malformed
   * @throws IllegalArgumentException if the operand is of an unsupported type or not finite
   */
  public double parse(Object operand) {
    Preconditions.checkNotNull(operand);
    if (quantityType.isInstance(operand)) {
      return ((Quantity<?, ?>) operand).getValue();
    } else if (operand instanceof Number) {
      return MorePreconditions.checkFinite(((Number) operand).doubleValue(),
          "Magnitudes must be finite, got %s");
    } else if (operand instanceof CharSequence) {
      return parse(operand.toString());
    }
    throw new IllegalArgumentException(String.format(
        "Cannot read a %s from a %s: %s", quantityType.getSimpleName(),
        operand.getClass().getName(), operand));
  }

  /**
   * Parses a quantity string.
   *
   * @param raw the string to parse
   * @return the canonical magnitude of the string
   * @throws QuantityParseException if the string is malformed or names an unknown unit
   */
  public double parse(String raw) {
    Match match = match(raw);
    double magnitude =
        match.unit == null ? match.number : match.number * match.unit.multiplier();
    if (Double.isInfinite(magnitude)) {
      throw new QuantityParseException(Reason.INVALID_NUMBER, raw);
    }
    return magnitude;
  }

  /**
   * Finds the unit a quantity string is expressed in.
   *
   * @param raw the string to inspect
   * @return the unit named by the string, or {@code null} for a plain number
   * @throws QuantityParseException if the string is malformed or names an unknown unit
   */
  @Nullable
  public U unitOf(String raw) {
    return match(raw).unit;
  }

  private Match match(String raw) {
    Preconditions.checkNotNull(raw);
    String trimmed = StringUtils.trim(raw);
    if (trimmed.isEmpty()) {
      throw new QuantityParseException(Reason.INVALID_NUMBER, raw);
    }

    if (NUMBER.matcher(trimmed).matches()) {
      return new Match(parseNumber(trimmed, raw), null);
    }

    Matcher matcher = QUANTITY.matcher(trimmed);
    if (!matcher.matches()) {
      throw new QuantityParseException(Reason.INVALID_NUMBER, raw);
    }

    String number = matcher.group(1);
    if (!NUMBER.matcher(number).matches()) {
      throw new QuantityParseException(Reason.INVALID_NUMBER, raw);
    }

    String symbol = matcher.group(2);
    if (symbol.length() > MAX_SYMBOL_LENGTH || !units.contains(symbol)) {
      throw new QuantityParseException(Reason.UNRECOGNIZED_UNIT, raw);
    }
    return new Match(parseNumber(number, raw), units.lookup(symbol));
  }

  private static double parseNumber(String number, String raw) {
    double value;
    try {
      value = Double.parseDouble(number);
    } catch (NumberFormatException e) {
      throw new QuantityParseException(Reason.INVALID_NUMBER, raw, e);
    }
    if (Double.isInfinite(value)) {
      throw new QuantityParseException(Reason.INVALID_NUMBER, raw);
    }
    return value;
  }

  private final class Match {
    private final double number;
    @Nullable private final U unit;

    private Match(double number, @Nullable U unit) {
      this.number = number;
      this.unit = unit;
    }
  }
}
