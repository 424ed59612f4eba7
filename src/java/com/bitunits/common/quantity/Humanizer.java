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

import java.math.BigDecimal;
import java.math.RoundingMode;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Converts canonical magnitudes into other units and renders them as strings.
 *
 * <p>Rendered numbers never use scientific notation and carry no trailing zeros, so a value of
 * 1.5 renders as {@code 1.5} whatever the precision.  Rounding is half up, away from zero.
 */
public final class Humanizer {

  public static final int DEFAULT_PRECISION = 2;
  public static final String DEFAULT_DELIMITER = " ";

  private Humanizer() {
    // utility
  }

  /**
   * Expresses a canonical magnitude in the given unit.
   *
   * @param magnitude the value in canonical units
   * @param unit the unit to convert to
   * @return the number of {@code unit}s the magnitude amounts to
   */
  public static double convert(double magnitude, Unit<?> unit) {
    return magnitude / unit.multiplier();
  }

  /**
   * Rounds a value to the given number of decimals.  A {@code null} precision leaves the value
   * as is.
   */
  public static double round(double value, @Nullable Integer precision) {
    return precision == null ? value : scale(value, precision).doubleValue();
  }

  /**
   * Renders a number.
   *
   * @param value the number to render
   * @param precision the number of decimals to round to, or {@code null} to render the value
   *     unrounded
   * @return the plain decimal rendering of the (rounded) value
   */
  public static String format(double value, @Nullable Integer precision) {
    BigDecimal decimal = precision == null ? BigDecimal.valueOf(value) : scale(value, precision);
    if (decimal.signum() == 0) {
      return "0";
    }
    return decimal.stripTrailingZeros().toPlainString();
  }

  /**
   * Renders a canonical magnitude in a specific unit, eg: {@code 1.5 kB}.
   */
  public static String render(double magnitude, Unit<?> unit, @Nullable Integer precision,
      String delimiter) {
    Preconditions.checkNotNull(delimiter);
    return format(convert(magnitude, unit), precision) + delimiter + unit.symbol();
  }

  /**
   * Picks the largest unit of the table in which the magnitude is at least 1.  Magnitudes smaller
   * than one canonical unit, zero included, map to the table's base unit.
   *
   * @param magnitude the value in canonical units
   * @param units the candidate units
   * @param <U> the unit type
   * @return the unit to display the magnitude in
   */
  public static <U extends Unit<U>> U select(double magnitude, UnitTable<U> units) {
    if (magnitude == 0) {
      return units.base();
    }

    double absolute = Math.abs(magnitude);
    for (U unit : units.descending()) {
      if (absolute / unit.multiplier() >= 1) {
        return unit;
      }
    }
    return units.base();
  }

  /**
   * Renders a canonical magnitude in the largest unit that keeps its value at or above 1.
   *
   * @param magnitude the value in canonical units
   * @param units the candidate units
   * @param precision the number of decimals to round to, or {@code null} for no rounding
   * @param delimiter the string placed between the number and the unit symbol
   * @return the humanized string, eg: {@code 1.5 kB}
   */
  public static <U extends Unit<U>> String humanize(double magnitude, UnitTable<U> units,
      @Nullable Integer precision, String delimiter) {
    return render(magnitude, select(magnitude, units), precision, delimiter);
  }

  private static BigDecimal scale(double value, int precision) {
    Preconditions.checkArgument(precision >= 0, "Precision must be non-negative, got %s",
        precision);
    return BigDecimal.valueOf(value).setScale(precision, RoundingMode.HALF_UP);
  }
}
