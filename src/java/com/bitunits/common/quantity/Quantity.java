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

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.Function;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Range;
import com.google.common.primitives.Doubles;

import com.bitunits.common.base.MorePreconditions;

/**
 * A magnitude in a fixed unit family that supports unit aware arithmetic and comparison.  The
 * value is always held in the family's canonical unit; other units are only ever computed.
 * Instances are immutable and every operation returns a new instance.
 *
 * <p>Operands may be given as another quantity of the same type, as a string such as
 * {@code "1.5 MB"} or as a number already expressed in canonical units.  Methods accepting a
 * collection of operands allow all three forms as elements.
 *
 * @param <Q> the concrete quantity type
 * @param <U> the type of unit that this quantity is measured in
 */
@Immutable
public abstract class Quantity<Q extends Quantity<Q, U>, U extends Unit<U>>
    implements Comparable<Q> {

  public static final int COMPARE_LT = -1;
  public static final int COMPARE_EQ = 0;
  public static final int COMPARE_GT = 1;

  /**
   * How the results of testing a predicate against several operands are combined.
   */
  public enum Mode {
    /** The predicate must hold for every operand. */
    ALL,
    /** The predicate must hold for at least one operand. */
    ANY
  }

  /**
   * Thrown when a subtraction would produce a negative quantity.
   */
  public static class NegativeQuantityException extends ArithmeticException {
    public NegativeQuantityException(double value, double operand) {
      super(String.format("Cannot subtract %s from %s: the result would be negative",
          Humanizer.format(operand, null), Humanizer.format(value, null)));
    }
  }

  /**
   * Thrown when dividing by, or taking the remainder of, a zero operand.
   */
  public static class DivisionByZeroException extends ArithmeticException {
    public DivisionByZeroException() {
      super("Division by zero");
    }
  }

  private final double value;

  protected Quantity(double value) {
    MorePreconditions.checkFinite(value, "Quantities must be finite, got %s");
    // Collapses -0.0 so that equality and hashing only see one zero.
    this.value = value + 0.0;
  }

  /**
   * Creates a quantity of the concrete type carrying any display settings of this one.
   */
  protected abstract Q create(double value);

  /**
   * Returns the parser that normalizes operands of this quantity type.
   */
  protected abstract QuantityParser<U> parser();

  /**
   * Returns the units {@link #humanize(Integer, String)} picks from.
   */
  protected abstract UnitTable<U> displayUnits();

  /**
   * Returns the magnitude in canonical units.
   */
  public double getValue() {
    return value;
  }

  /**
   * Returns the magnitude expressed in the given unit.
   */
  public double as(U unit) {
    return Humanizer.convert(value, unit);
  }

  /**
   * Returns the magnitude expressed in the unit with the given symbol.
   *
   * @throws UnknownUnitException if the symbol names no unit of this quantity type
   */
  public double getValue(String unit) {
    return getValue(unit, null);
  }

  /**
   * Returns the magnitude expressed in the unit with the given symbol, rounded to
   * {@code precision} decimals unless that is {@code null}.
   *
   * @throws UnknownUnitException if the symbol names no unit of this quantity type
   */
  public double getValue(String unit, @Nullable Integer precision) {
    return Humanizer.round(as(parser().units().lookup(unit)), precision);
  }

  /**
   * Renders the magnitude in the given unit without rounding, eg: {@code 1.5 kB}.
   */
  public String to(U unit) {
    return to(unit, null, Humanizer.DEFAULT_DELIMITER);
  }

  /**
   * Renders the magnitude in the given unit.
   *
   * @param unit the unit to render in
   * @param precision the number of decimals to round to, or {@code null} for no rounding
   * @param delimiter the string placed between the number and the unit symbol
   * @return the rendered magnitude
   */
  public String to(U unit, @Nullable Integer precision, String delimiter) {
    return Humanizer.render(value, unit, precision, delimiter);
  }

  /**
   * Renders the magnitude in the unit with the given symbol without rounding.
   *
   * @throws UnknownUnitException if the symbol names no unit of this quantity type
   */
  public String to(String unit) {
    return to(unit, null);
  }

  /**
   * Renders the magnitude in the unit with the given symbol.
   *
   * @throws UnknownUnitException if the symbol names no unit of this quantity type
   */
  public String to(String unit, @Nullable Integer precision) {
    return to(unit, precision, Humanizer.DEFAULT_DELIMITER);
  }

  /**
   * Renders the magnitude in the unit with the given symbol.
   *
   * @throws UnknownUnitException if the symbol names no unit of this quantity type
   */
  public String to(String unit, @Nullable Integer precision, String delimiter) {
    return to(parser().units().lookup(unit), precision, delimiter);
  }

  /**
   * Renders the magnitude in the largest unit that keeps it at or above 1, rounded to
   * {@value Humanizer#DEFAULT_PRECISION} decimals.
   */
  public String humanize() {
    return humanize(Humanizer.DEFAULT_PRECISION, Humanizer.DEFAULT_DELIMITER);
  }

  /**
   * Renders the magnitude in the largest unit that keeps it at or above 1.
   *
   * @param precision the number of decimals to round to, or {@code null} for no rounding
   * @param delimiter the string placed between the number and the unit symbol
   * @return the humanized magnitude
   */
  public String humanize(@Nullable Integer precision, String delimiter) {
    return Humanizer.humanize(value, displayUnits(), precision, delimiter);
  }

  public Q increment(Q operand) {
    return add(operand.getValue());
  }

  public Q increment(String operand) {
    return add(parse(operand));
  }

  public Q increment(double operand) {
    return add(checkOperand(operand));
  }

  /**
   * Subtracts the operand.
   *
   * @throws NegativeQuantityException if the operand is greater than this quantity
   */
  public Q decrement(Q operand) {
    return subtract(operand.getValue());
  }

  /**
   * Subtracts the parsed operand.
   *
   * @throws NegativeQuantityException if the operand is greater than this quantity
   */
  public Q decrement(String operand) {
    return subtract(parse(operand));
  }

  /**
   * Subtracts a canonical magnitude.
   *
   * @throws NegativeQuantityException if the operand is greater than this quantity
   */
  public Q decrement(double operand) {
    return subtract(checkOperand(operand));
  }

  /**
   * Scales this quantity by a plain factor.
   */
  public Q multiply(double factor) {
    return create(value * checkOperand(factor));
  }

  /**
   * Divides this quantity by the magnitude of another.
   *
   * @throws DivisionByZeroException if the operand is zero
   */
  public Q divide(Q operand) {
    return quotient(operand.getValue());
  }

  /**
   * Divides this quantity by the parsed magnitude of the operand.
   *
   * @throws DivisionByZeroException if the operand is zero
   */
  public Q divide(String operand) {
    return quotient(parse(operand));
  }

  /**
   * Divides this quantity by a plain divisor.
   *
   * @throws DivisionByZeroException if the divisor is zero
   */
  public Q divide(double divisor) {
    return quotient(checkOperand(divisor));
  }

  /**
   * Returns the remainder of dividing this quantity by the operand.  The remainder takes the
   * sign of this quantity.
   *
   * @throws DivisionByZeroException if the operand is zero
   */
  public Q modulo(Q operand) {
    return remainder(operand.getValue());
  }

  /**
   * @see #modulo(Quantity)
   */
  public Q modulo(String operand) {
    return remainder(parse(operand));
  }

  /**
   * @see #modulo(Quantity)
   */
  public Q modulo(double operand) {
    return remainder(checkOperand(operand));
  }

  public Q abs() {
    return create(Math.abs(value));
  }

  public boolean isZero() {
    return value == 0;
  }

  public boolean isPositive() {
    return value > 0;
  }

  public boolean isNegative() {
    return value < 0;
  }

  /**
   * Returns the larger of this quantity and the operand.
   */
  public Q max(Q operand) {
    return create(Math.max(value, operand.getValue()));
  }

  public Q max(String operand) {
    return create(Math.max(value, parse(operand)));
  }

  public Q max(double operand) {
    return create(Math.max(value, checkOperand(operand)));
  }

  /**
   * Returns the largest of this quantity and all of the operands.
   */
  public Q max(Iterable<?> operands) {
    double max = value;
    for (double operand : parseAll(operands)) {
      max = Math.max(max, operand);
    }
    return create(max);
  }

  /**
   * Returns the smaller of this quantity and the operand.
   */
  public Q min(Q operand) {
    return create(Math.min(value, operand.getValue()));
  }

  public Q min(String operand) {
    return create(Math.min(value, parse(operand)));
  }

  public Q min(double operand) {
    return create(Math.min(value, checkOperand(operand)));
  }

  /**
   * Returns the smallest of this quantity and all of the operands.
   */
  public Q min(Iterable<?> operands) {
    double min = value;
    for (double operand : parseAll(operands)) {
      min = Math.min(min, operand);
    }
    return create(min);
  }

  /**
   * Compares this quantity with an operand.
   *
   * @return {@link #COMPARE_LT}, {@link #COMPARE_EQ} or {@link #COMPARE_GT} as this quantity is
   *     less than, equal to or greater than the operand
   */
  public int compare(Q operand) {
    return compareMagnitudes(value, operand.getValue());
  }

  /**
   * @see #compare(Quantity)
   */
  public int compare(String operand) {
    return compareMagnitudes(value, parse(operand));
  }

  /**
   * @see #compare(Quantity)
   */
  public int compare(double operand) {
    return compareMagnitudes(value, checkOperand(operand));
  }

  /**
   * Compares this quantity with several operands.  In {@link Mode#ALL} the result is present only
   * if every operand compares the same way.  In {@link Mode#ANY} the result is
   * {@link #COMPARE_EQ} if any operand is equal, else {@link #COMPARE_GT} if any operand is
   * smaller, else {@link #COMPARE_LT}.
   *
   * @param operands the operands to compare with, at least one
   * @param mode how to combine the comparisons
   * @return the combined comparison
   */
  public Optional<Integer> compare(Iterable<?> operands, Mode mode) {
    MorePreconditions.checkNotEmpty(operands, "Nothing to compare with");
    Preconditions.checkNotNull(mode);

    ImmutableSet.Builder<Integer> builder = ImmutableSet.builder();
    for (double operand : parseAll(operands)) {
      builder.add(compareMagnitudes(value, operand));
    }
    ImmutableSet<Integer> results = builder.build();

    switch (mode) {
      case ALL:
        return results.size() == 1
            ? Optional.of(Iterables.getOnlyElement(results))
            : Optional.<Integer>absent();
      case ANY:
        if (results.contains(COMPARE_EQ)) {
          return Optional.of(COMPARE_EQ);
        }
        return Optional.of(results.contains(COMPARE_GT) ? COMPARE_GT : COMPARE_LT);
      default:
        throw new IllegalArgumentException("Unhandled mode " + mode);
    }
  }

  @Override
  public int compareTo(Q other) {
    return compare(other);
  }

  public boolean equalTo(Q operand) {
    return value == operand.getValue();
  }

  public boolean equalTo(String operand) {
    return value == parse(operand);
  }

  public boolean equalTo(double operand) {
    return value == checkOperand(operand);
  }

  public boolean equalTo(Iterable<?> operands, Mode mode) {
    return test(operands, mode, new Predicate<Double>() {
      @Override public boolean apply(Double operand) {
        return value == operand;
      }
    });
  }

  public boolean lessThan(Q operand) {
    return value < operand.getValue();
  }

  public boolean lessThan(String operand) {
    return value < parse(operand);
  }

  public boolean lessThan(double operand) {
    return value < checkOperand(operand);
  }

  public boolean lessThan(Iterable<?> operands, Mode mode) {
    return test(operands, mode, new Predicate<Double>() {
      @Override public boolean apply(Double operand) {
        return value < operand;
      }
    });
  }

  public boolean greaterThan(Q operand) {
    return value > operand.getValue();
  }

  public boolean greaterThan(String operand) {
    return value > parse(operand);
  }

  public boolean greaterThan(double operand) {
    return value > checkOperand(operand);
  }

  public boolean greaterThan(Iterable<?> operands, Mode mode) {
    return test(operands, mode, new Predicate<Double>() {
      @Override public boolean apply(Double operand) {
        return value > operand;
      }
    });
  }

  public boolean lessThanOrEqual(Q operand) {
    return value <= operand.getValue();
  }

  public boolean lessThanOrEqual(String operand) {
    return value <= parse(operand);
  }

  public boolean lessThanOrEqual(double operand) {
    return value <= checkOperand(operand);
  }

  public boolean lessThanOrEqual(Iterable<?> operands, Mode mode) {
    return test(operands, mode, new Predicate<Double>() {
      @Override public boolean apply(Double operand) {
        return value <= operand;
      }
    });
  }

  public boolean greaterThanOrEqual(Q operand) {
    return value >= operand.getValue();
  }

  public boolean greaterThanOrEqual(String operand) {
    return value >= parse(operand);
  }

  public boolean greaterThanOrEqual(double operand) {
    return value >= checkOperand(operand);
  }

  public boolean greaterThanOrEqual(Iterable<?> operands, Mode mode) {
    return test(operands, mode, new Predicate<Double>() {
      @Override public boolean apply(Double operand) {
        return value >= operand;
      }
    });
  }

  /**
   * Tests whether this quantity lies within {@code [lower, upper]}.  An inverted interval
   * contains nothing.
   */
  public boolean between(Q lower, Q upper) {
    return within(lower.getValue(), upper.getValue());
  }

  public boolean between(String lower, String upper) {
    return within(parse(lower), parse(upper));
  }

  public boolean between(double lower, double upper) {
    return within(checkOperand(lower), checkOperand(upper));
  }

  /**
   * Tests whether this quantity lies in any of the given ranges.
   */
  public boolean inRanges(Iterable<Range<Q>> ranges) {
    return inRanges(ranges, Mode.ANY);
  }

  /**
   * Tests this quantity for membership in several ranges.
   *
   * @param ranges the ranges to test
   * @param mode whether membership is required in every range or in at least one
   * @return whether the membership requirement holds
   */
  public boolean inRanges(Iterable<Range<Q>> ranges, Mode mode) {
    Preconditions.checkNotNull(ranges);
    Predicate<Range<Q>> contains = new Predicate<Range<Q>>() {
      @Override public boolean apply(Range<Q> range) {
        return range.contains(self());
      }
    };
    return mode == Mode.ALL ? Iterables.all(ranges, contains) : Iterables.any(ranges, contains);
  }

  @Override
  public int hashCode() {
    return Doubles.hashCode(value);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    return value == ((Quantity<?, ?>) obj).value;
  }

  @Override
  public String toString() {
    return humanize();
  }

  /**
   * Normalizes an operand of any supported form to a canonical magnitude.
   */
  protected double parse(Object operand) {
    return parser().parse(operand);
  }

  @SuppressWarnings("unchecked")
  private Q self() {
    return (Q) this;
  }

  private Iterable<Double> parseAll(Iterable<?> operands) {
    Preconditions.checkNotNull(operands);
    return Iterables.transform(operands, new Function<Object, Double>() {
      @Override public Double apply(Object operand) {
        return parse(operand);
      }
    });
  }

  private boolean test(Iterable<?> operands, Mode mode, Predicate<Double> predicate) {
    Preconditions.checkNotNull(mode);
    Iterable<Double> values = parseAll(operands);
    return mode == Mode.ALL ? Iterables.all(values, predicate) : Iterables.any(values, predicate);
  }

  private Q add(double operand) {
    return create(value + operand);
  }

  private Q subtract(double operand) {
    if (operand > value) {
      throw new NegativeQuantityException(value, operand);
    }
    return create(value - operand);
  }

  private Q quotient(double operand) {
    if (operand == 0) {
      throw new DivisionByZeroException();
    }
    return create(value / operand);
  }

  private Q remainder(double operand) {
    if (operand == 0) {
      throw new DivisionByZeroException();
    }
    return create(value % operand);
  }

  private boolean within(double lower, double upper) {
    return lower <= value && value <= upper;
  }

  private static double checkOperand(double operand) {
    return MorePreconditions.checkFinite(operand, "Operands must be finite, got %s");
  }

  static int compareMagnitudes(double left, double right) {
    if (left < right) {
      return COMPARE_LT;
    }
    return left > right ? COMPARE_GT : COMPARE_EQ;
  }
}
