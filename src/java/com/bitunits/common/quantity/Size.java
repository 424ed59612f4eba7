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

import java.util.List;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.collect.Range;

import com.bitunits.common.duration.DurationFormatter;
import com.bitunits.common.transfer.TransferCalculator;

/**
 * A storage size.  The canonical unit is the byte and units scale by 1024, so
 * {@code Size.of("1.5 kB").getValue() == 1536}.
 *
 * <p>Sizes are usually built from strings or unit factories:
 * <pre>
 *   Size file = Size.gb(4);
 *   Size chunk = Size.of("512 kB");
 *   file.decrement(chunk).humanize();  // "4 GB" less 512 kB, ie: "4 GB"
 * </pre>
 */
@Immutable
public final class Size extends Quantity<Size, SizeUnit> {

  static final QuantityParser<SizeUnit> PARSER =
      new QuantityParser<SizeUnit>(UnitTable.SIZE, Size.class);

  private static final Size ZERO = new Size(0);
  private static final int BITS_PER_BYTE = 8;

  private Size(double bytes) {
    super(bytes);
  }

  /**
   * Creates a size from a number of bytes.
   */
  public static Size of(double bytes) {
    return new Size(bytes);
  }

  /**
   * Creates a size from a string such as {@code "1.5 GB"}, or a plain number of bytes.
   *
   * @throws QuantityParseException if the string cannot be parsed
   */
  public static Size of(String size) {
    return new Size(PARSER.parse(size));
  }

  /**
   * Returns the given size; sizes are immutable so no copy is needed.
   */
  public static Size of(Size size) {
    return size;
  }

  /**
   * Equivalent to {@link #of(String)}.
   */
  public static Size fromHumanReadable(String size) {
    return of(size);
  }

  /**
   * Creates a size from a number of the given unit.
   */
  public static Size fromUnit(double value, SizeUnit unit) {
    return new Size(value * unit.multiplier());
  }

  /**
   * Creates a size from a number of the unit with the given symbol.
   *
   * @throws UnknownUnitException if the symbol names no size unit
   */
  public static Size fromUnit(double value, String unit) {
    return fromUnit(value, UnitTable.SIZE.lookup(unit));
  }

  /**
   * Creates a size from a number of bits.
   */
  public static Size fromBits(double bits) {
    return new Size(bits / BITS_PER_BYTE);
  }

  public static Size b(double value) {
    return fromUnit(value, SizeUnit.B);
  }

  public static Size kb(double value) {
    return fromUnit(value, SizeUnit.kB);
  }

  public static Size mb(double value) {
    return fromUnit(value, SizeUnit.MB);
  }

  public static Size gb(double value) {
    return fromUnit(value, SizeUnit.GB);
  }

  public static Size tb(double value) {
    return fromUnit(value, SizeUnit.TB);
  }

  public static Size pb(double value) {
    return fromUnit(value, SizeUnit.PB);
  }

  public static Size eb(double value) {
    return fromUnit(value, SizeUnit.EB);
  }

  public static Size zb(double value) {
    return fromUnit(value, SizeUnit.ZB);
  }

  public static Size yb(double value) {
    return fromUnit(value, SizeUnit.YB);
  }

  /**
   * Creates the closed range {@code [lower, upper]} for use with {@link #inRanges(Iterable)}.
   *
   * @throws IllegalArgumentException if {@code lower} is greater than {@code upper}
   */
  public static Range<Size> closedRange(String lower, String upper) {
    return Range.closed(of(lower), of(upper));
  }

  /**
   * Returns the sizes from {@code start} to {@code end} inclusive, {@code step} apart.
   *
   * @throws IllegalArgumentException if {@code end < start} or {@code step <= 0}
   */
  public static List<Size> range(Size start, Size end, Size step) {
    return Quantities.range(ZERO, start, end, step);
  }

  /**
   * @see #range(Size, Size, Size)
   */
  public static List<Size> range(String start, String end, String step) {
    return Quantities.range(ZERO, start, end, step);
  }

  /**
   * Adds up sizes given in any operand form; an empty collection sums to zero.
   */
  public static Size sum(Iterable<?> sizes) {
    return Quantities.sum(ZERO, sizes);
  }

  /**
   * @throws IllegalArgumentException if {@code sizes} is empty
   */
  public static Size average(Iterable<?> sizes) {
    return Quantities.average(ZERO, sizes);
  }

  /**
   * @throws IllegalArgumentException if {@code sizes} is empty
   */
  public static Size maximum(Iterable<?> sizes) {
    return Quantities.maximum(ZERO, sizes);
  }

  /**
   * @throws IllegalArgumentException if {@code sizes} is empty
   */
  public static Size minimum(Iterable<?> sizes) {
    return Quantities.minimum(ZERO, sizes);
  }

  /**
   * Returns the number of bits in this size.
   */
  public double toBits() {
    return getValue() * BITS_PER_BYTE;
  }

  public String toKb(@Nullable Integer precision) {
    return to(SizeUnit.kB, precision, Humanizer.DEFAULT_DELIMITER);
  }

  public String toMb(@Nullable Integer precision) {
    return to(SizeUnit.MB, precision, Humanizer.DEFAULT_DELIMITER);
  }

  public String toGb(@Nullable Integer precision) {
    return to(SizeUnit.GB, precision, Humanizer.DEFAULT_DELIMITER);
  }

  public String toTb(@Nullable Integer precision) {
    return to(SizeUnit.TB, precision, Humanizer.DEFAULT_DELIMITER);
  }

  /**
   * Calculates how long transferring this size takes at the given rate, in seconds.
   *
   * @see TransferCalculator#transferTime(Size, Rate)
   */
  public double getTransferTime(Rate rate) {
    return TransferCalculator.NOMINAL.transferTime(this, rate);
  }

  /**
   * Calculates how long transferring this size takes at a bandwidth in bytes per second.
   *
   * @see TransferCalculator#transferTime(Size, double)
   */
  public double getTransferTime(double bytesPerSecond) {
    return TransferCalculator.NOMINAL.transferTime(this, bytesPerSecond);
  }

  /**
   * Calculates how long transferring this size takes at a bandwidth given as the size moved per
   * second, eg: {@code "10 MB"}.
   *
   * @throws QuantityParseException if the bandwidth cannot be parsed
   */
  public double getTransferTime(String bytesPerSecond) {
    return getTransferTime(PARSER.parse(bytesPerSecond));
  }

  /**
   * Formats the time to transfer this size at the given rate in the formatter's default language.
   */
  public String getFormattedTransferTime(Rate rate, DurationFormatter formatter) {
    return getFormattedTransferTime(rate, formatter, null);
  }

  /**
   * Formats the time to transfer this size at the given rate.
   *
   * @param rate the transfer rate
   * @param formatter the formatter to render the duration with
   * @param language the language code to render in, or {@code null} for the default
   * @return the localized transfer time, eg: {@code "1 minute, 20 seconds"}
   */
  public String getFormattedTransferTime(Rate rate, DurationFormatter formatter,
      @Nullable String language) {
    return formatter.format(getTransferTime(rate), language);
  }

  @Override
  protected Size create(double value) {
    return new Size(value);
  }

  @Override
  protected QuantityParser<SizeUnit> parser() {
    return PARSER;
  }

  @Override
  protected UnitTable<SizeUnit> displayUnits() {
    return UnitTable.SIZE;
  }
}
