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

import com.google.common.base.Preconditions;
import com.google.common.collect.Range;

import com.bitunits.common.base.MorePreconditions;
import com.bitunits.common.duration.DurationFormatter;
import com.bitunits.common.transfer.TransferCalculator;

/**
 * A data transfer rate.  The canonical unit is bits per second and units scale by 1000.  Rates
 * may be written in bits ({@code "100 Mbps"}) or in bytes ({@code "12.5 MBps"}); both forms are
 * normalized to bits per second, so the two examples are equal.
 *
 * <p>Each rate carries a display preference that picks the bit or the byte units for
 * {@link #toString()} and {@link #humanize()}.  The preference is carried over to the results of
 * arithmetic but plays no part in comparison or equality.
 */
@Immutable
public final class Rate extends Quantity<Rate, RateUnit> {

  static final QuantityParser<RateUnit> PARSER =
      new QuantityParser<RateUnit>(UnitTable.RATE, Rate.class);

  private static final Rate ZERO_BITS = new Rate(0, true);
  private static final Rate ZERO_BYTES = new Rate(0, false);

  private final boolean displayAsBits;

  private Rate(double bitsPerSecond, boolean displayAsBits) {
    super(bitsPerSecond);
    this.displayAsBits = displayAsBits;
  }

  /**
   * Creates a rate from a number of bits per second, displayed in bits.
   */
  public static Rate of(double bitsPerSecond) {
    return of(bitsPerSecond, true, true);
  }

  /**
   * Creates a rate from a plain number.
   *
   * @param value the rate as a number of bits, or bytes, per second
   * @param isBits whether {@code value} counts bits rather than bytes
   * @param displayAsBits whether to display the rate in bit rather than byte units
   * @return a new rate
   */
  public static Rate of(double value, boolean isBits, boolean displayAsBits) {
    return new Rate(isBits ? value : value * RateUnit.Family.BYTE.bitsPerUnit(), displayAsBits);
  }

  /**
   * Creates a rate from a string such as {@code "100 Mbps"} or {@code "12.5 MBps"}, displayed in
   * bits.  A plain number is taken as bits per second.
   *
   * @throws QuantityParseException if the string cannot be parsed
   */
  public static Rate of(String rate) {
    return of(rate, true, true);
  }

  /**
   * Creates a rate from a string.
   *
   * @param rate the rate, eg: {@code "100 Mbps"}
   * @param isBits whether a plain number without a unit counts bits rather than bytes; ignored
   *     when the string names a unit
   * @param displayAsBits whether to display the rate in bit rather than byte units
   * @return a new rate
   * @throws QuantityParseException if the string cannot be parsed
   */
  public static Rate of(String rate, boolean isBits, boolean displayAsBits) {
    double value = PARSER.parse(rate);
    if (PARSER.unitOf(rate) == null) {
      return of(value, isBits, displayAsBits);
    }
    return new Rate(value, displayAsBits);
  }

  /**
   * Returns a rate equal to the given one with the given display preference.
   */
  public static Rate of(Rate rate, boolean displayAsBits) {
    return rate.withDisplayAs(displayAsBits);
  }

  /**
   * Creates a rate from a string, displayed in the family of the unit it names.  Plain numbers
   * are taken as bits per second and displayed in bits.
   *
   * @throws QuantityParseException if the string cannot be parsed
   */
  public static Rate fromHumanReadable(String rate) {
    RateUnit unit = PARSER.unitOf(rate);
    return of(rate, true, unit == null || unit.family() == RateUnit.Family.BIT);
  }

  /**
   * Creates a rate from a string with an explicit display preference.
   */
  public static Rate fromHumanReadable(String rate, boolean displayAsBits) {
    return of(rate, true, displayAsBits);
  }

  /**
   * Creates a rate from a number of the given unit, displayed in the unit's family.
   */
  public static Rate fromUnit(double value, RateUnit unit) {
    return fromUnit(value, unit, unit.family() == RateUnit.Family.BIT);
  }

  public static Rate fromUnit(double value, RateUnit unit, boolean displayAsBits) {
    return new Rate(value * unit.multiplier(), displayAsBits);
  }

  /**
   * Creates a rate from a number of the unit with the given symbol, displayed in the unit's
   * family.
   *
   * @throws UnknownUnitException if the symbol names no rate unit
   */
  public static Rate fromUnit(double value, String unit) {
    return fromUnit(value, UnitTable.RATE.lookup(unit));
  }

  /**
   * @throws UnknownUnitException if the symbol names no rate unit
   */
  public static Rate fromUnit(double value, String unit, boolean displayAsBits) {
    return fromUnit(value, UnitTable.RATE.lookup(unit), displayAsBits);
  }

  public static Rate bps(double value) {
    return fromUnit(value, RateUnit.bps);
  }

  public static Rate kbps(double value) {
    return fromUnit(value, RateUnit.kbps);
  }

  public static Rate mbps(double value) {
    return fromUnit(value, RateUnit.Mbps);
  }

  public static Rate gbps(double value) {
    return fromUnit(value, RateUnit.Gbps);
  }

  public static Rate tbps(double value) {
    return fromUnit(value, RateUnit.Tbps);
  }

  public static Rate bytesPerSec(double value) {
    return fromUnit(value, RateUnit.Bps);
  }

  public static Rate kBps(double value) {
    return fromUnit(value, RateUnit.kBps);
  }

  public static Rate mBps(double value) {
    return fromUnit(value, RateUnit.MBps);
  }

  public static Rate gBps(double value) {
    return fromUnit(value, RateUnit.GBps);
  }

  public static Rate tBps(double value) {
    return fromUnit(value, RateUnit.TBps);
  }

  /**
   * Creates the closed range {@code [lower, upper]} for use with {@link #inRanges(Iterable)}.
   *
   * @throws IllegalArgumentException if {@code lower} is greater than {@code upper}
   */
  public static Range<Rate> closedRange(String lower, String upper) {
    return Range.closed(of(lower), of(upper));
  }

  /**
   * Returns the rates from {@code start} to {@code end} inclusive, {@code step} apart, displayed
   * in bits.
   *
   * @throws IllegalArgumentException if {@code end < start} or {@code step <= 0}
   */
  public static List<Rate> range(Rate start, Rate end, Rate step) {
    return Quantities.range(ZERO_BITS, start, end, step);
  }

  /**
   * @see #range(Rate, Rate, Rate)
   */
  public static List<Rate> range(String start, String end, String step) {
    return range(start, end, step, true);
  }

  /**
   * @see #range(Rate, Rate, Rate)
   */
  public static List<Rate> range(String start, String end, String step, boolean displayAsBits) {
    return Quantities.range(zero(displayAsBits), start, end, step);
  }

  /**
   * Adds up rates given in any operand form, numbers counting bits per second.  An empty
   * collection sums to zero.
   */
  public static Rate sum(Iterable<?> rates) {
    return sum(rates, true);
  }

  public static Rate sum(Iterable<?> rates, boolean displayAsBits) {
    return Quantities.sum(zero(displayAsBits), rates);
  }

  /**
   * @throws IllegalArgumentException if {@code rates} is empty
   */
  public static Rate average(Iterable<?> rates) {
    return average(rates, true);
  }

  public static Rate average(Iterable<?> rates, boolean displayAsBits) {
    return Quantities.average(zero(displayAsBits), rates);
  }

  /**
   * @throws IllegalArgumentException if {@code rates} is empty
   */
  public static Rate maximum(Iterable<?> rates) {
    return maximum(rates, true);
  }

  public static Rate maximum(Iterable<?> rates, boolean displayAsBits) {
    return Quantities.maximum(zero(displayAsBits), rates);
  }

  /**
   * @throws IllegalArgumentException if {@code rates} is empty
   */
  public static Rate minimum(Iterable<?> rates) {
    return minimum(rates, true);
  }

  public static Rate minimum(Iterable<?> rates, boolean displayAsBits) {
    return Quantities.minimum(zero(displayAsBits), rates);
  }

  public boolean isDisplayAsBits() {
    return displayAsBits;
  }

  /**
   * Returns the unit family {@link #toString()} renders in.
   */
  public RateUnit.Family getDisplayFamily() {
    return displayAsBits ? RateUnit.Family.BIT : RateUnit.Family.BYTE;
  }

  /**
   * Returns this rate with the given display preference.
   */
  public Rate withDisplayAs(boolean displayAsBits) {
    return displayAsBits == this.displayAsBits ? this : new Rate(getValue(), displayAsBits);
  }

  /**
   * Returns the rate in bits per second.
   */
  public double toBits() {
    return getValue();
  }

  /**
   * Returns the rate in bytes per second.
   */
  public double toBytes() {
    return getValue() / RateUnit.Family.BYTE.bitsPerUnit();
  }

  /**
   * Renders the rate in the largest unit of the given family that keeps it at or above 1.
   */
  public String toString(RateUnit.Family family) {
    return humanize(family, Humanizer.DEFAULT_PRECISION, Humanizer.DEFAULT_DELIMITER);
  }

  /**
   * Renders the rate in the largest unit of the given family that keeps it at or above 1.
   *
   * @param family the unit family to render in
   * @param precision the number of decimals to round to, or {@code null} for no rounding
   * @param delimiter the string placed between the number and the unit symbol
   * @return the humanized rate
   */
  public String humanize(RateUnit.Family family, @Nullable Integer precision, String delimiter) {
    Preconditions.checkNotNull(family);
    return Humanizer.humanize(getValue(), units(family), precision, delimiter);
  }

  public String toKbps(@Nullable Integer precision) {
    return to(RateUnit.kbps, precision, Humanizer.DEFAULT_DELIMITER);
  }

  public String toMbps(@Nullable Integer precision) {
    return to(RateUnit.Mbps, precision, Humanizer.DEFAULT_DELIMITER);
  }

  public String toGbps(@Nullable Integer precision) {
    return to(RateUnit.Gbps, precision, Humanizer.DEFAULT_DELIMITER);
  }

  public String toTbps(@Nullable Integer precision) {
    return to(RateUnit.Tbps, precision, Humanizer.DEFAULT_DELIMITER);
  }

  public String toKBps(@Nullable Integer precision) {
    return to(RateUnit.kBps, precision, Humanizer.DEFAULT_DELIMITER);
  }

  public String toMBps(@Nullable Integer precision) {
    return to(RateUnit.MBps, precision, Humanizer.DEFAULT_DELIMITER);
  }

  public String toGBps(@Nullable Integer precision) {
    return to(RateUnit.GBps, precision, Humanizer.DEFAULT_DELIMITER);
  }

  public String toTBps(@Nullable Integer precision) {
    return to(RateUnit.TBps, precision, Humanizer.DEFAULT_DELIMITER);
  }

  /**
   * Scales this rate down by a factor between 0 and 1.
   *
   * @throws IllegalArgumentException if the factor falls outside {@code [0, 1]}
   */
  public Rate throttle(double factor) {
    MorePreconditions.checkArgumentRange(factor, 0, 1,
        "Throttle factor must be between 0 and 1, got %s");
    return multiply(factor);
  }

  /**
   * Calculates how long transferring the given size takes at this rate, in seconds.
   *
   * @throws IllegalArgumentException if this rate is not positive
   * @see TransferCalculator#transferTime(Size, Rate)
   */
  public double calculateTransferTime(Size size) {
    return TransferCalculator.NOMINAL.transferTime(size, this);
  }

  /**
   * @see #calculateTransferTime(Size)
   */
  public double calculateTransferTime(String size) {
    return calculateTransferTime(Size.of(size));
  }

  /**
   * Formats the time to transfer the given size at this rate in the formatter's default language.
   */
  public String getFormattedTransferTime(Size size, DurationFormatter formatter) {
    return getFormattedTransferTime(size, formatter, null);
  }

  /**
   * Formats the time to transfer the given size at this rate.
   *
   * @param size the size to transfer
   * @param formatter the formatter to render the duration with
   * @param language the language code to render in, or {@code null} for the default
   * @return the localized transfer time
   */
  public String getFormattedTransferTime(Size size, DurationFormatter formatter,
      @Nullable String language) {
    return TransferCalculator.NOMINAL.formattedTransferTime(size, this, formatter, language);
  }

  /**
   * Calculates how much data this rate moves in the given number of seconds.
   */
  public Size calculateTransferAmount(double seconds) {
    return TransferCalculator.NOMINAL.transferAmount(this, seconds);
  }

  /**
   * Estimates the size of a recording or stream of the given duration at this rate.
   */
  public Size estimateFileSize(double seconds) {
    return TransferCalculator.NOMINAL.estimateFileSize(this, seconds);
  }

  @Override
  public String toString() {
    return toString(getDisplayFamily());
  }

  @Override
  protected Rate create(double value) {
    return new Rate(value, displayAsBits);
  }

  @Override
  protected QuantityParser<RateUnit> parser() {
    return PARSER;
  }

  @Override
  protected UnitTable<RateUnit> displayUnits() {
    return units(getDisplayFamily());
  }

  private static UnitTable<RateUnit> units(RateUnit.Family family) {
    return family == RateUnit.Family.BIT ? UnitTable.RATE_BITS : UnitTable.RATE_BYTES;
  }

  private static Rate zero(boolean displayAsBits) {
    return displayAsBits ? ZERO_BITS : ZERO_BYTES;
  }
}
