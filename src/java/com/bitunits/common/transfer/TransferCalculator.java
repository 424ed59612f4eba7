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

package com.bitunits.common.transfer;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import com.bitunits.common.base.MorePreconditions;
import com.bitunits.common.duration.DurationFormatter;
import com.bitunits.common.quantity.Rate;
import com.bitunits.common.quantity.Size;

/**
 * Relates sizes, rates and durations: how long a transfer takes, and how much data a rate moves
 * in a given time.
 *
 * <p>Transfer times and amounts at a {@link Rate} follow the {@link TransferConvention}, so an
 * amount read back at the same rate takes the original time.  Under {@code NOMINAL} 100 Mbps for a
 * minute moves {@code 750 MB}; under {@code EXACT} it moves 750,000,000 bytes.  Raw bandwidths in
 * bytes per second are always exact.
 */
public class TransferCalculator {

  public static final TransferCalculator NOMINAL =
      new TransferCalculator(TransferConvention.NOMINAL);

  public static final TransferCalculator EXACT = new TransferCalculator(TransferConvention.EXACT);

  private final TransferConvention convention;

  public TransferCalculator(TransferConvention convention) {
    this.convention = Preconditions.checkNotNull(convention);
  }

  public TransferConvention getConvention() {
    return convention;
  }

  /**
   * Calculates the time needed to transfer a size at a rate.
   *
   * @param size the size to transfer
   * @param rate the transfer rate
   * @return the transfer time in seconds
   * @throws IllegalArgumentException if the rate is not positive
   */
  public double transferTime(Size size, Rate rate) {
    Preconditions.checkNotNull(size);
    Preconditions.checkArgument(rate.isPositive(), "Rate must be positive, got %s", rate);
    return convention.bits(size) / rate.toBits();
  }

  /**
   * Calculates the time needed to transfer a size over a raw bandwidth.
   *
   * @param size the size to transfer
   * @param bytesPerSecond the bandwidth in bytes per second
   * @return the transfer time in seconds
   * @throws IllegalArgumentException if the bandwidth is not positive
   */
  public double transferTime(Size size, double bytesPerSecond) {
    Preconditions.checkNotNull(size);
    checkBandwidth(bytesPerSecond);
    return size.getValue() / bytesPerSecond;
  }

  /**
   * Calculates the time needed to transfer a size when a given size moves every second.
   *
   * @see #transferTime(Size, double)
   */
  public double transferTime(Size size, Size perSecond) {
    return transferTime(size, perSecond.getValue());
  }

  /**
   * Calculates how much data a rate moves in the given time.
   *
   * @param rate the transfer rate
   * @param seconds the duration of the transfer
   * @return the size transferred
   * @throws IllegalArgumentException if the duration is negative or not finite
   */
  public Size transferAmount(Rate rate, double seconds) {
    Preconditions.checkNotNull(rate);
    checkSeconds(seconds);
    return convention.size(rate.toBits() * seconds);
  }

  /**
   * Calculates how much data a raw bandwidth moves in the given time.
   *
   * @param bytesPerSecond the bandwidth in bytes per second
   * @param seconds the duration of the transfer
   * @return the size transferred
   * @throws IllegalArgumentException if the duration is negative or either argument not finite
   */
  public Size transferAmount(double bytesPerSecond, double seconds) {
    MorePreconditions.checkFinite(bytesPerSecond, "Bandwidth must be finite, got %s");
    checkSeconds(seconds);
    return Size.of(bytesPerSecond * seconds);
  }

  /**
   * Estimates the size of a recording or stream of the given duration.
   *
   * @see #transferAmount(Rate, double)
   */
  public Size estimateFileSize(Rate rate, double seconds) {
    return transferAmount(rate, seconds);
  }

  /**
   * @see #transferAmount(double, double)
   */
  public Size estimateFileSize(double bytesPerSecond, double seconds) {
    return transferAmount(bytesPerSecond, seconds);
  }

  /**
   * Renders the time needed to transfer a size at a rate.
   *
   * @param size the size to transfer
   * @param rate the transfer rate
   * @param formatter the formatter to render the duration with
   * @param language the language code to render in, or {@code null} for the formatter's default
   * @return the localized transfer time
   */
  public String formattedTransferTime(Size size, Rate rate, DurationFormatter formatter,
      @Nullable String language) {
    Preconditions.checkNotNull(formatter);
    return formatter.format(transferTime(size, rate), language);
  }

  /**
   * Renders the time needed to transfer a size at a rate in the formatter's default language.
   */
  public String formattedTransferTime(Size size, Rate rate, DurationFormatter formatter) {
    return formattedTransferTime(size, rate, formatter, null);
  }

  @Override
  public String toString() {
    return "TransferCalculator(" + convention + ")";
  }

  private static void checkBandwidth(double bytesPerSecond) {
    MorePreconditions.checkFinite(bytesPerSecond, "Bandwidth must be finite, got %s");
    Preconditions.checkArgument(bytesPerSecond > 0, "Bandwidth must be positive, got %s",
        bytesPerSecond);
  }

  private static void checkSeconds(double seconds) {
    MorePreconditions.checkFinite(seconds, "Duration must be finite, got %s");
    Preconditions.checkArgument(seconds >= 0, "Duration must not be negative, got %s", seconds);
  }
}
