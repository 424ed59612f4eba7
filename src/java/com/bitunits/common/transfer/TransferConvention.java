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

import com.bitunits.common.quantity.Humanizer;
import com.bitunits.common.quantity.Size;
import com.bitunits.common.quantity.SizeUnit;
import com.bitunits.common.quantity.UnitTable;

/**
 * How a size is turned into a number of bits when it is set against a rate, and back.  Sizes
 * scale by 1024 while rates scale by 1000, so the two conventions disagree on how long
 * {@code 1 GB} takes.  Each convention's {@link #size(double)} inverts its {@link #bits(Size)}.
 */
public enum TransferConvention {

  /**
   * Reads the size in its humanized unit and takes that figure with a decimal prefix, so
   * {@code 1 GB} counts as 10^9 bytes and takes 80 seconds at 100 Mbps.  This is the figure
   * download dialogs and datasheets quote.
   *
   * <p>The bit count jumps down at every unit boundary: {@code 1023 kB} is read as 1,023,000
   * bytes but {@code 1 MB} as 1,000,000, so the larger size takes less time.  Transfer amounts
   * are read the other way round, {@code 750,000,000} bytes coming back as {@code 750 MB}.
   */
  NOMINAL {
    @Override public double bits(Size size) {
      SizeUnit unit = Humanizer.select(size.getValue(), UnitTable.SIZE);
      return Humanizer.convert(size.getValue(), unit) * Math.pow(DECIMAL_BASE, unit.exponent())
          * BITS_PER_BYTE;
    }

    @Override public Size size(double bits) {
      double bytes = bits / BITS_PER_BYTE;
      SizeUnit unit = decimalUnit(bytes);
      return Size.of(bytes / Math.pow(DECIMAL_BASE, unit.exponent()) * unit.multiplier());
    }
  },

  /**
   * Counts every byte of the size, so {@code 1 GB} is 2^30 bytes and takes about 85.9 seconds at
   * 100 Mbps.
   */
  EXACT {
    @Override public double bits(Size size) {
      return size.toBits();
    }

    @Override public Size size(double bits) {
      return Size.fromBits(bits);
    }
  };

  private static final int DECIMAL_BASE = 1000;
  private static final int BITS_PER_BYTE = 8;

  /**
   * Returns the number of bits the size amounts to under this convention.
   */
  public abstract double bits(Size size);

  /**
   * Returns the size a number of bits amounts to under this convention.
   */
  public abstract Size size(double bits);

  private static SizeUnit decimalUnit(double bytes) {
    double absolute = Math.abs(bytes);
    for (SizeUnit unit : UnitTable.SIZE.descending()) {
      if (absolute / Math.pow(DECIMAL_BASE, unit.exponent()) >= 1) {
        return unit;
      }
    }
    return UnitTable.SIZE.base();
  }
}
