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

import com.google.common.collect.ImmutableList;

/**
 * Data transfer rate units.  Rates follow the metric convention so each step is a factor of 1000.
 * Units are divided in 2 hierarchies, one based on bits and the other on bytes: {@link #kbps}
 * represents kilobits per second, so 1 kbps = 1000 bps, and {@link #kBps} represents kilobytes
 * per second, so 1 kBps = 1000 Bps or 8000 bps.  The canonical unit is {@link #bps}.
 */
public enum RateUnit implements Unit<RateUnit> {
  bps(Family.BIT),
  kbps(bps),
  Mbps(kbps),
  Gbps(Mbps),
  Tbps(Gbps),
  Pbps(Tbps),
  Ebps(Pbps),
  Zbps(Ebps),
  Ybps(Zbps),
  Bps(Family.BYTE),
  kBps(Bps),
  MBps(kBps),
  GBps(MBps),
  TBps(GBps),
  PBps(TBps),
  EBps(PBps),
  ZBps(EBps),
  YBps(ZBps);

  /**
   * The two rate hierarchies.
   */
  public enum Family {
    BIT(1),
    BYTE(8);

    private final int bitsPerUnit;

    private Family(int bitsPerUnit) {
      this.bitsPerUnit = bitsPerUnit;
    }

    /**
     * Returns the number of bits in one element of this family: 1 for bits, 8 for bytes.
     */
    public int bitsPerUnit() {
      return bitsPerUnit;
    }

    /**
     * Returns the units of this family from the smallest exponent to the largest.
     */
    public List<RateUnit> units() {
      ImmutableList.Builder<RateUnit> units = ImmutableList.builder();
      for (RateUnit unit : RateUnit.values()) {
        if (unit.family == this) {
          units.add(unit);
        }
      }
      return units.build();
    }
  }

  private static final int BASE = 1000;

  private final Family family;
  private final double multiplier;
  private final int exponent;

  private RateUnit(Family family) {
    this.family = family;
    this.multiplier = family.bitsPerUnit;
    this.exponent = 0;
  }

  private RateUnit(RateUnit previous) {
    this.family = previous.family;
    this.multiplier = 1000 * previous.multiplier;
    this.exponent = previous.exponent + 1;
  }

  /**
   * Returns the hierarchy this unit belongs to.
   */
  public Family family() {
    return family;
  }

  @Override
  public double multiplier() {
    return multiplier;
  }

  @Override
  public String symbol() {
    return name();
  }

  @Override
  public int exponent() {
    return exponent;
  }

  @Override
  public int base() {
    return BASE;
  }

  @Override
  public String toString() {
    return symbol();
  }
}
