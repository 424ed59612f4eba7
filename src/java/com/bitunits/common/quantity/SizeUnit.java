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
 * Storage size units.  The kilo/mega/giga/... hierarchy is built on base 2 so that it increases by
 * a factor of 1024 at each step: 1 kB = 1024 B, 1 MB = 1024 kB and so on up to yottabytes.  The
 * canonical unit is the byte.
 */
public enum SizeUnit implements Unit<SizeUnit> {
  B(1),
  kB(1024, B),
  MB(1024, kB),
  GB(1024, MB),
  TB(1024, GB),
  PB(1024, TB),
  EB(1024, PB),
  ZB(1024, EB),
  YB(1024, ZB);

  private static final int BASE = 1024;

  private final double multiplier;
  private final int exponent;

  private SizeUnit(double multiplier) {
    this.multiplier = multiplier;
    this.exponent = 0;
  }

  private SizeUnit(int step, SizeUnit previous) {
    this.multiplier = step * previous.multiplier;
    this.exponent = previous.exponent + 1;
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
