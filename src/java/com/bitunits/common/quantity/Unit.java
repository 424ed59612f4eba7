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
 * One unit of a fixed unit family, eg: megabytes within the size family.  Each family has a
 * canonical unit (bytes for sizes, bits per second for rates) and every unit reports its weight
 * relative to it as {@code base ^ exponent}, possibly scaled by a constant factor.
 *
 * @param <U> the type of the concrete unit implementation
 */
public interface Unit<U extends Unit<U>> {

  /**
   * Returns the number of canonical units in one of this unit.
   */
  double multiplier();

  /**
   * Returns the display symbol, eg: {@code kB} or {@code Mbps}.
   */
  String symbol();

  /**
   * Returns the power of {@link #base()} this unit is scaled by.  The canonical unit of a family
   * has exponent 0.
   */
  int exponent();

  /**
   * Returns the step between adjacent units of the family: 1024 or 1000.
   */
  int base();
}
