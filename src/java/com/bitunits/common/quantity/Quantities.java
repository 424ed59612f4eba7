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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import com.bitunits.common.base.MorePreconditions;

/**
 * Operations over collections of quantities.  Each takes a zero valued prototype of the quantity
 * type, which parses the operands and supplies any display settings of the results.
 */
final class Quantities {

  private Quantities() {
    // utility
  }

  static <Q extends Quantity<Q, U>, U extends Unit<U>> List<Q> range(Q prototype, Object start,
      Object end, Object step) {
    double first = prototype.parse(start);
    double last = prototype.parse(end);
    double increment = prototype.parse(step);
    Preconditions.checkArgument(last >= first,
        "End value %s cannot be less than start value %s", end, start);
    Preconditions.checkArgument(increment > 0, "Step value %s must be greater than zero", step);
    Preconditions.checkArgument(first + increment > first && last + increment > last,
        "Step value %s is too small to advance from %s to %s", step, start, end);

    ImmutableList.Builder<Q> range = ImmutableList.builder();
    // first + i * step rather than a running sum, so fractional steps do not drift.
    for (long i = 0; first + i * increment <= last; i++) {
      range.add(prototype.create(first + i * increment));
    }
    return range.build();
  }

  static <Q extends Quantity<Q, U>, U extends Unit<U>> Q sum(Q prototype, Iterable<?> values) {
    Preconditions.checkNotNull(values);
    double total = 0;
    for (Object value : values) {
      total += prototype.parse(value);
    }
    return prototype.create(total);
  }

  static <Q extends Quantity<Q, U>, U extends Unit<U>> Q average(Q prototype,
      Iterable<?> values) {
    MorePreconditions.checkNotEmpty(values, "Cannot compute the average of nothing");
    return sum(prototype, values).divide(Iterables.size(values));
  }

  static <Q extends Quantity<Q, U>, U extends Unit<U>> Q maximum(Q prototype,
      Iterable<?> values) {
    MorePreconditions.checkNotEmpty(values, "Cannot find the maximum of nothing");
    return first(prototype, values).max(Iterables.skip(values, 1));
  }

  static <Q extends Quantity<Q, U>, U extends Unit<U>> Q minimum(Q prototype,
      Iterable<?> values) {
    MorePreconditions.checkNotEmpty(values, "Cannot find the minimum of nothing");
    return first(prototype, values).min(Iterables.skip(values, 1));
  }

  private static <Q extends Quantity<Q, U>, U extends Unit<U>> Q first(Q prototype,
      Iterable<?> values) {
    return prototype.create(prototype.parse(Iterables.getFirst(values, null)));
  }
}
