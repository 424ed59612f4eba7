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

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Maps;
import com.google.common.collect.Multimaps;
import com.google.common.collect.Ordering;
import com.google.common.primitives.Doubles;

/**
 * An index over one family of units.  Symbols are matched case sensitively first; failing that a
 * case insensitive match is attempted.  When a case insensitive match is ambiguous, as with
 * {@code mbps} which could mean either {@link RateUnit#Mbps} or {@link RateUnit#MBps}, the
 * candidate sharing the most identically cased characters with the input wins.  Since the bit and
 * byte rate symbols differ only in the case of their {@code b}, this resolves by that letter.
 *
 * @param <U> the type of unit indexed
 */
public final class UnitTable<U extends Unit<U>> {

  private static final Function<Unit<?>, String> LOWER_CASE_SYMBOL =
      new Function<Unit<?>, String>() {
        @Override public String apply(Unit<?> unit) {
          return unit.symbol().toLowerCase(Locale.ROOT);
        }
      };

  private static final Ordering<Unit<?>> BY_MULTIPLIER = new Ordering<Unit<?>>() {
    @Override public int compare(Unit<?> left, Unit<?> right) {
      return Doubles.compare(left.multiplier(), right.multiplier());
    }
  };

  public static final UnitTable<SizeUnit> SIZE = of(EnumSet.allOf(SizeUnit.class));
  public static final UnitTable<RateUnit> RATE = of(EnumSet.allOf(RateUnit.class));
  public static final UnitTable<RateUnit> RATE_BITS = of(RateUnit.Family.BIT.units());
  public static final UnitTable<RateUnit> RATE_BYTES = of(RateUnit.Family.BYTE.units());

  private final Map<String, U> bySymbol;
  private final ImmutableListMultimap<String, U> byLowerCaseSymbol;
  private final List<U> descending;

  private UnitTable(Iterable<U> units) {
    Preconditions.checkArgument(!Iterables.isEmpty(units), "A unit table needs at least one unit");
    bySymbol = Maps.uniqueIndex(units, new Function<U, String>() {
      @Override public String apply(U unit) {
        return unit.symbol();
      }
    });
    byLowerCaseSymbol = Multimaps.index(units, LOWER_CASE_SYMBOL);
    descending = ImmutableList.copyOf(BY_MULTIPLIER.reverse().sortedCopy(units));
  }

  /**
   * Creates a table over the given units.
   *
   * @param units the units of a single family
   * @param <U> the unit type
   * @return a new table
   */
  public static <U extends Unit<U>> UnitTable<U> of(Iterable<U> units) {
    return new UnitTable<U>(units);
  }

  /**
   * Finds the unit with the given symbol.
   *
   * @param symbol the unit symbol, eg: {@code kB} or {@code Mbps}
   * @return the matching unit
   * @throws UnknownUnitException if no unit of this table matches
   */
  public U lookup(String symbol) {
    Preconditions.checkNotNull(symbol);
    U unit = bySymbol.get(symbol);
    if (unit != null) {
      return unit;
    }

    List<U> candidates = byLowerCaseSymbol.get(symbol.toLowerCase(Locale.ROOT));
    if (candidates.isEmpty()) {
      throw new UnknownUnitException(symbol, bySymbol.keySet());
    }
    return closestCaseMatch(symbol, candidates);
  }

  /**
   * Returns {@code true} if {@link #lookup(String)} would find a unit for the given symbol.
   */
  public boolean contains(String symbol) {
    return bySymbol.containsKey(symbol)
        || byLowerCaseSymbol.containsKey(symbol.toLowerCase(Locale.ROOT));
  }

  /**
   * Returns the units of this table ordered from the largest to the smallest.
   */
  public List<U> descending() {
    return descending;
  }

  /**
   * Returns the smallest unit of this table.
   */
  public U base() {
    return Iterables.getLast(descending);
  }

  @Override
  public String toString() {
    return bySymbol.keySet().toString();
  }

  private static <U extends Unit<U>> U closestCaseMatch(String symbol, List<U> candidates) {
    U best = candidates.get(0);
    int bestScore = -1;
    for (U candidate : candidates) {
      int score = 0;
      String candidateSymbol = candidate.symbol();
      for (int i = 0; i < symbol.length(); i++) {
        if (symbol.charAt(i) == candidateSymbol.charAt(i)) {
          score++;
        }
      }
      if (score > bestScore) {
        best = candidate;
        bestScore = score;
      }
    }
    return best;
  }
}
