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

package com.bitunits.common.duration;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import org.apache.commons.lang.StringUtils;

import com.bitunits.common.base.MorePreconditions;

/**
 * Renders durations in words, eg: {@code 130} seconds as {@code "2 minutes, 10 seconds"} in
 * English or {@code "2 минуты и 10 секунд"} in Russian.
 *
 * <p>At most the two largest non-trivial units are shown and anything smaller is dropped:
 * {@code 3725} seconds render as {@code "1 hour, 2 minutes"}.  The smaller unit is left out when
 * its count is zero.  Durations under a second render as the table's less than a second phrase.
 */
public class DurationFormatter {

  private final LanguageRegistry registry;

  public DurationFormatter(LanguageRegistry registry) {
    this.registry = Preconditions.checkNotNull(registry);
  }

  public LanguageRegistry getRegistry() {
    return registry;
  }

  /**
   * Formats a duration in the registry's default language.
   *
   * @see #format(double, String)
   */
  public String format(double seconds) {
    return format(seconds, null);
  }

  /**
   * Formats a duration.
   *
   * @param seconds the duration in seconds; fractions of a second are dropped
   * @param language the language to render in, or {@code null} for the registry's default
   * @return the duration in words
   * @throws IllegalArgumentException if {@code seconds} is not finite
   * @throws UnknownLanguageException if neither the language nor English is loaded
   * @throws MissingFormKeyException if the table lacks a form the duration needs
   */
  public String format(double seconds, @Nullable String language) {
    MorePreconditions.checkFinite(seconds, "Durations must be finite, got %s");
    LanguageTable table = registry.resolve(language);

    if (seconds < 1) {
      return table.getLessThanSecond();
    }

    long total = (long) seconds;
    long minutes = total / Time.MINUTES.seconds();
    long remainingSeconds = total % Time.MINUTES.seconds();
    if (minutes < 1) {
      return formatUnit(table, remainingSeconds, Time.SECONDS);
    }

    long hours = minutes / 60;
    long remainingMinutes = minutes % 60;
    if (hours < 1) {
      return join(table, Time.MINUTES, remainingMinutes, Time.SECONDS, remainingSeconds);
    }

    long days = hours / 24;
    long remainingHours = hours % 24;
    if (days < 1) {
      return join(table, Time.HOURS, remainingHours, Time.MINUTES, remainingMinutes);
    }
    return join(table, Time.DAYS, days, Time.HOURS, remainingHours);
  }

  /**
   * Renders a count of one unit, eg: {@code "2 minutes"}.
   *
   * @param table the language to render in
   * @param count the number of units
   * @param unit the unit counted
   * @return the count in words
   * @throws MissingFormKeyException if the table lacks the form the count needs
   */
  @VisibleForTesting
  static String formatUnit(LanguageTable table, long count, Time unit) {
    PluralRule rule = table.getPluralRule() == null ? PluralRules.DEFAULT : table.getPluralRule();
    String form = table.form(rule.formKey(count, unit));
    return StringUtils.replaceEach(table.getFormat(),
        new String[] {LanguageTable.VALUE_PLACEHOLDER, LanguageTable.UNIT_PLACEHOLDER},
        new String[] {String.valueOf(count), form});
  }

  private static String join(LanguageTable table, Time major, long majorCount, Time minor,
      long minorCount) {
    String result = formatUnit(table, majorCount, major);
    if (minorCount > 0) {
      result += table.getSeparator() + formatUnit(table, minorCount, minor);
    }
    return result;
  }
}
