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

/**
 * The units a duration is broken down into when formatted, from the smallest to the largest.
 * Each unit names the base form key its language table entries are stored under.
 */
public enum Time {
  SECONDS(1, "second"),
  MINUTES(60, SECONDS, "minute"),
  HOURS(60, MINUTES, "hour"),
  DAYS(24, HOURS, "day");

  private final long seconds;
  private final String formName;

  private Time(long seconds, String formName) {
    this.seconds = seconds;
    this.formName = formName;
  }

  private Time(long multiplier, Time base, String formName) {
    this(multiplier * base.seconds, formName);
  }

  /**
   * Returns the number of seconds in one of this unit.
   */
  public long seconds() {
    return seconds;
  }

  /**
   * Returns the singular form key, eg: {@code minute}.
   */
  public String formName() {
    return formName;
  }

  /**
   * Returns the plural form key, eg: {@code minutes}.
   */
  public String pluralFormName() {
    return formName + "s";
  }

  @Override
  public String toString() {
    return formName;
  }
}
