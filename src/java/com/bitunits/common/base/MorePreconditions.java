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

package com.bitunits.common.base;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterables;

import org.apache.commons.lang.StringUtils;

/**
 * Argument checks shared by the quantity, duration and transfer packages.  A complement to
 * {@link com.google.common.base.Preconditions}.
 */
public final class MorePreconditions {

  private static final String ARG_NOT_BLANK_MSG = "Argument cannot be blank";

  private MorePreconditions() {
    // utility
  }

  /**
   * Checks that a string is both non-null and not blank.
   *
   * @see #checkNotBlank(String, String, Object...)
   */
  public static String checkNotBlank(String argument) {
    return checkNotBlank(argument, ARG_NOT_BLANK_MSG);
  }

  /**
   * Checks that a string is both non-null and not blank.
   *
   * @param argument the argument to validate
   * @param message the message template for validation exception messages
   * @param args any arguments needed by the message template
   * @return the argument if it is valid
   * @throws NullPointerException if the argument is null
   * @throws IllegalArgumentException if the argument is empty or pure whitespace
   */
  public static String checkNotBlank(String argument, String message, Object... args) {
    Preconditions.checkNotNull(argument, message, args);
    Preconditions.checkArgument(!StringUtils.isBlank(argument), message, args);
    return argument;
  }

  /**
   * Checks that an Iterable is non-null and has at least one element.  Elements themselves are not
   * inspected.
   *
   * @param argument the argument to validate
   * @param message the message template for validation exception messages
   * @param args any arguments needed by the message template
   * @return the argument if it is valid
   * @throws NullPointerException if the argument is null
   * @throws IllegalArgumentException if the argument has no elements
   */
  public static <S, T extends Iterable<S>> T checkNotEmpty(T argument, String message,
      Object... args) {
    Preconditions.checkNotNull(argument, message, args);
    Preconditions.checkArgument(!Iterables.isEmpty(argument), message, args);
    return argument;
  }

  /**
   * Checks that a double is neither NaN nor infinite.
   *
   * @param argument argument to validate
   * @param message the message template, where %s is replaced by the argument
   * @return the argument if it is valid
   * @throws IllegalArgumentException if the argument is NaN or infinite
   */
  public static double checkFinite(double argument, String message) {
    Preconditions.checkArgument(!Double.isNaN(argument) && !Double.isInfinite(argument),
        message, argument);
    return argument;
  }

  /**
   * Checks that a double falls within a specified range, inclusive.
   *
   * @param argument argument to validate
   * @param minimum minimum possible valid value for the argument
   * @param maximum maximum possible valid value for the argument
   * @param message the message template, where %s is replaced by the argument
   * @return the argument if it is valid
   * @throws IllegalArgumentException if the argument falls outside of the specified range
   */
  public static double checkArgumentRange(double argument, double minimum, double maximum,
      String message) {
    Preconditions.checkArgument(minimum <= argument, message, argument);
    Preconditions.checkArgument(argument <= maximum, message, argument);
    return argument;
  }
}
