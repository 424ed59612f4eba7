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
 * Chooses the grammatical form a count of some time unit takes in a language.
 *
 * @see PluralRules
 */
public interface PluralRule {

  /**
   * Returns the key of the language table entry to render the count with, eg: {@code minute},
   * {@code minutes} or {@code minute_few}.
   *
   * @param count the whole number of units, never negative
   * @param unit the unit being counted
   * @return the form key
   */
  String formKey(long count, Time unit);
}
