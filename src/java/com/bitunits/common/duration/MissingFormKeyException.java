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
 * Thrown when a language table lacks the form a count needs to be rendered with.
 */
public class MissingFormKeyException extends IllegalStateException {

  private final String language;
  private final String key;

  public MissingFormKeyException(String language, String key) {
    super(String.format("Language table '%s' has no entry for '%s'", language, key));
    this.language = language;
    this.key = key;
  }

  public String getLanguage() {
    return language;
  }

  public String getKey() {
    return key;
  }
}
