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
 * Thrown when a language is requested that has no table loaded.
 */
public class UnknownLanguageException extends IllegalArgumentException {

  private final String language;

  public UnknownLanguageException(String language, Iterable<String> loaded) {
    super(String.format("Language '%s' is not loaded, loaded languages are %s", language, loaded));
    this.language = language;
  }

  public String getLanguage() {
    return language;
  }
}
