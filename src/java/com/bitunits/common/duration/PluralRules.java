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

import java.util.Locale;

import com.bitunits.common.base.MorePreconditions;

/**
 * The plural rules language tables can name in their {@code plural_rule} entry.
 */
public enum PluralRules implements PluralRule {

  /**
   * The singular key for one, the plural key for anything else, as in English.
   */
  DEFAULT {
    @Override public String formKey(long count, Time unit) {
      return count == 1 ? unit.formName() : unit.pluralFormName();
    }
  },

  /**
   * Russian and related languages: the singular key for 1, 21, 31... a {@code _few} key for 2-4,
   * 22-24... and the plural key for everything else, the teens included.
   */
  EAST_SLAVIC {
    @Override public String formKey(long count, Time unit) {
      long mod10 = count % 10;
      long mod100 = count % 100;
      if (mod10 == 1 && mod100 != 11) {
        return unit.formName();
      }
      if (mod10 >= 2 && mod10 <= 4 && (mod100 < 10 || mod100 >= 20)) {
        return unit.formName() + "_few";
      }
      return unit.pluralFormName();
    }
  },

  /**
   * Arabic: the singular key for one and two, the plural key for three to ten, and a
   * {@code s_many} key for zero and anything above ten.
   */
  ARABIC {
    @Override public String formKey(long count, Time unit) {
      if (count == 1 || count == 2) {
        return unit.formName();
      }
      if (count >= 3 && count <= 10) {
        return unit.pluralFormName();
      }
      return unit.pluralFormName() + "_many";
    }
  },

  /**
   * Languages without plural inflection: always the plural key.
   */
  INVARIANT {
    @Override public String formKey(long count, Time unit) {
      return unit.pluralFormName();
    }
  };

  /**
   * Returns the name language table files refer to this rule by, eg: {@code east_slavic}.
   */
  public String ruleName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Finds a rule by the name language table files use.
   *
   * @param name the rule name, eg: {@code east_slavic}
   * @return the named rule
   * @throws IllegalArgumentException if no rule has the name
   */
  public static PluralRules forName(String name) {
    MorePreconditions.checkNotBlank(name, "A plural rule name is required");
    for (PluralRules rule : values()) {
      if (rule.ruleName().equals(name.trim().toLowerCase(Locale.ROOT))) {
        return rule;
      }
    }
    throw new IllegalArgumentException("Unknown plural rule: " + name);
  }
}
