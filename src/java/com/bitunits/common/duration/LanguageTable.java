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

import java.util.Map;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import com.bitunits.common.base.MorePreconditions;

/**
 * The strings a {@link DurationFormatter} renders durations with in one language.
 *
 * <p>Each unit count is rendered by substituting the count for {@code {value}} and a unit form for
 * {@code {unit}} in the table's format template.  Forms are keyed by the unit's base name
 * ({@code second}, {@code minute}, {@code hour}, {@code day}) plus whatever suffixes the table's
 * {@link PluralRule} produces.  Tables without a rule use {@link PluralRules#DEFAULT}.
 */
@Immutable
public final class LanguageTable {

  public static final String VALUE_PLACEHOLDER = "{value}";
  public static final String UNIT_PLACEHOLDER = "{unit}";
  public static final String DEFAULT_FORMAT = VALUE_PLACEHOLDER + " " + UNIT_PLACEHOLDER;
  public static final String DEFAULT_SEPARATOR = ", ";

  private final String code;
  @Nullable private final String name;
  private final String format;
  private final String separator;
  private final String lessThanSecond;
  private final ImmutableMap<String, String> forms;
  @Nullable private final PluralRule pluralRule;

  private LanguageTable(Builder builder) {
    this.code = builder.code;
    this.name = builder.name;
    this.format = builder.format;
    this.separator = builder.separator;
    this.lessThanSecond = builder.lessThanSecond;
    this.forms = ImmutableMap.copyOf(builder.forms);
    this.pluralRule = builder.pluralRule;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the code the table is registered under, eg: {@code en} or {@code pt-BR}.
   */
  public String getCode() {
    return code;
  }

  /**
   * Returns the native name of the language, if the table carries one.
   */
  @Nullable
  public String getName() {
    return name;
  }

  public String getFormat() {
    return format;
  }

  public String getSeparator() {
    return separator;
  }

  public String getLessThanSecond() {
    return lessThanSecond;
  }

  public ImmutableMap<String, String> getForms() {
    return forms;
  }

  @Nullable
  public PluralRule getPluralRule() {
    return pluralRule;
  }

  public boolean hasForm(String key) {
    return forms.containsKey(key);
  }

  /**
   * Returns the unit form stored under a key.
   *
   * @throws MissingFormKeyException if the table has no such form
   */
  public String form(String key) {
    String form = forms.get(key);
    if (form == null) {
      throw new MissingFormKeyException(code, key);
    }
    return form;
  }

  /**
   * Returns this table registered under a different code.
   */
  public LanguageTable withCode(String code) {
    return code.equals(this.code) ? this : toBuilder().code(code).build();
  }

  public Builder toBuilder() {
    return new Builder()
        .code(code)
        .name(name)
        .format(format)
        .separator(separator)
        .lessThanSecond(lessThanSecond)
        .forms(forms)
        .pluralRule(pluralRule);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof LanguageTable)) {
      return false;
    }
    LanguageTable other = (LanguageTable) obj;
    return code.equals(other.code)
        && Objects.equal(name, other.name)
        && format.equals(other.format)
        && separator.equals(other.separator)
        && lessThanSecond.equals(other.lessThanSecond)
        && forms.equals(other.forms)
        && Objects.equal(pluralRule, other.pluralRule);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(code, name, format, separator, lessThanSecond, forms, pluralRule);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("code", code)
        .add("name", name)
        .add("forms", forms.keySet())
        .add("pluralRule", pluralRule)
        .toString();
  }

  /**
   * Assembles a {@link LanguageTable}.  The format defaults to {@value #DEFAULT_FORMAT} and the
   * separator to {@value #DEFAULT_SEPARATOR}; a code and a less than a second phrase are
   * required.
   */
  public static class Builder {
    private String code;
    private String name;
    private String format = DEFAULT_FORMAT;
    private String separator = DEFAULT_SEPARATOR;
    private String lessThanSecond;
    private final Map<String, String> forms = Maps.newLinkedHashMap();
    private PluralRule pluralRule;

    private Builder() {
    }

    public Builder code(String code) {
      this.code = MorePreconditions.checkNotBlank(code, "A language code is required").trim();
      return this;
    }

    public Builder name(@Nullable String name) {
      this.name = name;
      return this;
    }

    public Builder format(String format) {
      this.format = Preconditions.checkNotNull(format);
      return this;
    }

    public Builder separator(String separator) {
      this.separator = Preconditions.checkNotNull(separator);
      return this;
    }

    public Builder lessThanSecond(String lessThanSecond) {
      this.lessThanSecond = Preconditions.checkNotNull(lessThanSecond);
      return this;
    }

    public Builder form(String key, String form) {
      forms.put(MorePreconditions.checkNotBlank(key), Preconditions.checkNotNull(form));
      return this;
    }

    /**
     * Adds the singular and plural forms of a unit, eg: {@code minute} and {@code minutes}.
     */
    public Builder forms(Time unit, String singular, String plural) {
      return form(unit.formName(), singular).form(unit.pluralFormName(), plural);
    }

    public Builder forms(Map<String, String> forms) {
      for (Map.Entry<String, String> entry : forms.entrySet()) {
        form(entry.getKey(), entry.getValue());
      }
      return this;
    }

    public Builder pluralRule(@Nullable PluralRule pluralRule) {
      this.pluralRule = pluralRule;
      return this;
    }

    /**
     * @throws IllegalStateException if no code or less than a second phrase was given
     */
    public LanguageTable build() {
      Preconditions.checkState(code != null, "A language code is required");
      Preconditions.checkState(lessThanSecond != null,
          "Language table '%s' needs a less than a second phrase", code);
      return new LanguageTable(this);
    }
  }
}
