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

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.io.Files;
import com.google.common.io.Resources;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import org.apache.commons.lang.StringUtils;

/**
 * Reads {@link LanguageTable}s from JSON documents of the form:
 * <pre>
 * {
 *   "language_code": "en",
 *   "language_name": "English",
 *   "time": {
 *     "format": "{value} {unit}",
 *     "separator": ", ",
 *     "less_than_second": "less than a second",
 *     "plural_rule": "default",
 *     "second": "second",
 *     "seconds": "seconds",
 *     ...
 *   }
 * }
 * </pre>
 * Every entry of {@code time} other than the four settings above is a unit form.
 */
public final class LanguageTables {

  /**
   * The languages bundled on the classpath.
   */
  public static final List<String> BUNDLED =
      ImmutableList.of("ar", "de", "en", "es", "fr", "it", "ja", "nl", "pt", "ru", "zh");

  static final String EXTENSION = ".json";

  private static final String BUNDLED_PATH = "languages/";

  private static final String FORMAT = "format";
  private static final String SEPARATOR = "separator";
  private static final String LESS_THAN_SECOND = "less_than_second";
  private static final String PLURAL_RULE = "plural_rule";
  private static final ImmutableSet<String> SETTINGS =
      ImmutableSet.of(FORMAT, SEPARATOR, LESS_THAN_SECOND, PLURAL_RULE);

  private static final Pattern CODE_FILE_NAME = Pattern.compile("[a-z]{2}(?:[-_][a-zA-Z]{2})?");

  private static final Gson GSON = new GsonBuilder()
      .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
      .create();

  private LanguageTables() {
    // utility
  }

  /**
   * Mirrors the JSON document.
   */
  private static class TableDocument {
    private String languageCode;
    private String languageName;
    private Map<String, String> time;
  }

  /**
   * Loads one of the {@link #BUNDLED} tables.
   *
   * @param code the language code
   * @return the bundled table
   * @throws IllegalArgumentException if no table is bundled for the code
   * @throws IllegalStateException if the bundled table cannot be read
   */
  public static LanguageTable bundled(String code) {
    Preconditions.checkArgument(BUNDLED.contains(code), "No table is bundled for '%s'", code);
    URL resource = Resources.getResource(LanguageTables.class, BUNDLED_PATH + code + EXTENSION);
    try {
      return load(resource, code);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read bundled language table " + resource, e);
    }
  }

  /**
   * Loads a table from a URL.
   *
   * @param url the location of the JSON document
   * @param code the code to register the table under, or {@code null} to take it from the
   *     document or the file name
   * @return the table
   * @throws IOException if the document cannot be read
   * @throws IllegalArgumentException if the document is malformed or no code can be determined
   */
  public static LanguageTable load(URL url, @Nullable String code) throws IOException {
    Reader reader = Resources.asCharSource(url, StandardCharsets.UTF_8).openBufferedStream();
    try {
      return read(reader, code, StringUtils.substringAfterLast("/" + url.getPath(), "/"));
    } finally {
      reader.close();
    }
  }

  /**
   * Loads a table from a file.
   *
   * @see #load(URL, String)
   */
  public static LanguageTable load(File file, @Nullable String code) throws IOException {
    Reader reader = Files.asCharSource(file, StandardCharsets.UTF_8).openBufferedStream();
    try {
      return read(reader, code, file.getName());
    } finally {
      reader.close();
    }
  }

  /**
   * Reads a table.  The code comes from the {@code code} argument if given, else from the
   * document's {@code language_code}, else from a file name such as {@code fr.json},
   * {@code pt-BR.json} or {@code pt_BR.json}.
   *
   * @param reader the JSON document
   * @param code the code to register the table under, or {@code null}
   * @param fileName the name of the file the document was read from, or {@code null}
   * @return the table
   * @throws IllegalArgumentException if the document is malformed or no code can be determined
   */
  public static LanguageTable read(Reader reader, @Nullable String code,
      @Nullable String fileName) {
    Preconditions.checkNotNull(reader);
    TableDocument document;
    try {
      document = GSON.fromJson(reader, TableDocument.class);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Malformed language table " + describe(fileName), e);
    }
    Preconditions.checkArgument(document != null, "Empty language table %s", describe(fileName));
    Preconditions.checkArgument(document.time != null,
        "Language table %s has no time section", describe(fileName));

    Map<String, String> time = document.time;
    for (Map.Entry<String, String> entry : time.entrySet()) {
      Preconditions.checkArgument(entry.getValue() != null,
          "Language table %s has no value for %s", describe(fileName), entry.getKey());
    }
    Preconditions.checkArgument(time.get(LESS_THAN_SECOND) != null,
        "Language table %s has no %s entry", describe(fileName), LESS_THAN_SECOND);

    LanguageTable.Builder builder = LanguageTable.builder()
        .code(resolveCode(code, document.languageCode, fileName))
        .name(document.languageName)
        .lessThanSecond(time.get(LESS_THAN_SECOND))
        .forms(Maps.filterKeys(time, new Predicate<String>() {
          @Override public boolean apply(String key) {
            return !SETTINGS.contains(key);
          }
        }));
    if (time.get(FORMAT) != null) {
      builder.format(time.get(FORMAT));
    }
    if (time.get(SEPARATOR) != null) {
      builder.separator(time.get(SEPARATOR));
    }
    if (time.get(PLURAL_RULE) != null) {
      builder.pluralRule(PluralRules.forName(time.get(PLURAL_RULE)));
    }
    return builder.build();
  }

  @VisibleForTesting
  static String resolveCode(@Nullable String code, @Nullable String documentCode,
      @Nullable String fileName) {
    if (!StringUtils.isBlank(code)) {
      return code;
    }
    if (!StringUtils.isBlank(documentCode)) {
      return documentCode;
    }
    String baseName = StringUtils.removeEnd(StringUtils.defaultString(fileName), EXTENSION);
    Preconditions.checkArgument(CODE_FILE_NAME.matcher(baseName).matches(),
        "Cannot determine the language code of %s, please give it explicitly",
        describe(fileName));
    return baseName;
  }

  private static String describe(@Nullable String fileName) {
    return fileName == null ? "<unnamed>" : fileName;
  }
}
