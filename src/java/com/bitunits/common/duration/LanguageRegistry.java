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
import java.io.FilenameFilter;
import java.io.IOException;
import java.net.URL;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import com.bitunits.common.base.MorePreconditions;

/**
 * The language tables available to {@link DurationFormatter}s, keyed by language code, along with
 * the language to use when none is asked for.
 *
 * <p>The default language starts out as {@value #FALLBACK_LANGUAGE}; the first table registered
 * replaces it, after which only {@link #setDefaultLanguage(String)} changes it.  Registering a
 * table under a code already in use replaces the earlier table.
 *
 * <p>A registry is meant to be filled once at start up and then shared.  It is not synchronized,
 * so registration must not race with use.
 */
public class LanguageRegistry {

  private static final Logger LOG = Logger.getLogger(LanguageRegistry.class.getName());

  /**
   * The language formatters fall back on when asked for a language that is not loaded.
   */
  public static final String FALLBACK_LANGUAGE = "en";

  private static final FilenameFilter JSON_FILES = new FilenameFilter() {
    @Override public boolean accept(File dir, String name) {
      return name.endsWith(LanguageTables.EXTENSION);
    }
  };

  private final Map<String, LanguageTable> languages = Maps.newLinkedHashMap();
  private String defaultLanguage = FALLBACK_LANGUAGE;

  /**
   * Creates a registry holding every bundled language, with English as the default.
   */
  public static LanguageRegistry withDefaults() {
    LanguageRegistry registry = new LanguageRegistry();
    registry.loadDefaults();
    return registry;
  }

  /**
   * Registers a table under its own code.
   */
  public void addLanguage(LanguageTable table) {
    Preconditions.checkNotNull(table);
    register(table);
  }

  /**
   * Registers a table under the given code, whatever code the table carries.
   */
  public void addLanguage(String code, LanguageTable table) {
    MorePreconditions.checkNotBlank(code, "A language code is required");
    Preconditions.checkNotNull(table);
    register(table.withCode(code.trim()));
  }

  /**
   * Loads and registers a table.
   *
   * @param url the location of a JSON language table
   * @return the code the table was registered under
   * @throws IOException if the table cannot be read
   * @throws IllegalArgumentException if the table is malformed or carries no code
   * @see LanguageTables#load(URL, String)
   */
  public String loadLanguage(URL url) throws IOException {
    return loadLanguage(url, null);
  }

  /**
   * Loads and registers a table under the given code.
   *
   * @see #loadLanguage(URL)
   */
  public String loadLanguage(URL url, @Nullable String code) throws IOException {
    return register(LanguageTables.load(url, code));
  }

  /**
   * Loads and registers a table from a file.
   *
   * @see #loadLanguage(URL)
   */
  public String loadLanguage(File file) throws IOException {
    return loadLanguage(file, null);
  }

  /**
   * Loads and registers a table from a file under the given code.
   *
   * @see #loadLanguage(URL)
   */
  public String loadLanguage(File file, @Nullable String code) throws IOException {
    return register(LanguageTables.load(file, code));
  }

  /**
   * Loads every {@code .json} table in a directory, in file name order.  Files that cannot be
   * read or parsed are logged and skipped.
   *
   * @param directory the directory to scan
   * @return the codes of the tables loaded
   * @throws IllegalArgumentException if {@code directory} is not a directory
   */
  public List<String> loadLanguagesFromDirectory(File directory) {
    Preconditions.checkArgument(directory.isDirectory(), "Not a directory: %s", directory);
    File[] files = directory.listFiles(JSON_FILES);
    Preconditions.checkArgument(files != null, "Failed to list %s", directory);
    Arrays.sort(files);

    List<String> loaded = Lists.newArrayList();
    for (File file : files) {
      try {
        loaded.add(loadLanguage(file));
      } catch (IOException e) {
        LOG.log(Level.WARNING, "Skipping unreadable language table " + file, e);
      } catch (IllegalArgumentException e) {
        LOG.log(Level.WARNING, "Skipping invalid language table " + file, e);
      }
    }
    return loaded;
  }

  /**
   * Registers every bundled table.  English is registered first so that it becomes the default
   * of an empty registry.
   *
   * @return the codes of the tables loaded
   */
  public List<String> loadDefaults() {
    List<String> codes = Lists.newArrayList(FALLBACK_LANGUAGE);
    for (String code : LanguageTables.BUNDLED) {
      if (!code.equals(FALLBACK_LANGUAGE)) {
        codes.add(code);
      }
    }
    for (String code : codes) {
      register(LanguageTables.bundled(code));
    }
    return ImmutableList.copyOf(codes);
  }

  /**
   * Sets the language used when none is asked for.
   *
   * @throws UnknownLanguageException if the language is not loaded
   */
  public void setDefaultLanguage(String code) {
    getLanguage(code);
    defaultLanguage = code;
  }

  public String getDefaultLanguage() {
    return defaultLanguage;
  }

  public boolean isLanguageLoaded(String code) {
    return languages.containsKey(code);
  }

  /**
   * Returns the codes of the loaded languages in the order they were first registered.
   */
  public List<String> getLoadedLanguages() {
    return ImmutableList.copyOf(languages.keySet());
  }

  /**
   * Returns the table registered under a code.
   *
   * @throws UnknownLanguageException if the language is not loaded
   */
  public LanguageTable getLanguage(String code) {
    Preconditions.checkNotNull(code);
    LanguageTable table = languages.get(code);
    if (table == null) {
      throw new UnknownLanguageException(code, languages.keySet());
    }
    return table;
  }

  /**
   * Finds the table to format with: the requested language, or the default one if none is
   * requested, falling back on {@value #FALLBACK_LANGUAGE} when that language is not loaded.
   *
   * @param code the requested language, or {@code null} for the default
   * @return the table to format with
   * @throws UnknownLanguageException if neither the language nor the fallback is loaded
   */
  public LanguageTable resolve(@Nullable String code) {
    String language = code == null ? defaultLanguage : code;
    LanguageTable table = languages.get(language);
    if (table != null) {
      return table;
    }

    table = languages.get(FALLBACK_LANGUAGE);
    if (table == null) {
      throw new UnknownLanguageException(language, languages.keySet());
    }
    LOG.fine(String.format("Language '%s' is not loaded, using '%s'", language,
        FALLBACK_LANGUAGE));
    return table;
  }

  private String register(LanguageTable table) {
    String code = table.getCode();
    if (languages.isEmpty()) {
      defaultLanguage = code;
    }
    if (languages.put(code, table) != null) {
      LOG.info("Replaced language table " + code);
    } else {
      LOG.fine("Registered language table " + code);
    }
    return code;
  }
}
