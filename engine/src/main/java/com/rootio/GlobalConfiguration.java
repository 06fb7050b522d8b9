/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.rootio;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.rootio.utility.FileUtils;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties.
 */
public enum GlobalConfiguration {
  // ENVIRONMENT
  TEST("rootio.test", "Tells if it is running in test mode", Boolean.class, false),

  // COMPRESSION
  COMPRESSION_ALGORITHM("rootio.compression.algorithm", "Compression algorithm for new files among: none, zlib, lzma, lz4, zstd", String.class,
      "zlib"),

  COMPRESSION_LEVEL("rootio.compression.level", "Compression level for new files (0-9). 0 means no compression", Integer.class, 1),

  LZ4_VERIFY_CHECKSUM("rootio.lz4.verifyChecksum", "Verifies the XXH64 checksum of every LZ4 block before decompressing it", Boolean.class, true),

  // BINARY
  BINARY_ALLOCATION_CHUNK("rootio.binary.allocationChunk", "Growth step in bytes of auto-resizable buffers", Integer.class, 512),

  // TREES
  TREE_BASKET_SIZE("rootio.tree.basketSize", "Size in bytes of the basket buffers of new branches. Accepts KB/MB suffixes", Integer.class, 32000),

  TREE_MAX_ENTRIES_PER_BASKET("rootio.tree.maxEntriesPerBasket", "Maximum number of entries per basket. 0 = limited by the basket size only",
      Integer.class, 0);

  /**
   * Place holder for the "undefined" value of setting.
   */
  private final Object nullValue = new Object();

  public static final String PREFIX = "rootio.";

  private final String   key;
  private final Object   defValue;
  private final Class<?> type;
  private final String   description;
  private volatile Object value = nullValue;

  static {
    readConfiguration();
  }

  GlobalConfiguration(final String iKey, final String iDescription, final Class<?> iType, final Object iDefValue) {
    this.key = iKey;
    this.description = iDescription;
    this.defValue = iDefValue;
    this.type = iType;
  }

  /**
   * Reset all the configurations to the default values.
   */
  public static void resetAll() {
    for (final GlobalConfiguration v : values())
      v.reset();
  }

  /**
   * Reset the configuration to the default value.
   */
  public void reset() {
    value = nullValue;
  }

  public static void dumpConfiguration(final PrintStream out) {
    out.print(Constants.PRODUCT);
    out.print(" ");
    out.print(Constants.getVersion());
    out.println(" configuration:");

    String lastSection = "";
    for (final GlobalConfiguration v : values()) {
      final String section = v.key.substring(PREFIX.length(), v.key.indexOf('.', PREFIX.length()) > -1 ?
          v.key.indexOf('.', PREFIX.length()) :
          v.key.length());

      if (!lastSection.equals(section)) {
        out.print("- ");
        out.println(section.toUpperCase(Locale.ENGLISH));
        lastSection = section;
      }
      out.print("  + ");
      out.print(v.key);
      out.print(" = ");
      out.println(String.valueOf((Object) v.getValue()));
    }
  }

  public static void fromJSON(final String input) {
    if (input == null)
      return;

    final JsonObject cfg = JsonParser.parseString(input).getAsJsonObject().getAsJsonObject("configuration");
    for (final Map.Entry<String, JsonElement> entry : cfg.entrySet()) {
      final GlobalConfiguration cfgEntry = findByKey(PREFIX + entry.getKey());
      if (cfgEntry != null)
        cfgEntry.setValue(entry.getValue().getAsString());
    }
  }

  public static String toJSON() {
    final JsonObject json = new JsonObject();
    final JsonObject cfg = new JsonObject();
    json.add("configuration", cfg);

    final Gson gson = new Gson();
    for (final GlobalConfiguration k : values())
      cfg.add(k.key.substring(PREFIX.length()), gson.toJsonTree(k.getValue()));

    return json.toString();
  }

  /**
   * Find the GlobalConfiguration instance by the key. Key is case insensitive.
   *
   * @param iKey Key to find. It's case insensitive.
   *
   * @return GlobalConfiguration instance if found, otherwise null
   */
  public static GlobalConfiguration findByKey(final String iKey) {
    for (final GlobalConfiguration v : values()) {
      if (v.getKey().equalsIgnoreCase(iKey))
        return v;
    }
    return null;
  }

  /**
   * Assign configuration values by reading system properties.
   */
  private static void readConfiguration() {
    for (final GlobalConfiguration config : values()) {
      String prop = System.getProperty(config.key);
      if (prop == null)
        prop = System.getenv(config.key);

      if (prop != null)
        config.setValue(prop);
    }
  }

  @SuppressWarnings("unchecked")
  public <T> T getValue() {
    return (T) (value != nullValue && value != null ? value : defValue);
  }

  /**
   * @return {@literal true} if configuration was changed from default value and {@literal false} otherwise.
   */
  public boolean isChanged() {
    return value != nullValue;
  }

  public void setValue(final Object iValue) {
    if (iValue == null)
      return;

    if (type == Boolean.class)
      value = Boolean.parseBoolean(iValue.toString());
    else if (type == Integer.class)
      value = (int) FileUtils.getSizeAsNumber(iValue);
    else if (type == Long.class)
      value = FileUtils.getSizeAsNumber(iValue);
    else if (type == String.class)
      value = iValue.toString();
    else
      value = iValue;
  }

  public boolean getValueAsBoolean() {
    final Object v = getValue();
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
  }

  public String getValueAsString() {
    final Object v = getValue();
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger() {
    final Object v = getValue();
    return (int) (v instanceof Number ? ((Number) v).intValue() : FileUtils.getSizeAsNumber(v.toString()));
  }

  public long getValueAsLong() {
    final Object v = getValue();
    return v instanceof Number ? ((Number) v).longValue() : FileUtils.getSizeAsNumber(v.toString());
  }

  public String getKey() {
    return key;
  }

  public Object getDefValue() {
    return defValue;
  }

  public Class<?> getType() {
    return type;
  }

  public String getDescription() {
    return description;
  }
}
