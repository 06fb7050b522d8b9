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

import java.io.Serializable;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Represents a context configuration where custom setting could be defined for the context only. If not defined, globals will be
 * taken. Files keep one instance each, so the options passed at creation (compression, basket size) stay file-scoped.
 **/
public class ContextConfiguration implements Serializable {
  private final Map<String, Object> config = new ConcurrentHashMap<>();

  /**
   * Empty constructor to create just a proxy for the GlobalConfiguration. No values are set.
   */
  public ContextConfiguration() {
  }

  /**
   * Initializes the context with custom parameters.
   *
   * @param iConfig Map of parameters of type {@literal Map<String, Object>}.
   */
  public ContextConfiguration(final Map<String, Object> iConfig) {
    this.config.putAll(iConfig);
  }

  public ContextConfiguration(final ContextConfiguration iParent) {
    if (iParent != null)
      config.putAll(iParent.config);
  }

  public void fromJSON(final String input) {
    if (input == null)
      return;

    final JsonObject cfg = JsonParser.parseString(input).getAsJsonObject().getAsJsonObject("configuration");
    for (final Map.Entry<String, JsonElement> entry : cfg.entrySet()) {
      final GlobalConfiguration cfgEntry = GlobalConfiguration.findByKey(GlobalConfiguration.PREFIX + entry.getKey());
      if (cfgEntry != null)
        config.put(cfgEntry.getKey(), entry.getValue().getAsString());
    }
  }

  public String toJSON() {
    final JsonObject json = new JsonObject();
    final JsonObject cfg = new JsonObject();
    json.add("configuration", cfg);

    final Gson gson = new Gson();
    for (final Map.Entry<String, Object> entry : config.entrySet())
      cfg.add(entry.getKey().substring(GlobalConfiguration.PREFIX.length()), gson.toJsonTree(entry.getValue()));

    return json.toString();
  }

  public ContextConfiguration setValue(final GlobalConfiguration iConfig, final Object iValue) {
    if (iValue == null)
      config.remove(iConfig.getKey());
    else
      config.put(iConfig.getKey(), iValue);
    return this;
  }

  public Object getValue(final GlobalConfiguration iConfig) {
    if (config.containsKey(iConfig.getKey()))
      return config.get(iConfig.getKey());
    return iConfig.getValue();
  }

  public boolean hasValue(final GlobalConfiguration iConfig) {
    return config.containsKey(iConfig.getKey());
  }

  public boolean getValueAsBoolean(final GlobalConfiguration iConfig) {
    final Object v = getValue(iConfig);
    if (v == null)
      return false;
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
  }

  public String getValueAsString(final GlobalConfiguration iConfig) {
    final Object v = getValue(iConfig);
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger(final GlobalConfiguration iConfig) {
    final Object v = getValue(iConfig);
    if (v == null)
      return 0;
    return v instanceof Number ? ((Number) v).intValue() : (int) FileUtils.getSizeAsNumber(v.toString());
  }

  public long getValueAsLong(final GlobalConfiguration iConfig) {
    final Object v = getValue(iConfig);
    if (v == null)
      return 0;
    return v instanceof Number ? ((Number) v).longValue() : FileUtils.getSizeAsNumber(v.toString());
  }

  public int getContextSize() {
    return config.size();
  }

  public Set<String> getContextKeys() {
    return config.keySet();
  }

  public void merge(final ContextConfiguration contextConfiguration) {
    this.config.putAll(contextConfiguration.config);
  }

  public void reset() {
    config.clear();
  }
}
