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
package com.rootio.serializer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Class-agnostic decoded object: the field values in declaration order.
 * <p>
 * Values map to Java types as follows: bool as {@link Boolean}, int8/int16/int32/int64 as {@link Byte}/{@link Short}/{@link Integer}/
 * {@link Long}, uint8/uint16/uint32 widened to {@link Short}/{@link Integer}/{@link Long}, uint64 as the raw bits in a {@link Long},
 * floats as {@link Float}/{@link Double}, strings as {@link String}. Arrays are primitive Java arrays of the same width (unsigned
 * values keep their raw bits), embedded objects are {@code GenericObject}s and containers are {@link java.util.List}s.
 */
public class GenericObject {
  private final String              className;
  private final Map<String, Object> fields = new LinkedHashMap<>();
  private       short               version;

  public GenericObject(final String className) {
    this.className = className;
  }

  public String getClassName() {
    return className;
  }

  /**
   * @return the version the object was decoded from, 0 for objects built in memory
   */
  public short getVersion() {
    return version;
  }

  public void setVersion(final short version) {
    this.version = version;
  }

  public GenericObject set(final String name, final Object value) {
    fields.put(name, value);
    return this;
  }

  @SuppressWarnings("unchecked")
  public <T> T get(final String name) {
    return (T) fields.get(name);
  }

  public boolean has(final String name) {
    return fields.containsKey(name);
  }

  public Number getNumber(final String name) {
    final Object v = fields.get(name);
    if (v instanceof Number)
      return (Number) v;
    throw new IllegalArgumentException("Field '" + name + "' of '" + className + "' is not a number: " + v);
  }

  public int getInt(final String name) {
    return getNumber(name).intValue();
  }

  public long getLong(final String name) {
    return getNumber(name).longValue();
  }

  public String getString(final String name) {
    final Object v = fields.get(name);
    return v != null ? v.toString() : null;
  }

  public Map<String, Object> getFields() {
    return Collections.unmodifiableMap(fields);
  }

  /**
   * Class name and field values are compared, arrays by content. The decoded version is not.
   */
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof GenericObject))
      return false;
    final GenericObject that = (GenericObject) o;
    if (!className.equals(that.className) || !fields.keySet().equals(that.fields.keySet()))
      return false;
    for (final Map.Entry<String, Object> entry : fields.entrySet())
      if (!Objects.deepEquals(entry.getValue(), that.fields.get(entry.getKey())))
        return false;
    return true;
  }

  @Override
  public int hashCode() {
    return Objects.hash(className, fields.keySet());
  }

  @Override
  public String toString() {
    return className + fields.keySet();
  }
}
