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
package com.rootio.tree;

import com.rootio.binary.Binary;
import com.rootio.exception.ErrorCode;
import com.rootio.exception.SerializationException;
import com.rootio.serializer.GenericCodec;

import java.lang.reflect.Array;

/**
 * Typed column inside a branch. A leaf holds a scalar, a fixed-length array or, if variable, an array prefixed in every entry by
 * its int32 length. Strings and variable arrays make their branch variable-size.
 */
public class Leaf {
  private final String   name;
  private final String   title;
  private final LeafType type;
  private final int      length;
  private final boolean  variable;
  private       int      offset;

  Leaf(final String name, final String title, final LeafType type, final int length, final boolean variable, final int offset) {
    this.name = name;
    this.type = type;
    this.length = length;
    this.variable = variable;
    this.offset = offset;
    this.title = title != null ? title : defaultTitle();
  }

  public static Leaf scalar(final String name, final LeafType type) {
    return new Leaf(name, null, type, 1, false, 0);
  }

  public static Leaf array(final String name, final LeafType type, final int length) {
    if (type == LeafType.STRING)
      throw new IllegalArgumentException("Arrays of strings are not supported");
    if (length < 1)
      throw new IllegalArgumentException("Invalid array length " + length + " for leaf '" + name + "'");
    return new Leaf(name, null, type, length, false, 0);
  }

  public static Leaf variableArray(final String name, final LeafType type) {
    if (type == LeafType.STRING)
      throw new IllegalArgumentException("Arrays of strings are not supported");
    return new Leaf(name, null, type, 1, true, 0);
  }

  public static Leaf string(final String name) {
    return new Leaf(name, null, LeafType.STRING, 1, false, 0);
  }

  public String getName() {
    return name;
  }

  public String getTitle() {
    return title;
  }

  public LeafType getType() {
    return type;
  }

  /**
   * @return the number of values per entry for fixed leaves, 1 for scalars and variable leaves
   */
  public int getLength() {
    return length;
  }

  public boolean isVariable() {
    return variable || type == LeafType.STRING;
  }

  public boolean isArray() {
    return variable || length > 1;
  }

  /**
   * @return the position of the leaf inside a fixed-size entry
   */
  public int getOffset() {
    return offset;
  }

  void setOffset(final int offset) {
    this.offset = offset;
  }

  /**
   * @return the bytes per entry, -1 for variable leaves
   */
  public int getEntrySize() {
    return isVariable() ? -1 : type.getSize() * length;
  }

  public Object read(final Binary buffer) {
    if (type == LeafType.STRING)
      return buffer.getString();
    if (variable)
      return GenericCodec.readArray(buffer, type.getKind(), buffer.getInt(), name);
    if (length > 1)
      return GenericCodec.readArray(buffer, type.getKind(), length, name);
    return GenericCodec.readPrimitive(buffer, type.getKind());
  }

  public void write(final Binary buffer, final Object value) {
    if (value == null)
      throw new SerializationException(ErrorCode.SERIALIZATION_ERROR, "Missing value for leaf '" + name + "'");
    try {
      if (type == LeafType.STRING)
        buffer.putString(value.toString());
      else if (variable) {
        buffer.putInt(Array.getLength(value));
        GenericCodec.writeArray(buffer, type.getKind(), value);
      } else if (length > 1) {
        if (Array.getLength(value) != length)
          throw new IllegalArgumentException("expected " + length + " values, found " + Array.getLength(value));
        GenericCodec.writeArray(buffer, type.getKind(), value);
      } else
        GenericCodec.writePrimitive(buffer, type.getKind(), value);
    } catch (final ClassCastException | IllegalArgumentException e) {
      throw new SerializationException(ErrorCode.SERIALIZATION_ERROR, "Invalid value for leaf '" + name + "': " + e.getMessage(), e);
    }
  }

  private String defaultTitle() {
    if (variable)
      return name + "[]/" + type.getCode();
    if (length > 1)
      return name + "[" + length + "]/" + type.getCode();
    return name + "/" + type.getCode();
  }

  @Override
  public String toString() {
    return title;
  }
}
