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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Versioned field layout of a class. Instances are immutable.
 */
public class StreamerInfo {
  private final String                className;
  private final short                 version;
  private final List<StreamerElement> elements;
  private final int                   checksum;

  public StreamerInfo(final String className, final int version, final List<StreamerElement> elements) {
    this(className, version, elements, null);
  }

  /**
   * Creates a layout read from a file, keeping the checksum the writer stored.
   */
  public StreamerInfo(final String className, final int version, final List<StreamerElement> elements, final Integer checksum) {
    if (version < 0 || version > Short.MAX_VALUE)
      throw new IllegalArgumentException("Invalid version " + version + " for class '" + className + "'");
    this.className = className;
    this.version = (short) version;
    this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    this.checksum = checksum != null ? checksum : computeChecksum();
    checkCounts();
  }

  public static StreamerInfo of(final String className, final int version, final StreamerElement... elements) {
    return new StreamerInfo(className, version, List.of(elements));
  }

  public String getClassName() {
    return className;
  }

  public short getVersion() {
    return version;
  }

  public List<StreamerElement> getElements() {
    return elements;
  }

  public StreamerElement getElement(final String name) {
    for (final StreamerElement e : elements)
      if (e.getName().equals(name))
        return e;
    return null;
  }

  /**
   * @return the checksum of the layout, either computed or the one stored in the file the layout was read from
   */
  public int getChecksum() {
    return checksum;
  }

  /**
   * @return the classes this layout embeds, excluding strings
   */
  public List<String> getDependencies() {
    final List<String> result = new ArrayList<>();
    for (final StreamerElement e : elements)
      if (e.getClassName() != null && !StreamerElement.STRING_CLASS.equals(e.getClassName()) && !result.contains(e.getClassName()))
        result.add(e.getClassName());
    return result;
  }

  /**
   * Legacy hash: {@code id = id * 3 + c} over the class name, then over every field name and type name, array dimensions and
   * the count of variable arrays. Base classes contribute their name only.
   */
  private int computeChecksum() {
    int id = hash(0, className);
    for (final StreamerElement e : elements) {
      id = hash(id, e.getName());
      if (e.getKind() == FieldKind.BASE)
        continue;
      id = hash(id, e.getTypeName());
      if (e.getKind() == FieldKind.FIXED_ARRAY)
        id = id * 3 + e.getArrayLength();
      else if (e.getKind() == FieldKind.VARIABLE_ARRAY)
        id = hash(id, e.getCountName());
    }
    return id;
  }

  private static int hash(int id, final String text) {
    for (final byte b : text.getBytes(StandardCharsets.UTF_8))
      id = id * 3 + b;
    return id;
  }

  private void checkCounts() {
    for (int i = 0; i < elements.size(); i++) {
      final StreamerElement e = elements.get(i);
      if (e.getKind() != FieldKind.VARIABLE_ARRAY)
        continue;

      boolean found = false;
      for (int j = 0; j < i; j++) {
        final StreamerElement c = elements.get(j);
        if (c.getName().equals(e.getCountName())) {
          if (!c.getKind().isNumeric() || c.getKind() == FieldKind.BOOL || c.getKind() == FieldKind.FLOAT32
              || c.getKind() == FieldKind.FLOAT64)
            throw new IllegalArgumentException("Count field '" + c.getName() + "' of '" + e.getName() + "' is not an integer");
          found = true;
          break;
        }
      }
      if (!found)
        throw new IllegalArgumentException(
            "Count field '" + e.getCountName() + "' of '" + e.getName() + "' must be declared before it in class '" + className + "'");
    }
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof StreamerInfo))
      return false;
    final StreamerInfo that = (StreamerInfo) o;
    return version == that.version && className.equals(that.className) && elements.equals(that.elements);
  }

  @Override
  public int hashCode() {
    return Objects.hash(className, version, elements);
  }

  @Override
  public String toString() {
    return "StreamerInfo{" + className + " v" + version + " " + elements + "}";
  }
}
