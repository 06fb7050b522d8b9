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

import java.util.Objects;

/**
 * One field of a {@link StreamerInfo}. Fields are read and written strictly in declaration order.
 */
public class StreamerElement {
  public static final String STRING_CLASS  = "TString";
  public static final String TOBJECT_CLASS = "TObject";
  public static final String TNAMED_CLASS  = "TNamed";
  public static final int    TOBJECT_CODE  = 66;
  public static final int    TNAMED_CODE   = 67;

  private final String    name;
  private final FieldKind kind;
  private final FieldKind elementKind;
  private final int       arrayLength;
  private final String    countName;
  private final String    className;
  private final int       baseVersion;

  private StreamerElement(final String name, final FieldKind kind, final FieldKind elementKind, final int arrayLength,
      final String countName, final String className) {
    this(name, kind, elementKind, arrayLength, countName, className, 0);
  }

  private StreamerElement(final String name, final FieldKind kind, final FieldKind elementKind, final int arrayLength,
      final String countName, final String className, final int baseVersion) {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("Field name is empty");
    this.name = name;
    this.kind = kind;
    this.elementKind = elementKind;
    this.arrayLength = arrayLength;
    this.countName = countName;
    this.className = className;
    this.baseVersion = baseVersion;
  }

  public static StreamerElement primitive(final String name, final FieldKind kind) {
    if (!kind.isNumeric() && kind != FieldKind.STRING)
      throw new IllegalArgumentException("Kind " + kind + " is not a primitive");
    return new StreamerElement(name, kind, null, 0, null, null);
  }

  public static StreamerElement fixedArray(final String name, final FieldKind elementKind, final int length) {
    checkArrayElement(elementKind);
    if (length < 1)
      throw new IllegalArgumentException("Invalid array length " + length + " for field '" + name + "'");
    return new StreamerElement(name, FieldKind.FIXED_ARRAY, elementKind, length, null, null);
  }

  /**
   * An array whose length is the value of an integer field declared earlier in the same class.
   */
  public static StreamerElement variableArray(final String name, final FieldKind elementKind, final String countName) {
    checkArrayElement(elementKind);
    return new StreamerElement(name, FieldKind.VARIABLE_ARRAY, elementKind, 0, countName, null);
  }

  /**
   * A base class, streamed in front of the fields of the derived class. The element is named after the base class.
   */
  public static StreamerElement base(final String className, final int version) {
    return new StreamerElement(className, FieldKind.BASE, null, 0, null, className, version);
  }

  public static StreamerElement object(final String name, final String className) {
    return new StreamerElement(name, FieldKind.OBJECT, null, 0, null, className);
  }

  public static StreamerElement pointer(final String name, final String className) {
    return new StreamerElement(name, FieldKind.OBJECT_POINTER, null, 0, null, className);
  }

  public static StreamerElement container(final String name, final String elementClassName) {
    return new StreamerElement(name, FieldKind.CONTAINER, STRING_CLASS.equals(elementClassName) ? FieldKind.STRING : FieldKind.OBJECT,
        0, null, elementClassName);
  }

  public String getName() {
    return name;
  }

  public FieldKind getKind() {
    return kind;
  }

  public FieldKind getElementKind() {
    return elementKind;
  }

  public int getArrayLength() {
    return arrayLength;
  }

  public String getCountName() {
    return countName;
  }

  public String getClassName() {
    return className;
  }

  /**
   * @return the version of the base class for {@link FieldKind#BASE} elements, 0 otherwise
   */
  public int getBaseVersion() {
    return baseVersion;
  }

  /**
   * @return the data type code stored on disk. Arrays add their offset to the code of the element.
   */
  public int getTypeCode() {
    switch (kind) {
    case FIXED_ARRAY:
      return FieldKind.FIXED_ARRAY_OFFSET + elementKind.getTypeCode();
    case VARIABLE_ARRAY:
      return FieldKind.VARIABLE_ARRAY_OFFSET + elementKind.getTypeCode();
    case BASE:
      if (TOBJECT_CLASS.equals(className))
        return TOBJECT_CODE;
      return TNAMED_CLASS.equals(className) ? TNAMED_CODE : kind.getTypeCode();
    default:
      return kind.getTypeCode();
    }
  }

  /**
   * @return the stored type name: the element type for arrays (a pointer to it for variable ones), the class for objects
   */
  public String getTypeName() {
    switch (kind) {
    case FIXED_ARRAY:
      return elementKind.getTypeName();
    case VARIABLE_ARRAY:
      return elementKind.getTypeName() + "*";
    case OBJECT:
      return className;
    case OBJECT_POINTER:
      return className + "*";
    case CONTAINER:
      return "vector<" + (elementKind == FieldKind.STRING ? "string" : className) + ">";
    default:
      return kind.getTypeName();
    }
  }

  private static void checkArrayElement(final FieldKind elementKind) {
    if (!elementKind.isNumeric())
      throw new IllegalArgumentException("Arrays can only hold numeric values, found " + elementKind);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof StreamerElement))
      return false;
    final StreamerElement that = (StreamerElement) o;
    return arrayLength == that.arrayLength && baseVersion == that.baseVersion && name.equals(that.name) && kind == that.kind && elementKind == that.elementKind
        && Objects.equals(countName, that.countName) && Objects.equals(className, that.className);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind, elementKind, arrayLength, countName, className, baseVersion);
  }

  @Override
  public String toString() {
    switch (kind) {
    case BASE:
      return "BASE " + name + " v" + baseVersion;
    case FIXED_ARRAY:
      return getTypeName() + " " + name + "[" + arrayLength + "]";
    case VARIABLE_ARRAY:
      return getTypeName() + " " + name + "[" + countName + "]";
    default:
      return getTypeName() + " " + name;
    }
  }
}
