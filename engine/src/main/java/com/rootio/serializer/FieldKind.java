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

/**
 * Kinds of fields a {@link StreamerElement} can describe. Primitive kinds carry the legacy data type code and their size on disk.
 */
public enum FieldKind {
  BOOL(18, 1, "Bool_t"), //
  INT8(1, 1, "Char_t"), //
  INT16(2, 2, "Short_t"), //
  INT32(3, 4, "Int_t"), //
  INT64(16, 8, "Long64_t"), //
  UINT8(11, 1, "UChar_t"), //
  UINT16(12, 2, "UShort_t"), //
  UINT32(13, 4, "UInt_t"), //
  UINT64(17, 8, "ULong64_t"), //
  FLOAT32(5, 4, "Float_t"), //
  FLOAT64(8, 8, "Double_t"), //
  STRING(65, 0, "TString"), //
  FIXED_ARRAY(20, 0, null), //
  VARIABLE_ARRAY(40, 0, null), //
  BASE(0, 0, "BASE"), //
  OBJECT(62, 0, null), //
  OBJECT_POINTER(64, 0, null), //
  CONTAINER(500, 0, null);

  public static final int FIXED_ARRAY_OFFSET    = 20;
  public static final int VARIABLE_ARRAY_OFFSET = 40;

  private final int    typeCode;
  private final int    size;
  private final String typeName;

  FieldKind(final int typeCode, final int size, final String typeName) {
    this.typeCode = typeCode;
    this.size = size;
    this.typeName = typeName;
  }

  public int getTypeCode() {
    return typeCode;
  }

  /**
   * @return the size in bytes of one value, 0 for non-numeric kinds
   */
  public int getSize() {
    return size;
  }

  public String getTypeName() {
    return typeName;
  }

  /**
   * @return true for the fixed-size kinds that can be packed in arrays
   */
  public boolean isNumeric() {
    return size > 0;
  }

  /**
   * Maps a stored data type code to a numeric kind. Legacy codes of the same width are accepted as aliases: {@code Long_t} (4),
   * {@code ULong_t} (14), the counter (6) and bit fields (15).
   *
   * @return the kind, or null if the code has no numeric counterpart
   */
  public static FieldKind fromPrimitiveTypeCode(final int code) {
    switch (code) {
    case 4:
      return INT64;
    case 6:
      return INT32;
    case 14:
      return UINT64;
    case 15:
      return UINT32;
    default:
      for (final FieldKind k : values())
        if (k.isNumeric() && k.typeCode == code)
          return k;
      return null;
    }
  }
}
