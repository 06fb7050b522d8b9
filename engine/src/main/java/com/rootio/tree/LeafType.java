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

import com.rootio.serializer.FieldKind;

/**
 * Value types of a leaf, with the one-character code used in branch titles ({@code px/F}).
 */
public enum LeafType {
  BOOL('O', FieldKind.BOOL), //
  INT8('B', FieldKind.INT8), //
  UINT8('b', FieldKind.UINT8), //
  INT16('S', FieldKind.INT16), //
  UINT16('s', FieldKind.UINT16), //
  INT32('I', FieldKind.INT32), //
  UINT32('i', FieldKind.UINT32), //
  INT64('L', FieldKind.INT64), //
  UINT64('l', FieldKind.UINT64), //
  FLOAT32('F', FieldKind.FLOAT32), //
  FLOAT64('D', FieldKind.FLOAT64), //
  STRING('C', FieldKind.STRING);

  private final char      code;
  private final FieldKind kind;

  LeafType(final char code, final FieldKind kind) {
    this.code = code;
    this.kind = kind;
  }

  public char getCode() {
    return code;
  }

  public FieldKind getKind() {
    return kind;
  }

  /**
   * @return the size of one value, 0 for strings
   */
  public int getSize() {
    return kind.getSize();
  }

  public static LeafType fromCode(final char code) {
    for (final LeafType t : values())
      if (t.code == code)
        return t;
    throw new IllegalArgumentException("Unknown leaf type code '" + code + "'");
  }
}
