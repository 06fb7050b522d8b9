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
package com.rootio.binary;

/**
 * Packed {@code (byteCount, version)} pair preceding every streamed object. The byte count covers everything after the count
 * field itself, version included. Legacy writers may omit the count: in that case {@link #getByteCount()} returns -1 and the
 * object cannot be skipped.
 */
public class ObjectHeader {
  public static final int BYTE_COUNT_MASK = 0x40000000;

  private final int   position;
  private final long  byteCount;
  private final short version;

  public ObjectHeader(final int position, final long byteCount, final short version) {
    this.position = position;
    this.byteCount = byteCount;
    this.version = version;
  }

  /**
   * @return the buffer position where the header starts.
   */
  public int getPosition() {
    return position;
  }

  public long getByteCount() {
    return byteCount;
  }

  public boolean hasByteCount() {
    return byteCount >= 0;
  }

  public short getVersion() {
    return version;
  }

  /**
   * @return the buffer position right after the object, or -1 if the header carries no byte count.
   */
  public int getEnd() {
    return hasByteCount() ? (int) (position + Binary.INT_SERIALIZED_SIZE + byteCount) : -1;
  }

  @Override
  public String toString() {
    return "ObjectHeader{pos=" + position + ", byteCount=" + byteCount + ", version=" + version + "}";
  }
}
