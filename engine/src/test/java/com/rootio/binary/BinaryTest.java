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

import com.rootio.exception.ErrorCode;
import com.rootio.exception.StorageException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BinaryTest {

  @Test
  void scalarsAreBigEndian() {
    final Binary buffer = new Binary();
    buffer.putShort((short) 0x0102);
    buffer.putInt(0x03040506);
    buffer.putLong(0x0708090A0B0C0D0EL);

    assertThat(buffer.toByteArray()).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14);
  }

  @Test
  void writeAndReadEveryScalar() {
    final Binary buffer = new Binary(4);
    buffer.putByte((byte) -3);
    buffer.putUnsignedByte(250);
    buffer.putBoolean(true);
    buffer.putShort((short) -1234);
    buffer.putInt(Integer.MIN_VALUE);
    buffer.putUnsignedInt(0xFFFFFFF0L);
    buffer.putLong(Long.MAX_VALUE);
    buffer.putFloat(3.5F);
    buffer.putDouble(-2.25D);

    buffer.rewind();
    assertThat(buffer.getByte()).isEqualTo((byte) -3);
    assertThat(buffer.getUnsignedByte()).isEqualTo(250);
    assertThat(buffer.getBoolean()).isTrue();
    assertThat(buffer.getShort()).isEqualTo((short) -1234);
    assertThat(buffer.getInt()).isEqualTo(Integer.MIN_VALUE);
    assertThat(buffer.getUnsignedInt()).isEqualTo(0xFFFFFFF0L);
    assertThat(buffer.getLong()).isEqualTo(Long.MAX_VALUE);
    assertThat(buffer.getFloat()).isEqualTo(3.5F);
    assertThat(buffer.getDouble()).isEqualTo(-2.25D);
    assertThat(buffer.remaining()).isZero();
    assertThat(buffer.hasError()).isFalse();
  }

  @Test
  void shortAndLongStrings() {
    final String longString = "x".repeat(300);

    final Binary buffer = new Binary();
    buffer.putString("hello");
    buffer.putString(longString);
    buffer.putString(null);
    buffer.putCString("c-string");

    assertThat(buffer.size()).isEqualTo(
        Binary.getStringSize("hello") + Binary.getStringSize(longString) + Binary.getStringSize(null) + "c-string".length() + 1);
    assertThat(Binary.getStringSize(longString)).isEqualTo(1 + 4 + 300);

    buffer.rewind();
    assertThat(buffer.getString()).isEqualTo("hello");
    assertThat(buffer.getString()).isEqualTo(longString);
    assertThat(buffer.getString()).isEmpty();
    assertThat(buffer.getCString()).isEqualTo("c-string");
  }

  @Test
  void readPastTheEndSetsStickyError() {
    final Binary buffer = new Binary(new byte[] { 0, 1, 2 });

    assertThat(buffer.getShort()).isEqualTo((short) 1);
    assertThat(buffer.getInt()).isZero();
    assertThat(buffer.hasError()).isTrue();

    // EVERY FOLLOWING READ IS A NO-OP
    assertThat(buffer.getByte()).isZero();
    assertThat(buffer.position()).isEqualTo(2);

    assertThatThrownBy(buffer::checkError).isInstanceOf(StorageException.class)
        .satisfies(e -> assertThat(((StorageException) e).getErrorCode()).isEqualTo(ErrorCode.IO_ERROR));
  }

  @Test
  void fixedBufferCannotGrow() {
    final Binary buffer = new Binary(new byte[2], 0);
    buffer.putShort((short) 7);
    assertThat(buffer.hasError()).isFalse();

    buffer.putByte((byte) 1);
    assertThat(buffer.hasError()).isTrue();
    assertThat(buffer.size()).isEqualTo(2);
  }

  @Test
  void unterminatedCString() {
    final Binary buffer = new Binary(new byte[] { 'a', 'b' });
    assertThat(buffer.getCString()).isEmpty();
    assertThat(buffer.hasError()).isTrue();
  }

  @Test
  void invalidPosition() {
    final Binary buffer = new Binary(new byte[8]);
    buffer.position(8);
    assertThat(buffer.hasError()).isFalse();

    buffer.position(9);
    assertThat(buffer.hasError()).isTrue();
  }

  @Test
  void objectHeaderCountsBytesAfterTheCountField() {
    final Binary buffer = new Binary();
    final int countPosition = buffer.writeObjectHeader((short) 7);
    buffer.putInt(42);
    buffer.putString("abc");
    buffer.finishObjectHeader(countPosition);
    buffer.putByte((byte) 99);

    assertThat(buffer.getInt(0)).isEqualTo((2 + 4 + 4) | ObjectHeader.BYTE_COUNT_MASK);

    buffer.rewind();
    final ObjectHeader header = buffer.readObjectHeader();
    assertThat(header.hasByteCount()).isTrue();
    assertThat(header.getByteCount()).isEqualTo(10);
    assertThat(header.getVersion()).isEqualTo((short) 7);
    assertThat(header.getEnd()).isEqualTo(14);

    buffer.skipObject(header);
    assertThat(buffer.getByte()).isEqualTo((byte) 99);
  }

  @Test
  void objectHeaderWithoutByteCount() {
    final Binary buffer = new Binary();
    buffer.putShort((short) 3);
    buffer.putInt(5);

    buffer.rewind();
    final ObjectHeader header = buffer.readObjectHeader();
    assertThat(header.hasByteCount()).isFalse();
    assertThat(header.getVersion()).isEqualTo((short) 3);
    assertThat(buffer.getInt()).isEqualTo(5);

    buffer.skipObject(header);
    assertThat(buffer.hasError()).isTrue();
  }

  @Test
  void indexedAccessDoesNotMoveTheCursor() {
    final Binary buffer = new Binary();
    buffer.putLong(0);
    buffer.putInt(2, 0xCAFEBABE);

    assertThat(buffer.position()).isEqualTo(8);
    assertThat(buffer.getInt(2)).isEqualTo(0xCAFEBABE);
    assertThat(buffer.getShort(2)).isEqualTo((short) 0xCAFE);
  }

  @Test
  void growsPastTheAllocationChunk() {
    final Binary buffer = new Binary();
    buffer.setAllocationChunkSize(16);
    buffer.fill((byte) 1, 1000);
    buffer.putByteArray(new byte[] { 1, 2, 3 }, 1, 2);

    assertThat(buffer.size()).isEqualTo(1002);
    buffer.position(1000);
    assertThat(buffer.getBytes(2)).containsExactly(2, 3);
  }
}
