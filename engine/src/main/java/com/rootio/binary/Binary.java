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

import com.rootio.GlobalConfiguration;
import com.rootio.exception.ErrorCode;
import com.rootio.exception.RootIOException;
import com.rootio.exception.StorageException;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Binary cursor backed by a Java Byte Buffer. All the multi-byte values are big-endian.
 * <p>
 * The first failing operation records its error and turns the cursor into a sticky-error state: every following read returns a
 * zero value and every following write is ignored. Chains of calls can then be checked once at the end with {@link #checkError()}.
 *
 * @author Luca Garulli
 */
public class Binary {
  public static final int BYTE_SERIALIZED_SIZE   = 1;
  public static final int SHORT_SERIALIZED_SIZE  = 2;
  public static final int INT_SERIALIZED_SIZE    = 4;
  public static final int LONG_SERIALIZED_SIZE   = 8;
  public static final int FLOAT_SERIALIZED_SIZE  = 4;
  public static final int DOUBLE_SERIALIZED_SIZE = 8;

  /**
   * Strings longer than this are prefixed by the marker byte followed by an int32 length.
   */
  public static final int LONG_STRING_MARKER = 255;

  protected boolean         autoResizable = true;
  protected byte[]          content;
  protected ByteBuffer      buffer;
  protected int             size;
  protected int             allocationChunkSize;
  private   RootIOException error;
  private   int             displacement;
  private   ObjectTags      objectTags;

  public Binary() {
    this.allocationChunkSize = GlobalConfiguration.BINARY_ALLOCATION_CHUNK.getValueAsInteger();
    this.content = new byte[allocationChunkSize];
    this.buffer = ByteBuffer.wrap(content);
    size = 0;
  }

  public Binary(final int initialSize) {
    this.allocationChunkSize = GlobalConfiguration.BINARY_ALLOCATION_CHUNK.getValueAsInteger();
    this.content = new byte[initialSize];
    this.buffer = ByteBuffer.wrap(content);
    size = 0;
  }

  public Binary(final byte[] buffer) {
    this(buffer, buffer.length);
  }

  public Binary(final byte[] buffer, final int contentSize) {
    this.allocationChunkSize = GlobalConfiguration.BINARY_ALLOCATION_CHUNK.getValueAsInteger();
    this.content = buffer;
    this.buffer = ByteBuffer.wrap(content);
    this.size = contentSize;
    this.autoResizable = false;
  }

  public void clear() {
    size = 0;
    error = null;
    objectTags = null;
    buffer.clear();
    buffer.position(0);
  }

  public void rewind() {
    buffer.position(0);
  }

  public void setAutoResizable(final boolean autoResizable) {
    this.autoResizable = autoResizable;
  }

  public int getAllocationChunkSize() {
    return allocationChunkSize;
  }

  public void setAllocationChunkSize(final int allocationChunkSize) {
    this.allocationChunkSize = allocationChunkSize;
  }

  /**
   * @return the offset of this buffer in the key it is stored in. Class tags reference positions in key coordinates.
   */
  public int getDisplacement() {
    return displacement;
  }

  public void setDisplacement(final int displacement) {
    this.displacement = displacement;
  }

  /**
   * @return the class tags met so far in this buffer, created on first use
   */
  public ObjectTags getObjectTags() {
    if (objectTags == null)
      objectTags = new ObjectTags();
    return objectTags;
  }

  // ERROR STATE

  public boolean hasError() {
    return error != null;
  }

  public RootIOException getError() {
    return error;
  }

  /**
   * Throws the first error recorded by this cursor, if any.
   */
  public void checkError() {
    if (error != null)
      throw error;
  }

  /**
   * Records an error. Only the first one is kept.
   */
  public void setError(final RootIOException e) {
    if (error == null)
      error = e;
  }

  // POSITION

  public int position() {
    return buffer.position();
  }

  public void position(final int index) {
    if (error != null)
      return;
    if (index < 0 || index > size) {
      setError(new StorageException(ErrorCode.IO_ERROR, "Invalid position " + index + " (size=" + size + ")"));
      return;
    }
    buffer.position(index);
  }

  public void skip(final int bytes) {
    position(buffer.position() + bytes);
  }

  public int size() {
    return size;
  }

  public int remaining() {
    return size - buffer.position();
  }

  public byte[] getContent() {
    return content;
  }

  public byte[] toByteArray() {
    return Arrays.copyOf(content, size);
  }

  // WRITE

  public void putByte(final byte value) {
    if (checkForAllocation(buffer.position(), BYTE_SERIALIZED_SIZE))
      buffer.put(value);
  }

  public void putUnsignedByte(final int value) {
    putByte((byte) value);
  }

  public void putBoolean(final boolean value) {
    putByte((byte) (value ? 1 : 0));
  }

  public void putShort(final short value) {
    if (checkForAllocation(buffer.position(), SHORT_SERIALIZED_SIZE))
      buffer.putShort(value);
  }

  public void putShort(final int index, final short value) {
    if (checkForAllocation(index, SHORT_SERIALIZED_SIZE))
      buffer.putShort(index, value);
  }

  public void putInt(final int value) {
    if (checkForAllocation(buffer.position(), INT_SERIALIZED_SIZE))
      buffer.putInt(value);
  }

  public void putInt(final int index, final int value) {
    if (checkForAllocation(index, INT_SERIALIZED_SIZE))
      buffer.putInt(index, value);
  }

  public void putUnsignedInt(final long value) {
    putInt((int) value);
  }

  public void putLong(final long value) {
    if (checkForAllocation(buffer.position(), LONG_SERIALIZED_SIZE))
      buffer.putLong(value);
  }

  public void putLong(final int index, final long value) {
    if (checkForAllocation(index, LONG_SERIALIZED_SIZE))
      buffer.putLong(index, value);
  }

  public void putFloat(final float value) {
    if (checkForAllocation(buffer.position(), FLOAT_SERIALIZED_SIZE))
      buffer.putFloat(value);
  }

  public void putDouble(final double value) {
    if (checkForAllocation(buffer.position(), DOUBLE_SERIALIZED_SIZE))
      buffer.putDouble(value);
  }

  public void putByteArray(final byte[] value) {
    putByteArray(value, 0, value.length);
  }

  public void putByteArray(final byte[] value, final int offset, final int length) {
    if (length > 0 && checkForAllocation(buffer.position(), length))
      buffer.put(value, offset, length);
  }

  public void fill(final byte filler, final int length) {
    if (length > 0 && checkForAllocation(buffer.position(), length))
      for (int i = 0; i < length; ++i)
        buffer.put(filler);
  }

  /**
   * Writes a string prefixed by its length: one byte for short strings, the {@link #LONG_STRING_MARKER} followed by an int32 for
   * longer ones.
   */
  public void putString(final String value) {
    final byte[] bytes = value != null ? value.getBytes(StandardCharsets.UTF_8) : new byte[0];
    if (bytes.length < LONG_STRING_MARKER)
      putUnsignedByte(bytes.length);
    else {
      putUnsignedByte(LONG_STRING_MARKER);
      putInt(bytes.length);
    }
    putByteArray(bytes);
  }

  /**
   * Writes a zero-terminated string.
   */
  public void putCString(final String value) {
    putByteArray(value.getBytes(StandardCharsets.UTF_8));
    putByte((byte) 0);
  }

  public static int getStringSize(final String value) {
    final int len = value != null ? value.getBytes(StandardCharsets.UTF_8).length : 0;
    return len < LONG_STRING_MARKER ? BYTE_SERIALIZED_SIZE + len : BYTE_SERIALIZED_SIZE + INT_SERIALIZED_SIZE + len;
  }

  // READ

  public byte getByte() {
    return checkForRead(BYTE_SERIALIZED_SIZE) ? buffer.get() : 0;
  }

  public int getUnsignedByte() {
    return getByte() & 0xFF;
  }

  public boolean getBoolean() {
    return getByte() != 0;
  }

  public short getShort() {
    return checkForRead(SHORT_SERIALIZED_SIZE) ? buffer.getShort() : 0;
  }

  public short getShort(final int index) {
    return checkForRead(index, SHORT_SERIALIZED_SIZE) ? buffer.getShort(index) : 0;
  }

  public int getUnsignedShort() {
    return getShort() & 0xFFFF;
  }

  public int getInt() {
    return checkForRead(INT_SERIALIZED_SIZE) ? buffer.getInt() : 0;
  }

  public int getInt(final int index) {
    return checkForRead(index, INT_SERIALIZED_SIZE) ? buffer.getInt(index) : 0;
  }

  public long getUnsignedInt() {
    return getInt() & 0xFFFFFFFFL;
  }

  public long getLong() {
    return checkForRead(LONG_SERIALIZED_SIZE) ? buffer.getLong() : 0;
  }

  public long getLong(final int index) {
    return checkForRead(index, LONG_SERIALIZED_SIZE) ? buffer.getLong(index) : 0;
  }

  public float getFloat() {
    return checkForRead(FLOAT_SERIALIZED_SIZE) ? buffer.getFloat() : 0F;
  }

  public double getDouble() {
    return checkForRead(DOUBLE_SERIALIZED_SIZE) ? buffer.getDouble() : 0D;
  }

  public void getByteArray(final byte[] destination) {
    getByteArray(destination, 0, destination.length);
  }

  public void getByteArray(final byte[] destination, final int offset, final int length) {
    if (checkForRead(length))
      buffer.get(destination, offset, length);
  }

  public byte[] getBytes(final int length) {
    if (length < 0) {
      setError(new StorageException(ErrorCode.IO_ERROR, "Invalid negative length " + length));
      return new byte[0];
    }
    if (!checkForRead(length))
      return new byte[0];
    final byte[] result = new byte[length];
    buffer.get(result);
    return result;
  }

  public String getString() {
    int length = getUnsignedByte();
    if (length == LONG_STRING_MARKER)
      length = getInt();
    if (error != null)
      return "";
    return new String(getBytes(length), StandardCharsets.UTF_8);
  }

  public String getCString() {
    if (error != null)
      return "";
    final int start = buffer.position();
    int end = start;
    while (end < size && content[end] != 0)
      ++end;
    if (end >= size) {
      setError(new StorageException(ErrorCode.IO_ERROR, "Unterminated string at position " + start));
      return "";
    }
    final String result = new String(content, start, end - start, StandardCharsets.UTF_8);
    buffer.position(end + 1);
    return result;
  }

  // OBJECT HEADERS

  /**
   * Writes an object header with a placeholder byte count.
   *
   * @return the position of the byte count, to pass to {@link #finishObjectHeader(int)} once the object is written
   */
  public int writeObjectHeader(final short version) {
    final int countPosition = buffer.position();
    putInt(0);
    putShort(version);
    return countPosition;
  }

  /**
   * Patches the byte count of an object header written by {@link #writeObjectHeader(short)} with the bytes written since then.
   */
  public void finishObjectHeader(final int countPosition) {
    final int byteCount = buffer.position() - countPosition - INT_SERIALIZED_SIZE;
    putInt(countPosition, byteCount | ObjectHeader.BYTE_COUNT_MASK);
  }

  public ObjectHeader readObjectHeader() {
    final int start = buffer.position();
    final long raw = getUnsignedInt();
    if (error != null)
      return new ObjectHeader(start, -1, (short) 0);

    if ((raw & ObjectHeader.BYTE_COUNT_MASK) != 0)
      return new ObjectHeader(start, raw & ~ObjectHeader.BYTE_COUNT_MASK, getShort());

    // NO BYTE COUNT: THE FIRST TWO BYTES ARE THE VERSION
    buffer.position(start);
    return new ObjectHeader(start, -1, getShort());
  }

  /**
   * Moves past the object described by the header. The header must carry a byte count.
   */
  public void skipObject(final ObjectHeader header) {
    if (!header.hasByteCount()) {
      setError(new StorageException(ErrorCode.IO_ERROR, "Cannot skip an object without byte count at position " + header.getPosition()));
      return;
    }
    position(header.getEnd());
  }

  @Override
  public String toString() {
    return "Binary size=" + size + " pos=" + buffer.position() + (error != null ? " error=" + error.getMessage() : "");
  }

  private boolean checkForRead(final int bytesToRead) {
    return checkForRead(buffer.position(), bytesToRead);
  }

  private boolean checkForRead(final int offset, final int bytesToRead) {
    if (error != null)
      return false;
    if (offset < 0 || offset + bytesToRead > size) {
      setError(new StorageException(ErrorCode.IO_ERROR,
          "Cannot read " + bytesToRead + " bytes at position " + offset + " (size=" + size + ")"));
      return false;
    }
    return true;
  }

  /**
   * Allocates enough space and updates the size according to the bytes to write.
   *
   * @return false if the cursor is in error state or cannot grow
   */
  protected boolean checkForAllocation(final int offset, final int bytesToWrite) {
    if (error != null)
      return false;

    if (offset + bytesToWrite > content.length) {
      if (!autoResizable) {
        setError(new StorageException(ErrorCode.IO_ERROR, "Cannot resize the buffer (autoResizable=false)"));
        return false;
      }

      final int newSize;
      if (offset + bytesToWrite > allocationChunkSize)
        newSize = (((offset + bytesToWrite) / allocationChunkSize) + 1) * allocationChunkSize;
      else
        newSize = allocationChunkSize;

      final byte[] newContent = new byte[newSize];
      System.arraycopy(content, 0, newContent, 0, content.length);
      this.content = newContent;

      final int oldPosition = this.buffer.position();
      this.buffer = ByteBuffer.wrap(this.content);
      this.buffer.position(oldPosition);
    }

    if (offset + bytesToWrite > size)
      size = offset + bytesToWrite;
    return true;
  }
}
