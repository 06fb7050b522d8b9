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
package com.rootio.engine;

import com.rootio.binary.Binary;
import com.rootio.exception.CorruptionException;
import com.rootio.exception.ErrorCode;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Fixed header at the beginning of every file. Versions from {@link #LARGE_FILE_VERSION} on store the seek pointers on 64 bits.
 */
public class FileHeader {
  public static final byte[] MAGIC              = "root".getBytes(StandardCharsets.US_ASCII);
  public static final int    FORMAT_VERSION     = 62600;
  public static final int    LARGE_FILE_VERSION = 1000000;
  public static final int    BEGIN              = 100;
  public static final short  UUID_VERSION       = 1;

  int    version    = FORMAT_VERSION + LARGE_FILE_VERSION;
  int    begin      = BEGIN;
  long   end        = BEGIN;
  long   seekFree;
  int    nbytesFree;
  int    nfree;
  int    nbytesName;
  byte   units      = 8;
  int    compress;
  long   seekInfo;
  int    nbytesInfo;
  UUID   uuid       = UUID.randomUUID();

  public static FileHeader read(final byte[] content) {
    final Binary buffer = new Binary(content);
    final byte[] magic = buffer.getBytes(MAGIC.length);
    if (buffer.hasError() || magic[0] != MAGIC[0] || magic[1] != MAGIC[1] || magic[2] != MAGIC[2] || magic[3] != MAGIC[3])
      throw new CorruptionException(ErrorCode.NOT_A_ROOT_FILE, "Invalid file signature");

    final FileHeader header = new FileHeader();
    header.version = buffer.getInt();
    header.begin = buffer.getInt();
    final boolean large = header.version >= LARGE_FILE_VERSION;
    if (large) {
      header.end = buffer.getLong();
      header.seekFree = buffer.getLong();
    } else {
      header.end = buffer.getUnsignedInt();
      header.seekFree = buffer.getUnsignedInt();
    }
    header.nbytesFree = buffer.getInt();
    header.nfree = buffer.getInt();
    header.nbytesName = buffer.getInt();
    header.units = buffer.getByte();
    header.compress = buffer.getInt();
    header.seekInfo = large ? buffer.getLong() : buffer.getUnsignedInt();
    header.nbytesInfo = buffer.getInt();
    buffer.getShort();
    final long msb = buffer.getLong();
    final long lsb = buffer.getLong();
    header.uuid = new UUID(msb, lsb);

    if (buffer.hasError())
      throw new CorruptionException(ErrorCode.NOT_A_ROOT_FILE, "Truncated file header", buffer.getError());
    if (header.begin < buffer.position() || header.end < header.begin)
      throw new CorruptionException(ErrorCode.NOT_A_ROOT_FILE,
          "Invalid file header (begin=" + header.begin + " end=" + header.end + ")");
    return header;
  }

  public byte[] toByteArray() {
    final Binary buffer = new Binary(begin);
    buffer.putByteArray(MAGIC);
    buffer.putInt(version);
    buffer.putInt(begin);
    buffer.putLong(end);
    buffer.putLong(seekFree);
    buffer.putInt(nbytesFree);
    buffer.putInt(nfree);
    buffer.putInt(nbytesName);
    buffer.putByte(units);
    buffer.putInt(compress);
    buffer.putLong(seekInfo);
    buffer.putInt(nbytesInfo);
    buffer.putShort(UUID_VERSION);
    buffer.putLong(uuid.getMostSignificantBits());
    buffer.putLong(uuid.getLeastSignificantBits());
    buffer.fill((byte) 0, begin - buffer.position());
    buffer.checkError();
    return buffer.toByteArray();
  }

  public int getVersion() {
    return version;
  }

  public long getEnd() {
    return end;
  }

  public UUID getUuid() {
    return uuid;
  }
}
