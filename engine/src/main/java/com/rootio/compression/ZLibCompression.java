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
package com.rootio.compression;

import com.rootio.exception.CorruptionException;
import com.rootio.exception.ErrorCode;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Deflate with zlib framing.
 */
public class ZLibCompression implements Compression {
  private static final byte Z_DEFLATED = 8;

  @Override
  public CompressionAlgorithm getAlgorithm() {
    return CompressionAlgorithm.ZLIB;
  }

  @Override
  public byte getMethod() {
    return Z_DEFLATED;
  }

  @Override
  public byte[] compress(final byte[] src, final int offset, final int length, final int level) {
    final Deflater deflater = new Deflater(Math.max(Deflater.BEST_SPEED, Math.min(level, Deflater.BEST_COMPRESSION)));
    try {
      deflater.setInput(src, offset, length);
      deflater.finish();

      final ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, length / 2));
      final byte[] chunk = new byte[8192];
      while (!deflater.finished()) {
        final int n = deflater.deflate(chunk);
        out.write(chunk, 0, n);
      }
      return out.toByteArray();
    } finally {
      deflater.end();
    }
  }

  @Override
  public int decompress(final byte[] src, final int srcOffset, final int srcLength, final byte[] dst, final int dstOffset,
      final int dstLength) {
    final Inflater inflater = new Inflater();
    try {
      inflater.setInput(src, srcOffset, srcLength);
      int total = 0;
      while (total < dstLength && !inflater.finished()) {
        final int n = inflater.inflate(dst, dstOffset + total, dstLength - total);
        if (n == 0 && (inflater.needsInput() || inflater.needsDictionary()))
          break;
        total += n;
      }
      return total;
    } catch (final DataFormatException e) {
      throw new CorruptionException(ErrorCode.CORRUPT_BLOCK, "Invalid zlib block", e);
    } finally {
      inflater.end();
    }
  }
}
