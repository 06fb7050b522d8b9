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
import org.tukaani.xz.LZMA2Options;
import org.tukaani.xz.UnsupportedOptionsException;
import org.tukaani.xz.XZ;
import org.tukaani.xz.XZInputStream;
import org.tukaani.xz.XZOutputStream;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * LZMA2 in the xz container format.
 */
public class LZMACompression implements Compression {
  @Override
  public CompressionAlgorithm getAlgorithm() {
    return CompressionAlgorithm.LZMA;
  }

  @Override
  public byte getMethod() {
    return 0;
  }

  @Override
  public byte[] compress(final byte[] src, final int offset, final int length, final int level) {
    final ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, length / 2));
    try {
      final LZMA2Options options = new LZMA2Options(Math.max(LZMA2Options.PRESET_MIN, Math.min(level, LZMA2Options.PRESET_MAX)));
      try (final XZOutputStream xz = new XZOutputStream(out, options, XZ.CHECK_CRC32)) {
        xz.write(src, offset, length);
      }
    } catch (final UnsupportedOptionsException e) {
      throw new IllegalArgumentException("Invalid LZMA level " + level, e);
    } catch (final IOException e) {
      // IN-MEMORY STREAMS DO NOT FAIL
      throw new UncheckedIOException(e);
    }
    return out.toByteArray();
  }

  @Override
  public int decompress(final byte[] src, final int srcOffset, final int srcLength, final byte[] dst, final int dstOffset,
      final int dstLength) {
    try (final XZInputStream in = new XZInputStream(new ByteArrayInputStream(src, srcOffset, srcLength))) {
      int total = 0;
      while (total < dstLength) {
        final int n = in.read(dst, dstOffset + total, dstLength - total);
        if (n < 0)
          break;
        total += n;
      }
      return total;
    } catch (final IOException e) {
      throw new CorruptionException(ErrorCode.CORRUPT_BLOCK, "Invalid xz block", e);
    }
  }
}
