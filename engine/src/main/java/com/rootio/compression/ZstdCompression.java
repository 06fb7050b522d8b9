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

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdException;
import com.rootio.exception.CorruptionException;
import com.rootio.exception.ErrorCode;

import java.util.Arrays;

/**
 * Zstandard compression through the zstd-jni bindings.
 */
public class ZstdCompression implements Compression {
  @Override
  public CompressionAlgorithm getAlgorithm() {
    return CompressionAlgorithm.ZSTD;
  }

  @Override
  public byte getMethod() {
    return 1;
  }

  @Override
  public byte[] compress(final byte[] src, final int offset, final int length, final int level) {
    final byte[] input = offset == 0 && length == src.length ? src : Arrays.copyOfRange(src, offset, offset + length);
    return Zstd.compress(input, level);
  }

  @Override
  public int decompress(final byte[] src, final int srcOffset, final int srcLength, final byte[] dst, final int dstOffset,
      final int dstLength) {
    final long result;
    try {
      result = Zstd.decompressByteArray(dst, dstOffset, dstLength, src, srcOffset, srcLength);
    } catch (final ZstdException e) {
      throw new CorruptionException(ErrorCode.CORRUPT_BLOCK, "Invalid zstd block", e);
    }
    if (Zstd.isError(result))
      throw new CorruptionException(ErrorCode.CORRUPT_BLOCK, "Invalid zstd block: " + Zstd.getErrorName(result));
    return (int) result;
  }
}
