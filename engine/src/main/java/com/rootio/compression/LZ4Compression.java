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

import com.rootio.GlobalConfiguration;
import com.rootio.exception.CorruptionException;
import com.rootio.exception.ErrorCode;
import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4SafeDecompressor;
import net.jpountz.xxhash.XXHash64;
import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;

/**
 * Compression implementation that uses the popular LZ4 algorithm. Every block is prefixed by the big-endian XXH64 checksum of the
 * compressed bytes.
 */
public class LZ4Compression implements Compression {
  public static final  int CHECKSUM_SIZE    = 8;
  private static final int HIGH_LEVEL_START = 4;

  private final LZ4Factory          factory;
  private final LZ4Compressor       compressor;
  private final LZ4SafeDecompressor decompressor;
  private final XXHash64            hash;

  public LZ4Compression() {
    this.factory = LZ4Factory.fastestInstance();
    this.compressor = factory.fastCompressor();
    this.decompressor = factory.safeDecompressor();
    this.hash = XXHashFactory.fastestInstance().hash64();
  }

  @Override
  public CompressionAlgorithm getAlgorithm() {
    return CompressionAlgorithm.LZ4;
  }

  @Override
  public byte getMethod() {
    return 1;
  }

  @Override
  public byte[] compress(final byte[] src, final int offset, final int length, final int level) {
    final LZ4Compressor c = level >= HIGH_LEVEL_START ? factory.highCompressor(level) : compressor;

    final int maxCompressedLength = c.maxCompressedLength(length);
    final byte[] compressed = new byte[CHECKSUM_SIZE + maxCompressedLength];
    final int compressedLength = c.compress(src, offset, length, compressed, CHECKSUM_SIZE, maxCompressedLength);

    ByteBuffer.wrap(compressed).putLong(0, hash.hash(compressed, CHECKSUM_SIZE, compressedLength, 0));

    final byte[] result = new byte[CHECKSUM_SIZE + compressedLength];
    System.arraycopy(compressed, 0, result, 0, result.length);
    return result;
  }

  @Override
  public int decompress(final byte[] src, final int srcOffset, final int srcLength, final byte[] dst, final int dstOffset,
      final int dstLength) {
    if (srcLength < CHECKSUM_SIZE)
      throw new CorruptionException(ErrorCode.CORRUPT_BLOCK, "LZ4 block too short: " + srcLength + " bytes");

    if (GlobalConfiguration.LZ4_VERIFY_CHECKSUM.getValueAsBoolean()) {
      final long expected = ByteBuffer.wrap(src, srcOffset, CHECKSUM_SIZE).getLong();
      final long actual = hash.hash(src, srcOffset + CHECKSUM_SIZE, srcLength - CHECKSUM_SIZE, 0);
      if (expected != actual)
        throw new CorruptionException(ErrorCode.CORRUPT_BLOCK,
            "LZ4 checksum mismatch: expected " + Long.toHexString(expected) + " found " + Long.toHexString(actual));
    }

    try {
      return decompressor.decompress(src, srcOffset + CHECKSUM_SIZE, srcLength - CHECKSUM_SIZE, dst, dstOffset, dstLength);
    } catch (final LZ4Exception e) {
      throw new CorruptionException(ErrorCode.CORRUPT_BLOCK, "Invalid LZ4 block", e);
    }
  }
}
