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

/**
 * Splits payloads in compressed envelopes and chains them back.
 * <p>
 * Every envelope starts with a 9-byte header: 2-byte algorithm tag, 1-byte method, 3-byte compressed size and 3-byte uncompressed
 * size, both sizes little-endian. Payloads bigger than {@link #MAX_CHUNK_SIZE} are split in consecutive envelopes. A payload that
 * does not shrink is stored as is, without envelopes: readers recognize it because its stored length equals the declared one.
 */
public class BlockCodec {
  public static final int HEADER_SIZE    = 9;
  public static final int MAX_CHUNK_SIZE = 0xffffff;

  private BlockCodec() {
  }

  public static byte[] compress(final byte[] src, final CompressionSettings settings) {
    return compress(src, 0, src.length, settings);
  }

  /**
   * @return the envelopes, or a copy of the input if compression is disabled or would not reduce the size
   */
  public static byte[] compress(final byte[] src, final int offset, final int length, final CompressionSettings settings) {
    if (settings.isStore() || length == 0)
      return copy(src, offset, length);

    final Compression compression = CompressionFactory.getCompression(settings.getAlgorithm());
    final ByteArrayOutputStream out = new ByteArrayOutputStream(length / 2 + HEADER_SIZE);

    for (int pos = 0; pos < length; ) {
      final int chunkLength = Math.min(MAX_CHUNK_SIZE, length - pos);
      final byte[] compressed = compression.compress(src, offset + pos, chunkLength, settings.getLevel());
      if (compressed.length > MAX_CHUNK_SIZE || compressed.length + HEADER_SIZE >= chunkLength)
        return copy(src, offset, length);

      final byte[] tag = compression.getAlgorithm().getTag();
      out.write(tag[0]);
      out.write(tag[1]);
      out.write(compression.getMethod());
      writeSize(out, compressed.length);
      writeSize(out, chunkLength);
      out.write(compressed, 0, compressed.length);

      pos += chunkLength;
    }

    final byte[] result = out.toByteArray();
    return result.length < length ? result : copy(src, offset, length);
  }

  public static byte[] decompress(final byte[] src, final int uncompressedLength) {
    return decompress(src, 0, src.length, uncompressedLength);
  }

  /**
   * Decodes the chained envelopes until {@code uncompressedLength} bytes are produced.
   *
   * @throws CorruptionException on unknown tags, truncated envelopes, size mismatches or trailing bytes
   */
  public static byte[] decompress(final byte[] src, final int offset, final int length, final int uncompressedLength) {
    if (length == uncompressedLength)
      return copy(src, offset, length);

    final byte[] dst = new byte[uncompressedLength];
    int srcPos = offset;
    final int srcEnd = offset + length;
    int dstPos = 0;

    while (dstPos < uncompressedLength) {
      if (srcEnd - srcPos < HEADER_SIZE)
        throw corrupted("Truncated envelope header at offset " + (srcPos - offset), uncompressedLength);

      final CompressionAlgorithm algorithm = CompressionAlgorithm.fromTag(src[srcPos], src[srcPos + 1]);
      if (algorithm == null)
        throw corrupted("Unknown compression tag '" + (char) src[srcPos] + (char) src[srcPos + 1] + "'", uncompressedLength);

      final int compressedSize = readSize(src, srcPos + 3);
      final int chunkSize = readSize(src, srcPos + 6);
      srcPos += HEADER_SIZE;

      if (compressedSize > srcEnd - srcPos)
        throw corrupted("Envelope declares " + compressedSize + " compressed bytes but only " + (srcEnd - srcPos) + " are available",
            uncompressedLength);
      if (chunkSize > uncompressedLength - dstPos)
        throw corrupted("Envelope declares " + chunkSize + " bytes past the expected payload end", uncompressedLength);

      final int produced = CompressionFactory.getCompression(algorithm).decompress(src, srcPos, compressedSize, dst, dstPos, chunkSize);
      if (produced != chunkSize)
        throw corrupted("Envelope decompressed to " + produced + " bytes instead of " + chunkSize, uncompressedLength);

      srcPos += compressedSize;
      dstPos += chunkSize;
    }

    if (srcPos != srcEnd)
      throw corrupted((srcEnd - srcPos) + " trailing bytes after the last envelope", uncompressedLength);

    return dst;
  }

  private static CorruptionException corrupted(final String message, final int uncompressedLength) {
    final CorruptionException e = new CorruptionException(ErrorCode.CORRUPT_BLOCK, message);
    e.addContext("uncompressedLength", uncompressedLength);
    return e;
  }

  private static void writeSize(final ByteArrayOutputStream out, final int size) {
    out.write(size & 0xff);
    out.write((size >> 8) & 0xff);
    out.write((size >> 16) & 0xff);
  }

  private static int readSize(final byte[] src, final int offset) {
    return (src[offset] & 0xff) | ((src[offset + 1] & 0xff) << 8) | ((src[offset + 2] & 0xff) << 16);
  }

  private static byte[] copy(final byte[] src, final int offset, final int length) {
    final byte[] result = new byte[length];
    System.arraycopy(src, offset, result, 0, length);
    return result;
  }
}
