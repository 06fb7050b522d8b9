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

import com.rootio.ContextConfiguration;
import com.rootio.GlobalConfiguration;
import com.rootio.exception.CorruptionException;
import com.rootio.exception.ErrorCode;
import com.rootio.exception.RootIOException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompressionTest {

  @ParameterizedTest
  @EnumSource(value = CompressionAlgorithm.class, names = "NONE", mode = EnumSource.Mode.EXCLUDE)
  void compressAndDecompress(final CompressionAlgorithm algorithm) {
    final byte[] payload = compressible(100_000);
    final CompressionSettings settings = new CompressionSettings(algorithm, 5);

    final byte[] compressed = BlockCodec.compress(payload, settings);
    assertThat(compressed.length).isLessThan(payload.length);
    assertThat(CompressionAlgorithm.fromTag(compressed[0], compressed[1])).isEqualTo(algorithm);

    assertThat(BlockCodec.decompress(compressed, payload.length)).isEqualTo(payload);
  }

  @ParameterizedTest
  @EnumSource(value = CompressionAlgorithm.class, names = "NONE", mode = EnumSource.Mode.EXCLUDE)
  void tinyPayloadsAreStored(final CompressionAlgorithm algorithm) {
    final CompressionSettings settings = new CompressionSettings(algorithm, 1);

    assertThat(BlockCodec.compress(new byte[0], settings)).isEmpty();
    assertThat(BlockCodec.compress(new byte[] { 42 }, settings)).containsExactly(42);
    assertThat(BlockCodec.decompress(new byte[] { 42 }, 1)).containsExactly(42);
  }

  @Test
  void incompressiblePayloadIsStored() {
    final byte[] payload = new byte[4096];
    new Random(7).nextBytes(payload);

    final byte[] result = BlockCodec.compress(payload, new CompressionSettings(CompressionAlgorithm.ZLIB, 9));
    assertThat(result).isEqualTo(payload);
    assertThat(BlockCodec.decompress(result, payload.length)).isEqualTo(payload);
  }

  @Test
  void storeSettingsNeverCompress() {
    final byte[] payload = compressible(10_000);
    assertThat(BlockCodec.compress(payload, CompressionSettings.STORE)).isEqualTo(payload);
    assertThat(BlockCodec.compress(payload, new CompressionSettings(CompressionAlgorithm.ZSTD, 0))).isEqualTo(payload);
  }

  @ParameterizedTest
  @EnumSource(value = CompressionAlgorithm.class, names = "NONE", mode = EnumSource.Mode.EXCLUDE)
  void payloadsAboveTheChunkCeilingUseSeveralEnvelopes(final CompressionAlgorithm algorithm) {
    final byte[] payload = compressible(BlockCodec.MAX_CHUNK_SIZE + 1000);

    final byte[] compressed = BlockCodec.compress(payload, new CompressionSettings(algorithm, 1));

    // SECOND ENVELOPE DECLARES THE REMAINING 1000 BYTES
    final int firstCompressedSize = size(compressed, 3);
    assertThat(size(compressed, 6)).isEqualTo(BlockCodec.MAX_CHUNK_SIZE);
    final int second = BlockCodec.HEADER_SIZE + firstCompressedSize;
    assertThat(CompressionAlgorithm.fromTag(compressed[0], compressed[1])).isEqualTo(algorithm);
    assertThat(CompressionAlgorithm.fromTag(compressed[second], compressed[second + 1])).isEqualTo(algorithm);
    assertThat(size(compressed, second + 6)).isEqualTo(1000);

    assertThat(BlockCodec.decompress(compressed, payload.length)).isEqualTo(payload);
  }

  @Test
  void envelopeHeaderLayout() {
    final byte[] payload = compressible(5000);
    final byte[] compressed = BlockCodec.compress(payload, new CompressionSettings(CompressionAlgorithm.ZLIB, 6));

    assertThat(new String(compressed, 0, 2, StandardCharsets.US_ASCII)).isEqualTo("ZL");
    assertThat(compressed[2]).isEqualTo((byte) 8);
    assertThat(size(compressed, 3)).isEqualTo(compressed.length - BlockCodec.HEADER_SIZE);
    assertThat(size(compressed, 6)).isEqualTo(5000);
  }

  @Test
  void unknownTagIsCorruption() {
    final byte[] compressed = BlockCodec.compress(compressible(5000), new CompressionSettings(CompressionAlgorithm.ZLIB, 1));
    compressed[0] = 'Q';

    assertCorrupted(() -> BlockCodec.decompress(compressed, 5000));
  }

  @Test
  void truncatedEnvelopeIsCorruption() {
    final byte[] compressed = BlockCodec.compress(compressible(5000), new CompressionSettings(CompressionAlgorithm.LZMA, 1));
    final byte[] truncated = new byte[compressed.length - 10];
    System.arraycopy(compressed, 0, truncated, 0, truncated.length);

    assertCorrupted(() -> BlockCodec.decompress(truncated, 5000));
  }

  @Test
  void sizeMismatchIsCorruption() {
    final byte[] compressed = BlockCodec.compress(compressible(5000), new CompressionSettings(CompressionAlgorithm.ZSTD, 3));

    assertCorrupted(() -> BlockCodec.decompress(compressed, 4000));
    assertCorrupted(() -> BlockCodec.decompress(compressed, 6000));
  }

  @Test
  void trailingBytesAreCorruption() {
    final byte[] compressed = BlockCodec.compress(compressible(5000), new CompressionSettings(CompressionAlgorithm.ZLIB, 1));
    final byte[] padded = new byte[compressed.length + 3];
    System.arraycopy(compressed, 0, padded, 0, compressed.length);

    assertCorrupted(() -> BlockCodec.decompress(padded, 5000));
  }

  @Test
  void lz4ChecksumDetectsFlippedBits() {
    final byte[] compressed = BlockCodec.compress(compressible(5000), new CompressionSettings(CompressionAlgorithm.LZ4, 1));
    // FIRST BYTE AFTER THE CHECKSUM
    compressed[BlockCodec.HEADER_SIZE + LZ4Compression.CHECKSUM_SIZE] ^= 0x01;

    assertThatThrownBy(() -> BlockCodec.decompress(compressed, 5000)).isInstanceOf(CorruptionException.class)
        .hasMessageContaining("checksum");
  }

  @Test
  void lz4HighCompressor() {
    final byte[] payload = compressible(50_000);
    final byte[] fast = BlockCodec.compress(payload, new CompressionSettings(CompressionAlgorithm.LZ4, 1));
    final byte[] high = BlockCodec.compress(payload, new CompressionSettings(CompressionAlgorithm.LZ4, 9));

    assertThat(high.length).isLessThanOrEqualTo(fast.length);
    assertThat(BlockCodec.decompress(high, payload.length)).isEqualTo(payload);
  }

  @Test
  void settingsCodes() {
    assertThat(new CompressionSettings(CompressionAlgorithm.ZLIB, 1).getCode()).isEqualTo(101);
    assertThat(new CompressionSettings(CompressionAlgorithm.LZ4, 4).getCode()).isEqualTo(404);
    assertThat(CompressionSettings.STORE.getCode()).isZero();

    assertThat(CompressionSettings.fromCode(505)).isEqualTo(new CompressionSettings(CompressionAlgorithm.ZSTD, 5));
    assertThat(CompressionSettings.fromCode(206)).isEqualTo(new CompressionSettings(CompressionAlgorithm.LZMA, 6));
    assertThat(CompressionSettings.fromCode(0).isStore()).isTrue();
    // LEGACY WRITERS STORED THE LEVEL ONLY
    assertThat(CompressionSettings.fromCode(4)).isEqualTo(new CompressionSettings(CompressionAlgorithm.ZLIB, 4));

    assertThatThrownBy(() -> CompressionSettings.fromCode(901)).isInstanceOf(RootIOException.class);
    assertThatThrownBy(() -> new CompressionSettings(CompressionAlgorithm.ZLIB, 10)).isInstanceOf(RootIOException.class)
        .satisfies(e -> assertThat(((RootIOException) e).getErrorCode()).isEqualTo(ErrorCode.CONFIGURATION_ERROR));
  }

  @Test
  void settingsFromConfiguration() {
    final ContextConfiguration configuration = new ContextConfiguration();
    assertThat(CompressionSettings.fromConfiguration(configuration)).isEqualTo(new CompressionSettings(CompressionAlgorithm.ZLIB, 1));

    configuration.setValue(GlobalConfiguration.COMPRESSION_ALGORITHM, "lz4");
    configuration.setValue(GlobalConfiguration.COMPRESSION_LEVEL, 7);
    assertThat(CompressionSettings.fromConfiguration(configuration)).isEqualTo(new CompressionSettings(CompressionAlgorithm.LZ4, 7));

    configuration.setValue(GlobalConfiguration.COMPRESSION_ALGORITHM, "brotli");
    assertThatThrownBy(() -> CompressionSettings.fromConfiguration(configuration)).isInstanceOf(RootIOException.class);
  }

  private static void assertCorrupted(final Runnable action) {
    assertThatThrownBy(action::run).isInstanceOf(CorruptionException.class)
        .satisfies(e -> assertThat(((CorruptionException) e).getErrorCode()).isEqualTo(ErrorCode.CORRUPT_BLOCK));
  }

  private static int size(final byte[] src, final int offset) {
    return (src[offset] & 0xff) | ((src[offset + 1] & 0xff) << 8) | ((src[offset + 2] & 0xff) << 16);
  }

  private static byte[] compressible(final int length) {
    final byte[] payload = new byte[length];
    final byte[] pattern = "the quick brown fox jumps over the lazy dog ".getBytes(StandardCharsets.US_ASCII);
    final Random random = new Random(42);
    for (int i = 0; i < length; i++)
      payload[i] = (i % 97) == 0 ? (byte) random.nextInt() : pattern[i % pattern.length];
    return payload;
  }
}
