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

/**
 * A single block compression algorithm. Implementations work on raw payloads: the envelope header is handled by
 * {@link BlockCodec}.
 */
public interface Compression {
  CompressionAlgorithm getAlgorithm();

  /**
   * @return the codec version byte written in the envelope header.
   */
  byte getMethod();

  byte[] compress(byte[] src, int offset, int length, int level);

  /**
   * Decompresses {@code srcLength} bytes into {@code dst}.
   *
   * @return the number of bytes written into {@code dst}
   *
   * @throws com.rootio.exception.CorruptionException if the input is not a valid block
   */
  int decompress(byte[] src, int srcOffset, int srcLength, byte[] dst, int dstOffset, int dstLength);
}
