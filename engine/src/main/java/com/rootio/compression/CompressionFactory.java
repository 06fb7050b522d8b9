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

import com.rootio.exception.ErrorCode;
import com.rootio.exception.RootIOException;

import java.util.EnumMap;
import java.util.Map;

/**
 * Returns the stateless {@link Compression} implementation of an algorithm.
 */
public class CompressionFactory {
  private static final Map<CompressionAlgorithm, Compression> IMPLEMENTATIONS = new EnumMap<>(CompressionAlgorithm.class);

  static {
    IMPLEMENTATIONS.put(CompressionAlgorithm.ZLIB, new ZLibCompression());
    IMPLEMENTATIONS.put(CompressionAlgorithm.LZMA, new LZMACompression());
    IMPLEMENTATIONS.put(CompressionAlgorithm.LZ4, new LZ4Compression());
    IMPLEMENTATIONS.put(CompressionAlgorithm.ZSTD, new ZstdCompression());
  }

  private CompressionFactory() {
  }

  public static Compression getCompression(final CompressionAlgorithm algorithm) {
    final Compression c = IMPLEMENTATIONS.get(algorithm);
    if (c == null)
      throw new RootIOException(ErrorCode.INTERNAL_ERROR, "No compression implementation for " + algorithm);
    return c;
  }
}
