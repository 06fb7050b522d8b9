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

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Block compression algorithms. The code is the one stored in the file header ({@code code * 100 + level}), the tag is the 2-byte
 * prefix of every compressed envelope.
 */
public enum CompressionAlgorithm {
  NONE(0, null), ZLIB(1, "ZL"), LZMA(2, "XZ"), LZ4(4, "L4"), ZSTD(5, "ZS");

  private final int    code;
  private final byte[] tag;

  CompressionAlgorithm(final int code, final String tag) {
    this.code = code;
    this.tag = tag != null ? tag.getBytes(StandardCharsets.US_ASCII) : null;
  }

  public int getCode() {
    return code;
  }

  public byte[] getTag() {
    return tag;
  }

  public static CompressionAlgorithm fromTag(final byte first, final byte second) {
    for (final CompressionAlgorithm a : values())
      if (a.tag != null && a.tag[0] == first && a.tag[1] == second)
        return a;
    return null;
  }

  public static CompressionAlgorithm fromCode(final int code) {
    for (final CompressionAlgorithm a : values())
      if (a.code == code)
        return a;
    return null;
  }

  public static CompressionAlgorithm fromName(final String name) {
    final String n = name.trim().toUpperCase(Locale.ENGLISH);
    switch (n) {
    case "STORE":
    case "NONE":
      return NONE;
    case "DEFLATE":
    case "ZLIB":
      return ZLIB;
    case "XZ":
    case "LZMA":
      return LZMA;
    case "LZ4":
      return LZ4;
    case "ZSTD":
      return ZSTD;
    default:
      return null;
    }
  }
}
