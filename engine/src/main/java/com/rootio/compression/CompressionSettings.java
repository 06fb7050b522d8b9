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
import com.rootio.exception.ErrorCode;
import com.rootio.exception.RootIOException;

import java.util.Objects;

/**
 * Algorithm and level used to compress the payloads of a file. Stored in the file header as {@code algorithm * 100 + level}.
 */
public class CompressionSettings {
  public static final CompressionSettings STORE = new CompressionSettings(CompressionAlgorithm.NONE, 0);

  private final CompressionAlgorithm algorithm;
  private final int                  level;

  public CompressionSettings(final CompressionAlgorithm algorithm, final int level) {
    if (level < 0 || level > 9)
      throw new RootIOException(ErrorCode.CONFIGURATION_ERROR, "Invalid compression level " + level + " (expected 0-9)");
    this.algorithm = level == 0 ? CompressionAlgorithm.NONE : algorithm;
    this.level = algorithm == CompressionAlgorithm.NONE ? 0 : level;
  }

  public static CompressionSettings fromConfiguration(final ContextConfiguration configuration) {
    final String name = configuration.getValueAsString(GlobalConfiguration.COMPRESSION_ALGORITHM);
    final CompressionAlgorithm algorithm = CompressionAlgorithm.fromName(name);
    if (algorithm == null)
      throw new RootIOException(ErrorCode.CONFIGURATION_ERROR, "Unknown compression algorithm '" + name + "'");
    return new CompressionSettings(algorithm, configuration.getValueAsInteger(GlobalConfiguration.COMPRESSION_LEVEL));
  }

  /**
   * Decodes the header value. Codes below 100 come from writers that predate the algorithm selector and mean zlib.
   */
  public static CompressionSettings fromCode(final int code) {
    if (code <= 0)
      return STORE;
    final int level = code % 100;
    final CompressionAlgorithm algorithm = code < 100 ? CompressionAlgorithm.ZLIB : CompressionAlgorithm.fromCode(code / 100);
    if (algorithm == null)
      throw new RootIOException(ErrorCode.CONFIGURATION_ERROR, "Unknown compression code " + code);
    return new CompressionSettings(algorithm, Math.min(level, 9));
  }

  public int getCode() {
    return algorithm.getCode() * 100 + level;
  }

  public CompressionAlgorithm getAlgorithm() {
    return algorithm;
  }

  public int getLevel() {
    return level;
  }

  public boolean isStore() {
    return algorithm == CompressionAlgorithm.NONE;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof CompressionSettings))
      return false;
    final CompressionSettings that = (CompressionSettings) o;
    return level == that.level && algorithm == that.algorithm;
  }

  @Override
  public int hashCode() {
    return Objects.hash(algorithm, level);
  }

  @Override
  public String toString() {
    return algorithm + ":" + level;
  }
}
