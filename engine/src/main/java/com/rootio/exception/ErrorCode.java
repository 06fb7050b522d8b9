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
package com.rootio.exception;

import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Standardized error codes for RootIO exceptions.
 * Error codes are organized in categories based on the first digit(s):
 * <ul>
 *   <li>1xxx - File and directory errors (lookup, nesting, handle state)</li>
 *   <li>3xxx - Serialization errors (streamer infos, classes, versions)</li>
 *   <li>5xxx - Storage errors (I/O, corruption)</li>
 *   <li>6xxx - Tree errors (baskets, reading)</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 *
 * @see RootIOException
 */
public enum ErrorCode {

  // ========== File and Directory Errors (1xxx) ==========
  /** No key with the requested name (and cycle) in the directory */
  KEY_NOT_FOUND(1001, "Key not found"),

  /** Cyclic directory nesting, wrong stream mode or duplicated directory */
  INVALID_DIRECTORY(1002, "Invalid directory"),

  /** Operation attempted on a closed file */
  CLOSED_HANDLE(1003, "File is closed"),

  /** Invalid file or context configuration */
  CONFIGURATION_ERROR(1004, "Configuration error"),

  // ========== Serialization Errors (3xxx) ==========
  /** No streamer info registered for the class */
  UNKNOWN_CLASS(3001, "Unknown class"),

  /** No streamer info registered for the class version */
  UNKNOWN_VERSION(3002, "Unknown class version"),

  /** Object does not match its streamer info or byte count mismatch */
  SERIALIZATION_ERROR(3003, "Serialization error"),

  /** Attempt to change the layout of a class already written in the current session */
  STREAMER_LAYOUT_LOCKED(3004, "Streamer layout locked"),

  // ========== Storage Errors (5xxx) ==========
  /** File system I/O operation failed */
  IO_ERROR(5001, "I/O error"),

  /** Compressed block checksum or size mismatch */
  CORRUPT_BLOCK(5002, "Corrupted compressed block"),

  /** The file does not start with the expected magic */
  NOT_A_ROOT_FILE(5003, "Not a ROOT file"),

  // ========== Tree Errors (6xxx) ==========
  /** Basket size, span or offsets table mismatch */
  CORRUPT_BASKET(6001, "Corrupted basket"),

  /** Long scan interrupted by the caller's cancellation signal */
  OPERATION_CANCELLED(6002, "Operation cancelled"),

  // ========== General Errors (99xxx) ==========
  /** Error without a specific code */
  UNKNOWN_ERROR(99998, "Unknown error"),

  /** Unexpected internal error (should not normally occur) */
  INTERNAL_ERROR(99999, "Internal error");

  private static final Map<Integer, ErrorCode> CODE_MAP = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(ErrorCode::getCode, e -> e));

  private final int    code;
  private final String defaultMessage;

  ErrorCode(final int code, final String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  /**
   * Returns the numeric error code.
   *
   * @return the error code (e.g., 1001, 5001, etc.)
   */
  public int getCode() {
    return code;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }

  /**
   * Returns the error category based on the error code range.
   *
   * @return the error category name
   */
  public String getCategory() {
    final int category = code / 1000;
    return switch (category) {
      case 1 -> "File";
      case 3 -> "Serialization";
      case 5 -> "Storage";
      case 6 -> "Tree";
      case 99 -> "Internal";
      default -> "Unknown";
    };
  }

  /**
   * Finds an ErrorCode by its numeric code.
   *
   * @param code the numeric error code to look up
   *
   * @return the matching ErrorCode, or INTERNAL_ERROR if not found
   */
  public static ErrorCode fromCode(final int code) {
    return CODE_MAP.getOrDefault(code, INTERNAL_ERROR);
  }

  @Override
  public String toString() {
    return String.format("%s(%d): %s", name(), code, defaultMessage);
  }
}
