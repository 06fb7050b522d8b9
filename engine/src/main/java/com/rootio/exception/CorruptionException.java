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

/**
 * Exception thrown when stored bytes do not decode to what their headers declare: compressed block size or checksum mismatch, corrupted baskets, invalid file headers. Never retried.
 */
public class CorruptionException extends RootIOException {

  public CorruptionException(final String message) {
    super(ErrorCode.CORRUPT_BLOCK, message);
  }

  public CorruptionException(final ErrorCode errorCode, final String message) {
    super(errorCode, message);
  }

  public CorruptionException(final ErrorCode errorCode, final String message, final Throwable cause) {
    super(errorCode, message, cause);
  }

  @Override
  protected ErrorCode getDefaultErrorCode() {
    return ErrorCode.CORRUPT_BLOCK;
  }
}
