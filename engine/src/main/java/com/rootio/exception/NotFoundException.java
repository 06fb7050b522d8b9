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
 * Exception thrown when a key (or a cycle of it) does not exist in a directory.
 */
public class NotFoundException extends RootIOException {

  public NotFoundException(final String message) {
    super(ErrorCode.KEY_NOT_FOUND, message);
  }

  public NotFoundException(final ErrorCode errorCode, final String message) {
    super(errorCode, message);
  }

  public NotFoundException(final ErrorCode errorCode, final String message, final Throwable cause) {
    super(errorCode, message, cause);
  }

  @Override
  protected ErrorCode getDefaultErrorCode() {
    return ErrorCode.KEY_NOT_FOUND;
  }
}
