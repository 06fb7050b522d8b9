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

import java.lang.reflect.Constructor;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing RootIO exceptions with error codes and diagnostic context.
 * <pre>{@code
 * throw ExceptionBuilder.storage()
 *     .code(ErrorCode.IO_ERROR)
 *     .message("Cannot read %d bytes at offset %d", length, position)
 *     .cause(e)
 *     .context("filePath", filePath)
 *     .build();
 * }</pre>
 *
 * @see RootIOException
 * @see ErrorCode
 */
public class ExceptionBuilder {
  private       ErrorCode                        errorCode;
  private       String                           message;
  private       Throwable                        cause;
  private final Map<String, Object>              context = new LinkedHashMap<>();
  private final Class<? extends RootIOException> exceptionClass;

  private ExceptionBuilder(final Class<? extends RootIOException> exceptionClass) {
    this.exceptionClass = exceptionClass;
  }

  public static ExceptionBuilder storage() {
    return new ExceptionBuilder(StorageException.class);
  }

  public static ExceptionBuilder corruption() {
    return new ExceptionBuilder(CorruptionException.class);
  }

  public static ExceptionBuilder serialization() {
    return new ExceptionBuilder(SerializationException.class);
  }

  public static ExceptionBuilder directory() {
    return new ExceptionBuilder(InvalidDirectoryException.class);
  }

  public static ExceptionBuilder notFound() {
    return new ExceptionBuilder(NotFoundException.class);
  }

  public ExceptionBuilder code(final ErrorCode errorCode) {
    this.errorCode = errorCode;
    return this;
  }

  public ExceptionBuilder message(final String message) {
    this.message = message;
    return this;
  }

  /**
   * Sets the error message using String.format() syntax.
   *
   * @param format the format string
   * @param args   the format arguments
   *
   * @return this builder for method chaining
   */
  public ExceptionBuilder message(final String format, final Object... args) {
    this.message = String.format(format, args);
    return this;
  }

  public ExceptionBuilder cause(final Throwable cause) {
    this.cause = cause;
    return this;
  }

  /**
   * Adds a diagnostic context entry. Null values are ignored.
   */
  public ExceptionBuilder context(final String key, final Object value) {
    if (key != null && value != null)
      this.context.put(key, value);
    return this;
  }

  /**
   * Builds and returns the configured exception.
   *
   * @return the configured exception
   *
   * @throws IllegalStateException if error code is not specified
   */
  public RootIOException build() {
    if (errorCode == null)
      throw new IllegalStateException("Error code must be specified");

    if (message == null || message.isEmpty())
      message = errorCode.getDefaultMessage();

    try {
      final RootIOException exception;
      if (cause != null) {
        final Constructor<? extends RootIOException> constructor = exceptionClass.getConstructor(ErrorCode.class, String.class,
            Throwable.class);
        exception = constructor.newInstance(errorCode, message, cause);
      } else {
        final Constructor<? extends RootIOException> constructor = exceptionClass.getConstructor(ErrorCode.class, String.class);
        exception = constructor.newInstance(errorCode, message);
      }

      context.forEach(exception::addContext);
      return exception;

    } catch (final ReflectiveOperationException e) {
      throw new RootIOException(ErrorCode.INTERNAL_ERROR, "Failed to build exception: " + exceptionClass.getName(), e);
    }
  }
}
