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

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RootIOExceptionTest {

  @Test
  void categoriesFollowCodeRanges() {
    assertThat(ErrorCode.KEY_NOT_FOUND.getCategory()).isEqualTo("File");
    assertThat(ErrorCode.UNKNOWN_VERSION.getCategory()).isEqualTo("Serialization");
    assertThat(ErrorCode.CORRUPT_BLOCK.getCategory()).isEqualTo("Storage");
    assertThat(ErrorCode.CORRUPT_BASKET.getCategory()).isEqualTo("Tree");
    assertThat(ErrorCode.INTERNAL_ERROR.getCategory()).isEqualTo("Internal");
  }

  @Test
  void fromCode() {
    assertThat(ErrorCode.fromCode(6001)).isEqualTo(ErrorCode.CORRUPT_BASKET);
    assertThat(ErrorCode.fromCode(5003)).isEqualTo(ErrorCode.NOT_A_ROOT_FILE);
    assertThat(ErrorCode.fromCode(424242)).isEqualTo(ErrorCode.INTERNAL_ERROR);
  }

  @Test
  void toStringShowsCategoryAndCode() {
    final RootIOException e = new CorruptionException(ErrorCode.CORRUPT_BASKET, "bad basket");
    assertThat(e.toString()).isEqualTo("CorruptionException [Tree-6001]: bad basket");
  }

  @Test
  void jsonContainsContextAndCause() {
    final RootIOException e = new StorageException(ErrorCode.IO_ERROR, "cannot read \"file\"", new IOException("disk gone"));
    e.addContext("path", "/tmp/a.root").addContext("position", 100L).addContext("retry", false);

    final String json = e.toJSON();
    assertThat(json).startsWith("{\"errorCode\":5001,\"errorName\":\"IO_ERROR\",\"category\":\"Storage\"");
    assertThat(json).contains("\"message\":\"cannot read \\\"file\\\"\"");
    assertThat(json).contains("\"context\":{\"path\":\"/tmp/a.root\",\"position\":100,\"retry\":false}");
    assertThat(json).endsWith(",\"cause\":\"disk gone\"}");
  }

  @Test
  void builderCreatesTheRequestedType() {
    final RootIOException e = ExceptionBuilder.notFound()
        .code(ErrorCode.KEY_NOT_FOUND)
        .message("Key '%s' not found in '%s'", "h1", "/dir")
        .context("key", "h1")
        .context("ignored", null)
        .build();

    assertThat(e).isInstanceOf(NotFoundException.class).hasMessage("Key 'h1' not found in '/dir'").hasNoCause();
    assertThat(e.getErrorCode()).isEqualTo(ErrorCode.KEY_NOT_FOUND);
    assertThat(e.getContext()).containsOnlyKeys("key");
  }

  @Test
  void builderWithCauseAndDefaultMessage() {
    final IOException cause = new IOException("boom");

    final RootIOException e = ExceptionBuilder.storage().code(ErrorCode.IO_ERROR).cause(cause).build();

    assertThat(e).isInstanceOf(StorageException.class).hasCause(cause);
    assertThat(e.getMessage()).isEqualTo(ErrorCode.IO_ERROR.getDefaultMessage());

    assertThat(ExceptionBuilder.corruption().code(ErrorCode.CORRUPT_BLOCK).build()).isInstanceOf(CorruptionException.class);
    assertThat(ExceptionBuilder.serialization().code(ErrorCode.UNKNOWN_CLASS).build()).isInstanceOf(SerializationException.class);
    assertThat(ExceptionBuilder.directory().code(ErrorCode.INVALID_DIRECTORY).build()).isInstanceOf(InvalidDirectoryException.class);
  }

  @Test
  void builderRequiresACode() {
    assertThatThrownBy(() -> ExceptionBuilder.storage().message("no code").build()).isInstanceOf(IllegalStateException.class);
  }
}
