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
package com.rootio.tree;

/**
 * State of a {@link TreeReader} passed to the callback at every entry.
 */
public class ReaderContext {
  private final TreeReader reader;
  private       long       entry;

  ReaderContext(final TreeReader reader) {
    this.reader = reader;
  }

  /**
   * @return the entry whose values are in the read variables
   */
  public long getEntry() {
    return entry;
  }

  void setEntry(final long entry) {
    this.entry = entry;
  }

  public TreeReader getReader() {
    return reader;
  }
}
