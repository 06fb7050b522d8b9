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
package com.rootio.engine;

/**
 * Unused byte range {@code [first, last]} of a file.
 */
public class FreeSegment {
  public static final short VERSION      = 1;
  public static final short LARGE_OFFSET = 1000;
  public static final int   SIZE         = 2 + 8 + 8;

  private final long first;
  private final long last;

  public FreeSegment(final long first, final long last) {
    this.first = first;
    this.last = last;
  }

  public long getFirst() {
    return first;
  }

  public long getLast() {
    return last;
  }

  public long getSize() {
    return last - first + 1;
  }

  @Override
  public String toString() {
    return "[" + first + ", " + last + "]";
  }
}
