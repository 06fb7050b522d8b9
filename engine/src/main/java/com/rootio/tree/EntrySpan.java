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
 * Entry range {@code [begin, end)} stored in one basket.
 */
public class EntrySpan {
  private final long begin;
  private final long end;

  public EntrySpan(final long begin, final long end) {
    this.begin = begin;
    this.end = end;
  }

  public long getBegin() {
    return begin;
  }

  public long getEnd() {
    return end;
  }

  public long size() {
    return end - begin;
  }

  public boolean contains(final long entry) {
    return entry >= begin && entry < end;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof EntrySpan))
      return false;
    final EntrySpan that = (EntrySpan) o;
    return begin == that.begin && end == that.end;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(begin) * 31 + Long.hashCode(end);
  }

  @Override
  public String toString() {
    return "[" + begin + ", " + end + ")";
  }
}
