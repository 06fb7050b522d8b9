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

import java.time.DateTimeException;
import java.time.LocalDateTime;

/**
 * Date and time packed in 32 bits: {@code (year-1995)<<26 | month<<22 | day<<17 | hour<<12 | minute<<6 | second}.
 */
public class Datime {
  private static final int BASE_YEAR = 1995;

  private Datime() {
  }

  public static long now() {
    return encode(LocalDateTime.now());
  }

  public static long encode(final LocalDateTime time) {
    final int year = Math.max(time.getYear(), BASE_YEAR);
    return ((long) (year - BASE_YEAR) << 26 | (long) time.getMonthValue() << 22 | (long) time.getDayOfMonth() << 17
        | (long) time.getHour() << 12 | (long) time.getMinute() << 6 | time.getSecond()) & 0xFFFFFFFFL;
  }

  /**
   * @return the decoded time, or null if the value is not a valid date
   */
  public static LocalDateTime decode(final long value) {
    if (value == 0)
      return null;
    final int year = (int) (value >>> 26) + BASE_YEAR;
    final int month = (int) (value >>> 22) & 0xF;
    final int day = (int) (value >>> 17) & 0x1F;
    final int hour = (int) (value >>> 12) & 0x1F;
    final int minute = (int) (value >>> 6) & 0x3F;
    final int second = (int) value & 0x3F;
    try {
      return LocalDateTime.of(year, month, day, hour, minute, second);
    } catch (final DateTimeException e) {
      return null;
    }
  }
}
