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
package com.rootio.serializer;

/**
 * Placeholder for an object whose version is newer than every registered layout. Its bytes were skipped using the byte count of
 * its header.
 */
public class SkippedObject {
  private final String className;
  private final short  version;
  private final long   byteCount;

  public SkippedObject(final String className, final short version, final long byteCount) {
    this.className = className;
    this.version = version;
    this.byteCount = byteCount;
  }

  public String getClassName() {
    return className;
  }

  public short getVersion() {
    return version;
  }

  public long getByteCount() {
    return byteCount;
  }

  @Override
  public String toString() {
    return "SkippedObject{" + className + " v" + version + ", " + byteCount + " bytes}";
  }
}
