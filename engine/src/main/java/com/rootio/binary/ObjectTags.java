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
package com.rootio.binary;

import com.rootio.exception.ErrorCode;
import com.rootio.exception.SerializationException;

import java.util.HashMap;
import java.util.Map;

/**
 * Class tags in front of objects stored by pointer: a byte count, then either a new class tag followed by the class name, a
 * reference to the first tag of the same class, or a null tag. References are positions in key coordinates plus
 * {@link #MAP_OFFSET}.
 */
public class ObjectTags {
  public static final long NULL_TAG      = 0L;
  public static final long NEW_CLASS_TAG = 0xFFFFFFFFL;
  public static final long CLASS_MASK    = 0x80000000L;
  public static final int  MAP_OFFSET    = 2;

  private final Map<Long, String> classesByReference = new HashMap<>();
  private final Map<String, Long> referencesByClass  = new HashMap<>();

  /**
   * Class and extent of an object read after its tag.
   */
  public static class Tag {
    private final String className;
    private final int    end;

    Tag(final String className, final int end) {
      this.className = className;
      this.end = end;
    }

    /**
     * @return the class of the object, null for a null pointer
     */
    public String getClassName() {
      return className;
    }

    public boolean hasEnd() {
      return end >= 0;
    }

    /**
     * @return the position right after the object, -1 if the tag carried no byte count
     */
    public int getEnd() {
      return end;
    }
  }

  /**
   * Reads the tag of the next object.
   *
   * @throws SerializationException if the tag references an unknown class or an already read object
   */
  public Tag readTag(final Binary buffer) {
    int tagPosition = buffer.position();
    int end = -1;
    long tag = buffer.getUnsignedInt();
    if (tag != NEW_CLASS_TAG && (tag & ObjectHeader.BYTE_COUNT_MASK) != 0) {
      end = buffer.position() + (int) (tag & ~ObjectHeader.BYTE_COUNT_MASK);
      tagPosition = buffer.position();
      tag = buffer.getUnsignedInt();
    }
    buffer.checkError();

    if (tag == NULL_TAG)
      return new Tag(null, end);

    if (tag == NEW_CLASS_TAG) {
      final String className = buffer.getCString();
      buffer.checkError();
      final long reference = tagPosition + buffer.getDisplacement() + MAP_OFFSET;
      classesByReference.put(reference, className);
      referencesByClass.putIfAbsent(className, reference);
      return new Tag(className, end);
    }

    if ((tag & CLASS_MASK) != 0) {
      final String className = classesByReference.get(tag & ~CLASS_MASK);
      if (className == null)
        throw new SerializationException(ErrorCode.SERIALIZATION_ERROR,
            "Reference to unknown class tag " + (tag & ~CLASS_MASK) + " at position " + tagPosition);
      return new Tag(className, end);
    }

    throw new SerializationException(ErrorCode.SERIALIZATION_ERROR,
        "Reference to an already read object (tag " + tag + ") at position " + tagPosition + " is not supported");
  }

  /**
   * @return the class of the next object, or null for a null pointer
   */
  public String readClassTag(final Binary buffer) {
    return readTag(buffer).getClassName();
  }

  /**
   * Writes a byte count placeholder and the class tag of an object.
   *
   * @return the position of the byte count, to pass to {@link Binary#finishObjectHeader(int)} once the object is written
   */
  public int writeClassTag(final Binary buffer, final String className) {
    final int countPosition = buffer.position();
    buffer.putInt(0);

    final Long reference = referencesByClass.get(className);
    if (reference != null) {
      buffer.putUnsignedInt(reference | CLASS_MASK);
    } else {
      final long newReference = buffer.position() + buffer.getDisplacement() + MAP_OFFSET;
      buffer.putUnsignedInt(NEW_CLASS_TAG);
      buffer.putCString(className);
      referencesByClass.put(className, newReference);
      classesByReference.put(newReference, className);
    }
    return countPosition;
  }

  public void writeNull(final Binary buffer) {
    buffer.putUnsignedInt(NULL_TAG);
  }
}
