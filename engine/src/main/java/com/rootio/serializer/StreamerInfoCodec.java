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

import com.rootio.binary.Binary;
import com.rootio.binary.ObjectHeader;
import com.rootio.binary.ObjectTags;
import com.rootio.exception.CorruptionException;
import com.rootio.exception.ErrorCode;
import com.rootio.log.LogManager;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

/**
 * Encodes the list of layouts stored in every file. The layouts describe the other classes, so this one is written by hand: a
 * {@code TList} of {@code TStreamerInfo}, each holding a {@code TObjArray} of {@code TStreamerElement} subclasses, every object
 * behind a class tag.
 * <p>
 * Decoding keeps the layouts that can be represented. A layout using an element this library has no kind for is dropped with a
 * warning, and so are the other objects of the list (the schema evolution rules for instance). Stored checksums are kept as read.
 */
public class StreamerInfoCodec {
  public static final String KEY_NAME  = "StreamerInfo";
  public static final String KEY_CLASS = "TList";
  public static final String KEY_TITLE = "Doubly linked list";

  static final String INFO_CLASS               = "TStreamerInfo";
  static final String ARRAY_CLASS              = "TObjArray";
  static final String BASE_CLASS               = "TStreamerBase";
  static final String BASIC_TYPE_CLASS         = "TStreamerBasicType";
  static final String STRING_ELEMENT_CLASS     = "TStreamerString";
  static final String BASIC_POINTER_CLASS      = "TStreamerBasicPointer";
  static final String OBJECT_CLASS             = "TStreamerObject";
  static final String OBJECT_ANY_CLASS         = "TStreamerObjectAny";
  static final String OBJECT_POINTER_CLASS     = "TStreamerObjectPointer";
  static final String OBJECT_ANY_POINTER_CLASS = "TStreamerObjectAnyPointer";
  static final String STL_CLASS                = "TStreamerSTL";
  static final String STL_STRING_CLASS         = "TStreamerSTLstring";

  public static final short LIST_VERSION    = 5;
  public static final short INFO_VERSION    = 9;
  public static final short ELEMENT_VERSION = 4;
  static final        short NAMED_VERSION   = 1;
  static final        short ARRAY_VERSION   = 3;

  private static final int MAX_INDEXES       = 5;
  private static final int LONG_OPTION       = 255;
  private static final int STL_VECTOR        = 1;
  private static final int STL_OBJECT_TYPE   = 61;
  private static final int STL_STRING_TYPE   = 365;
  private static final int POINTER_SIZE      = 8;
  private static final int STRING_SIZE       = 24;
  private static final int VECTOR_SIZE       = 24;

  private StreamerInfoCodec() {
  }

  public static byte[] encode(final List<StreamerInfo> list) {
    return encode(list, 0);
  }

  /**
   * @param displacement offset of the payload inside its key, where class tag references are counted from
   */
  public static byte[] encode(final List<StreamerInfo> list, final int displacement) {
    final Binary buffer = new Binary();
    buffer.setDisplacement(displacement);
    final ObjectTags tags = buffer.getObjectTags();

    final int listCount = buffer.writeObjectHeader(LIST_VERSION);
    GenericCodec.writeTObject(buffer, null);
    buffer.putString("");
    buffer.putInt(list.size());
    for (final StreamerInfo info : list) {
      final int infoCount = tags.writeClassTag(buffer, INFO_CLASS);
      writeInfo(buffer, info);
      buffer.finishObjectHeader(infoCount);
      // NO OPTION
      buffer.putUnsignedByte(0);
    }
    buffer.finishObjectHeader(listCount);
    buffer.checkError();
    return buffer.toByteArray();
  }

  public static List<StreamerInfo> decode(final byte[] payload) {
    return decode(payload, 0);
  }

  /**
   * @param displacement offset of the payload inside its key, where class tag references are counted from
   *
   * @throws CorruptionException if the list is malformed
   */
  public static List<StreamerInfo> decode(final byte[] payload, final int displacement) {
    final Binary buffer = new Binary(payload);
    buffer.setDisplacement(displacement);
    final ObjectTags tags = buffer.getObjectTags();

    final ObjectHeader listHeader = buffer.readObjectHeader();
    if (listHeader.getVersion() <= 3)
      throw new CorruptionException(ErrorCode.CORRUPT_BLOCK, "Unsupported list version " + listHeader.getVersion());
    GenericCodec.readTObject(buffer);
    buffer.getString();
    final int size = buffer.getInt();
    buffer.checkError();
    checkCount(size, buffer, "streamer infos");

    final List<StreamerInfo> result = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      final ObjectTags.Tag tag = tags.readTag(buffer);
      if (tag.getClassName() != null) {
        if (INFO_CLASS.equals(tag.getClassName())) {
          final StreamerInfo info = readInfo(buffer, tags);
          if (info != null)
            result.add(info);
        } else if (tag.hasEnd())
          LogManager.instance().log(StreamerInfoCodec.class, Level.FINE, "Skipped object of class '%s' in the streamer info list", null,
              tag.getClassName());
        else
          throw new CorruptionException(ErrorCode.CORRUPT_BLOCK, "Object of class '" + tag.getClassName() + "' has no byte count");

        if (tag.hasEnd())
          buffer.position(tag.getEnd());
      }
      skipOption(buffer, listHeader.getVersion());
      buffer.checkError();
    }
    return result;
  }

  private static void writeInfo(final Binary buffer, final StreamerInfo info) {
    final ObjectTags tags = buffer.getObjectTags();
    final int count = buffer.writeObjectHeader(INFO_VERSION);
    writeNamed(buffer, info.getClassName(), "");
    buffer.putInt(info.getChecksum());
    buffer.putInt(info.getVersion());

    final int arrayTag = tags.writeClassTag(buffer, ARRAY_CLASS);
    final int arrayCount = buffer.writeObjectHeader(ARRAY_VERSION);
    GenericCodec.writeTObject(buffer, null);
    buffer.putString("");
    buffer.putInt(info.getElements().size());
    // LOWER BOUND
    buffer.putInt(0);
    for (final StreamerElement e : info.getElements())
      writeElement(buffer, info, e);
    buffer.finishObjectHeader(arrayCount);
    buffer.finishObjectHeader(arrayTag);

    buffer.finishObjectHeader(count);
  }

  private static void writeElement(final Binary buffer, final StreamerInfo info, final StreamerElement e) {
    final String elementClass = elementClassOf(e);
    final int tag = buffer.getObjectTags().writeClassTag(buffer, elementClass);
    final int outer = buffer.writeObjectHeader(elementVersionOf(elementClass));

    final boolean fixed = e.getKind() == FieldKind.FIXED_ARRAY;
    final int inner = buffer.writeObjectHeader(ELEMENT_VERSION);
    writeNamed(buffer, e.getName(), e.getKind() == FieldKind.VARIABLE_ARRAY ? "[" + e.getCountName() + "]" : "");
    buffer.putInt(e.getTypeCode());
    buffer.putInt(sizeOf(e));
    buffer.putInt(fixed ? e.getArrayLength() : 0);
    buffer.putInt(fixed ? 1 : 0);
    for (int i = 0; i < MAX_INDEXES; i++)
      buffer.putInt(fixed && i == 0 ? e.getArrayLength() : 0);
    buffer.putString(e.getTypeName());
    buffer.finishObjectHeader(inner);

    switch (e.getKind()) {
    case BASE:
      buffer.putInt(e.getBaseVersion());
      break;
    case VARIABLE_ARRAY:
      buffer.putInt(info.getVersion());
      buffer.putString(e.getCountName());
      buffer.putString(info.getClassName());
      break;
    case CONTAINER:
      buffer.putInt(STL_VECTOR);
      buffer.putInt(e.getElementKind() == FieldKind.STRING ? STL_STRING_TYPE : STL_OBJECT_TYPE);
      break;
    default:
      break;
    }
    buffer.finishObjectHeader(outer);
    buffer.finishObjectHeader(tag);
  }

  private static StreamerInfo readInfo(final Binary buffer, final ObjectTags tags) {
    final ObjectHeader header = buffer.readObjectHeader();
    final String className = readNamed(buffer)[0];
    final int checksum = buffer.getInt();
    final int version = buffer.getInt();
    buffer.checkError();

    final List<StreamerElement> elements = new ArrayList<>();
    String unsupported = null;

    final ObjectTags.Tag arrayTag = tags.readTag(buffer);
    if (arrayTag.getClassName() != null) {
      if (!ARRAY_CLASS.equals(arrayTag.getClassName()))
        throw new CorruptionException(ErrorCode.CORRUPT_BLOCK,
            "Expected the elements of class '" + className + "' in a " + ARRAY_CLASS + ", found " + arrayTag.getClassName());

      final ObjectHeader arrayHeader = buffer.readObjectHeader();
      if (arrayHeader.getVersion() > 2)
        GenericCodec.readTObject(buffer);
      if (arrayHeader.getVersion() > 1)
        buffer.getString();
      final int size = buffer.getInt();
      // LOWER BOUND
      buffer.getInt();
      buffer.checkError();
      checkCount(size, buffer, "elements in the streamer info of '" + className + "'");

      for (int i = 0; i < size; i++) {
        final ObjectTags.Tag elementTag = tags.readTag(buffer);
        if (elementTag.getClassName() == null)
          continue;
        try {
          elements.add(readElement(buffer, elementTag.getClassName()));
        } catch (final IllegalArgumentException e) {
          if (!elementTag.hasEnd())
            throw new CorruptionException(ErrorCode.CORRUPT_BLOCK, "Cannot skip element of class " + elementTag.getClassName(), e);
          if (unsupported == null)
            unsupported = e.getMessage();
        }
        if (elementTag.hasEnd())
          buffer.position(elementTag.getEnd());
        buffer.checkError();
      }
      if (arrayHeader.hasByteCount())
        buffer.position(arrayHeader.getEnd());
      if (arrayTag.hasEnd())
        buffer.position(arrayTag.getEnd());
    }
    if (header.hasByteCount())
      buffer.position(header.getEnd());
    buffer.checkError();

    if (unsupported == null)
      try {
        return new StreamerInfo(className, version, elements, checksum);
      } catch (final IllegalArgumentException e) {
        unsupported = e.getMessage();
      }

    LogManager.instance().log(StreamerInfoCodec.class, Level.WARNING, "Ignored the layout of class '%s' v%d: %s", null, className, version,
        unsupported);
    return null;
  }

  /**
   * @throws IllegalArgumentException if the element has no counterpart in {@link FieldKind}
   */
  private static StreamerElement readElement(final Binary buffer, final String elementClass) {
    final ObjectHeader outer = buffer.readObjectHeader();
    if (STL_STRING_CLASS.equals(elementClass))
      // NESTED TStreamerSTL
      buffer.readObjectHeader();

    final ObjectHeader inner = buffer.readObjectHeader();
    final String name = readNamed(buffer)[0];
    final int type = buffer.getInt();
    // SIZE
    buffer.getInt();
    final int arrayLength = buffer.getInt();
    // DIMENSIONS
    buffer.getInt();
    if (inner.getVersion() == 1)
      buffer.skip(buffer.getInt() * Binary.INT_SERIALIZED_SIZE);
    else
      buffer.skip(MAX_INDEXES * Binary.INT_SERIALIZED_SIZE);
    final String typeName = buffer.getString();
    if (inner.hasByteCount())
      buffer.position(inner.getEnd());
    buffer.checkError();

    switch (elementClass) {
    case BASE_CLASS: {
      final int baseVersion = outer.getVersion() > 2 ? buffer.getInt() : 0;
      buffer.checkError();
      return StreamerElement.base(name, baseVersion);
    }
    case STRING_ELEMENT_CLASS:
    case STL_STRING_CLASS:
      return StreamerElement.primitive(name, FieldKind.STRING);
    case BASIC_TYPE_CLASS:
      if (type > FieldKind.FIXED_ARRAY_OFFSET && type < FieldKind.VARIABLE_ARRAY_OFFSET)
        return StreamerElement.fixedArray(name, numericKind(type - FieldKind.FIXED_ARRAY_OFFSET, name, typeName), arrayLength);
      return StreamerElement.primitive(name, numericKind(type, name, typeName));
    case BASIC_POINTER_CLASS: {
      // COUNT VERSION
      buffer.getInt();
      final String countName = buffer.getString();
      // COUNT CLASS
      buffer.getString();
      buffer.checkError();
      return StreamerElement.variableArray(name, numericKind(type - FieldKind.VARIABLE_ARRAY_OFFSET, name, typeName), countName);
    }
    case OBJECT_CLASS:
    case OBJECT_ANY_CLASS:
      return StreamerElement.object(name, typeName);
    case OBJECT_POINTER_CLASS:
    case OBJECT_ANY_POINTER_CLASS:
      return StreamerElement.pointer(name, typeName.endsWith("*") ? typeName.substring(0, typeName.length() - 1) : typeName);
    case STL_CLASS: {
      final int stlType = buffer.getInt();
      final int contentType = buffer.getInt();
      buffer.checkError();
      final String content = vectorContent(typeName);
      if (stlType != STL_VECTOR || content == null)
        throw new IllegalArgumentException("Container '" + name + "' of type " + typeName + " is not supported");
      if (contentType == STL_STRING_TYPE || "string".equals(content))
        return StreamerElement.container(name, StreamerElement.STRING_CLASS);
      return StreamerElement.container(name, content);
    }
    default:
      throw new IllegalArgumentException("Element '" + name + "' of class " + elementClass + " is not supported");
    }
  }

  private static FieldKind numericKind(final int code, final String name, final String typeName) {
    final FieldKind kind = FieldKind.fromPrimitiveTypeCode(code);
    if (kind == null)
      throw new IllegalArgumentException("Field '" + name + "' of type " + typeName + " (code " + code + ") is not supported");
    return kind;
  }

  /**
   * @return the content class of a {@code vector<...>} type name without namespace, or null for other containers
   */
  private static String vectorContent(final String typeName) {
    final String type = typeName.replace("std::", "").replace(" ", "");
    if (!type.startsWith("vector<") || !type.endsWith(">"))
      return null;
    return type.substring("vector<".length(), type.length() - 1);
  }

  private static String elementClassOf(final StreamerElement e) {
    switch (e.getKind()) {
    case BASE:
      return BASE_CLASS;
    case STRING:
      return STRING_ELEMENT_CLASS;
    case VARIABLE_ARRAY:
      return BASIC_POINTER_CLASS;
    case OBJECT:
      return OBJECT_ANY_CLASS;
    case OBJECT_POINTER:
      return OBJECT_POINTER_CLASS;
    case CONTAINER:
      return STL_CLASS;
    default:
      return BASIC_TYPE_CLASS;
    }
  }

  private static short elementVersionOf(final String elementClass) {
    return BASE_CLASS.equals(elementClass) || STL_CLASS.equals(elementClass) ? (short) 3 : (short) 2;
  }

  private static int sizeOf(final StreamerElement e) {
    switch (e.getKind()) {
    case FIXED_ARRAY:
      return e.getArrayLength() * e.getElementKind().getSize();
    case VARIABLE_ARRAY:
    case OBJECT_POINTER:
      return POINTER_SIZE;
    case STRING:
      return STRING_SIZE;
    case CONTAINER:
      return VECTOR_SIZE;
    default:
      return e.getKind().getSize();
    }
  }

  private static void writeNamed(final Binary buffer, final String name, final String title) {
    final int count = buffer.writeObjectHeader(NAMED_VERSION);
    GenericCodec.writeTObject(buffer, null);
    buffer.putString(name);
    buffer.putString(title);
    buffer.finishObjectHeader(count);
  }

  /**
   * @return the name and the title
   */
  private static String[] readNamed(final Binary buffer) {
    final ObjectHeader header = buffer.readObjectHeader();
    GenericCodec.readTObject(buffer);
    final String name = buffer.getString();
    final String title = buffer.getString();
    if (header.hasByteCount())
      buffer.position(header.getEnd());
    buffer.checkError();
    return new String[] { name, title };
  }

  private static void skipOption(final Binary buffer, final short listVersion) {
    int length = buffer.getUnsignedByte();
    if (listVersion > 4 && length == LONG_OPTION)
      length = buffer.getInt();
    buffer.skip(length);
  }

  private static void checkCount(final int count, final Binary buffer, final String what) {
    if (count < 0 || count > buffer.remaining())
      throw new CorruptionException(ErrorCode.CORRUPT_BLOCK, "Invalid number of " + what + ": " + count);
  }
}
