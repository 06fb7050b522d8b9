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
import com.rootio.exception.ErrorCode;
import com.rootio.exception.SerializationException;
import com.rootio.log.LogManager;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

/**
 * Reads and writes objects field by field following their {@link StreamerInfo}.
 */
public class GenericCodec {
  public static final short CONTAINER_VERSION = 9;
  public static final short TOBJECT_VERSION   = 1;
  public static final long  DEFAULT_BITS      = 0x03000000L;
  public static final long  IS_REFERENCED     = 1L << 4;

  private static final int VERSION_BYTE_COUNT_MASK = ObjectHeader.BYTE_COUNT_MASK >>> 16;

  private final StreamerRegistry registry;

  public GenericCodec(final StreamerRegistry registry) {
    this.registry = registry;
  }

  /**
   * @return a {@link GenericObject}, or a {@link SkippedObject} if the stored version is newer than every registered layout
   */
  public Object readObject(final Binary buffer, final String className) {
    final ObjectHeader header = buffer.readObjectHeader();
    buffer.checkError();

    final StreamerInfo info = registry.resolve(className, header);
    if (info == null) {
      buffer.skipObject(header);
      buffer.checkError();
      return new SkippedObject(className, header.getVersion(), header.getByteCount());
    }

    final GenericObject object = new GenericObject(className);
    object.setVersion(header.getVersion());
    for (final StreamerElement e : info.getElements())
      object.set(e.getName(), readField(buffer, e, object));
    buffer.checkError();

    if (header.hasByteCount() && buffer.position() != header.getEnd()) {
      if (info.getVersion() == header.getVersion())
        throw new SerializationException(ErrorCode.SERIALIZATION_ERROR,
            "Object of class '" + className + "' v" + info.getVersion() + " declares " + header.getByteCount() + " bytes but " + (
                buffer.position() - header.getPosition() - Binary.INT_SERIALIZED_SIZE) + " were read");

      LogManager.instance()
          .log(this, Level.WARNING, "Object of class '%s' v%d decoded with layout v%d ended at %d instead of %d, realigning", null,
              className, header.getVersion(), info.getVersion(), buffer.position(), header.getEnd());
      buffer.position(header.getEnd());
    }
    return object;
  }

  public void writeObject(final Binary buffer, final GenericObject object) {
    final StreamerInfo info = registry.getLatest(object.getClassName());
    registry.markWritten(info);

    final int countPosition = buffer.writeObjectHeader(info.getVersion());
    for (final StreamerElement e : info.getElements())
      writeField(buffer, e, object);
    buffer.finishObjectHeader(countPosition);
    buffer.checkError();
  }

  private Object readField(final Binary buffer, final StreamerElement e, final GenericObject current) {
    switch (e.getKind()) {
    case FIXED_ARRAY:
      return readArray(buffer, e.getElementKind(), e.getArrayLength(), e.getName());
    case VARIABLE_ARRAY:
      return readArray(buffer, e.getElementKind(), current.getInt(e.getCountName()), e.getName());
    case BASE:
      return StreamerElement.TOBJECT_CLASS.equals(e.getClassName()) ? readTObject(buffer) : readObject(buffer, e.getClassName());
    case OBJECT:
      return readObject(buffer, e.getClassName());
    case OBJECT_POINTER:
      return readPointer(buffer);
    case CONTAINER:
      return readContainer(buffer, e);
    default:
      return readPrimitive(buffer, e.getKind());
    }
  }

  private void writeField(final Binary buffer, final StreamerElement e, final GenericObject current) {
    final Object value = current.get(e.getName());
    if (e.getKind() == FieldKind.BASE && StreamerElement.TOBJECT_CLASS.equals(e.getClassName())) {
      final StreamerInfo info = registry.getStreamerInfo(StreamerElement.TOBJECT_CLASS, TOBJECT_VERSION);
      if (info != null)
        registry.markWritten(info);
      writeTObject(buffer, value instanceof GenericObject ? (GenericObject) value : null);
      return;
    }
    if (value == null && e.getKind() != FieldKind.OBJECT_POINTER)
      throw new SerializationException(ErrorCode.SERIALIZATION_ERROR,
          "Missing value for field '" + e.getName() + "' of class '" + current.getClassName() + "'");

    try {
      switch (e.getKind()) {
      case FIXED_ARRAY:
        checkArrayLength(value, e.getArrayLength(), e.getName());
        writeArray(buffer, e.getElementKind(), value);
        break;
      case VARIABLE_ARRAY:
        checkArrayLength(value, current.getInt(e.getCountName()), e.getName());
        writeArray(buffer, e.getElementKind(), value);
        break;
      case BASE:
      case OBJECT:
        writeObject(buffer, registry.toGeneric(value));
        break;
      case OBJECT_POINTER:
        writePointer(buffer, value);
        break;
      case CONTAINER:
        writeContainer(buffer, e, (List<?>) value);
        break;
      default:
        writePrimitive(buffer, e.getKind(), value);
      }
    } catch (final ClassCastException | IllegalArgumentException ex) {
      throw new SerializationException(ErrorCode.SERIALIZATION_ERROR,
          "Invalid value for field '" + e.getName() + "' of class '" + current.getClassName() + "': " + ex.getMessage(), ex);
    }
  }

  public static Object readPrimitive(final Binary buffer, final FieldKind kind) {
    switch (kind) {
    case BOOL:
      return buffer.getBoolean();
    case INT8:
      return buffer.getByte();
    case INT16:
      return buffer.getShort();
    case INT32:
      return buffer.getInt();
    case INT64:
    case UINT64:
      return buffer.getLong();
    case UINT8:
      return (short) buffer.getUnsignedByte();
    case UINT16:
      return buffer.getUnsignedShort();
    case UINT32:
      return buffer.getUnsignedInt();
    case FLOAT32:
      return buffer.getFloat();
    case FLOAT64:
      return buffer.getDouble();
    case STRING:
      return buffer.getString();
    default:
      throw new SerializationException(ErrorCode.SERIALIZATION_ERROR, "Kind " + kind + " is not a primitive");
    }
  }

  public static void writePrimitive(final Binary buffer, final FieldKind kind, final Object value) {
    switch (kind) {
    case BOOL:
      buffer.putBoolean((Boolean) value);
      break;
    case INT8:
    case UINT8:
      buffer.putByte(((Number) value).byteValue());
      break;
    case INT16:
    case UINT16:
      buffer.putShort(((Number) value).shortValue());
      break;
    case INT32:
    case UINT32:
      buffer.putInt(((Number) value).intValue());
      break;
    case INT64:
    case UINT64:
      buffer.putLong(((Number) value).longValue());
      break;
    case FLOAT32:
      buffer.putFloat(((Number) value).floatValue());
      break;
    case FLOAT64:
      buffer.putDouble(((Number) value).doubleValue());
      break;
    case STRING:
      buffer.putString(value.toString());
      break;
    default:
      throw new SerializationException(ErrorCode.SERIALIZATION_ERROR, "Kind " + kind + " is not a primitive");
    }
  }

  /**
   * Reads {@code length} packed values into a primitive array of the element width.
   */
  public static Object readArray(final Binary buffer, final FieldKind kind, final int length, final String name) {
    if (length < 0 || (long) length * kind.getSize() > buffer.remaining())
      throw new SerializationException(ErrorCode.SERIALIZATION_ERROR,
          "Invalid length " + length + " for array '" + name + "' (" + buffer.remaining() + " bytes left)");

    switch (kind) {
    case BOOL: {
      final boolean[] a = new boolean[length];
      for (int i = 0; i < length; i++)
        a[i] = buffer.getBoolean();
      return a;
    }
    case INT8:
    case UINT8:
      return buffer.getBytes(length);
    case INT16:
    case UINT16: {
      final short[] a = new short[length];
      for (int i = 0; i < length; i++)
        a[i] = buffer.getShort();
      return a;
    }
    case INT32:
    case UINT32: {
      final int[] a = new int[length];
      for (int i = 0; i < length; i++)
        a[i] = buffer.getInt();
      return a;
    }
    case INT64:
    case UINT64: {
      final long[] a = new long[length];
      for (int i = 0; i < length; i++)
        a[i] = buffer.getLong();
      return a;
    }
    case FLOAT32: {
      final float[] a = new float[length];
      for (int i = 0; i < length; i++)
        a[i] = buffer.getFloat();
      return a;
    }
    case FLOAT64: {
      final double[] a = new double[length];
      for (int i = 0; i < length; i++)
        a[i] = buffer.getDouble();
      return a;
    }
    default:
      throw new SerializationException(ErrorCode.SERIALIZATION_ERROR, "Kind " + kind + " cannot be packed in array '" + name + "'");
    }
  }

  public static void writeArray(final Binary buffer, final FieldKind kind, final Object array) {
    switch (kind) {
    case BOOL:
      for (final boolean v : (boolean[]) array)
        buffer.putBoolean(v);
      break;
    case INT8:
    case UINT8:
      buffer.putByteArray((byte[]) array);
      break;
    case INT16:
    case UINT16:
      for (final short v : (short[]) array)
        buffer.putShort(v);
      break;
    case INT32:
    case UINT32:
      for (final int v : (int[]) array)
        buffer.putInt(v);
      break;
    case INT64:
    case UINT64:
      for (final long v : (long[]) array)
        buffer.putLong(v);
      break;
    case FLOAT32:
      for (final float v : (float[]) array)
        buffer.putFloat(v);
      break;
    case FLOAT64:
      for (final double v : (double[]) array)
        buffer.putDouble(v);
      break;
    default:
      throw new IllegalArgumentException("Kind " + kind + " cannot be packed in an array");
    }
  }

  private static void checkArrayLength(final Object array, final int expected, final String name) {
    final int length = Array.getLength(array);
    if (length != expected)
      throw new IllegalArgumentException("array '" + name + "' has " + length + " elements, expected " + expected);
  }

  /**
   * @return the default base of objects created in memory: no unique id, the heap bits set
   */
  public static GenericObject newTObject() {
    final GenericObject object = new GenericObject(StreamerElement.TOBJECT_CLASS).set("fUniqueID", 0L).set("fBits", DEFAULT_BITS);
    object.setVersion(TOBJECT_VERSION);
    return object;
  }

  /**
   * Reads the {@code TObject} base: a bare version without byte count, the unique id and the bits, plus the process id of
   * referenced objects.
   */
  public static GenericObject readTObject(final Binary buffer) {
    final short version = buffer.getShort();
    if ((version & VERSION_BYTE_COUNT_MASK) != 0)
      // A BYTE COUNT WAS WRITTEN: SKIP ITS SECOND HALF AND THE VERSION
      buffer.skip(Binary.INT_SERIALIZED_SIZE);

    final GenericObject object = new GenericObject(StreamerElement.TOBJECT_CLASS).set("fUniqueID", buffer.getUnsignedInt());
    final long bits = buffer.getUnsignedInt();
    object.set("fBits", bits);
    if ((bits & IS_REFERENCED) != 0)
      object.set("fPid", buffer.getUnsignedShort());
    buffer.checkError();
    object.setVersion(version);
    return object;
  }

  /**
   * Writes the {@code TObject} base of an object. A null value writes the default base.
   */
  public static void writeTObject(final Binary buffer, final GenericObject value) {
    final GenericObject object = value != null ? value : newTObject();
    final long bits = object.has("fBits") ? object.getLong("fBits") : DEFAULT_BITS;
    buffer.putShort(TOBJECT_VERSION);
    buffer.putUnsignedInt(object.has("fUniqueID") ? object.getLong("fUniqueID") : 0L);
    buffer.putUnsignedInt(bits);
    if ((bits & IS_REFERENCED) != 0)
      buffer.putShort((short) (object.has("fPid") ? object.getInt("fPid") : 0));
  }

  private Object readPointer(final Binary buffer) {
    final String className = buffer.getObjectTags().readClassTag(buffer);
    return className != null ? readObject(buffer, className) : null;
  }

  private void writePointer(final Binary buffer, final Object value) {
    final ObjectTags tags = buffer.getObjectTags();
    if (value == null) {
      tags.writeNull(buffer);
      return;
    }
    final GenericObject object = registry.toGeneric(value);
    final int countPosition = tags.writeClassTag(buffer, object.getClassName());
    writeObject(buffer, object);
    buffer.finishObjectHeader(countPosition);
  }

  private List<Object> readContainer(final Binary buffer, final StreamerElement e) {
    final ObjectHeader header = buffer.readObjectHeader();
    final int size = buffer.getInt();
    buffer.checkError();
    if (size < 0 || size > buffer.remaining())
      throw new SerializationException(ErrorCode.SERIALIZATION_ERROR, "Invalid size " + size + " for container '" + e.getName() + "'");

    final List<Object> result = new ArrayList<>(size);
    for (int i = 0; i < size; i++)
      result.add(e.getElementKind() == FieldKind.STRING ? buffer.getString() : readObject(buffer, e.getClassName()));
    buffer.checkError();

    if (header.hasByteCount() && buffer.position() != header.getEnd())
      throw new SerializationException(ErrorCode.SERIALIZATION_ERROR,
          "Container '" + e.getName() + "' ended at " + buffer.position() + " instead of " + header.getEnd());
    return result;
  }

  private void writeContainer(final Binary buffer, final StreamerElement e, final List<?> values) {
    final int countPosition = buffer.writeObjectHeader(CONTAINER_VERSION);
    buffer.putInt(values.size());
    for (final Object v : values) {
      if (e.getElementKind() == FieldKind.STRING)
        buffer.putString(v.toString());
      else
        writeObject(buffer, registry.toGeneric(v));
    }
    buffer.finishObjectHeader(countPosition);
  }
}
