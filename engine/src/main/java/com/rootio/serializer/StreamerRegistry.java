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
import com.rootio.engine.RootFile;
import com.rootio.exception.ErrorCode;
import com.rootio.exception.SerializationException;
import com.rootio.log.LogManager;
import com.rootio.tree.TreeBinding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;

/**
 * Per-file catalog of class layouts keyed by {@code (class, version)}, plus the bindings that turn decoded objects into Java types.
 * <p>
 * Decoding selects the layout with the exact version of the object, or the closest older one. Objects newer than every registered
 * layout are skipped through their byte count. Encoding always uses the latest layout. Once a class has been written, its latest
 * layout is locked until the registry is discarded.
 * <p>
 * Not thread safe: a registry belongs to one file handle.
 */
public class StreamerRegistry {
  private static final List<ObjectBinding<?>> DEFAULT_BINDINGS = new CopyOnWriteArrayList<>(
      List.of(new NamedBinding(), new TreeBinding()));

  private final Map<String, NavigableMap<Short, StreamerInfo>> infos          = new HashMap<>();
  private final Map<String, ObjectBinding<?>>                  bindingsByName = new HashMap<>();
  private final Map<Class<?>, ObjectBinding<?>>                bindingsByType = new HashMap<>();
  private final Set<String>                                    written        = new LinkedHashSet<>();
  private final List<StreamerInfo>                             fileInfos      = new ArrayList<>();
  private final GenericCodec                                   codec          = new GenericCodec(this);

  public StreamerRegistry() {
    for (final ObjectBinding<?> b : DEFAULT_BINDINGS)
      register(b);
  }

  /**
   * Registers a binding for every registry created from now on, so for every file opened or created afterwards.
   */
  public static void registerDefault(final ObjectBinding<?> binding) {
    DEFAULT_BINDINGS.removeIf(b -> b.getClassName().equals(binding.getClassName()));
    DEFAULT_BINDINGS.add(binding);
  }

  public static void unregisterDefault(final String className) {
    DEFAULT_BINDINGS.removeIf(b -> b.getClassName().equals(className));
  }

  public void register(final ObjectBinding<?> binding) {
    for (final StreamerInfo info : binding.getStreamerInfos())
      register(info);
    bindingsByName.put(binding.getClassName(), binding);
    bindingsByType.put(binding.getType(), binding);
  }

  /**
   * Registers a layout, replacing any layout registered with the same class and version.
   *
   * @throws SerializationException with {@link ErrorCode#STREAMER_LAYOUT_LOCKED} if the class was already written with a different
   *                                latest layout
   */
  public void register(final StreamerInfo info) {
    final NavigableMap<Short, StreamerInfo> versions = infos.computeIfAbsent(info.getClassName(), k -> new TreeMap<>());
    if (written.contains(info.getClassName())) {
      final StreamerInfo latest = versions.lastEntry().getValue();
      if (info.getVersion() >= latest.getVersion() && !info.equals(latest))
        throw new SerializationException(ErrorCode.STREAMER_LAYOUT_LOCKED,
            "Layout of class '" + info.getClassName() + "' cannot change after objects of the class have been written (current v"
                + latest.getVersion() + ", new v" + info.getVersion() + ")");
    }
    versions.put(info.getVersion(), info);
  }

  /**
   * Loads the layouts stored in a file. They take precedence over the built-in ones with the same class and version.
   */
  public void loadFileStreamerInfos(final List<StreamerInfo> list) {
    for (final StreamerInfo info : list) {
      infos.computeIfAbsent(info.getClassName(), k -> new TreeMap<>()).put(info.getVersion(), info);
      fileInfos.add(info);
    }
  }

  /**
   * @return the layouts loaded from the file, in file order
   */
  public List<StreamerInfo> getFileStreamerInfos() {
    return Collections.unmodifiableList(fileInfos);
  }

  /**
   * @return the latest layout of every class written through this registry, in order of first write
   */
  public List<StreamerInfo> getWrittenStreamerInfos() {
    final List<StreamerInfo> result = new ArrayList<>(written.size());
    for (final String className : written)
      result.add(getLatest(className));
    return result;
  }

  public boolean isLocked(final String className) {
    return written.contains(className);
  }

  public Set<String> getClassNames() {
    return Collections.unmodifiableSet(infos.keySet());
  }

  public StreamerInfo getStreamerInfo(final String className, final int version) {
    final NavigableMap<Short, StreamerInfo> versions = infos.get(className);
    return versions != null ? versions.get((short) version) : null;
  }

  public StreamerInfo getLatest(final String className) {
    final NavigableMap<Short, StreamerInfo> versions = infos.get(className);
    if (versions == null || versions.isEmpty())
      throw new SerializationException(ErrorCode.UNKNOWN_CLASS, "Unknown class '" + className + "'");
    return versions.lastEntry().getValue();
  }

  public ObjectBinding<?> getBinding(final String className) {
    return bindingsByName.get(className);
  }

  /**
   * @return the stored class name of a value, either a {@link GenericObject} or an instance of a bound Java type
   */
  public String getClassName(final Object value) {
    if (value instanceof GenericObject)
      return ((GenericObject) value).getClassName();
    return bindingFor(value.getClass()).getClassName();
  }

  public byte[] marshal(final Object value) {
    return marshal(value, 0);
  }

  /**
   * @param displacement offset of the payload inside its key, where class tag references are counted from
   */
  public byte[] marshal(final Object value, final int displacement) {
    final Binary buffer = new Binary();
    buffer.setDisplacement(displacement);
    codec.writeObject(buffer, toGeneric(value));
    return buffer.toByteArray();
  }

  /**
   * Decodes a top-level object.
   *
   * @return the bound Java object, a {@link GenericObject} if the class has no binding, or a {@link SkippedObject}
   */
  public Object unmarshal(final String className, final byte[] payload, final RootFile file) {
    return unmarshal(className, payload, 0, file);
  }

  /**
   * @param displacement offset of the payload inside its key, where class tag references are counted from
   */
  public Object unmarshal(final String className, final byte[] payload, final int displacement, final RootFile file) {
    final Binary buffer = new Binary(payload);
    buffer.setDisplacement(displacement);
    final Object result = codec.readObject(buffer, className);
    if (result instanceof SkippedObject)
      return result;

    final ObjectBinding<?> binding = bindingsByName.get(className);
    return binding != null ? binding.fromGeneric((GenericObject) result, file) : result;
  }

  public GenericCodec getCodec() {
    return codec;
  }

  /**
   * Selects the layout to decode an object with.
   *
   * @return the layout, or null if the object is newer than every layout and can be skipped
   */
  StreamerInfo resolve(final String className, final ObjectHeader header) {
    final NavigableMap<Short, StreamerInfo> versions = infos.get(className);
    if (versions == null || versions.isEmpty())
      throw new SerializationException(ErrorCode.UNKNOWN_CLASS, "Unknown class '" + className + "'");

    final short version = header.getVersion();
    final StreamerInfo exact = versions.get(version);
    if (exact != null)
      return exact;

    if (version > versions.lastKey()) {
      if (header.hasByteCount())
        return null;
      throw new SerializationException(ErrorCode.UNKNOWN_VERSION,
          "Class '" + className + "' v" + version + " is newer than every known layout and carries no byte count");
    }

    final Map.Entry<Short, StreamerInfo> closest = versions.floorEntry(version);
    if (closest == null)
      throw new SerializationException(ErrorCode.UNKNOWN_VERSION,
          "Class '" + className + "' v" + version + " is older than every known layout (oldest v" + versions.firstKey() + ")");

    LogManager.instance()
        .log(this, Level.WARNING, "No layout for class '%s' v%d, decoding with v%d", null, className, version, closest.getKey());
    return closest.getValue();
  }

  void markWritten(final StreamerInfo info) {
    written.add(info.getClassName());
  }

  @SuppressWarnings("unchecked")
  GenericObject toGeneric(final Object value) {
    if (value instanceof GenericObject)
      return (GenericObject) value;
    return ((ObjectBinding<Object>) bindingFor(value.getClass())).toGeneric(value);
  }

  private ObjectBinding<?> bindingFor(final Class<?> type) {
    for (Class<?> c = type; c != null; c = c.getSuperclass()) {
      final ObjectBinding<?> b = bindingsByType.get(c);
      if (b != null)
        return b;
    }
    throw new SerializationException(ErrorCode.UNKNOWN_CLASS, "No binding registered for Java type " + type.getName());
  }
}
