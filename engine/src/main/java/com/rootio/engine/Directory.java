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

import com.rootio.binary.Binary;
import com.rootio.exception.ErrorCode;
import com.rootio.exception.InvalidDirectoryException;
import com.rootio.exception.NotFoundException;
import com.rootio.exception.OperationCancelledException;
import com.rootio.exception.SerializationException;
import com.rootio.log.LogManager;
import com.rootio.serializer.SkippedObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;

/**
 * Index of keys, possibly nested. Keys are kept in insertion order, all cycles included.
 * <p>
 * In write mode new keys are appended at the end of the file; the key list and the directory record are written when the file is
 * closed.
 */
public class Directory {
  public static final String CLASS_NAME      = "TDirectory";
  public static final String FILE_CLASS_NAME = "TFile";
  public static final short  RECORD_VERSION  = 5;
  /**
   * Version, creation and modification times, nbytesKeys, nbytesName, three 64-bit seeks and the UUID.
   */
  public static final int    RECORD_SIZE     = 2 + 4 + 4 + 4 + 4 + 8 + 8 + 8 + 2 + 16;
  public static final char   PATH_SEPARATOR  = '/';
  public static final char   CYCLE_SEPARATOR = ';';

  private final RootFile               file;
  private final Directory              parent;
  private final String                 name;
  private final String                 title;
  private final List<Key>              keys           = new ArrayList<>();
  private final Map<String, Directory> subdirectories = new LinkedHashMap<>();
  private       Key                    key;
  private       short                  version        = RECORD_VERSION + Key.LARGE_OFFSET;
  private       long                   ctime;
  private       long                   mtime;
  private       int                    nbytesKeys;
  private       int                    nbytesName;
  private       long                   seekDir;
  private       long                   seekParent;
  private       long                   seekKeys;
  private       UUID                   uuid           = UUID.randomUUID();

  Directory(final RootFile file, final Directory parent, final String name, final String title) {
    this.file = file;
    this.parent = parent;
    this.name = name;
    this.title = title != null ? title : "";
    this.ctime = Datime.now();
    this.mtime = ctime;
  }

  public String getName() {
    return name;
  }

  public String getTitle() {
    return title;
  }

  public Directory getParent() {
    return parent;
  }

  public RootFile getFile() {
    return file;
  }

  /**
   * @return the absolute path, {@code /} for the top directory
   */
  public String getPath() {
    if (parent == null)
      return String.valueOf(PATH_SEPARATOR);
    final String parentPath = parent.getPath();
    return parentPath.length() == 1 ? parentPath + name : parentPath + PATH_SEPARATOR + name;
  }

  public List<Key> getKeys() {
    file.checkOpen();
    return Collections.unmodifiableList(keys);
  }

  /**
   * @return the key with the highest cycle for the name
   */
  public Key getKey(final String keyName) {
    file.checkOpen();
    Key found = null;
    for (final Key k : keys)
      if (k.getName().equals(keyName) && (found == null || k.getCycle() > found.getCycle()))
        found = k;
    if (found == null)
      throw notFound(keyName, -1);
    return found;
  }

  public Key getKey(final String keyName, final int cycle) {
    file.checkOpen();
    for (final Key k : keys)
      if (k.getName().equals(keyName) && k.getCycle() == cycle)
        return k;
    throw notFound(keyName, cycle);
  }

  public boolean exists(final String keyName) {
    file.checkOpen();
    for (final Key k : keys)
      if (k.getName().equals(keyName))
        return true;
    return false;
  }

  /**
   * Resolves a path like {@code a/b/name} or {@code a/b/name;2}, relative to this directory or absolute when it starts with
   * {@code /}. Without a cycle the highest one is returned.
   *
   * @return the decoded object, or a {@link Directory}
   */
  public Object get(final String path) {
    return getKeyByPath(path).getObject();
  }

  public <T> T get(final String path, final Class<T> type) {
    final Object result = get(path);
    if (!type.isInstance(result)) {
      final String found = result instanceof SkippedObject ?
          "skipped object of class '" + ((SkippedObject) result).getClassName() + "'" :
          result.getClass().getName();
      throw new SerializationException(ErrorCode.SERIALIZATION_ERROR,
          "Object '" + path + "' is a " + found + ", not a " + type.getName());
    }
    return type.cast(result);
  }

  public Key getKeyByPath(final String path) {
    file.checkOpen();

    Directory current = this;
    String relative = path;
    if (!relative.isEmpty() && relative.charAt(0) == PATH_SEPARATOR) {
      while (current.parent != null)
        current = current.parent;
      relative = relative.substring(1);
    }

    final String[] parts = relative.split(String.valueOf(PATH_SEPARATOR));
    for (int i = 0; i < parts.length - 1; i++) {
      if (parts[i].isEmpty())
        continue;
      current = current.getDirectory(parts[i]);
    }

    final String last = parts[parts.length - 1];
    final int cyclePos = last.indexOf(CYCLE_SEPARATOR);
    if (cyclePos < 0)
      return current.getKey(last);

    final int cycle;
    try {
      cycle = Integer.parseInt(last.substring(cyclePos + 1));
    } catch (final NumberFormatException e) {
      throw new NotFoundException(ErrorCode.KEY_NOT_FOUND, "Invalid cycle in path '" + path + "'", e);
    }
    return current.getKey(last.substring(0, cyclePos), cycle);
  }

  /**
   * @return the sub-directory with the name
   *
   * @throws InvalidDirectoryException if the key exists but is not a directory
   */
  public Directory getDirectory(final String directoryName) {
    final Key k = getKey(directoryName);
    if (!k.isDirectory())
      throw new InvalidDirectoryException(ErrorCode.INVALID_DIRECTORY,
          "'" + directoryName + "' in directory '" + getPath() + "' is a " + k.getClassName() + ", not a directory");
    return getSubdirectory(k);
  }

  public List<Directory> getDirectories() {
    final List<Directory> result = new ArrayList<>();
    for (final Key k : getKeys())
      if (k.isDirectory())
        result.add(getSubdirectory(k));
    return result;
  }

  public Key put(final String keyName, final Object value) {
    return put(keyName, null, value);
  }

  /**
   * Serializes the value and appends it to the file under a new cycle of the name.
   *
   * @param keyTitle title of the key, if null the empty string
   *
   * @throws InvalidDirectoryException if the file is read-only, the name belongs to a directory or the value is a directory
   */
  public Key put(final String keyName, final String keyTitle, final Object value) {
    file.checkOpen();
    checkWritable();
    checkName(keyName);

    if (value == null)
      throw new IllegalArgumentException("Cannot store a null object under '" + keyName + "'");

    if (value instanceof Directory) {
      for (Directory d = this; d != null; d = d.parent)
        if (d == value)
          throw new InvalidDirectoryException(ErrorCode.INVALID_DIRECTORY,
              "Directory '" + ((Directory) value).getPath() + "' cannot contain itself");
      throw new InvalidDirectoryException(ErrorCode.INVALID_DIRECTORY,
          "Directories cannot be stored as objects, use mkdir() to create '" + keyName + "'");
    }

    if (subdirectories.containsKey(keyName))
      throw new InvalidDirectoryException(ErrorCode.INVALID_DIRECTORY,
          "Name '" + keyName + "' is used by a directory in '" + getPath() + "'");

    final String className = file.getStreamerRegistry().getClassName(value);
    final byte[] payload = file.getStreamerRegistry()
        .marshal(value, Key.computeHeaderSize(className, keyName, keyTitle != null ? keyTitle : ""));

    final Key k = file.writeObjectKey(this, className, keyName, keyTitle, nextCycle(keyName), payload);
    keys.add(k);
    mtime = Datime.now();
    return k;
  }

  /**
   * Creates the directories of the path that do not exist yet.
   *
   * @throws InvalidDirectoryException if the last directory of the path already exists or a name is taken by an object
   */
  public Directory mkdir(final String path) {
    file.checkOpen();
    checkWritable();

    final String[] parts = path.split(String.valueOf(PATH_SEPARATOR));
    Directory current = this;
    for (int i = 0; i < parts.length; i++) {
      if (parts[i].isEmpty())
        continue;
      final boolean last = i == parts.length - 1;
      if (current.exists(parts[i])) {
        if (last)
          throw new InvalidDirectoryException(ErrorCode.INVALID_DIRECTORY,
              "Cannot create directory '" + parts[i] + "' in '" + current.getPath() + "': name already exists");
        current = current.getDirectory(parts[i]);
      } else
        current = current.createSubdirectory(parts[i]);
    }
    return current;
  }

  public void walk(final WalkCallback callback) {
    walk(callback, null);
  }

  /**
   * Visits this directory, then every key in insertion order, descending into sub-directories.
   *
   * @param cancel checked before every key, null for no cancellation
   *
   * @throws OperationCancelledException if the cancellation signal is raised
   */
  public void walk(final WalkCallback callback, final BooleanSupplier cancel) {
    file.checkOpen();
    callback.visit(getPath(), this);
    final String prefix = parent == null ? getPath() : getPath() + PATH_SEPARATOR;
    for (final Key k : new ArrayList<>(keys)) {
      if (cancel != null && cancel.getAsBoolean())
        throw new OperationCancelledException(ErrorCode.OPERATION_CANCELLED, "Walk of '" + getPath() + "' cancelled");

      if (k.isDirectory())
        getSubdirectory(k).walk(callback, cancel);
      else
        callback.visit(prefix + k.getName(), k.getObject());
    }
  }

  public long getSeekDir() {
    return seekDir;
  }

  public long getSeekKeys() {
    return seekKeys;
  }

  public int getNbytesName() {
    return nbytesName;
  }

  public long getCreationDatime() {
    return ctime;
  }

  public long getModificationDatime() {
    return mtime;
  }

  public UUID getUuid() {
    return uuid;
  }

  @Override
  public String toString() {
    return "Directory{" + getPath() + ", keys=" + keys.size() + "}";
  }

  Directory getSubdirectory(final Key k) {
    final Directory cached = subdirectories.get(k.getName());
    if (cached != null && cached.key == k)
      return cached;

    final Directory sub = new Directory(file, this, k.getName(), k.getTitle());
    sub.key = k;
    sub.seekDir = k.getSeekKey();
    final Binary record = new Binary(k.getPayload());
    sub.readRecord(record);
    sub.readKeys();
    subdirectories.put(k.getName(), sub);
    return sub;
  }

  /**
   * Binds this directory to its key. The record is at {@code seekDir + nbytesName}.
   */
  void attach(final Key k, final int nbytesName) {
    this.key = k;
    this.seekDir = k.getSeekKey();
    this.nbytesName = nbytesName;
    this.seekParent = parent != null ? parent.seekDir : 0;
  }

  void readRecord(final Binary buffer) {
    version = buffer.getShort();
    ctime = buffer.getUnsignedInt();
    mtime = buffer.getUnsignedInt();
    nbytesKeys = buffer.getInt();
    nbytesName = buffer.getInt();
    if (version > Key.LARGE_OFFSET) {
      seekDir = buffer.getLong();
      seekParent = buffer.getLong();
      seekKeys = buffer.getLong();
    } else {
      seekDir = buffer.getInt();
      seekParent = buffer.getInt();
      seekKeys = buffer.getInt();
    }
    buffer.getShort();
    uuid = new UUID(buffer.getLong(), buffer.getLong());
    buffer.checkError();
  }

  byte[] toRecord() {
    final Binary buffer = new Binary(RECORD_SIZE);
    buffer.putShort((short) (RECORD_VERSION + Key.LARGE_OFFSET));
    buffer.putUnsignedInt(ctime);
    buffer.putUnsignedInt(mtime);
    buffer.putInt(nbytesKeys);
    buffer.putInt(nbytesName);
    buffer.putLong(seekDir);
    buffer.putLong(seekParent);
    buffer.putLong(seekKeys);
    buffer.putShort(FileHeader.UUID_VERSION);
    buffer.putLong(uuid.getMostSignificantBits());
    buffer.putLong(uuid.getLeastSignificantBits());
    buffer.checkError();
    return buffer.toByteArray();
  }

  void readKeys() {
    if (seekKeys <= 0)
      return;

    final Binary buffer = new Binary(file.read(seekKeys, nbytesKeys));
    final Key header = Key.read(buffer, file, this);
    buffer.position(header.getKeyLength());
    final int count = buffer.getInt();
    buffer.checkError();
    for (int i = 0; i < count; i++)
      keys.add(Key.read(buffer, file, this));
  }

  /**
   * Writes the key list of this directory and of its sub-directories, then the directory records in place.
   */
  void flush() {
    for (final Directory sub : subdirectories.values())
      sub.flush();

    final Binary list = new Binary();
    list.putInt(keys.size());
    for (final Key k : keys)
      k.write(list);
    list.checkError();

    final Key listKey = file.writeStoredKey(this, key.getClassName(), name, title, list.toByteArray());
    seekKeys = listKey.getSeekKey();
    nbytesKeys = listKey.getNbytes();

    file.write(seekDir + nbytesName, toRecord());
    LogManager.instance().log(this, Level.FINE, "Flushed directory '%s' (%d keys)", null, getPath(), keys.size());
  }

  private Directory createSubdirectory(final String directoryName) {
    checkName(directoryName);

    final Directory sub = new Directory(file, this, directoryName, "");
    final Key k = file.writeStoredKey(this, CLASS_NAME, directoryName, "", new byte[RECORD_SIZE], nextCycle(directoryName));
    sub.attach(k, k.getKeyLength());
    file.write(sub.seekDir + sub.nbytesName, sub.toRecord());

    keys.add(k);
    subdirectories.put(directoryName, sub);
    mtime = Datime.now();
    return sub;
  }

  private short nextCycle(final String keyName) {
    int max = 0;
    for (final Key k : keys)
      if (k.getName().equals(keyName))
        max = Math.max(max, k.getCycle());
    if (max >= Short.MAX_VALUE)
      throw new InvalidDirectoryException(ErrorCode.INVALID_DIRECTORY, "Too many cycles for key '" + keyName + "'");
    return (short) (max + 1);
  }

  private void checkWritable() {
    if (!file.isWritable())
      throw new InvalidDirectoryException(ErrorCode.INVALID_DIRECTORY, "File '" + file.getPath() + "' is open in read-only mode");
  }

  private static void checkName(final String keyName) {
    if (keyName == null || keyName.isEmpty() || keyName.indexOf(PATH_SEPARATOR) > -1 || keyName.indexOf(CYCLE_SEPARATOR) > -1)
      throw new IllegalArgumentException("Invalid key name '" + keyName + "'");
  }

  private NotFoundException notFound(final String keyName, final int cycle) {
    final NotFoundException e = new NotFoundException(ErrorCode.KEY_NOT_FOUND,
        "Key '" + keyName + (cycle > -1 ? ";" + cycle : "") + "' not found in directory '" + getPath() + "'");
    e.addContext("directory", getPath()).addContext("key", keyName);
    return e;
  }
}
