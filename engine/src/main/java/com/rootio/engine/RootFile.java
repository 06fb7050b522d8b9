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

import com.rootio.ContextConfiguration;
import com.rootio.binary.Binary;
import com.rootio.compression.BlockCodec;
import com.rootio.compression.CompressionSettings;
import com.rootio.exception.ClosedHandleException;
import com.rootio.exception.CorruptionException;
import com.rootio.exception.ErrorCode;
import com.rootio.exception.ExceptionBuilder;
import com.rootio.exception.RootIOException;
import com.rootio.exception.StorageException;
import com.rootio.log.LogManager;
import com.rootio.serializer.StreamerInfo;
import com.rootio.serializer.StreamerInfoCodec;
import com.rootio.serializer.StreamerRegistry;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;

/**
 * File handle. A file is either opened for reading with {@link #open(String)} or created for writing with
 * {@link #create(String, ContextConfiguration)}, never both.
 * <p>
 * Writing always appends at the end of the file: free gaps are never reused. The key lists, the streamer infos, the free segments
 * and the header are written by {@link #close()}. A failed close leaves the file partially written.
 * <p>
 * A handle has no internal locking: it must be used by one thread at a time, since reads also fill the directory caches. Threads
 * that read the same file concurrently open a read-only handle each.
 *
 * @author Luca Garulli
 */
public class RootFile implements Closeable {
  /**
   * Last byte of the free segment written at close, as large files use.
   */
  public static final long FREE_SEGMENT_LAST = 2000000000L;

  private final String               path;
  private final boolean              writable;
  private final ContextConfiguration configuration;
  private final StreamerRegistry     registry      = new StreamerRegistry();
  private final List<FreeSegment>    freeSegments  = new ArrayList<>();
  private       StorageFile          storage;
  private       FileHeader           header;
  private       Directory            directory;
  private       CompressionSettings  compression;
  private       volatile boolean     open;

  private RootFile(final String path, final boolean writable, final ContextConfiguration configuration) {
    this.path = path;
    this.writable = writable;
    this.configuration = configuration != null ? configuration : new ContextConfiguration();
  }

  public static RootFile open(final String path) {
    final RootFile file = new RootFile(path, false, null);
    file.openForRead();
    return file;
  }

  public static RootFile create(final String path) {
    return create(path, "", new ContextConfiguration());
  }

  public static RootFile create(final String path, final ContextConfiguration configuration) {
    return create(path, "", configuration);
  }

  /**
   * Creates a new file, replacing any existing one. Compression and tree settings are taken from the configuration.
   */
  public static RootFile create(final String path, final String title, final ContextConfiguration configuration) {
    final RootFile file = new RootFile(path, true, new ContextConfiguration(configuration));
    file.openForWrite(title);
    return file;
  }

  // DIRECTORY SHORTCUTS

  public Directory getDirectory() {
    checkOpen();
    return directory;
  }

  public Object get(final String path) {
    return getDirectory().get(path);
  }

  public <T> T get(final String path, final Class<T> type) {
    return getDirectory().get(path, type);
  }

  public Key put(final String name, final Object value) {
    return getDirectory().put(name, value);
  }

  public Key put(final String name, final String title, final Object value) {
    return getDirectory().put(name, title, value);
  }

  public List<Key> getKeys() {
    return getDirectory().getKeys();
  }

  public Directory mkdir(final String path) {
    return getDirectory().mkdir(path);
  }

  public void walk(final WalkCallback callback) {
    getDirectory().walk(callback);
  }

  public void walk(final WalkCallback callback, final BooleanSupplier cancel) {
    getDirectory().walk(callback, cancel);
  }

  // LIFECYCLE

  /**
   * Closes the file. In write mode flushes key lists, streamer infos, free segments and header first.
   *
   * @throws StorageException if the flush fails. The handle is closed anyway and the file must be considered partially written.
   */
  @Override
  public void close() {
    if (!open)
      return;

    if (!writable) {
      open = false;
      storage.close();
      LogManager.instance().log(this, Level.FINE, "Closed file %s", null, path);
      return;
    }

    try {
      directory.flush();
      writeStreamerInfos();
      writeFreeSegments();
      header.nbytesName = directory.getNbytesName();
      write(0, header.toByteArray());
      try {
        storage.flush();
      } catch (final IOException e) {
        throw storageError("Error on flushing file", 0, e);
      }

      LogManager.instance()
          .log(this, Level.INFO, "Closed file %s (%d top-level keys, %d bytes, compression=%s)", null, path, directory.getKeys().size(),
              header.end, compression);

    } catch (final RootIOException e) {
      LogManager.instance().log(this, Level.SEVERE, "Error on closing file %s, the file may be partially written", e, path);
      throw e;
    } finally {
      open = false;
      storage.close();
    }
  }

  public boolean isOpen() {
    return open;
  }

  public boolean isWritable() {
    return writable;
  }

  public void checkOpen() {
    if (!open)
      throw new ClosedHandleException(ErrorCode.CLOSED_HANDLE, "File '" + path + "' is closed");
  }

  // METADATA

  public String getPath() {
    return path;
  }

  public String getName() {
    return directory != null ? directory.getName() : new File(path).getName();
  }

  public String getTitle() {
    return directory.getTitle();
  }

  public int getVersion() {
    return header.version;
  }

  public UUID getUUID() {
    return header.uuid;
  }

  public long getEnd() {
    return header.end;
  }

  public LocalDateTime getCreationTime() {
    return Datime.decode(directory.getCreationDatime());
  }

  public LocalDateTime getModificationTime() {
    return Datime.decode(directory.getModificationDatime());
  }

  public CompressionSettings getCompression() {
    return compression;
  }

  public ContextConfiguration getConfiguration() {
    return configuration;
  }

  public StreamerRegistry getStreamerRegistry() {
    return registry;
  }

  /**
   * @return the streamer infos stored in the file when reading, the ones written so far when writing
   */
  public List<StreamerInfo> getStreamerInfos() {
    return writable ? registry.getWrittenStreamerInfos() : registry.getFileStreamerInfos();
  }

  public List<FreeSegment> getFreeSegments() {
    return Collections.unmodifiableList(freeSegments);
  }

  // LOW LEVEL I/O

  public byte[] read(final long position, final int length) {
    checkOpen();
    if (length < 0)
      throw new CorruptionException(ErrorCode.CORRUPT_BLOCK, "Invalid negative length " + length + " at position " + position);
    try {
      return storage.read(position, length);
    } catch (final IOException e) {
      throw storageError("Error on reading " + length + " bytes", position, e);
    }
  }

  public void write(final long position, final byte[] content) {
    checkOpen();
    try {
      storage.write(position, content);
    } catch (final IOException e) {
      throw storageError("Error on writing " + content.length + " bytes", position, e);
    }
  }

  /**
   * Reserves space at the end of the file.
   *
   * @return the position of the reserved space
   */
  public long allocate(final int size) {
    final long position = header.end;
    header.end += size;
    return position;
  }

  /**
   * Reads the header of the key at the position.
   */
  public Key readKey(final long position, final Directory parent) {
    final byte[] fixed = read(position, Key.FIXED_HEADER_SIZE);
    final int keyLen = new Binary(fixed).getShort(Key.FIXED_HEADER_SIZE - 4);
    return Key.read(new Binary(read(position, keyLen)), this, parent);
  }

  /**
   * Allocates and writes a key: the header, the header extension (if any) and the stored payload. The key length must already
   * include the extension.
   */
  public void writeKey(final Key key, final byte[] headerExtension, final byte[] stored) {
    checkOpen();
    final int extension = headerExtension != null ? headerExtension.length : 0;
    if (key.getStandardHeaderSize() + extension != key.getKeyLength())
      throw new IllegalArgumentException(
          "Key length " + key.getKeyLength() + " does not match header size " + (key.getStandardHeaderSize() + extension));

    final int nbytes = key.getKeyLength() + stored.length;
    key.setNbytes(nbytes);
    key.setSeekKey(allocate(nbytes));

    final Binary buffer = new Binary(nbytes);
    key.write(buffer);
    if (headerExtension != null)
      buffer.putByteArray(headerExtension);
    buffer.putByteArray(stored);
    buffer.checkError();

    write(key.getSeekKey(), buffer.toByteArray());
    LogManager.instance()
        .log(this, Level.FINE, "Written key %s;%d class=%s at %d (%d bytes, objLen=%d)", null, key.getName(), key.getCycle(),
            key.getClassName(), key.getSeekKey(), nbytes, key.getObjLen());
  }

  Key writeObjectKey(final Directory dir, final String className, final String name, final String title, final short cycle,
      final byte[] payload) {
    final Key key = new Key(this, dir, className, name, title, cycle, payload.length, 0);
    writeKey(key, null, BlockCodec.compress(payload, compression));
    return key;
  }

  Key writeStoredKey(final Directory dir, final String className, final String name, final String title, final byte[] payload) {
    return writeStoredKey(dir, className, name, title, payload, (short) 1);
  }

  Key writeStoredKey(final Directory dir, final String className, final String name, final String title, final byte[] payload,
      final short cycle) {
    final Key key = new Key(this, dir, className, name, title, cycle, payload.length, 0);
    writeKey(key, null, payload);
    return key;
  }

  @Override
  public String toString() {
    return path;
  }

  private void openForWrite(final String title) {
    compression = CompressionSettings.fromConfiguration(configuration);
    try {
      storage = new StorageFile(path, StorageFile.MODE.READ_WRITE, true);
    } catch (final IOException e) {
      throw storageError("Cannot create file", 0, e);
    }
    open = true;

    header = new FileHeader();
    header.compress = compression.getCode();

    final String name = new File(path).getName();
    directory = new Directory(this, null, name, title);
    final int nameSize = Binary.getStringSize(name) + Binary.getStringSize(directory.getTitle());

    final Key key = new Key(this, null, Directory.FILE_CLASS_NAME, name, directory.getTitle(), (short) 1,
        nameSize + Directory.RECORD_SIZE, 0);
    final Binary payload = new Binary(nameSize + Directory.RECORD_SIZE);
    payload.putString(name);
    payload.putString(directory.getTitle());
    payload.fill((byte) 0, Directory.RECORD_SIZE);
    writeKey(key, null, payload.toByteArray());

    directory.attach(key, key.getKeyLength() + nameSize);
    header.nbytesName = directory.getNbytesName();
    write(0, header.toByteArray());

    LogManager.instance().log(this, Level.INFO, "Created file %s (compression=%s)", null, path, compression);
  }

  private void openForRead() {
    try {
      storage = new StorageFile(path, StorageFile.MODE.READ_ONLY, false);
    } catch (final IOException e) {
      throw storageError("Cannot open file", 0, e);
    }
    open = true;

    try {
      final long size = storage.getSize();
      if (size < FileHeader.MAGIC.length)
        throw new CorruptionException(ErrorCode.NOT_A_ROOT_FILE, "File '" + path + "' is too short (" + size + " bytes)");

      header = FileHeader.read(read(0, (int) Math.min(size, FileHeader.BEGIN)));
      compression = CompressionSettings.fromCode(header.compress);

      final Key topKey = readKey(header.begin, null);
      final Binary top = new Binary(read(header.begin, header.nbytesName + Directory.RECORD_SIZE));
      top.position(topKey.getKeyLength());
      final String name = top.getString();
      final String title = top.getString();
      top.position(header.nbytesName);
      top.checkError();

      directory = new Directory(this, null, name, title);
      directory.readRecord(top);
      directory.attach(topKey, header.nbytesName);
      directory.readKeys();

      if (header.seekInfo > 0) {
        final Key infoKey = readKey(header.seekInfo, directory);
        try {
          registry.loadFileStreamerInfos(StreamerInfoCodec.decode(infoKey.getPayload(), infoKey.getKeyLength()));
        } catch (final RootIOException e) {
          LogManager.instance()
              .log(this, Level.WARNING, "Cannot decode the streamer infos of file %s, using the built-in layouts", e, path);
        }
      }

      if (header.seekFree > 0)
        readFreeSegments();

    } catch (final IOException e) {
      storage.close();
      open = false;
      throw storageError("Cannot read file", 0, e);
    } catch (final RuntimeException e) {
      storage.close();
      open = false;
      throw e;
    }

    LogManager.instance()
        .log(this, Level.FINE, "Opened file %s (version=%d, %d top-level keys, %d streamer infos)", null, path, header.version,
            directory.getKeys().size(), registry.getFileStreamerInfos().size());
  }

  private void writeStreamerInfos() {
    final List<StreamerInfo> infos = registry.getWrittenStreamerInfos();
    final byte[] payload = StreamerInfoCodec.encode(infos,
        Key.computeHeaderSize(StreamerInfoCodec.KEY_CLASS, StreamerInfoCodec.KEY_NAME, StreamerInfoCodec.KEY_TITLE));

    final Key key = new Key(this, directory, StreamerInfoCodec.KEY_CLASS, StreamerInfoCodec.KEY_NAME, StreamerInfoCodec.KEY_TITLE,
        (short) 1, payload.length, 0);
    writeKey(key, null, BlockCodec.compress(payload, compression));
    header.seekInfo = key.getSeekKey();
    header.nbytesInfo = key.getNbytes();
  }

  /**
   * Writes the free segment list as the last key: one segment from the end of that key on.
   */
  private void writeFreeSegments() {
    final Key key = new Key(this, directory, Directory.FILE_CLASS_NAME, directory.getName(), directory.getTitle(), (short) 1,
        FreeSegment.SIZE, 0);
    final long first = header.end + key.getKeyLength() + FreeSegment.SIZE;
    final long last = Math.max(FREE_SEGMENT_LAST, first + FREE_SEGMENT_LAST / 2);

    final Binary payload = new Binary(FreeSegment.SIZE);
    payload.putShort((short) (FreeSegment.VERSION + FreeSegment.LARGE_OFFSET));
    payload.putLong(first);
    payload.putLong(last);
    writeKey(key, null, payload.toByteArray());

    freeSegments.clear();
    freeSegments.add(new FreeSegment(first, last));
    header.seekFree = key.getSeekKey();
    header.nbytesFree = key.getNbytes();
    header.nfree = 1;
  }

  private void readFreeSegments() {
    final Key key = readKey(header.seekFree, directory);
    final Binary buffer = new Binary(key.getPayload());
    for (int i = 0; i < header.nfree && buffer.remaining() > 0; i++) {
      final short version = buffer.getShort();
      final long first = version > FreeSegment.LARGE_OFFSET ? buffer.getLong() : buffer.getUnsignedInt();
      final long last = version > FreeSegment.LARGE_OFFSET ? buffer.getLong() : buffer.getUnsignedInt();
      buffer.checkError();
      freeSegments.add(new FreeSegment(first, last));
    }
  }

  private StorageException storageError(final String message, final long position, final IOException cause) {
    return (StorageException) ExceptionBuilder.storage().code(ErrorCode.IO_ERROR).message("%s '%s': %s", message, path, cause.getMessage())
        .cause(cause).context("path", path).context("position", position).build();
  }
}
