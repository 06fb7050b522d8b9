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
import com.rootio.compression.BlockCodec;
import com.rootio.exception.CorruptionException;
import com.rootio.exception.ErrorCode;

import java.time.LocalDateTime;

/**
 * Directory entry. The pair {@code (name, cycle)} identifies a key inside its directory. The payload starts at
 * {@code seekKey + keyLength} and is loaded lazily.
 */
public class Key {
  public static final short VERSION      = 4;
  public static final short LARGE_OFFSET = 1000;
  /**
   * Fixed part of the header: nbytes, version, objLen, datime, keyLen, cycle.
   */
  public static final int   FIXED_HEADER_SIZE = 4 + 2 + 4 + 4 + 2 + 2;

  private final RootFile  file;
  private final Directory directory;
  private       int       nbytes;
  private       short     version;
  private       int       objLen;
  private       long      datime;
  private       short     keyLen;
  private       short     cycle;
  private       long      seekKey;
  private       long      seekPdir;
  private       String    className;
  private       String    name;
  private       String    title;

  private Key(final RootFile file, final Directory directory) {
    this.file = file;
    this.directory = directory;
  }

  /**
   * Creates the header of a new key. Size and position are assigned when the payload is written.
   *
   * @param extraHeaderSize bytes appended to the standard header, counted in the key length
   */
  public Key(final RootFile file, final Directory directory, final String className, final String name, final String title,
      final short cycle, final int objLen, final int extraHeaderSize) {
    this(file, directory);
    this.version = (short) (VERSION + LARGE_OFFSET);
    this.className = className;
    this.name = name;
    this.title = title != null ? title : "";
    this.cycle = cycle;
    this.objLen = objLen;
    this.datime = Datime.now();
    this.seekPdir = directory != null ? directory.getSeekDir() : 0;
    final int size = getStandardHeaderSize() + extraHeaderSize;
    if (size > Short.MAX_VALUE)
      throw new IllegalArgumentException("Key header too big: " + size + " bytes");
    this.keyLen = (short) size;
  }

  public static Key read(final Binary buffer, final RootFile file, final Directory directory) {
    final Key key = new Key(file, directory);
    final int start = buffer.position();
    key.nbytes = buffer.getInt();
    key.version = buffer.getShort();
    key.objLen = buffer.getInt();
    key.datime = buffer.getUnsignedInt();
    key.keyLen = buffer.getShort();
    key.cycle = buffer.getShort();
    if (key.version > LARGE_OFFSET) {
      key.seekKey = buffer.getLong();
      key.seekPdir = buffer.getLong();
    } else {
      key.seekKey = buffer.getInt();
      key.seekPdir = buffer.getInt();
    }
    key.className = buffer.getString();
    key.name = buffer.getString();
    key.title = buffer.getString();
    buffer.checkError();

    if (key.keyLen < buffer.position() - start || key.nbytes < key.keyLen || key.objLen < 0)
      throw new CorruptionException(ErrorCode.CORRUPT_BLOCK,
          "Invalid header of key '" + key.name + "' (nbytes=" + key.nbytes + " keyLen=" + key.keyLen + " objLen=" + key.objLen + ")");
    return key;
  }

  public void write(final Binary buffer) {
    buffer.putInt(nbytes);
    buffer.putShort(version);
    buffer.putInt(objLen);
    buffer.putUnsignedInt(datime);
    buffer.putShort(keyLen);
    buffer.putShort(cycle);
    if (version > LARGE_OFFSET) {
      buffer.putLong(seekKey);
      buffer.putLong(seekPdir);
    } else {
      buffer.putInt((int) seekKey);
      buffer.putInt((int) seekPdir);
    }
    buffer.putString(className);
    buffer.putString(name);
    buffer.putString(title);
  }

  /**
   * @return the size of the header without extensions
   */
  public int getStandardHeaderSize() {
    final int seeks = version > LARGE_OFFSET ? 16 : 8;
    return FIXED_HEADER_SIZE + seeks + Binary.getStringSize(className) + Binary.getStringSize(name) + Binary.getStringSize(title);
  }

  /**
   * @return the size of the header of a new key, without extensions
   */
  public static int computeHeaderSize(final String className, final String name, final String title) {
    return FIXED_HEADER_SIZE + 16 + Binary.getStringSize(className) + Binary.getStringSize(name) + Binary.getStringSize(title);
  }

  /**
   * Reads and decompresses the payload. Nothing is cached: every call goes to the storage.
   */
  public byte[] getPayload() {
    final byte[] stored = file.read(seekKey + keyLen, nbytes - keyLen);
    try {
      return BlockCodec.decompress(stored, objLen);
    } catch (final CorruptionException e) {
      e.addContext("key", name + ";" + cycle).addContext("seekKey", seekKey);
      throw e;
    }
  }

  /**
   * Decodes the payload through the streamer registry of the file.
   */
  public Object getObject() {
    file.checkOpen();
    if (isDirectory())
      return directory.getSubdirectory(this);
    return file.getStreamerRegistry().unmarshal(className, getPayload(), keyLen, file);
  }

  public boolean isDirectory() {
    return Directory.CLASS_NAME.equals(className) || Directory.FILE_CLASS_NAME.equals(className);
  }

  public RootFile getFile() {
    return file;
  }

  public Directory getDirectory() {
    return directory;
  }

  public int getNbytes() {
    return nbytes;
  }

  void setNbytes(final int nbytes) {
    this.nbytes = nbytes;
  }

  public short getVersion() {
    return version;
  }

  public int getObjLen() {
    return objLen;
  }

  public long getDatime() {
    return datime;
  }

  public LocalDateTime getDateTime() {
    return Datime.decode(datime);
  }

  public short getKeyLength() {
    return keyLen;
  }

  public short getCycle() {
    return cycle;
  }

  public long getSeekKey() {
    return seekKey;
  }

  void setSeekKey(final long seekKey) {
    this.seekKey = seekKey;
  }

  public long getSeekPdir() {
    return seekPdir;
  }

  public String getClassName() {
    return className;
  }

  public String getName() {
    return name;
  }

  public String getTitle() {
    return title;
  }

  public boolean isCompressed() {
    return nbytes - keyLen != objLen;
  }

  /**
   * @return uncompressed size divided by stored size
   */
  public float getCompressionRatio() {
    final int stored = nbytes - keyLen;
    return stored > 0 ? (float) objLen / stored : 1F;
  }

  @Override
  public String toString() {
    return className + " " + name + ";" + cycle + " \"" + title + "\" (seek=" + seekKey + " nbytes=" + nbytes + " objLen=" + objLen + ")";
  }
}
