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

import com.rootio.log.LogManager;

import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.logging.Level;

/**
 * Positional access to the file on disk. Reads and writes never move a shared cursor, so concurrent reads through one instance are
 * safe.
 */
public class StorageFile {
  public enum MODE {
    READ_ONLY, READ_WRITE
  }

  private final String           filePath;
  private final MODE             mode;
  private       RandomAccessFile file;
  private       FileChannel      channel;
  private       boolean          open;

  public StorageFile(final String filePath, final MODE mode, final boolean truncate) throws IOException {
    this.filePath = filePath;
    this.mode = mode;
    this.file = new RandomAccessFile(new File(filePath), mode == MODE.READ_WRITE ? "rw" : "r");
    if (truncate && mode == MODE.READ_WRITE)
      this.file.setLength(0);
    this.channel = file.getChannel();
    this.open = true;
  }

  public void close() {
    try {
      LogManager.instance().log(this, Level.FINE, "Closing file %s...", null, filePath);

      if (channel != null) {
        channel.close();
        channel = null;
      }

      if (file != null) {
        file.close();
        file = null;
      }

    } catch (final IOException e) {
      LogManager.instance().log(this, Level.SEVERE, "Error on closing file %s", e, filePath);
    }
    this.open = false;
  }

  /**
   * Reads exactly {@code length} bytes.
   *
   * @throws EOFException if the file ends before
   */
  public byte[] read(final long position, final int length) throws IOException {
    if (position < 0)
      throw new IOException("Invalid negative position " + position + " in file " + filePath);

    final ByteBuffer buffer = ByteBuffer.allocate(length);
    long pos = position;
    while (buffer.hasRemaining()) {
      final int read = channel.read(buffer, pos);
      if (read < 0)
        throw new EOFException(
            "Cannot read " + length + " bytes at position " + position + " of file " + filePath + " (size=" + channel.size() + ")");
      pos += read;
    }
    return buffer.array();
  }

  public void write(final long position, final byte[] content) throws IOException {
    final ByteBuffer buffer = ByteBuffer.wrap(content);
    long pos = position;
    while (buffer.hasRemaining())
      pos += channel.write(buffer, pos);
  }

  public long getSize() throws IOException {
    return channel.size();
  }

  public void flush() throws IOException {
    channel.force(true);
  }

  public boolean isOpen() {
    return open;
  }

  public MODE getMode() {
    return mode;
  }

  public String getFilePath() {
    return filePath;
  }

  @Override
  public String toString() {
    return filePath;
  }
}
