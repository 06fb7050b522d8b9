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
package com.rootio.tree;

import com.rootio.binary.Binary;
import com.rootio.compression.BlockCodec;
import com.rootio.engine.Directory;
import com.rootio.engine.Key;
import com.rootio.engine.RootFile;

import java.util.ArrayList;
import java.util.List;

/**
 * Buffers the entries of one branch and writes a basket when the buffer reaches the basket size or the entry limit.
 */
class BranchWriter {
  private final RootFile       file;
  private final Directory      directory;
  private final String         name;
  private final String         treeName;
  private final List<WriteVar> vars;
  private final List<Leaf>     leaves     = new ArrayList<>();
  private final int            basketSize;
  private final int            maxEntriesPerBasket;
  private final boolean        variable;
  private final int            entrySize;
  private final Binary         data       = new Binary();
  private final List<Integer>  offsets    = new ArrayList<>();
  private final List<Long>     seeks      = new ArrayList<>();
  private final List<Integer>  bytes      = new ArrayList<>();
  private final List<Long>     boundaries = new ArrayList<>();
  private       int            basketEntries;
  private       long           entries;
  private       long           totBytes;
  private       long           zipBytes;

  BranchWriter(final Directory directory, final String name, final String treeName, final List<WriteVar> vars, final int basketSize,
      final int maxEntriesPerBasket) {
    this.file = directory.getFile();
    this.directory = directory;
    this.name = name;
    this.treeName = treeName;
    this.vars = vars;
    this.basketSize = basketSize;
    this.maxEntriesPerBasket = maxEntriesPerBasket;

    int offset = 0;
    boolean anyVariable = false;
    for (final WriteVar v : vars) {
      final Leaf leaf = v.getLeaf();
      if (leaf.isVariable())
        anyVariable = true;
      else {
        leaf.setOffset(offset);
        offset += leaf.getEntrySize();
      }
      leaves.add(leaf);
    }
    if (anyVariable && vars.size() > 1)
      throw new IllegalArgumentException("Branch '" + name + "' mixes a variable-size leaf with other leaves");

    this.variable = anyVariable;
    this.entrySize = anyVariable ? -1 : offset;
    this.boundaries.add(0L);
  }

  void writeEntry() {
    if (variable)
      offsets.add(data.size());
    for (final WriteVar v : vars)
      v.getLeaf().write(data, v.get());
    data.checkError();

    basketEntries++;
    entries++;
    if (data.size() >= basketSize || (maxEntriesPerBasket > 0 && basketEntries >= maxEntriesPerBasket))
      flush();
  }

  void flush() {
    if (basketEntries == 0)
      return;

    final int keyLength = Key.computeHeaderSize(Basket.CLASS_NAME, name, treeName) + Basket.EXTENSION_SIZE;
    final int dataLength = data.size();
    final int last = keyLength + dataLength;

    final Binary payload = new Binary(dataLength + (variable ? Binary.INT_SERIALIZED_SIZE * (basketEntries + 2) : 0));
    payload.putByteArray(data.getContent(), 0, dataLength);
    if (variable) {
      payload.putInt(basketEntries + 1);
      for (final int offset : offsets)
        payload.putInt(keyLength + offset);
      payload.putInt(last);
    }
    payload.checkError();

    final Binary extension = new Binary(Basket.EXTENSION_SIZE);
    extension.putShort(Basket.VERSION);
    extension.putInt(basketSize);
    extension.putInt(variable ? 0 : entrySize);
    extension.putInt(basketEntries);
    extension.putInt(last);
    extension.putByte((byte) 0);

    final Key key = new Key(file, directory, Basket.CLASS_NAME, name, treeName, (short) 1, payload.size(), Basket.EXTENSION_SIZE);
    file.writeKey(key, extension.toByteArray(), BlockCodec.compress(payload.toByteArray(), file.getCompression()));

    seeks.add(key.getSeekKey());
    bytes.add(key.getNbytes());
    boundaries.add(entries);
    totBytes += keyLength + payload.size();
    zipBytes += key.getNbytes();

    data.clear();
    offsets.clear();
    basketEntries = 0;
  }

  Branch toBranch() {
    final long[] basketEntry = new long[boundaries.size()];
    for (int i = 0; i < basketEntry.length; i++)
      basketEntry[i] = boundaries.get(i);
    final long[] basketSeek = new long[seeks.size()];
    final int[] basketBytes = new int[bytes.size()];
    for (int i = 0; i < basketSeek.length; i++) {
      basketSeek[i] = seeks.get(i);
      basketBytes[i] = bytes.get(i);
    }
    return new Branch(name, branchTitle(), leaves, basketSize, file.getCompression().getCode(), entries, basketEntry, basketSeek,
        basketBytes, totBytes, zipBytes);
  }

  long getTotBytes() {
    return totBytes;
  }

  long getZipBytes() {
    return zipBytes;
  }

  private String branchTitle() {
    final StringBuilder title = new StringBuilder();
    for (final Leaf l : leaves) {
      if (title.length() > 0)
        title.append(':');
      title.append(l.getTitle());
    }
    return title.toString();
  }
}
