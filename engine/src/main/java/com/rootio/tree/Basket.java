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
import com.rootio.engine.Key;
import com.rootio.engine.RootFile;
import com.rootio.exception.CorruptionException;
import com.rootio.exception.ErrorCode;
import com.rootio.log.LogManager;

import java.util.logging.Level;

/**
 * Inflated basket. The scratch buffer holds the key header followed by the uncompressed payload, so positions stored in the basket
 * (the "last" pointer and the offsets table) index it directly.
 * <p>
 * Basket keys extend the key header with: version int16, buffer size int32, entry size int32, entries int32, last int32 and a flag
 * byte. Variable-size baskets store after the data, at "last", an int32 count ({@code entries + 1}) followed by the offset of every
 * entry and of the end of the data.
 */
public class Basket {
  public static final String CLASS_NAME     = "TBasket";
  public static final short  VERSION        = 3;
  public static final int    EXTENSION_SIZE = 2 + 4 + 4 + 4 + 4 + 1;

  private final Branch    branch;
  private final int       index;
  private final EntrySpan span;
  private final int       keyLength;
  private final int       last;
  private final byte[]    scratch;
  private final int[]     offsets;

  private Basket(final Branch branch, final int index, final EntrySpan span, final int keyLength, final int last, final byte[] scratch,
      final int[] offsets) {
    this.branch = branch;
    this.index = index;
    this.span = span;
    this.keyLength = keyLength;
    this.last = last;
    this.scratch = scratch;
    this.offsets = offsets;
  }

  /**
   * Loads and decompresses a basket of the branch. Decoding is atomic: a basket is returned only after every check passed.
   *
   * @throws CorruptionException with {@link ErrorCode#CORRUPT_BASKET} if the basket does not match its branch or its own header
   */
  public static Basket inflate(final RootFile file, final Branch branch, final int index) {
    final EntrySpan span = branch.getSpan(index);
    final long seek = branch.getBasketSeek(index);
    final int nbytes = branch.getBasketBytes(index);

    final byte[] raw = file.read(seek, nbytes);
    final Binary header = new Binary(raw);
    final Key key = Key.read(header, file, null);
    if (key.getNbytes() != nbytes)
      throw corrupted(branch, index, "key size " + key.getNbytes() + " differs from branch table size " + nbytes);

    header.getShort();
    header.getInt();
    final int entrySize = header.getInt();
    final int entries = header.getInt();
    final int last = header.getInt();
    header.getByte();
    if (header.hasError() || header.position() > key.getKeyLength())
      throw corrupted(branch, index, "truncated basket header");

    if (entries != span.size())
      throw corrupted(branch, index, "basket holds " + entries + " entries, branch expects " + span.size());

    final int keyLength = key.getKeyLength();
    final byte[] payload;
    try {
      payload = BlockCodec.decompress(raw, keyLength, nbytes - keyLength, key.getObjLen());
    } catch (final CorruptionException e) {
      final CorruptionException ex = new CorruptionException(ErrorCode.CORRUPT_BASKET,
          "Basket " + index + " of branch '" + branch.getName() + "' cannot be inflated: " + e.getMessage(), e);
      ex.addContext("branch", branch.getName()).addContext("basket", index);
      throw ex;
    }
    if (payload.length != key.getObjLen())
      throw corrupted(branch, index, "inflated to " + payload.length + " bytes instead of " + key.getObjLen());

    final byte[] scratch = new byte[keyLength + payload.length];
    System.arraycopy(raw, 0, scratch, 0, keyLength);
    System.arraycopy(payload, 0, scratch, keyLength, payload.length);

    int[] offsets = null;
    if (branch.isVariable())
      offsets = readOffsets(branch, index, scratch, keyLength, last, entries);
    else {
      if (entrySize != branch.getEntrySize())
        throw corrupted(branch, index, "entry size " + entrySize + " differs from branch entry size " + branch.getEntrySize());
      if (last != keyLength + entries * entrySize || last > scratch.length)
        throw corrupted(branch, index, "data ends at " + last + ", expected " + (keyLength + entries * entrySize));
    }

    LogManager.instance()
        .log(Basket.class, Level.FINE, "Inflated basket %d of branch '%s' (%d entries, %d -> %d bytes)", null, index, branch.getName(),
            entries, nbytes, scratch.length);
    return new Basket(branch, index, span, keyLength, last, scratch, offsets);
  }

  private static int[] readOffsets(final Branch branch, final int index, final byte[] scratch, final int keyLength, final int last,
      final int entries) {
    if (last < keyLength || last > scratch.length - Binary.INT_SERIALIZED_SIZE)
      throw corrupted(branch, index, "offsets table position " + last + " out of the basket");

    final Binary buffer = new Binary(scratch);
    buffer.position(last);
    final int count = buffer.getInt();
    if (count != entries + 1)
      throw corrupted(branch, index, "offsets table has " + count + " elements, expected " + (entries + 1));

    final int[] offsets = new int[count];
    for (int i = 0; i < count; i++)
      offsets[i] = buffer.getInt();
    if (buffer.hasError())
      throw corrupted(branch, index, "truncated offsets table");

    if (offsets[0] != keyLength || offsets[count - 1] != last)
      throw corrupted(branch, index, "offsets table spans [" + offsets[0] + ", " + offsets[count - 1] + "] instead of [" + keyLength
          + ", " + last + "]");
    for (int i = 0; i < count - 1; i++)
      if (offsets[i] >= offsets[i + 1])
        throw corrupted(branch, index, "offsets table not increasing at entry " + i);
    return offsets;
  }

  private static CorruptionException corrupted(final Branch branch, final int index, final String reason) {
    final CorruptionException e = new CorruptionException(ErrorCode.CORRUPT_BASKET,
        "Corrupted basket " + index + " of branch '" + branch.getName() + "': " + reason);
    e.addContext("branch", branch.getName()).addContext("basket", index);
    return e;
  }

  public Branch getBranch() {
    return branch;
  }

  public int getIndex() {
    return index;
  }

  public EntrySpan getSpan() {
    return span;
  }

  public int getKeyLength() {
    return keyLength;
  }

  public int getLast() {
    return last;
  }

  /**
   * @return the offsets table in scratch-buffer coordinates, null for fixed-size branches
   */
  public int[] getOffsets() {
    return offsets;
  }

  /**
   * @return the position of the leaf value of an entry in the scratch buffer
   */
  public int getPosition(final long entry, final Leaf leaf) {
    final int entryInBasket = (int) (entry - span.getBegin());
    if (offsets != null)
      return offsets[entryInBasket];
    return entryInBasket * branch.getEntrySize() + leaf.getOffset() + keyLength;
  }

  /**
   * @return a new cursor over the scratch buffer
   */
  public Binary newCursor() {
    return new Binary(scratch);
  }
}
