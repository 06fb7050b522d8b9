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

import com.rootio.exception.CorruptionException;
import com.rootio.exception.ErrorCode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Column of a tree stored in baskets. Basket {@code i} holds the entries {@code [basketEntry[i], basketEntry[i+1])}; spans are
 * contiguous and cover {@code [0, entries)} exactly once.
 * <p>
 * A fixed-size branch packs all its leaves in every entry at fixed offsets. A variable-size branch has a single leaf and its baskets
 * carry an offsets table.
 */
public class Branch {
  private final String     name;
  private final String     title;
  private final List<Leaf> leaves;
  private final int        basketSize;
  private final int        compress;
  private final long       entries;
  private final long[]     basketEntry;
  private final long[]     basketSeek;
  private final int[]      basketBytes;
  private final long       totBytes;
  private final long       zipBytes;
  private final int        entrySize;
  private       Tree       tree;

  public Branch(final String name, final String title, final List<Leaf> leaves, final int basketSize, final int compress,
      final long entries, final long[] basketEntry, final long[] basketSeek, final int[] basketBytes, final long totBytes,
      final long zipBytes) {
    this.name = name;
    this.title = title != null ? title : name;
    this.leaves = Collections.unmodifiableList(new ArrayList<>(leaves));
    this.basketSize = basketSize;
    this.compress = compress;
    this.entries = entries;
    this.basketEntry = basketEntry.clone();
    this.basketSeek = basketSeek.clone();
    this.basketBytes = basketBytes.clone();
    this.totBytes = totBytes;
    this.zipBytes = zipBytes;
    this.entrySize = computeEntrySize();
    validate();
  }

  public String getName() {
    return name;
  }

  public String getTitle() {
    return title;
  }

  public List<Leaf> getLeaves() {
    return leaves;
  }

  public Leaf getLeaf(final String leafName) {
    for (final Leaf l : leaves)
      if (l.getName().equals(leafName))
        return l;
    return null;
  }

  public long getEntries() {
    return entries;
  }

  public int getBasketSize() {
    return basketSize;
  }

  public int getCompress() {
    return compress;
  }

  public int getBasketCount() {
    return basketSeek.length;
  }

  public long getBasketSeek(final int basket) {
    return basketSeek[basket];
  }

  public int getBasketBytes(final int basket) {
    return basketBytes[basket];
  }

  long[] getBasketEntries() {
    return basketEntry;
  }

  long[] getBasketSeeks() {
    return basketSeek;
  }

  int[] getBasketBytesArray() {
    return basketBytes;
  }

  public EntrySpan getSpan(final int basket) {
    return new EntrySpan(basketEntry[basket], basketEntry[basket + 1]);
  }

  public List<EntrySpan> getSpans() {
    final List<EntrySpan> spans = new ArrayList<>(getBasketCount());
    for (int i = 0; i < getBasketCount(); i++)
      spans.add(getSpan(i));
    return spans;
  }

  /**
   * @return the index of the basket holding the entry
   */
  public int findBasket(final long entry) {
    if (entry < 0 || entry >= entries)
      throw new IndexOutOfBoundsException("Entry " + entry + " out of range [0, " + entries + ") in branch '" + name + "'");
    final int pos = Arrays.binarySearch(basketEntry, entry);
    return pos >= 0 ? pos : -pos - 2;
  }

  public boolean isVariable() {
    return entrySize < 0;
  }

  /**
   * @return the bytes of one entry, -1 for variable-size branches
   */
  public int getEntrySize() {
    return entrySize;
  }

  public long getTotBytes() {
    return totBytes;
  }

  public long getZipBytes() {
    return zipBytes;
  }

  public Tree getTree() {
    return tree;
  }

  void setTree(final Tree tree) {
    this.tree = tree;
  }

  private int computeEntrySize() {
    int size = 0;
    for (final Leaf l : leaves) {
      if (l.isVariable())
        return -1;
      size += l.getEntrySize();
    }
    return size;
  }

  private void validate() {
    if (leaves.isEmpty())
      throw new IllegalArgumentException("Branch '" + name + "' has no leaves");
    for (final Leaf l : leaves)
      if (l.isVariable() && leaves.size() > 1)
        throw new IllegalArgumentException("Variable-size leaf '" + l.getName() + "' must be the only leaf of branch '" + name + "'");

    final int baskets = basketSeek.length;
    if (basketBytes.length != baskets || basketEntry.length != baskets + 1)
      throw corrupted("inconsistent basket tables (" + baskets + " seeks, " + basketBytes.length + " sizes, " + basketEntry.length
          + " entry boundaries)");
    if (basketEntry[0] != 0)
      throw corrupted("first basket starts at entry " + basketEntry[0]);
    for (int i = 0; i < baskets; i++)
      if (basketEntry[i + 1] <= basketEntry[i])
        throw corrupted("basket " + i + " has span [" + basketEntry[i] + ", " + basketEntry[i + 1] + ")");
    if (basketEntry[baskets] != entries)
      throw corrupted("baskets cover " + basketEntry[baskets] + " entries instead of " + entries);
  }

  private CorruptionException corrupted(final String reason) {
    final CorruptionException e = new CorruptionException(ErrorCode.CORRUPT_BASKET, "Invalid branch '" + name + "': " + reason);
    e.addContext("branch", name);
    return e;
  }

  @Override
  public String toString() {
    return "Branch{" + name + ", entries=" + entries + ", baskets=" + getBasketCount() + "}";
  }
}
