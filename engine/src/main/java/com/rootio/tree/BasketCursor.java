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
import com.rootio.engine.RootFile;

/**
 * Keeps at most one inflated basket of a branch. Moving to an entry of another basket evicts the current one.
 */
public class BasketCursor {
  private final RootFile file;
  private final Branch   branch;
  private       Basket   basket;
  private       Binary   cursor;
  private       int      inflated;

  public BasketCursor(final RootFile file, final Branch branch) {
    this.file = file;
    this.branch = branch;
  }

  /**
   * @return true if the entry is in the basket already inflated
   */
  public boolean isLoaded(final long entry) {
    return basket != null && basket.getSpan().contains(entry);
  }

  /**
   * Makes sure the basket holding the entry is inflated.
   */
  public void load(final long entry) {
    if (isLoaded(entry))
      return;
    final Basket next = Basket.inflate(file, branch, branch.findBasket(entry));
    basket = next;
    cursor = next.newCursor();
    inflated++;
  }

  public Object loadLeaf(final long entry, final Leaf leaf) {
    load(entry);
    cursor.position(basket.getPosition(entry, leaf));
    final Object value = leaf.read(cursor);
    cursor.checkError();
    return value;
  }

  public Branch getBranch() {
    return branch;
  }

  public Basket getBasket() {
    return basket;
  }

  /**
   * @return how many baskets this cursor inflated so far
   */
  public int getInflatedCount() {
    return inflated;
  }

  public void clear() {
    basket = null;
    cursor = null;
  }
}
