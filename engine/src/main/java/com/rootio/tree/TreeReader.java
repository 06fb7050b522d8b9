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

import com.rootio.engine.RootFile;
import com.rootio.exception.ErrorCode;
import com.rootio.exception.NotFoundException;
import com.rootio.exception.OperationCancelledException;
import com.rootio.log.LogManager;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;

/**
 * Reads entries of a tree in lock-step across the requested leaves. Every branch keeps one inflated basket, owned by this reader
 * and discarded by {@link #close()}.
 * <p>
 * Not thread safe. Different readers over the same file can run concurrently as long as no writer runs on that file.
 */
public class TreeReader implements Closeable {
  private final Tree                      tree;
  private final RootFile                  file;
  private final List<ReadVar>             vars;
  private final Map<Branch, BasketCursor> cursors = new LinkedHashMap<>();
  private final List<BasketCursor>        varCursors;
  private final List<Leaf>                varLeaves;
  private       long                      begin;
  private       long                      end;
  private       BooleanSupplier           cancel;

  public TreeReader(final Tree tree) {
    this(tree, ReadVar.of(tree));
  }

  /**
   * @throws NotFoundException if a variable refers to a missing branch or leaf
   */
  public TreeReader(final Tree tree, final List<ReadVar> vars) {
    if (tree.getFile() == null)
      throw new IllegalArgumentException("Tree '" + tree.getName() + "' is not bound to a file");

    this.tree = tree;
    this.file = tree.getFile();
    this.vars = new ArrayList<>(vars);
    this.varCursors = new ArrayList<>(vars.size());
    this.varLeaves = new ArrayList<>(vars.size());
    this.begin = 0;
    this.end = tree.getEntries();

    for (final ReadVar v : vars) {
      final Branch branch = tree.getBranch(v.getBranch());
      if (branch == null)
        throw new NotFoundException(ErrorCode.KEY_NOT_FOUND, "Branch '" + v.getBranch() + "' not found in tree '" + tree.getName() + "'");

      final Leaf leaf = resolveLeaf(branch, v.getLeaf());
      varLeaves.add(leaf);
      varCursors.add(cursors.computeIfAbsent(branch, b -> new BasketCursor(file, b)));
    }
  }

  /**
   * Restricts the reading to the entries {@code [begin, end)}.
   */
  public TreeReader withRange(final long begin, final long end) {
    if (begin < 0 || end > tree.getEntries() || begin > end)
      throw new IndexOutOfBoundsException("Invalid range [" + begin + ", " + end + ") for tree with " + tree.getEntries() + " entries");
    this.begin = begin;
    this.end = end;
    return this;
  }

  /**
   * Sets a signal checked before inflating every basket.
   */
  public TreeReader withCancellation(final BooleanSupplier cancel) {
    this.cancel = cancel;
    return this;
  }

  /**
   * Populates the read variables with every entry of the range and calls the callback.
   *
   * @throws OperationCancelledException if the cancellation signal is raised at a basket boundary
   */
  public void read(final ReadCallback callback) {
    file.checkOpen();
    final ReaderContext context = new ReaderContext(this);

    for (long entry = begin; entry < end; entry++) {
      for (int i = 0; i < vars.size(); i++) {
        final BasketCursor cursor = varCursors.get(i);
        if (!cursor.isLoaded(entry)) {
          checkCancelled(entry);
          cursor.load(entry);
        }
        vars.get(i).setValue(cursor.loadLeaf(entry, varLeaves.get(i)));
      }

      context.setEntry(entry);
      callback.onEntry(context);
    }

    LogManager.instance()
        .log(this, Level.FINE, "Read entries [%d, %d) of tree '%s' (%d baskets inflated)", null, begin, end, tree.getName(),
            getInflatedCount());
  }

  public Tree getTree() {
    return tree;
  }

  public List<ReadVar> getVars() {
    return vars;
  }

  public long getBegin() {
    return begin;
  }

  public long getEnd() {
    return end;
  }

  /**
   * @return the number of basket inflations across all branches so far
   */
  public int getInflatedCount() {
    int total = 0;
    for (final BasketCursor c : cursors.values())
      total += c.getInflatedCount();
    return total;
  }

  @Override
  public void close() {
    for (final BasketCursor c : cursors.values())
      c.clear();
    cursors.clear();
  }

  private void checkCancelled(final long entry) {
    if (cancel != null && cancel.getAsBoolean())
      throw new OperationCancelledException(ErrorCode.OPERATION_CANCELLED,
          "Reading of tree '" + tree.getName() + "' cancelled at entry " + entry);
  }

  private Leaf resolveLeaf(final Branch branch, final String leafName) {
    if (leafName == null) {
      if (branch.getLeaves().size() == 1)
        return branch.getLeaves().get(0);
      final Leaf sameName = branch.getLeaf(branch.getName());
      if (sameName != null)
        return sameName;
      throw new NotFoundException(ErrorCode.KEY_NOT_FOUND,
          "Branch '" + branch.getName() + "' has " + branch.getLeaves().size() + " leaves, specify which one to read");
    }
    final Leaf leaf = branch.getLeaf(leafName);
    if (leaf == null)
      throw new NotFoundException(ErrorCode.KEY_NOT_FOUND, "Leaf '" + leafName + "' not found in branch '" + branch.getName() + "'");
    return leaf;
  }
}
