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

import com.rootio.GlobalConfiguration;
import com.rootio.engine.Directory;
import com.rootio.engine.Key;
import com.rootio.exception.ClosedHandleException;
import com.rootio.exception.ErrorCode;
import com.rootio.exception.InvalidDirectoryException;
import com.rootio.log.LogManager;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;

/**
 * Writes a tree entry by entry. Baskets are appended to the file as they fill up; {@link #close()} writes the last baskets and
 * stores the tree in the directory.
 * <p>
 * Basket size and entries per basket come from the file configuration ({@link GlobalConfiguration#TREE_BASKET_SIZE},
 * {@link GlobalConfiguration#TREE_MAX_ENTRIES_PER_BASKET}).
 */
public class TreeWriter implements Closeable {
  private final Directory          directory;
  private final String             name;
  private final String             title;
  private final List<BranchWriter> branches = new ArrayList<>();
  private       long               entries;
  private       Key                key;
  private       Tree               tree;

  public TreeWriter(final Directory directory, final String name, final List<WriteVar> vars) {
    this(directory, name, "", vars);
  }

  public TreeWriter(final Directory directory, final String name, final String title, final List<WriteVar> vars) {
    directory.getFile().checkOpen();
    if (!directory.getFile().isWritable())
      throw new InvalidDirectoryException(ErrorCode.INVALID_DIRECTORY,
          "Cannot write tree '" + name + "': file '" + directory.getFile().getPath() + "' is open in read-only mode");
    if (vars.isEmpty())
      throw new IllegalArgumentException("Tree '" + name + "' has no variables");

    this.directory = directory;
    this.name = name;
    this.title = title;

    final int basketSize = directory.getFile().getConfiguration().getValueAsInteger(GlobalConfiguration.TREE_BASKET_SIZE);
    final int maxEntries = directory.getFile().getConfiguration().getValueAsInteger(GlobalConfiguration.TREE_MAX_ENTRIES_PER_BASKET);

    final Map<String, List<WriteVar>> groups = new LinkedHashMap<>();
    for (final WriteVar v : vars)
      groups.computeIfAbsent(v.getBranch(), k -> new ArrayList<>()).add(v);
    for (final Map.Entry<String, List<WriteVar>> g : groups.entrySet())
      branches.add(new BranchWriter(directory, g.getKey(), name, g.getValue(), basketSize, maxEntries));
  }

  /**
   * Appends one entry with the current values of the variables.
   */
  public void write() {
    checkNotClosed();
    for (final BranchWriter b : branches)
      b.writeEntry();
    entries++;
  }

  public long getEntries() {
    return entries;
  }

  /**
   * @return the key of the stored tree, null until the writer is closed
   */
  public Key getKey() {
    return key;
  }

  public Tree getTree() {
    return tree;
  }

  @Override
  public void close() {
    if (key != null)
      return;

    long totBytes = 0;
    long zipBytes = 0;
    final List<Branch> result = new ArrayList<>(branches.size());
    for (final BranchWriter b : branches) {
      b.flush();
      result.add(b.toBranch());
      totBytes += b.getTotBytes();
      zipBytes += b.getZipBytes();
    }

    tree = new Tree(name, title, entries, result, totBytes, zipBytes, directory.getFile());
    key = directory.put(name, title, tree);

    LogManager.instance()
        .log(this, Level.FINE, "Written tree '%s' (%d entries, %d branches, %d -> %d bytes)", null, name, entries, result.size(),
            totBytes, zipBytes);
  }

  private void checkNotClosed() {
    if (key != null)
      throw new ClosedHandleException(ErrorCode.CLOSED_HANDLE, "Tree writer of '" + name + "' is closed");
  }
}
