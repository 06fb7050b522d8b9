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
import com.rootio.exception.CorruptionException;
import com.rootio.exception.ErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Table of entries stored column by column in branches.
 */
public class Tree {
  private final String       name;
  private final String       title;
  private final long         entries;
  private final List<Branch> branches;
  private final long         totBytes;
  private final long         zipBytes;
  private final RootFile     file;

  /**
   * @throws CorruptionException with {@link ErrorCode#CORRUPT_BASKET} if the entry count is negative or a branch holds a different
   *                             number of entries than the tree
   */
  public Tree(final String name, final String title, final long entries, final List<Branch> branches, final long totBytes,
      final long zipBytes, final RootFile file) {
    if (entries < 0)
      throw new CorruptionException(ErrorCode.CORRUPT_BASKET, "Tree '" + name + "' declares " + entries + " entries");
    for (final Branch b : branches)
      if (b.getEntries() != entries) {
        final CorruptionException e = new CorruptionException(ErrorCode.CORRUPT_BASKET,
            "Branch '" + b.getName() + "' holds " + b.getEntries() + " entries, tree '" + name + "' " + entries);
        e.addContext("tree", name).addContext("branch", b.getName());
        throw e;
      }

    this.name = name;
    this.title = title != null ? title : "";
    this.entries = entries;
    this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
    this.totBytes = totBytes;
    this.zipBytes = zipBytes;
    this.file = file;
    for (final Branch b : branches)
      b.setTree(this);
  }

  public String getName() {
    return name;
  }

  public String getTitle() {
    return title;
  }

  public long getEntries() {
    return entries;
  }

  public List<Branch> getBranches() {
    return branches;
  }

  public Branch getBranch(final String branchName) {
    for (final Branch b : branches)
      if (b.getName().equals(branchName))
        return b;
    return null;
  }

  /**
   * @return the leaves of all the branches, in branch order
   */
  public List<Leaf> getLeaves() {
    final List<Leaf> result = new ArrayList<>();
    for (final Branch b : branches)
      result.addAll(b.getLeaves());
    return result;
  }

  public long getTotBytes() {
    return totBytes;
  }

  public long getZipBytes() {
    return zipBytes;
  }

  /**
   * @return the file the baskets are read from
   */
  public RootFile getFile() {
    return file;
  }

  @Override
  public String toString() {
    return "Tree{" + name + ", entries=" + entries + ", branches=" + branches.size() + "}";
  }
}
