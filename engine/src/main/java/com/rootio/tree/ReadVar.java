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

import java.util.ArrayList;
import java.util.List;

/**
 * Leaf to read, and holder of its value for the current entry.
 */
public class ReadVar {
  private final String branch;
  private final String leaf;
  private       Object value;

  /**
   * Reads the only leaf of a branch, or the leaf with the same name as the branch.
   */
  public ReadVar(final String branch) {
    this(branch, null);
  }

  public ReadVar(final String branch, final String leaf) {
    this.branch = branch;
    this.leaf = leaf;
  }

  /**
   * @return one variable for every leaf of the tree
   */
  public static List<ReadVar> of(final Tree tree) {
    final List<ReadVar> result = new ArrayList<>();
    for (final Branch b : tree.getBranches())
      for (final Leaf l : b.getLeaves())
        result.add(new ReadVar(b.getName(), l.getName()));
    return result;
  }

  public String getBranch() {
    return branch;
  }

  /**
   * @return the leaf name, null if the branch has a single leaf
   */
  public String getLeaf() {
    return leaf;
  }

  @SuppressWarnings("unchecked")
  public <T> T getValue() {
    return (T) value;
  }

  void setValue(final Object value) {
    this.value = value;
  }

  @Override
  public String toString() {
    return (leaf != null ? branch + "." + leaf : branch) + "=" + value;
  }
}
