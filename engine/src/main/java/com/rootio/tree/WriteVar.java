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

/**
 * Leaf to write, and holder of its value for the next entry. Every variable becomes a branch with the same name, unless
 * {@link #inBranch(String)} groups fixed-size variables in one branch.
 */
public class WriteVar {
  private final Leaf   leaf;
  private       String branch;
  private       Object value;

  private WriteVar(final Leaf leaf) {
    this.leaf = leaf;
    this.branch = leaf.getName();
  }

  public static WriteVar scalar(final String name, final LeafType type) {
    return new WriteVar(Leaf.scalar(name, type));
  }

  public static WriteVar array(final String name, final LeafType type, final int length) {
    return new WriteVar(Leaf.array(name, type, length));
  }

  public static WriteVar variableArray(final String name, final LeafType type) {
    return new WriteVar(Leaf.variableArray(name, type));
  }

  public static WriteVar string(final String name) {
    return new WriteVar(Leaf.string(name));
  }

  public WriteVar inBranch(final String branchName) {
    this.branch = branchName;
    return this;
  }

  public WriteVar set(final Object value) {
    this.value = value;
    return this;
  }

  public Object get() {
    return value;
  }

  public String getName() {
    return leaf.getName();
  }

  public String getBranch() {
    return branch;
  }

  Leaf getLeaf() {
    return leaf;
  }

  @Override
  public String toString() {
    return branch + "." + leaf.getName() + "=" + value;
  }
}
