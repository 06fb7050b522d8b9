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
import com.rootio.serializer.FieldKind;
import com.rootio.serializer.GenericObject;
import com.rootio.serializer.NamedBinding;
import com.rootio.serializer.ObjectBinding;
import com.rootio.serializer.StreamerElement;
import com.rootio.serializer.StreamerInfo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Stores {@link Tree}s as {@code TTree}, with their branches ({@code TBranch}) and leaves ({@code TLeaf}) embedded. The three
 * classes start with a {@code TNamed} base holding their name and title.
 * <p>
 * Basket tables are stored with one extra slot ({@code fMaxBaskets = baskets + 1}): the last entry boundary is the number of
 * entries, the last seek and size are zero.
 */
public class TreeBinding implements ObjectBinding<Tree> {
  public static final String TREE_CLASS   = "TTree";
  public static final String BRANCH_CLASS = "TBranch";
  public static final String LEAF_CLASS   = "TLeaf";

  private static final StreamerInfo LEAF_INFO = StreamerInfo.of(LEAF_CLASS, 2, //
      StreamerElement.base(StreamerElement.TNAMED_CLASS, 1), //
      StreamerElement.primitive("fLen", FieldKind.INT32), //
      StreamerElement.primitive("fLenType", FieldKind.INT32), //
      StreamerElement.primitive("fOffset", FieldKind.INT32), //
      StreamerElement.primitive("fType", FieldKind.INT8), //
      StreamerElement.primitive("fIsVariable", FieldKind.BOOL));

  private static final StreamerInfo BRANCH_INFO = StreamerInfo.of(BRANCH_CLASS, 13, //
      StreamerElement.base(StreamerElement.TNAMED_CLASS, 1), //
      StreamerElement.primitive("fCompress", FieldKind.INT32), //
      StreamerElement.primitive("fBasketSize", FieldKind.INT32), //
      StreamerElement.primitive("fEntryOffsetLen", FieldKind.INT32), //
      StreamerElement.primitive("fWriteBasket", FieldKind.INT32), //
      StreamerElement.primitive("fEntries", FieldKind.INT64), //
      StreamerElement.primitive("fTotBytes", FieldKind.INT64), //
      StreamerElement.primitive("fZipBytes", FieldKind.INT64), //
      StreamerElement.primitive("fMaxBaskets", FieldKind.INT32), //
      StreamerElement.variableArray("fBasketBytes", FieldKind.INT32, "fMaxBaskets"), //
      StreamerElement.variableArray("fBasketEntry", FieldKind.INT64, "fMaxBaskets"), //
      StreamerElement.variableArray("fBasketSeek", FieldKind.INT64, "fMaxBaskets"), //
      StreamerElement.container("fLeaves", LEAF_CLASS));

  private static final StreamerInfo TREE_INFO = StreamerInfo.of(TREE_CLASS, 20, //
      StreamerElement.base(StreamerElement.TNAMED_CLASS, 1), //
      StreamerElement.primitive("fEntries", FieldKind.INT64), //
      StreamerElement.primitive("fTotBytes", FieldKind.INT64), //
      StreamerElement.primitive("fZipBytes", FieldKind.INT64), //
      StreamerElement.container("fBranches", BRANCH_CLASS));

  @Override
  public String getClassName() {
    return TREE_CLASS;
  }

  @Override
  public Class<Tree> getType() {
    return Tree.class;
  }

  @Override
  public List<StreamerInfo> getStreamerInfos() {
    return List.of(NamedBinding.TOBJECT_INFO, NamedBinding.TNAMED_INFO, LEAF_INFO, BRANCH_INFO, TREE_INFO);
  }

  @Override
  public GenericObject toGeneric(final Tree tree) {
    final List<Object> branches = new ArrayList<>(tree.getBranches().size());
    for (final Branch b : tree.getBranches())
      branches.add(toGeneric(b));

    return new GenericObject(TREE_CLASS).set(StreamerElement.TNAMED_CLASS, named(tree.getName(), tree.getTitle()))
        .set("fEntries", tree.getEntries()).set("fTotBytes", tree.getTotBytes()).set("fZipBytes", tree.getZipBytes())
        .set("fBranches", branches);
  }

  @Override
  public Tree fromGeneric(final GenericObject object, final RootFile file) {
    final List<Object> stored = object.get("fBranches");
    final List<Branch> branches = new ArrayList<>(stored.size());
    for (final Object b : stored)
      branches.add(toBranch(asGeneric(b, BRANCH_CLASS)));

    final GenericObject named = asGeneric(object.get(StreamerElement.TNAMED_CLASS), StreamerElement.TNAMED_CLASS);
    return new Tree(named.getString("fName"), named.getString("fTitle"), object.getLong("fEntries"), branches,
        object.getLong("fTotBytes"), object.getLong("fZipBytes"), file);
  }

  private static GenericObject toGeneric(final Branch branch) {
    final int baskets = branch.getBasketCount();
    final List<Object> leaves = new ArrayList<>(branch.getLeaves().size());
    for (final Leaf l : branch.getLeaves())
      leaves.add(new GenericObject(LEAF_CLASS).set(StreamerElement.TNAMED_CLASS, named(l.getName(), l.getTitle()))
          .set("fLen", l.getLength())
          .set("fLenType", l.getType().getSize()).set("fOffset", l.getOffset()).set("fType", (byte) l.getType().getCode())
          .set("fIsVariable", l.isVariable() && l.getType() != LeafType.STRING));

    return new GenericObject(BRANCH_CLASS).set(StreamerElement.TNAMED_CLASS, named(branch.getName(), branch.getTitle()))
        .set("fCompress", branch.getCompress()).set("fBasketSize", branch.getBasketSize())
        .set("fEntryOffsetLen", branch.isVariable() ? 4 : 0).set("fWriteBasket", baskets).set("fEntries", branch.getEntries())
        .set("fTotBytes", branch.getTotBytes()).set("fZipBytes", branch.getZipBytes()).set("fMaxBaskets", baskets + 1)
        .set("fBasketBytes", Arrays.copyOf(branch.getBasketBytesArray(), baskets + 1))
        .set("fBasketEntry", Arrays.copyOf(branch.getBasketEntries(), baskets + 1))
        .set("fBasketSeek", Arrays.copyOf(branch.getBasketSeeks(), baskets + 1)).set("fLeaves", leaves);
  }

  private static Branch toBranch(final GenericObject object) {
    final GenericObject named = asGeneric(object.get(StreamerElement.TNAMED_CLASS), StreamerElement.TNAMED_CLASS);
    final String name = named.getString("fName");
    final int baskets = object.getInt("fWriteBasket");
    final int maxBaskets = object.getInt("fMaxBaskets");
    if (baskets < 0 || baskets >= maxBaskets)
      throw new CorruptionException(ErrorCode.CORRUPT_BASKET,
          "Branch '" + name + "' declares " + baskets + " baskets with tables of " + maxBaskets + " slots");

    final List<Object> stored = object.get("fLeaves");
    final List<Leaf> leaves = new ArrayList<>(stored.size());
    for (final Object o : stored) {
      final GenericObject l = asGeneric(o, LEAF_CLASS);
      final GenericObject leafNamed = asGeneric(l.get(StreamerElement.TNAMED_CLASS), StreamerElement.TNAMED_CLASS);
      final LeafType type;
      try {
        type = LeafType.fromCode((char) l.getInt("fType"));
      } catch (final IllegalArgumentException e) {
        throw new CorruptionException(ErrorCode.CORRUPT_BASKET,
            "Invalid leaf '" + leafNamed.getString("fName") + "' in branch '" + name + "'", e);
      }
      leaves.add(new Leaf(leafNamed.getString("fName"), leafNamed.getString("fTitle"), type, l.getInt("fLen"),
          (Boolean) l.get("fIsVariable"), l.getInt("fOffset")));
    }

    final long[] entries = object.get("fBasketEntry");
    final long[] seeks = object.get("fBasketSeek");
    final int[] bytes = object.get("fBasketBytes");
    try {
      return new Branch(name, named.getString("fTitle"), leaves, object.getInt("fBasketSize"), object.getInt("fCompress"),
          object.getLong("fEntries"), Arrays.copyOf(entries, baskets + 1), Arrays.copyOf(seeks, baskets),
          Arrays.copyOf(bytes, baskets), object.getLong("fTotBytes"), object.getLong("fZipBytes"));
    } catch (final IllegalArgumentException e) {
      throw new CorruptionException(ErrorCode.CORRUPT_BASKET, "Invalid branch '" + name + "'", e);
    }
  }

  private static GenericObject named(final String name, final String title) {
    return new GenericObject(StreamerElement.TNAMED_CLASS).set("fName", name).set("fTitle", title);
  }

  private static GenericObject asGeneric(final Object value, final String className) {
    if (!(value instanceof GenericObject))
      throw new CorruptionException(ErrorCode.CORRUPT_BASKET, "Cannot decode " + className + ": found " + value);
    return (GenericObject) value;
  }
}
