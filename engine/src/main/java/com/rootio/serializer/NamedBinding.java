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
package com.rootio.serializer;

import com.rootio.engine.RootFile;

import java.util.List;

/**
 * Binds {@code TNamed}: a {@code TObject} base followed by a name and a title.
 */
public class NamedBinding implements ObjectBinding<Named> {
  public static final String CLASS_NAME = StreamerElement.TNAMED_CLASS;

  public static final StreamerInfo TOBJECT_INFO = StreamerInfo.of(StreamerElement.TOBJECT_CLASS, GenericCodec.TOBJECT_VERSION, //
      StreamerElement.primitive("fUniqueID", FieldKind.UINT32), //
      StreamerElement.primitive("fBits", FieldKind.UINT32));

  public static final StreamerInfo TNAMED_INFO  = StreamerInfo.of(CLASS_NAME, 1, //
      StreamerElement.base(StreamerElement.TOBJECT_CLASS, GenericCodec.TOBJECT_VERSION), //
      StreamerElement.primitive("fName", FieldKind.STRING), //
      StreamerElement.primitive("fTitle", FieldKind.STRING));

  @Override
  public String getClassName() {
    return CLASS_NAME;
  }

  @Override
  public Class<Named> getType() {
    return Named.class;
  }

  @Override
  public List<StreamerInfo> getStreamerInfos() {
    return List.of(TOBJECT_INFO, TNAMED_INFO);
  }

  @Override
  public GenericObject toGeneric(final Named value) {
    return new GenericObject(CLASS_NAME).set("fName", value.getName()).set("fTitle", value.getTitle());
  }

  @Override
  public Named fromGeneric(final GenericObject object, final RootFile file) {
    return new Named(object.getString("fName"), object.getString("fTitle"));
  }
}
