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
 * Binds a Java type to a stored class. The binding declares the layouts of the class (and of the classes it embeds) and converts
 * between the Java object and its {@link GenericObject} form.
 *
 * @param <T> the Java type
 */
public interface ObjectBinding<T> {
  String getClassName();

  Class<T> getType();

  /**
   * @return the layouts to register: every supported version of the bound class plus the layouts of the embedded classes
   */
  List<StreamerInfo> getStreamerInfos();

  GenericObject toGeneric(T value);

  /**
   * @param file the file the object is read from, for objects that load more data lazily
   */
  T fromGeneric(GenericObject object, RootFile file);
}
