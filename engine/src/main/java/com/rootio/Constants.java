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
package com.rootio;

import com.rootio.log.LogManager;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Level;

public class Constants {
  public static final String PRODUCT   = "RootIO";
  public static final String COPYRIGHT = "Copyrights (c) 2021 Arcade Data Ltd";

  private static final Properties properties = new Properties();

  static {
    try (final InputStream inputStream = Constants.class.getResourceAsStream("/com/rootio/rootio.properties")) {
      if (inputStream != null)
        properties.load(inputStream);
    } catch (final IOException e) {
      LogManager.instance().log(Constants.class, Level.SEVERE, "Failed to load RootIO properties", e);
    }
  }

  /**
   * @return the full version of the library, or "unknown" if the build did not stamp it.
   */
  public static String getVersion() {
    return properties.getProperty("version", "unknown");
  }

  /**
   * @return the library version followed by the build timestamp, when available.
   */
  public static String getFullVersion() {
    final String timestamp = properties.getProperty("buildTimestamp");
    return timestamp != null && !timestamp.startsWith("$") ? getVersion() + " (build " + timestamp + ")" : getVersion();
  }
}
