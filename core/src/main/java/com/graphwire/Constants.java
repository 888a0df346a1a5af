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
package com.graphwire;

import com.graphwire.log.LogManager;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Level;

public class Constants {
  public static final String PRODUCT = "GraphWire";

  private static final Properties properties = new Properties();

  static {
    try (final InputStream inputStream = Constants.class.getResourceAsStream("/com/graphwire/graphwire.properties")) {
      if (inputStream != null)
        properties.load(inputStream);
    } catch (IOException e) {
      LogManager.instance().log(Constants.class, Level.SEVERE, "Failed to load GraphWire properties", e);
    }
  }

  /**
   * @return Complete version of the driver, or "unknown" if the build information is missing
   */
  public static String getRawVersion() {
    final String version = properties.getProperty("version");
    return version == null || version.startsWith("${") ? "unknown" : version;
  }

  /**
   * @return Value sent in the User-Agent header
   */
  public static String getUserAgent() {
    return PRODUCT + "/" + getRawVersion();
  }
}
