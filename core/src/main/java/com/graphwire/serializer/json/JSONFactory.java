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
package com.graphwire.serializer.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Shared Gson instance used by the JSON wrappers. NaN and infinite numbers are written as bare tokens instead of failing.
 *
 * @author Luca Garulli (l.garulli@arcadedata.com)
 */
public class JSONFactory {
  private final Gson gson;

  public final static JSONFactory INSTANCE = new JSONFactory();

  private JSONFactory() {
    gson = new GsonBuilder()//
        .serializeNulls()//
        .serializeSpecialFloatingPointValues()//
        .create();
  }

  public Gson getGson() {
    return gson;
  }
}
