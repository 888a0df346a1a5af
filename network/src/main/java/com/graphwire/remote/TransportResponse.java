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
package com.graphwire.remote;

/**
 * Raw HTTP answer.
 *
 * @param statusCode HTTP status code
 * @param body       response body, empty if the server sent none
 * @param location   value of the Location header, or null
 */
public record TransportResponse(int statusCode, String body, String location) {
  public TransportResponse {
    body = body != null ? body : "";
  }

  public TransportResponse(final int statusCode, final String body) {
    this(statusCode, body, null);
  }
}
