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
 * Sends one HTTP request to the server and returns the raw answer. Implementations never interpret the status code: checking it is
 * up to the caller, that knows which code each operation expects.
 *
 * @see HttpTransport
 */
public interface Transport extends AutoCloseable {
  /**
   * Sends a request.
   *
   * @param method HTTP method (GET, POST or DELETE)
   * @param url    absolute URL
   * @param body   JSON body, or null to send no body
   *
   * @return status code, body and Location header of the response
   *
   * @throws com.graphwire.network.exception.TransportException if no response could be obtained
   */
  TransportResponse send(String method, String url, String body);

  /**
   * Releases the resources held by the transport. The default implementation does nothing.
   */
  @Override
  default void close() {
  }
}
