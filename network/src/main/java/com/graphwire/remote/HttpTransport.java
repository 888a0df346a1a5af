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

import com.graphwire.Constants;
import com.graphwire.ContextConfiguration;
import com.graphwire.GlobalConfiguration;
import com.graphwire.exception.ErrorCode;
import com.graphwire.log.LogManager;
import com.graphwire.network.exception.TransportException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.logging.Level;

/**
 * {@link Transport} implementation based on the JDK HTTP client. When a user name is provided, every request carries the Basic
 * authentication header. The instance is thread safe and can be shared by many transactions.
 */
public class HttpTransport implements Transport {
  private final String     userName;
  private final String     userPassword;
  private final HttpClient httpClient;
  private final int        timeout;
  private final boolean    logPayloads;

  public HttpTransport() {
    this(null, null, new ContextConfiguration());
  }

  public HttpTransport(final String userName, final String userPassword, final ContextConfiguration configuration) {
    this.userName = userName;
    this.userPassword = userPassword;
    this.timeout = configuration.getValueAsInteger(GlobalConfiguration.NETWORK_SOCKET_TIMEOUT);
    this.logPayloads = configuration.getValueAsBoolean(GlobalConfiguration.NETWORK_LOG_PAYLOADS);

    final HttpClient.Builder builder = HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .followRedirects(configuration.getValueAsBoolean(GlobalConfiguration.NETWORK_FOLLOW_REDIRECTS) ?
            HttpClient.Redirect.NORMAL :
            HttpClient.Redirect.NEVER);

    final int connectTimeout = configuration.getValueAsInteger(GlobalConfiguration.NETWORK_CONNECT_TIMEOUT);
    if (connectTimeout > 0)
      builder.connectTimeout(Duration.ofMillis(connectTimeout));

    this.httpClient = builder.build();
  }

  @Override
  public TransportResponse send(final String method, final String url, final String body) {
    final HttpRequest.Builder requestBuilder = createRequestBuilder(url);

    if (body != null) {
      if ("GET".equalsIgnoreCase(method))
        throw new IllegalArgumentException("Cannot execute a HTTP GET request with a payload");

      requestBuilder.method(method, HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
          .header("Content-Type", "application/json; charset=UTF-8");
    } else if ("GET".equalsIgnoreCase(method))
      requestBuilder.GET();
    else
      requestBuilder.method(method, HttpRequest.BodyPublishers.noBody());

    if (logPayloads)
      LogManager.instance().log(this, Level.FINE, "%s %s %s", method, url, body != null ? body : "");

    try {
      final HttpResponse<String> response = httpClient.send(requestBuilder.build(),
          HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

      if (logPayloads)
        LogManager.instance().log(this, Level.FINE, "%s %s -> %d %s", method, url, response.statusCode(), response.body());

      return new TransportResponse(response.statusCode(), response.body(),
          response.headers().firstValue("Location").orElse(null));

    } catch (final IOException e) {
      throw new TransportException(ErrorCode.TRANSPORT_ERROR,
          "Error on executing remote operation " + method + " " + url + " (cause: " + e + ")", e).addContext("url", url);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException(ErrorCode.REQUEST_INTERRUPTED, "Request interrupted: " + method + " " + url, e).addContext(
          "url", url);
    }
  }

  HttpRequest.Builder createRequestBuilder(final String url) {
    final HttpRequest.Builder builder;
    try {
      builder = HttpRequest.newBuilder().uri(URI.create(url));
    } catch (final IllegalArgumentException e) {
      throw new TransportException(ErrorCode.PROTOCOL_ERROR, "Invalid URL '" + url + "'", e);
    }

    if (timeout > 0)
      builder.timeout(Duration.ofMillis(timeout));

    builder.header("Accept", "application/json; charset=UTF-8").header("User-Agent", Constants.getUserAgent());

    if (userName != null) {
      final String authorization = userName + ":" + (userPassword != null ? userPassword : "");
      builder.header("Authorization",
          "Basic " + Base64.getEncoder().encodeToString(authorization.getBytes(StandardCharsets.UTF_8)));
    }
    return builder;
  }

  public String getUserName() {
    return userName;
  }

  public int getTimeout() {
    return timeout;
  }

  /**
   * The JDK client releases its connections when it is garbage collected, nothing to do here.
   */
  @Override
  public void close() {
    LogManager.instance().log(this, Level.FINE, "HTTP transport closed");
  }
}
