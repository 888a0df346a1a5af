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
import com.graphwire.serializer.json.JSONObject;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Level;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties and then
 * environment variables.
 */
public enum GlobalConfiguration {
  // ENVIRONMENT
  DUMP_CONFIG_AT_STARTUP("graphwire.dumpConfigAtStartup", "Dumps the configuration at startup", Boolean.class, false,
      value -> {
        if (Boolean.parseBoolean(String.valueOf(value)))
          dumpConfiguration(System.out);
        return value;
      }),

  // NETWORK
  NETWORK_SOCKET_TIMEOUT("graphwire.network.socketTimeout", "Timeout of a single HTTP request (in ms)", Integer.class, 30000),

  NETWORK_CONNECT_TIMEOUT("graphwire.network.connectTimeout", "Timeout to establish a connection to the server (in ms)",
      Integer.class, 60000),

  NETWORK_FOLLOW_REDIRECTS("graphwire.network.followRedirects", "Follows HTTP redirects returned by the server", Boolean.class,
      true),

  NETWORK_LOG_PAYLOADS("graphwire.network.logPayloads",
      "Logs the JSON payloads sent and received at FINE level. Statement parameters could contain sensitive data", Boolean.class,
      false),

  // SERVER
  SERVER_DATABASE("graphwire.server.database",
      "Database name replacing the {databaseName} placeholder of the transaction endpoint discovered from the service root",
      String.class, "neo4j"),

  // TRANSACTIONS
  TX_CLIENT_EXPIRY_CHECK("graphwire.tx.clientExpiryCheck",
      "Fails fast without contacting the server when the expiry returned by the server is already past", Boolean.class, true),

  TX_EXPIRY_GRACE("graphwire.tx.expiryGraceMs", "Tolerance added to the server expiry before the client considers it past (in ms)",
      Long.class, 0L);

  /**
   * Place holder for the "undefined" value. This is needed to distinguish null values from not set ones.
   */
  private final Object nullValue = new Object();

  private final       String                   key;
  private final       Object                   defValue;
  private final       Class<?>                 type;
  private final       Function<Object, Object> callback;
  private volatile    Object                   value  = nullValue;
  private final       String                   description;
  public final static String                   PREFIX = "graphwire.";

  static {
    readConfiguration();
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue) {
    this(key, description, type, defValue, null);
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue,
      final Function<Object, Object> callback) {
    this.key = key;
    this.description = description;
    this.defValue = defValue;
    this.type = type;
    this.callback = callback;
  }

  /**
   * Reset all the configurations to the default values.
   */
  public static void resetAll() {
    for (GlobalConfiguration v : values())
      v.reset();
  }

  /**
   * Reset the configuration to the default value.
   */
  public void reset() {
    value = nullValue;
  }

  public static void dumpConfiguration(final PrintStream out) {
    out.print(Constants.PRODUCT.toUpperCase(Locale.ENGLISH));
    out.print(" ");
    out.print(Constants.getRawVersion());
    out.println(" configuration:");

    String lastSection = "";
    for (GlobalConfiguration v : values()) {
      final String name = v.key.substring(PREFIX.length());
      final int dot = name.indexOf('.');
      final String section = dot > -1 ? name.substring(0, dot) : "environment";

      if (!lastSection.equals(section)) {
        out.print("- ");
        out.println(section.toUpperCase(Locale.ENGLISH));
        lastSection = section;
      }
      out.print("  + ");
      out.print(v.key);
      out.print(" = ");
      out.println(String.valueOf((Object) v.getValue()));
    }
  }

  public static void fromJSON(final String input) {
    if (input == null)
      return;

    final JSONObject json = new JSONObject(input);
    final JSONObject cfg = json.getJSONObject("configuration");
    for (String k : cfg.keySet()) {
      final GlobalConfiguration cfgEntry = findByKey(PREFIX + k);
      if (cfgEntry != null)
        cfgEntry.setValue(cfg.get(k));
    }
  }

  public static String toJSON() {
    final JSONObject json = new JSONObject();

    final JSONObject cfg = new JSONObject();
    for (GlobalConfiguration k : values())
      cfg.put(k.key.substring(PREFIX.length()), (Object) k.getValue());

    json.put("configuration", cfg);
    return json.toString();
  }

  /**
   * Finds the GlobalConfiguration instance by the key. Key is case insensitive.
   *
   * @param key Key to find. It's case insensitive.
   *
   * @return GlobalConfiguration instance if found, otherwise null
   */
  public static GlobalConfiguration findByKey(final String key) {
    for (GlobalConfiguration v : values()) {
      if (v.getKey().equalsIgnoreCase(key))
        return v;
    }
    return null;
  }

  /**
   * Changes the configuration values in one shot by passing a Map of values. Keys can be the Java ENUM names or the string
   * representation of configuration values
   */
  public static void setConfiguration(final Map<String, Object> config) {
    for (Map.Entry<String, Object> entry : config.entrySet()) {
      for (GlobalConfiguration v : values()) {
        if (v.getKey().equals(entry.getKey()) || v.name().equals(entry.getKey())) {
          v.setValue(entry.getValue());
          break;
        }
      }
    }
  }

  /**
   * Assign configuration values by reading system properties.
   */
  private static void readConfiguration() {
    for (GlobalConfiguration config : values()) {
      String prop = System.getProperty(config.key);
      if (prop == null)
        prop = System.getenv(config.key);

      if (prop != null)
        config.setValue(prop);
    }
  }

  public <T> T getValue() {
    //noinspection unchecked
    return (T) (value != nullValue && value != null ? value : defValue);
  }

  /**
   * @return {@literal true} if configuration was changed from default value and {@literal false} otherwise.
   */
  public boolean isChanged() {
    return value != nullValue;
  }

  public void setValue(final Object newValue) {
    if (newValue == null) {
      value = nullValue;
      return;
    }

    value = convert(newValue);

    if (callback != null)
      try {
        final Object callbackValue = callback.apply(value);
        if (callbackValue != value)
          // OVERWRITE IT
          value = callbackValue;
      } catch (Exception e) {
        LogManager.instance().log(this, Level.SEVERE, "Error during setting property %s=%s", e, key, value);
      }
  }

  /**
   * Converts a raw value (typically a string read from system properties) to the type of this setting.
   */
  Object convert(final Object raw) {
    if (type.isInstance(raw))
      return raw;

    final String s = raw.toString().trim();
    try {
      if (type == Boolean.class)
        return Boolean.parseBoolean(s);
      else if (type == Integer.class)
        return Integer.parseInt(s);
      else if (type == Long.class)
        return Long.parseLong(s);
      else if (type == String.class)
        return s;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value '" + raw + "' for setting '" + key + "' of type " + type.getSimpleName(),
          e);
    }
    return raw;
  }

  public boolean getValueAsBoolean() {
    final Object v = getValue();
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
  }

  public String getValueAsString() {
    final Object v = getValue();
    return v != null ? v.toString() : null;
  }

  public int getValueAsInteger() {
    final Object v = getValue();
    return v instanceof Number ? ((Number) v).intValue() : Integer.parseInt(v.toString());
  }

  public long getValueAsLong() {
    final Object v = getValue();
    return v instanceof Number ? ((Number) v).longValue() : Long.parseLong(v.toString());
  }

  public String getKey() {
    return key;
  }

  public Object getDefValue() {
    return defValue;
  }

  public Class<?> getType() {
    return type;
  }

  public String getDescription() {
    return description;
  }
}
