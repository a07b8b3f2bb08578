/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */

package exm.vgen.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import exm.vgen.common.exceptions.InvalidOptionException;
import exm.vgen.common.exceptions.VGenRuntimeError;

/**
 * General code generator settings
 *
 * Defaults are set here and may be overridden by Java system
 * properties of the same name.
 * */
public class Settings
{
  /** Spaces per nesting level in generated VHDL */
  public static final String INDENT_WIDTH = "vgen.indent-width";
  public static final int MAX_INDENT_WIDTH = 32;
  public static final String ARCH_DEFAULT_NAME = "vgen.arch.default-name";

  public static final String LOG_FILE = "vgen.log.file";
  public static final String LOG_TRACE = "vgen.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(INDENT_WIDTH, "2");
    defaults.setProperty(ARCH_DEFAULT_NAME, "Behavioural");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System.  If the result does not validate,
     the previous values are put back.
   */
  public static void initVGenProperties() throws InvalidOptionException {
    // Explicitly set values, or null where the default applied
    Map<String, Object> previous = new HashMap<String, Object>();
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        previous.put(key, properties.get(key));
        properties.setProperty(key, sysVal);
      }
    }
    try {
      validateProperties();
    } catch (InvalidOptionException e) {
      for (Map.Entry<String, Object> prev: previous.entrySet()) {
        if (prev.getValue() == null) {
          properties.remove(prev.getKey());
        } else {
          properties.put(prev.getKey(), prev.getValue());
        }
      }
      throw e;
    }
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any value set since startup, restoring the default
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    checkIndentWidth(getLong(INDENT_WIDTH));
    if (get(ARCH_DEFAULT_NAME).trim().length() == 0) {
      throw new InvalidOptionException(ARCH_DEFAULT_NAME + " is empty");
    }
  }

  private static void checkIndentWidth(long width)
                                    throws InvalidOptionException {
    if (width < 0 || width > MAX_INDENT_WIDTH) {
      throw new InvalidOptionException(INDENT_WIDTH + " must be between 0 " +
          "and " + MAX_INDENT_WIDTH + ", but was " + get(INDENT_WIDTH));
    }
  }

  /**
   * Indentation width, for use while emitting.  A value set with
   * set() is checked here, so a bad one is an internal error.
   */
  public static int indentWidth() {
    try {
      long width = getLong(INDENT_WIDTH);
      checkIndentWidth(width);
      return (int)width;
    } catch (InvalidOptionException e) {
      throw new VGenRuntimeError(e.getMessage(), e);
    }
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
