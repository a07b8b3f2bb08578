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

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.vgen.common.exceptions.InvalidOptionException;
import exm.vgen.common.exceptions.VGenRuntimeError;
import exm.vgen.common.util.Pair;

public class Logging
{
  private static final String VGEN_LOGGER_NAME = "exm.vgen";

  /**
   * Messages already emitted.
   */
  static final Set<Pair<Level, String>> emitted =
       new HashSet<Pair<Level, String>>();

  public static Logger getVGenLogger()
  {
    return Logger.getLogger(VGEN_LOGGER_NAME);
  }

  /**
   * Set up logging from the vgen.log.* settings
   */
  public static Logger setupLogging() throws InvalidOptionException
  {
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Settings.getBoolean(Settings.LOG_TRACE));
  }

  /**
   * Send generator logging to the given file.
   * @param logfile empty or null to leave the log4j configuration alone
   * @param trace log at TRACE level instead of DEBUG
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger vgenLogger = getVGenLogger();
    if (logfile != null && logfile.length() > 0) {
      Layout layout = new PatternLayout("%-5p %m%n");
      try {
        FileAppender appender = new FileAppender(layout, logfile, false);
        vgenLogger.addAppender(appender);
      } catch (IOException e) {
        throw new VGenRuntimeError("Could not open log file: " + logfile, e);
      }
      vgenLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    }
    // Even if logging is disabled, this must be valid:
    return vgenLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getVGenLogger().warn(msg);
    else
      getVGenLogger().debug("Duplicate Warning: " + msg);
  }
}
