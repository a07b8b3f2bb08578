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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Level;
import org.junit.Test;

public class LoggingTest {

  @Test
  public void testLoggerName() {
    assertEquals("exm.vgen", Logging.getVGenLogger().getName());
  }

  @Test
  public void testAddEmittedOnce() {
    assertTrue(Logging.addEmitted(Level.WARN, "LoggingTest once"));
    assertFalse(Logging.addEmitted(Level.WARN, "LoggingTest once"));
    assertTrue(Logging.addEmitted(Level.INFO, "LoggingTest once"));
  }

  @Test
  public void testNoLogFileLeavesLevel() {
    Level before = Logging.getVGenLogger().getLevel();
    Logging.setupLogging("", true);
    assertEquals(before, Logging.getVGenLogger().getLevel());
  }
}
