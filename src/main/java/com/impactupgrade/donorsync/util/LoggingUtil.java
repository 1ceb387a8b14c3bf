/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.util;

import org.apache.logging.log4j.Logger;

public class LoggingUtil {

  private static final boolean VERBOSE = System.getenv("VERBOSE") != null && Boolean.parseBoolean(System.getenv("VERBOSE"));

  /**
   * If in VERBOSE mode, log it. The caller's Logger is required so the line is attributed to where it came from,
   * not to LoggingUtil. Meant for row-level detail that would drown out the run summary otherwise.
   */
  public static void verbose(Logger log, String s, Object... params) {
    if (VERBOSE) log.info(s, params);
  }
}
