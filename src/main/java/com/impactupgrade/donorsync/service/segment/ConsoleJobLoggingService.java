/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.segment;

import com.impactupgrade.donorsync.environment.Environment;
import com.impactupgrade.donorsync.model.JobStatus;
import com.impactupgrade.donorsync.model.JobType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.util.StackLocatorUtil;

/**
 * Job logs straight to Log4j2, attributed to whichever class called Environment.logJob*.
 */
public class ConsoleJobLoggingService implements JobLoggingService {

  private static final Logger log = LogManager.getLogger(ConsoleJobLoggingService.class);

  @Override
  public String name() {
    return "console";
  }

  @Override
  public boolean isConfigured(Environment env) {
    return true;
  }

  @Override
  public void init(Environment env) {
  }

  @Override
  public void startLog(JobType jobType, String username, String jobName, String originatingPlatform) {
    log.info("starting job {} ({}), requested by {} via {}", jobName, jobType, username, originatingPlatform);
  }

  @Override
  public void endLog(JobStatus jobStatus) {
    log.info("job ended: {}", jobStatus);
  }

  @Override
  public void info(String message, Object... params) {
    getLogger().info(message, params);
  }

  @Override
  public void warn(String message, Object... params) {
    getLogger().warn(message, params);
  }

  @Override
  public void error(String message, Object... params) {
    getLogger().error(message, params);
  }

  private Logger getLogger() {
    return LogManager.getLogger(StackLocatorUtil.getCallerClass(6));
  }
}
