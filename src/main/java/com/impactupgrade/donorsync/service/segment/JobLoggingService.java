/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.segment;

import com.impactupgrade.donorsync.model.JobStatus;
import com.impactupgrade.donorsync.model.JobType;

public interface JobLoggingService extends SegmentService {

  void startLog(JobType jobType, String username, String jobName, String originatingPlatform);
  void endLog(JobStatus jobStatus);

  void info(String message, Object... params);
  void warn(String message, Object... params);
  void error(String message, Object... params);
}
