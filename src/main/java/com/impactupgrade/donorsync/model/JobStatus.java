/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.model;

public enum JobStatus {
  ACTIVE, DONE, FAILED
}
