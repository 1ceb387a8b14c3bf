/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.model;

public enum JobType {
  PORTAL_TASK, MANUAL_TASK
}
