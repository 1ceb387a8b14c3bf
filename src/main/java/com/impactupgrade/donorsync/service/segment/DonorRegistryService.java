/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.segment;

import com.impactupgrade.donorsync.model.DonorRegistry;

import java.util.List;

/**
 * Where the master registry and the audit log live. The engine never talks to storage directly: it gets a snapshot
 * from loadRegistry, computes, and hands back a complete next-state registry.
 */
public interface DonorRegistryService extends SegmentService {

  /**
   * A full snapshot. An empty or missing registry is an empty snapshot, not an error.
   */
  DonorRegistry loadRegistry() throws Exception;

  /**
   * Replaces the stored registry with the given one, in full.
   */
  void saveRegistry(DonorRegistry registry) throws Exception;

  /**
   * Appends to the audit log. Existing audit rows are never touched.
   */
  void appendAuditRows(List<List<String>> auditRows) throws Exception;
}
