/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.model;

import java.util.Collections;
import java.util.List;

/**
 * Everything one import run computed. Immutable once built, so a failed persistence step can be retried against the
 * exact same next-state registry.
 */
public class DonorImportResult {

  private final int totalRows;
  private final FieldMapping mapping;
  private final NormalizationStats normalizationStats;
  private final List<DonorRecord> batchRecords;
  private final ReconciliationOutcome outcome;
  private final DonorRegistry nextRegistry;
  private final List<List<String>> auditRows;
  private final List<DonorRecord> leads;
  private final List<List<String>> leadsTable;

  public DonorImportResult(int totalRows, FieldMapping mapping, NormalizationStats normalizationStats,
      List<DonorRecord> batchRecords, ReconciliationOutcome outcome, DonorRegistry nextRegistry,
      List<List<String>> auditRows, List<DonorRecord> leads, List<List<String>> leadsTable) {
    this.totalRows = totalRows;
    this.mapping = mapping;
    this.normalizationStats = normalizationStats;
    this.batchRecords = Collections.unmodifiableList(batchRecords);
    this.outcome = outcome;
    this.nextRegistry = nextRegistry;
    this.auditRows = Collections.unmodifiableList(auditRows);
    this.leads = Collections.unmodifiableList(leads);
    this.leadsTable = Collections.unmodifiableList(leadsTable);
  }

  public int getTotalRows() {
    return totalRows;
  }

  public FieldMapping getMapping() {
    return mapping;
  }

  public NormalizationStats getNormalizationStats() {
    return normalizationStats;
  }

  /**
   * The deduplicated batch, one record per (donor number, facility).
   */
  public List<DonorRecord> getBatchRecords() {
    return batchRecords;
  }

  public long getUniqueDonors() {
    return batchRecords.stream().filter(DonorRecord::isKeyable).map(r -> r.donorNumber).distinct().count();
  }

  public ReconciliationOutcome getOutcome() {
    return outcome;
  }

  public DonorRegistry getNextRegistry() {
    return nextRegistry;
  }

  public List<List<String>> getAuditRows() {
    return auditRows;
  }

  public List<DonorRecord> getLeads() {
    return leads;
  }

  public List<List<String>> getLeadsTable() {
    return leadsTable;
  }
}
