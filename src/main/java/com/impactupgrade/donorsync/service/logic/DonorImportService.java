/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.logic;

import com.impactupgrade.donorsync.environment.Environment;
import com.impactupgrade.donorsync.mapper.SchemaMapper;
import com.impactupgrade.donorsync.mapper.SchemaValidationException;
import com.impactupgrade.donorsync.model.DonorField;
import com.impactupgrade.donorsync.model.DonorImportResult;
import com.impactupgrade.donorsync.model.DonorRecord;
import com.impactupgrade.donorsync.model.DonorRegistry;
import com.impactupgrade.donorsync.model.FieldMapping;
import com.impactupgrade.donorsync.model.NormalizationStats;
import com.impactupgrade.donorsync.model.RawRow;
import com.impactupgrade.donorsync.model.ReconciliationOutcome;
import com.impactupgrade.donorsync.service.segment.DonorRegistryService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One uploaded batch, end to end: map, normalize, deduplicate, reconcile, then build the next registry, the audit
 * rows, and the leads. All of the computation happens on a registry snapshot taken up front; storage is only touched
 * before and after.
 * <p>
 * Not safe to run concurrently against the same registry. Two overlapping runs would each write a full registry
 * computed from the same snapshot, and the second write would silently drop the first run's changes. Callers must
 * make sure only one import runs at a time.
 */
public class DonorImportService {

  private static final Logger log = LogManager.getLogger(DonorImportService.class);

  private final Environment env;

  public DonorImportService(Environment env) {
    this.env = env;
  }

  /**
   * Loads the registry, computes, and persists: the registry first, then the audit rows.
   */
  public DonorImportResult importBatch(List<RawRow> rows, SchemaMapper schemaMapper)
      throws SchemaValidationException, DonorImportException {
    // fail fast on a bad file, before we go anywhere near the registry
    schemaMapper.resolve(columns(rows));

    DonorRegistryService donorRegistryService = env.donorRegistryService();

    DonorRegistry registry;
    try {
      registry = donorRegistryService.loadRegistry();
    } catch (Exception e) {
      throw new DonorImportException("unable to load the donor registry from " + donorRegistryService.name(), e);
    }

    DonorImportResult result = process(rows, schemaMapper, registry);
    persist(result, donorRegistryService);
    return result;
  }

  /**
   * Pure computation against the given snapshot. Nothing is persisted.
   */
  public DonorImportResult process(List<RawRow> rows, SchemaMapper schemaMapper, DonorRegistry registry)
      throws SchemaValidationException {
    FieldMapping mapping = schemaMapper.resolve(columns(rows));
    env.logJobInfo("processing {} rows with mapping {}", rows.size(), mapping);

    NormalizationStats stats = new NormalizationStats();
    List<DonorRecord> normalized = env.batchNormalizer().normalize(rows, mapping, stats);
    List<DonorRecord> batch = env.batchDeduplicator()
        .deduplicate(normalized, mapping.isMapped(DonorField.LAST_DONATION_DATE));
    if (!mapping.isMapped(DonorField.LAST_DONATION_DATE)) {
      env.logJobWarn("no last donation date mapped; keeping the first row seen per donor and facility");
    }

    boolean batchHasBirthdate = mapping.isMapped(DonorField.BIRTHDATE);
    ReconciliationOutcome outcome = env.reconciliationService().reconcile(batch, registry, mapping);
    DonorRegistry nextRegistry = env.masterMergeService().merge(registry, outcome);
    List<List<String>> auditRows = env.auditRowBuilder().build(outcome);

    LeadsService leadsService = env.leadsService();
    List<DonorRecord> leads = leadsService.selectLeads(outcome);
    List<List<String>> leadsTable = leadsService.toTable(leads, batchHasBirthdate);

    DonorImportResult result = new DonorImportResult(rows.size(), mapping, stats, batch, outcome, nextRegistry,
        auditRows, leads, leadsTable);
    logSummary(result);
    return result;
  }

  /**
   * Registry first, then the audit log. Safe to call again with the same result after a failure.
   */
  public void persist(DonorImportResult result, DonorRegistryService donorRegistryService)
      throws DonorImportException {
    try {
      donorRegistryService.saveRegistry(result.getNextRegistry());
    } catch (Exception e) {
      throw new DonorImportException("unable to save the donor registry to " + donorRegistryService.name(), result, e);
    }

    try {
      donorRegistryService.appendAuditRows(result.getAuditRows());
    } catch (Exception e) {
      throw new DonorImportException("registry saved, but unable to append the audit rows to "
          + donorRegistryService.name(), result, e);
    }

    env.logJobInfo("saved {} registry rows and appended {} audit rows",
        result.getNextRegistry().size(), result.getAuditRows().size());
  }

  private void logSummary(DonorImportResult result) {
    ReconciliationOutcome outcome = result.getOutcome();
    env.logJobInfo("rows read: {}; unique donors: {}", result.getTotalRows(), result.getUniqueDonors());
    env.logJobInfo("new: {}; updated: {}; unchanged: {}; excluded (no donor number or facility): {}",
        outcome.getNewRecords().size(), outcome.getUpdatedRecords().size(), outcome.getUnchangedRecords().size(),
        outcome.getExcludedCount());
    if (outcome.getLooseUpdatedRecords().size() != outcome.getUpdatedRecords().size()) {
      log.info("loose comparison flagged {} updated records", outcome.getLooseUpdatedRecords().size());
    }
    if (result.getNormalizationStats().getTotalFailures() > 0) {
      env.logJobWarn("values that could not be normalized: {}", result.getNormalizationStats());
    }
    env.logJobInfo("leads: {}", result.getLeads().size());
  }

  // every column any row has, in file order
  private static List<String> columns(List<RawRow> rows) {
    Set<String> columns = new LinkedHashSet<>();
    rows.forEach(row -> columns.addAll(row.columns()));
    return new ArrayList<>(columns);
  }
}
