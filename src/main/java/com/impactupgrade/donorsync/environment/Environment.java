/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.environment;

import com.impactupgrade.donorsync.client.GoogleSheetsClient;
import com.impactupgrade.donorsync.mapper.AssistedSchemaMapper;
import com.impactupgrade.donorsync.mapper.FixedSchemaMapper;
import com.impactupgrade.donorsync.mapper.MappingSuggester;
import com.impactupgrade.donorsync.model.FieldMapping;
import com.impactupgrade.donorsync.model.JobStatus;
import com.impactupgrade.donorsync.model.JobType;
import com.impactupgrade.donorsync.service.logic.AuditRowBuilder;
import com.impactupgrade.donorsync.service.logic.BatchDeduplicator;
import com.impactupgrade.donorsync.service.logic.BatchNormalizer;
import com.impactupgrade.donorsync.service.logic.DonorImportService;
import com.impactupgrade.donorsync.service.logic.LeadsService;
import com.impactupgrade.donorsync.service.logic.MasterMergeService;
import com.impactupgrade.donorsync.service.logic.ReconciliationService;
import com.impactupgrade.donorsync.service.segment.DonorRegistryService;
import com.impactupgrade.donorsync.service.segment.JobLoggingService;
import com.impactupgrade.donorsync.service.segment.SegmentService;
import com.impactupgrade.donorsync.util.FieldNormalizer;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.map.CaseInsensitiveMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Every import is kicked off by either an HTTP request or a manual script. This class carries the context of that
 * run through all processing steps: the merged configuration, the request's headers and params, and the registry of
 * services the run should use.
 * <p>
 * Tests (and deployments with custom needs) subclass it and override individual registry methods.
 */
public class Environment {

  private static final Logger log = LogManager.getLogger(Environment.class);

  protected final EnvironmentConfig config;

  protected final String jobTraceId = UUID.randomUUID().toString();

  // Request headers, query params, etc., if available.
  protected CaseInsensitiveMap<String, String> otherContext = new CaseInsensitiveMap<>();

  public Environment() {
    config = EnvironmentConfig.init();
  }

  public Environment(String otherJsonFilename) {
    config = EnvironmentConfig.init();
    config.addOtherJsonFile(otherJsonFilename);
  }

  public EnvironmentConfig getConfig() {
    return config;
  }

  public String getJobTraceId() {
    return jobTraceId;
  }

  public Map<String, String> getOtherContext() {
    return otherContext;
  }

  public void addOtherContext(String key, String value) {
    otherContext.put(key, value);
  }

  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
  // REGISTRY
  // Provides a simple registry of services, clients, etc. to allow subprojects to override concepts as needed!
  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

  // engine

  public FieldNormalizer fieldNormalizer() { return new FieldNormalizer(getConfig().normalization); }
  public FixedSchemaMapper fixedSchemaMapper() { return new FixedSchemaMapper(getConfig().schema); }
  public AssistedSchemaMapper assistedSchemaMapper(FieldMapping confirmedMapping) { return new AssistedSchemaMapper(confirmedMapping); }
  public MappingSuggester mappingSuggester() { return new MappingSuggester(getConfig().schema); }
  public BatchNormalizer batchNormalizer() { return new BatchNormalizer(fieldNormalizer()); }
  public BatchDeduplicator batchDeduplicator() { return new BatchDeduplicator(); }
  public ReconciliationService reconciliationService() { return new ReconciliationService(fieldNormalizer(), getConfig().reconciliation); }
  public MasterMergeService masterMergeService() { return new MasterMergeService(); }
  public LeadsService leadsService() { return new LeadsService(fieldNormalizer(), getConfig().reconciliation); }
  public AuditRowBuilder auditRowBuilder() { return new AuditRowBuilder(getConfig().audit); }

  // logic services

  public DonorImportService donorImportService() { return new DonorImportService(this); }

  // segment services

  public DonorRegistryService donorRegistryService() {
    return donorRegistryService(getConfig().registryPlatform);
  }

  public DonorRegistryService donorRegistryService(String name) {
    return segmentService(name, DonorRegistryService.class);
  }

  private <T extends SegmentService> T segmentService(final String name, Class<T> clazz) {
    ServiceLoader<T> loader = java.util.ServiceLoader.load(clazz);
    T segmentService = loader.stream()
        .map(ServiceLoader.Provider::get)
        .filter(service -> name.equalsIgnoreCase(service.name()))
        // Custom overrides will appear first naturally due to CL order!
        .findFirst()
        .orElseThrow(() -> new RuntimeException("segment service not found: " + name));
    segmentService.init(this);
    return segmentService;
  }

  // vendor clients

  public GoogleSheetsClient googleSheetsClient() throws GeneralSecurityException, IOException {
    return new GoogleSheetsClient(getConfig().googleSheets);
  }

  // job logging services

  public JobLoggingService jobLoggingService(String name) {
    return segmentService(name, JobLoggingService.class);
  }

  public Set<JobLoggingService> jobLoggingServices() {
    if (CollectionUtils.isNotEmpty(config.loggers)) {
      return config.loggers.stream()
          .map(name -> segmentService(name, JobLoggingService.class))
          .filter(service -> service.isConfigured(this))
          .collect(Collectors.toSet());
    } else {
      log.debug("no loggers configured; defaulting to console");
      return Set.of(segmentService("console", JobLoggingService.class));
    }
  }

  public void startJobLog(JobType jobType, String username, String jobName, String originatingPlatform) {
    jobLoggingServices().forEach(logger -> logger.startLog(jobType, username, jobName, originatingPlatform));
  }

  public void logJobInfo(String message, Object... params) {
    jobLoggingServices().forEach(logger -> logger.info(message, params));
  }

  public void logJobWarn(String message, Object... params) {
    jobLoggingServices().forEach(logger -> logger.warn(message, params));
  }

  public void logJobError(String message, Object... params) {
    jobLoggingServices().forEach(logger -> logger.error(message, params));
  }

  public void endJobLog(JobStatus jobStatus) {
    jobLoggingServices().forEach(logger -> logger.endLog(jobStatus));
  }
}
