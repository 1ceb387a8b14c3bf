/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.segment;

import com.google.common.base.Strings;
import com.impactupgrade.donorsync.environment.Environment;
import com.impactupgrade.donorsync.environment.EnvironmentConfig;
import com.impactupgrade.donorsync.model.DonorRegistry;
import com.impactupgrade.donorsync.service.logic.AuditRowBuilder;
import com.impactupgrade.donorsync.util.Utils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Registry and audit log as two CSV files in a local directory. Handy for single-office deployments and for running
 * the whole pipeline without any Google credentials.
 */
public class CsvDonorRegistryService implements DonorRegistryService {

  private static final Logger log = LogManager.getLogger(CsvDonorRegistryService.class);

  protected Environment env;
  protected EnvironmentConfig.CsvRegistry csvConfig;

  @Override
  public String name() {
    return "csv";
  }

  @Override
  public boolean isConfigured(Environment env) {
    return !Strings.isNullOrEmpty(env.getConfig().csvRegistry.directory);
  }

  @Override
  public void init(Environment env) {
    this.env = env;
    this.csvConfig = env.getConfig().csvRegistry;
  }

  @Override
  public DonorRegistry loadRegistry() throws Exception {
    Path registryFile = registryFile();
    if (!Files.exists(registryFile)) {
      log.info("no registry at {}; starting from an empty one", registryFile);
      return DonorRegistry.empty(env.getConfig().registry.tracksBirthdate);
    }

    try (Reader reader = Files.newBufferedReader(registryFile, StandardCharsets.UTF_8)) {
      return DonorRegistry.fromTable(Utils.getCsvTable(reader), env.getConfig().registry.tracksBirthdate);
    }
  }

  @Override
  public void saveRegistry(DonorRegistry registry) throws Exception {
    Path registryFile = registryFile();
    Files.createDirectories(registryFile.getParent());

    // write the complete next state aside, then swap it in
    Path tempFile = Files.createTempFile(registryFile.getParent(), csvConfig.registryFile, ".tmp");
    try {
      try (Writer writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
        Utils.writeCsvTable(registry.toTable(), writer);
      }
      move(tempFile, registryFile);
    } finally {
      Files.deleteIfExists(tempFile);
    }

    log.info("saved {} registry rows to {}", registry.size(), registryFile);
  }

  @Override
  public void appendAuditRows(List<List<String>> auditRows) throws Exception {
    if (auditRows.isEmpty()) {
      return;
    }

    Path auditFile = auditFile();
    Files.createDirectories(auditFile.getParent());

    List<List<String>> table = new ArrayList<>();
    if (!Files.exists(auditFile) || Files.size(auditFile) == 0) {
      table.add(AuditRowBuilder.header(env.getConfig().audit));
    }
    table.addAll(auditRows);

    try (Writer writer = Files.newBufferedWriter(auditFile, StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
      Utils.writeCsvTable(table, writer);
    }

    log.info("appended {} audit rows to {}", auditRows.size(), auditFile);
  }

  protected Path registryFile() {
    return Paths.get(csvConfig.directory, csvConfig.registryFile).toAbsolutePath();
  }

  protected Path auditFile() {
    return Paths.get(csvConfig.directory, csvConfig.auditFile).toAbsolutePath();
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.warn("atomic move not supported for {}; replacing in place", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
