/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.segment;

import com.google.common.base.Strings;
import com.impactupgrade.donorsync.client.GoogleSheetsClient;
import com.impactupgrade.donorsync.environment.Environment;
import com.impactupgrade.donorsync.environment.EnvironmentConfig;
import com.impactupgrade.donorsync.model.DonorRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * The live setup: one spreadsheet, where the registry is read from a combined view, written to the DB tab, and the
 * audit trail is appended to its own tab.
 */
public class GoogleSheetsDonorRegistryService implements DonorRegistryService {

  private static final Logger log = LogManager.getLogger(GoogleSheetsDonorRegistryService.class);

  protected Environment env;
  protected EnvironmentConfig.GoogleSheets googleSheetsConfig;
  private GoogleSheetsClient googleSheetsClient;

  @Override
  public String name() {
    return "googlesheets";
  }

  @Override
  public boolean isConfigured(Environment env) {
    return !Strings.isNullOrEmpty(env.getConfig().googleSheets.spreadsheetId);
  }

  @Override
  public void init(Environment env) {
    this.env = env;
    this.googleSheetsConfig = env.getConfig().googleSheets;
  }

  @Override
  public DonorRegistry loadRegistry() throws Exception {
    List<List<Object>> values = client().getValues(googleSheetsConfig.spreadsheetId,
        GoogleSheetsClient.sheetRange(googleSheetsConfig.registrySourceSheet));
    DonorRegistry registry = DonorRegistry.fromTable(values, env.getConfig().registry.tracksBirthdate);
    log.info("loaded {} registry rows from {}", registry.size(), googleSheetsConfig.registrySourceSheet);
    return registry;
  }

  @Override
  public void saveRegistry(DonorRegistry registry) throws Exception {
    String range = GoogleSheetsClient.sheetRange(googleSheetsConfig.registrySheet);
    client().clear(googleSheetsConfig.spreadsheetId, range);
    client().update(googleSheetsConfig.spreadsheetId, range, toCells(registry.toTable()));
    log.info("saved {} registry rows to {}", registry.size(), googleSheetsConfig.registrySheet);
  }

  @Override
  public void appendAuditRows(List<List<String>> auditRows) throws Exception {
    if (auditRows.isEmpty()) {
      return;
    }

    client().append(googleSheetsConfig.spreadsheetId, GoogleSheetsClient.sheetRange(googleSheetsConfig.auditSheet),
        toCells(auditRows));
    log.info("appended {} audit rows to {}", auditRows.size(), googleSheetsConfig.auditSheet);
  }

  protected GoogleSheetsClient client() throws Exception {
    if (googleSheetsClient == null) {
      googleSheetsClient = env.googleSheetsClient();
    }
    return googleSheetsClient;
  }

  // the Sheets API wants Objects, and blank cells rather than nulls
  private static List<List<Object>> toCells(List<List<String>> table) {
    List<List<Object>> cells = new ArrayList<>();
    for (List<String> row : table) {
      List<Object> cellRow = new ArrayList<>();
      row.forEach(value -> cellRow.add(value == null ? "" : value));
      cells.add(cellRow);
    }
    return cells;
  }
}
