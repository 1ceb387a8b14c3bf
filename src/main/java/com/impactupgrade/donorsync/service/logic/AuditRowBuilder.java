/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.logic;

import com.impactupgrade.donorsync.environment.EnvironmentConfig;
import com.impactupgrade.donorsync.model.DonorRecord;
import com.impactupgrade.donorsync.model.DonorRegistry;
import com.impactupgrade.donorsync.model.MasterRecord;
import com.impactupgrade.donorsync.model.ReconciliationOutcome;

import java.util.ArrayList;
import java.util.List;

import static com.impactupgrade.donorsync.util.Utils.nullToEmptyString;

/**
 * Rows for the append-only audit log: the registry columns, the manual-review marker columns, then the birthdate.
 * Every row has the same width whether or not the batch had birthdates.
 */
public class AuditRowBuilder {

  private final List<String> markerColumns;
  private final String markerValue;

  public AuditRowBuilder(List<String> markerColumns, String markerValue) {
    this.markerColumns = List.copyOf(markerColumns);
    this.markerValue = nullToEmptyString(markerValue);
  }

  public AuditRowBuilder(EnvironmentConfig.Audit config) {
    this(config.markerColumns, config.markerValue);
  }

  /**
   * New records first, then updated ones.
   */
  public List<List<String>> build(ReconciliationOutcome outcome) {
    List<List<String>> rows = new ArrayList<>();
    for (DonorRecord record : outcome.getNewAndUpdatedRecords()) {
      MasterRecord master = MasterRecord.from(record);
      List<String> row = new ArrayList<>(master.toRow(false));
      markerColumns.forEach(c -> row.add(markerValue));
      row.add(nullToEmptyString(master.birthdate));
      rows.add(row);
    }
    return rows;
  }

  public static List<String> header(EnvironmentConfig.Audit config) {
    return header(config.markerColumns);
  }

  private static List<String> header(List<String> markerColumns) {
    List<String> header = new ArrayList<>(DonorRegistry.COLUMNS);
    header.addAll(markerColumns);
    header.add(DonorRegistry.BIRTHDATE_COLUMN);
    return header;
  }
}
