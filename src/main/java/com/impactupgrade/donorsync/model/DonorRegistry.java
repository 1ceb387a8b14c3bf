/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A full snapshot of the master registry. The table layout is fixed, with an optional trailing Birthday column.
 */
public class DonorRegistry {

  public static final List<String> COLUMNS = List.of(
      "Donor #", "Donor First", "Donor Last", "Donor E-mail", "Donor Account #",
      "Donor Phone", "Donor Address", "Zip Code", "Donor Status", "Center"
  );
  public static final String BIRTHDATE_COLUMN = "Birthday";

  private final List<MasterRecord> records;
  private final boolean tracksBirthdate;

  public DonorRegistry(List<MasterRecord> records, boolean tracksBirthdate) {
    this.records = Collections.unmodifiableList(new ArrayList<>(records));
    this.tracksBirthdate = tracksBirthdate;
  }

  public static DonorRegistry empty(boolean tracksBirthdate) {
    return new DonorRegistry(List.of(), tracksBirthdate);
  }

  /**
   * Reads a registry table (header row first). Columns are positional, as the header names in the live sheets have
   * drifted over time. The birthdate variant is recognized by an 11th header column named Birthday; any other trailing
   * columns are ignored. With no header at all, the layout falls back to the given default.
   */
  public static DonorRegistry fromTable(List<? extends List<?>> table, boolean defaultTracksBirthdate) {
    if (table == null || table.isEmpty()) {
      return empty(defaultTracksBirthdate);
    }

    List<?> header = table.get(0);
    boolean tracksBirthdate = header.size() > COLUMNS.size() && header.get(COLUMNS.size()) != null
        && BIRTHDATE_COLUMN.equalsIgnoreCase(header.get(COLUMNS.size()).toString().trim());
    List<MasterRecord> records = new ArrayList<>();
    for (List<?> row : table.subList(1, table.size())) {
      if (row == null || row.stream().allMatch(c -> c == null || c.toString().isBlank())) {
        continue;
      }
      records.add(MasterRecord.fromRow(row, tracksBirthdate));
    }
    return new DonorRegistry(records, tracksBirthdate);
  }

  public List<List<String>> toTable() {
    List<List<String>> table = new ArrayList<>();
    table.add(header(tracksBirthdate));
    records.forEach(r -> table.add(r.toRow(tracksBirthdate)));
    return table;
  }

  public static List<String> header(boolean withBirthdate) {
    List<String> header = new ArrayList<>(COLUMNS);
    if (withBirthdate) {
      header.add(BIRTHDATE_COLUMN);
    }
    return header;
  }

  public List<MasterRecord> getRecords() {
    return records;
  }

  public boolean tracksBirthdate() {
    return tracksBirthdate;
  }

  public int size() {
    return records.size();
  }
}
