/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.model;

import com.google.common.base.Strings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Which source column feeds each canonical field. Unmapped fields are simply absent and drop out of every downstream
 * record.
 */
public class FieldMapping {

  private final Map<DonorField, String> columns = new EnumMap<>(DonorField.class);

  public FieldMapping() {}

  public FieldMapping(Map<DonorField, String> columns) {
    columns.forEach(this::put);
  }

  /**
   * Builds a mapping from the loosely-typed form the UI sends (canonical field name -> column name). Unknown field
   * names are ignored.
   */
  public static FieldMapping fromNames(Map<String, String> columnsByFieldName) {
    FieldMapping mapping = new FieldMapping();
    if (columnsByFieldName != null) {
      columnsByFieldName.forEach((fieldName, column) -> mapping.put(DonorField.fromName(fieldName), column));
    }
    return mapping;
  }

  public FieldMapping put(DonorField field, String column) {
    if (field != null && !Strings.isNullOrEmpty(column)) {
      columns.put(field, column);
    }
    return this;
  }

  public String column(DonorField field) {
    return columns.get(field);
  }

  public boolean isMapped(DonorField field) {
    return columns.containsKey(field);
  }

  public boolean hasSplitName() {
    return isMapped(DonorField.DONOR_FIRST) && isMapped(DonorField.DONOR_LAST);
  }

  /**
   * Required fields that are unresolved. A batch is processable only if this is empty.
   */
  public List<DonorField> missingRequired() {
    List<DonorField> missing = new ArrayList<>();
    if (!isMapped(DonorField.DONOR_NUMBER)) missing.add(DonorField.DONOR_NUMBER);
    if (!isMapped(DonorField.DONOR_NAME) && !hasSplitName()) missing.add(DonorField.DONOR_NAME);
    if (!isMapped(DonorField.FACILITY)) missing.add(DonorField.FACILITY);
    return missing;
  }

  public Map<DonorField, String> asMap() {
    return Collections.unmodifiableMap(columns);
  }

  @Override
  public String toString() {
    return columns.toString();
  }
}
