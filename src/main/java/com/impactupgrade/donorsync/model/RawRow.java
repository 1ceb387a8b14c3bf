/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.model;

import java.text.DecimalFormat;
import java.text.SimpleDateFormat;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One row of an uploaded batch, exactly as the file gave it to us. Column names are the file's own headers, values are
 * Strings, Numbers, dates, or null for empty cells.
 */
public class RawRow {

  private final Map<String, Object> values;

  public RawRow(Map<String, ?> values) {
    // keep the file's column order
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static RawRow of(Object... columnsAndValues) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (int i = 0; i + 1 < columnsAndValues.length; i += 2) {
      values.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
    }
    return new RawRow(values);
  }

  public List<String> columns() {
    return new ArrayList<>(values.keySet());
  }

  public boolean hasColumn(String column) {
    return column != null && values.containsKey(column);
  }

  public Object get(String column) {
    if (column == null) return null;
    return values.get(column);
  }

  /**
   * The cell as trimmed text, or null if the column is absent or the cell is empty. Whole numbers are rendered without
   * a decimal part so numeric donor numbers and zip codes survive as the text the center sees.
   */
  public String getString(String column) {
    Object value = get(column);
    if (value == null) {
      return null;
    }

    String s;
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      s = new DecimalFormat(d % 1 == 0 ? "#" : "#.##").format(d);
    } else if (value instanceof LocalDate || value instanceof LocalDateTime) {
      s = value.toString();
    } else if (value instanceof Date) {
      s = new SimpleDateFormat("yyyy-MM-dd").format((Date) value);
    } else {
      s = value.toString();
    }

    s = s.trim();
    return s.isEmpty() ? null : s;
  }

  public boolean isEmpty() {
    return values.values().stream().allMatch(v -> v == null || v.toString().isBlank());
  }

  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
