/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-field counts of values that could not be normalized and fell back to their original form. Failures never stop
 * a batch, but they should never be invisible either.
 */
public class NormalizationStats {

  public static final String PHONE = "phone";
  public static final String NAME = "name";
  public static final String BIRTHDATE = "birthdate";
  public static final String LAST_DONATION_DATE = "last_donation_date";

  private final Map<String, Integer> failures = new TreeMap<>();

  public void recordFailure(String field) {
    failures.merge(field, 1, Integer::sum);
  }

  public int getFailures(String field) {
    return failures.getOrDefault(field, 0);
  }

  public int getTotalFailures() {
    return failures.values().stream().mapToInt(Integer::intValue).sum();
  }

  public Map<String, Integer> asMap() {
    return Collections.unmodifiableMap(failures);
  }

  @Override
  public String toString() {
    return failures.toString();
  }
}
