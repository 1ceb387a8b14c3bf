/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.model;

/**
 * A proposed source column for one canonical field. Offered to the operator, never enforced.
 */
public class MappingSuggestion {

  public enum Confidence {
    // column name equals a known synonym
    EXACT,
    // column name contains a known synonym
    SUBSTRING,
    // nothing matched; first available column
    DEFAULT
  }

  public DonorField field;
  public String column;
  public Confidence confidence;

  public MappingSuggestion() {}

  public MappingSuggestion(DonorField field, String column, Confidence confidence) {
    this.field = field;
    this.column = column;
    this.confidence = confidence;
  }

  @Override
  public String toString() {
    return field.getName() + " <- " + column + " (" + confidence + ")";
  }
}
