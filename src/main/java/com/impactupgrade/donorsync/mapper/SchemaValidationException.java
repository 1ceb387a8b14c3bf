/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.mapper;

import com.google.common.base.Joiner;

import java.util.List;

/**
 * The batch's columns cannot satisfy the schema. Fatal to the batch.
 */
public class SchemaValidationException extends Exception {

  private final List<String> missing;

  public SchemaValidationException(String message, List<String> missing) {
    super(message + ": " + Joiner.on(", ").join(missing));
    this.missing = List.copyOf(missing);
  }

  public List<String> getMissing() {
    return missing;
  }
}
