/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.logic;

import com.impactupgrade.donorsync.model.DonorImportResult;

/**
 * The registry couldn't be loaded or the results couldn't be persisted. When the failure happened after the
 * computation, the result is attached untouched, so persisting can be retried without recomputing anything.
 */
public class DonorImportException extends Exception {

  private final DonorImportResult result;

  public DonorImportException(String message, Throwable cause) {
    this(message, null, cause);
  }

  public DonorImportException(String message, DonorImportResult result, Throwable cause) {
    super(message, cause);
    this.result = result;
  }

  /**
   * Null if the failure happened before anything was computed.
   */
  public DonorImportResult getResult() {
    return result;
  }
}
