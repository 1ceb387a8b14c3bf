/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.logic;

import com.impactupgrade.donorsync.model.DonorField;
import com.impactupgrade.donorsync.model.DonorRecord;
import com.impactupgrade.donorsync.model.DonorRegistry;
import com.impactupgrade.donorsync.model.MasterRecord;
import com.impactupgrade.donorsync.model.ReconciliationOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes the complete next-state registry. Rows are replaced on update and appended when new, never deleted. An
 * updated row keeps the registry's value for every field the batch didn't map. The registry passed in is left
 * untouched.
 */
public class MasterMergeService {

  public DonorRegistry merge(DonorRegistry registry, ReconciliationOutcome outcome) {
    Set<String> updatedKeys = outcome.getUpdatedRecords().stream()
        .map(DonorRecord::matchKey)
        .collect(Collectors.toSet());

    List<MasterRecord> merged = new ArrayList<>();
    for (MasterRecord master : registry.getRecords()) {
      if (!updatedKeys.contains(master.matchKey())) {
        merged.add(master);
      }
    }

    for (DonorRecord record : outcome.getUpdatedRecords()) {
      MasterRecord updated = MasterRecord.from(record);
      MasterRecord previous = outcome.getMatchedMaster(record.matchKey());
      if (previous != null) {
        keepUnmapped(updated, previous, outcome);
      }
      merged.add(updated);
    }

    for (DonorRecord record : outcome.getNewRecords()) {
      merged.add(MasterRecord.from(record));
    }

    return new DonorRegistry(merged, registry.tracksBirthdate());
  }

  // a batch that never read a column must not wipe out what the registry already has in it
  private static void keepUnmapped(MasterRecord updated, MasterRecord previous, ReconciliationOutcome outcome) {
    if (!outcome.isMapped(DonorField.DONOR_EMAIL)) {
      updated.email = previous.email;
    }
    if (!outcome.isMapped(DonorField.DONOR_ACCOUNT)) {
      updated.account = previous.account;
    }
    if (!outcome.isMapped(DonorField.DONOR_PHONE)) {
      updated.phone = previous.phone;
    }
    if (!outcome.isMapped(DonorField.ADDRESS_LINE1) && !outcome.isMapped(DonorField.ADDRESS_LINE2)) {
      updated.address = previous.address;
    }
    if (!outcome.isMapped(DonorField.ZIP_CODE)) {
      updated.zipCode = previous.zipCode;
    }
    if (!outcome.isMapped(DonorField.DONOR_STATUS)) {
      updated.status = previous.status;
    }
    // blank birthdates in the batch don't clear known ones either
    if (updated.birthdate == null) {
      updated.birthdate = previous.birthdate;
    }
  }
}
