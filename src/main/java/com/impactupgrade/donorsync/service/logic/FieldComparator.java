/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.logic;

import com.impactupgrade.donorsync.model.ComparedField;
import com.impactupgrade.donorsync.model.DonorRecord;
import com.impactupgrade.donorsync.model.MasterRecord;
import com.impactupgrade.donorsync.util.FieldNormalizer;

import java.util.EnumSet;
import java.util.Set;

import static com.impactupgrade.donorsync.util.Utils.standardize;

/**
 * Compares a batch record to its registry row on standardized values, so only semantic changes count.
 */
public class FieldComparator {

  private final FieldNormalizer fieldNormalizer;

  public FieldComparator(FieldNormalizer fieldNormalizer) {
    this.fieldNormalizer = fieldNormalizer;
  }

  public boolean differs(ComparedField field, DonorRecord record, MasterRecord master) {
    return !standardize(field.batchValue(record)).equals(standardize(masterValue(field, master)));
  }

  public Set<ComparedField> changedFields(Set<ComparedField> fields, DonorRecord record, MasterRecord master) {
    Set<ComparedField> changed = EnumSet.noneOf(ComparedField.class);
    for (ComparedField field : fields) {
      if (differs(field, record, master)) {
        changed.add(field);
      }
    }
    return changed;
  }

  private String masterValue(ComparedField field, MasterRecord master) {
    String value = field.masterValue(master);
    // older registry rows were typed in by hand, so run them through the same formatters as the batch
    return switch (field) {
      case PHONE -> fieldNormalizer.formatPhone(value);
      case BIRTHDATE -> fieldNormalizer.formatBirthdate(value);
      default -> value;
    };
  }
}
