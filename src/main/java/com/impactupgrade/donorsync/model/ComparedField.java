/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.model;

import com.google.common.base.Strings;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Fields whose change (after standardization) makes a matched donor count as updated.
 */
public enum ComparedField {
  EMAIL("email", r -> r.email, m -> m.email, DonorField.DONOR_EMAIL),
  PHONE("phone", r -> r.phone, m -> m.phone, DonorField.DONOR_PHONE),
  ADDRESS("address", r -> r.address, m -> m.address, DonorField.ADDRESS_LINE1, DonorField.ADDRESS_LINE2),
  CENTER("center", r -> r.facility, m -> m.center, DonorField.FACILITY),
  // only compared when both the batch and the registry carry it
  BIRTHDATE("birthdate", r -> r.birthdate, m -> m.birthdate, DonorField.BIRTHDATE);

  private final String name;
  private final Function<DonorRecord, String> batchValue;
  private final Function<MasterRecord, String> masterValue;
  private final Set<DonorField> sources;

  ComparedField(String name, Function<DonorRecord, String> batchValue, Function<MasterRecord, String> masterValue,
      DonorField source, DonorField... moreSources) {
    this.name = name;
    this.batchValue = batchValue;
    this.masterValue = masterValue;
    this.sources = EnumSet.of(source, moreSources);
  }

  public String getName() {
    return name;
  }

  /**
   * A field can only be compared when at least one of the columns feeding it was mapped. Otherwise the batch simply
   * has no value for it.
   */
  public boolean isMappedBy(Set<DonorField> mappedFields) {
    return sources.stream().anyMatch(mappedFields::contains);
  }

  public String batchValue(DonorRecord record) {
    return batchValue.apply(record);
  }

  public String masterValue(MasterRecord master) {
    return masterValue.apply(master);
  }

  public static ComparedField fromName(String name) {
    if (Strings.isNullOrEmpty(name)) {
      return null;
    }

    String lowercased = name.trim().toLowerCase(Locale.ROOT);
    for (ComparedField field : values()) {
      if (field.name.equals(lowercased)) {
        return field;
      }
    }
    return null;
  }

  public static Set<ComparedField> fromNames(Iterable<String> names) {
    Set<ComparedField> fields = EnumSet.noneOf(ComparedField.class);
    if (names != null) {
      for (String name : names) {
        ComparedField field = fromName(name);
        if (field != null) {
          fields.add(field);
        }
      }
    }
    return fields;
  }
}
