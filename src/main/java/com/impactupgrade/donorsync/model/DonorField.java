/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.model;

import com.google.common.base.Strings;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Canonical fields a source column can feed. The names are the keys used in environment.json and in the
 * confirmed mappings sent by the import UI.
 */
public enum DonorField {
  DONOR_NUMBER("donor_number"),
  DONOR_NAME("donor_name"),
  // pre-split names, as an alternative to DONOR_NAME
  DONOR_FIRST("donor_first"),
  DONOR_LAST("donor_last"),
  DONOR_EMAIL("donor_email"),
  DONOR_ACCOUNT("donor_account"),
  DONOR_PHONE("donor_phone"),
  FACILITY("facility"),
  ADDRESS_LINE1("address_line1"),
  ADDRESS_LINE2("address_line2"),
  CITY("city"),
  ZIP_CODE("zip_code"),
  DONOR_STATUS("donor_status"),
  LAST_DONATION_DATE("last_donation_date"),
  BIRTHDATE("birthdate");

  // Fields that receive a suggestion (possibly a low-confidence default) during assisted mapping.
  public static final Set<DonorField> BASE_FIELDS = EnumSet.complementOf(EnumSet.of(DONOR_FIRST, DONOR_LAST));

  private final String name;

  DonorField(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public static DonorField fromName(String name) {
    if (Strings.isNullOrEmpty(name)) {
      return null;
    }

    String lowercased = name.trim().toLowerCase(Locale.ROOT);
    for (DonorField field : values()) {
      if (field.name.equals(lowercased)) {
        return field;
      }
    }
    return null;
  }
}
