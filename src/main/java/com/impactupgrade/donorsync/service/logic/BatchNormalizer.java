/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.logic;

import com.impactupgrade.donorsync.model.DonorField;
import com.impactupgrade.donorsync.model.DonorRecord;
import com.impactupgrade.donorsync.model.FieldMapping;
import com.impactupgrade.donorsync.model.NormalizationStats;
import com.impactupgrade.donorsync.model.RawRow;
import com.impactupgrade.donorsync.util.FieldNormalizer;
import com.impactupgrade.donorsync.util.LoggingUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Raw rows -> normalized donor records, one per row, in file order. Never fails on bad cell data.
 */
public class BatchNormalizer {

  private static final Logger log = LogManager.getLogger(BatchNormalizer.class);

  private final FieldNormalizer fieldNormalizer;

  public BatchNormalizer(FieldNormalizer fieldNormalizer) {
    this.fieldNormalizer = fieldNormalizer;
  }

  public List<DonorRecord> normalize(List<RawRow> rows, FieldMapping mapping, NormalizationStats stats) {
    List<DonorRecord> records = new ArrayList<>();
    for (RawRow row : rows) {
      records.add(normalize(row, mapping, stats));
    }
    return records;
  }

  public DonorRecord normalize(RawRow row, FieldMapping mapping, NormalizationStats stats) {
    DonorRecord record = new DonorRecord();

    record.donorNumber = value(row, mapping, DonorField.DONOR_NUMBER);
    record.facility = value(row, mapping, DonorField.FACILITY);

    if (mapping.isMapped(DonorField.DONOR_NAME)) {
      String[] names = fieldNormalizer.processName(value(row, mapping, DonorField.DONOR_NAME), stats);
      record.firstName = names[0];
      record.lastName = names[1];
    } else if (mapping.hasSplitName()) {
      record.firstName = FieldNormalizer.nameToTitleCase(value(row, mapping, DonorField.DONOR_FIRST));
      record.lastName = FieldNormalizer.nameToTitleCase(value(row, mapping, DonorField.DONOR_LAST));
      if (record.firstName.isEmpty() && record.lastName.isEmpty() && stats != null) {
        stats.recordFailure(NormalizationStats.NAME);
      }
    }

    if (mapping.isMapped(DonorField.DONOR_EMAIL)) {
      record.email = fieldNormalizer.normalizeEmail(value(row, mapping, DonorField.DONOR_EMAIL));
    }
    if (mapping.isMapped(DonorField.DONOR_PHONE)) {
      record.phone = fieldNormalizer.formatPhone(value(row, mapping, DonorField.DONOR_PHONE), stats);
    }

    record.account = value(row, mapping, DonorField.DONOR_ACCOUNT);
    record.zipCode = value(row, mapping, DonorField.ZIP_CODE);
    record.status = value(row, mapping, DonorField.DONOR_STATUS);
    record.city = value(row, mapping, DonorField.CITY);

    if (mapping.isMapped(DonorField.ADDRESS_LINE1) || mapping.isMapped(DonorField.ADDRESS_LINE2)) {
      record.address = fieldNormalizer.combineAddress(
          value(row, mapping, DonorField.ADDRESS_LINE1), value(row, mapping, DonorField.ADDRESS_LINE2));
    }

    if (mapping.isMapped(DonorField.BIRTHDATE)) {
      record.birthdate = fieldNormalizer.formatBirthdate(row.get(mapping.column(DonorField.BIRTHDATE)), stats);
    }

    if (mapping.isMapped(DonorField.LAST_DONATION_DATE)) {
      Object lastDonation = row.get(mapping.column(DonorField.LAST_DONATION_DATE));
      if (lastDonation != null && !lastDonation.toString().isBlank()) {
        LocalDate date = fieldNormalizer.parseDate(lastDonation);
        if (date == null) {
          if (stats != null) {
            stats.recordFailure(NormalizationStats.LAST_DONATION_DATE);
          }
          LoggingUtil.verbose(log, "unparseable last donation date {} for donor {}", lastDonation, record.donorNumber);
        }
        record.lastDonationDate = date;
      }
    }

    return record;
  }

  private static String value(RawRow row, FieldMapping mapping, DonorField field) {
    return row.getString(mapping.column(field));
  }
}
