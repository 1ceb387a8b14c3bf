/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.logic;

import com.impactupgrade.donorsync.environment.EnvironmentConfig;
import com.impactupgrade.donorsync.model.ComparedField;
import com.impactupgrade.donorsync.model.DonorRecord;
import com.impactupgrade.donorsync.model.MasterRecord;
import com.impactupgrade.donorsync.model.ReconciliationOutcome;
import com.impactupgrade.donorsync.util.FieldNormalizer;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.impactupgrade.donorsync.util.Utils.nullToEmptyString;

/**
 * Leads are donors the outreach team should contact: everyone new, plus updated donors whose contact details changed.
 * An address or center change alone is not a lead.
 */
public class LeadsService {

  public static final List<String> COLUMNS_BEFORE_BIRTHDATE = List.of(
      "Donor #", "Donor Account #", "Zip Code", "Donor Status", "Facility");
  public static final String BIRTHDATE_COLUMN = "Birthday";
  public static final List<String> COLUMNS_AFTER_BIRTHDATE = List.of(
      "Donor First", "Donor Last", "Donor E-mail", "Donor Phone", "Donor Address", "City");

  private final FieldComparator fieldComparator;
  private final Set<ComparedField> leadFields;

  public LeadsService(FieldNormalizer fieldNormalizer, Set<ComparedField> leadFields) {
    this.fieldComparator = new FieldComparator(fieldNormalizer);
    this.leadFields = leadFields.isEmpty() ? EnumSet.noneOf(ComparedField.class) : EnumSet.copyOf(leadFields);
  }

  public LeadsService(FieldNormalizer fieldNormalizer, EnvironmentConfig.Reconciliation config) {
    this(fieldNormalizer, ComparedField.fromNames(config.leadFields));
  }

  public List<DonorRecord> selectLeads(ReconciliationOutcome outcome) {
    Set<ComparedField> fields = ReconciliationService.comparable(leadFields, outcome.getMappedFields(),
        outcome.isBirthdateCompared());

    List<DonorRecord> leads = new ArrayList<>(outcome.getNewRecords());
    for (DonorRecord record : outcome.getUpdatedRecords()) {
      MasterRecord master = outcome.getMatchedMaster(record.matchKey());
      if (master != null && !fieldComparator.changedFields(fields, record, master).isEmpty()) {
        leads.add(record);
      }
    }
    return leads;
  }

  /**
   * Header row first. The Birthday column is only there when the batch had birthdates to begin with.
   */
  public List<List<String>> toTable(List<DonorRecord> leads, boolean withBirthdate) {
    List<List<String>> table = new ArrayList<>();
    table.add(header(withBirthdate));
    for (DonorRecord lead : leads) {
      List<String> row = new ArrayList<>(List.of(
          nullToEmptyString(lead.donorNumber), nullToEmptyString(lead.account), nullToEmptyString(lead.zipCode),
          nullToEmptyString(lead.status), nullToEmptyString(lead.facility)));
      if (withBirthdate) {
        row.add(nullToEmptyString(lead.birthdate));
      }
      row.addAll(List.of(
          nullToEmptyString(lead.firstName), nullToEmptyString(lead.lastName), nullToEmptyString(lead.email),
          nullToEmptyString(lead.phone), nullToEmptyString(lead.address), nullToEmptyString(lead.city)));
      table.add(row);
    }
    return table;
  }

  public static List<String> header(boolean withBirthdate) {
    List<String> header = new ArrayList<>(COLUMNS_BEFORE_BIRTHDATE);
    if (withBirthdate) {
      header.add(BIRTHDATE_COLUMN);
    }
    header.addAll(COLUMNS_AFTER_BIRTHDATE);
    return header;
  }
}
