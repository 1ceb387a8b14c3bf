/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.model;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The result of reconciling one batch against a registry snapshot. Records keep their original, pre-standardization
 * values. Everything is keyed by the records' match keys internally.
 */
public class ReconciliationOutcome {

  private final List<DonorRecord> newRecords = new ArrayList<>();
  // authoritative: drives the merge and the leads
  private final List<DonorRecord> updatedRecords = new ArrayList<>();
  // informational; same predicate as updated unless the loose field set is configured differently
  private final List<DonorRecord> looseUpdatedRecords = new ArrayList<>();
  private final List<DonorRecord> unchangedRecords = new ArrayList<>();
  private final Map<String, Set<ComparedField>> changeMasks = new LinkedHashMap<>();
  private final Map<String, MasterRecord> matchedMasters = new LinkedHashMap<>();
  private final List<DonorRecord> excludedRecords = new ArrayList<>();
  private boolean birthdateCompared;
  private Set<DonorField> mappedFields = EnumSet.allOf(DonorField.class);

  public void addNew(DonorRecord record) {
    newRecords.add(record);
  }

  public void addMatched(DonorRecord record, MasterRecord master, Set<ComparedField> changedFields,
      boolean updated, boolean looseUpdated) {
    matchedMasters.put(record.matchKey(), master);
    changeMasks.put(record.matchKey(), changedFields.isEmpty()
        ? EnumSet.noneOf(ComparedField.class) : EnumSet.copyOf(changedFields));
    if (updated) {
      updatedRecords.add(record);
    } else {
      unchangedRecords.add(record);
    }
    if (looseUpdated) {
      looseUpdatedRecords.add(record);
    }
  }

  public void addExcluded(DonorRecord record) {
    excludedRecords.add(record);
  }

  public void setBirthdateCompared(boolean birthdateCompared) {
    this.birthdateCompared = birthdateCompared;
  }

  public void setMappedFields(Set<DonorField> mappedFields) {
    this.mappedFields = mappedFields.isEmpty() ? EnumSet.noneOf(DonorField.class) : EnumSet.copyOf(mappedFields);
  }

  public List<DonorRecord> getNewRecords() {
    return Collections.unmodifiableList(newRecords);
  }

  public List<DonorRecord> getUpdatedRecords() {
    return Collections.unmodifiableList(updatedRecords);
  }

  public List<DonorRecord> getLooseUpdatedRecords() {
    return Collections.unmodifiableList(looseUpdatedRecords);
  }

  public List<DonorRecord> getUnchangedRecords() {
    return Collections.unmodifiableList(unchangedRecords);
  }

  public List<DonorRecord> getExcludedRecords() {
    return Collections.unmodifiableList(excludedRecords);
  }

  public int getExcludedCount() {
    return excludedRecords.size();
  }

  public boolean isBirthdateCompared() {
    return birthdateCompared;
  }

  /**
   * The canonical fields the batch carried. Anything else was never read, so it says nothing about the donor.
   */
  public Set<DonorField> getMappedFields() {
    return Collections.unmodifiableSet(mappedFields);
  }

  public boolean isMapped(DonorField field) {
    return mappedFields.contains(field);
  }

  /**
   * New records first, then updated records, each in batch order.
   */
  public List<DonorRecord> getNewAndUpdatedRecords() {
    List<DonorRecord> records = new ArrayList<>(newRecords);
    records.addAll(updatedRecords);
    return records;
  }

  public Set<ComparedField> getChangedFields(String matchKey) {
    Set<ComparedField> changed = changeMasks.get(matchKey);
    return changed == null ? EnumSet.noneOf(ComparedField.class) : Collections.unmodifiableSet(changed);
  }

  public MasterRecord getMatchedMaster(String matchKey) {
    return matchedMasters.get(matchKey);
  }

  /**
   * Updated records grouped by donor number (in batch order), for lookups. The same donor number at two facilities yields two entries,
   * each matched independently.
   */
  public ListMultimap<String, DonorRecord> getUpdatedByDonorNumber() {
    ListMultimap<String, DonorRecord> byDonorNumber = MultimapBuilder.linkedHashKeys().arrayListValues().build();
    updatedRecords.forEach(r -> byDonorNumber.put(r.donorNumber, r));
    return byDonorNumber;
  }

  public ListMultimap<String, DonorRecord> getNewByDonorNumber() {
    ListMultimap<String, DonorRecord> byDonorNumber = MultimapBuilder.linkedHashKeys().arrayListValues().build();
    newRecords.forEach(r -> byDonorNumber.put(r.donorNumber, r));
    return byDonorNumber;
  }
}
