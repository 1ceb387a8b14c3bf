/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.logic;

import com.impactupgrade.donorsync.model.DonorRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Exports list every visit, so a regular donor shows up many times. Keeps one record per (donor number, facility).
 */
public class BatchDeduplicator {

  private static final Comparator<DonorRecord> MOST_RECENT_FIRST = Comparator.comparing(
      (DonorRecord r) -> r.lastDonationDate, Comparator.nullsLast(Comparator.reverseOrder()));

  /**
   * With recency ordering, records are stably sorted by last donation date, newest first (undated last), so the
   * most recent visit is the one kept. Without it, the first record seen per key wins.
   * <p>
   * Records that can't be keyed are passed through as-is; reconciliation reports them.
   */
  public List<DonorRecord> deduplicate(List<DonorRecord> records, boolean orderByLastDonation) {
    List<DonorRecord> ordered = new ArrayList<>(records);
    if (orderByLastDonation) {
      // List.sort is stable, so equal dates keep their file order
      ordered.sort(MOST_RECENT_FIRST);
    }

    Set<String> seenKeys = new HashSet<>();
    List<DonorRecord> deduplicated = new ArrayList<>();
    for (DonorRecord record : ordered) {
      if (!record.isKeyable() || seenKeys.add(record.matchKey())) {
        deduplicated.add(record);
      }
    }
    return deduplicated;
  }
}
