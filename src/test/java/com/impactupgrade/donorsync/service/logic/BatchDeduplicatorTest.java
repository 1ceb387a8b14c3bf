/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.logic;

import com.impactupgrade.donorsync.model.DonorRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.impactupgrade.donorsync.DonorTestUtil.donor;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

public class BatchDeduplicatorTest {

  private final BatchDeduplicator deduplicator = new BatchDeduplicator();

  @Test
  public void mostRecentDonationWins() {
    DonorRecord january = donor("100", "Center A", LocalDate.of(2024, 1, 1));
    DonorRecord march = donor("100", "Center A", LocalDate.of(2024, 3, 1));

    List<DonorRecord> deduplicated = deduplicator.deduplicate(List.of(january, march), true);

    assertEquals(1, deduplicated.size());
    assertSame(march, deduplicated.get(0));
  }

  @Test
  public void undatedSortsLast() {
    DonorRecord undated = donor("100", "Center A", null);
    DonorRecord dated = donor("100", "Center A", LocalDate.of(2023, 6, 1));

    List<DonorRecord> deduplicated = deduplicator.deduplicate(List.of(undated, dated), true);

    assertEquals(List.of(dated), deduplicated);
  }

  @Test
  public void sameDateKeepsFileOrder() {
    DonorRecord first = donor("100", "Center A", LocalDate.of(2024, 3, 1));
    first.phone = "1(555) 000-0001";
    DonorRecord second = donor("100", "Center A", LocalDate.of(2024, 3, 1));
    second.phone = "1(555) 000-0002";

    List<DonorRecord> deduplicated = deduplicator.deduplicate(List.of(first, second), true);

    assertEquals(1, deduplicated.size());
    assertSame(first, deduplicated.get(0));
  }

  @Test
  public void withoutDatesFirstSeenWins() {
    DonorRecord older = donor("100", "Center A", LocalDate.of(2024, 1, 1));
    DonorRecord newer = donor("100", "Center A", LocalDate.of(2024, 3, 1));

    List<DonorRecord> deduplicated = deduplicator.deduplicate(List.of(older, newer), false);

    assertEquals(1, deduplicated.size());
    assertSame(older, deduplicated.get(0));
  }

  @Test
  public void facilityIsPartOfTheKey() {
    DonorRecord centerA = donor("100", "Center A", LocalDate.of(2024, 1, 1));
    DonorRecord centerB = donor("100", "Center B", LocalDate.of(2024, 3, 1));

    List<DonorRecord> deduplicated = deduplicator.deduplicate(List.of(centerA, centerB), true);

    assertEquals(List.of(centerB, centerA), deduplicated);
  }

  @Test
  public void unkeyableRecordsPassThrough() {
    DonorRecord noFacility1 = donor("100", null, LocalDate.of(2024, 1, 1));
    DonorRecord noFacility2 = donor("100", null, LocalDate.of(2024, 1, 1));
    DonorRecord noNumber = donor(null, "Center A", LocalDate.of(2024, 1, 1));

    List<DonorRecord> deduplicated = deduplicator.deduplicate(List.of(noFacility1, noFacility2, noNumber), true);

    assertEquals(3, deduplicated.size());
  }
}
