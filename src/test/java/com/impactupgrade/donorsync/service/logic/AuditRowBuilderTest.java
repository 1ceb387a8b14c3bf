/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.logic;

import com.impactupgrade.donorsync.environment.EnvironmentConfig;
import com.impactupgrade.donorsync.model.DonorRecord;
import com.impactupgrade.donorsync.model.DonorRegistry;
import com.impactupgrade.donorsync.model.ReconciliationOutcome;
import com.impactupgrade.donorsync.util.FieldNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.impactupgrade.donorsync.DonorTestUtil.donor;
import static com.impactupgrade.donorsync.DonorTestUtil.master;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AuditRowBuilderTest {

  private static final String PHONE = "1(555) 123-4567";
  private static final String EMAIL = "john@example.com";

  private final EnvironmentConfig envConfig = EnvironmentConfig.init();
  private final ReconciliationService reconciliationService = new ReconciliationService(
      new FieldNormalizer(envConfig.normalization), envConfig.reconciliation);
  private final AuditRowBuilder auditRowBuilder = new AuditRowBuilder(envConfig.audit);

  @Test
  public void newThenUpdatedWithMarkers() {
    DonorRegistry registry = new DonorRegistry(List.of(
        master("200", "Center A", PHONE, EMAIL),
        master("300", "Center A", PHONE, EMAIL)
    ), false);
    DonorRecord updated = donor("200", "Center A", "1(555) 999-0000", EMAIL);
    DonorRecord unchanged = donor("300", "Center A", PHONE, EMAIL);
    DonorRecord added = donor("100", "Center B", PHONE, EMAIL);
    added.birthdate = "1985-03-15";

    ReconciliationOutcome outcome = reconciliationService.reconcile(List.of(updated, unchanged, added), registry,
        false);
    List<List<String>> rows = auditRowBuilder.build(outcome);

    assertEquals(2, rows.size());
    assertEquals(List.of("100", "John", "Smith", EMAIL, "A100", PHONE, "12 Main St", "62701", "Active", "Center B",
        "x", "x", "x", "x", "1985-03-15"), rows.get(0));
    assertEquals("200", rows.get(1).get(0));
    assertEquals(15, rows.get(1).size());
    assertEquals("", rows.get(1).get(14));
  }

  @Test
  public void nothingToAudit() {
    DonorRegistry registry = new DonorRegistry(List.of(master("300", "Center A", PHONE, EMAIL)), false);
    ReconciliationOutcome outcome = reconciliationService.reconcile(
        List.of(donor("300", "Center A", PHONE, EMAIL)), registry, false);

    assertTrue(auditRowBuilder.build(outcome).isEmpty());
  }

  @Test
  public void header() {
    List<String> header = AuditRowBuilder.header(envConfig.audit);

    assertEquals(15, header.size());
    assertEquals("Center", header.get(9));
    assertEquals(List.of("K", "L", "M", "N", "Birthday"), header.subList(10, 15));
  }
}
