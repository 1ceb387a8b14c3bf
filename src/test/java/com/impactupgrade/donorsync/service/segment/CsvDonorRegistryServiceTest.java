/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.segment;

import com.impactupgrade.donorsync.environment.Environment;
import com.impactupgrade.donorsync.model.DonorRegistry;
import com.impactupgrade.donorsync.model.MasterRecord;
import com.impactupgrade.donorsync.util.Utils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.impactupgrade.donorsync.DonorTestUtil.master;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CsvDonorRegistryServiceTest {

  @TempDir
  Path dataDir;

  private DonorRegistryService donorRegistryService;

  @BeforeEach
  public void setup() {
    Environment env = new Environment();
    env.getConfig().registryPlatform = "csv";
    env.getConfig().csvRegistry.directory = dataDir.toString();
    donorRegistryService = env.donorRegistryService();
  }

  @Test
  public void loadedThroughTheServiceLoader() {
    assertTrue(donorRegistryService instanceof CsvDonorRegistryService);
  }

  @Test
  public void missingRegistryIsEmpty() throws Exception {
    DonorRegistry registry = donorRegistryService.loadRegistry();

    assertEquals(0, registry.size());
    assertFalse(registry.tracksBirthdate());
  }

  @Test
  public void saveAndReload() throws Exception {
    MasterRecord withBirthdate = master("100", "Center A", "1(555) 123-4567", "john@example.com");
    withBirthdate.birthdate = "1985-03-15";
    // commas and quotes have to survive the round trip
    MasterRecord tricky = master("200", "Center B", "", "");
    tricky.address = "12 Main St, Apt \"B\"";
    tricky.birthdate = "";
    DonorRegistry registry = new DonorRegistry(List.of(withBirthdate, tricky), true);

    donorRegistryService.saveRegistry(registry);
    DonorRegistry reloaded = donorRegistryService.loadRegistry();

    assertTrue(reloaded.tracksBirthdate());
    assertEquals(registry.getRecords(), reloaded.getRecords());
    // nothing left behind but the registry itself
    try (Stream<Path> files = Files.list(dataDir)) {
      assertEquals(List.of("registry.csv"),
          files.map(p -> p.getFileName().toString()).collect(Collectors.toList()));
    }
  }

  @Test
  public void saveReplacesTheWholeRegistry() throws Exception {
    donorRegistryService.saveRegistry(new DonorRegistry(List.of(
        master("100", "Center A", "", ""),
        master("200", "Center A", "", "")
    ), false));
    donorRegistryService.saveRegistry(new DonorRegistry(List.of(master("300", "Center A", "", "")), false));

    DonorRegistry reloaded = donorRegistryService.loadRegistry();

    assertEquals(1, reloaded.size());
    assertEquals("300", reloaded.getRecords().get(0).donorNumber);
  }

  @Test
  public void auditIsAppendOnly() throws Exception {
    List<String> row1 = List.of("100", "John", "Smith", "", "A100", "", "", "", "", "Center A", "x", "x", "x", "x", "");
    List<String> row2 = List.of("200", "Jane", "Doe", "", "A200", "", "", "", "", "Center A", "x", "x", "x", "x", "");

    donorRegistryService.appendAuditRows(List.of(row1));
    donorRegistryService.appendAuditRows(List.of(row2));

    List<List<String>> audit;
    try (Reader reader = Files.newBufferedReader(dataDir.resolve("audit.csv"), StandardCharsets.UTF_8)) {
      audit = Utils.getCsvTable(reader);
    }
    assertEquals(3, audit.size());
    assertEquals("Donor #", audit.get(0).get(0));
    assertEquals("Birthday", audit.get(0).get(14));
    assertEquals(row1, audit.get(1));
    assertEquals(row2, audit.get(2));
  }

  @Test
  public void nothingToAudit() throws Exception {
    donorRegistryService.appendAuditRows(List.of());

    assertFalse(Files.exists(dataDir.resolve("audit.csv")));
  }
}
