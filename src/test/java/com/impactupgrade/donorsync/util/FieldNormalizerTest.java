/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.util;

import com.impactupgrade.donorsync.model.NormalizationStats;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static com.impactupgrade.donorsync.util.Utils.standardize;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class FieldNormalizerTest {

  private final FieldNormalizer normalizer = new FieldNormalizer(
      List.of("someone@plasmaworld.com", "na@na.com"),
      List.of("M/d/uuuu", "d/M/uuuu", "uuuu-M-d", "uuuu/M/d", "M-d-uuuu", "d-M-uuuu"));

  @Test
  public void formatPhone_tenAndElevenDigits() {
    assertEquals("1(555) 123-4567", normalizer.formatPhone("5551234567"));
    assertEquals("1(555) 123-4567", normalizer.formatPhone("(555) 123-4567"));
    assertEquals("1(555) 123-4567", normalizer.formatPhone("555.123.4567"));
    assertEquals("1(555) 123-4567", normalizer.formatPhone("15551234567"));
    assertEquals("1(555) 123-4567", normalizer.formatPhone("+1 555-123-4567"));
  }

  @Test
  public void formatPhone_otherDigitCountsUnchanged() {
    assertEquals("12345", normalizer.formatPhone("12345"));
    assertEquals("555-1234", normalizer.formatPhone("555-1234"));
    assertEquals("555-123-456789", normalizer.formatPhone("555-123-456789"));
    assertEquals("n/a", normalizer.formatPhone("n/a"));
    assertEquals("", normalizer.formatPhone(""));
    assertNull(normalizer.formatPhone(null));
  }

  @Test
  public void formatPhone_countsFailures() {
    NormalizationStats stats = new NormalizationStats();
    normalizer.formatPhone("5551234567", stats);
    normalizer.formatPhone("12345", stats);
    normalizer.formatPhone("", stats);
    normalizer.formatPhone(null, stats);

    assertEquals(1, stats.getFailures(NormalizationStats.PHONE));
  }

  @Test
  public void formatPhone_formattingDifferencesStandardizeEqual() {
    assertEquals(standardize(normalizer.formatPhone("(555) 123-4567")), standardize(normalizer.formatPhone("5551234567")));
    assertEquals(standardize("1(555) 123-4567"), standardize(normalizer.formatPhone("555-123-4567")));
  }

  @Test
  public void processName_lastCommaFirst() {
    assertArrayEquals(new String[]{"John", "Smith"}, normalizer.processName("Smith, john"));
    assertArrayEquals(new String[]{"Mary Ann", "Smith"}, normalizer.processName("SMITH,  MARY   ann"));
    assertArrayEquals(new String[]{"Juan, Jr", "De La Cruz"}, normalizer.processName("de la cruz, Juan, JR"));
  }

  @Test
  public void processName_noComma() {
    assertArrayEquals(new String[]{"Madonna", ""}, normalizer.processName("madonna"));
    assertArrayEquals(new String[]{"John Smith", ""}, normalizer.processName("JOHN smith"));
  }

  @Test
  public void processName_missing() {
    NormalizationStats stats = new NormalizationStats();
    assertArrayEquals(new String[]{"", ""}, normalizer.processName(null, stats));
    assertArrayEquals(new String[]{"", ""}, normalizer.processName("", stats));
    assertEquals(2, stats.getFailures(NormalizationStats.NAME));
  }

  @Test
  public void normalizeEmail_denylist() {
    assertNull(normalizer.normalizeEmail("someone@plasmaworld.com"));
    assertNull(normalizer.normalizeEmail("SomeOne@PlasmaWorld.COM"));
    assertNull(normalizer.normalizeEmail(" na@na.com "));
    // exact match only, never substring
    assertEquals("na@na.com.au", normalizer.normalizeEmail("NA@na.com.au"));
    assertEquals("bill@example.com", normalizer.normalizeEmail("Bill@Example.com"));
  }

  @Test
  public void normalizeEmail_empty() {
    assertNull(normalizer.normalizeEmail(null));
    assertNull(normalizer.normalizeEmail(""));
    assertNull(normalizer.normalizeEmail("   "));
  }

  @Test
  public void formatBirthdate_patternsInOrder() {
    assertEquals("1985-03-15", normalizer.formatBirthdate("03/15/1985"));
    assertEquals("1985-03-15", normalizer.formatBirthdate("3/15/1985"));
    // not a valid M/d, so d/M wins
    assertEquals("1985-03-15", normalizer.formatBirthdate("15/03/1985"));
    // ambiguous, M/d is tried first
    assertEquals("1990-01-02", normalizer.formatBirthdate("01/02/1990"));
    assertEquals("1985-03-05", normalizer.formatBirthdate("1985-3-5"));
    assertEquals("1985-03-15", normalizer.formatBirthdate("1985/03/15"));
    assertEquals("1985-03-15", normalizer.formatBirthdate("03-15-1985"));
    assertEquals("1985-03-15", normalizer.formatBirthdate("15-03-1985"));
  }

  @Test
  public void formatBirthdate_trailingTime() {
    assertEquals("1985-03-15", normalizer.formatBirthdate("1985-03-15 00:00:00"));
    assertEquals("1985-03-15", normalizer.formatBirthdate("1985-03-15T00:00:00"));
  }

  @Test
  public void formatBirthdate_dateValues() {
    assertEquals("1990-01-02", normalizer.formatBirthdate(LocalDate.of(1990, 1, 2)));
    assertEquals("1990-01-02", normalizer.formatBirthdate(LocalDateTime.of(1990, 1, 2, 13, 45)));
  }

  @Test
  public void formatBirthdate_unparseable() {
    NormalizationStats stats = new NormalizationStats();
    assertEquals("sometime in May", normalizer.formatBirthdate(" sometime in May ", stats));
    assertEquals("02/30/1990", normalizer.formatBirthdate("02/30/1990", stats));
    assertNull(normalizer.formatBirthdate(null, stats));
    assertNull(normalizer.formatBirthdate("", stats));
    assertEquals(2, stats.getFailures(NormalizationStats.BIRTHDATE));
  }

  @Test
  public void combineAddress() {
    assertEquals("12 Main St Apt 4", normalizer.combineAddress("12 Main St", "Apt 4"));
    assertEquals("12 Main St", normalizer.combineAddress("12 Main St", null));
    assertEquals("Apt 4", normalizer.combineAddress(null, "Apt 4"));
    assertEquals("", normalizer.combineAddress(null, null));
  }
}
