/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.mapper;

import com.impactupgrade.donorsync.DonorTestUtil;
import com.impactupgrade.donorsync.environment.EnvironmentConfig;
import com.impactupgrade.donorsync.model.DonorField;
import com.impactupgrade.donorsync.model.FieldMapping;
import com.impactupgrade.donorsync.model.MappingSuggestion;
import com.impactupgrade.donorsync.model.MappingSuggestion.Confidence;
import com.impactupgrade.donorsync.model.RawRow;
import com.impactupgrade.donorsync.util.FieldNormalizer;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MappingSuggesterTest {

  private final EnvironmentConfig envConfig = EnvironmentConfig.init();
  private final MappingSuggester suggester = new MappingSuggester(envConfig.schema);

  @Test
  public void standardExport() {
    Map<DonorField, MappingSuggestion> suggestions = byField(suggester.suggest(DonorTestUtil.EXPORT_COLUMNS));

    assertSuggested(suggestions, DonorField.DONOR_NUMBER, "Donor #", Confidence.EXACT);
    assertSuggested(suggestions, DonorField.DONOR_NAME, "Donor Name", Confidence.EXACT);
    assertSuggested(suggestions, DonorField.FACILITY, "Facility", Confidence.EXACT);
    assertSuggested(suggestions, DonorField.DONOR_EMAIL, "Donor E-mail", Confidence.EXACT);
    // the tab in the header doesn't get in the way
    assertSuggested(suggestions, DonorField.LAST_DONATION_DATE, "Last \tDonation Date", Confidence.EXACT);
    // nothing looks like a birthdate, so the first column nobody claimed is offered
    assertSuggested(suggestions, DonorField.BIRTHDATE, "Yield (ml)", Confidence.DEFAULT);
    // pre-split names are never defaulted
    assertFalse(suggestions.containsKey(DonorField.DONOR_FIRST));
    assertFalse(suggestions.containsKey(DonorField.DONOR_LAST));
  }

  @Test
  public void exactBeatsSubstring() {
    Map<DonorField, MappingSuggestion> suggestions = byField(suggester.suggest(List.of("Center Phone", "Phone")));

    assertSuggested(suggestions, DonorField.DONOR_PHONE, "Phone", Confidence.EXACT);
    assertSuggested(suggestions, DonorField.FACILITY, "Center Phone", Confidence.SUBSTRING);
  }

  @Test
  public void exactMatchIsCaseInsensitive() {
    Map<DonorField, MappingSuggestion> suggestions = byField(suggester.suggest(List.of("DONOR #", "dob", "ZIP")));

    assertSuggested(suggestions, DonorField.DONOR_NUMBER, "DONOR #", Confidence.EXACT);
    assertSuggested(suggestions, DonorField.BIRTHDATE, "dob", Confidence.EXACT);
    assertSuggested(suggestions, DonorField.ZIP_CODE, "ZIP", Confidence.EXACT);
  }

  @Test
  public void substringAndDefault() {
    List<String> columns = List.of("DOB", "Email Address", "Zip");
    Map<DonorField, MappingSuggestion> suggestions = byField(suggester.suggest(columns));

    assertSuggested(suggestions, DonorField.DONOR_EMAIL, "Email Address", Confidence.SUBSTRING);
    // every column is taken, so defaults fall back to the first one
    assertSuggested(suggestions, DonorField.DONOR_NUMBER, "DOB", Confidence.DEFAULT);
  }

  @Test
  public void splitNames() {
    Map<DonorField, MappingSuggestion> suggestions = byField(
        suggester.suggest(List.of("Donor #", "First Name", "Last Name", "Center")));

    assertSuggested(suggestions, DonorField.DONOR_FIRST, "First Name", Confidence.EXACT);
    assertSuggested(suggestions, DonorField.DONOR_LAST, "Last Name", Confidence.EXACT);
    assertSuggested(suggestions, DonorField.FACILITY, "Center", Confidence.EXACT);
  }

  @Test
  public void noColumns() {
    assertTrue(suggester.suggest(List.of()).isEmpty());
  }

  @Test
  public void toFieldMapping() {
    FieldMapping mapping = MappingSuggester.toFieldMapping(suggester.suggest(DonorTestUtil.EXPORT_COLUMNS));

    assertEquals("Donor #", mapping.column(DonorField.DONOR_NUMBER));
    assertTrue(mapping.missingRequired().isEmpty());
  }

  @Test
  public void previewBirthdates() {
    FieldNormalizer normalizer = new FieldNormalizer(envConfig.normalization);
    List<RawRow> rows = List.of(
        RawRow.of("DOB", "03/15/1985"),
        RawRow.of("DOB", ""),
        RawRow.of("DOB", "03/15/1985"),
        RawRow.of("DOB", LocalDate.of(1990, 1, 2)),
        RawRow.of("DOB", "unknown"),
        RawRow.of("DOB", "1979-12-01"),
        RawRow.of("DOB", "31/01/1970"),
        RawRow.of("DOB", "01/01/2000")
    );

    Map<String, String> preview = MappingSuggester.previewBirthdates(rows, "DOB", normalizer, 5);

    assertEquals(5, preview.size());
    assertEquals(List.of("03/15/1985", "1990-01-02", "unknown", "1979-12-01", "31/01/1970"), List.copyOf(preview.keySet()));
    assertEquals("1985-03-15", preview.get("03/15/1985"));
    assertEquals("1990-01-02", preview.get("1990-01-02"));
    assertEquals("unknown", preview.get("unknown"));
    assertEquals("1970-01-31", preview.get("31/01/1970"));
  }

  private static Map<DonorField, MappingSuggestion> byField(List<MappingSuggestion> suggestions) {
    return suggestions.stream().collect(Collectors.toMap(s -> s.field, Function.identity()));
  }

  private static void assertSuggested(Map<DonorField, MappingSuggestion> suggestions, DonorField field, String column,
      Confidence confidence) {
    MappingSuggestion suggestion = suggestions.get(field);
    assertEquals(column, suggestion.column, field.getName());
    assertEquals(confidence, suggestion.confidence, field.getName());
  }
}
