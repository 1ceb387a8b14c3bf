/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.mapper;

import com.impactupgrade.donorsync.environment.EnvironmentConfig;
import com.impactupgrade.donorsync.model.DonorField;
import com.impactupgrade.donorsync.model.FieldMapping;
import com.impactupgrade.donorsync.model.MappingSuggestion;
import com.impactupgrade.donorsync.model.MappingSuggestion.Confidence;
import com.impactupgrade.donorsync.model.RawRow;
import com.impactupgrade.donorsync.util.FieldNormalizer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.impactupgrade.donorsync.util.Utils.collapseWhitespace;

/**
 * Proposes a mapping for an unfamiliar export, purely from its column names. Exact synonym matches are resolved for
 * every field before any substring match is considered, so a column that is exactly some field's name can never be
 * taken by a coincidental substring of another field's synonym.
 */
public class MappingSuggester {

  private final Map<DonorField, List<String>> synonyms = new EnumMap<>(DonorField.class);

  public MappingSuggester(Map<DonorField, List<String>> synonyms) {
    synonyms.forEach((field, names) -> this.synonyms.put(field, names.stream().map(MappingSuggester::comparable).toList()));
  }

  public MappingSuggester(EnvironmentConfig.Schema schema) {
    this(toFieldSynonyms(schema.synonyms));
  }

  public List<MappingSuggestion> suggest(List<String> columns) {
    Map<DonorField, MappingSuggestion> suggestions = new EnumMap<>(DonorField.class);
    Set<String> claimed = new HashSet<>();

    // exact
    for (DonorField field : DonorField.values()) {
      String column = findExact(field, columns);
      if (column != null) {
        suggestions.put(field, new MappingSuggestion(field, column, Confidence.EXACT));
        claimed.add(column);
      }
    }

    // substring, only among columns no exact match took
    for (DonorField field : DonorField.values()) {
      if (suggestions.containsKey(field)) continue;
      String column = findSubstring(field, columns, claimed);
      if (column != null) {
        suggestions.put(field, new MappingSuggestion(field, column, Confidence.SUBSTRING));
        claimed.add(column);
      }
    }

    // low-confidence default, for the operator to correct
    if (!columns.isEmpty()) {
      for (DonorField field : DonorField.BASE_FIELDS) {
        if (suggestions.containsKey(field)) continue;
        String column = columns.stream().filter(c -> !claimed.contains(c)).findFirst().orElse(columns.get(0));
        suggestions.put(field, new MappingSuggestion(field, column, Confidence.DEFAULT));
        claimed.add(column);
      }
    }

    return new ArrayList<>(suggestions.values());
  }

  public static FieldMapping toFieldMapping(List<MappingSuggestion> suggestions) {
    FieldMapping mapping = new FieldMapping();
    suggestions.forEach(s -> mapping.put(s.field, s.column));
    return mapping;
  }

  /**
   * Birthdates are the one field whose format varies enough between centers that the operator confirms it by eye.
   * Returns up to {@code limit} distinct non-empty values of the column, each with its normalized form.
   */
  public static Map<String, String> previewBirthdates(List<RawRow> rows, String column, FieldNormalizer normalizer,
      int limit) {
    Map<String, String> preview = new LinkedHashMap<>();
    for (RawRow row : rows) {
      if (preview.size() >= limit) break;
      String raw = row.getString(column);
      if (raw != null && !preview.containsKey(raw)) {
        preview.put(raw, normalizer.formatBirthdate(row.get(column)));
      }
    }
    return preview;
  }

  private String findExact(DonorField field, List<String> columns) {
    for (String synonym : synonyms.getOrDefault(field, List.of())) {
      for (String column : columns) {
        if (comparable(column).equals(synonym)) {
          return column;
        }
      }
    }
    return null;
  }

  private String findSubstring(DonorField field, List<String> columns, Set<String> claimed) {
    for (String synonym : synonyms.getOrDefault(field, List.of())) {
      for (String column : columns) {
        if (!claimed.contains(column) && comparable(column).contains(synonym)) {
          return column;
        }
      }
    }
    return null;
  }

  // case-insensitive, and tolerant of the stray tabs/double spaces some exports put in headers
  private static String comparable(String s) {
    return collapseWhitespace(s).toLowerCase(Locale.ROOT);
  }

  private static Map<DonorField, List<String>> toFieldSynonyms(Map<String, List<String>> synonymsByName) {
    Map<DonorField, List<String>> fieldSynonyms = new EnumMap<>(DonorField.class);
    synonymsByName.forEach((name, names) -> {
      DonorField field = DonorField.fromName(name);
      if (field != null) {
        fieldSynonyms.put(field, names);
      }
    });
    return fieldSynonyms;
  }
}
