/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.util;

import com.google.common.base.Strings;
import com.impactupgrade.donorsync.environment.EnvironmentConfig;
import com.impactupgrade.donorsync.model.NormalizationStats;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import static com.impactupgrade.donorsync.util.Utils.lowercase;
import static com.impactupgrade.donorsync.util.Utils.nullToEmptyString;
import static com.impactupgrade.donorsync.util.Utils.numericOnly;

/**
 * Turns raw cell values into their canonical form. None of these ever throw on bad data: an unparseable value falls
 * back to its original form (or empty) and, when a stats instance is given, is counted as a failure.
 */
public class FieldNormalizer {

  private final Set<String> invalidEmails;
  private final List<DateTimeFormatter> dateFormatters;

  public FieldNormalizer(Collection<String> invalidEmails, List<String> datePatterns) {
    this.invalidEmails = invalidEmails.stream().map(e -> e.trim().toLowerCase(Locale.ROOT))
        .collect(Collectors.toCollection(LinkedHashSet::new));
    this.dateFormatters = datePatterns.stream()
        .map(p -> DateTimeFormatter.ofPattern(p, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT))
        .collect(Collectors.toList());
  }

  public FieldNormalizer(EnvironmentConfig.Normalization config) {
    this(config.invalidEmails, config.datePatterns);
  }

  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
  // PHONE
  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

  public String formatPhone(String phone) {
    return formatPhone(phone, null);
  }

  /**
   * 10 digits get the US country code, then 11 digits become 1(AAA) BBB-CCCC. Anything else is returned untouched.
   */
  public String formatPhone(String phone, NormalizationStats stats) {
    if (phone == null) {
      return null;
    }

    String numbers = numericOnly(phone);
    if (numbers.length() == 10) {
      numbers = "1" + numbers;
    }
    if (numbers.length() != 11) {
      if (stats != null && !phone.isBlank()) {
        stats.recordFailure(NormalizationStats.PHONE);
      }
      return phone;
    }

    return "1(" + numbers.substring(1, 4) + ") " + numbers.substring(4, 7) + "-" + numbers.substring(7);
  }

  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
  // NAME
  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

  public String[] processName(String name) {
    return processName(name, null);
  }

  /**
   * The export gives "Last, First". Splits on the first comma only. Without a comma, the whole value is treated as the
   * first name. Returns {first, last}, never null.
   */
  public String[] processName(String name, NormalizationStats stats) {
    if (Strings.isNullOrEmpty(name)) {
      if (stats != null) {
        stats.recordFailure(NormalizationStats.NAME);
      }
      return new String[]{"", ""};
    }

    String[] parts = name.split(",", 2);
    String firstName;
    String lastName;
    if (parts.length == 2) {
      lastName = parts[0];
      firstName = parts[1];
    } else {
      firstName = parts[0];
      lastName = "";
    }

    return new String[]{nameToTitleCase(firstName), nameToTitleCase(lastName)};
  }

  // bill SMITH -> Bill Smith. Only the first letter of each word is upper.
  public static String nameToTitleCase(String name) {
    if (Strings.isNullOrEmpty(name)) {
      return "";
    }
    return Arrays.stream(name.trim().split("\\s+"))
        .filter(word -> !word.isEmpty())
        .map(word -> StringUtils.capitalize(word.toLowerCase(Locale.ROOT)))
        .collect(Collectors.joining(" "));
  }

  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
  // EMAIL
  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

  /**
   * Lowercased. Known placeholder addresses are treated as no email at all.
   */
  public String normalizeEmail(String email) {
    String lowercased = Utils.trim(lowercase(email));
    if (Strings.isNullOrEmpty(lowercased) || invalidEmails.contains(lowercased)) {
      return null;
    }
    return lowercased;
  }

  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
  // DATES
  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

  public String formatBirthdate(Object value) {
    return formatBirthdate(value, null);
  }

  /**
   * yyyy-MM-dd if the value is a date or parses as one, otherwise the original value as text.
   */
  public String formatBirthdate(Object value, NormalizationStats stats) {
    if (value == null || value.toString().isBlank()) {
      return null;
    }

    LocalDate date = parseDate(value);
    if (date == null) {
      if (stats != null) {
        stats.recordFailure(NormalizationStats.BIRTHDATE);
      }
      return value.toString().trim();
    }
    return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
  }

  /**
   * Values that already carry date semantics are used directly. Text is tried against the configured patterns in
   * order, first on the whole value and then on its leading token (exports often append a time). Null if nothing
   * parses.
   */
  public LocalDate parseDate(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof LocalDate) {
      return (LocalDate) value;
    }
    if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).toLocalDate();
    }
    if (value instanceof Date) {
      return ((Date) value).toInstant().atZone(ZoneId.systemDefault()).toLocalDate();
    }

    String s = value.toString().trim();
    if (s.isEmpty()) {
      return null;
    }

    List<String> candidates = new ArrayList<>();
    candidates.add(s);
    String leadingToken = s.split("[\\sT]", 2)[0];
    if (!leadingToken.equals(s)) {
      candidates.add(leadingToken);
    }

    for (String candidate : candidates) {
      for (DateTimeFormatter formatter : dateFormatters) {
        LocalDate date = tryParse(candidate, formatter);
        if (date != null) {
          return date;
        }
      }
    }
    return null;
  }

  private static LocalDate tryParse(String s, DateTimeFormatter formatter) {
    try {
      return LocalDate.parse(s, formatter);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
  // ADDRESS
  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

  public String combineAddress(String line1, String line2) {
    return (nullToEmptyString(line1) + " " + nullToEmptyString(line2)).trim();
  }
}
