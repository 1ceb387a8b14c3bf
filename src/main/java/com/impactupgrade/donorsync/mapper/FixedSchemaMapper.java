/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.mapper;

import com.impactupgrade.donorsync.environment.EnvironmentConfig;
import com.impactupgrade.donorsync.model.DonorField;
import com.impactupgrade.donorsync.model.FieldMapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The standard export: every column of the contract must be present under its exact, agreed-upon name. Optional
 * canonical fields (ex: DOB) are mapped only if the file happens to carry them.
 */
public class FixedSchemaMapper implements SchemaMapper {

  private final Set<String> requiredColumns;
  private final Map<DonorField, String> fixedColumns;

  public FixedSchemaMapper(Collection<String> requiredColumns, Map<DonorField, String> fixedColumns) {
    this.requiredColumns = new LinkedHashSet<>(requiredColumns);
    this.fixedColumns = new EnumMap<>(DonorField.class);
    this.fixedColumns.putAll(fixedColumns);
  }

  public FixedSchemaMapper(EnvironmentConfig.Schema schema) {
    this(schema.requiredColumns, FieldMapping.fromNames(schema.fixedColumns).asMap());
  }

  @Override
  public FieldMapping resolve(List<String> rawColumns) throws SchemaValidationException {
    Set<String> present = new HashSet<>(rawColumns);

    List<String> missingColumns = requiredColumns.stream()
        .filter(c -> !present.contains(c))
        .collect(Collectors.toList());
    if (!missingColumns.isEmpty()) {
      throw new SchemaValidationException("Missing required columns", missingColumns);
    }

    FieldMapping mapping = new FieldMapping();
    fixedColumns.forEach((field, column) -> {
      if (present.contains(column)) {
        mapping.put(field, column);
      }
    });

    List<DonorField> missingFields = mapping.missingRequired();
    if (!missingFields.isEmpty()) {
      List<String> names = new ArrayList<>();
      missingFields.forEach(f -> names.add(f.getName() + " (" + fixedColumns.getOrDefault(f, "unconfigured") + ")"));
      throw new SchemaValidationException("Missing required fields", names);
    }

    return mapping;
  }
}
