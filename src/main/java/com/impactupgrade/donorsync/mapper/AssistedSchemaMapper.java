/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.mapper;

import com.impactupgrade.donorsync.model.DonorField;
import com.impactupgrade.donorsync.model.FieldMapping;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Uses a mapping the operator confirmed (usually starting from {@link MappingSuggester}'s proposal). The mapping is
 * trusted as-is, but it still has to point at columns the batch really has and cover the required fields.
 */
public class AssistedSchemaMapper implements SchemaMapper {

  private final FieldMapping confirmedMapping;

  public AssistedSchemaMapper(FieldMapping confirmedMapping) {
    this.confirmedMapping = confirmedMapping;
  }

  @Override
  public FieldMapping resolve(List<String> rawColumns) throws SchemaValidationException {
    Set<String> present = new HashSet<>(rawColumns);

    List<String> unknownColumns = confirmedMapping.asMap().entrySet().stream()
        .filter(e -> !present.contains(e.getValue()))
        .map(e -> e.getKey().getName() + " (" + e.getValue() + ")")
        .collect(Collectors.toList());
    if (!unknownColumns.isEmpty()) {
      throw new SchemaValidationException("Mapped columns not found in the file", unknownColumns);
    }

    List<DonorField> missingFields = confirmedMapping.missingRequired();
    if (!missingFields.isEmpty()) {
      throw new SchemaValidationException("Missing required fields",
          missingFields.stream().map(DonorField::getName).collect(Collectors.toList()));
    }

    return new FieldMapping(confirmedMapping.asMap());
  }
}
