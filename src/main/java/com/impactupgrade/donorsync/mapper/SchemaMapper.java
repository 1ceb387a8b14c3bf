/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.mapper;

import com.impactupgrade.donorsync.model.FieldMapping;

import java.util.List;

/**
 * Decides which of a batch's columns feeds each canonical field. Implementations fail fast, before a single row is
 * normalized, if the batch cannot be processed.
 */
public interface SchemaMapper {

  FieldMapping resolve(List<String> rawColumns) throws SchemaValidationException;
}
