/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.service.logic;

import com.impactupgrade.donorsync.environment.EnvironmentConfig;
import com.impactupgrade.donorsync.model.ComparedField;
import com.impactupgrade.donorsync.model.DonorField;
import com.impactupgrade.donorsync.model.DonorRecord;
import com.impactupgrade.donorsync.model.DonorRegistry;
import com.impactupgrade.donorsync.model.FieldMapping;
import com.impactupgrade.donorsync.model.MasterRecord;
import com.impactupgrade.donorsync.model.ReconciliationOutcome;
import com.impactupgrade.donorsync.util.FieldNormalizer;
import com.impactupgrade.donorsync.util.LoggingUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sorts a deduplicated batch into new, updated, and unchanged donors by joining it to the registry on the composite
 * key. There is no fuzzy matching: a key the registry doesn't have is a new donor, period.
 */
public class ReconciliationService {

  private static final Logger log = LogManager.getLogger(ReconciliationService.class);

  private final FieldComparator fieldComparator;
  private final Set<ComparedField> strictFields;
  private final Set<ComparedField> looseFields;

  public ReconciliationService(FieldNormalizer fieldNormalizer, Set<ComparedField> strictFields,
      Set<ComparedField> looseFields) {
    this.fieldComparator = new FieldComparator(fieldNormalizer);
    this.strictFields = copy(strictFields);
    this.looseFields = copy(looseFields);
  }

  public ReconciliationService(FieldNormalizer fieldNormalizer, EnvironmentConfig.Reconciliation config) {
    this(fieldNormalizer, ComparedField.fromNames(config.strictFields), ComparedField.fromNames(config.looseFields));
  }

  public ReconciliationOutcome reconcile(List<DonorRecord> batch, DonorRegistry registry, FieldMapping mapping) {
    return reconcile(batch, registry, mapping.asMap().keySet());
  }

  /**
   * @param batchHasBirthdate whether the batch mapped a birthdate column. Every other field is treated as mapped.
   */
  public ReconciliationOutcome reconcile(List<DonorRecord> batch, DonorRegistry registry, boolean batchHasBirthdate) {
    Set<DonorField> mappedFields = EnumSet.allOf(DonorField.class);
    if (!batchHasBirthdate) {
      mappedFields.remove(DonorField.BIRTHDATE);
    }
    return reconcile(batch, registry, mappedFields);
  }

  /**
   * Only fields the batch mapped are compared. Birthdates additionally need the registry to carry them.
   */
  public ReconciliationOutcome reconcile(List<DonorRecord> batch, DonorRegistry registry,
      Set<DonorField> mappedFields) {
    ReconciliationOutcome outcome = new ReconciliationOutcome();
    outcome.setMappedFields(mappedFields);

    boolean compareBirthdate = mappedFields.contains(DonorField.BIRTHDATE) && registry.tracksBirthdate();
    outcome.setBirthdateCompared(compareBirthdate);
    Set<ComparedField> strict = comparable(strictFields, mappedFields, compareBirthdate);
    Set<ComparedField> loose = comparable(looseFields, mappedFields, compareBirthdate);
    Set<ComparedField> compared = EnumSet.noneOf(ComparedField.class);
    compared.addAll(strict);
    compared.addAll(loose);

    Map<String, MasterRecord> mastersByKey = indexByKey(registry);

    for (DonorRecord record : batch) {
      if (!record.isKeyable()) {
        outcome.addExcluded(record);
        continue;
      }

      MasterRecord master = mastersByKey.get(record.matchKey());
      if (master == null) {
        outcome.addNew(record);
        continue;
      }

      Set<ComparedField> changed = fieldComparator.changedFields(compared, record, master);
      boolean updated = !Collections.disjoint(changed, strict);
      boolean looseUpdated = !Collections.disjoint(changed, loose);
      if (updated) {
        LoggingUtil.verbose(log, "{} changed: {}", record.compositeKey(), changed);
      }
      outcome.addMatched(record, master, changed, updated, looseUpdated);
    }

    if (outcome.getExcludedCount() > 0) {
      log.warn("{} records had no donor number or facility and were excluded", outcome.getExcludedCount());
    }

    return outcome;
  }

  private static Map<String, MasterRecord> indexByKey(DonorRegistry registry) {
    Map<String, MasterRecord> mastersByKey = new LinkedHashMap<>();
    for (MasterRecord master : registry.getRecords()) {
      MasterRecord existing = mastersByKey.putIfAbsent(master.matchKey(), master);
      if (existing != null) {
        log.warn("registry has more than one row for {}; matching against the first", master.compositeKey());
      }
    }
    return mastersByKey;
  }

  static Set<ComparedField> comparable(Set<ComparedField> fields, Set<DonorField> mappedFields,
      boolean compareBirthdate) {
    Set<ComparedField> result = copy(fields);
    result.removeIf(field -> !field.isMappedBy(mappedFields));
    if (!compareBirthdate) {
      result.remove(ComparedField.BIRTHDATE);
    }
    return result;
  }

  private static Set<ComparedField> copy(Set<ComparedField> fields) {
    return fields.isEmpty() ? EnumSet.noneOf(ComparedField.class) : EnumSet.copyOf(fields);
  }
}
