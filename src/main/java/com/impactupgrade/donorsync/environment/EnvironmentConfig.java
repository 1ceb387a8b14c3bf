/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.environment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.google.common.base.Strings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Whenever possible, we focus on being configuration-driven using one JSON file.
 * See environment-default.json for the base layer! Then, a deployment can provide its own environment.json file
 * to overwrite specific values from the default. environment.json is assumed to be on the thread's classpath.
 */
public class EnvironmentConfig implements Serializable {

  private static final Logger log = LogManager.getLogger(EnvironmentConfig.class.getName());

  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
  // HIGH-LEVEL CONFIG
  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

  // NOTE: We use Set for collections of Strings. When the JSON files are merged together, this prevents duplicate values.

  // Required by every HTTP call, sent as the DonorSync-Api-Key header.
  public String apiKey = "";

  // Which DonorRegistryService holds the master registry and the audit log.
  public String registryPlatform = "";

  public Set<String> loggers = new LinkedHashSet<>();

  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
  // NORMALIZATION
  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

  public Normalization normalization = new Normalization();
  public static class Normalization implements Serializable {
    // Placeholder addresses the centers type in when a donor has no email. Exact match, after lowercasing.
    public Set<String> invalidEmails = new LinkedHashSet<>();
    // Tried in order, first parse wins. java.time patterns, so use uuuu for the year.
    public List<String> datePatterns = new ArrayList<>();
  }

  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
  // SCHEMA
  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

  public Schema schema = new Schema();
  public static class Schema implements Serializable {
    // The export's column contract in fixed-schema mode. Every one of these must be present.
    public Set<String> requiredColumns = new LinkedHashSet<>();
    // canonical field name -> exact column name, for fixed-schema mode
    public Map<String, String> fixedColumns = new LinkedHashMap<>();
    // canonical field name -> known column names, used to suggest a mapping for unfamiliar exports
    public Map<String, List<String>> synonyms = new LinkedHashMap<>();
  }

  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
  // RECONCILIATION
  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

  public Reconciliation reconciliation = new Reconciliation();
  public static class Reconciliation implements Serializable {
    public Set<String> strictFields = new LinkedHashSet<>();
    public Set<String> looseFields = new LinkedHashSet<>();
    // a change to one of these makes an updated donor a lead
    public Set<String> leadFields = new LinkedHashSet<>();
  }

  public Registry registry = new Registry();
  public static class Registry implements Serializable {
    // Layout to use when the registry is completely empty and has no header to go by.
    public boolean tracksBirthdate = false;
  }

  public Audit audit = new Audit();
  public static class Audit implements Serializable {
    // Manual-review flag columns the office works through by hand.
    public List<String> markerColumns = new ArrayList<>();
    public String markerValue = "";
  }

  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
  // PLATFORMS
  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

  public GoogleSheets googleSheets = new GoogleSheets();
  public static class GoogleSheets implements Serializable {
    public String projectId = "";
    public String privateKeyId = "";
    public String secretKey = "";
    public String clientEmail = "";
    public String clientId = "";
    public String authUri = "";
    public String tokenServerUrl = "";
    public String authProviderCertUrl = "";
    public String clientCertUrl = "";
    public String applicationName = "";

    public String spreadsheetId = "";
    // The registry is read from the combined view, but written to the DB tab.
    public String registrySourceSheet = "";
    public String registrySheet = "";
    public String auditSheet = "";
  }

  public CsvRegistry csvRegistry = new CsvRegistry();
  public static class CsvRegistry implements Serializable {
    public String directory = "";
    public String registryFile = "";
    public String auditFile = "";
  }

  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
  // INITIALIZATION
  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

  private static final String PROFILE = System.getenv("PROFILE");
  public String getProfile() {
    return PROFILE;
  }

  private static final boolean IS_PROD = "production".equalsIgnoreCase(PROFILE);
  private static final boolean IS_SANDBOX = "sandbox".equalsIgnoreCase(PROFILE);
  private static final String OTHER_JSON_FILENAME = System.getenv("OTHER_JSON_FILENAME");

  private static final ObjectMapper mapper = new ObjectMapper();
  static {
    // Allows nested objects, collections, etc. to be merged together.
    mapper.setDefaultMergeable(true);
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  public static EnvironmentConfig init() {
    try (
        InputStream jsonDefault = Thread.currentThread().getContextClassLoader()
            .getResourceAsStream("environment-default.json");
        InputStream jsonOrg = Thread.currentThread().getContextClassLoader()
            .getResourceAsStream("environment.json");
        InputStream jsonOrgSandbox = Thread.currentThread().getContextClassLoader()
            .getResourceAsStream("environment-sandbox.json");
        InputStream jsonOther = OTHER_JSON_FILENAME == null ? null : Thread.currentThread().getContextClassLoader().getResourceAsStream(OTHER_JSON_FILENAME)
    ) {
      // Start with the default JSON as the foundation.
      EnvironmentConfig envConfig = mapper.readValue(jsonDefault, EnvironmentConfig.class);

      if (IS_PROD && jsonOrg != null) {
        mapper.readerForUpdating(envConfig).readValue(jsonOrg);
      }

      if (IS_SANDBOX && jsonOrgSandbox != null) {
        mapper.readerForUpdating(envConfig).readValue(jsonOrgSandbox);
      }

      if (jsonOther != null) {
        log.debug("Including {} in the environment...", OTHER_JSON_FILENAME);
        mapper.readerForUpdating(envConfig).readValue(jsonOther);
      }

      return envConfig;
    } catch (IOException e) {
      log.error("Unable to read environment JSON files! Exiting...", e);
      System.exit(1);
      return null;
    }
  }

  // Allow additional env.json files to be added. This cannot be statically defined, due to usages such as tests
  // where each may need a unique setup.
  public void addOtherJsonFile(String otherJsonFilename) {
    if (!Strings.isNullOrEmpty(otherJsonFilename)) {
      try (InputStream otherJson = Thread.currentThread().getContextClassLoader()
          .getResourceAsStream(otherJsonFilename)) {
        if (otherJson != null) {
          mapper.readerForUpdating(this).readValue(otherJson);
        }
      } catch (IOException e) {
        log.error("unable to read {}", otherJsonFilename, e);
      }
    }
  }

  /**
   * Overlay JSON provided at runtime (ex: per-center overrides) on top of what we already have.
   */
  public void init(String jsonOverride) {
    try {
      mapper.readerForUpdating(this).readValue(jsonOverride);
    } catch (MismatchedInputException e) {
      // an empty body, nothing to overlay
      log.debug("empty environment JSON override");
    } catch (JsonProcessingException e) {
      log.error("Unable to read environment JSON! {}", jsonOverride, e);
    }
  }
}
