/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.client;

import com.google.api.client.googleapis.auth.oauth2.GoogleCredential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.sheets.v4.Sheets;
import com.google.api.services.sheets.v4.SheetsScopes;
import com.google.api.services.sheets.v4.model.ClearValuesRequest;
import com.google.api.services.sheets.v4.model.ValueRange;
import com.impactupgrade.donorsync.environment.EnvironmentConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.List;

public class GoogleSheetsClient {

  private static final Logger log = LogManager.getLogger(GoogleSheetsClient.class);

  private final Sheets sheets;

  public GoogleSheetsClient(EnvironmentConfig.GoogleSheets googleSheetsConfig) throws GeneralSecurityException, IOException {
    // Build service account credential
    // Configuration parameters represent Google's JSON file with the credential information
    JSONObject jsonObject = new JSONObject();
    jsonObject.put("type", "service_account");
    jsonObject.put("project_id", googleSheetsConfig.projectId);
    jsonObject.put("private_key_id", googleSheetsConfig.privateKeyId);
    jsonObject.put("private_key", googleSheetsConfig.secretKey);
    jsonObject.put("client_email", googleSheetsConfig.clientEmail);
    jsonObject.put("client_id", googleSheetsConfig.clientId);
    jsonObject.put("auth_uri", googleSheetsConfig.authUri);
    jsonObject.put("token_uri", googleSheetsConfig.tokenServerUrl);
    jsonObject.put("auth_provider_x509_cert_url", googleSheetsConfig.authProviderCertUrl);
    jsonObject.put("client_x509_cert_url", googleSheetsConfig.clientCertUrl);
    jsonObject.put("universe_domain", "googleapis.com");

    // A service account, so nobody is redirected to a login screen. The spreadsheet must be shared with its email.
    GoogleCredential googleCredentials = GoogleCredential
        .fromStream(new ByteArrayInputStream(jsonObject.toString().getBytes(StandardCharsets.UTF_8)))
        .createScoped(List.of(SheetsScopes.SPREADSHEETS));

    sheets = new Sheets.Builder(
        GoogleNetHttpTransport.newTrustedTransport(),
        GsonFactory.getDefaultInstance(), googleCredentials)
        .setApplicationName(googleSheetsConfig.applicationName)
        .build();
  }

  /**
   * A range covering a whole tab. Names are quoted, as tab names can contain spaces.
   */
  public static String sheetRange(String sheetName) {
    return "'" + sheetName.replace("'", "''") + "'";
  }

  public List<List<Object>> getValues(String spreadsheetId, String range) throws IOException {
    ValueRange valueRange = sheets.spreadsheets().values().get(spreadsheetId, range).execute();
    List<List<Object>> values = valueRange.getValues();
    log.info("read {} rows from {}", values == null ? 0 : values.size(), range);
    return values == null ? List.of() : values;
  }

  public void clear(String spreadsheetId, String range) throws IOException {
    sheets.spreadsheets().values()
        .clear(spreadsheetId, range, new ClearValuesRequest())
        .execute();
  }

  public void update(String spreadsheetId, String range, List<List<Object>> rows) throws IOException {
    ValueRange valueRange = new ValueRange().setValues(rows);
    sheets.spreadsheets().values()
        // writing the whole table starting from the 1st cell
        .update(spreadsheetId, range, valueRange)
        .setValueInputOption("RAW")
        .execute();
    log.info("wrote {} rows to {}", rows.size(), range);
  }

  public void append(String spreadsheetId, String range, List<List<Object>> rows) throws IOException {
    ValueRange valueRange = new ValueRange().setValues(rows);
    sheets.spreadsheets().values()
        // new rows go after the last row with data, never over it
        .append(spreadsheetId, range, valueRange)
        .setValueInputOption("RAW")
        .setInsertDataOption("INSERT_ROWS")
        .execute();
    log.info("appended {} rows to {}", rows.size(), range);
  }
}
