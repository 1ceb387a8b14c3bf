/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.controller;

import com.impactupgrade.donorsync.AbstractMockTest;
import com.impactupgrade.donorsync.DonorTestUtil;
import com.impactupgrade.donorsync.environment.Environment;
import com.impactupgrade.donorsync.environment.EnvironmentFactory;
import com.impactupgrade.donorsync.model.DonorRegistry;
import com.impactupgrade.donorsync.model.RawRow;
import com.impactupgrade.donorsync.security.SecurityUtil;
import com.impactupgrade.donorsync.util.Utils;
import org.glassfish.jersey.media.multipart.FormDataContentDisposition;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import javax.ws.rs.core.Response;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class DonorImportControllerTest extends AbstractMockTest {

  private DonorImportController controller(String apiKey) {
    EnvironmentFactory envFactory = new EnvironmentFactory() {
      @Override
      protected Environment newEnv() {
        Environment env = new DefaultEnvironment();
        env.addOtherContext(SecurityUtil.API_KEY_HEADER, apiKey);
        return env;
      }
    };
    return new DonorImportController(envFactory);
  }

  private static InputStream csv(List<String> columns, List<RawRow> rows) throws Exception {
    List<List<String>> table = new ArrayList<>();
    table.add(columns);
    for (RawRow row : rows) {
      List<String> values = new ArrayList<>();
      columns.forEach(c -> values.add(row.getString(c)));
      table.add(values);
    }
    return new ByteArrayInputStream(Utils.toCsv(table).getBytes(StandardCharsets.UTF_8));
  }

  private static InputStream standardExport() throws Exception {
    return csv(DonorTestUtil.EXPORT_COLUMNS, List.of(
        DonorTestUtil.exportRow("100", "Smith, John", "Center A", "(555) 123-4567", "john@example.com", "3/1/2024")));
  }

  private static FormDataContentDisposition file(String fileName) {
    return FormDataContentDisposition.name("file").fileName(fileName).build();
  }

  @Test
  public void rejectsABadApiKey() throws Exception {
    DonorImportController controller = controller("wrong");

    assertThrows(SecurityException.class,
        () -> controller.importDonors(standardExport(), file("batch.csv"), null, "jdoe", null));
    verifyNoInteractions(donorRegistryServiceMock);
  }

  @Test
  public void importsTheStandardExport() throws Exception {
    when(donorRegistryServiceMock.loadRegistry()).thenReturn(DonorRegistry.empty(false));

    Response response = controller(API_KEY).importDonors(standardExport(), file("batch.csv"), null, "jdoe", null);

    assertEquals(200, response.getStatus());
    JSONObject json = new JSONObject((String) response.getEntity());
    assertEquals(1, json.getInt("totalRows"));
    assertEquals(1, json.getInt("newDonors"));
    assertEquals(0, json.getInt("updatedRecords"));
    assertEquals("100", json.getJSONArray("newDonorNumbers").getString(0));
    assertEquals(1, json.getInt("leads"));
    assertTrue(json.getString("leadsCsv").contains("Donor Account #"));
    verify(donorRegistryServiceMock).saveRegistry(any());
    verify(donorRegistryServiceMock).appendAuditRows(any());
  }

  @Test
  public void rejectsOtherFileTypes() throws Exception {
    Response response = controller(API_KEY).importDonors(standardExport(), file("batch.txt"), null, "jdoe", null);

    assertEquals(400, response.getStatus());
    verifyNoInteractions(donorRegistryServiceMock);
  }

  @Test
  public void rejectsAnIncompleteExport() throws Exception {
    InputStream incomplete = csv(List.of("Donor #", "Donor Name"),
        List.of(RawRow.of("Donor #", "100", "Donor Name", "Smith, John")));

    Response response = controller(API_KEY).importDonors(incomplete, file("batch.csv"), null, "jdoe", null);

    assertEquals(400, response.getStatus());
    JSONObject json = new JSONObject((String) response.getEntity());
    assertTrue(json.getString("error").startsWith("Missing required columns"));
    assertTrue(json.getJSONArray("missing").toList().contains("Facility"));
    verifyNoInteractions(donorRegistryServiceMock);
  }

  @Test
  public void importsWithAConfirmedMapping() throws Exception {
    when(donorRegistryServiceMock.loadRegistry()).thenReturn(DonorRegistry.empty(false));
    InputStream custom = csv(List.of("ID", "Name", "Site"), List.of(
        RawRow.of("ID", "100", "Name", "Smith, John", "Site", "Center A"),
        RawRow.of("ID", "200", "Name", "Doe, Jane", "Site", "Center A")));
    String mapping = new JSONObject().put("donor_number", "ID").put("donor_name", "Name").put("facility", "Site")
        .toString();

    Response response = controller(API_KEY).importDonors(custom, file("batch.csv"), mapping, "jdoe", null);

    assertEquals(200, response.getStatus());
    assertEquals(2, new JSONObject((String) response.getEntity()).getInt("newDonors"));
  }

  @Test
  public void rejectsAnUnreadableMapping() throws Exception {
    Response response = controller(API_KEY).importDonors(standardExport(), file("batch.csv"), "{not json", "jdoe",
        null);

    assertEquals(400, response.getStatus());
  }

  @Test
  public void saveFailureStillReturnsTheLeads() throws Exception {
    when(donorRegistryServiceMock.loadRegistry()).thenReturn(DonorRegistry.empty(false));
    doThrow(new RuntimeException("quota exceeded")).when(donorRegistryServiceMock).saveRegistry(any());

    Response response = controller(API_KEY).importDonors(standardExport(), file("batch.csv"), null, "jdoe", null);

    assertEquals(500, response.getStatus());
    JSONObject json = new JSONObject((String) response.getEntity());
    assertEquals(1, json.getJSONObject("result").getInt("leads"));
  }

  @Test
  public void suggestsAMapping() throws Exception {
    InputStream custom = csv(List.of("Donor Number", "Full Name", "Center", "DOB"), List.of(
        RawRow.of("Donor Number", "100", "Full Name", "Smith, John", "Center", "Center A", "DOB", "03/15/1985"),
        RawRow.of("Donor Number", "200", "Full Name", "Doe, Jane", "Center", "Center A", "DOB", "03/15/1985")));

    Response response = controller(API_KEY).suggestMapping(custom, file("batch.csv"), null, null);

    assertEquals(200, response.getStatus());
    JSONObject json = new JSONObject((String) response.getEntity());
    assertEquals(4, json.getJSONArray("columns").length());
    assertEquals("DOB", json.getString("birthdateColumn"));

    JSONArray suggestions = json.getJSONArray("suggestions");
    JSONObject donorNumber = suggestions.getJSONObject(0);
    assertEquals("donor_number", donorNumber.getString("field"));
    assertEquals("Donor Number", donorNumber.getString("column"));
    assertEquals("EXACT", donorNumber.getString("confidence"));

    JSONArray preview = json.getJSONArray("birthdatePreview");
    assertEquals(1, preview.length());
    assertEquals("03/15/1985", preview.getJSONObject(0).getString("raw"));
    assertEquals("1985-03-15", preview.getJSONObject(0).getString("normalized"));
  }
}
