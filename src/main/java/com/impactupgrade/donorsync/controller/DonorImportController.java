/*
 * Copyright (c) 2024 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.impactupgrade.donorsync.environment.Environment;
import com.impactupgrade.donorsync.environment.EnvironmentFactory;
import com.impactupgrade.donorsync.mapper.MappingSuggester;
import com.impactupgrade.donorsync.mapper.SchemaMapper;
import com.impactupgrade.donorsync.mapper.SchemaValidationException;
import com.impactupgrade.donorsync.model.DonorField;
import com.impactupgrade.donorsync.model.DonorImportResult;
import com.impactupgrade.donorsync.model.FieldMapping;
import com.impactupgrade.donorsync.model.JobStatus;
import com.impactupgrade.donorsync.model.JobType;
import com.impactupgrade.donorsync.model.MappingSuggestion;
import com.impactupgrade.donorsync.model.RawRow;
import com.impactupgrade.donorsync.model.ReconciliationOutcome;
import com.impactupgrade.donorsync.security.SecurityUtil;
import com.impactupgrade.donorsync.service.logic.DonorImportException;
import com.impactupgrade.donorsync.util.Utils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.glassfish.jersey.media.multipart.FormDataContentDisposition;
import org.glassfish.jersey.media.multipart.FormDataParam;
import org.json.JSONArray;
import org.json.JSONObject;

import javax.servlet.http.HttpServletRequest;
import javax.ws.rs.Consumes;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.core.Context;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

@Path("/donors")
public class DonorImportController {

  private static final Logger log = LogManager.getLogger(DonorImportController.class);

  private static final int BIRTHDATE_PREVIEW_SIZE = 5;
  private static final ObjectMapper MAPPER = new ObjectMapper();

  // Every import rewrites the whole registry from the snapshot it started with, so only one may run at a time.
  private static final ReentrantLock IMPORT_LOCK = new ReentrantLock();

  protected final EnvironmentFactory envFactory;

  public DonorImportController(EnvironmentFactory envFactory) {
    this.envFactory = envFactory;
  }

  /**
   * Reconciles an uploaded export against the registry, saves the result, and returns the run summary along with the
   * leads as CSV. Without a mapping, the file must follow the standard export's columns exactly.
   */
  @Path("/import")
  @POST
  @Consumes(MediaType.MULTIPART_FORM_DATA)
  @Produces(MediaType.APPLICATION_JSON)
  public Response importDonors(
      @FormDataParam("file") InputStream inputStream,
      @FormDataParam("file") FormDataContentDisposition fileDisposition,
      @FormDataParam("mapping") String mappingJson,
      @FormDataParam("username") String username,
      @Context HttpServletRequest request
  ) throws Exception {
    Environment env = envFactory.init(request);
    SecurityUtil.verifyApiKey(env);

    if (!IMPORT_LOCK.tryLock()) {
      env.logJobWarn("an import is already running; rejecting this one");
      return error(Response.Status.CONFLICT, "Another import is already running. Please try again once it finishes.");
    }

    String jobName = "Donor Import";
    env.startJobLog(JobType.PORTAL_TASK, username, jobName, "Donor Sync Portal");

    try {
      List<RawRow> rows = toRawRows(inputStream, fileDisposition);
      if (rows == null) {
        env.endJobLog(JobStatus.FAILED);
        return error(Response.Status.BAD_REQUEST, "Please upload an Excel (.xlsx) or CSV file.");
      }

      SchemaMapper schemaMapper;
      if (Strings.isNullOrEmpty(mappingJson)) {
        schemaMapper = env.fixedSchemaMapper();
      } else {
        schemaMapper = env.assistedSchemaMapper(FieldMapping.fromNames(parseMapping(mappingJson)));
      }

      DonorImportResult result = env.donorImportService().importBatch(rows, schemaMapper);
      env.endJobLog(JobStatus.DONE);
      return Response.status(200).entity(toJson(result).toString()).build();
    } catch (JsonProcessingException e) {
      env.logJobWarn("unreadable mapping: {}", mappingJson);
      env.endJobLog(JobStatus.FAILED);
      return error(Response.Status.BAD_REQUEST, "The column mapping could not be read.");
    } catch (SchemaValidationException e) {
      env.logJobWarn("rejected the file: {}", e.getMessage());
      env.endJobLog(JobStatus.FAILED);
      JSONObject jsonObj = new JSONObject()
          .put("error", e.getMessage())
          .put("missing", new JSONArray(e.getMissing()));
      return Response.status(Response.Status.BAD_REQUEST).entity(jsonObj.toString()).build();
    } catch (DonorImportException e) {
      env.logJobError("donor import failed", e);
      env.endJobLog(JobStatus.FAILED);
      JSONObject jsonObj = new JSONObject().put("error", e.getMessage());
      if (e.getResult() != null) {
        // computed but not (fully) saved; give the operator the leads regardless
        jsonObj.put("result", toJson(e.getResult()));
      }
      return Response.status(Response.Status.INTERNAL_SERVER_ERROR).entity(jsonObj.toString()).build();
    } catch (Exception e) {
      env.logJobError("donor import failed", e);
      env.endJobLog(JobStatus.FAILED);
      throw e;
    } finally {
      IMPORT_LOCK.unlock();
    }
  }

  /**
   * For exports that don't follow the standard columns. Suggests a mapping from the column names alone, plus a sample
   * of the birthdate column so the operator can confirm the dates read the way they expect.
   */
  @Path("/import/mapping")
  @POST
  @Consumes(MediaType.MULTIPART_FORM_DATA)
  @Produces(MediaType.APPLICATION_JSON)
  public Response suggestMapping(
      @FormDataParam("file") InputStream inputStream,
      @FormDataParam("file") FormDataContentDisposition fileDisposition,
      @FormDataParam("birthdateColumn") String birthdateColumn,
      @Context HttpServletRequest request
  ) throws Exception {
    Environment env = envFactory.init(request);
    SecurityUtil.verifyApiKey(env);

    List<RawRow> rows = toRawRows(inputStream, fileDisposition);
    if (rows == null) {
      return error(Response.Status.BAD_REQUEST, "Please upload an Excel (.xlsx) or CSV file.");
    }

    List<String> columns = rows.stream().flatMap(r -> r.columns().stream()).distinct().collect(Collectors.toList());
    List<MappingSuggestion> suggestions = env.mappingSuggester().suggest(columns);

    if (Strings.isNullOrEmpty(birthdateColumn)) {
      birthdateColumn = suggestions.stream()
          .filter(s -> s.field == DonorField.BIRTHDATE && s.confidence != MappingSuggestion.Confidence.DEFAULT)
          .map(s -> s.column)
          .findFirst().orElse(null);
    }

    JSONArray suggestionsJson = new JSONArray();
    for (MappingSuggestion suggestion : suggestions) {
      suggestionsJson.put(new JSONObject()
          .put("field", suggestion.field.getName())
          .put("column", suggestion.column)
          .put("confidence", suggestion.confidence.name()));
    }

    JSONArray previewJson = new JSONArray();
    if (birthdateColumn != null) {
      Map<String, String> preview = MappingSuggester.previewBirthdates(rows, birthdateColumn, env.fieldNormalizer(),
          BIRTHDATE_PREVIEW_SIZE);
      preview.forEach((raw, normalized) -> previewJson.put(new JSONObject().put("raw", raw).put("normalized", normalized)));
    }

    JSONObject jsonObj = new JSONObject()
        .put("columns", new JSONArray(columns))
        .put("suggestions", suggestionsJson)
        .put("birthdateColumn", birthdateColumn == null ? JSONObject.NULL : birthdateColumn)
        .put("birthdatePreview", previewJson);
    return Response.status(200).entity(jsonObj.toString()).build();
  }

  /**
   * Null if the file type isn't one we read.
   */
  protected List<RawRow> toRawRows(InputStream inputStream, FormDataContentDisposition fileDisposition)
      throws Exception {
    if (inputStream == null || fileDisposition == null) {
      return null;
    }

    String fileExtension = Utils.getFileExtension(fileDisposition.getFileName());
    if ("csv".equals(fileExtension)) {
      return Utils.getCsvData(inputStream);
    } else if ("xlsx".equals(fileExtension)) {
      return Utils.getExcelData(inputStream);
    } else {
      log.info("unsupported file extension: {}", fileExtension);
      return null;
    }
  }

  protected JSONObject toJson(DonorImportResult result) throws Exception {
    ReconciliationOutcome outcome = result.getOutcome();
    return new JSONObject()
        .put("totalRows", result.getTotalRows())
        .put("uniqueDonors", result.getUniqueDonors())
        .put("newDonors", outcome.getNewRecords().size())
        .put("updatedRecords", outcome.getUpdatedRecords().size())
        .put("unchangedRecords", outcome.getUnchangedRecords().size())
        .put("excludedRecords", outcome.getExcludedCount())
        .put("leads", result.getLeads().size())
        // a donor number can appear once per facility; list each one once
        .put("newDonorNumbers", new JSONArray(outcome.getNewByDonorNumber().keySet()))
        .put("updatedDonorNumbers", new JSONArray(outcome.getUpdatedByDonorNumber().keySet()))
        .put("normalizationFailures", new JSONObject(result.getNormalizationStats().asMap()))
        .put("leadsCsv", Utils.toCsv(result.getLeadsTable()));
  }

  private static Map<String, String> parseMapping(String mappingJson) throws JsonProcessingException {
    return MAPPER.readValue(mappingJson, new TypeReference<Map<String, String>>() {});
  }

  private static Response error(Response.Status status, String message) {
    return Response.status(status).entity(new JSONObject().put("error", message).toString()).build();
  }
}
