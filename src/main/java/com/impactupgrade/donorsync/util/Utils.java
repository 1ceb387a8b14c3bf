/*
 * Copyright (c) 2021 3River Development LLC, DBA Impact Upgrade. All rights reserved.
 */

package com.impactupgrade.donorsync.util;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.google.common.base.Strings;
import com.impactupgrade.donorsync.model.RawRow;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class Utils {

  private static final CsvMapper CSV_MAPPER = new CsvMapper();

  public static String trim(String s) {
    if (s == null) return null;
    return s.trim();
  }

  public static String lowercase(String s) {
    if (s == null) return null;
    return s.toLowerCase(Locale.ROOT);
  }

  public static String numericOnly(String s) {
    if (s == null) return null;
    return s.replaceAll("\\D", "");
  }

  public static String collapseWhitespace(String s) {
    if (s == null) return null;
    return s.trim().replaceAll("\\s+", " ");
  }

  /**
   * Comparison form of a value: lowercased, trimmed, and stripped of everything but letters, digits, '@', and '.'.
   * Formatting-only differences (phone punctuation, address casing, etc.) disappear. Never stored.
   */
  public static String standardize(String s) {
    if (s == null) return "";
    return s.toLowerCase(Locale.ROOT).trim().replaceAll("[^a-z0-9@.]", "");
  }

  public static String emptyStringToNull(String s) {
    if (s == null || s.isEmpty()) {
      return null;
    }
    return s;
  }

  public static String nullToEmptyString(String s) {
    if (s == null) {
      return "";
    }
    return s;
  }

  public static String getFileExtension(String fileName) {
    if (Strings.isNullOrEmpty(fileName)) {
      return null;
    }
    String extension = "";
    int index = fileName.lastIndexOf('.');
    if (index > 0) {
      extension = fileName.substring(index + 1).toLowerCase(Locale.ROOT);
    }
    return extension;
  }

  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////
  // FILES
  //////////////////////////////////////////////////////////////////////////////////////////////////////////////////////

  public static List<RawRow> getCsvData(String csv) throws IOException {
    try (InputStream inputStream = new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8))) {
      return getCsvData(inputStream);
    }
  }

  public static List<RawRow> getCsvData(InputStream inputStream) throws IOException {
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    MappingIterator<Map<String, String>> iterator = CSV_MAPPER.readerFor(Map.class).with(schema).readValues(inputStream);
    List<RawRow> result = new ArrayList<>();
    while (iterator.hasNext()) {
      RawRow row = new RawRow(iterator.next());
      // Some exports oddly give us empty rows at the end before the file terminates. Skip them!
      if (!row.isEmpty()) {
        result.add(row);
      }
    }
    return result;
  }

  /**
   * Reads a CSV without a header, every line as a list of cells. Used for registry and audit tables, where the
   * header is just another row.
   */
  public static List<List<String>> getCsvTable(Reader reader) throws IOException {
    MappingIterator<List<String>> iterator = CSV_MAPPER.readerForListOf(String.class)
        .with(CsvParser.Feature.WRAP_AS_ARRAY)
        .readValues(reader);
    List<List<String>> result = new ArrayList<>();
    while (iterator.hasNext()) {
      result.add(iterator.next());
    }
    return result;
  }

  public static void writeCsvTable(List<List<String>> table, Writer writer) throws IOException {
    try (SequenceWriter sequenceWriter = CSV_MAPPER.writerFor(String[].class).writeValues(writer)) {
      for (List<String> row : table) {
        sequenceWriter.write(row.stream().map(Utils::nullToEmptyString).toArray(String[]::new));
      }
    }
  }

  public static String toCsv(List<List<String>> table) throws IOException {
    StringWriter writer = new StringWriter();
    writeCsvTable(table, writer);
    return writer.toString();
  }

  public static List<RawRow> getExcelData(InputStream inputStream) throws IOException {
    try (Workbook workbook = new XSSFWorkbook(inputStream)) {
      Sheet sheet = workbook.getSheetAt(0);
      return getExcelData(sheet);
    }
  }

  public static List<RawRow> getExcelData(Sheet sheet) {
    List<String> headerData = new ArrayList<>();
    List<RawRow> data = new ArrayList<>();

    Iterator<Row> rowIterator = sheet.iterator();
    if (!rowIterator.hasNext()) {
      return data;
    }

    // first row is the header
    Row header = rowIterator.next();
    for (Cell cell : header) {
      switch (cell.getCellType()) {
        case NUMERIC -> headerData.add(formatDouble(cell.getNumericCellValue()));
        case BOOLEAN -> headerData.add(cell.getBooleanCellValue() + "");
        // note the use of trim -- vital since column names are used to fetch values
        default -> headerData.add(cell.getStringCellValue().trim());
      }
    }

    int numCols = headerData.size();

    while (rowIterator.hasNext()) {
      Row row = rowIterator.next();
      Map<String, Object> rowData = new LinkedHashMap<>();
      for (int i = 0; i < numCols; i++) {
        Cell cell = row.getCell(i, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
        rowData.put(headerData.get(i), cell == null ? null : cellValue(cell));
      }
      RawRow rawRow = new RawRow(rowData);
      if (!rawRow.isEmpty()) {
        data.add(rawRow);
      }
    }

    return data;
  }

  // Dates stay dates, numbers stay numbers. RawRow decides how they render as text.
  private static Object cellValue(Cell cell) {
    CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
    return switch (type) {
      case NUMERIC -> DateUtil.isCellDateFormatted(cell)
          ? cell.getLocalDateTimeCellValue().toLocalDate()
          : (Object) cell.getNumericCellValue();
      case BOOLEAN -> cell.getBooleanCellValue();
      case STRING -> cell.getStringCellValue().trim();
      default -> null;
    };
  }

  private static String formatDouble(double d) {
    String formatPattern = d % 1 == 0 ? "#" : "#.##";
    return new DecimalFormat(formatPattern).format(d);
  }
}
