package com.ethicalai.scoring.service.data_processing;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Service;

import com.ethicalai.scoring.exception.DatasetLoadException;
import com.ethicalai.scoring.exception.EmptyDatasetException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Materializes CSV, TSV, JSON and Excel uploads into a {@link RawDataset}. */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetParsingService {

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final ObjectMapper objectMapper;

  public RawDataset parse(DatasetSource source) {
    DatasetFormat format = source.format();
    try (InputStream in = source.getContent().openStream()) {
      return parse(in, source.getName(), format);
    } catch (IOException e) {
      throw new DatasetLoadException("Could not read dataset '" + source.getName() + "'", e);
    }
  }

  public RawDataset parse(InputStream in, String fileName, DatasetFormat format) {
    RawDataset dataset;
    switch (format) {
      case CSV:
        dataset = parseDelimited(in, fileName, ',');
        break;
      case TSV:
        dataset = parseDelimited(in, fileName, '\t');
        break;
      case JSON:
        dataset = parseJson(in, fileName);
        break;
      case EXCEL:
        dataset = parseExcel(in, fileName);
        break;
      default:
        throw new IllegalStateException("Unhandled format " + format);
    }

    if (dataset.rowCount() == 0) {
      throw new EmptyDatasetException(fileName);
    }
    log.debug(
        "Parsed {} as {}: {} rows x {} columns",
        fileName,
        format,
        dataset.rowCount(),
        dataset.columnCount());
    return dataset;
  }

  private RawDataset parseDelimited(InputStream in, String fileName, char separator) {
    try (CSVReader reader =
        new CSVReaderBuilder(new InputStreamReader(in, StandardCharsets.UTF_8))
            .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
            .build()) {

      String[] headers = reader.readNext();
      if (headers == null || isBlankLine(headers)) {
        throw new EmptyDatasetException(fileName);
      }
      List<String> columns = dedupeHeaders(headers);

      List<List<String>> rows = new ArrayList<>();
      String[] row;
      while ((row = reader.readNext()) != null) {
        if (isBlankLine(row)) {
          continue;
        }
        rows.add(fitRow(row, columns.size(), reader.getLinesRead()));
      }
      return new RawDataset(fileName, columns, rows);
    } catch (IOException | CsvException e) {
      throw new DatasetLoadException("Malformed delimited file '" + fileName + "'", e);
    }
  }

  private RawDataset parseJson(InputStream in, String fileName) {
    JsonNode root;
    try {
      root = objectMapper.readTree(in);
    } catch (IOException e) {
      throw new DatasetLoadException("Malformed JSON dataset '" + fileName + "'", e);
    }
    if (root == null || root.isMissingNode()) {
      throw new EmptyDatasetException(fileName);
    }

    JsonNode records = root;
    if (root.isObject()) {
      records = root.has("data") ? root.get("data") : root.get("records");
    }
    if (records == null || !records.isArray()) {
      throw new DatasetLoadException(
          "JSON dataset '" + fileName + "' must be an array of row objects");
    }

    Set<String> columnSet = new LinkedHashSet<>();
    for (JsonNode record : records) {
      if (!record.isObject()) {
        throw new DatasetLoadException(
            "JSON dataset '" + fileName + "' contains a row that is not an object");
      }
      record.fieldNames().forEachRemaining(columnSet::add);
    }

    List<String> columns = new ArrayList<>(columnSet);
    List<List<String>> rows = new ArrayList<>();
    for (JsonNode record : records) {
      List<String> cells = new ArrayList<>(columns.size());
      for (String column : columns) {
        JsonNode value = record.get(column);
        if (value == null || value.isNull()) {
          cells.add("");
        } else if (value.isValueNode()) {
          cells.add(value.asText());
        } else {
          cells.add(value.toString());
        }
      }
      rows.add(cells);
    }
    return new RawDataset(fileName, columns, rows);
  }

  private RawDataset parseExcel(InputStream in, String fileName) {
    try (Workbook workbook = WorkbookFactory.create(in)) {
      if (workbook.getNumberOfSheets() == 0) {
        throw new EmptyDatasetException(fileName);
      }
      Sheet sheet = workbook.getSheetAt(0);
      DataFormatter formatter = new DataFormatter();
      FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

      Iterator<Row> rowIterator = sheet.iterator();
      if (!rowIterator.hasNext()) {
        throw new EmptyDatasetException(fileName);
      }
      Row headerRow = rowIterator.next();
      int width = Math.max(headerRow.getLastCellNum(), 0);
      String[] headers = new String[width];
      for (int i = 0; i < width; i++) {
        headers[i] = formatter.formatCellValue(headerRow.getCell(i), evaluator);
      }
      if (width == 0 || isBlankLine(headers)) {
        throw new EmptyDatasetException(fileName);
      }
      List<String> columns = dedupeHeaders(headers);

      List<List<String>> rows = new ArrayList<>();
      while (rowIterator.hasNext()) {
        Row row = rowIterator.next();
        String[] cells = new String[width];
        for (int i = 0; i < width; i++) {
          Cell cell = row.getCell(i, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
          cells[i] = cell == null ? "" : formatter.formatCellValue(cell, evaluator);
        }
        if (!isBlankLine(cells)) {
          rows.add(List.of(cells));
        }
      }
      return new RawDataset(fileName, columns, rows);
    } catch (DatasetLoadException e) {
      throw e;
    } catch (IOException | RuntimeException e) {
      throw new DatasetLoadException("Unreadable spreadsheet '" + fileName + "'", e);
    }
  }

  /** Short rows are padded with missing cells; rows wider than the header are corrupt. */
  private List<String> fitRow(String[] row, int width, long lineNumber) {
    if (row.length > width) {
      throw new DatasetLoadException(
          String.format(
              "Line %d has %d fields but the header declares %d", lineNumber, row.length, width));
    }
    List<String> cells = new ArrayList<>(width);
    Collections.addAll(cells, row);
    while (cells.size() < width) {
      cells.add("");
    }
    return cells;
  }

  /** Repeated header names get a numeric suffix: a, a.1, a.2. */
  private List<String> dedupeHeaders(String[] headers) {
    Map<String, Integer> seen = new HashMap<>();
    List<String> columns = new ArrayList<>(headers.length);
    for (int i = 0; i < headers.length; i++) {
      String header = headers[i] == null ? "" : headers[i].trim();
      if (i == 0 && !header.isEmpty() && header.charAt(0) == BYTE_ORDER_MARK) {
        header = header.substring(1);
      }
      if (header.isEmpty()) {
        header = "Unnamed: " + i;
      }
      int occurrences = seen.merge(header, 1, Integer::sum);
      columns.add(occurrences == 1 ? header : header + "." + (occurrences - 1));
    }
    return columns;
  }

  private boolean isBlankLine(String[] cells) {
    for (String cell : cells) {
      if (cell != null && !cell.isBlank()) {
        return false;
      }
    }
    return true;
  }
}
