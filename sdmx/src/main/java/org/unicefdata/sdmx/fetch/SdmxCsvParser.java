/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.unicefdata.sdmx.fetch;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the CSV bodies returned by the SDMX API with {@code format=csv}.
 *
 * <p>Each row becomes a map from header to cell, in header order. Short rows
 * are padded with empty cells; a row longer than the header is malformed.
 */
public class SdmxCsvParser {
  private static final char BOM = '\uFEFF';

  /**
   * Parses a CSV body.
   *
   * @param body response body; may be empty
   * @return rows, empty when the body has a header only or nothing at all
   * @throws IOException if the body is not well-formed CSV
   */
  public List<Map<String, String>> parse(String body) throws IOException {
    String text = body;
    if (!text.isEmpty() && text.charAt(0) == BOM) {
      text = text.substring(1);
    }
    if (text.trim().isEmpty()) {
      return Collections.emptyList();
    }
    try (CSVReader reader = new CSVReaderBuilder(new StringReader(text))
        .withCSVParser(new CSVParserBuilder().withSeparator(',').build())
        .build()) {
      String[] header = reader.readNext();
      if (header == null) {
        return Collections.emptyList();
      }
      for (int i = 0; i < header.length; i++) {
        header[i] = header[i].trim();
      }
      List<Map<String, String>> rows = new ArrayList<Map<String, String>>();
      String[] line;
      while ((line = reader.readNext()) != null) {
        if (line.length == 1 && line[0].trim().isEmpty()) {
          continue;
        }
        if (line.length > header.length) {
          throw new IOException("CSV row " + (rows.size() + 2) + " has " + line.length
              + " cells but the header has " + header.length);
        }
        Map<String, String> row = new LinkedHashMap<String, String>();
        for (int i = 0; i < header.length; i++) {
          row.put(header[i], i < line.length ? line[i] : "");
        }
        rows.add(Collections.unmodifiableMap(row));
      }
      return rows;
    } catch (CsvValidationException e) {
      throw new IOException("Malformed CSV response: " + e.getMessage(), e);
    }
  }
}
