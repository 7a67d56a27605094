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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link SdmxCsvParser} and {@link SdmxErrorMessage}.
 */
@Tag("unit")
public class SdmxCsvParserTest {
  private final SdmxCsvParser parser = new SdmxCsvParser();

  @Test void testParsesRowsInHeaderOrder() throws IOException {
    List<Map<String, String>> rows = parser.parse(
        "REF_AREA,INDICATOR,TIME_PERIOD,OBS_VALUE\n"
            + "ALB,CME_MRY0T4,2020,9.7\n"
            + "BGD,CME_MRY0T4,2019,30.8\n");

    assertEquals(2, rows.size());
    assertEquals(Arrays.asList("REF_AREA", "INDICATOR", "TIME_PERIOD", "OBS_VALUE"),
        Arrays.asList(rows.get(0).keySet().toArray()));
    assertEquals("BGD", rows.get(1).get("REF_AREA"));
    assertEquals("30.8", rows.get(1).get("OBS_VALUE"));
  }

  @Test void testQuotedCellsKeepCommas() throws IOException {
    List<Map<String, String>> rows = parser.parse(
        "REF_AREA,Geographic area,OBS_VALUE\n"
            + "COD,\"Congo, Democratic Republic of the\",80.1\n");

    assertEquals("Congo, Democratic Republic of the", rows.get(0).get("Geographic area"));
  }

  @Test void testByteOrderMarkIsStripped() throws IOException {
    List<Map<String, String>> rows = parser.parse("\uFEFFREF_AREA,OBS_VALUE\nALB,1\n");
    assertEquals("ALB", rows.get(0).get("REF_AREA"));
  }

  @Test void testEmptyAndHeaderOnlyBodies() throws IOException {
    assertTrue(parser.parse("").isEmpty());
    assertTrue(parser.parse("  \n").isEmpty());
    assertTrue(parser.parse("REF_AREA,OBS_VALUE\n").isEmpty());
  }

  @Test void testShortRowIsPadded() throws IOException {
    List<Map<String, String>> rows = parser.parse("REF_AREA,TIME_PERIOD,OBS_VALUE\nALB,2020\n");
    assertEquals("", rows.get(0).get("OBS_VALUE"));
  }

  @Test void testLongRowIsMalformed() {
    assertThrows(IOException.class, () -> {
      parser.parse("REF_AREA,OBS_VALUE\nALB,1,extra\n");
    });
  }

  @Test void testErrorMessageParsing() {
    SdmxErrorMessage message = SdmxErrorMessage.parse(
        "<message:Error><message:ErrorMessage code=\"100\">"
            + "<common:Text>No Results Found</common:Text>"
            + "</message:ErrorMessage></message:Error>");
    assertNotNull(message);
    assertEquals(100, message.getCode());
    assertEquals("No Results Found", message.getText());
    assertTrue(message.isNoResults());

    assertNull(SdmxErrorMessage.parse("REF_AREA,OBS_VALUE\n"));
    assertNull(SdmxErrorMessage.parse("<html><body>Bad gateway</body></html>"));
    assertNull(SdmxErrorMessage.parse(null));
  }
}
