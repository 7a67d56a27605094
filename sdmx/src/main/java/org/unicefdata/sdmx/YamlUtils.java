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
package org.unicefdata.sdmx;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;

/**
 * Utility methods for reading the metadata YAML tables.
 *
 * <p>The sync tables share dataflow lists through YAML anchors and aliases.
 * Jackson's YAML parser does not resolve aliases for scalars and sequences,
 * so the document is parsed with SnakeYAML and converted to a Jackson
 * {@link JsonNode} afterwards.
 */
public final class YamlUtils {
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  private YamlUtils() {
  }

  /**
   * Parses a YAML or JSON stream into a JsonNode with anchors resolved.
   *
   * @param stream stream containing YAML or JSON data
   * @param resourceName name of the resource, used to pick the format by extension
   * @return parsed tree; a {@code MissingNode} for an empty document
   * @throws IOException if the stream cannot be read or parsed
   */
  public static JsonNode parseYamlOrJson(InputStream stream, String resourceName)
      throws IOException {
    if (resourceName.endsWith(".yaml") || resourceName.endsWith(".yml")) {
      LoaderOptions loaderOptions = new LoaderOptions();
      loaderOptions.setMaxAliasesForCollections(500);
      Yaml yaml = new Yaml(loaderOptions);
      Object parsedYaml;
      try {
        parsedYaml = yaml.load(stream);
      } catch (RuntimeException e) {
        // SnakeYAML reports syntax errors as unchecked YAMLException
        throw new IOException("Malformed YAML in " + resourceName + ": " + e.getMessage(), e);
      }
      if (parsedYaml == null) {
        return JSON_MAPPER.missingNode();
      }
      return JSON_MAPPER.convertValue(parsedYaml, JsonNode.class);
    }
    return JSON_MAPPER.readTree(stream);
  }
}
