// This file is part of tsquery.
// Copyright (C) 2024  The tsquery Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tsquery.serdes;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonGenerator;

import net.tsquery.data.NormalizedSeries;
import net.tsquery.query.EvaluationResult;
import net.tsquery.utils.JSON;
import net.tsquery.utils.JSONException;

/**
 * Streams evaluated series in the render JSON format:
 * <pre>
 * [{"target": "a.b", "datapoints": [[1.0, 60], [null, 120]]}]
 * </pre>
 * Gaps are written as {@code null}, timestamps as Unix seconds.
 *
 * @since 3.0
 */
public final class SeriesJsonSerializer {

  private SeriesJsonSerializer() { }

  /**
   * Writes the series of every target in target order.
   * @param result A non-null result.
   * @param output The stream to write to, left open.
   * @throws JSONException if writing failed.
   */
  public static void serialize(final EvaluationResult result,
                               final OutputStream output) {
    try {
      final JsonGenerator json = JSON.getFactory().createGenerator(output);
      json.writeStartArray();
      for (final Map.Entry<String, List<NormalizedSeries>> entry :
          result.series().entrySet()) {
        for (final NormalizedSeries series : entry.getValue()) {
          writeSeries(json, series);
        }
      }
      json.writeEndArray();
      json.flush();
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }

  /**
   * @param series The series to write.
   * @return The JSON array.
   * @throws JSONException if writing failed.
   */
  public static String serializeToString(final List<NormalizedSeries> series) {
    final ByteArrayOutputStream output = new ByteArrayOutputStream();
    try {
      final JsonGenerator json = JSON.getFactory().createGenerator(output);
      json.writeStartArray();
      for (final NormalizedSeries s : series) {
        writeSeries(json, s);
      }
      json.writeEndArray();
      json.close();
    } catch (IOException e) {
      throw new JSONException(e);
    }
    return new String(output.toByteArray(), StandardCharsets.UTF_8);
  }

  private static void writeSeries(final JsonGenerator json,
                                  final NormalizedSeries series) throws IOException {
    json.writeStartObject();
    json.writeStringField("target", series.name());
    json.writeArrayFieldStart("datapoints");
    for (int i = 0; i < series.size(); i++) {
      json.writeStartArray();
      final Double value = series.value(i);
      if (value == null) {
        json.writeNull();
      } else {
        json.writeNumber(value.doubleValue());
      }
      json.writeNumber(series.timeInfo().timestamp(i));
      json.writeEndArray();
    }
    json.writeEndArray();
    json.writeEndObject();
  }
}
