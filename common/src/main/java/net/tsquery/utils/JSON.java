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
package net.tsquery.utils;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;

/**
 * Static class with helpers to serialize and deserialize JSON through a
 * single, shared Jackson {@link ObjectMapper}. Parse problems in the
 * input are reported as {@link IllegalArgumentException}s, everything
 * else as a {@link JSONException}.
 *
 * @since 3.0
 */
public final class JSON {

  /** Thread safe once configured. */
  private static final ObjectMapper jsonMapper = new ObjectMapper();

  private JSON() { }

  /**
   * Deserializes a JSON formatted string to a specific class type.
   * @param json The string to deserialize.
   * @param pojo The class type of the object used for deserialization.
   * @return An object of the {@code pojo} type.
   * @throws IllegalArgumentException if the data or class was null or
   * parsing failed.
   * @throws JSONException if the data could not be deserialized.
   */
  public static final <T> T parseToObject(final String json,
                                          final Class<T> pojo) {
    if (Strings.isNullOrEmpty(json)) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }
    try {
      return jsonMapper.readValue(json, pojo);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }

  /**
   * Deserializes a JSON formatted string to a complex type.
   * @param json The string to deserialize.
   * @param type A type reference describing the target.
   * @return An object of the given type.
   * @throws IllegalArgumentException if the data or type was null or
   * parsing failed.
   * @throws JSONException if the data could not be deserialized.
   */
  public static final <T> T parseToObject(final String json,
                                          final TypeReference<T> type) {
    if (Strings.isNullOrEmpty(json)) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (type == null) {
      throw new IllegalArgumentException("Missing type reference");
    }
    try {
      return jsonMapper.readValue(json, type);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }

  /**
   * Serializes the given object to a JSON string.
   * @param object The object to serialize.
   * @return A JSON formatted string.
   * @throws IllegalArgumentException if the object was null.
   * @throws JSONException if the object could not be serialized.
   */
  public static final String serializeToString(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object was null");
    }
    try {
      return jsonMapper.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new JSONException(e);
    }
  }

  /**
   * Serializes the given object to a UTF-8 byte array.
   * @param object The object to serialize.
   * @return A JSON formatted byte array.
   * @throws IllegalArgumentException if the object was null.
   * @throws JSONException if the object could not be serialized.
   */
  public static final byte[] serializeToBytes(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object was null");
    }
    try {
      return jsonMapper.writeValueAsBytes(object);
    } catch (JsonProcessingException e) {
      throw new JSONException(e);
    }
  }

  /** @return The shared mapper. Do not reconfigure it. */
  public static final ObjectMapper getMapper() {
    return jsonMapper;
  }

  /** @return The factory of the shared mapper, for streaming output. */
  public static final JsonFactory getFactory() {
    return jsonMapper.getFactory();
  }
}
