/*
 * Copyright 2026 The Board of Trustees of The Leland Stanford Junior University.
 * All Rights Reserved.
 *
 * See the NOTICE and LICENSE files distributed with this work for information
 * regarding copyright ownership and licensing. You may not use this file except
 * in compliance with a written license agreement with Stanford University.
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See your
 * License for the specific language governing permissions and limitations under
 * the License.
 */
package com.github.susom.vertx.flow;

import io.vertx.core.json.JsonObject;

/**
 * The prompt a stage presents to the client. This is just a JSON document
 * with a few well known fields; rendering it is the client's business.
 */
public class Challenge {
  public static final String TYPE_NATIVE = "native";

  private final JsonObject json;

  private Challenge(JsonObject json) {
    this.json = json;
  }

  /**
   * A challenge rendered by a client side component.
   */
  public static Challenge nativeChallenge(String component, String title) {
    return new Challenge(new JsonObject()
        .put("type", TYPE_NATIVE)
        .put("component", component)
        .put("title", title));
  }

  public Challenge put(String field, Object value) {
    json.put(field, value);
    return this;
  }

  public String type() {
    return json.getString("type");
  }

  public String component() {
    return json.getString("component");
  }

  public String title() {
    return json.getString("title");
  }

  /**
   * Copy of this challenge with the rejection attached, for re-display.
   */
  public Challenge withErrors(ValidationResult rejection) {
    return new Challenge(json.copy().put("response_errors", rejection.toResponseErrors()));
  }

  public JsonObject toJson() {
    return json.copy();
  }

  @Override
  public String toString() {
    return json.encode();
  }
}
