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

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Result of a stage checking the response submitted for its challenge.
 */
public class ValidationResult {
  private static final ValidationResult ACCEPTED = new ValidationResult(true, null, null);

  private final boolean accepted;
  private final String code;
  private final String detail;

  private ValidationResult(boolean accepted, String code, String detail) {
    this.accepted = accepted;
    this.code = code;
    this.detail = detail;
  }

  public static ValidationResult accepted() {
    return ACCEPTED;
  }

  /**
   * @param code machine readable reason (e.g. "email-sent")
   * @param detail message for the user; it will be returned to the client
   */
  public static ValidationResult rejected(String code, String detail) {
    return new ValidationResult(false, code, detail);
  }

  public boolean isAccepted() {
    return accepted;
  }

  public String code() {
    return code;
  }

  public String detail() {
    return detail;
  }

  /**
   * Errors in the form the client renders next to the challenge.
   */
  public JsonObject toResponseErrors() {
    if (accepted) {
      return new JsonObject();
    }
    return new JsonObject().put("non_field_errors", new JsonArray()
        .add(new JsonObject().put("string", detail).put("code", code)));
  }

  @Override
  public String toString() {
    return accepted ? "accepted" : "rejected(" + code + ")";
  }
}
