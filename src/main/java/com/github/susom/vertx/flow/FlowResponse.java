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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import javax.annotation.Nullable;

/**
 * What the executor produced for one request.
 */
public class FlowResponse {
  private final String flowSlug;
  private final FlowState state;
  private final Challenge challenge;
  private final List<FlowMessage> messages;
  private final String reason;

  FlowResponse(String flowSlug, FlowState state, Challenge challenge, List<FlowMessage> messages, String reason) {
    this.flowSlug = flowSlug;
    this.state = state;
    this.challenge = challenge;
    this.messages = Collections.unmodifiableList(new ArrayList<>(messages));
    this.reason = reason;
  }

  public String flowSlug() {
    return flowSlug;
  }

  public FlowState state() {
    return state;
  }

  /**
   * @return the challenge to display, or null if the flow completed or was denied
   */
  @Nullable
  public Challenge challenge() {
    return challenge;
  }

  public List<FlowMessage> messages() {
    return messages;
  }

  /**
   * @return why the flow was denied, or null
   */
  @Nullable
  public String reason() {
    return reason;
  }

  public JsonObject toJson() {
    JsonArray messagesJson = new JsonArray();
    for (FlowMessage message : messages) {
      messagesJson.add(message.toJson());
    }
    JsonObject json = new JsonObject()
        .put("flow", flowSlug)
        .put("state", state.name().toLowerCase(Locale.ROOT))
        .put("messages", messagesJson);
    if (challenge != null) {
      json.put("challenge", challenge.toJson());
    }
    if (reason != null) {
      json.put("reason", reason);
    }
    return json;
  }

  @Override
  public String toString() {
    return toJson().encode();
  }
}
