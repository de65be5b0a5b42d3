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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The parts of an incoming request the executor and stages are allowed to
 * see: the session and the query parameters.
 */
public class FlowRequest {
  private final FlowSession session;
  private final Map<String, String> query;

  public FlowRequest(@Nonnull FlowSession session, Map<String, String> query) {
    this.session = session;
    this.query = query == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(query));
  }

  public FlowRequest(@Nonnull FlowSession session) {
    this(session, null);
  }

  public FlowSession session() {
    return session;
  }

  @Nullable
  public String query(String name) {
    return query.get(name);
  }

  public Map<String, String> query() {
    return query;
  }

  public JsonObject queryJson() {
    JsonObject json = new JsonObject();
    query.forEach(json::put);
    return json;
  }
}
