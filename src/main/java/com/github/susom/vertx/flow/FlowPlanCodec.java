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

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * Reads and writes plan snapshots. The snapshot is a JSON document with an
 * explicit version so tokens issued by one deployment can be redeemed by
 * the next one:
 *
 * <pre>
 *   {"v":1,"flow":"signup","cursor":1,
 *    "stages":[{"name":"prompt","kind":"prompt","config":{}}, ...],
 *    "context":{"pending_user":"42"}}
 * </pre>
 *
 * <p>Anything that does not match this layout exactly is rejected with a
 * {@link PlanSnapshotException} rather than partially restored.</p>
 *
 * <p>Context values are kept in the form {@link #canonical(Object)} gives
 * them, both in a live plan and in a decoded one, so a restored context
 * equals the context that was snapshotted.</p>
 */
public class FlowPlanCodec {
  public static final int VERSION = 1;

  private FlowPlanCodec() {
    // Static methods only
  }

  @Nonnull
  public static JsonObject toJson(@Nonnull FlowPlan plan) {
    JsonArray stages = new JsonArray();
    for (StageBinding stage : plan.stages()) {
      stages.add(stage.toJson());
    }

    JsonObject context = new JsonObject();
    for (Map.Entry<String, Object> entry : plan.context().entrySet()) {
      context.put(entry.getKey(), entry.getValue());
    }

    return new JsonObject()
        .put("v", VERSION)
        .put("flow", plan.flowSlug())
        .put("cursor", plan.cursor())
        .put("stages", stages)
        .put("context", context);
  }

  @Nonnull
  public static String encode(@Nonnull FlowPlan plan) {
    return toJson(plan).encode();
  }

  @Nonnull
  public static FlowPlan decode(String snapshot) {
    if (snapshot == null || snapshot.isEmpty()) {
      throw new PlanSnapshotException("Plan snapshot is empty");
    }

    JsonObject json;
    try {
      json = new JsonObject(snapshot);
    } catch (DecodeException e) {
      throw new PlanSnapshotException("Plan snapshot is not valid JSON", e);
    }
    return fromJson(json);
  }

  @Nonnull
  public static FlowPlan fromJson(@Nonnull JsonObject json) {
    try {
      Integer version = json.getInteger("v");
      if (version == null || version != VERSION) {
        throw new PlanSnapshotException("Unsupported plan snapshot version: " + version);
      }

      String flowSlug = json.getString("flow");
      Integer cursor = json.getInteger("cursor");
      JsonArray stagesJson = json.getJsonArray("stages");
      JsonObject contextJson = json.getJsonObject("context");
      if (flowSlug == null || cursor == null || stagesJson == null || contextJson == null) {
        throw new PlanSnapshotException("Plan snapshot is missing one of flow, cursor, stages, or context");
      }

      List<StageBinding> stages = new ArrayList<>();
      for (int i = 0; i < stagesJson.size(); i++) {
        JsonObject stage = stagesJson.getJsonObject(i);
        if (stage == null || stage.getString("name") == null || stage.getString("kind") == null) {
          throw new PlanSnapshotException("Stage " + i + " in plan snapshot is missing its name or kind");
        }
        stages.add(new StageBinding(stage.getString("name"), stage.getString("kind"), stage.getJsonObject("config")));
      }

      Map<String, Object> context = new LinkedHashMap<>();
      for (String key : contextJson.fieldNames()) {
        context.put(key, contextJson.getValue(key));
      }

      return new FlowPlan(flowSlug, stages, cursor, context);
    } catch (ClassCastException | IllegalArgumentException e) {
      throw new PlanSnapshotException("Plan snapshot is malformed: " + e.getMessage(), e);
    }
  }

  /**
   * The form a context value has after a round trip through a snapshot.
   * Integral numbers become Long, other numbers Double, and maps and lists
   * become JsonObject and JsonArray, recursively. Strings, booleans and null
   * are unchanged.
   *
   * @throws IllegalArgumentException if the value has no JSON representation
   */
  @SuppressWarnings("unchecked")
  static Object canonical(Object value) {
    if (value == null || value instanceof String || value instanceof Boolean || value instanceof Long
        || value instanceof Double) {
      return value;
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float) {
      return ((Float) value).doubleValue();
    }
    if (value instanceof BigInteger && ((BigInteger) value).bitLength() < 64) {
      return ((BigInteger) value).longValue();
    }
    if (value instanceof JsonObject) {
      value = ((JsonObject) value).getMap();
    }
    if (value instanceof Map) {
      JsonObject json = new JsonObject();
      for (Map.Entry<Object, Object> entry : ((Map<Object, Object>) value).entrySet()) {
        json.put(String.valueOf(entry.getKey()), canonical(entry.getValue()));
      }
      return json;
    }
    if (value instanceof JsonArray) {
      value = ((JsonArray) value).getList();
    }
    if (value instanceof List) {
      JsonArray json = new JsonArray();
      for (Object item : (List<Object>) value) {
        json.add(canonical(item));
      }
      return json;
    }
    throw new IllegalArgumentException("No JSON representation for " + value.getClass().getName());
  }
}
