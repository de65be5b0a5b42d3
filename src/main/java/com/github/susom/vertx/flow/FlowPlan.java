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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The live state of one subject's attempt at a flow: the ordered stages,
 * a cursor pointing at the active one, and a context shared by all stages.
 *
 * <p>The cursor is either a valid index into the stages or {@link #COMPLETED}.
 * Context values must be representable as JSON because plans are snapshotted
 * into the session and into resumption tokens. They are stored in the form a
 * snapshot restores them in (see {@link FlowPlanCodec#canonical(Object)}), so
 * an Integer put into the context reads back as a Long.</p>
 *
 * <p>Plans are not thread safe. A plan belongs to exactly one session.</p>
 */
public class FlowPlan {
  /** The id of the user this flow is being executed for (value is the user id string). */
  public static final String PENDING_USER = "pending_user";
  /** Set when the plan was rehydrated from a redeemed resumption token. */
  public static final String IS_RESTORED = "is_restored";

  public static final int COMPLETED = -1;

  private final String flowSlug;
  private final List<StageBinding> stages;
  private final Map<String, Object> context;
  private int cursor;

  public FlowPlan(@Nonnull String flowSlug, @Nonnull List<StageBinding> stages) {
    this(flowSlug, stages, 0, new LinkedHashMap<>());
  }

  FlowPlan(@Nonnull String flowSlug, @Nonnull List<StageBinding> stages, int cursor, Map<String, Object> context) {
    this.flowSlug = Objects.requireNonNull(flowSlug, "Flow slug is required");
    this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
    this.context = new LinkedHashMap<>();
    putAll(context);
    if (this.stages.isEmpty()) {
      cursor = COMPLETED;
    }
    if (cursor != COMPLETED && (cursor < 0 || cursor >= this.stages.size())) {
      throw new IllegalArgumentException("Cursor " + cursor + " is outside the plan (" + this.stages.size()
          + " stages)");
    }
    this.cursor = cursor;
  }

  public String flowSlug() {
    return flowSlug;
  }

  public List<StageBinding> stages() {
    return stages;
  }

  public int cursor() {
    return cursor;
  }

  public boolean isCompleted() {
    return cursor == COMPLETED;
  }

  /**
   * @return the binding at the cursor, or null if the plan is completed
   */
  @Nullable
  public StageBinding currentStage() {
    return isCompleted() ? null : stages.get(cursor);
  }

  /**
   * Move the cursor past the current stage.
   *
   * @return true if there is another stage to run, false if the plan is now completed
   */
  public boolean advance() {
    if (isCompleted()) {
      throw new IllegalStateException("Flow plan " + flowSlug + " is already completed");
    }
    cursor++;
    if (cursor >= stages.size()) {
      cursor = COMPLETED;
      return false;
    }
    return true;
  }

  /**
   * The context shared by all stages of this plan. Use {@link #put(String, Object)}
   * to change it.
   */
  public Map<String, Object> context() {
    return Collections.unmodifiableMap(context);
  }

  public boolean has(String key) {
    return context.containsKey(key);
  }

  @Nullable
  public Object get(String key) {
    return context.get(key);
  }

  @Nullable
  public String getString(String key) {
    Object value = context.get(key);
    return value == null ? null : value.toString();
  }

  public boolean getBoolean(String key) {
    Object value = context.get(key);
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    return value != null && Boolean.parseBoolean(value.toString());
  }

  /**
   * @throws IllegalArgumentException if the value cannot be represented as JSON
   */
  public FlowPlan put(String key, Object value) {
    try {
      context.put(key, FlowPlanCodec.canonical(value));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Plan context value for '" + key + "' cannot be serialized: "
          + e.getMessage(), e);
    }
    return this;
  }

  public FlowPlan putAll(Map<String, ?> values) {
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      put(entry.getKey(), entry.getValue());
    }
    return this;
  }

  @Nullable
  public Object remove(String key) {
    return context.remove(key);
  }

  @Override
  public String toString() {
    return "FlowPlan{" + flowSlug + " at " + (isCompleted() ? "completed" : cursor + "/" + stages.size()) + "}";
  }
}
