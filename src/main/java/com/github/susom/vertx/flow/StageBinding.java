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
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * One entry in a flow plan: which stage implementation to run (the kind),
 * the name of this particular configured instance, and its configuration.
 */
public class StageBinding {
  private final String name;
  private final String kind;
  private final JsonObject config;

  public StageBinding(@Nonnull String name, @Nonnull String kind, JsonObject config) {
    this.name = Objects.requireNonNull(name, "Stage name is required");
    this.kind = Objects.requireNonNull(kind, "Stage kind is required");
    this.config = config == null ? new JsonObject() : config.copy();
  }

  public StageBinding(@Nonnull String name, @Nonnull String kind) {
    this(name, kind, null);
  }

  public String name() {
    return name;
  }

  public String kind() {
    return kind;
  }

  /**
   * A copy of the stage configuration. Modifying the result has no effect
   * on the binding.
   */
  public JsonObject config() {
    return config.copy();
  }

  public JsonObject toJson() {
    return new JsonObject().put("name", name).put("kind", kind).put("config", config.copy());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StageBinding)) {
      return false;
    }
    StageBinding other = (StageBinding) o;
    return name.equals(other.name) && kind.equals(other.kind) && config.equals(other.config);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind, config);
  }

  @Override
  public String toString() {
    return kind + ":" + name;
  }
}
