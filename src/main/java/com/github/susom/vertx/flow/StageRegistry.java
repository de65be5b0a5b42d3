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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nullable;

/**
 * Maps the kind named in a {@link StageBinding} to the implementation.
 */
public class StageRegistry {
  private final Map<String, Stage> stages = new ConcurrentHashMap<>();

  public StageRegistry register(String kind, Stage stage) {
    if (stages.putIfAbsent(kind, stage) != null) {
      throw new IllegalStateException("A stage of kind '" + kind + "' is already registered");
    }
    return this;
  }

  @Nullable
  public Stage get(String kind) {
    return stages.get(kind);
  }
}
