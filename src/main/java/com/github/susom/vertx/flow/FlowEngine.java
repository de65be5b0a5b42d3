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
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The long lived pieces of the flow machinery (flow definitions, stage
 * implementations, token storage, planning). Create one per application and
 * ask it for a {@link FlowExecutor} for each request.
 */
public class FlowEngine {
  private final Map<String, Flow> flows = new ConcurrentHashMap<>();
  private final StageRegistry stages;
  private final FlowTokenStore tokens;
  private final FlowPlanner planner;

  public FlowEngine(StageRegistry stages, FlowTokenStore tokens, FlowPlanner planner) {
    this.stages = stages;
    this.tokens = tokens;
    this.planner = planner;
  }

  public FlowEngine addFlow(Flow flow) {
    flows.put(flow.slug(), flow);
    return this;
  }

  @Nullable
  public Flow flow(String slug) {
    return flows.get(slug);
  }

  @Nonnull
  public FlowExecutor executor(@Nonnull Flow flow, @Nonnull FlowRequest request) {
    return new FlowExecutor(this, flow, request);
  }

  public StageRegistry stages() {
    return stages;
  }

  public FlowTokenStore tokens() {
    return tokens;
  }

  public FlowPlanner planner() {
    return planner;
  }
}
