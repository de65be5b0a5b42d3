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
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * Creates the plan when a user starts a flow. Hosts decide here which stages
 * apply and what goes into the initial context (typically the pending user).
 */
public interface FlowPlanner {
  /**
   * @return a new plan, or null if this request may not start the flow
   */
  @Nullable
  FlowPlan plan(Flow flow, FlowRequest request);

  /**
   * Plan every stage of the flow, seeding the context from the request.
   * The function may return null to deny the flow.
   */
  static FlowPlanner withContext(Function<FlowRequest, Map<String, Object>> initialContext) {
    return (flow, request) -> {
      Map<String, Object> context = initialContext.apply(request);
      if (context == null) {
        return null;
      }
      return new FlowPlan(flow.slug(), flow.stages()).putAll(context);
    };
  }
}
