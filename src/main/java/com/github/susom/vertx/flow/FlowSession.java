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

import javax.annotation.Nullable;

/**
 * The small amount of per-browser state the executor needs. Values put here
 * are Strings or JsonObjects so any session store can hold them.
 */
public interface FlowSession {
  /** Snapshot (see {@link FlowPlanCodec}) of the plan in progress. */
  String SESSION_KEY_PLAN = "flow_plan";
  /** Query parameters presented when the user came back through a resumption link. */
  String SESSION_KEY_GET = "flow_get";

  @Nullable
  <T> T get(String key);

  void put(String key, Object value);

  void remove(String key);
}
