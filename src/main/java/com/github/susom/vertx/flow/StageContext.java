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

/**
 * Everything a stage may look at or touch while handling one request. The
 * executor is shared (not owned) by the stage.
 */
public class StageContext {
  private final FlowExecutor executor;
  private final StageBinding binding;

  StageContext(FlowExecutor executor, StageBinding binding) {
    this.executor = executor;
    this.binding = binding;
  }

  public FlowExecutor executor() {
    return executor;
  }

  public FlowPlan plan() {
    return executor.plan();
  }

  /**
   * The configured instance of the stage being run.
   */
  public StageBinding binding() {
    return binding;
  }

  public FlowRequest request() {
    return executor.request();
  }

  public FlowSession session() {
    return executor.request().session();
  }

  public void success(String text) {
    executor.addMessage(FlowMessage.success(text));
  }

  public void error(String text) {
    executor.addMessage(FlowMessage.error(text));
  }
}
