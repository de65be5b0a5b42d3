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

/**
 * One kind of unit of work in a flow (prompt for a password, send a
 * verification email, etc.). Implementations are registered by kind in a
 * {@link StageRegistry} and are shared by every flow and request, so they
 * must keep per-flow state in the plan context rather than in fields.
 *
 * <p>The executor calls {@link #enter(StageContext)} when the stage is shown
 * (a GET), and {@link #validate(StageContext, JsonObject)} followed by either
 * {@link #onValid(StageContext, JsonObject)} or
 * {@link #onInvalid(StageContext, ValidationResult)} when the client answers
 * (a POST).</p>
 */
public interface Stage {
  /**
   * Called each time the stage becomes (or remains) the active one on a GET.
   * May perform side effects, but must record in the plan context that it did
   * so if they should not repeat.
   */
  default StageResult enter(StageContext ctx) {
    return StageResult.challenge();
  }

  /**
   * Build the prompt for the client. Must not modify the plan.
   */
  Challenge challenge(StageContext ctx);

  ValidationResult validate(StageContext ctx, JsonObject response);

  StageResult onValid(StageContext ctx, JsonObject response);

  default StageResult onInvalid(StageContext ctx, ValidationResult rejection) {
    return StageResult.reprompt(rejection);
  }
}
