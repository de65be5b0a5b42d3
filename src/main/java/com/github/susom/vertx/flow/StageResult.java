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

import java.util.Objects;

/**
 * What a stage tells the executor to do next.
 */
public class StageResult {
  public enum Action {
    /** Stage is satisfied, move to the next one. */
    ADVANCE,
    /** Show (or keep showing) this stage's challenge. */
    CHALLENGE,
    /** Show this stage's challenge again along with the rejection. */
    REPROMPT,
    /** Abort the whole flow. */
    DENY
  }

  private static final StageResult ADVANCE = new StageResult(Action.ADVANCE, null, null);
  private static final StageResult CHALLENGE = new StageResult(Action.CHALLENGE, null, null);

  private final Action action;
  private final ValidationResult rejection;
  private final String reason;

  private StageResult(Action action, ValidationResult rejection, String reason) {
    this.action = action;
    this.rejection = rejection;
    this.reason = reason;
  }

  public static StageResult advance() {
    return ADVANCE;
  }

  public static StageResult challenge() {
    return CHALLENGE;
  }

  public static StageResult reprompt(ValidationResult rejection) {
    return new StageResult(Action.REPROMPT, Objects.requireNonNull(rejection), null);
  }

  /**
   * @param reason shown to the user, so keep sensitive details out of it
   */
  public static StageResult deny(String reason) {
    return new StageResult(Action.DENY, null, reason);
  }

  public Action action() {
    return action;
  }

  public ValidationResult rejection() {
    return rejection;
  }

  public String reason() {
    return reason;
  }

  @Override
  public String toString() {
    return action + (rejection == null ? "" : " " + rejection) + (reason == null ? "" : " " + reason);
  }
}
