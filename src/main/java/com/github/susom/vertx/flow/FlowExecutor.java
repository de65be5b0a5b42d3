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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.github.susom.vertx.flow.FlowSession.SESSION_KEY_GET;
import static com.github.susom.vertx.flow.FlowSession.SESSION_KEY_PLAN;

/**
 * Drives one flow plan through one request. An executor is created for each
 * request (see {@link FlowEngine#executor(Flow, FlowRequest)}), loads the
 * plan from the session, runs the current stage, and writes the plan back.
 *
 * <p>On a GET the current stage is entered, which either shows its challenge,
 * reports itself satisfied (the plan advances and the next stage is entered
 * right away), or denies the flow. On a POST the current stage validates the
 * response and reacts to it the same way, with the additional option of
 * re-showing its challenge with errors.</p>
 *
 * <p>A GET carrying {@link #QS_KEY_TOKEN} replaces the session plan with the
 * one stored in that token. The query parameters are kept in the session under
 * {@link FlowSession#SESSION_KEY_GET} and the plan is flagged with
 * {@link FlowPlan#IS_RESTORED}, which lets the stage that issued the token
 * recognize the user came back through the link. That evidence is consumed
 * when the stage completes. The token itself is only consumed once the stages
 * have run without throwing, so a failed request leaves the link usable.</p>
 *
 * <p>The plan is only written back to the session after the stage returns
 * normally. If a stage throws, the session still holds the plan from before
 * the request.</p>
 */
public class FlowExecutor {
  /** Query parameter carrying the key of a resumption token. */
  public static final String QS_KEY_TOKEN = "flow_token";

  private static final Logger log = LoggerFactory.getLogger(FlowExecutor.class);
  private final FlowEngine engine;
  private final Flow flow;
  private final FlowRequest request;
  private final FlowSession session;
  private final List<FlowMessage> messages = new ArrayList<>();
  private final List<FlowState> transitions = new ArrayList<>();
  private FlowPlan plan;
  private FlowState state;
  private FlowToken restoredFrom;

  FlowExecutor(FlowEngine engine, Flow flow, FlowRequest request) {
    this.engine = engine;
    this.flow = flow;
    this.request = request;
    this.session = request.session();
    transition(FlowState.AWAITING_CHALLENGE);
  }

  /**
   * Handle the client asking what to show for this flow.
   */
  @Nonnull
  public FlowResponse get() {
    String tokenKey = request.query(QS_KEY_TOKEN);
    if (tokenKey != null) {
      FlowPlan restored = restore(tokenKey);
      if (restored != null) {
        plan = restored;
        session.put(SESSION_KEY_GET, request.queryJson());
        transition(FlowState.RESTORED);
      }
    }

    if (plan == null) {
      plan = loadPlan();
    }
    if (plan == null) {
      plan = engine.planner().plan(flow, request);
      if (plan == null) {
        log.debug("Planner refused to start flow {}", flow.slug());
        return stageInvalid("You are not allowed to start this flow.");
      }
      log.debug("Started {}", plan);
    }

    FlowResponse response = enterCurrent();
    if (restoredFrom != null && !engine.tokens().consume(restoredFrom)) {
      log.warn("{} was used by another request while this one was restoring it", restoredFrom);
      messages.clear();
      return stageInvalid("This link has expired.");
    }
    return response;
  }

  /**
   * Handle the client answering the current challenge.
   */
  @Nonnull
  public FlowResponse post(@Nullable JsonObject response) {
    plan = loadPlan();
    if (plan == null) {
      log.debug("Response submitted for flow {} but there is no plan in the session", flow.slug());
      return stageInvalid("There is no flow in progress.");
    }
    if (plan.isCompleted()) {
      return complete();
    }

    StageBinding binding = plan.currentStage();
    Stage stage = engine.stages().get(binding.kind());
    if (stage == null) {
      log.error("No stage registered for kind '{}' used by {} in flow {}", binding.kind(), binding.name(),
          flow.slug());
      return stageInvalid("This flow is not configured correctly.");
    }

    JsonObject body = response == null ? new JsonObject() : response;
    StageContext ctx = new StageContext(this, binding);
    ValidationResult validation = stage.validate(ctx, body);
    log.debug("Response to {} was {}", binding, validation);
    StageResult result = validation.isAccepted() ? stage.onValid(ctx, body) : stage.onInvalid(ctx, validation);
    return apply(stage, ctx, result);
  }

  /**
   * The current stage is satisfied: advance the plan and enter whatever comes
   * next. Stages normally report this by returning {@link StageResult#advance()}.
   */
  @Nonnull
  public FlowResponse stageOk() {
    if (plan == null || plan.isCompleted()) {
      throw new IllegalStateException("There is no active stage to complete");
    }
    log.debug("Stage {} of flow {} is done", plan.currentStage(), flow.slug());
    transition(FlowState.STAGE_OK);

    // Coming back through a link satisfies only the stage that issued it
    session.remove(SESSION_KEY_GET);
    plan.remove(FlowPlan.IS_RESTORED);

    plan.advance();
    return enterCurrent();
  }

  /**
   * The flow cannot continue: cancel it and tell the user why. Stages
   * normally report this by returning {@link StageResult#deny(String)}.
   */
  @Nonnull
  public FlowResponse stageInvalid(String reason) {
    log.debug("Flow {} denied: {}", flow.slug(), reason);
    transition(FlowState.STAGE_INVALID);
    cancel();
    return new FlowResponse(flow.slug(), state, null, messages, reason);
  }

  /**
   * Forget the plan in progress.
   */
  public void cancel() {
    session.remove(SESSION_KEY_PLAN);
    session.remove(SESSION_KEY_GET);
  }

  public Flow flow() {
    return flow;
  }

  /**
   * @return the plan being executed, or null before one is loaded or created
   */
  @Nullable
  public FlowPlan plan() {
    return plan;
  }

  public FlowRequest request() {
    return request;
  }

  public FlowState state() {
    return state;
  }

  /**
   * Every state this executor passed through, in order.
   */
  public List<FlowState> transitions() {
    return Collections.unmodifiableList(transitions);
  }

  void addMessage(FlowMessage message) {
    messages.add(message);
  }

  private FlowResponse enterCurrent() {
    if (plan.isCompleted()) {
      return complete();
    }

    StageBinding binding = plan.currentStage();
    Stage stage = engine.stages().get(binding.kind());
    if (stage == null) {
      log.error("No stage registered for kind '{}' used by {} in flow {}", binding.kind(), binding.name(),
          flow.slug());
      return stageInvalid("This flow is not configured correctly.");
    }

    StageContext ctx = new StageContext(this, binding);
    return apply(stage, ctx, stage.enter(ctx));
  }

  private FlowResponse apply(Stage stage, StageContext ctx, StageResult result) {
    switch (result.action()) {
    case ADVANCE:
      return stageOk();
    case DENY:
      return stageInvalid(result.reason());
    case REPROMPT:
      transition(FlowState.STAGE_INVALID);
      return render(stage.challenge(ctx).withErrors(result.rejection()));
    case CHALLENGE:
    default:
      transition(FlowState.AWAITING_RESPONSE);
      return render(stage.challenge(ctx));
    }
  }

  private FlowResponse render(Challenge challenge) {
    session.put(SESSION_KEY_PLAN, FlowPlanCodec.encode(plan));
    return new FlowResponse(flow.slug(), state, challenge, messages, null);
  }

  private FlowResponse complete() {
    transition(FlowState.COMPLETED);
    cancel();
    log.info("Flow {} completed", flow.slug());
    return new FlowResponse(flow.slug(), state, null, messages, null);
  }

  @Nullable
  private FlowPlan loadPlan() {
    String snapshot = session.get(SESSION_KEY_PLAN);
    if (snapshot == null) {
      return null;
    }

    FlowPlan loaded;
    try {
      loaded = FlowPlanCodec.decode(snapshot);
    } catch (PlanSnapshotException e) {
      log.warn("Discarding unreadable flow plan from the session", e);
      session.remove(SESSION_KEY_PLAN);
      return null;
    }

    if (!loaded.flowSlug().equals(flow.slug())) {
      log.debug("Session holds a plan for flow {}, not {}", loaded.flowSlug(), flow.slug());
      return null;
    }
    return loaded;
  }

  @Nullable
  private FlowPlan restore(String key) {
    TokenRedemption redemption = engine.tokens().inspect(key);
    switch (redemption.status()) {
    case NOT_FOUND:
      log.debug("No flow token matches the presented key");
      addMessage(FlowMessage.error("This link is not valid."));
      return null;
    case EXPIRED:
      log.debug("Presented {} is expired", redemption.token());
      addMessage(FlowMessage.error("This link has expired."));
      return null;
    default:
      break;
    }

    FlowToken token = redemption.token();
    if (!token.flowSlug().equals(flow.slug())) {
      log.warn("Presented {} belongs to flow {}, not {}", token, token.flowSlug(), flow.slug());
      addMessage(FlowMessage.error("This link is not valid."));
      return null;
    }

    FlowPlan restored;
    try {
      restored = token.plan();
    } catch (PlanSnapshotException e) {
      log.warn("Unable to restore the plan stored in " + token, e);
      addMessage(FlowMessage.error("This link is not valid."));
      return null;
    }

    restored.put(FlowPlan.IS_RESTORED, true);
    restoredFrom = token;
    log.info("Restored {} from {}", restored, token);
    return restored;
  }

  private void transition(FlowState next) {
    state = next;
    transitions.add(next);
  }
}
