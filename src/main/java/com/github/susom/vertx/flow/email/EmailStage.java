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
package com.github.susom.vertx.flow.email;

import com.github.susom.vertx.flow.Challenge;
import com.github.susom.vertx.flow.FlowExecutor;
import com.github.susom.vertx.flow.FlowPlan;
import com.github.susom.vertx.flow.FlowSession;
import com.github.susom.vertx.flow.FlowToken;
import com.github.susom.vertx.flow.FlowTokenStore;
import com.github.susom.vertx.flow.FlowUrls;
import com.github.susom.vertx.flow.FlowUser;
import com.github.susom.vertx.flow.Stage;
import com.github.susom.vertx.flow.StageContext;
import com.github.susom.vertx.flow.StageResult;
import com.github.susom.vertx.flow.UserStore;
import com.github.susom.vertx.flow.ValidationResult;
import io.vertx.core.json.JsonObject;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.Locale;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies the pending user controls an email address. The first time the
 * stage is shown it emails a link containing a resumption token, then waits.
 * Following the link restores the flow in whatever browser the user opens
 * it in, and this stage completes without any further input.
 *
 * <p>Any response to the challenge is treated as "send it again". The
 * challenge is never accepted.</p>
 *
 * <p>The address used is the "email" value in the plan context when it is
 * not blank (for example when the user is changing their address), otherwise
 * the address of the pending user.</p>
 */
public class EmailStage implements Stage {
  public static final String KIND = "email";
  /** Set in the plan once the first email was sent. */
  public static final String PLAN_CONTEXT_EMAIL_SENT = "email_sent";
  /** Optional address to verify instead of the one on the user account. */
  public static final String PLAN_CONTEXT_EMAIL_OVERRIDE = "email";
  public static final String COMPONENT = "flow-stage-email";
  public static final String CODE_EMAIL_SENT = "email-sent";

  private static final Logger log = LoggerFactory.getLogger(EmailStage.class);
  private static final Pattern NOT_SLUG = Pattern.compile("[^a-z0-9_\\s-]");
  private static final Pattern DASHES_AND_SPACE = Pattern.compile("[-\\s]+");
  private final FlowTokenStore tokens;
  private final UserStore users;
  private final EmailSender sender;
  private final FlowUrls urls;
  private final Clock clock;

  public EmailStage(FlowTokenStore tokens, UserStore users, EmailSender sender, FlowUrls urls, Clock clock) {
    this.tokens = tokens;
    this.users = users;
    this.sender = sender;
    this.urls = urls;
    this.clock = clock;
  }

  @Override
  public StageResult enter(StageContext ctx) {
    FlowPlan plan = ctx.plan();
    EmailStageConfig config = EmailStageConfig.from(ctx.binding());

    if (cameBackThroughLink(ctx)) {
      ctx.success("Successfully verified Email.");
      if (config.activateUserOnSuccess()) {
        String userId = plan.getString(FlowPlan.PENDING_USER);
        if (userId == null || !users.setActive(userId, true)) {
          log.warn("Unable to activate pending user {} after email verification", userId);
        } else {
          log.info("Activated user {} after email verification", userId);
        }
      }
      return StageResult.advance();
    }

    FlowUser user = pendingUser(plan);
    if (user == null) {
      log.debug("No pending user");
      return StageResult.deny("No pending user.");
    }

    if (!plan.has(PLAN_CONTEXT_EMAIL_SENT) && sendEmail(ctx, config, user)) {
      plan.put(PLAN_CONTEXT_EMAIL_SENT, true);
    }
    return StageResult.challenge();
  }

  @Override
  public Challenge challenge(StageContext ctx) {
    return Challenge.nativeChallenge(COMPONENT, "Email sent.");
  }

  @Override
  public ValidationResult validate(StageContext ctx, JsonObject response) {
    return ValidationResult.rejected(CODE_EMAIL_SENT, CODE_EMAIL_SENT);
  }

  @Override
  public StageResult onValid(StageContext ctx, JsonObject response) {
    return onInvalid(ctx, ValidationResult.rejected(CODE_EMAIL_SENT, CODE_EMAIL_SENT));
  }

  @Override
  public StageResult onInvalid(StageContext ctx, ValidationResult rejection) {
    FlowUser user = pendingUser(ctx.plan());
    if (user == null) {
      ctx.error("No pending user.");
      return StageResult.reprompt(rejection);
    }

    // Still waiting for the link to be followed
    sendEmail(ctx, EmailStageConfig.from(ctx.binding()), user);
    return StageResult.reprompt(rejection);
  }

  /**
   * Deterministic token identifier for a stage and user, in the form
   * "email-stage-{stage}-{username}" reduced to lowercase letters, digits,
   * underscores and single dashes.
   */
  @Nonnull
  public static String identifier(@Nonnull String stageName, @Nonnull String username) {
    return slugify("email-stage-" + stageName + "-" + username);
  }

  static String slugify(String value) {
    String slug = StringUtils.stripAccents(value).toLowerCase(Locale.ROOT);
    slug = NOT_SLUG.matcher(slug).replaceAll("").trim();
    slug = DASHES_AND_SPACE.matcher(slug).replaceAll("-");
    return StringUtils.strip(slug, "-_");
  }

  private boolean cameBackThroughLink(StageContext ctx) {
    JsonObject returnedWith = ctx.session().get(FlowSession.SESSION_KEY_GET);
    return returnedWith != null && returnedWith.containsKey(FlowExecutor.QS_KEY_TOKEN)
        && ctx.plan().getBoolean(FlowPlan.IS_RESTORED);
  }

  @Nullable
  private FlowUser pendingUser(FlowPlan plan) {
    String userId = plan.getString(FlowPlan.PENDING_USER);
    if (userId == null) {
      return null;
    }
    FlowUser user = users.find(userId);
    if (user == null) {
      log.warn("Pending user {} does not exist", userId);
    }
    return user;
  }

  /**
   * @return false if there was no address to send to
   */
  private boolean sendEmail(StageContext ctx, EmailStageConfig config, FlowUser user) {
    String email = ctx.plan().getString(PLAN_CONTEXT_EMAIL_OVERRIDE);
    if (StringUtils.isBlank(email)) {
      email = user.email();
    }
    if (StringUtils.isBlank(email)) {
      log.warn("Not sending verification email because {} has no email address", user);
      ctx.error("No email address to verify.");
      return false;
    }

    FlowToken token = token(ctx, config, user);
    String url = urls.resumeUrl(ctx.executor().flow().slug(),
        Collections.singletonMap(FlowExecutor.QS_KEY_TOKEN, token.key()));

    JsonObject templateContext = new JsonObject()
        .put("url", url)
        .put("user", new JsonObject()
            .put("id", user.id())
            .put("username", user.username())
            .put("email", user.email()))
        .put("expires", token.expires());
    EmailMessage message = new EmailMessage(config.subject(), email, user.locale(), config.template(),
        templateContext);

    log.debug("Sending verification email for {} using {}", user, token);
    sender.send(config, message);
    return true;
  }

  private FlowToken token(StageContext ctx, EmailStageConfig config, FlowUser user) {
    // The token outlives the advertised expiry by a minute
    Duration ttl = Duration.ofMinutes(config.tokenExpiryMinutes() + 1);
    String identifier = identifier(config.stageName(), user.username());

    FlowToken token = tokens.getOrCreate(identifier, user.id(), ctx.plan(), ttl);
    if (token.isExpired(clock.instant())) {
      log.debug("Rotating expired {}", token);
      token = tokens.rotate(token, ttl, ctx.plan());
    }
    return token;
  }
}
