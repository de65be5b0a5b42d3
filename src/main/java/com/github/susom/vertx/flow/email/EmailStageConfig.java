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

import com.github.susom.vertx.flow.StageBinding;
import io.vertx.core.json.JsonObject;

/**
 * Settings of one email stage instance, read from the binding configuration:
 *
 * <pre>
 *   {
 *     "subject": "Verify your email",
 *     "template": "email/account_confirmation.html",
 *     "token_expiry": 30,
 *     "activate_user_on_success": false
 *   }
 * </pre>
 */
public class EmailStageConfig {
  public static final String DEFAULT_SUBJECT = "Verify your email";
  public static final String DEFAULT_TEMPLATE = "email/account_confirmation.html";
  public static final int DEFAULT_TOKEN_EXPIRY_MINUTES = 30;

  private final String stageName;
  private final String subject;
  private final String template;
  private final int tokenExpiryMinutes;
  private final boolean activateUserOnSuccess;

  public EmailStageConfig(String stageName, String subject, String template, int tokenExpiryMinutes,
                          boolean activateUserOnSuccess) {
    if (tokenExpiryMinutes < 1) {
      throw new IllegalArgumentException("Email stage " + stageName + " must have a positive token_expiry");
    }
    this.stageName = stageName;
    this.subject = subject;
    this.template = template;
    this.tokenExpiryMinutes = tokenExpiryMinutes;
    this.activateUserOnSuccess = activateUserOnSuccess;
  }

  public static EmailStageConfig from(StageBinding binding) {
    JsonObject config = binding.config();
    Integer expiry;
    try {
      expiry = config.getInteger("token_expiry", DEFAULT_TOKEN_EXPIRY_MINUTES);
    } catch (ClassCastException e) {
      throw new IllegalArgumentException("Email stage " + binding.name() + " has a non-numeric token_expiry", e);
    }
    return new EmailStageConfig(binding.name(),
        config.getString("subject", DEFAULT_SUBJECT),
        config.getString("template", DEFAULT_TEMPLATE),
        expiry,
        config.getBoolean("activate_user_on_success", false));
  }

  public String stageName() {
    return stageName;
  }

  public String subject() {
    return subject;
  }

  public String template() {
    return template;
  }

  /**
   * How long the link in the email is advertised as valid.
   */
  public int tokenExpiryMinutes() {
    return tokenExpiryMinutes;
  }

  public boolean activateUserOnSuccess() {
    return activateUserOnSuccess;
  }
}
