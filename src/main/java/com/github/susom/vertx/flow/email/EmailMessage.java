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

import io.vertx.core.json.JsonObject;
import java.util.Locale;

/**
 * A templated email ready for delivery. Rendering the template with the
 * context is up to the {@link EmailSender}.
 */
public class EmailMessage {
  private final String subject;
  private final String to;
  private final Locale language;
  private final String template;
  private final JsonObject context;

  public EmailMessage(String subject, String to, Locale language, String template, JsonObject context) {
    this.subject = subject;
    this.to = to;
    this.language = language;
    this.template = template;
    this.context = context;
  }

  public String subject() {
    return subject;
  }

  public String to() {
    return to;
  }

  public Locale language() {
    return language;
  }

  public String template() {
    return template;
  }

  /**
   * Values for the template: "url" (the resume link), "user" and "expires".
   */
  public JsonObject context() {
    return context;
  }

  @Override
  public String toString() {
    return "EmailMessage{to=" + to + " subject=" + subject + " template=" + template + "}";
  }
}
