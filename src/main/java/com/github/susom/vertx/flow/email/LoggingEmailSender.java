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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes emails to the log instead of sending them. Intended for development
 * environments without a mail service.
 */
public class LoggingEmailSender implements EmailSender {
  private static final Logger log = LoggerFactory.getLogger(LoggingEmailSender.class);

  @Override
  public void send(EmailStageConfig stage, EmailMessage message) {
    log.warn("Here is your email:\nTo: {}\nSubject: {}\nLink: {}", message.to(), message.subject(),
        message.context().getString("url"));
  }
}
