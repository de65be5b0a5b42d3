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
import java.util.Locale;

/**
 * A one-time notice for the user, returned alongside the next response.
 */
public class FlowMessage {
  public enum Level {
    SUCCESS, INFO, WARNING, ERROR
  }

  private final Level level;
  private final String text;

  public FlowMessage(Level level, String text) {
    this.level = level;
    this.text = text;
  }

  public static FlowMessage success(String text) {
    return new FlowMessage(Level.SUCCESS, text);
  }

  public static FlowMessage error(String text) {
    return new FlowMessage(Level.ERROR, text);
  }

  public Level level() {
    return level;
  }

  public String text() {
    return text;
  }

  public JsonObject toJson() {
    return new JsonObject().put("level", level.name().toLowerCase(Locale.ROOT)).put("text", text);
  }

  @Override
  public String toString() {
    return level + ": " + text;
  }
}
