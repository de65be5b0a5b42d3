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

import java.util.Locale;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The parts of a user account that flows care about. Instances are
 * immutable; use {@link UserStore#setActive(String, boolean)} to change
 * the stored account.
 */
public class FlowUser {
  private final String id;
  private final String username;
  private final String email;
  private final Locale locale;
  private final boolean active;

  public FlowUser(@Nonnull String id, @Nonnull String username, @Nullable String email, @Nullable Locale locale,
                  boolean active) {
    this.id = Objects.requireNonNull(id);
    this.username = Objects.requireNonNull(username);
    this.email = email;
    this.locale = locale == null ? Locale.ENGLISH : locale;
    this.active = active;
  }

  public String id() {
    return id;
  }

  public String username() {
    return username;
  }

  @Nullable
  public String email() {
    return email;
  }

  public Locale locale() {
    return locale;
  }

  public boolean isActive() {
    return active;
  }

  public FlowUser withActive(boolean newActive) {
    return new FlowUser(id, username, email, locale, newActive);
  }

  @Override
  public String toString() {
    return "FlowUser{" + id + " " + username + (active ? "" : " inactive") + "}";
  }
}
