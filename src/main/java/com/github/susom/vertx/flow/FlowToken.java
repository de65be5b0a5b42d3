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

import java.time.Instant;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * A credential that lets a user resume a flow from outside the browser
 * session that started it (for example by clicking a link in an email).
 *
 * <p>The identifier is derived from what the token is for (stage and user),
 * so there is at most one token per identifier. The key is the random,
 * unguessable value that goes into the link. Instances are immutable; the
 * store hands out a new instance when it rotates the key.</p>
 */
public class FlowToken {
  /** Length of generated keys in characters. */
  public static final int KEY_LENGTH = 60;

  private final String identifier;
  private final String key;
  private final String flowSlug;
  private final String owner;
  private final Instant expires;
  private final String planSnapshot;

  public FlowToken(@Nonnull String identifier, @Nonnull String key, @Nonnull String flowSlug, @Nonnull String owner,
                   @Nonnull Instant expires, @Nonnull String planSnapshot) {
    this.identifier = Objects.requireNonNull(identifier);
    this.key = Objects.requireNonNull(key);
    this.flowSlug = Objects.requireNonNull(flowSlug);
    this.owner = Objects.requireNonNull(owner);
    this.expires = Objects.requireNonNull(expires);
    this.planSnapshot = Objects.requireNonNull(planSnapshot);
  }

  public String identifier() {
    return identifier;
  }

  public String key() {
    return key;
  }

  public String flowSlug() {
    return flowSlug;
  }

  /**
   * The id of the user this token was issued to.
   */
  public String owner() {
    return owner;
  }

  public Instant expires() {
    return expires;
  }

  public String planSnapshot() {
    return planSnapshot;
  }

  /**
   * A token is expired from the instant of its expiry onward.
   */
  public boolean isExpired(@Nonnull Instant now) {
    return !expires.isAfter(now);
  }

  /**
   * Rehydrate the plan this token was issued for. Each call returns a new,
   * independent plan instance.
   *
   * @throws PlanSnapshotException if the stored snapshot is not readable
   */
  @Nonnull
  public FlowPlan plan() {
    return FlowPlanCodec.decode(planSnapshot);
  }

  FlowToken withKey(String newKey, Instant newExpires, String newSnapshot) {
    return new FlowToken(identifier, newKey, flowSlug, owner, newExpires, newSnapshot);
  }

  FlowToken withExpires(Instant newExpires) {
    return new FlowToken(identifier, key, flowSlug, owner, newExpires, planSnapshot);
  }

  @Override
  public String toString() {
    // Never log the full key
    return "FlowToken{" + identifier + " key=" + key.substring(0, Math.min(4, key.length())) + "... expires="
        + expires + "}";
  }
}
