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

import com.github.susom.vertx.flow.TokenRedemption.Status;
import java.time.Duration;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Storage for flow resumption tokens. This is the only state shared between
 * independent flows, so every implementation must make the three mutating
 * operations atomic with respect to each other.
 *
 * <p>Tokens are never deleted here. Expiry is a timestamp comparison, and
 * removing old rows is left to whatever housekeeping the host runs.</p>
 *
 * <p>Storage failures are reported as {@link FlowStorageException}. A
 * missing token is never an exception.</p>
 */
public interface FlowTokenStore {
  /**
   * Find the token for this identifier, creating one bound to a snapshot of
   * the plan if there is none. An existing token is returned exactly as
   * stored, even if it has expired. Callers decide whether to rotate it.
   *
   * @param identifier deterministic identifier (usually derived from stage and user)
   * @param owner id of the user the token is issued to
   * @param plan the plan to snapshot if a token is created
   * @param ttl lifetime of a newly created token
   */
  @Nonnull
  FlowToken getOrCreate(@Nonnull String identifier, @Nonnull String owner, @Nonnull FlowPlan plan,
                        @Nonnull Duration ttl);

  @Nullable
  FlowToken findByIdentifier(@Nonnull String identifier);

  /**
   * Look up the token for a key taken from a resumption link without changing
   * it. The result is {@link Status#VALID} if the token could be consumed now.
   */
  @Nonnull
  TokenRedemption inspect(@Nonnull String key);

  /**
   * Use up a token previously returned by {@link #inspect(String)} by setting
   * its expiry to now. This only happens if the stored token still has the
   * same key and expiry it was inspected with, and has not expired since.
   *
   * @return true if this call consumed the token, false if it was consumed,
   *         rotated or expired in the meantime
   */
  boolean consume(@Nonnull FlowToken token);

  /**
   * Present a key taken from a resumption link. A valid token is consumed
   * (its expiry is set to now) so the same link cannot restore a plan twice.
   * Expired tokens are reported but never redeemed.
   */
  @Nonnull
  default TokenRedemption redeem(@Nonnull String key) {
    TokenRedemption found = inspect(key);
    if (found.status() != Status.VALID) {
      return found;
    }
    if (consume(found.token())) {
      return TokenRedemption.redeemed(found.token());
    }
    return TokenRedemption.expired(found.token());
  }

  /**
   * Replace the key of a token and push its expiry out to now + ttl, keeping
   * the identifier and the plan snapshot. If another caller rotated the same
   * token first, the token they stored is returned instead and the key
   * generated here is discarded.
   */
  @Nonnull
  FlowToken rotate(@Nonnull FlowToken token, @Nonnull Duration ttl);

  /**
   * Same as {@link #rotate(FlowToken, Duration)} but the stored plan snapshot
   * is replaced with a snapshot of the provided plan.
   */
  @Nonnull
  FlowToken rotate(@Nonnull FlowToken token, @Nonnull Duration ttl, @Nonnull FlowPlan plan);
}
