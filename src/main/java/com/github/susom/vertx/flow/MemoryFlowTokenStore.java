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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token store kept in the JVM heap. Suitable for a single server process and
 * for tests. Tokens are lost on restart.
 *
 * <p>All operations synchronize on the store, which gives the atomic
 * get-or-create, rotate and consume the interface requires.</p>
 */
public class MemoryFlowTokenStore implements FlowTokenStore {
  private static final Logger log = LoggerFactory.getLogger(MemoryFlowTokenStore.class);
  private final Map<String, FlowToken> byIdentifier = new HashMap<>();
  private final Map<String, String> identifierByKey = new HashMap<>();
  private final TokenGenerator keys;
  private final Clock clock;

  public MemoryFlowTokenStore(TokenGenerator keys, Clock clock) {
    this.keys = keys;
    this.clock = clock;
  }

  @Nonnull
  @Override
  public synchronized FlowToken getOrCreate(@Nonnull String identifier, @Nonnull String owner, @Nonnull FlowPlan plan,
                                            @Nonnull Duration ttl) {
    FlowToken existing = byIdentifier.get(identifier);
    if (existing != null) {
      return existing;
    }

    FlowToken token = new FlowToken(identifier, newKey(), plan.flowSlug(), owner, clock.instant().plus(ttl),
        FlowPlanCodec.encode(plan));
    byIdentifier.put(identifier, token);
    identifierByKey.put(token.key(), identifier);
    log.debug("Created {}", token);
    return token;
  }

  @Nullable
  @Override
  public synchronized FlowToken findByIdentifier(@Nonnull String identifier) {
    return byIdentifier.get(identifier);
  }

  @Nonnull
  @Override
  public synchronized TokenRedemption inspect(@Nonnull String key) {
    String identifier = identifierByKey.get(key);
    if (identifier == null) {
      return TokenRedemption.notFound();
    }

    FlowToken token = byIdentifier.get(identifier);
    if (token.isExpired(clock.instant())) {
      return TokenRedemption.expired(token);
    }
    return TokenRedemption.valid(token);
  }

  @Override
  public synchronized boolean consume(@Nonnull FlowToken token) {
    FlowToken current = byIdentifier.get(token.identifier());
    Instant now = clock.instant();
    if (current == null || !current.key().equals(token.key()) || !current.expires().equals(token.expires())
        || current.isExpired(now)) {
      log.debug("Unable to consume {}, the stored token is now {}", token, current);
      return false;
    }

    byIdentifier.put(current.identifier(), current.withExpires(now));
    return true;
  }

  @Nonnull
  @Override
  public FlowToken rotate(@Nonnull FlowToken token, @Nonnull Duration ttl) {
    return rotate(token, ttl, null);
  }

  @Nonnull
  @Override
  public synchronized FlowToken rotate(@Nonnull FlowToken token, @Nonnull Duration ttl, FlowPlan plan) {
    FlowToken current = byIdentifier.get(token.identifier());
    if (current == null) {
      throw new IllegalStateException("No token stored for identifier " + token.identifier());
    }
    if (!current.key().equals(token.key())) {
      log.debug("Token {} was already rotated, returning {}", token.identifier(), current);
      return current;
    }

    Instant expires = clock.instant().plus(ttl);
    if (!expires.isAfter(current.expires())) {
      expires = current.expires().plus(ttl);
    }
    String snapshot = plan == null ? current.planSnapshot() : FlowPlanCodec.encode(plan);
    FlowToken rotated = current.withKey(newKey(), expires, snapshot);

    identifierByKey.remove(current.key());
    identifierByKey.put(rotated.key(), rotated.identifier());
    byIdentifier.put(rotated.identifier(), rotated);
    log.debug("Rotated {} to {}", current, rotated);
    return rotated;
  }

  private String newKey() {
    String key = keys.create();
    while (identifierByKey.containsKey(key)) {
      key = keys.create();
    }
    return key;
  }
}
