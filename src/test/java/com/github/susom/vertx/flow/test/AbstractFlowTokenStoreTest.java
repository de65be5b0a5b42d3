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
package com.github.susom.vertx.flow.test;

import com.github.susom.vertx.flow.FlowPlan;
import com.github.susom.vertx.flow.FlowToken;
import com.github.susom.vertx.flow.FlowTokenStore;
import com.github.susom.vertx.flow.StageBinding;
import com.github.susom.vertx.flow.TokenGenerator;
import com.github.susom.vertx.flow.TokenRedemption;
import com.github.susom.vertx.flow.TokenRedemption.Status;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Behavior every token store must have. Subclasses provide the store.
 */
public abstract class AbstractFlowTokenStoreTest {
  protected static final Duration TTL = Duration.ofMinutes(16);
  protected TestClock clock;
  protected FlowTokenStore store;

  protected abstract FlowTokenStore createStore(TokenGenerator keys, Clock clock) throws Exception;

  @Before
  public void setUpStore() throws Exception {
    clock = new TestClock();
    store = createStore(new TokenGenerator(new SecureRandom()), clock);
  }

  protected FlowPlan plan() {
    FlowPlan plan = new FlowPlan("enroll", Arrays.asList(new StageBinding("identify", "test"),
        new StageBinding("verify", "email")));
    plan.advance();
    plan.put(FlowPlan.PENDING_USER, "u-alice");
    return plan;
  }

  @Test
  public void getOrCreateIsIdempotent() {
    FlowToken first = store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);
    FlowToken second = store.getOrCreate("stage-email-alice", "u-alice", plan().put("other", 1), TTL);

    assertEquals(first.key(), second.key());
    assertEquals(first.expires(), second.expires());
    assertEquals(first.planSnapshot(), second.planSnapshot());
    assertEquals(FlowToken.KEY_LENGTH, first.key().length());
    assertEquals("enroll", first.flowSlug());
    assertEquals("u-alice", first.owner());
  }

  @Test
  public void findByIdentifier() {
    assertNull(store.findByIdentifier("stage-email-alice"));

    FlowToken created = store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);
    FlowToken found = store.findByIdentifier("stage-email-alice");

    assertNotNull(found);
    assertEquals(created.key(), found.key());
    assertNull(store.findByIdentifier("stage-email-bob"));
  }

  @Test
  public void expiredTokenIsReturnedUnchanged() {
    FlowToken created = store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);
    clock.advance(Duration.ofHours(2));

    FlowToken again = store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);

    assertEquals(created.key(), again.key());
    assertEquals(created.expires(), again.expires());
    assertTrue(again.isExpired(clock.instant()));
  }

  @Test
  public void emailStageScenario() {
    FlowToken a = store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);
    assertEquals(clock.instant().plus(TTL), a.expires());
    assertFalse(a.isExpired(clock.instant()));

    FlowToken same = store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);
    assertEquals(a.key(), same.key());

    clock.advance(Duration.ofMinutes(17));
    FlowToken found = store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);
    assertTrue(found.isExpired(clock.instant()));

    FlowToken b = store.rotate(found, TTL);
    assertEquals("stage-email-alice", b.identifier());
    assertNotEquals(a.key(), b.key());
    assertEquals(clock.instant().plus(TTL), b.expires());
    assertFalse(b.isExpired(clock.instant()));
    assertEquals(b.key(), store.findByIdentifier("stage-email-alice").key());
  }

  @Test
  public void rotationKeepsIdentifierAndSnapshot() {
    FlowToken before = store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);

    FlowToken after = store.rotate(before, TTL);

    assertEquals(before.identifier(), after.identifier());
    assertNotEquals(before.key(), after.key());
    assertTrue(after.expires().isAfter(before.expires()));
    assertEquals(before.planSnapshot(), after.planSnapshot());
    assertEquals(before.owner(), after.owner());
  }

  @Test
  public void rotationWithPlanReplacesSnapshot() {
    FlowToken before = store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);
    clock.advance(Duration.ofMinutes(20));

    FlowToken after = store.rotate(before, TTL, plan().put("email", "alice@example.org"));

    assertEquals("alice@example.org", after.plan().getString("email"));
    assertEquals("alice@example.org", store.findByIdentifier("stage-email-alice").plan().getString("email"));
  }

  @Test
  public void losingRotationGetsTheWinningToken() {
    FlowToken original = store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);
    clock.advance(Duration.ofMinutes(17));

    FlowToken winner = store.rotate(original, TTL);
    FlowToken loser = store.rotate(original, TTL);

    assertEquals(winner.key(), loser.key());
    assertEquals(winner.expires(), loser.expires());
    assertEquals(winner.key(), store.findByIdentifier("stage-email-alice").key());
    assertEquals(Status.NOT_FOUND, store.redeem(original.key()).status());
  }

  @Test
  public void redeemRestoresPlanOnce() {
    FlowToken token = store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);
    clock.advance(Duration.ofMinutes(3));

    TokenRedemption first = store.redeem(token.key());
    assertEquals(Status.REDEEMED, first.status());
    assertTrue(first.isRedeemed());
    FlowPlan restored = first.token().plan();
    assertEquals("enroll", restored.flowSlug());
    assertEquals(1, restored.cursor());
    assertEquals("u-alice", restored.getString(FlowPlan.PENDING_USER));

    TokenRedemption second = store.redeem(token.key());
    assertEquals(Status.EXPIRED, second.status());
    assertFalse(second.isRedeemed());
  }

  @Test
  public void redeemUnknownKey() {
    store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);

    TokenRedemption redemption = store.redeem("nosuchkey");

    assertEquals(Status.NOT_FOUND, redemption.status());
    assertNull(redemption.token());
  }

  @Test
  public void expiredTokenCannotBeRedeemed() {
    FlowToken token = store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);
    clock.advance(TTL);

    TokenRedemption redemption = store.redeem(token.key());

    assertEquals(Status.EXPIRED, redemption.status());
    assertEquals(token.identifier(), redemption.token().identifier());
    // Still expired, still not redeemable
    assertEquals(Status.EXPIRED, store.redeem(token.key()).status());
  }

  @Test
  public void redeemedTokenCanBeRotatedForANewLink() {
    FlowToken token = store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);
    store.redeem(token.key());

    FlowToken consumed = store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);
    assertTrue(consumed.isExpired(clock.instant()));

    clock.advance(Duration.ofSeconds(1));
    FlowToken fresh = store.rotate(consumed, TTL);
    assertEquals(Status.REDEEMED, store.redeem(fresh.key()).status());
  }

  @Test
  public void inspectLeavesTokenUntouched() {
    FlowToken token = store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);

    TokenRedemption inspected = store.inspect(token.key());
    assertEquals(Status.VALID, inspected.status());
    assertEquals(Status.VALID, store.inspect(token.key()).status());
    assertEquals(token.expires(), store.findByIdentifier("stage-email-alice").expires());

    assertTrue(store.consume(inspected.token()));
    assertFalse(store.consume(inspected.token()));
    assertEquals(Status.EXPIRED, store.inspect(token.key()).status());
    assertEquals(Status.NOT_FOUND, store.inspect("nosuchkey").status());
  }

  @Test
  public void consumeFailsAfterRotation() {
    FlowToken token = store.getOrCreate("stage-email-alice", "u-alice", plan(), TTL);
    TokenRedemption inspected = store.inspect(token.key());

    FlowToken rotated = store.rotate(token, TTL);

    assertFalse(store.consume(inspected.token()));
    assertEquals(Status.VALID, store.inspect(rotated.key()).status());
  }
}
