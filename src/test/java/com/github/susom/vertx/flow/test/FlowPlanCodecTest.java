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
import com.github.susom.vertx.flow.FlowPlanCodec;
import com.github.susom.vertx.flow.PlanSnapshotException;
import com.github.susom.vertx.flow.StageBinding;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static org.junit.Assert.*;

@RunWith(JUnit4.class)
public class FlowPlanCodecTest {
  private FlowPlan plan() {
    return new FlowPlan("enroll", Arrays.asList(
        new StageBinding("identify", "prompt"),
        new StageBinding("verify", "email", new JsonObject().put("token_expiry", 15).put("subject", "Hi"))));
  }

  @Test
  public void snapshotKeepsPositionAndContext() {
    Map<String, Object> address = new LinkedHashMap<>();
    address.put("city", "Palo Alto");
    address.put("zip", 94305);
    address.put("lines", Arrays.asList("450 Serra Mall", 2));
    FlowPlan plan = plan();
    plan.advance();
    plan.put(FlowPlan.PENDING_USER, "u-alice")
        .put("email_sent", true)
        .put("attempts", 2)
        .put("profile", new JsonObject().put("locale", "de"))
        .put("groups", new JsonArray().add("staff"))
        .put("since", 1772355600000L)
        .put("score", 0.5f)
        .put("address", address);

    FlowPlan copy = FlowPlanCodec.decode(FlowPlanCodec.encode(plan));

    assertEquals(plan.context(), copy.context());

    assertEquals("enroll", copy.flowSlug());
    assertEquals(1, copy.cursor());
    assertEquals(plan.stages(), copy.stages());
    assertEquals(15, (int) copy.currentStage().config().getInteger("token_expiry"));
    assertEquals("u-alice", copy.getString(FlowPlan.PENDING_USER));
    assertEquals(true, copy.get("email_sent"));
    assertEquals(2L, copy.get("attempts"));
    assertEquals(1772355600000L, copy.get("since"));
    assertEquals(0.5d, copy.get("score"));
    JsonObject restoredAddress = (JsonObject) copy.get("address");
    assertEquals(94305L, restoredAddress.getValue("zip"));
    assertEquals(2L, restoredAddress.getJsonArray("lines").getValue(1));
    assertEquals("de", ((JsonObject) copy.get("profile")).getString("locale"));
    assertEquals("staff", ((JsonArray) copy.get("groups")).getString(0));

    // Independent of the original
    copy.put("email_sent", false);
    assertEquals(true, plan.get("email_sent"));
  }

  @Test
  public void snapshotOfCompletedPlan() {
    FlowPlan plan = plan();
    plan.advance();
    plan.advance();

    assertTrue(FlowPlanCodec.decode(FlowPlanCodec.encode(plan)).isCompleted());
  }

  @Test
  public void snapshotIsVersioned() {
    JsonObject json = FlowPlanCodec.toJson(plan());

    assertEquals(FlowPlanCodec.VERSION, (int) json.getInteger("v"));
    assertEquals("enroll", json.getString("flow"));
    assertEquals(0, (int) json.getInteger("cursor"));
  }

  @Test
  public void rejectsValuesThatAreNotJson() {
    FlowPlan plan = plan();

    try {
      plan.put("thread", new Object());
      fail("Should have rejected the context value");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().startsWith("Plan context value for 'thread' cannot be serialized"));
    }
    try {
      plan.put("nested", new JsonObject().put("thread", new Object()));
      fail("Should have rejected the nested context value");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().startsWith("Plan context value for 'nested' cannot be serialized"));
    }
    assertFalse(plan.has("thread"));
  }

  @Test
  public void rejectsBadSnapshots() {
    JsonObject good = FlowPlanCodec.toJson(plan());

    assertRejected(null);
    assertRejected("");
    assertRejected("not json");
    assertRejected("[]");
    assertRejected(good.copy().put("v", 2).encode());
    assertRejected(good.copy().put("v", "one").encode());
    assertRejected(good.copy().put("cursor", 7).encode());
    assertRejected(good.copy().put("stages", "identify").encode());
    assertRejected(good.copy().put("stages", new JsonArray().add(new JsonObject().put("name", "x"))).encode());
    JsonObject missingContext = good.copy();
    missingContext.remove("context");
    assertRejected(missingContext.encode());
  }

  private void assertRejected(String snapshot) {
    try {
      FlowPlanCodec.decode(snapshot);
      fail("Should have rejected " + snapshot);
    } catch (PlanSnapshotException e) {
      // Good
    }
  }
}
