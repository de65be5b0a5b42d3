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

import com.github.susom.database.Config;
import com.github.susom.database.DatabaseProvider;
import com.github.susom.database.DatabaseProvider.Builder;
import com.github.susom.vertx.flow.DatabaseFlowTokenStore;
import com.github.susom.vertx.flow.Flow;
import com.github.susom.vertx.flow.FlowEngine;
import com.github.susom.vertx.flow.FlowPlan;
import com.github.susom.vertx.flow.FlowPlanner;
import com.github.susom.vertx.flow.FlowRouter;
import com.github.susom.vertx.flow.FlowUrls;
import com.github.susom.vertx.flow.FlowUser;
import com.github.susom.vertx.flow.MemoryUserStore;
import com.github.susom.vertx.flow.MetricsHandler;
import com.github.susom.vertx.flow.StageBinding;
import com.github.susom.vertx.flow.StageRegistry;
import com.github.susom.vertx.flow.TokenGenerator;
import com.github.susom.vertx.flow.Valid;
import com.github.susom.vertx.flow.email.EmailStage;
import com.github.susom.vertx.flow.email.LoggingEmailSender;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Collections;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.github.susom.vertx.flow.FlowVertx.rootRouter;

/**
 * Sample application for manual testing and experimentation. Open the
 * executor URL in a browser, then follow the link written to the log.
 */
public class EmailFlowSample {
  private static final Logger log = LoggerFactory.getLogger(EmailFlowSample.class);

  public static void main(String[] args) {
    try {
      Vertx vertx = Vertx.vertx();
      TokenGenerator generator = new TokenGenerator(new SecureRandom());

      int port = 8878;
      Config config = Config.from()
          .value("public.url", "http://localhost:" + port)
          .value("flow.session.timeout.minutes", "10")
          .get();

      MemoryUserStore users = new MemoryUserStore()
          .add(new FlowUser("1", "testy", "testy@example.com", Locale.US, false));
      Builder db = DatabaseProvider.fromDriverManager("jdbc:hsqldb:mem:flowsample;hsqldb.tx=mvcc")
          .withSqlParameterLogging();
      DatabaseFlowTokenStore.createSchema(db);
      DatabaseFlowTokenStore tokens = new DatabaseFlowTokenStore(db, generator, Clock.systemUTC());
      StageRegistry stages = new StageRegistry()
          .register(EmailStage.KIND, new EmailStage(tokens, users, new LoggingEmailSender(),
              new FlowUrls(config::getString), Clock.systemUTC()));
      FlowEngine engine = new FlowEngine(stages, tokens,
          FlowPlanner.withContext(request -> Collections.singletonMap(FlowPlan.PENDING_USER, "1")))
          .addFlow(new Flow("enroll", "Enroll", new StageBinding("verify", EmailStage.KIND,
              new JsonObject().put("subject", "Please confirm").put("token_expiry", 5)
                  .put("activate_user_on_success", true))));

      Router root = rootRouter(vertx);
      root.route().handler(new MetricsHandler(generator));
      FlowRouter flows = new FlowRouter(vertx, engine, config::getString);
      flows.configure(root);

      // Stand-in for the flow UI: hand the link straight to the executor
      root.get("/if/flow/:slug/").handler(rc -> {
        String query = rc.request().query();
        rc.response().setStatusCode(302).putHeader("Location", flows.apiPath() + "/" + Valid.flowSlug(rc.pathParam("slug"))
            + "/executor" + (query == null ? "" : "?" + query)).end();
      });

      vertx.createHttpServer().requestHandler(root).listen(port, "localhost", h -> {
        if (h.succeeded()) {
          int actualPort = h.result().actualPort();
          log.info("Started server on port " + actualPort + ":\n"
              + "    http://localhost:" + actualPort + "/api/v1/flows/enroll/executor\n");
        } else {
          log.error("Could not start server", h.cause());
        }
      });
    } catch (Exception e) {
      log.error("Unexpected exception in main()", e);
      System.exit(1);
    }
  }
}
