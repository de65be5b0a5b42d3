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

import com.github.susom.database.Config;
import io.vertx.core.Vertx;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.Session;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.SessionHandler;
import io.vertx.ext.web.sstore.LocalSessionStore;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import static com.github.susom.vertx.flow.FlowVertx.executeBlocking;
import static com.github.susom.vertx.flow.FlowVertx.sendJson;

/**
 * HTTP interface to the flow executor:
 *
 * <pre>
 *   GET  {flow.api.path}/{slug}/executor   enter the current stage and get its challenge
 *   POST {flow.api.path}/{slug}/executor   submit a JSON response to the current challenge
 * </pre>
 *
 * <p>The default path is "/api/v1/flows". Plans are kept in a Vert.x web
 * session. Each executor call runs on a worker thread because stages and
 * token stores may block.</p>
 *
 * <p>Changes a stage makes to the session are only copied into the Vert.x
 * session if the call completes successfully.</p>
 */
public class FlowRouter {
  private static final Logger log = LoggerFactory.getLogger(FlowRouter.class);
  private final Vertx vertx;
  private final FlowEngine engine;
  private final String apiPath;
  private final long bodyLimitBytes;
  private final long sessionTimeoutMillis;

  public FlowRouter(Vertx vertx, FlowEngine engine, Function<String, String> keyToValueConfig) {
    Config config = Config.from().custom(keyToValueConfig::apply).get();
    this.vertx = vertx;
    this.engine = engine;
    String path = config.getString("flow.api.path", "/api/v1/flows");
    this.apiPath = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    this.bodyLimitBytes = config.getLong("flow.body.limit.bytes", 16000L);
    this.sessionTimeoutMillis = config.getLong("flow.session.timeout.minutes", 30L) * 60000L;
  }

  /**
   * Add the flow routes to an existing router.
   */
  public Router configure(Router router) {
    SessionHandler sessionHandler = SessionHandler.create(LocalSessionStore.create(vertx))
        .setSessionTimeout(sessionTimeoutMillis);

    router.route(apiPath + "/*").handler(sessionHandler);
    router.get(apiPath + "/:slug/executor").handler(this::handleGet).failureHandler(FlowVertx::jsonApiFail);
    router.post(apiPath + "/:slug/executor")
        .handler(BodyHandler.create(false).setBodyLimit(bodyLimitBytes))
        .handler(this::handlePost)
        .failureHandler(FlowVertx::jsonApiFail);
    log.debug("Flow executor is available at {}/:slug/executor", apiPath);
    return router;
  }

  public String apiPath() {
    return apiPath;
  }

  private void handleGet(RoutingContext rc) {
    Flow flow = flowFor(rc);
    if (flow == null) {
      return;
    }

    Map<String, String> query = new LinkedHashMap<>();
    for (Entry<String, String> param : rc.queryParams()) {
      query.putIfAbsent(param.getKey(), param.getValue());
    }
    Valid.tokenKeyOpt(query.get(FlowExecutor.QS_KEY_TOKEN));

    BufferedSession session = new BufferedSession(rc.session());
    FlowRequest request = new FlowRequest(session, query);
    executeBlocking(vertx, p -> {
      FlowResponse response = engine.executor(flow, request).get();
      session.commit();
      p.complete(response.toJson());
    }, false, sendJson(rc));
  }

  private void handlePost(RoutingContext rc) {
    Flow flow = flowFor(rc);
    if (flow == null) {
      return;
    }

    JsonObject body;
    try {
      body = rc.body().asJsonObject();
    } catch (DecodeException | ClassCastException e) {
      throw new BadRequestException("Request body must be a JSON object", e);
    }

    BufferedSession session = new BufferedSession(rc.session());
    FlowRequest request = new FlowRequest(session);
    executeBlocking(vertx, p -> {
      FlowResponse response = engine.executor(flow, request).post(body);
      session.commit();
      p.complete(response.toJson());
    }, false, sendJson(rc));
  }

  private Flow flowFor(RoutingContext rc) {
    String slug = Valid.flowSlug(rc.pathParam("slug"));
    MDC.put("flow", slug);
    Flow flow = engine.flow(slug);
    if (flow == null) {
      log.debug("No flow with slug {}", slug);
      rc.fail(404);
    }
    return flow;
  }

  /**
   * Collects changes in memory until {@link #commit()} copies them into the
   * Vert.x session.
   */
  private static class BufferedSession implements FlowSession {
    private final Session session;
    private final Map<String, Object> written = new HashMap<>();
    private final Set<String> removed = new HashSet<>();

    BufferedSession(Session session) {
      this.session = Valid.nonNull(session, "No session is available for this request");
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
      if (removed.contains(key)) {
        return null;
      }
      if (written.containsKey(key)) {
        return (T) written.get(key);
      }
      return session.get(key);
    }

    @Override
    public void put(String key, Object value) {
      removed.remove(key);
      written.put(key, value);
    }

    @Override
    public void remove(String key) {
      written.remove(key);
      removed.add(key);
    }

    void commit() {
      for (String key : removed) {
        session.remove(key);
      }
      written.forEach(session::put);
    }
  }
}
