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

import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.Map;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Vert.x plumbing for running flows: versions of the async functionality
 * that preserve the SLF4J MDC across event loop and worker threads, plus the
 * root router and JSON error reporting used by {@link FlowRouter}.
 */
public class FlowVertx {
  private static final Logger log = LoggerFactory.getLogger(FlowVertx.class);

  /**
   * Wrap a Handler in a way that will preserve the SLF4J MDC context.
   * The context from the current thread at the time of this method call
   * will be cached and restored within the wrapper at the time the
   * handler is invoked. This version delegates the handler call directly
   * on the thread that calls it.
   */
  public static <T> Handler<T> mdc(final Handler<T> handler) {
    final Map<String, String> mdc = MDC.getCopyOfContextMap();

    return t -> {
      Map<String, String> restore = MDC.getCopyOfContextMap();
      try {
        if (mdc == null) {
          MDC.clear();
        } else {
          MDC.setContextMap(mdc);
        }
        handler.handle(t);
      } finally {
        if (restore == null) {
          MDC.clear();
        } else {
          MDC.setContextMap(restore);
        }
      }
    };
  }

  /**
   * Same as {@link #mdc(Handler)}, but the handler is invoked using
   * {@link Context#runOnContext(Handler)} from the context calling this
   * method, so it runs on the correct event loop.
   */
  public static <T> Handler<T> mdcEventLoop(final Handler<T> handler) {
    final Map<String, String> mdc = MDC.getCopyOfContextMap();
    final Context context = Vertx.currentContext();

    return t -> context.runOnContext((v) -> {
      Map<String, String> restore = MDC.getCopyOfContextMap();
      try {
        if (mdc == null) {
          MDC.clear();
        } else {
          MDC.setContextMap(mdc);
        }
        handler.handle(t);
      } finally {
        if (restore == null) {
          MDC.clear();
        } else {
          MDC.setContextMap(restore);
        }
      }
    });
  }

  /**
   * Equivalent to {@link Vertx#executeBlocking(Handler, boolean, Handler)},
   * but preserves the {@link MDC} correctly.
   */
  public static <T> void executeBlocking(Vertx vertx, Handler<Promise<T>> blocking, boolean ordered,
                                         Handler<AsyncResult<T>> handler) {
    vertx.executeBlocking(mdc(blocking), ordered, mdcEventLoop(handler));
  }

  public static Router rootRouter(Vertx vertx) {
    Router root = Router.router(vertx);
    root.route().handler(rc -> {
      // Make sure all requests start with a clean slate for logging
      MDC.clear();
      rc.next();
    });
    return root;
  }

  public static Handler<AsyncResult<JsonObject>> sendJson(RoutingContext rc) {
    return r -> {
      if (r.succeeded() && r.result() != null) {
        rc.response().putHeader("content-type", "application/json").end(r.result().encode() + '\n');
      } else {
        jsonApiFail(rc, r.cause());
      }
    };
  }

  public static void jsonApiFail(RoutingContext rc) {
    jsonApiFail(rc, rc.failure());
  }

  public static void jsonApiFail(RoutingContext rc, Throwable t) {
    HttpServerResponse response = rc.response();

    if (isOrCausedBy(t, BadRequestException.class)) {
      log.debug("Validation error", t);
      response.setStatusCode(400).putHeader("content-type", "application/json")
          .end(new JsonObject().put("error", t.getMessage()).encode() + '\n');
    } else if (isOrCausedBy(t, FlowStorageException.class)) {
      log.error("Flow storage error", t);
      response.setStatusCode(500).putHeader("content-type", "application/json")
          .end(new JsonObject().put("error", "Unable to process the flow right now").encode() + '\n');
    } else {
      int statusCode = rc.statusCode();
      if (statusCode < 0) {
        statusCode = 500;
      }
      if (statusCode >= 500) {
        log.error("Unexpected error {}", statusCode, t);
      } else {
        log.debug("Request failed with status {}", statusCode, t);
      }

      response.setStatusCode(statusCode);
      String message = response.getStatusMessage();
      if (statusCode == 413) {
        message = "The request body is too large";
      }

      response.putHeader("content-type", "application/json").end(new JsonObject().put("error", message).encode()
          + '\n');
    }
  }

  public static boolean isOrCausedBy(Throwable top, Class<? extends Throwable> type) {
    for (Throwable t : ExceptionUtils.getThrowables(top)) {
      if (type.isAssignableFrom(t.getClass())) {
        return true;
      }
    }
    return false;
  }
}
