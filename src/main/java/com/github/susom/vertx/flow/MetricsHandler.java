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

import com.github.susom.database.Metric;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Assigns each request an id in the "requestId" MDC entry and logs timing
 * for it at debug level. An id provided by a proxy in the X-REQUEST-ID
 * header is appended to ours so the logs can be correlated.
 */
public class MetricsHandler implements Handler<RoutingContext> {
  private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);
  private final String requestIdPrefix;
  private long requestId = 1;

  public MetricsHandler(TokenGenerator generator) {
    this.requestIdPrefix = generator.create(5);
  }

  public void handle(RoutingContext rc) {
    String externalRequestId = rc.request().getHeader("X-REQUEST-ID");
    if (externalRequestId == null || !externalRequestId.matches("[a-zA-Z0-9:]{1,80}")) {
      externalRequestId = "";
    } else {
      externalRequestId = ":" + externalRequestId;
    }
    // Only called on the event loop
    MDC.put("requestId", requestIdPrefix + Long.toString(requestId++, Character.MAX_RADIX) + externalRequestId);

    Metric metric = metricFor(rc);
    if (log.isDebugEnabled()) {
      log.debug("Received {} {}", rc.request().method(), rc.request().path());
    }
    rc.response().headersEndHandler(h -> metric.checkpoint("call"));
    rc.addBodyEndHandler(h -> {
      metric.done("send");
      if (log.isDebugEnabled()) {
        StringBuilder buf = new StringBuilder();
        buf.append("Served ").append(rc.response().getStatusCode()).append(": ");
        metric.printMessage(buf);
        buf.append(' ').append(rc.request().path());
        log.debug(buf.toString());
      }
    });
    rc.next();
  }

  private static Metric metricFor(RoutingContext rc) {
    Metric metric = rc.get("metric");
    if (metric == null) {
      metric = new Metric(log.isDebugEnabled());
      rc.put("metric", metric);
    }
    return metric;
  }
}
