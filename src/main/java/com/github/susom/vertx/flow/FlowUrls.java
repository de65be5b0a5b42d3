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
import com.github.susom.database.ConfigMissingException;
import io.netty.handler.codec.http.QueryStringEncoder;
import java.net.URI;
import java.util.Map;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * Builds the absolute URLs users follow to get back into a flow, for example
 * from a verification email:
 *
 * <code>
 *   https://example.com/if/flow/enroll/?flow_token=abc123
 * </code>
 *
 * <p>The server root comes from configuration, either:</p>
 *
 * <code>
 *   public.url=https://example.com
 * </code>
 *
 * <p>Or, equivalently:</p>
 *
 * <code>
 *   public.proto=https
 *   public.host=example.com
 *   public.port=443
 * </code>
 *
 * <p>The path of the flow interface is taken from flow.interface.path
 * (default "if/flow/").</p>
 */
public class FlowUrls {
  public static final String DEFAULT_INTERFACE_PATH = "if/flow/";

  private final String root;
  private final String interfacePath;

  public FlowUrls(Function<String, String> keyToValueConfig) {
    Config config = Config.from().custom(keyToValueConfig::apply).get();
    root = absoluteRoot(config);
    interfacePath = normalizePath(config.getString("flow.interface.path", DEFAULT_INTERFACE_PATH));
  }

  /**
   * @return the full public URL of the server, including trailing slash
   */
  public String root() {
    return root;
  }

  /**
   * @return absolute URL of the interface page for the flow, including trailing slash
   */
  @Nonnull
  public String interfaceUrl(@Nonnull String flowSlug) {
    return root + interfacePath + flowSlug + "/";
  }

  /**
   * Absolute URL of the flow interface with the provided query parameters.
   */
  @Nonnull
  public String resumeUrl(@Nonnull String flowSlug, @Nonnull Map<String, String> params) {
    QueryStringEncoder enc = new QueryStringEncoder(interfaceUrl(flowSlug));
    params.forEach(enc::addParam);
    return enc.toString();
  }

  private static String absoluteRoot(Config config) {
    String url = config.getString("public.url");
    String proto;
    String host;
    String port;
    if (url == null) {
      proto = config.getString("public.proto");
      host = config.getString("public.host");
      port = config.getString("public.port");
      if (proto == null || host == null || port == null) {
        throw new ConfigMissingException("You must provide config property public.url or public.[proto,host,port]");
      }
    } else {
      URI uri;
      try {
        uri = URI.create(url);
      } catch (IllegalArgumentException e) {
        throw new RuntimeException("Configuration error: public.url is not a valid URL: " + url, e);
      }
      proto = uri.getScheme();
      host = uri.getHost();
      if (proto == null || host == null) {
        throw new RuntimeException("Configuration error: public.url must be an absolute URL: " + url);
      }
      if (uri.getPort() == -1) {
        port = "https".equals(proto) ? "443" : "80";
      } else {
        port = Integer.toString(uri.getPort());
      }
    }

    StringBuilder buf = new StringBuilder();
    buf.append(proto).append("://").append(host);
    switch (proto) {
    case "http":
      if (!port.equals("80")) {
        buf.append(':').append(port);
      }
      break;
    case "https":
      if (!port.equals("443")) {
        buf.append(':').append(port);
      }
      break;
    default:
      throw new RuntimeException("Configuration error: public.proto must be either http or https");
    }
    buf.append('/');
    return buf.toString();
  }

  private static String normalizePath(String path) {
    while (path.startsWith("/")) {
      path = path.substring(1);
    }
    if (!path.isEmpty() && !path.endsWith("/")) {
      path = path + "/";
    }
    return path;
  }
}
