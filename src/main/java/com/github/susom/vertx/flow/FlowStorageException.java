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

/**
 * The token storage could not be read or written. This is fatal to the
 * request being processed; the top level handler returns a generic HTTP 500
 * and nothing from the request is committed to the session.
 */
public class FlowStorageException extends RuntimeException {
  /**
   * @param message this is logged but not returned to the client
   */
  public FlowStorageException(String message, Throwable cause) {
    super(message, cause);
  }

  public FlowStorageException(String message) {
    super(message);
  }
}
