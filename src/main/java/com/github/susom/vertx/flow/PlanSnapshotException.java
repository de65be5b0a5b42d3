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
 * Indicates a flow plan could not be written to or read from its snapshot
 * form (wrong version, malformed structure, or a context value that is not
 * representable as JSON).
 */
public class PlanSnapshotException extends RuntimeException {
  public PlanSnapshotException(String message) {
    super(message);
  }

  public PlanSnapshotException(String message, Throwable cause) {
    super(message, cause);
  }
}
