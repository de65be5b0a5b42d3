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
 * States of the flow executor for the current request.
 */
public enum FlowState {
  /** The current stage has not been shown yet. */
  AWAITING_CHALLENGE,
  /** A challenge was rendered and the client is expected to answer it. */
  AWAITING_RESPONSE,
  /** The current stage is satisfied and the plan advanced. */
  STAGE_OK,
  /** The current stage rejected the response, or denied the flow. */
  STAGE_INVALID,
  /** Every stage is done. */
  COMPLETED,
  /** The plan was rehydrated from a redeemed token. */
  RESTORED
}
