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

import javax.annotation.Nullable;

/**
 * Outcome of presenting a token key to {@link FlowTokenStore#inspect(String)}
 * or {@link FlowTokenStore#redeem(String)}.
 */
public class TokenRedemption {
  public enum Status {
    /** No token has this key (never issued, or rotated away). */
    NOT_FOUND,
    /** The token exists but is past its expiry, or was already redeemed. */
    EXPIRED,
    /** The token can be redeemed; nothing has been changed yet. */
    VALID,
    /** The token was valid and has now been used up. */
    REDEEMED
  }

  private static final TokenRedemption NOT_FOUND = new TokenRedemption(Status.NOT_FOUND, null);

  private final Status status;
  private final FlowToken token;

  private TokenRedemption(Status status, FlowToken token) {
    this.status = status;
    this.token = token;
  }

  public static TokenRedemption notFound() {
    return NOT_FOUND;
  }

  public static TokenRedemption expired(FlowToken token) {
    return new TokenRedemption(Status.EXPIRED, token);
  }

  public static TokenRedemption valid(FlowToken token) {
    return new TokenRedemption(Status.VALID, token);
  }

  public static TokenRedemption redeemed(FlowToken token) {
    return new TokenRedemption(Status.REDEEMED, token);
  }

  public Status status() {
    return status;
  }

  public boolean isRedeemed() {
    return status == Status.REDEEMED;
  }

  /**
   * @return the token as it was before redemption, or null when not found
   */
  @Nullable
  public FlowToken token() {
    return token;
  }

  @Override
  public String toString() {
    return status + (token == null ? "" : " " + token);
  }
}
