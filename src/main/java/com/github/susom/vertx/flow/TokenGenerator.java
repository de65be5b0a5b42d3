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
import java.security.SecureRandom;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generate flow token keys using a cryptographically secure random number
 * generator. Keys only contain the ASCII characters a-z, A-Z, and 0-9 so they
 * can be placed in a query string without escaping.
 */
public class TokenGenerator {
  private static final Logger log = LoggerFactory.getLogger(TokenGenerator.class);
  private static final char[] ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();
  private final SecureRandom secureRandom;

  public TokenGenerator(SecureRandom secureRandom) {
    this.secureRandom = Objects.requireNonNull(secureRandom);
  }

  /**
   * Create a key of the specified length (in characters). Each character
   * carries a little under six bits of randomness.
   */
  public String create(int length) {
    if (length < 1) {
      throw new IllegalArgumentException("Key length must be positive");
    }
    Metric metric = new Metric(log.isDebugEnabled());
    char[] key = new char[length];

    for (int i = 0; i < length; i++) {
      key[i] = ALPHABET[secureRandom.nextInt(ALPHABET.length)];
    }

    if (log.isDebugEnabled() && metric.elapsedMillis() > 50) {
      log.debug("Slow token generation: " + metric.getMessage());
    }

    return new String(key);
  }

  /**
   * Create a key of {@link FlowToken#KEY_LENGTH} characters.
   */
  public String create() {
    return create(FlowToken.KEY_LENGTH);
  }
}
