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

import java.text.Normalizer;
import java.text.Normalizer.Form;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Validation of values that arrive from the client. Failures are reported
 * as {@link BadRequestException}.
 */
public class Valid {
  private static final Pattern TOKEN_KEY = Pattern.compile("[a-zA-Z0-9]{1,200}");

  @Nullable
  public static String matchesOpt(String value, Pattern requiredPattern, String validationMessage) {
    if (value == null || value.length() == 0) {
      return null;
    }

    // Eliminate potentially malicious crafted Unicode escape sequences
    value = Normalizer.normalize(value, Form.NFKC);

    if (requiredPattern.matcher(value).matches()) {
      return value;
    }

    throw new BadRequestException(validationMessage);
  }

  @Nonnull
  public static String matchesReq(String value, Pattern requiredPattern, String validationMessage) {
    value = matchesOpt(value, requiredPattern, validationMessage);
    if (value == null) {
      throw new BadRequestException(validationMessage);
    }

    return value;
  }

  @Nonnull
  public static <T> T nonNull(T object, String validationMessage) {
    if (object == null) {
      throw new BadRequestException(validationMessage);
    }

    return object;
  }

  @Nonnull
  public static String flowSlug(String value) {
    return matchesReq(value, Flow.SLUG, "Flow slug must match " + Flow.SLUG.pattern());
  }

  @Nullable
  public static String tokenKeyOpt(String value) {
    return matchesOpt(value, TOKEN_KEY, "Parameter " + FlowExecutor.QS_KEY_TOKEN + " is not valid");
  }
}
