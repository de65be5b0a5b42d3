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
 * Exception to represent a malformed request from the client (bad flow slug,
 * body that is not a JSON object, etc.). It is expected the top level handler
 * for this exception will return an HTTP 400 "Bad Request" status code.
 */
public class BadRequestException extends RuntimeException {
  /**
   * @param message this message is expected to be returned to the client
   *                so do not include sensitive information
   */
  public BadRequestException(String message) {
    super(message);
  }

  /**
   * @param message this message is expected to be returned to the client
   *                so do not include sensitive information
   */
  public BadRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
