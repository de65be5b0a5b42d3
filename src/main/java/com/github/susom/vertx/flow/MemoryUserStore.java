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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nullable;

/**
 * Keeps users in memory. Useful for samples and tests.
 */
public class MemoryUserStore implements UserStore {
  private final Map<String, FlowUser> users = new ConcurrentHashMap<>();

  public MemoryUserStore add(FlowUser user) {
    users.put(user.id(), user);
    return this;
  }

  @Nullable
  @Override
  public FlowUser find(String id) {
    return id == null ? null : users.get(id);
  }

  @Override
  public boolean setActive(String id, boolean active) {
    return users.computeIfPresent(id, (k, user) -> user.withActive(active)) != null;
  }
}
