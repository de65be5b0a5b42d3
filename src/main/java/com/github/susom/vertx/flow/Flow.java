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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A named, ordered sequence of stages. Flows are definitions; a
 * {@link FlowPlan} is one user's run through a flow.
 */
public class Flow {
  public static final Pattern SLUG = Pattern.compile("[a-z0-9][a-z0-9-]{0,49}");

  private final String slug;
  private final String title;
  private final List<StageBinding> stages;

  public Flow(String slug, String title, List<StageBinding> stages) {
    if (slug == null || !SLUG.matcher(slug).matches()) {
      throw new IllegalArgumentException("Flow slug must match " + SLUG.pattern() + ": " + slug);
    }
    this.slug = slug;
    this.title = title;
    this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
  }

  public Flow(String slug, String title, StageBinding... stages) {
    this(slug, title, Arrays.asList(stages));
  }

  public String slug() {
    return slug;
  }

  public String title() {
    return title;
  }

  public List<StageBinding> stages() {
    return stages;
  }
}
