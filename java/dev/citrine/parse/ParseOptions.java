/*
 * Copyright 2016 Google Inc. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.citrine.parse;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.auto.value.AutoBuilder;
import java.util.Optional;

/**
 * Options for a single parse.
 *
 * @param path the path reported in diagnostics, if the text came from a file
 * @param internNodes whether identical subtrees share one green node
 * @param maxNestingDepth the deepest nesting of forms the parser descends into
 */
public record ParseOptions(Optional<String> path, boolean internNodes, int maxNestingDepth) {

  public static final int DEFAULT_MAX_NESTING_DEPTH = 1000;

  public ParseOptions {
    requireNonNull(path, "path");
    checkArgument(maxNestingDepth > 0, "maxNestingDepth must be positive: %s", maxNestingDepth);
  }

  public static ParseOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoBuilder_ParseOptions_Builder()
        .setInternNodes(true)
        .setMaxNestingDepth(DEFAULT_MAX_NESTING_DEPTH);
  }

  /** A builder for {@link ParseOptions}. */
  @AutoBuilder
  public abstract static class Builder {
    public abstract Builder setPath(String path);

    public abstract Builder setInternNodes(boolean internNodes);

    public abstract Builder setMaxNestingDepth(int maxNestingDepth);

    public abstract ParseOptions build();
  }
}
