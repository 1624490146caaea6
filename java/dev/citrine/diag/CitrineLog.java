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

package dev.citrine.diag;

import com.google.common.collect.ImmutableList;
import dev.citrine.diag.CitrineError.ErrorKind;
import java.util.LinkedHashSet;
import java.util.Set;

/** Collects the diagnostics reported while processing a single source file. */
public class CitrineLog {

  private final SourceFile source;
  private final Set<CitrineDiagnostic> errors = new LinkedHashSet<>();

  public CitrineLog(SourceFile source) {
    this.source = source;
  }

  public SourceFile source() {
    return source;
  }

  public void error(int position, ErrorKind kind, Object... args) {
    errors.add(CitrineDiagnostic.format(source, position, kind, args));
  }

  /** The diagnostics reported so far, in the order they were reported. */
  public ImmutableList<CitrineDiagnostic> diagnostics() {
    return ImmutableList.copyOf(errors);
  }
}
