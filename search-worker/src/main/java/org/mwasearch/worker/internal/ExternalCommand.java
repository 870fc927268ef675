/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
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
package org.mwasearch.worker.internal;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A command line to run in a working directory.
 *
 * @param arguments        program name followed by its arguments
 * @param workingDirectory directory the program runs in
 */
record ExternalCommand(List<String> arguments, Path workingDirectory) {

  ExternalCommand {
    requireNonNull(workingDirectory, "workingDirectory must not be null");
    arguments = List.copyOf(arguments);
    if (arguments.isEmpty()) {
      throw new IllegalArgumentException("arguments must contain the program name");
    }
  }

  static Builder in(Path workingDirectory, String program) {
    return new Builder(workingDirectory, program);
  }

  String program() {
    return arguments.get(0);
  }

  @Override
  public String toString() {
    return String.join(" ", arguments);
  }

  static final class Builder {
    private final Path workingDirectory;
    private final List<String> arguments = new ArrayList<>();

    private Builder(Path workingDirectory, String program) {
      this.workingDirectory = workingDirectory;
      this.arguments.add(requireNonNull(program, "program must not be null"));
    }

    Builder flag(String name, Object value) {
      arguments.add(name);
      arguments.add(String.valueOf(value));
      return this;
    }

    Builder arg(Object value) {
      arguments.add(String.valueOf(value));
      return this;
    }

    Builder args(List<?> values) {
      values.forEach(this::arg);
      return this;
    }

    ExternalCommand build() {
      return new ExternalCommand(arguments, workingDirectory);
    }
  }
}
