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
package org.mwasearch.pipeline.aggregate;

import java.time.Instant;

/**
 * Snapshot of a result bundle still waiting for trial results.
 *
 * @param targetName   name of the target
 * @param expected     number of trial results the bundle waits for
 * @param received     number of distinct trial results received so far
 * @param lastProgress time the bundle was registered or last received a result
 */
public record PendingBundle(String targetName, int expected, int received, Instant lastProgress) {

  public int missing() {
    return expected - received;
  }
}
