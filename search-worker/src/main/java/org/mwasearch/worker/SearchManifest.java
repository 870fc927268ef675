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
package org.mwasearch.worker;

import org.mwasearch.pipeline.model.ChannelGroup;
import org.mwasearch.pipeline.model.Target;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Input of a run: the shared channel layout and the targets to search.
 *
 * @param channelGroup channel layout of the observation
 * @param targets      targets, in submission order
 */
public record SearchManifest(ChannelGroup channelGroup, List<Target> targets) {

  public SearchManifest {
    requireNonNull(channelGroup, "channelGroup must not be null");
    targets = List.copyOf(targets);
  }
}
