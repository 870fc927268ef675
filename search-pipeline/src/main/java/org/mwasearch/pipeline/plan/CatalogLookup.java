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
package org.mwasearch.pipeline.plan;

import java.util.OptionalDouble;

/**
 * Read access to the astronomical source catalogues.
 * <p>
 * Implementations return at most one DM per source and category. They must be safe for
 * concurrent use since targets are planned independently.
 * </p>
 *
 * @see MapCatalogLookup
 */
@FunctionalInterface
public interface CatalogLookup {

  /**
   * Looks up the dispersion measure of a source in one catalogue.
   *
   * @param sourceName the source name, without any target discriminator; never {@code null}
   * @param category   the catalogue to consult; never {@code null}
   * @return the catalogued DM, or an empty optional when the catalogue does not know the source
   */
  OptionalDouble lookup(String sourceName, CatalogCategory category);
}
