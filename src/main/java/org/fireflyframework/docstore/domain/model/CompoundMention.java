/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.docstore.domain.model;

import java.util.List;

/**
 * A chemical compound found on a page.
 *
 * @param smiles          the SMILES string as extracted, never blank
 * @param canonicalSmiles the canonical form, if computed
 * @param smilesValid     whether the SMILES string parsed as a valid structure
 * @param identifiers     external identifiers of the compound
 * @param metadata        extraction provenance, may be null
 */
public record CompoundMention(
        String smiles,
        String canonicalSmiles,
        boolean smilesValid,
        List<String> identifiers,
        ExtractionMetadata metadata
) {

    public CompoundMention {
        smiles = Validations.requireText(smiles, "smiles");
        canonicalSmiles = Validations.trimToNull(canonicalSmiles);
        identifiers = identifiers == null ? List.of() : List.copyOf(identifiers);
    }
}
