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

package org.fireflyframework.transformers;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Field definitions for both directions plus the set of virtual fields.
 *
 * <p>Each direction's map is keyed by the field name as it appears in the
 * <em>opposite</em> direction's records, and holds the definition used to
 * move that field into this direction. Registering one logical field always
 * writes the mirror pair; redefining a key replaces the previous entry.</p>
 *
 * <p>The registry is written during setup and then {@linkplain #freeze() frozen};
 * reads after that point are safe from any thread.</p>
 */
@Slf4j
public class DefinitionRegistry {

    private final Map<Direction, Map<String, FieldDefinition>> definitions = new EnumMap<>(Direction.class);
    private final Set<String> virtualFields = new LinkedHashSet<>();
    private volatile boolean frozen;

    public DefinitionRegistry() {
        for (Direction direction : Direction.values()) {
            definitions.put(direction, new LinkedHashMap<>());
        }
    }

    /**
     * Registers a logical field.
     *
     * @param declaration the field declaration
     * @return this registry
     * @throws IllegalStateException if the registry is frozen
     */
    public DefinitionRegistry define(FieldDeclaration declaration) {
        checkNotFrozen();
        put(Direction.EXTERNAL, declaration.getAppKey(), declaration.toExternalDefinition());
        put(Direction.APPLICATION, declaration.getExtKey(), declaration.toApplicationDefinition());
        return this;
    }

    /**
     * Registers a logical field from its positional parts. Converters and
     * argument lists may be {@code null}.
     */
    public DefinitionRegistry define(String appKey, String extKey,
                                     FieldConverter appConverter, FieldConverter extConverter,
                                     List<Object> appArgs, List<Object> extArgs) {
        return define(FieldDeclaration.builder()
                .appKey(appKey)
                .extKey(extKey)
                .appConverter(appConverter)
                .extConverter(extConverter)
                .appArgs(appArgs)
                .extArgs(extArgs)
                .build());
    }

    public DefinitionRegistry define(String appKey, String extKey) {
        return define(FieldDeclaration.of(appKey, extKey));
    }

    /**
     * Marks a field as a passthrough. Idempotent.
     *
     * @param key the field name
     * @return this registry
     */
    public DefinitionRegistry defineVirtual(String key) {
        checkNotFrozen();
        virtualFields.add(key);
        return this;
    }

    /**
     * Looks up the definition used to move {@code key} into {@code direction}.
     *
     * @param direction the target direction
     * @param key       the field name in the opposite direction
     * @return the definition, or empty when none is registered
     */
    public Optional<FieldDefinition> getDefinition(Direction direction, String key) {
        return Optional.ofNullable(definitions.get(direction).get(key));
    }

    /**
     * Returns the registry keys of one direction's map in registration order.
     */
    public List<String> keys(Direction direction) {
        return List.copyOf(definitions.get(direction).keySet());
    }

    /**
     * Returns the definitions of one direction in registration order.
     */
    public Map<String, FieldDefinition> definitions(Direction direction) {
        return Collections.unmodifiableMap(definitions.get(direction));
    }

    public boolean isVirtual(String key) {
        return virtualFields.contains(key);
    }

    public Set<String> virtualFields() {
        return Collections.unmodifiableSet(virtualFields);
    }

    /**
     * Returns the number of logical fields, counted on the external side.
     */
    public int size() {
        return definitions.get(Direction.EXTERNAL).size();
    }

    /**
     * Rejects further registrations.
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void put(Direction direction, String key, FieldDefinition definition) {
        FieldDefinition previous = definitions.get(direction).put(key, definition);
        if (previous != null) {
            log.debug("Redefined {} field '{}': '{}' replaced by '{}'",
                    direction, key, previous.getTargetKey(), definition.getTargetKey());
        }
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Definition registry is frozen");
        }
    }
}
