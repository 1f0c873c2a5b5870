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

package org.fireflyframework.transformers.registry;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.transformers.Transformer;
import org.fireflyframework.transformers.TransformerConfiguration;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Named {@link Transformer}s, typically one per entity or table.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * TransformerRegistry registry = new TransformerRegistry();
 * registry.register(postsConfiguration);
 * Map<String, Object> post = registry.require("posts").toApp(row);
 * }</pre>
 */
@Slf4j
public class TransformerRegistry {

    private final Map<String, Transformer> transformers = new ConcurrentHashMap<>();
    private final List<String> names = new CopyOnWriteArrayList<>();

    /**
     * Registers a transformer under its name.
     *
     * @param transformer the transformer
     * @return the registered transformer
     * @throws IllegalStateException if the name is already taken
     */
    public Transformer register(Transformer transformer) {
        Transformer existing = transformers.putIfAbsent(transformer.getName(), transformer);
        if (existing != null) {
            throw new IllegalStateException("Transformer already registered: " + transformer.getName());
        }
        names.add(transformer.getName());
        log.debug("Registered transformer '{}'", transformer.getName());
        return transformer;
    }

    /**
     * Builds and registers a transformer from its configuration.
     */
    public Transformer register(TransformerConfiguration configuration) {
        return register(new Transformer(configuration));
    }

    public Optional<Transformer> get(String name) {
        return Optional.ofNullable(transformers.get(name));
    }

    /**
     * Returns the transformer registered under {@code name}.
     *
     * @throws IllegalArgumentException if none is registered
     */
    public Transformer require(String name) {
        return get(name).orElseThrow(() -> new IllegalArgumentException("No transformer registered: " + name));
    }

    /**
     * Returns the registered names in registration order.
     */
    public List<String> names() {
        return List.copyOf(names);
    }

    public int size() {
        return transformers.size();
    }
}
