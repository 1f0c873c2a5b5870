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
import org.fireflyframework.transformers.exception.InvalidDirectionException;
import org.fireflyframework.transformers.exception.UnknownFieldException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Translates records between their application and external representations.
 *
 * <p>A transformer is built from a {@link TransformerConfiguration} and never
 * changes afterwards, so a single instance can be shared by every caller of a
 * data-access layer. For a record moving into a direction, each field is
 * handled as follows:</p>
 * <ul>
 *   <li>a field with a definition is renamed and its value converted</li>
 *   <li>a virtual field is copied unchanged</li>
 *   <li>any other field is dropped</li>
 * </ul>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * Transformer posts = new Transformer(TransformerConfiguration.builder("posts")
 *     .field("id", "postid", FieldConverter.of(v -> Integer.valueOf(v.toString())), FieldConverter.of(String::valueOf))
 *     .field("title", "post_title")
 *     .build());
 *
 * Map<String, Object> app = posts.toApp(Map.of("postid", "5", "post_title", "Hello"));
 * // {id=5, title=Hello}
 * String column = posts.getKeyApp("title");
 * // post_title
 * }</pre>
 */
@Slf4j
public class Transformer {

    private final String name;
    private final DefinitionRegistry registry;
    private final TransformHooks hooks;

    /**
     * Creates a transformer from the given configuration.
     *
     * @param configuration the field declarations, virtual fields and hooks
     */
    public Transformer(TransformerConfiguration configuration) {
        this.name = configuration.getName();
        this.registry = configuration.toRegistry();
        this.registry.freeze();
        this.hooks = configuration.getHooks();
        log.debug("Transformer '{}' built with {} fields and {} virtual fields",
                name, registry.size(), registry.virtualFields().size());
    }

    /**
     * Transforms data into the given direction.
     *
     * <p>Exactly one mode applies:</p>
     * <ul>
     *   <li>{@code batch} - {@code data} is a collection of records, each transformed in order</li>
     *   <li>{@code key != null} - {@code data} is the raw value of field {@code key}; the converted value is returned</li>
     *   <li>otherwise - {@code data} is a single record</li>
     * </ul>
     *
     * @param direction the target direction
     * @param data      a record, a collection of records, or a single value
     * @param key       the field name for single-value mode, or {@code null}
     * @param batch     whether {@code data} is a collection of records
     * @return the transformed record, list of records or value; {@code null} for {@code null} data
     * @throws InvalidDirectionException if {@code direction} is {@code null}
     * @throws UnknownFieldException     if {@code key} has no definition for {@code direction}
     * @throws IllegalArgumentException  if both {@code key} and {@code batch} are given, or data has the wrong shape
     */
    public Object to(Direction direction, Object data, String key, boolean batch) {
        if (direction == null) {
            throw new InvalidDirectionException(null);
        }
        if (batch && key != null) {
            throw new IllegalArgumentException("Batch mode does not accept a field key: " + key);
        }

        if (batch) {
            return transformBatch(direction, data);
        }
        if (key != null) {
            return transformValue(direction, key, data);
        }
        return transformRecord(direction, data);
    }

    /**
     * Same as {@link #to(Direction, Object, String, boolean)} with the direction
     * given by name ({@code app}, {@code ext}, or a {@link Direction} constant name).
     *
     * @throws InvalidDirectionException if the name matches no direction
     */
    public Object to(String direction, Object data, String key, boolean batch) {
        return to(Direction.of(direction), data, key, batch);
    }

    /**
     * Transforms a single record into the given direction.
     */
    public Map<String, Object> to(Direction direction, Map<String, Object> record) {
        if (direction == null) {
            throw new InvalidDirectionException(null);
        }
        return transformRecord(direction, record);
    }

    public Map<String, Object> toApp(Map<String, Object> record) {
        return to(Direction.APPLICATION, record);
    }

    public Map<String, Object> toExt(Map<String, Object> record) {
        return to(Direction.EXTERNAL, record);
    }

    /**
     * Converts one external value of field {@code key} (an external name).
     */
    public Object toApp(Object value, String key) {
        return to(Direction.APPLICATION, value, key, false);
    }

    /**
     * Converts one application value of field {@code key} (an application name).
     */
    public Object toExt(Object value, String key) {
        return to(Direction.EXTERNAL, value, key, false);
    }

    public Object toApp(Object data, String key, boolean batch) {
        return to(Direction.APPLICATION, data, key, batch);
    }

    public Object toExt(Object data, String key, boolean batch) {
        return to(Direction.EXTERNAL, data, key, batch);
    }

    public List<Map<String, Object>> toAppBatch(Collection<? extends Map<String, Object>> records) {
        return transformBatch(Direction.APPLICATION, records);
    }

    public List<Map<String, Object>> toExtBatch(Collection<? extends Map<String, Object>> records) {
        return transformBatch(Direction.EXTERNAL, records);
    }

    /**
     * Returns the field names consumed when transforming into {@code direction},
     * in registration order: {@code getKeys(APPLICATION)} lists the external
     * names. Virtual fields are not included.
     *
     * @param direction the target direction
     * @param prefix    prepended to every name when not {@code null}, e.g. a table alias
     * @return the field names
     */
    public List<String> getKeys(Direction direction, String prefix) {
        if (direction == null) {
            throw new InvalidDirectionException(null);
        }
        List<String> keys = registry.keys(direction);
        if (prefix == null) {
            return keys;
        }
        List<String> prefixed = new ArrayList<>(keys.size());
        for (String key : keys) {
            prefixed.add(prefix + key);
        }
        return prefixed;
    }

    public List<String> getKeys(String direction, String prefix) {
        return getKeys(Direction.of(direction), prefix);
    }

    public List<String> getKeys(Direction direction) {
        return getKeys(direction, null);
    }

    /**
     * External field names, i.e. the columns read by {@link #toApp(Map)}.
     */
    public List<String> getKeysApp() {
        return getKeys(Direction.APPLICATION, null);
    }

    public List<String> getKeysApp(String prefix) {
        return getKeys(Direction.APPLICATION, prefix);
    }

    /**
     * Application field names, i.e. those read by {@link #toExt(Map)}.
     */
    public List<String> getKeysExt() {
        return getKeys(Direction.EXTERNAL, null);
    }

    public List<String> getKeysExt(String prefix) {
        return getKeys(Direction.EXTERNAL, prefix);
    }

    /**
     * Maps each field's name in {@code direction} to its name in the opposite
     * direction.
     *
     * @param direction the direction whose names become the map keys
     * @return an insertion-ordered map, one entry per logical field
     */
    public Map<String, String> getMap(Direction direction) {
        if (direction == null) {
            throw new InvalidDirectionException(null);
        }
        Map<String, String> map = new LinkedHashMap<>();
        registry.definitions(direction).values()
                .forEach(definition -> map.put(definition.getTargetKey(), definition.getSourceKey()));
        return map;
    }

    /**
     * Looks up the counterpart of a field name.
     *
     * @param direction the direction {@code key} belongs to
     * @param key       the field name in {@code direction}
     * @return the name in the opposite direction, or {@code null} if not registered
     */
    public String getKey(Direction direction, String key) {
        return getMap(direction).get(key);
    }

    /**
     * Returns the external name of an application field, or {@code null}.
     */
    public String getKeyApp(String key) {
        return getKey(Direction.APPLICATION, key);
    }

    /**
     * Returns the application name of an external field, or {@code null}.
     */
    public String getKeyExt(String key) {
        return getKey(Direction.EXTERNAL, key);
    }

    public Optional<FieldDefinition> getDefinition(Direction direction, String key) {
        return registry.getDefinition(direction, key);
    }

    public Set<String> getVirtualFields() {
        return registry.virtualFields();
    }

    public String getName() {
        return name;
    }

    private Object transformValue(Direction direction, String key, Object value) {
        FieldDefinition definition = registry.getDefinition(direction, key)
                .orElseThrow(() -> new UnknownFieldException(direction, key));
        if (value == null) {
            return null;
        }
        return definition.apply(value);
    }

    private List<Map<String, Object>> transformBatch(Direction direction, Object data) {
        if (data == null) {
            return null;
        }
        if (!(data instanceof Collection<?> records)) {
            throw new IllegalArgumentException("Batch data must be a collection of records: "
                    + data.getClass().getName());
        }
        List<Map<String, Object>> result = new ArrayList<>(records.size());
        for (Object record : records) {
            result.add(transformRecord(direction, record));
        }
        return result;
    }

    private Map<String, Object> transformRecord(Direction direction, Object data) {
        if (data == null) {
            return null;
        }
        if (!(data instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException("Record data must be a map: " + data.getClass().getName());
        }

        Map<String, Object> input = hooks.before(direction).apply(copyOf(raw));
        if (input == null) {
            return null;
        }

        Map<String, Object> output = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : input.entrySet()) {
            String field = entry.getKey();
            Optional<FieldDefinition> definition = registry.getDefinition(direction, field);
            if (definition.isPresent()) {
                output.put(definition.get().getTargetKey(), definition.get().apply(entry.getValue()));
            } else if (registry.isVirtual(field)) {
                output.put(field, entry.getValue());
            } else if (log.isTraceEnabled()) {
                log.trace("Transformer '{}' dropped field '{}' moving to {}", name, field, direction);
            }
        }

        return hooks.after(direction).apply(output);
    }

    private static Map<String, Object> copyOf(Map<?, ?> raw) {
        Map<String, Object> record = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (!(key instanceof String field)) {
                throw new IllegalArgumentException("Record field names must be strings: " + key);
            }
            record.put(field, value);
        });
        return record;
    }
}
