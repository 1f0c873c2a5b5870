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

package org.fireflyframework.transformers.conversion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.transformers.FieldConverter;
import org.fireflyframework.transformers.FieldDeclaration;

import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Map;
import java.util.Objects;

/**
 * Ready-made {@link FieldDeclaration}s for common storage formats.
 *
 * <ul>
 *   <li>{@link #date} - {@link LocalDateTime} in the application, {@code yyyy-MM-dd HH:mm:ss} string outside</li>
 *   <li>{@link #json} - decoded maps and lists in the application, a JSON string outside</li>
 *   <li>{@link #mask} - a set of flag names in the application, an integer bitmask outside</li>
 * </ul>
 *
 * <p>All converters pass {@code null} through, except the mask converters which
 * map it to {@code 0} and the empty set.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * FieldConversions conversions = FieldConversions.defaults();
 * TransformerConfiguration posts = TransformerConfiguration.builder("posts")
 *     .field(conversions.date("createdAt", "post_date"))
 *     .field(conversions.json("meta", "post_meta"))
 *     .field(conversions.mask("flags", "post_flags", Map.of("sticky", 0, "locked", 1)))
 *     .build();
 * }</pre>
 */
public class FieldConversions {

    public static final String DEFAULT_DATE_PATTERN = "yyyy-MM-dd HH:mm:ss";

    private final ObjectMapper objectMapper;
    private final DateTimeFormatter dateFormatter;
    private final UnknownFlagPolicy unknownFlagPolicy;

    public FieldConversions(ObjectMapper objectMapper, DateTimeFormatter dateFormatter,
                            UnknownFlagPolicy unknownFlagPolicy) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.dateFormatter = Objects.requireNonNull(dateFormatter, "dateFormatter");
        this.unknownFlagPolicy = Objects.requireNonNull(unknownFlagPolicy, "unknownFlagPolicy");
    }

    /**
     * Creates conversions with a plain {@link ObjectMapper}, the canonical date
     * pattern and {@link UnknownFlagPolicy#IGNORE}.
     */
    public static FieldConversions defaults() {
        return new FieldConversions(new ObjectMapper(),
                DateTimeFormatter.ofPattern(DEFAULT_DATE_PATTERN), UnknownFlagPolicy.IGNORE);
    }

    /**
     * Declares a date/time field.
     *
     * @param appKey the application field name
     * @param extKey the external field name
     * @return the declaration
     */
    public FieldDeclaration date(String appKey, String extKey) {
        return FieldDeclaration.of(appKey, extKey, parseDate(dateFormatter), formatDate(dateFormatter));
    }

    public FieldDeclaration date(String appKey, String extKey, DateTimeFormatter formatter) {
        return FieldDeclaration.of(appKey, extKey, parseDate(formatter), formatDate(formatter));
    }

    /**
     * Declares a JSON-encoded field. JSON objects decode to insertion-ordered
     * maps and arrays to lists.
     *
     * @param appKey the application field name
     * @param extKey the external field name
     * @return the declaration
     */
    public FieldDeclaration json(String appKey, String extKey) {
        return FieldDeclaration.of(appKey, extKey, decodeJson(objectMapper), encodeJson(objectMapper));
    }

    /**
     * Declares a bitmask field using the configured {@link UnknownFlagPolicy}.
     *
     * @param appKey the application field name
     * @param extKey the external field name
     * @param mask   flag name to bit position
     * @return the declaration
     */
    public FieldDeclaration mask(String appKey, String extKey, Map<String, Integer> mask) {
        return mask(appKey, extKey, mask, unknownFlagPolicy);
    }

    public FieldDeclaration mask(String appKey, String extKey, Map<String, Integer> mask, UnknownFlagPolicy policy) {
        FlagMask flagMask = new FlagMask(mask, policy);
        return FieldDeclaration.of(appKey, extKey,
                FieldConverter.of(flagMask::decode),
                FieldConverter.of(flagMask::encode));
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public DateTimeFormatter getDateFormatter() {
        return dateFormatter;
    }

    public UnknownFlagPolicy getUnknownFlagPolicy() {
        return unknownFlagPolicy;
    }

    static FieldConverter parseDate(DateTimeFormatter formatter) {
        return FieldConverter.of(value -> {
            if (value == null || value instanceof LocalDateTime) {
                return value;
            }
            return LocalDateTime.parse(value.toString(), formatter);
        });
    }

    static FieldConverter formatDate(DateTimeFormatter formatter) {
        return FieldConverter.of(value -> {
            if (value == null) {
                return null;
            }
            if (!(value instanceof TemporalAccessor temporal)) {
                throw new IllegalArgumentException("Date value must be a temporal: " + value.getClass().getName());
            }
            return formatter.format(temporal);
        });
    }

    static FieldConverter decodeJson(ObjectMapper mapper) {
        return FieldConverter.of(value -> {
            if (value == null) {
                return null;
            }
            try {
                return mapper.readValue(value.toString(), Object.class);
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    static FieldConverter encodeJson(ObjectMapper mapper) {
        return FieldConverter.of(value -> {
            if (value == null) {
                return null;
            }
            try {
                return mapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        });
    }
}
