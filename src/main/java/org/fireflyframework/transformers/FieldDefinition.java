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

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * How one field is translated when a record moves into a given direction.
 *
 * <p>{@code sourceKey} is the field's name in the record being transformed and
 * {@code targetKey} its name in the result. A missing converter means the
 * value is copied as is.</p>
 */
@Value
public class FieldDefinition {

    String targetKey;
    String sourceKey;
    FieldConverter converter;
    List<Object> converterArgs;

    @Builder
    private FieldDefinition(String targetKey, String sourceKey, FieldConverter converter, List<Object> converterArgs) {
        this.targetKey = targetKey;
        this.sourceKey = sourceKey;
        this.converter = converter;
        this.converterArgs = converterArgs == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(converterArgs));
    }

    /**
     * Applies the converter, if any, to the given value.
     *
     * @param value the source value
     * @return the converted value
     */
    public Object apply(Object value) {
        if (converter == null) {
            return value;
        }
        return converter.convert(value, converterArgs);
    }

    public boolean hasConverter() {
        return converter != null;
    }
}
