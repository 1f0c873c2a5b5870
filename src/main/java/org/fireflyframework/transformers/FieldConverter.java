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

import java.util.List;
import java.util.function.Function;

/**
 * Functional interface for converting a single field value as it enters a
 * {@link Direction}.
 *
 * <p>The converter receives the value followed by the extra arguments
 * registered with the field. Converters are expected to be pure; any
 * exception they throw reaches the caller of the {@link Transformer}
 * unchanged.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * FieldConverter toInt = FieldConverter.of(v -> Integer.valueOf(v.toString()));
 * FieldConverter padded = (value, args) -> String.format((String) args.get(0), value);
 * }</pre>
 */
@FunctionalInterface
public interface FieldConverter {

    /**
     * Converts the given value.
     *
     * @param value the value in the source representation
     * @param args  extra positional arguments registered with the field, never {@code null}
     * @return the value in the target representation
     */
    Object convert(Object value, List<Object> args);

    /**
     * Adapts a single-argument function that ignores extra arguments.
     *
     * @param function the conversion function
     * @return a converter delegating to {@code function}
     */
    static FieldConverter of(Function<Object, Object> function) {
        return (value, args) -> function.apply(value);
    }
}
