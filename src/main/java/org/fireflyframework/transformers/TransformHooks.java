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

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Pre- and post-mapping hooks for each {@link Direction}.
 *
 * <p>The before hook receives the raw input record of a transformation into
 * the given direction; the after hook receives the assembled output. Every
 * slot defaults to {@link RecordHook#identity()}.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * TransformHooks hooks = TransformHooks.builder()
 *     .after(Direction.APPLICATION, record -> {
 *         record.putIfAbsent("status", "draft");
 *         return record;
 *     })
 *     .build();
 * }</pre>
 */
public final class TransformHooks {

    private static final TransformHooks NONE = builder().build();

    private final Map<Direction, RecordHook> before;
    private final Map<Direction, RecordHook> after;

    private TransformHooks(Map<Direction, RecordHook> before, Map<Direction, RecordHook> after) {
        this.before = before;
        this.after = after;
    }

    public static TransformHooks none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public RecordHook before(Direction direction) {
        return before.getOrDefault(direction, RecordHook.identity());
    }

    public RecordHook after(Direction direction) {
        return after.getOrDefault(direction, RecordHook.identity());
    }

    public static final class Builder {

        private final Map<Direction, RecordHook> before = new EnumMap<>(Direction.class);
        private final Map<Direction, RecordHook> after = new EnumMap<>(Direction.class);

        private Builder() {}

        public Builder before(Direction direction, RecordHook hook) {
            before.put(Objects.requireNonNull(direction, "direction"), Objects.requireNonNull(hook, "hook"));
            return this;
        }

        public Builder after(Direction direction, RecordHook hook) {
            after.put(Objects.requireNonNull(direction, "direction"), Objects.requireNonNull(hook, "hook"));
            return this;
        }

        public TransformHooks build() {
            return new TransformHooks(new EnumMap<>(before), new EnumMap<>(after));
        }
    }
}
