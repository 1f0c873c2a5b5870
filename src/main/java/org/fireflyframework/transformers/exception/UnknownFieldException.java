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

package org.fireflyframework.transformers.exception;

import lombok.Getter;
import org.fireflyframework.transformers.Direction;

/**
 * Thrown when a single-field transformation names a key that has no
 * definition for the requested direction.
 */
@Getter
public class UnknownFieldException extends IllegalArgumentException {

    private final Direction direction;
    private final String key;

    public UnknownFieldException(Direction direction, String key) {
        super("Unknown key: " + key + " (direction " + direction + ")");
        this.direction = direction;
        this.key = key;
    }
}
