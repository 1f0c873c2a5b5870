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

import org.fireflyframework.transformers.exception.InvalidDirectionException;

/**
 * Representation a record is transformed into.
 *
 * <ul>
 *   <li>{@link #APPLICATION} - in-memory field names and value formats</li>
 *   <li>{@link #EXTERNAL} - persisted or wire field names and value formats</li>
 * </ul>
 */
public enum Direction {

    APPLICATION("app"),
    EXTERNAL("ext");

    private final String shortName;

    Direction(String shortName) {
        this.shortName = shortName;
    }

    public String getShortName() {
        return shortName;
    }

    /**
     * Returns the other direction. Mapping into one direction always
     * consumes records of the opposite one.
     *
     * @return the opposite direction
     */
    public Direction opposite() {
        return this == APPLICATION ? EXTERNAL : APPLICATION;
    }

    /**
     * Resolves a direction from its short name ({@code app}, {@code ext})
     * or its constant name, ignoring case.
     *
     * @param value the direction name
     * @return the matching direction
     * @throws InvalidDirectionException if the value names no direction
     */
    public static Direction of(String value) {
        if (value != null) {
            for (Direction direction : values()) {
                if (direction.shortName.equalsIgnoreCase(value) || direction.name().equalsIgnoreCase(value)) {
                    return direction;
                }
            }
        }
        throw new InvalidDirectionException(value);
    }
}
