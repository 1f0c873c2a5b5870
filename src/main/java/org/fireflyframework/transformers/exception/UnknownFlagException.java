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

/**
 * Thrown by a strict mask converter when a flag name or bit has no entry in
 * the mask definition.
 *
 * @see org.fireflyframework.transformers.conversion.UnknownFlagPolicy#REJECT
 */
public class UnknownFlagException extends IllegalArgumentException {

    public UnknownFlagException(String message) {
        super(message);
    }
}
