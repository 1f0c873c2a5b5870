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

package org.fireflyframework.transformers.config;

import lombok.Data;
import org.fireflyframework.transformers.conversion.FieldConversions;
import org.fireflyframework.transformers.conversion.UnknownFlagPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for field transformers.
 *
 * <pre>{@code
 * firefly:
 *   transformers:
 *     enabled: true
 *     date-pattern: "yyyy-MM-dd HH:mm:ss"
 *     unknown-flag-policy: IGNORE
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.transformers")
public class TransformerProperties {

    /**
     * Whether the transformer auto-configuration is active.
     */
    private boolean enabled = true;

    /**
     * Pattern of the external representation of date fields.
     */
    private String datePattern = FieldConversions.DEFAULT_DATE_PATTERN;

    /**
     * Handling of flag names and bits missing from a mask definition.
     */
    private UnknownFlagPolicy unknownFlagPolicy = UnknownFlagPolicy.IGNORE;
}
