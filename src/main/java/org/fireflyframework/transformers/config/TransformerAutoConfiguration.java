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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.transformers.TransformerConfiguration;
import org.fireflyframework.transformers.conversion.FieldConversions;
import org.fireflyframework.transformers.registry.TransformerRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Auto-configuration for field transformers.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>{@link FieldConversions} using the context {@link ObjectMapper} when one exists</li>
 *   <li>{@link TransformerRegistry} with a transformer for every {@link TransformerConfiguration} bean</li>
 * </ul>
 *
 * <p>The configuration is activated when:</p>
 * <ul>
 *   <li>The property {@code firefly.transformers.enabled} is true (default)</li>
 *   <li>Or the property is not set (enabled by default)</li>
 * </ul>
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   transformers:
 *     enabled: true
 *     date-pattern: "yyyy-MM-dd HH:mm:ss"
 *     unknown-flag-policy: REJECT
 * }</pre>
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(TransformerProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.transformers",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class TransformerAutoConfiguration {

    /**
     * Creates the field conversions used by date, JSON and mask declarations.
     *
     * @param properties   the transformer properties
     * @param objectMapper the application object mapper, if any
     * @return the field conversions
     */
    @Bean
    @ConditionalOnMissingBean
    public FieldConversions fieldConversions(TransformerProperties properties,
                                             ObjectProvider<ObjectMapper> objectMapper) {
        return new FieldConversions(
                objectMapper.getIfAvailable(ObjectMapper::new),
                DateTimeFormatter.ofPattern(properties.getDatePattern()),
                properties.getUnknownFlagPolicy());
    }

    /**
     * Creates the transformer registry.
     *
     * <p>Every {@link TransformerConfiguration} bean is turned into a
     * {@link org.fireflyframework.transformers.Transformer} and registered under
     * its configuration name. Duplicate names fail the context start-up.</p>
     *
     * @param configurations the transformer configurations declared in the context
     * @return the populated registry
     */
    @Bean
    @ConditionalOnMissingBean
    public TransformerRegistry transformerRegistry(ObjectProvider<TransformerConfiguration> configurations) {
        TransformerRegistry registry = new TransformerRegistry();
        List<TransformerConfiguration> declared = configurations.orderedStream().toList();
        declared.forEach(registry::register);
        log.info("Configuring Transformer Registry with {} transformers", declared.size());
        return registry;
    }
}
