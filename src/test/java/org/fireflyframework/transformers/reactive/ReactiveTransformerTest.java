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

package org.fireflyframework.transformers.reactive;

import org.fireflyframework.transformers.FieldConverter;
import org.fireflyframework.transformers.Transformer;
import org.fireflyframework.transformers.TransformerConfiguration;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReactiveTransformer}.
 */
class ReactiveTransformerTest {

    private final ReactiveTransformer transformer = new ReactiveTransformer(new Transformer(
            TransformerConfiguration.builder("posts")
                    .field("id", "postid",
                            FieldConverter.of(v -> Integer.valueOf(v.toString())),
                            FieldConverter.of(String::valueOf))
                    .field("title", "post_title")
                    .build()));

    @Test
    void toApp_shouldEmitTransformedRecord() {
        // When & Then
        StepVerifier.create(transformer.toApp(Map.of("postid", "5", "post_title", "Hello")))
                .assertNext(result -> assertThat(result)
                        .containsOnly(Map.entry("id", 5), Map.entry("title", "Hello")))
                .verifyComplete();
    }

    @Test
    void toExt_shouldCompleteEmptyForNullRecord() {
        // When & Then
        StepVerifier.create(transformer.toExt((Map<String, Object>) null))
                .verifyComplete();
    }

    @Test
    void toApp_flux_shouldPreserveOrder() {
        // Given
        Flux<Map<String, Object>> rows = Flux.just(
                Map.of("postid", "1"),
                Map.of("postid", "2"),
                Map.of("postid", "3"));

        // When & Then
        StepVerifier.create(transformer.toApp(rows))
                .assertNext(result -> assertThat(result).containsEntry("id", 1))
                .assertNext(result -> assertThat(result).containsEntry("id", 2))
                .assertNext(result -> assertThat(result).containsEntry("id", 3))
                .verifyComplete();
    }

    @Test
    void toApp_flux_shouldSignalConversionFailure() {
        // Given
        Flux<Map<String, Object>> rows = Flux.just(
                Map.of("postid", "1"),
                Map.of("postid", "not-a-number"),
                Map.of("postid", "3"));

        // When & Then
        StepVerifier.create(transformer.toApp(rows))
                .assertNext(result -> assertThat(result).containsEntry("id", 1))
                .expectError(NumberFormatException.class)
                .verify();
    }
}
