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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link TransformerConfiguration} and {@link TransformHooks}.
 */
@ExtendWith(MockitoExtension.class)
class TransformerConfigurationTest {

    @Mock
    private RecordHook beforeApp;

    @Mock
    private RecordHook afterApp;

    @Test
    void include_shouldComposeFieldsAndVirtualFields() {
        // Given - a shared audit configuration reused by an entity configuration
        TransformerConfiguration audit = TransformerConfiguration.builder("audit")
                .field("createdBy", "created_by")
                .virtual("version")
                .build();

        // When
        TransformerConfiguration posts = TransformerConfiguration.builder("posts")
                .field("id", "postid")
                .include(audit)
                .build();

        // Then
        assertThat(posts.getName()).isEqualTo("posts");
        assertThat(posts.getFields()).extracting(FieldDeclaration::getAppKey).containsExactly("id", "createdBy");
        assertThat(posts.getVirtualFields()).containsExactly("version");

        Transformer transformer = new Transformer(posts);
        assertThat(transformer.getKeysApp()).containsExactly("postid", "created_by");
        assertThat(transformer.getVirtualFields()).containsExactly("version");
    }

    @Test
    void toRegistry_shouldReturnUnfrozenRegistry() {
        // Given
        TransformerConfiguration configuration = TransformerConfiguration.builder("posts")
                .field("id", "postid")
                .build();

        // When
        DefinitionRegistry registry = configuration.toRegistry();

        // Then
        assertThat(registry.isFrozen()).isFalse();
        assertThat(registry.getDefinition(Direction.APPLICATION, "postid")).isPresent();
    }

    @Test
    void hooks_shouldDefaultToIdentity() {
        // Given
        Map<String, Object> record = new LinkedHashMap<>(Map.of("a", 1));

        // When & Then
        for (Direction direction : Direction.values()) {
            assertThat(TransformHooks.none().before(direction).apply(record)).isSameAs(record);
            assertThat(TransformHooks.none().after(direction).apply(record)).isSameAs(record);
        }
    }

    @Test
    void hooks_shouldOnlyRunForTheirDirection() {
        // Given
        when(beforeApp.apply(any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(afterApp.apply(any())).thenAnswer(invocation -> invocation.getArgument(0));
        Transformer transformer = new Transformer(TransformerConfiguration.builder("posts")
                .field("id", "postid")
                .hooks(TransformHooks.builder()
                        .before(Direction.APPLICATION, beforeApp)
                        .after(Direction.APPLICATION, afterApp)
                        .build())
                .build());

        // When
        transformer.toExt(Map.of("id", 1));
        transformer.toApp(Map.of("postid", 1, "dropped", 2));

        // Then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> input = ArgumentCaptor.forClass(Map.class);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> output = ArgumentCaptor.forClass(Map.class);
        verify(beforeApp).apply(input.capture());
        verify(afterApp).apply(output.capture());
        assertThat(input.getValue()).containsOnlyKeys("postid", "dropped");
        assertThat(output.getValue()).containsExactly(Map.entry("id", 1));
    }

    @Test
    void hooks_shouldNotRunForSingleValueOrNullRecord() {
        // Given
        Transformer transformer = new Transformer(TransformerConfiguration.builder("posts")
                .field("id", "postid")
                .hooks(TransformHooks.builder().before(Direction.APPLICATION, beforeApp).build())
                .build());

        // When
        transformer.toApp(5, "postid");
        transformer.toApp((Map<String, Object>) null);

        // Then
        verify(beforeApp, never()).apply(any());
    }
}
