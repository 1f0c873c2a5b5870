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

import lombok.Getter;
import org.fireflyframework.transformers.conversion.FieldConversions;
import org.fireflyframework.transformers.conversion.UnknownFlagPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable description of a {@link Transformer}: its field declarations,
 * virtual fields and hooks.
 *
 * <p>Configurations compose: a shared base (audit columns, for instance) is
 * built once and pulled into entity-specific configurations with
 * {@link Builder#include(TransformerConfiguration)}.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * TransformerConfiguration audit = TransformerConfiguration.builder("audit")
 *     .date("createdAt", "created_at")
 *     .date("updatedAt", "updated_at")
 *     .build();
 *
 * TransformerConfiguration posts = TransformerConfiguration.builder("posts")
 *     .include(audit)
 *     .field("id", "postid")
 *     .field("title", "post_title")
 *     .virtual("score")
 *     .build();
 *
 * Transformer transformer = new Transformer(posts);
 * }</pre>
 */
@Getter
public final class TransformerConfiguration {

    private final String name;
    private final List<FieldDeclaration> fields;
    private final Set<String> virtualFields;
    private final TransformHooks hooks;

    private TransformerConfiguration(Builder builder) {
        this.name = builder.name;
        this.fields = Collections.unmodifiableList(new ArrayList<>(builder.fields));
        this.virtualFields = Collections.unmodifiableSet(new LinkedHashSet<>(builder.virtualFields));
        this.hooks = builder.hooks;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Fills a fresh {@link DefinitionRegistry} with this configuration.
     *
     * @return the populated, unfrozen registry
     */
    public DefinitionRegistry toRegistry() {
        DefinitionRegistry registry = new DefinitionRegistry();
        fields.forEach(registry::define);
        virtualFields.forEach(registry::defineVirtual);
        return registry;
    }

    public static final class Builder {

        private final String name;
        private final List<FieldDeclaration> fields = new ArrayList<>();
        private final Set<String> virtualFields = new LinkedHashSet<>();
        private TransformHooks hooks = TransformHooks.none();
        private FieldConversions conversions;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder field(FieldDeclaration declaration) {
            fields.add(Objects.requireNonNull(declaration, "declaration"));
            return this;
        }

        public Builder field(String appKey, String extKey) {
            return field(FieldDeclaration.of(appKey, extKey));
        }

        public Builder field(String appKey, String extKey, FieldConverter appConverter, FieldConverter extConverter) {
            return field(FieldDeclaration.of(appKey, extKey, appConverter, extConverter));
        }

        public Builder virtual(String key) {
            virtualFields.add(Objects.requireNonNull(key, "key"));
            return this;
        }

        public Builder hooks(TransformHooks hooks) {
            this.hooks = Objects.requireNonNull(hooks, "hooks");
            return this;
        }

        /**
         * Sets the conversions used by {@link #date}, {@link #json} and {@link #mask}.
         * Defaults to {@link FieldConversions#defaults()}.
         */
        public Builder conversions(FieldConversions conversions) {
            this.conversions = Objects.requireNonNull(conversions, "conversions");
            return this;
        }

        public Builder date(String appKey, String extKey) {
            return field(conversions().date(appKey, extKey));
        }

        public Builder json(String appKey, String extKey) {
            return field(conversions().json(appKey, extKey));
        }

        public Builder mask(String appKey, String extKey, Map<String, Integer> mask) {
            return field(conversions().mask(appKey, extKey, mask));
        }

        public Builder mask(String appKey, String extKey, Map<String, Integer> mask, UnknownFlagPolicy policy) {
            return field(conversions().mask(appKey, extKey, mask, policy));
        }

        /**
         * Appends the fields and virtual fields of another configuration.
         * Its hooks are not carried over.
         */
        public Builder include(TransformerConfiguration other) {
            fields.addAll(other.getFields());
            virtualFields.addAll(other.getVirtualFields());
            return this;
        }

        public TransformerConfiguration build() {
            return new TransformerConfiguration(this);
        }

        private FieldConversions conversions() {
            if (conversions == null) {
                conversions = FieldConversions.defaults();
            }
            return conversions;
        }
    }
}
