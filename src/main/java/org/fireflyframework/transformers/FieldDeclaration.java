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

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Declaration of one logical field: its name on each side and the converter
 * used when entering each side.
 *
 * <p>A declaration expands into the mirror pair of {@link FieldDefinition}s
 * stored by the {@link DefinitionRegistry}.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * FieldDeclaration id = FieldDeclaration.builder()
 *     .appKey("id")
 *     .extKey("postid")
 *     .appConverter(FieldConverter.of(v -> Integer.valueOf(v.toString())))
 *     .extConverter(FieldConverter.of(String::valueOf))
 *     .build();
 * }</pre>
 */
@Value
public class FieldDeclaration {

    String appKey;
    String extKey;
    FieldConverter appConverter;
    FieldConverter extConverter;
    List<Object> appArgs;
    List<Object> extArgs;

    @Builder
    private FieldDeclaration(String appKey, String extKey,
                             FieldConverter appConverter, FieldConverter extConverter,
                             List<Object> appArgs, List<Object> extArgs) {
        this.appKey = Objects.requireNonNull(appKey, "appKey");
        this.extKey = Objects.requireNonNull(extKey, "extKey");
        this.appConverter = appConverter;
        this.extConverter = extConverter;
        this.appArgs = copy(appArgs);
        this.extArgs = copy(extArgs);
    }

    /**
     * Declares a field that is renamed without value conversion.
     */
    public static FieldDeclaration of(String appKey, String extKey) {
        return builder().appKey(appKey).extKey(extKey).build();
    }

    public static FieldDeclaration of(String appKey, String extKey,
                                      FieldConverter appConverter, FieldConverter extConverter) {
        return builder()
                .appKey(appKey)
                .extKey(extKey)
                .appConverter(appConverter)
                .extConverter(extConverter)
                .build();
    }

    /**
     * Definition applied to application records, keyed by {@link #getAppKey()}.
     */
    public FieldDefinition toExternalDefinition() {
        return FieldDefinition.builder()
                .targetKey(extKey)
                .sourceKey(appKey)
                .converter(extConverter)
                .converterArgs(extArgs)
                .build();
    }

    /**
     * Definition applied to external records, keyed by {@link #getExtKey()}.
     */
    public FieldDefinition toApplicationDefinition() {
        return FieldDefinition.builder()
                .targetKey(appKey)
                .sourceKey(extKey)
                .converter(appConverter)
                .converterArgs(appArgs)
                .build();
    }

    private static List<Object> copy(List<Object> args) {
        return args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }
}
