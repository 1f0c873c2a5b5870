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

import org.fireflyframework.transformers.Direction;
import org.fireflyframework.transformers.Transformer;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Objects;

/**
 * Reactive facade over a {@link Transformer} for repositories built on
 * Project Reactor.
 *
 * <p>Transformation stays synchronous: each record is converted inside
 * {@link Mono#fromCallable} and any exception becomes an error signal.
 * Flux variants preserve element order and stop at the first failing
 * record.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ReactiveTransformer posts = new ReactiveTransformer(transformer);
 * Flux<Map<String, Object>> rows = databaseClient.sql("SELECT * FROM posts").fetch().all();
 * Flux<Map<String, Object>> app = posts.toApp(rows);
 * }</pre>
 */
public class ReactiveTransformer {

    private final Transformer transformer;

    public ReactiveTransformer(Transformer transformer) {
        this.transformer = Objects.requireNonNull(transformer, "transformer");
    }

    /**
     * Transforms a record into the given direction.
     *
     * @param direction the target direction
     * @param record    the record, may be {@code null}
     * @return a {@link Mono} emitting the transformed record, or empty for a {@code null} record
     */
    public Mono<Map<String, Object>> to(Direction direction, Map<String, Object> record) {
        return Mono.fromCallable(() -> transformer.to(direction, record));
    }

    public Mono<Map<String, Object>> toApp(Map<String, Object> record) {
        return to(Direction.APPLICATION, record);
    }

    public Mono<Map<String, Object>> toExt(Map<String, Object> record) {
        return to(Direction.EXTERNAL, record);
    }

    /**
     * Transforms every record of a stream into the given direction.
     *
     * @param direction the target direction
     * @param records   the records
     * @return a {@link Flux} of transformed records in source order
     */
    public Flux<Map<String, Object>> to(Direction direction, Flux<Map<String, Object>> records) {
        return records.concatMap(record -> to(direction, record));
    }

    public Flux<Map<String, Object>> toApp(Flux<Map<String, Object>> records) {
        return to(Direction.APPLICATION, records);
    }

    public Flux<Map<String, Object>> toExt(Flux<Map<String, Object>> records) {
        return to(Direction.EXTERNAL, records);
    }

    public Transformer getTransformer() {
        return transformer;
    }
}
