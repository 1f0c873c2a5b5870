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

package org.fireflyframework.transformers.conversion;

import org.fireflyframework.transformers.exception.UnknownFlagException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FlagMask}.
 */
class FlagMaskTest {

    private final FlagMask mask = new FlagMask(Map.of("read", 0, "write", 1, "exec", 2));

    @Test
    void decode_shouldOrderFlagsByBitPosition() {
        // When & Then
        assertThat(mask.decode(7)).containsExactly("read", "write", "exec");
        assertThat(mask.decode(6L)).containsExactly("write", "exec");
    }

    @Test
    void decode_shouldAcceptNumericStrings() {
        // When & Then
        assertThat(mask.decode("5")).containsExactly("read", "exec");
        assertThat(mask.decode(" ")).isEmpty();
    }

    @Test
    void decode_withIgnorePolicy_shouldDropUnknownBits() {
        // When & Then
        assertThat(mask.getPolicy()).isEqualTo(UnknownFlagPolicy.IGNORE);
        assertThat(mask.decode(16 | 2)).containsExactly("write");
    }

    @Test
    void encode_withIgnorePolicy_shouldSkipUnknownNames() {
        // When & Then
        assertThat(mask.encode(List.of("write", "delete"))).isEqualTo(2L);
    }

    @Test
    void encode_shouldRejectNonCollections() {
        // When & Then
        assertThatThrownBy(() -> mask.encode("read"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_shouldRejectInvalidPositions() {
        // Given
        Map<String, Integer> shared = new LinkedHashMap<>();
        shared.put("a", 3);
        shared.put("b", 3);

        // When & Then
        assertThatThrownBy(() -> new FlagMask(Map.of("a", -1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FlagMask(Map.of("a", 63)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FlagMask(shared))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("share bit 3");
    }

    @Test
    void encode_shouldSupportHighBits() {
        // Given
        FlagMask wide = new FlagMask(Map.of("archived", 40));

        // When
        long encoded = wide.encode(List.of("archived"));

        // Then
        assertThat(encoded).isEqualTo(1L << 40);
        assertThat(wide.decode(encoded)).containsExactly("archived");
    }

    @Test
    void decode_shouldReadNarrowIntegersAsUnsigned() {
        // Given
        Map<String, Integer> bits = Map.of("top", 31, "wide", 40, "low", 15);
        FlagMask ignoring = new FlagMask(bits);
        FlagMask rejecting = new FlagMask(bits, UnknownFlagPolicy.REJECT);

        // When & Then
        assertThat(ignoring.decode(Integer.MIN_VALUE)).containsExactly("top");
        assertThat(rejecting.decode(Integer.MIN_VALUE)).containsExactly("top");
        assertThat(rejecting.decode(Short.MIN_VALUE)).containsExactly("low");
        assertThat(new FlagMask(Map.of("seven", 7)).decode((byte) 0x80)).containsExactly("seven");
    }

    @Test
    void decode_shouldRejectUnknownBitsWithRejectPolicy() {
        // Given
        FlagMask strict = new FlagMask(Map.of("read", 0), UnknownFlagPolicy.REJECT);

        // When & Then
        assertThatThrownBy(() -> strict.decode(3))
                .isInstanceOf(UnknownFlagException.class);
    }

    @Test
    void decode_shouldRejectNonIntegralNumbers() {
        // When & Then
        assertThat(mask.decode(5.0d)).containsExactly("read", "exec");
        assertThat(mask.decode(BigInteger.valueOf(6))).containsExactly("write", "exec");
        assertThatThrownBy(() -> mask.decode(5.5d))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("integral");
        assertThatThrownBy(() -> mask.decode(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> mask.decode(BigInteger.ONE.shiftLeft(64)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("long");
    }
}
