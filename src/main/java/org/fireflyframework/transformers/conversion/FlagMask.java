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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Codec between a set of named flags and an integer bitmask.
 *
 * <p>Each flag name maps to a bit position in {@code [0, 62]}. Decoded sets
 * are ordered by bit position. An empty or {@code null} flag set encodes to
 * {@code 0}, and {@code 0} or {@code null} decodes to an empty set.</p>
 */
public final class FlagMask {

    static final int MAX_BIT = 62;

    private final Map<String, Integer> bitsByName;
    private final Map<Integer, String> namesByBit;
    private final long knownBits;
    private final UnknownFlagPolicy policy;

    /**
     * Creates a mask codec.
     *
     * @param bitsByName flag name to bit position
     * @param policy     handling of unknown names and bits
     * @throws IllegalArgumentException if a position is out of range or used twice
     */
    public FlagMask(Map<String, Integer> bitsByName, UnknownFlagPolicy policy) {
        Objects.requireNonNull(bitsByName, "bitsByName");
        this.policy = Objects.requireNonNull(policy, "policy");

        Map<Integer, String> inverse = new TreeMap<>();
        long known = 0L;
        for (Map.Entry<String, Integer> entry : bitsByName.entrySet()) {
            Integer bit = entry.getValue();
            if (bit == null || bit < 0 || bit > MAX_BIT) {
                throw new IllegalArgumentException(
                        "Bit position for flag '" + entry.getKey() + "' must be between 0 and " + MAX_BIT + ": " + bit);
            }
            String existing = inverse.putIfAbsent(bit, entry.getKey());
            if (existing != null) {
                throw new IllegalArgumentException(
                        "Flags '" + existing + "' and '" + entry.getKey() + "' share bit " + bit);
            }
            known |= 1L << bit;
        }

        this.bitsByName = Collections.unmodifiableMap(new LinkedHashMap<>(bitsByName));
        this.namesByBit = Collections.unmodifiableMap(inverse);
        this.knownBits = known;
    }

    public FlagMask(Map<String, Integer> bitsByName) {
        this(bitsByName, UnknownFlagPolicy.IGNORE);
    }

    /**
     * Encodes a collection of flag names into a bitmask.
     *
     * @param flags a collection of flag names, or {@code null}
     * @return the bitmask
     * @throws IllegalArgumentException if {@code flags} is not a collection
     * @throws UnknownFlagException     if a name is unknown and the policy is {@link UnknownFlagPolicy#REJECT}
     */
    public long encode(Object flags) {
        if (flags == null) {
            return 0L;
        }
        if (!(flags instanceof Collection<?> names)) {
            throw new IllegalArgumentException("Flags must be a collection of names: " + flags.getClass().getName());
        }

        long mask = 0L;
        for (Object name : names) {
            Integer bit = name == null ? null : bitsByName.get(name.toString());
            if (bit == null) {
                if (policy == UnknownFlagPolicy.REJECT) {
                    throw new UnknownFlagException("Unknown flag: " + name);
                }
                continue;
            }
            mask |= 1L << bit;
        }
        return mask;
    }

    /**
     * Decodes a bitmask into the set of flag names.
     *
     * <p>{@link Integer}, {@link Short} and {@link Byte} values are read as
     * unsigned, so bit 31 of an {@code INT} column decodes as bit 31 only.</p>
     *
     * @param value an integral {@link Number}, a numeric string, or {@code null}
     * @return the flag names ordered by bit position
     * @throws IllegalArgumentException if the value is not integral or does not fit in a {@code long}
     * @throws UnknownFlagException if unknown bits are set and the policy is {@link UnknownFlagPolicy#REJECT}
     */
    public Set<String> decode(Object value) {
        long mask = toLong(value);
        Set<String> flags = new LinkedHashSet<>();
        if (mask == 0L) {
            return flags;
        }

        namesByBit.forEach((bit, name) -> {
            if ((mask & (1L << bit)) != 0L) {
                flags.add(name);
            }
        });

        long unknown = mask & ~knownBits;
        if (unknown != 0L && policy == UnknownFlagPolicy.REJECT) {
            throw new UnknownFlagException("Unknown bits set in mask " + mask + ": " + unknown);
        }
        return flags;
    }

    public Map<String, Integer> getBitsByName() {
        return bitsByName;
    }

    public UnknownFlagPolicy getPolicy() {
        return policy;
    }

    private static long toLong(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number number) {
            return toLong(number);
        }
        if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            return trimmed.isEmpty() ? 0L : Long.parseLong(trimmed);
        }
        throw new IllegalArgumentException("Bitmask must be numeric: " + value.getClass().getName());
    }

    // Narrow columns hold the mask in their own width, so their sign bit is a flag bit.
    private static long toLong(Number number) {
        if (number instanceof Integer i) {
            return Integer.toUnsignedLong(i);
        }
        if (number instanceof Short s) {
            return Short.toUnsignedLong(s);
        }
        if (number instanceof Byte b) {
            return Byte.toUnsignedLong(b);
        }
        if (number instanceof Long
                || number instanceof AtomicLong
                || number instanceof AtomicInteger) {
            return number.longValue();
        }
        if (number instanceof BigInteger big) {
            if (big.bitLength() > Long.SIZE - 1) {
                throw new IllegalArgumentException("Bitmask does not fit in a long: " + big);
            }
            return big.longValue();
        }
        try {
            return new BigDecimal(number.toString()).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Bitmask must be an integral value: " + number, e);
        }
    }
}
