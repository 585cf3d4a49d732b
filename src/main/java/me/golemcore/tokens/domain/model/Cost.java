package me.golemcore.tokens.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Objects;

/**
 * Monetary cost that may be undefined.
 *
 * <p>
 * An undefined cost means no contributing record could be priced. It is not
 * the same as zero: summing undefined with undefined stays undefined, and the
 * first defined operand makes the sum defined.
 */
public final class Cost implements Comparable<Cost> {

    private static final Cost UNDEFINED = new Cost(false, 0.0);

    private final boolean defined;
    private final double value;

    private Cost(boolean defined, double value) {
        this.defined = defined;
        this.value = value;
    }

    public static Cost undefined() {
        return UNDEFINED;
    }

    public static Cost of(double value) {
        return new Cost(true, value);
    }

    public boolean isDefined() {
        return defined;
    }

    /**
     * @throws IllegalStateException
     *             when the cost is undefined
     */
    public double getValue() {
        if (!defined) {
            throw new IllegalStateException("Cost is undefined");
        }
        return value;
    }

    public double orZero() {
        return defined ? value : 0.0;
    }

    public Cost plus(Cost other) {
        if (!other.defined) {
            return this;
        }
        if (!defined) {
            return other;
        }
        return Cost.of(value + other.value);
    }

    /**
     * Orders by value with undefined treated as zero.
     */
    @Override
    public int compareTo(Cost other) {
        return Double.compare(orZero(), other.orZero());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cost cost)) {
            return false;
        }
        return defined == cost.defined && Double.compare(value, cost.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(defined, value);
    }

    @Override
    public String toString() {
        return defined ? String.format("$%.4f", value) : "undefined";
    }
}
