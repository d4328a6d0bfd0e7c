// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import com.google.common.base.Equivalence;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Structural equality of items. Attribute order is irrelevant, nested maps and lists are compared recursively,
 * set types are compared as sets and numbers by value.
 */
public class ItemEquivalence extends Equivalence<Map<String, AttributeValue>> {
    public static final ItemEquivalence INSTANCE = new ItemEquivalence();

    private ItemEquivalence() {
    }

    @Override
    protected boolean doEquivalent(Map<String, AttributeValue> a, Map<String, AttributeValue> b) {
        return canonical(a).equals(canonical(b));
    }

    @Override
    protected int doHash(Map<String, AttributeValue> item) {
        return canonical(item).hashCode();
    }

    /**
     * Plain value form of an item where {@link Object#equals} matches item equivalence.
     */
    public static ImmutableMap<String, Object> canonical(Map<String, AttributeValue> item) {
        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builderWithExpectedSize(item.size());
        item.forEach((name, value) -> builder.put(name, canonicalValue(value)));
        return builder.build();
    }

    private static Object canonicalValue(AttributeValue value) {
        switch (value.type()) {
            case S:
                return ImmutableList.of(AttributeValue.Type.S, value.s());
            case N:
                return ImmutableList.of(AttributeValue.Type.N, number(value.n()));
            case B:
                return ImmutableList.of(AttributeValue.Type.B, value.b());
            case BOOL:
                return ImmutableList.of(AttributeValue.Type.BOOL, value.bool());
            case NUL:
                return ImmutableList.of(AttributeValue.Type.NUL);
            case SS:
                return ImmutableList.of(AttributeValue.Type.SS, ImmutableSet.copyOf(value.ss()));
            case NS:
                return ImmutableList.of(AttributeValue.Type.NS, value.ns().stream()
                        .map(ItemEquivalence::number)
                        .collect(ImmutableSet.toImmutableSet()));
            case BS:
                return ImmutableList.of(AttributeValue.Type.BS, ImmutableSet.copyOf(value.bs()));
            case L:
                return ImmutableList.of(AttributeValue.Type.L, value.l().stream()
                        .map(ItemEquivalence::canonicalValue)
                        .collect(ImmutableList.toImmutableList()));
            case M:
                return ImmutableList.of(AttributeValue.Type.M, canonical(value.m()));
            default:
                return ImmutableList.of(value.type(), value);
        }
    }

    private static Object number(String n) {
        try {
            return new BigDecimal(n).stripTrailingZeros();
        } catch (NumberFormatException ex) {
            return n;
        }
    }
}
