// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.List;
import java.util.Map;

/**
 * Decides which items of a source page are missing from a destination page.
 */
public class PageComparator {

    /**
     * @return true if both pages hold equivalent items in the same order
     */
    public boolean identical(List<Map<String, AttributeValue>> sourceItems, List<Map<String, AttributeValue>> destItems) {
        return ItemEquivalence.INSTANCE.pairwise().equivalent(sourceItems, destItems);
    }

    /**
     * Every source item with no equivalent anywhere in the destination items, in source order.
     * Source duplicates are kept as they are; only membership in the destination is tested.
     */
    public ImmutableList<Map<String, AttributeValue>> diff(List<Map<String, AttributeValue>> sourceItems, List<Map<String, AttributeValue>> destItems) {
        if (sourceItems.isEmpty()) {
            return ImmutableList.of();
        }
        ImmutableSet<ImmutableMap<String, Object>> present = destItems.stream()
                .map(ItemEquivalence::canonical)
                .collect(ImmutableSet.toImmutableSet());
        return sourceItems.stream()
                .filter(item -> !present.contains(ItemEquivalence.canonical(item)))
                .collect(ImmutableList.toImmutableList());
    }
}
