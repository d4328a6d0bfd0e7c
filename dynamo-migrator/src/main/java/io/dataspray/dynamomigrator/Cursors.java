// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;
import com.google.common.io.BaseEncoding;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.Map;
import java.util.Optional;

/**
 * Renders scan cursors as compact JSON for progress output.
 */
public final class Cursors {
    private static final Gson GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .create();

    private Cursors() {
    }

    public static Optional<String> serialize(Optional<Map<String, AttributeValue>> cursorOpt) {
        return cursorOpt
                .filter(cursor -> !cursor.isEmpty())
                .map(cursor -> GSON.toJson(ImmutableSortedMap.copyOf(Maps.transformValues(cursor, Cursors::keyValue))));
    }

    private static String keyValue(AttributeValue value) {
        switch (value.type()) {
            case S:
                return value.s();
            case N:
                return value.n();
            case B:
                return BaseEncoding.base64().encode(value.b().asByteArray());
            default:
                return value.toString();
        }
    }
}
