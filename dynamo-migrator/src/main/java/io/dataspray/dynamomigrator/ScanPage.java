// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import com.google.common.collect.ImmutableList;
import lombok.NonNull;
import lombok.Value;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.Map;
import java.util.Optional;

@Value
public class ScanPage {

    @NonNull
    ImmutableList<Map<String, AttributeValue>> items;

    /**
     * Present iff more pages remain.
     */
    @NonNull
    Optional<Map<String, AttributeValue>> cursorOpt;
}
