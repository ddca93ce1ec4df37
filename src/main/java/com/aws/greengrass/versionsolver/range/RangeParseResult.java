/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.range;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of parsing a range expression. Exactly one of range and error is set.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RangeParseResult {
    String text;
    SemverRange range;
    String error;

    static RangeParseResult valid(String text, @NonNull SemverRange range) {
        return new RangeParseResult(text, range, null);
    }

    static RangeParseResult invalid(String text, @NonNull String error) {
        return new RangeParseResult(text, null, error);
    }

    public boolean isValid() {
        return range != null;
    }
}
