/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.constraint;

/**
 * Notified when a version requirement could not be parsed as a range and was kept as a literal. Useful to flag
 * manifest typos that would otherwise only show up as unmatched versions.
 */
@FunctionalInterface
public interface LiteralFallbackListener {

    void onLiteralFallback(String text, String reason);
}
