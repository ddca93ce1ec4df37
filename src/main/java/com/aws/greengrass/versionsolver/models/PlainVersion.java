/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.models;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.util.Optional;

/**
 * Unstructured version text, such as a tag that does not follow semver.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class PlainVersion extends UnpairedVersion {
    private final String text;

    public PlainVersion(@NonNull String text) {
        super();
        this.text = text;
    }

    @Override
    public VersionType getType() {
        return VersionType.PLAIN;
    }

    @Override
    public Optional<String> getLiteralFacet() {
        return Optional.of(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
