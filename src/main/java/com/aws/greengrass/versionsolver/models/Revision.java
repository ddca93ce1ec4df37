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
 * An immutable, content-addressed identifier such as a commit hash. Compared only by equality.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class Revision extends Version {
    private final String id;

    public Revision(@NonNull String id) {
        super();
        this.id = id;
    }

    @Override
    public VersionType getType() {
        return VersionType.REVISION;
    }

    @Override
    public Optional<String> getRevisionFacet() {
        return Optional.of(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
