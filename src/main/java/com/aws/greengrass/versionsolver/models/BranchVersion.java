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
 * A named branch whose underlying revision can move. Two branches are the same version when their names match.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class BranchVersion extends UnpairedVersion {
    private final String name;

    public BranchVersion(@NonNull String name) {
        super();
        this.name = name;
    }

    @Override
    public VersionType getType() {
        return VersionType.BRANCH;
    }

    @Override
    public Optional<String> getBranchFacet() {
        return Optional.of(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
