/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.models;

import com.vdurmont.semver4j.Semver;

import java.util.Optional;

/**
 * A concrete version of a dependency. The set of subclasses is closed; constraints read versions only through the
 * facet accessors below, and an absent facet simply fails the match.
 */
public abstract class Version {

    Version() {
    }

    public abstract VersionType getType();

    public Optional<Semver> getSemverFacet() {
        return Optional.empty();
    }

    public Optional<String> getRevisionFacet() {
        return Optional.empty();
    }

    public Optional<String> getBranchFacet() {
        return Optional.empty();
    }

    public Optional<String> getLiteralFacet() {
        return Optional.empty();
    }
}
