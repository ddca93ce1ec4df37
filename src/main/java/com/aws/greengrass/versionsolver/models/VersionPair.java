/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.models;

import com.vdurmont.semver4j.Semver;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.util.Optional;

/**
 * An unpaired version together with the revision it currently points at. The pair is never matched as a whole:
 * the revision facet comes from the revision, every other facet from the underlying version.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class VersionPair extends Version {
    private final UnpairedVersion version;
    private final Revision revision;

    VersionPair(@NonNull UnpairedVersion version, @NonNull Revision revision) {
        super();
        this.version = version;
        this.revision = revision;
    }

    @Override
    public VersionType getType() {
        return VersionType.PAIRED;
    }

    @Override
    public Optional<Semver> getSemverFacet() {
        return version.getSemverFacet();
    }

    @Override
    public Optional<String> getRevisionFacet() {
        return revision.getRevisionFacet();
    }

    @Override
    public Optional<String> getBranchFacet() {
        return version.getBranchFacet();
    }

    @Override
    public Optional<String> getLiteralFacet() {
        return version.getLiteralFacet();
    }

    @Override
    public String toString() {
        return String.format("%s (%s)", version, revision);
    }
}
