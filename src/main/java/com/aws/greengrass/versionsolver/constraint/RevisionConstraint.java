/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.constraint;

import com.aws.greengrass.versionsolver.models.Version;

import java.util.Optional;

/**
 * Admits only the version with the given revision, whether bare or paired.
 */
public final class RevisionConstraint extends PinConstraint {

    RevisionConstraint(String revision) {
        super(revision);
    }

    public String getRevision() {
        return getKey();
    }

    @Override
    public ConstraintKind getKind() {
        return ConstraintKind.REVISION;
    }

    @Override
    Optional<String> facetOf(Version version) {
        return version.getRevisionFacet();
    }
}
