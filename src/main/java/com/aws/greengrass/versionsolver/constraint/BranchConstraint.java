/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.constraint;

import com.aws.greengrass.versionsolver.models.Version;

import java.util.Optional;

/**
 * Admits the versions on a named branch. Matching is by name only, never by the revision the branch points at.
 */
public final class BranchConstraint extends PinConstraint {

    BranchConstraint(String branch) {
        super(branch);
    }

    public String getBranch() {
        return getKey();
    }

    @Override
    public ConstraintKind getKind() {
        return ConstraintKind.BRANCH;
    }

    @Override
    Optional<String> facetOf(Version version) {
        return version.getBranchFacet();
    }
}
