/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.constraint;

import com.aws.greengrass.versionsolver.models.Version;

import java.util.Optional;

public final class LiteralConstraint extends PinConstraint {

    LiteralConstraint(String text) {
        super(text);
    }

    public String getText() {
        return getKey();
    }

    @Override
    public ConstraintKind getKind() {
        return ConstraintKind.LITERAL;
    }

    @Override
    Optional<String> facetOf(Version version) {
        return version.getLiteralFacet();
    }
}
