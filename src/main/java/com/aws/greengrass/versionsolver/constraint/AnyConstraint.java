/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.constraint;

import com.aws.greengrass.versionsolver.models.Version;
import lombok.NonNull;

/**
 * Matches every version. Identity element of intersection.
 */
public final class AnyConstraint extends Constraint {
    static final AnyConstraint INSTANCE = new AnyConstraint();

    private AnyConstraint() {
        super();
    }

    @Override
    public ConstraintKind getKind() {
        return ConstraintKind.ANY;
    }

    @Override
    public boolean matches(@NonNull Version version) {
        return true;
    }

    @Override
    Constraint intersectSameKind(Constraint other) {
        return this;
    }

    @Override
    public String toString() {
        return "*";
    }
}
