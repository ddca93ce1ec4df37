/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.constraint;

import com.aws.greengrass.versionsolver.models.Version;
import lombok.NonNull;

/**
 * Matches no version. Absorbing element of intersection.
 */
public final class NoneConstraint extends Constraint {
    static final NoneConstraint INSTANCE = new NoneConstraint();

    private NoneConstraint() {
        super();
    }

    @Override
    public ConstraintKind getKind() {
        return ConstraintKind.NONE;
    }

    @Override
    public boolean matches(@NonNull Version version) {
        return false;
    }

    @Override
    Constraint intersectSameKind(Constraint other) {
        return this;
    }

    @Override
    public String toString() {
        return "";
    }
}
