/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.constraint;

import com.aws.greengrass.versionsolver.models.Version;
import com.aws.greengrass.versionsolver.range.SemverRange;
import lombok.NonNull;

/**
 * Admits the semantic versions inside a {@link SemverRange}. Versions without a semver facet never match.
 *
 * <p>Equality depends only on the admitted versions; the expression the range was written as is kept for display.
 */
public final class RangeConstraint extends Constraint {
    private final SemverRange range;
    private final String expression;

    RangeConstraint(@NonNull SemverRange range, String expression) {
        super();
        this.range = range;
        this.expression = expression == null ? range.render() : expression;
    }

    public SemverRange getRange() {
        return range;
    }

    @Override
    public ConstraintKind getKind() {
        return ConstraintKind.RANGE;
    }

    @Override
    public boolean matches(@NonNull Version version) {
        return version.getSemverFacet().map(range::contains).orElse(false);
    }

    @Override
    Constraint intersectSameKind(Constraint other) {
        return Constraints.range(range.intersect(((RangeConstraint) other).range));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RangeConstraint)) {
            return false;
        }
        return range.equals(((RangeConstraint) o).range);
    }

    @Override
    public int hashCode() {
        return range.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
