/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.constraint;

import com.aws.greengrass.versionsolver.models.Version;
import lombok.NonNull;

/**
 * A rule describing which versions of a dependency are acceptable.
 *
 * <p>The set of implementations is closed: constructors are package-private and every variant reports a
 * {@link ConstraintKind}. Constraints are immutable; every operation returns a new value or one of the shared
 * {@link Constraints#any()} and {@link Constraints#none()} sentinels, which are compared by identity.
 */
public abstract class Constraint {

    Constraint() {
    }

    public abstract ConstraintKind getKind();

    /**
     * Check whether the version is allowed by this constraint.
     *
     * @param version candidate version
     * @return true if the version is admissible
     */
    public abstract boolean matches(Version version);

    /**
     * Check whether this constraint and the other one could both be satisfied by some version. This is exactly
     * {@code !intersect(other).isNone()}.
     *
     * @param other constraint to combine with
     * @return true if the intersection is not empty
     */
    public final boolean matchesAny(@NonNull Constraint other) {
        return !intersect(other).isNone();
    }

    /**
     * Compute the constraint satisfied by exactly the versions that satisfy both this constraint and the other one.
     * Universal is the identity and empty absorbs; otherwise constraints of different kinds never intersect.
     *
     * @param other constraint to combine with
     * @return the intersection, {@link Constraints#none()} if nothing can satisfy both
     */
    public final Constraint intersect(@NonNull Constraint other) {
        switch (getKind()) {
            case ANY:
                return other;
            case NONE:
                return Constraints.none();
            default:
                break;
        }
        switch (other.getKind()) {
            case ANY:
                return this;
            case NONE:
                return Constraints.none();
            default:
                break;
        }
        if (getKind() != other.getKind()) {
            return Constraints.none();
        }
        return intersectSameKind(other);
    }

    /**
     * Variant-specific intersection. Only called with a non-sentinel constraint of the same kind.
     */
    abstract Constraint intersectSameKind(Constraint other);

    public boolean isAny() {
        return getKind() == ConstraintKind.ANY;
    }

    public boolean isNone() {
        return getKind() == ConstraintKind.NONE;
    }

    /**
     * Canonical text of the constraint: {@code *} for universal, an empty string for empty, the range expression
     * for ranges and the bare key for pins.
     */
    @Override
    public abstract String toString();
}
