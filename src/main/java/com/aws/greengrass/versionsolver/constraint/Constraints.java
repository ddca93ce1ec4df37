/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.constraint;

import com.aws.greengrass.versionsolver.models.Version;
import com.aws.greengrass.versionsolver.range.Interval;
import com.aws.greengrass.versionsolver.range.SemverRange;
import lombok.NonNull;

/**
 * Constructors for every constraint variant. Ranges that admit nothing are normalized to the {@link #none()} sentinel.
 * A range admitting every semantic version stays a range: it still rejects revisions, branches and literals.
 */
public final class Constraints {

    private Constraints() {
    }

    public static Constraint any() {
        return AnyConstraint.INSTANCE;
    }

    public static Constraint none() {
        return NoneConstraint.INSTANCE;
    }

    public static Constraint range(@NonNull SemverRange range) {
        return range(range, null);
    }

    /**
     * Range constraint displayed as the given expression.
     *
     * @param range      admitted versions
     * @param expression text to display, or null to render the range
     * @return range constraint, or {@link #none()} if the range is empty
     */
    public static Constraint range(@NonNull SemverRange range, String expression) {
        if (range.isEmpty()) {
            return none();
        }
        return new RangeConstraint(range, expression);
    }

    public static Constraint revision(@NonNull String revision) {
        return new RevisionConstraint(revision);
    }

    public static Constraint branch(@NonNull String branch) {
        return new BranchConstraint(branch);
    }

    public static Constraint literal(@NonNull String text) {
        return new LiteralConstraint(text);
    }

    /**
     * Constraint that admits exactly the given version. A paired version is pinned by its revision.
     *
     * @param version version to pin
     * @return pinning constraint
     */
    public static Constraint exactly(@NonNull Version version) {
        switch (version.getType()) {
            case SEMVER:
                return range(SemverRange.of(Interval.exactly(version.getSemverFacet().get())));
            case PLAIN:
                return literal(version.getLiteralFacet().get());
            case BRANCH:
                return branch(version.getBranchFacet().get());
            case REVISION:
            case PAIRED:
                return revision(version.getRevisionFacet().get());
            default:
                throw new IllegalArgumentException("Unsupported version type " + version.getType());
        }
    }

    /**
     * Intersect all constraints, starting from {@link #any()}.
     *
     * @param constraints constraints to fold
     * @return the combined constraint
     */
    public static Constraint intersectAll(@NonNull Iterable<? extends Constraint> constraints) {
        Constraint result = any();
        for (Constraint constraint : constraints) {
            result = result.intersect(constraint);
            if (result.isNone()) {
                break;
            }
        }
        return result;
    }
}
