/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.constraint;

import com.aws.greengrass.versionsolver.models.Version;
import lombok.NonNull;

import java.util.Optional;

/**
 * Base of the constraints that admit a single key: a revision, a branch name or a literal. A version matches when
 * its corresponding facet equals the key, and two pins of the same kind agree only when their keys do.
 */
abstract class PinConstraint extends Constraint {
    private final String key;

    PinConstraint(@NonNull String key) {
        super();
        this.key = key;
    }

    String getKey() {
        return key;
    }

    abstract Optional<String> facetOf(Version version);

    @Override
    public boolean matches(@NonNull Version version) {
        return facetOf(version).map(key::equals).orElse(false);
    }

    @Override
    Constraint intersectSameKind(Constraint other) {
        return key.equals(((PinConstraint) other).key) ? this : Constraints.none();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PinConstraint)) {
            return false;
        }
        PinConstraint other = (PinConstraint) o;
        return getKind() == other.getKind() && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return 31 * getKind().hashCode() + key.hashCode();
    }

    @Override
    public String toString() {
        return key;
    }
}
