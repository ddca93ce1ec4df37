/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver;

import com.aws.greengrass.versionsolver.constraint.Constraint;
import com.aws.greengrass.versionsolver.constraint.Constraints;
import com.aws.greengrass.versionsolver.exceptions.ConstraintConflictException;
import com.aws.greengrass.versionsolver.models.Version;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The requirements placed on one dependency, keyed by the party that declared each of them. One dependent can only
 * hold one requirement at a time, so re-declaring replaces the earlier one; this keeps the set correct when a
 * dependent moves to another version with different requirements.
 *
 * <p>Instances are immutable. Updates return a copy, so a search can keep the set it had before trying a candidate.
 */
@Getter
@EqualsAndHashCode
public final class DependencyConstraints {
    private static final Logger logger = LoggerFactory.getLogger(DependencyConstraints.class);
    private static final String DEPENDENCY_NAME_KEY = "dependencyName";
    private static final String DEPENDENT_KEY = "dependent";
    private static final String CONSTRAINT_KEY = "constraint";

    private final String dependencyName;
    private final Map<String, Constraint> requirements;
    @Getter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    private final Constraint effective;

    private DependencyConstraints(String dependencyName, Map<String, Constraint> requirements) {
        this.dependencyName = dependencyName;
        this.requirements = Collections.unmodifiableMap(requirements);
        this.effective = Constraints.intersectAll(requirements.values());
    }

    public static DependencyConstraints of(@NonNull String dependencyName) {
        return new DependencyConstraints(dependencyName, new LinkedHashMap<>());
    }

    /**
     * Add or replace the requirement declared by a dependent.
     *
     * @param dependent  name of the declaring party
     * @param constraint its requirement
     * @return updated copy
     */
    public DependencyConstraints withRequirement(@NonNull String dependent, @NonNull Constraint constraint) {
        Map<String, Constraint> updated = new LinkedHashMap<>(requirements);
        updated.put(dependent, constraint);
        DependencyConstraints result = new DependencyConstraints(dependencyName, updated);
        logger.atDebug()
                .addKeyValue(DEPENDENCY_NAME_KEY, dependencyName)
                .addKeyValue(DEPENDENT_KEY, dependent)
                .addKeyValue(CONSTRAINT_KEY, constraint)
                .addKeyValue("effectiveConstraint", result.effective)
                .log("Added version constraint");
        return result;
    }

    public DependencyConstraints withoutRequirement(@NonNull String dependent) {
        if (!requirements.containsKey(dependent)) {
            return this;
        }
        Map<String, Constraint> updated = new LinkedHashMap<>(requirements);
        updated.remove(dependent);
        return new DependencyConstraints(dependencyName, updated);
    }

    /**
     * All requirements combined. Universal when nothing has been declared.
     *
     * @return the intersection of every requirement
     */
    public Constraint effective() {
        return effective;
    }

    public boolean admits(@NonNull Version version) {
        return effective.matches(version);
    }

    public boolean isSatisfiable() {
        return !effective.isNone();
    }

    /**
     * Check whether a further requirement could be added without making the set unsatisfiable.
     *
     * @param candidate requirement to test
     * @return true if some version would still satisfy every requirement
     */
    public boolean isCompatibleWith(@NonNull Constraint candidate) {
        return effective.matchesAny(candidate);
    }

    /**
     * Filter candidate versions down to those every requirement admits.
     *
     * @param candidates available versions
     * @return admitted versions, in the order given
     */
    public List<Version> satisfying(@NonNull Collection<? extends Version> candidates) {
        return candidates.stream().filter(effective::matches).collect(Collectors.toList());
    }

    /**
     * Get the combined constraint, failing if no version can satisfy it.
     *
     * @return the effective constraint
     * @throws ConstraintConflictException if the requirements cannot all be met
     */
    public Constraint requireSatisfiable() throws ConstraintConflictException {
        if (effective.isNone()) {
            logger.atInfo()
                    .addKeyValue(DEPENDENCY_NAME_KEY, dependencyName)
                    .addKeyValue("requirements", requirements)
                    .log("Version constraints conflict");
            throw new ConstraintConflictException(dependencyName, requirements);
        }
        return effective;
    }

    @Override
    public String toString() {
        return String.format("%s%s", dependencyName, requirements);
    }
}
