/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.models;

import com.aws.greengrass.versionsolver.range.SemverParser;
import com.vdurmont.semver4j.Semver;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.util.Optional;

@Getter
@EqualsAndHashCode(callSuper = false)
public final class SemverVersion extends UnpairedVersion {
    private final Semver semver;

    public SemverVersion(@NonNull Semver semver) {
        super();
        this.semver = semver;
    }

    /**
     * Parse a semantic version, accepting a leading {@code v} and missing minor or patch parts.
     *
     * @param version version text
     * @return parsed version
     * @throws com.vdurmont.semver4j.SemverException if the text is not a semantic version
     */
    public static SemverVersion of(@NonNull String version) {
        return new SemverVersion(SemverParser.parse(version));
    }

    @Override
    public VersionType getType() {
        return VersionType.SEMVER;
    }

    @Override
    public Optional<Semver> getSemverFacet() {
        return Optional.of(semver);
    }

    @Override
    public String toString() {
        return semver.getValue();
    }
}
