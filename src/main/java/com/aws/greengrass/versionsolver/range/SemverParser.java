/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.range;

import com.vdurmont.semver4j.Semver;
import com.vdurmont.semver4j.SemverException;

/**
 * Parses concrete semantic versions into the normalized {@code MAJOR.MINOR.PATCH[-PRERELEASE]} form used by ranges.
 */
public final class SemverParser {

    private SemverParser() {
    }

    /**
     * Parse a concrete version. A leading {@code v} is accepted, missing minor and patch parts default to zero and
     * build metadata is dropped.
     *
     * @param version version text
     * @return normalized semver
     * @throws SemverException if the text is not a concrete semantic version
     */
    public static Semver parse(String version) {
        PartialVersion partial = PartialVersion.parse(version);
        if (partial.isWildcard()) {
            throw new SemverException(String.format("Wildcards are not allowed in a concrete version '%s'", version));
        }
        return partial.floor();
    }
}
