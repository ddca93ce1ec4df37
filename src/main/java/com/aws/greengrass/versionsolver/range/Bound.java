/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.range;

import com.vdurmont.semver4j.Semver;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import org.apache.commons.lang3.StringUtils;

import java.math.BigInteger;

@Getter
@AllArgsConstructor
public final class Bound {
    @NonNull
    private final Semver version;
    private final boolean inclusive;

    int compareVersion(Bound other) {
        return compare(version, other.version);
    }

    /**
     * Semantic version precedence. Pre-release identifiers are compared numerically when both are numeric and by
     * ASCII order otherwise, so ordering agrees with {@link #equals(Object)}.
     */
    static int compare(Semver a, Semver b) {
        int result = Integer.compare(a.getMajor(), b.getMajor());
        if (result == 0) {
            result = Integer.compare(a.getMinor(), b.getMinor());
        }
        if (result == 0) {
            result = Integer.compare(a.getPatch(), b.getPatch());
        }
        if (result != 0) {
            return result;
        }
        return comparePreRelease(a.getSuffixTokens(), b.getSuffixTokens());
    }

    private static int comparePreRelease(String[] a, String[] b) {
        // a release ranks above its pre-releases
        if (a.length == 0 || b.length == 0) {
            return Integer.compare(b.length, a.length);
        }
        for (int i = 0; i < Math.min(a.length, b.length); i++) {
            int result = compareIdentifier(a[i], b[i]);
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(a.length, b.length);
    }

    private static int compareIdentifier(String a, String b) {
        boolean numericA = StringUtils.isNumeric(a);
        boolean numericB = StringUtils.isNumeric(b);
        if (numericA && numericB) {
            return new BigInteger(a).compareTo(new BigInteger(b));
        }
        if (numericA != numericB) {
            return numericA ? -1 : 1;
        }
        return a.compareTo(b);
    }

    // Versions are normalized on the way in, so the value string identifies them.
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Bound)) {
            return false;
        }
        Bound other = (Bound) o;
        return inclusive == other.inclusive && version.getValue().equals(other.version.getValue());
    }

    @Override
    public int hashCode() {
        return 31 * version.getValue().hashCode() + (inclusive ? 1 : 0);
    }

    @Override
    public String toString() {
        return (inclusive ? "[" : "(") + version.getValue();
    }
}
