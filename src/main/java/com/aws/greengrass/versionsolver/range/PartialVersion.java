/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.range;

import com.vdurmont.semver4j.Semver;
import com.vdurmont.semver4j.SemverException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

/**
 * A version as written inside a range expression. Any of major, minor and patch may be missing or a wildcard
 * ({@code x}, {@code X}, {@code *}), in which case the field is null.
 */
@Getter(AccessLevel.PACKAGE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
final class PartialVersion {
    private static final Pattern NUMBER = Pattern.compile("\\d{1,9}");
    private static final Pattern PRE_RELEASE = Pattern.compile("[0-9A-Za-z-]+(\\.[0-9A-Za-z-]+)*");
    private static final int MAX_PARTS = 3;

    private final Integer major;
    private final Integer minor;
    private final Integer patch;
    private final String preRelease;
    private final boolean wildcard;

    static PartialVersion parse(String text) {
        String remaining = StringUtils.trimToEmpty(text);
        if (remaining.isEmpty()) {
            throw new SemverException("Missing version");
        }
        if ((remaining.charAt(0) == 'v' || remaining.charAt(0) == 'V') && remaining.length() > 1) {
            remaining = remaining.substring(1);
        }
        // build metadata has no bearing on precedence
        int buildStart = remaining.indexOf('+');
        if (buildStart >= 0) {
            remaining = remaining.substring(0, buildStart);
        }
        String preRelease = null;
        int preReleaseStart = remaining.indexOf('-');
        if (preReleaseStart >= 0) {
            preRelease = remaining.substring(preReleaseStart + 1);
            remaining = remaining.substring(0, preReleaseStart);
            if (!PRE_RELEASE.matcher(preRelease).matches()) {
                throw new SemverException(String.format("Invalid pre-release '%s' in version '%s'", preRelease, text));
            }
        }

        String[] parts = remaining.split("\\.", -1);
        if (parts.length > MAX_PARTS) {
            throw new SemverException(String.format("Too many parts in version '%s'", text));
        }
        Integer[] numbers = new Integer[MAX_PARTS];
        boolean wildcard = false;
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if ("x".equals(part) || "X".equals(part) || "*".equals(part)) {
                wildcard = true;
            } else if (wildcard || !NUMBER.matcher(part).matches()) {
                throw new SemverException(String.format("Invalid part '%s' in version '%s'", part, text));
            } else {
                numbers[i] = Integer.parseInt(part);
            }
        }
        if (preRelease != null && numbers[2] == null) {
            throw new SemverException(
                    String.format("Pre-release requires a full major.minor.patch version, got '%s'", text));
        }
        return new PartialVersion(numbers[0], numbers[1], numbers[2], preRelease, wildcard);
    }

    boolean isAny() {
        return major == null;
    }

    boolean isComplete() {
        return patch != null;
    }

    /**
     * Lowest version this partial version stands for; missing parts are zero.
     */
    Semver floor() {
        return semver(major, minor == null ? 0 : minor, patch == null ? 0 : patch, preRelease);
    }

    /**
     * Exclusive upper limit of the versions this partial version stands for. Only defined when a part is missing.
     */
    Semver ceiling() {
        if (minor == null) {
            return semver(major + 1, 0, 0, null);
        }
        return semver(major, minor + 1, 0, null);
    }

    static Semver semver(int major, int minor, int patch, String preRelease) {
        String value = major + "." + minor + "." + patch;
        if (preRelease != null) {
            value = value + "-" + preRelease;
        }
        return new Semver(value, Semver.SemverType.STRICT);
    }
}
