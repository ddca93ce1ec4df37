/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.range;

import com.vdurmont.semver4j.Semver;
import com.vdurmont.semver4j.SemverException;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses semantic version range expressions.
 *
 * <p>Alternatives are separated by {@code ||}. Inside an alternative, comparators separated by commas or whitespace
 * must all hold. A comparator is an optional operator ({@code = != > >= < <= ~ ~> ^}) followed by a version, which
 * may be partial ({@code 1.2}) or use {@code x}, {@code X} or {@code *} wildcards. {@code A - B} is an inclusive
 * hyphen range.
 */
public final class RangeParser {
    private static final String ALTERNATIVE_SEPARATOR = "||";
    private static final String HYPHEN = "-";
    // Longest operators first so that ">=" is not read as ">".
    private static final List<String> OPERATORS = Arrays.asList("!=", ">=", "<=", "~>", ">", "<", "=", "~", "^");

    private RangeParser() {
    }

    /**
     * Parse a range expression.
     *
     * @param text range expression
     * @return the parsed range, or the reason the text is not a range expression
     */
    public static RangeParseResult parse(String text) {
        if (StringUtils.isBlank(text)) {
            return RangeParseResult.invalid(text, "Range expression is empty");
        }
        try {
            SemverRange result = SemverRange.empty();
            for (String alternative : StringUtils.splitByWholeSeparatorPreserveAllTokens(text,
                    ALTERNATIVE_SEPARATOR)) {
                result = result.union(parseAlternative(alternative));
            }
            return RangeParseResult.valid(text, result);
        } catch (SemverException e) {
            return RangeParseResult.invalid(text, e.getMessage());
        }
    }

    private static SemverRange parseAlternative(String alternative) {
        String[] tokens = StringUtils.split(alternative.replace(',', ' '));
        if (tokens.length == 0) {
            throw new SemverException("Empty alternative in range expression");
        }

        // operators may be separated from their version by whitespace, as in ">= 1.2"
        List<String> comparators = new ArrayList<>();
        for (int i = 0; i < tokens.length; i++) {
            if (OPERATORS.contains(tokens[i])) {
                if (i + 1 == tokens.length) {
                    throw new SemverException(String.format("Operator '%s' is missing a version", tokens[i]));
                }
                comparators.add(tokens[i] + tokens[++i]);
            } else {
                comparators.add(tokens[i]);
            }
        }

        SemverRange result = SemverRange.all();
        for (int i = 0; i < comparators.size(); i++) {
            SemverRange range;
            if (i + 2 < comparators.size() && HYPHEN.equals(comparators.get(i + 1))) {
                range = parseHyphen(comparators.get(i), comparators.get(i + 2));
                i += 2;
            } else {
                range = parseComparator(comparators.get(i));
            }
            result = result.intersect(range);
        }
        return result;
    }

    private static SemverRange parseHyphen(String from, String to) {
        PartialVersion lower = PartialVersion.parse(from);
        PartialVersion upper = PartialVersion.parse(to);
        Interval interval = Interval.all();
        if (!lower.isAny()) {
            interval = interval.intersect(Interval.atLeast(lower.floor()));
        }
        if (!upper.isAny()) {
            interval = interval.intersect(
                    upper.isComplete() ? Interval.atMost(upper.floor()) : Interval.below(upper.ceiling()));
        }
        return SemverRange.of(interval);
    }

    @SuppressWarnings("PMD.CyclomaticComplexity")
    private static SemverRange parseComparator(String comparator) {
        String operator = "";
        for (String candidate : OPERATORS) {
            if (comparator.startsWith(candidate)) {
                operator = candidate;
                break;
            }
        }
        PartialVersion version = PartialVersion.parse(comparator.substring(operator.length()));
        if (version.isAny()) {
            return wildcard(operator);
        }

        Semver floor = version.floor();
        switch (operator) {
            case "":
            case "=":
                return SemverRange.of(version.isComplete() ? Interval.exactly(floor)
                        : Interval.between(floor, version.ceiling()));
            case "!=":
                return SemverRange.of(Interval.below(floor), version.isComplete() ? Interval.above(floor)
                        : Interval.atLeast(version.ceiling()));
            case ">":
                return SemverRange.of(version.isComplete() ? Interval.above(floor)
                        : Interval.atLeast(version.ceiling()));
            case ">=":
                return SemverRange.of(Interval.atLeast(floor));
            case "<":
                return SemverRange.of(Interval.below(floor));
            case "<=":
                return SemverRange.of(version.isComplete() ? Interval.atMost(floor)
                        : Interval.below(version.ceiling()));
            case "~":
            case "~>":
                return SemverRange.of(Interval.between(floor, tildeCeiling(version)));
            case "^":
                return SemverRange.of(Interval.between(floor, caretCeiling(version)));
            default:
                throw new SemverException(String.format("Unsupported operator '%s'", operator));
        }
    }

    private static SemverRange wildcard(String operator) {
        switch (operator) {
            case "!=":
            case ">":
            case "<":
                return SemverRange.empty();
            default:
                return SemverRange.all();
        }
    }

    // ~1.2.3 and ~1.2 allow patch changes, ~1 allows minor changes
    private static Semver tildeCeiling(PartialVersion version) {
        if (version.getMinor() == null) {
            return PartialVersion.semver(version.getMajor() + 1, 0, 0, null);
        }
        return PartialVersion.semver(version.getMajor(), version.getMinor() + 1, 0, null);
    }

    // ^ allows changes that keep the left-most non-zero part, as npm does
    private static Semver caretCeiling(PartialVersion version) {
        int major = version.getMajor();
        if (major > 0 || version.getMinor() == null) {
            return PartialVersion.semver(major + 1, 0, 0, null);
        }
        int minor = version.getMinor();
        if (minor > 0 || version.getPatch() == null) {
            return PartialVersion.semver(0, minor + 1, 0, null);
        }
        return PartialVersion.semver(0, 0, version.getPatch() + 1, null);
    }
}
