/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.range;

import com.vdurmont.semver4j.Semver;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Comparator;

/**
 * A contiguous run of semantic versions. A null bound leaves that side open.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor
public final class Interval {
    private static final Interval ALL = new Interval(null, null);

    /**
     * Orders intervals by lower bound, open lower bounds first and inclusive before exclusive on a tie.
     */
    static final Comparator<Interval> BY_LOWER_BOUND = (a, b) -> {
        if (a.lower == null || b.lower == null) {
            return a.lower == null ? (b.lower == null ? 0 : -1) : 1;
        }
        int result = a.lower.compareVersion(b.lower);
        if (result != 0) {
            return result;
        }
        return Boolean.compare(b.lower.isInclusive(), a.lower.isInclusive());
    };

    private final Bound lower;
    private final Bound upper;

    public static Interval all() {
        return ALL;
    }

    public static Interval exactly(Semver version) {
        return new Interval(new Bound(version, true), new Bound(version, true));
    }

    public static Interval atLeast(Semver version) {
        return new Interval(new Bound(version, true), null);
    }

    public static Interval above(Semver version) {
        return new Interval(new Bound(version, false), null);
    }

    public static Interval below(Semver version) {
        return new Interval(null, new Bound(version, false));
    }

    public static Interval atMost(Semver version) {
        return new Interval(null, new Bound(version, true));
    }

    /**
     * Half-open interval {@code [from, until)}.
     */
    public static Interval between(Semver from, Semver until) {
        return new Interval(new Bound(from, true), new Bound(until, false));
    }

    public boolean isEmpty() {
        if (lower == null || upper == null) {
            return false;
        }
        int result = lower.compareVersion(upper);
        return result > 0 || result == 0 && !(lower.isInclusive() && upper.isInclusive());
    }

    public boolean isUnbounded() {
        return lower == null && upper == null;
    }

    public boolean contains(Semver version) {
        if (lower != null) {
            int result = Bound.compare(version, lower.getVersion());
            if (result < 0 || result == 0 && !lower.isInclusive()) {
                return false;
            }
        }
        if (upper != null) {
            int result = Bound.compare(version, upper.getVersion());
            return result < 0 || result == 0 && upper.isInclusive();
        }
        return true;
    }

    /**
     * Intersect with another interval. The result may be empty.
     */
    public Interval intersect(Interval other) {
        return new Interval(higherLower(lower, other.lower), lowerUpper(upper, other.upper));
    }

    /**
     * True when this interval, which starts no later than {@code next}, overlaps or touches it so that their union is
     * a single interval.
     */
    boolean joins(Interval next) {
        if (upper == null || next.lower == null) {
            return true;
        }
        int result = upper.compareVersion(next.lower);
        return result > 0 || result == 0 && (upper.isInclusive() || next.lower.isInclusive());
    }

    Interval span(Interval next) {
        return new Interval(lower, higherUpper(upper, next.upper));
    }

    /**
     * Render as a range expression that {@link RangeParser} reads back to the same interval.
     */
    public String render() {
        if (isUnbounded()) {
            return "*";
        }
        if (lower != null && upper != null && lower.isInclusive() && upper.isInclusive()
                && lower.compareVersion(upper) == 0) {
            return lower.getVersion().getValue();
        }
        StringBuilder sb = new StringBuilder();
        if (lower != null) {
            sb.append(lower.isInclusive() ? ">=" : ">").append(lower.getVersion().getValue());
        }
        if (upper != null) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(upper.isInclusive() ? "<=" : "<").append(upper.getVersion().getValue());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }

    private static Bound higherLower(Bound a, Bound b) {
        if (a == null || b == null) {
            return a == null ? b : a;
        }
        int result = a.compareVersion(b);
        if (result == 0) {
            return a.isInclusive() ? b : a;
        }
        return result > 0 ? a : b;
    }

    private static Bound lowerUpper(Bound a, Bound b) {
        if (a == null || b == null) {
            return a == null ? b : a;
        }
        int result = a.compareVersion(b);
        if (result == 0) {
            return a.isInclusive() ? b : a;
        }
        return result < 0 ? a : b;
    }

    private static Bound higherUpper(Bound a, Bound b) {
        if (a == null || b == null) {
            return null;
        }
        int result = a.compareVersion(b);
        if (result == 0) {
            return a.isInclusive() ? a : b;
        }
        return result > 0 ? a : b;
    }
}
