/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.range;

import com.vdurmont.semver4j.Semver;
import lombok.EqualsAndHashCode;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A set of semantic versions stored as disjoint intervals, sorted by lower bound. Intervals that overlap or touch are
 * merged on construction, so two ranges admitting the same versions are equal.
 */
@EqualsAndHashCode
public final class SemverRange {
    private static final SemverRange EMPTY = new SemverRange(Collections.emptyList());
    private static final SemverRange ALL = new SemverRange(Collections.singletonList(Interval.all()));

    private final List<Interval> intervals;

    private SemverRange(List<Interval> intervals) {
        this.intervals = intervals;
    }

    public static SemverRange empty() {
        return EMPTY;
    }

    public static SemverRange all() {
        return ALL;
    }

    public static SemverRange of(Interval... intervals) {
        return of(Arrays.asList(intervals));
    }

    /**
     * Build a range from arbitrary intervals; empty ones are dropped and the rest are sorted and merged.
     */
    public static SemverRange of(@NonNull Collection<Interval> intervals) {
        List<Interval> sorted = intervals.stream()
                .filter(i -> !i.isEmpty())
                .sorted(Interval.BY_LOWER_BOUND)
                .collect(Collectors.toList());
        if (sorted.isEmpty()) {
            return EMPTY;
        }

        List<Interval> merged = new ArrayList<>();
        Interval current = sorted.get(0);
        for (Interval next : sorted.subList(1, sorted.size())) {
            if (current.joins(next)) {
                current = current.span(next);
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return new SemverRange(Collections.unmodifiableList(merged));
    }

    public List<Interval> getIntervals() {
        return intervals;
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    public boolean isUnbounded() {
        return intervals.size() == 1 && intervals.get(0).isUnbounded();
    }

    public boolean contains(@NonNull Semver version) {
        for (Interval interval : intervals) {
            if (interval.contains(version)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Versions present in both ranges: every pairwise interval intersection that is not empty.
     */
    public SemverRange intersect(@NonNull SemverRange other) {
        if (isEmpty() || other.isEmpty()) {
            return EMPTY;
        }
        List<Interval> result = new ArrayList<>();
        for (Interval a : intervals) {
            for (Interval b : other.intervals) {
                Interval overlap = a.intersect(b);
                if (!overlap.isEmpty()) {
                    result.add(overlap);
                }
            }
        }
        return of(result);
    }

    public SemverRange union(@NonNull SemverRange other) {
        List<Interval> combined = new ArrayList<>(intervals);
        combined.addAll(other.intervals);
        return of(combined);
    }

    /**
     * Render as a range expression, alternatives separated by {@code ||}. The empty range renders as an empty
     * string.
     */
    public String render() {
        return intervals.stream().map(Interval::render).collect(Collectors.joining(" || "));
    }

    @Override
    public String toString() {
        return render();
    }
}
