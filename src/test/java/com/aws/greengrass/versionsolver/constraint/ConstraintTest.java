/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.constraint;

import com.aws.greengrass.versionsolver.models.BranchVersion;
import com.aws.greengrass.versionsolver.models.PlainVersion;
import com.aws.greengrass.versionsolver.models.Revision;
import com.aws.greengrass.versionsolver.models.SemverVersion;
import com.aws.greengrass.versionsolver.models.Version;
import com.aws.greengrass.versionsolver.range.RangeParser;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConstraintTest {
    private static final Version v1_0_0 = SemverVersion.of("1.0.0");
    private static final Version v1_4_9 = SemverVersion.of("1.4.9");
    private static final Version v1_5_0 = SemverVersion.of("1.5.0");
    private static final Version v1_9_9 = SemverVersion.of("1.9.9");
    private static final Version v2_0_0 = SemverVersion.of("2.0.0");

    private static Constraint range(String expression) {
        return Constraints.range(RangeParser.parse(expression).getRange(), expression);
    }

    private static List<Constraint> samples() {
        return Arrays.asList(Constraints.any(), Constraints.none(), range(">=1.0.0,<2.0.0"), range(">=1.5.0"),
                range("<1.0.0"), range("^2.0.0 || ~1.2.0"), range("!=1.5.0"), range("*"),
                Constraints.revision("abc123"), Constraints.revision("def456"), Constraints.branch("main"),
                Constraints.branch("dev"), Constraints.literal("not-a-semver-string"), Constraints.literal("other"));
    }

    private static List<Version> versions() {
        return Arrays.asList(v1_0_0, v1_4_9, v1_5_0, v1_9_9, v2_0_0, SemverVersion.of("0.1.0"),
                SemverVersion.of("1.2.7"), new Revision("abc123"), new BranchVersion("main"),
                new PlainVersion("not-a-semver-string"), SemverVersion.of("1.6.0").pairWith(new Revision("def456")),
                new BranchVersion("dev").pairWith(new Revision("abc123")));
    }

    @Test
    void GIVEN_any_constraint_WHEN_intersect_with_universal_THEN_constraint_is_returned() {
        for (Constraint c : samples()) {
            assertThat(c.intersect(Constraints.any()), sameInstance(c));
            assertThat(Constraints.any().intersect(c), sameInstance(c));
        }
    }

    @Test
    void GIVEN_any_constraint_WHEN_intersect_with_empty_THEN_empty_is_returned() {
        for (Constraint c : samples()) {
            assertThat(c.intersect(Constraints.none()), sameInstance(Constraints.none()));
            assertThat(Constraints.none().intersect(c), sameInstance(Constraints.none()));
        }
    }

    @Test
    void GIVEN_pairs_of_constraints_WHEN_intersect_THEN_order_does_not_matter() {
        for (Constraint a : samples()) {
            for (Constraint b : samples()) {
                assertThat(a + " & " + b, a.intersect(b), is(b.intersect(a)));
            }
        }
    }

    @Test
    void GIVEN_triples_of_constraints_WHEN_intersect_THEN_grouping_does_not_matter() {
        for (Constraint a : samples()) {
            for (Constraint b : samples()) {
                for (Constraint c : samples()) {
                    assertThat(a.intersect(b).intersect(c), is(a.intersect(b.intersect(c))));
                }
            }
        }
    }

    @Test
    void GIVEN_pairs_of_constraints_WHEN_matches_any_THEN_agrees_with_intersection() {
        for (Constraint a : samples()) {
            for (Constraint b : samples()) {
                assertThat(a + " & " + b, a.matchesAny(b), is(!a.intersect(b).isNone()));
            }
        }
    }

    @Test
    void GIVEN_pairs_of_constraints_WHEN_intersect_THEN_result_matches_exactly_what_both_match() {
        for (Constraint a : samples()) {
            for (Constraint b : samples()) {
                Constraint both = a.intersect(b);
                for (Version v : versions()) {
                    // cross-kind intersections are empty even where a pair version satisfies both sides
                    if (a.getKind() == b.getKind() || a.isAny() || b.isAny()) {
                        assertThat(a + " & " + b + " on " + v, both.matches(v), is(a.matches(v) && b.matches(v)));
                    } else if (!a.isNone() && !b.isNone()) {
                        assertThat(both, sameInstance(Constraints.none()));
                    }
                }
            }
        }
    }

    @Test
    void GIVEN_overlapping_ranges_WHEN_intersect_THEN_result_is_the_overlap() {
        Constraint result = range(">=1.0.0,<2.0.0").intersect(range(">=1.5.0"));

        assertThat(result, instanceOf(RangeConstraint.class));
        assertThat(result.matches(v1_5_0), is(true));
        assertThat(result.matches(v1_9_9), is(true));
        assertThat(result.matches(v1_4_9), is(false));
        assertThat(result.matches(v2_0_0), is(false));
        assertThat(result.toString(), is(">=1.5.0, <2.0.0"));
    }

    @Test
    void GIVEN_disjoint_ranges_WHEN_intersect_THEN_empty_sentinel_is_returned() {
        Constraint result = range(">=1.0.0,<2.0.0").intersect(range("<1.0.0"));
        assertThat(result, sameInstance(Constraints.none()));
        assertThat(range(">=1.0.0,<2.0.0").matchesAny(range("<1.0.0")), is(false));
    }

    @Test
    void GIVEN_revision_and_range_WHEN_intersect_THEN_empty() {
        assertThat(Constraints.revision("abc123").intersect(range(">=1.0.0")), sameInstance(Constraints.none()));
        assertThat(range(">=1.0.0").intersect(Constraints.revision("abc123")), sameInstance(Constraints.none()));
        assertThat(Constraints.branch("main").intersect(Constraints.literal("main")), sameInstance(Constraints.none()));
    }

    @Test
    void GIVEN_branch_pins_WHEN_intersect_THEN_same_name_agrees_and_different_name_conflicts() {
        Constraint main = Constraints.branch("main");

        Constraint same = main.intersect(Constraints.branch("main"));
        assertThat(same, instanceOf(BranchConstraint.class));
        assertThat(((BranchConstraint) same).getBranch(), is("main"));
        assertThat(same, is(main));

        assertThat(main.intersect(Constraints.branch("dev")), sameInstance(Constraints.none()));
    }

    @Test
    void GIVEN_revision_and_literal_pins_WHEN_intersect_THEN_keys_must_match() {
        assertThat(Constraints.revision("abc123").intersect(Constraints.revision("abc123")),
                is(Constraints.revision("abc123")));
        assertThat(Constraints.revision("abc123").intersect(Constraints.revision("def456")),
                sameInstance(Constraints.none()));
        assertThat(Constraints.literal("x").intersect(Constraints.literal("y")), sameInstance(Constraints.none()));
    }

    @Test
    void GIVEN_paired_version_WHEN_matches_THEN_facet_understood_by_constraint_is_used() {
        Version pair = SemverVersion.of("1.5.0").pairWith(new Revision("abc123"));

        assertThat(range(">=1.0.0").matches(pair), is(true));
        assertThat(range("<1.0.0").matches(pair), is(false));
        assertThat(Constraints.revision("abc123").matches(pair), is(true));
        assertThat(Constraints.revision("def456").matches(pair), is(false));
        assertThat(Constraints.branch("main").matches(pair), is(false));
        assertThat(Constraints.literal("1.5.0").matches(pair), is(false));

        Version branchPair = new BranchVersion("main").pairWith(new Revision("abc123"));
        assertThat(Constraints.branch("main").matches(branchPair), is(true));
        assertThat(range(">=0.0.0").matches(branchPair), is(false));
    }

    @Test
    void GIVEN_version_without_required_facet_WHEN_matches_THEN_false() {
        assertThat(Constraints.revision("abc123").matches(v1_0_0), is(false));
        assertThat(Constraints.branch("1.0.0").matches(v1_0_0), is(false));
        assertThat(Constraints.literal("1.0.0").matches(v1_0_0), is(false));
        assertThat(range(">=1.0.0").matches(new PlainVersion("1.0.0")), is(false));
        assertThat(range(">=1.0.0").matches(new Revision("1.0.0")), is(false));
    }

    @Test
    void GIVEN_sentinels_WHEN_matches_THEN_all_or_nothing() {
        for (Version v : versions()) {
            assertThat(Constraints.any().matches(v), is(true));
            assertThat(Constraints.none().matches(v), is(false));
        }
        assertThat(Constraints.any().matchesAny(Constraints.branch("main")), is(true));
        assertThat(Constraints.none().matchesAny(Constraints.any()), is(false));
    }

    @Test
    void GIVEN_constraints_WHEN_to_string_THEN_canonical_text() {
        assertThat(Constraints.any().toString(), is("*"));
        assertThat(Constraints.none().toString(), is(""));
        assertThat(range(">=1.0.0,<2.0.0").toString(), is(">=1.0.0,<2.0.0"));
        assertThat(Constraints.revision("abc123").toString(), is("abc123"));
        assertThat(Constraints.branch("main").toString(), is("main"));
        assertThat(Constraints.literal("not-a-semver-string").toString(), is("not-a-semver-string"));
    }

    @Test
    void GIVEN_null_version_WHEN_matches_THEN_every_variant_rejects_it() {
        for (Constraint c : samples()) {
            assertThrows(NullPointerException.class, () -> c.matches(null), c.getKind().toString());
        }
    }

    @Test
    void GIVEN_empty_range_WHEN_create_THEN_empty_sentinel_is_returned() {
        assertThat(range(">=2.0.0 <1.0.0"), sameInstance(Constraints.none()));
        assertThat(range("<*"), sameInstance(Constraints.none()));
    }

    @Test
    void GIVEN_range_covering_every_semver_WHEN_create_THEN_it_still_only_admits_semver() {
        for (String expression : Arrays.asList("*", "<1.0.0 || >=1.0.0")) {
            Constraint constraint = range(expression);

            assertThat(constraint, instanceOf(RangeConstraint.class));
            assertThat(constraint.isAny(), is(false));
            assertThat(constraint.matches(v1_0_0), is(true));
            assertThat(constraint.matches(SemverVersion.of("0.0.1-alpha")), is(true));
            assertThat(constraint.matches(SemverVersion.of("1.6.0").pairWith(new Revision("def456"))), is(true));
            assertThat(constraint.matches(new Revision("abc123")), is(false));
            assertThat(constraint.matches(new BranchVersion("main")), is(false));
            assertThat(constraint.matches(new PlainVersion("not-a-semver-string")), is(false));
            assertThat(constraint.intersect(Constraints.revision("abc123")), sameInstance(Constraints.none()));
            assertThat(Constraints.branch("main").intersect(constraint), sameInstance(Constraints.none()));
            assertThat(constraint.intersect(range(">=1.5.0")), is(range(">=1.5.0")));
        }
        assertThat(range("<1.0.0 || >=1.0.0"), is(range("*")));
        assertThat(Constraints.range(RangeParser.parse("x").getRange()).toString(), is("*"));
    }

    @Test
    void GIVEN_concrete_versions_WHEN_exactly_THEN_only_that_version_matches() {
        Constraint semver = Constraints.exactly(v1_5_0);
        assertThat(semver, instanceOf(RangeConstraint.class));
        assertThat(semver.matches(v1_5_0), is(true));
        assertThat(semver.matches(v1_4_9), is(false));
        assertThat(semver.toString(), is("1.5.0"));

        assertThat(Constraints.exactly(new BranchVersion("main")), is(Constraints.branch("main")));
        assertThat(Constraints.exactly(new PlainVersion("tag")), is(Constraints.literal("tag")));
        assertThat(Constraints.exactly(new Revision("abc123")), is(Constraints.revision("abc123")));
        Version pair = SemverVersion.of("1.5.0").pairWith(new Revision("abc123"));
        assertThat(Constraints.exactly(pair), is(Constraints.revision("abc123")));
    }

    @Test
    void GIVEN_constraints_WHEN_intersect_all_THEN_fold_starts_from_universal() {
        assertThat(Constraints.intersectAll(Arrays.<Constraint>asList()), sameInstance(Constraints.any()));
        assertThat(Constraints.intersectAll(Arrays.asList(range(">=1.0.0"), range("<2.0.0"), range("!=1.5.0"))),
                is(range(">=1.0.0 <1.5.0 || >1.5.0 <2.0.0")));
        assertThat(Constraints.intersectAll(Arrays.asList(range(">=1.0.0"), Constraints.branch("main"))),
                sameInstance(Constraints.none()));
    }
}
