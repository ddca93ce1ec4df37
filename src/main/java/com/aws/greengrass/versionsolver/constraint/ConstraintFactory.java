/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.constraint;

import com.aws.greengrass.versionsolver.exceptions.UnknownConstraintTypeException;
import com.aws.greengrass.versionsolver.range.RangeParseResult;
import com.aws.greengrass.versionsolver.range.RangeParser;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds constraints from manifest-declared requirements.
 */
public class ConstraintFactory {
    private static final Logger logger = LoggerFactory.getLogger(ConstraintFactory.class);
    private static final String CONSTRAINT_KEY = "constraint";
    private static final String REASON_KEY = "reason";

    private final LiteralFallbackListener fallbackListener;

    public ConstraintFactory() {
        this((text, reason) -> {
        });
    }

    public ConstraintFactory(@NonNull LiteralFallbackListener fallbackListener) {
        this.fallbackListener = fallbackListener;
    }

    /**
     * Build a constraint from a type name and requirement text.
     *
     * @param type constraint type name: branch, revision or version
     * @param body requirement text
     * @return the constraint
     * @throws UnknownConstraintTypeException if the type name is not recognized
     */
    public Constraint build(String type, @NonNull String body) {
        return build(ConstraintType.fromString(type), body);
    }

    /**
     * Build a constraint of the given type. Branch and revision text is used verbatim. Version text is parsed as a
     * range expression; if it is not one, the constraint matches the text literally.
     *
     * @param type constraint type
     * @param body requirement text
     * @return the constraint
     * @throws UnknownConstraintTypeException if the type is null
     */
    public Constraint build(ConstraintType type, @NonNull String body) {
        if (type == null) {
            throw new UnknownConstraintTypeException(null);
        }
        switch (type) {
            case BRANCH:
                return Constraints.branch(body);
            case REVISION:
                return Constraints.revision(body);
            case VERSION:
                return buildVersionConstraint(body);
            default:
                throw new UnknownConstraintTypeException(type.getName());
        }
    }

    private Constraint buildVersionConstraint(String body) {
        RangeParseResult parsed = RangeParser.parse(body);
        if (parsed.isValid()) {
            return Constraints.range(parsed.getRange(), body);
        }

        logger.atDebug()
                .addKeyValue(CONSTRAINT_KEY, body)
                .addKeyValue(REASON_KEY, parsed.getError())
                .log("Version constraint is not a semver range, matching it literally");
        fallbackListener.onLiteralFallback(body, parsed.getError());
        return Constraints.literal(body);
    }
}
