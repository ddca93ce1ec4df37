/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.constraint;

import com.aws.greengrass.versionsolver.exceptions.UnknownConstraintTypeException;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * How a requirement was declared in a manifest.
 */
@Getter
@AllArgsConstructor
public enum ConstraintType {
    BRANCH("branch"), REVISION("revision"), VERSION("version");

    private final String name;

    /**
     * Look up a type by its manifest name, ignoring case.
     *
     * @param name manifest name
     * @return the matching type
     * @throws UnknownConstraintTypeException if no type has that name
     */
    public static ConstraintType fromString(String name) {
        for (ConstraintType type : values()) {
            if (type.name.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new UnknownConstraintTypeException(name);
    }
}
