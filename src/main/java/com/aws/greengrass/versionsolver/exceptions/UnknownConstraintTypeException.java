/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.exceptions;

import lombok.Getter;

/**
 * Thrown when a constraint is requested with a type that is not branch, revision or version. This is a caller error
 * and is never defaulted.
 */
@Getter
public class UnknownConstraintTypeException extends IllegalArgumentException {
    static final long serialVersionUID = -3387516993124229948L;

    private final String constraintType;

    public UnknownConstraintTypeException(String constraintType) {
        super(String.format("Unknown constraint type '%s'", constraintType));
        this.constraintType = constraintType;
    }
}
