/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.constraint;

public enum ConstraintKind {
    ANY, NONE, RANGE, REVISION, BRANCH, LITERAL
}
