/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.models;

public enum VersionType {
    SEMVER, PLAIN, BRANCH, REVISION, PAIRED
}
