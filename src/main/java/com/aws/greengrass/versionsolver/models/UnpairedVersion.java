/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.models;

import lombok.NonNull;

/**
 * A version that is not yet bound to the revision it was fetched at.
 */
public abstract class UnpairedVersion extends Version {

    UnpairedVersion() {
        super();
    }

    public VersionPair pairWith(@NonNull Revision revision) {
        return new VersionPair(this, revision);
    }
}
