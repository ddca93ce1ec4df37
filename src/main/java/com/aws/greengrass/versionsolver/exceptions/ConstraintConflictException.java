/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.versionsolver.exceptions;

import com.aws.greengrass.versionsolver.constraint.Constraint;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class ConstraintConflictException extends Exception {
    static final long serialVersionUID = -3387516993124229948L;

    private final String dependencyName;
    private final transient Map<String, Constraint> requirements;

    public ConstraintConflictException(String dependencyName, Map<String, Constraint> requirements) {
        super(makeMessage(dependencyName, requirements));
        this.dependencyName = dependencyName;
        this.requirements = Collections.unmodifiableMap(new LinkedHashMap<>(requirements));
    }

    private static String makeMessage(String dependencyName, Map<String, Constraint> requirements) {
        StringBuilder sb = new StringBuilder("No version can satisfy all constraints on dependency ")
                .append(dependencyName).append('.').append(" Version constraints:");

        for (Map.Entry<String, Constraint> req : requirements.entrySet()) {
            sb.append(' ').append(req.getKey()).append(" requires '").append(req.getValue().toString())
                    .append("',");
        }
        if (sb.charAt(sb.length() - 1) == ',') {
            sb.deleteCharAt(sb.length() - 1);
        }
        sb.append('.');

        return sb.toString();
    }
}
