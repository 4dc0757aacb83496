package com.trustbridge.models.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Origin of a configuration entry. A lower priority value wins during the merge.
 */
@Getter
@AllArgsConstructor
public enum ConfigSource {
    REMOTE_BACKEND(1),
    ENVIRONMENT(2),
    ENV_FILE(3),
    DEFAULT(4);

    private final int priority;
}
