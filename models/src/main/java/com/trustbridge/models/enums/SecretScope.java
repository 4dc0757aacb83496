package com.trustbridge.models.enums;

public enum SecretScope {
    GLOBAL,
    PROJECT,
    ENVIRONMENT,
    SERVICE
}
