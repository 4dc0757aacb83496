package com.trustbridge.models.enums;

public enum RotationType {
    PASSWORD,
    API_KEY,
    TOKEN,
    CERTIFICATE,
    DB_PASSWORD,
    ENCRYPTION_KEY
}
