package com.trustbridge.configuration.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "trustbridge.crypto")
public class CryptoProperties {

    /**
     * base64 encoded AES key. A random key is generated at startup when absent.
     */
    private String key;
}
