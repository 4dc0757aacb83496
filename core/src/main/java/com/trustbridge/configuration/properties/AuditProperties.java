package com.trustbridge.configuration.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "audit")
@Validated
public class AuditProperties {

    private boolean enabled = true;

    /**
     * name recorded as serviceName in the context of events logged by this process
     */
    @NotEmpty
    private String serviceName = "trustbridge";

    /**
     * number of buffered events after which the buffer is flushed without waiting for the flush interval
     */
    @Min(1)
    private int bufferSize = 100;

    @NotNull
    private Duration flushInterval = Duration.ofSeconds(30);

    @NotNull
    private Duration rotationInterval = Duration.ofDays(1);

    private File file = new File();

    private Syslog syslog = new Syslog();

    @Getter
    @Setter
    public static class File {
        private boolean enabled = true;

        @NotEmpty
        private String path = "logs/audit.log";

        /**
         * size above which the rotation loop renames and compresses the audit file
         */
        @NotNull
        private DataSize maxFileSize = DataSize.ofMegabytes(100);

        private boolean encryptionEnabled = true;

        /**
         * gzip every flushed batch into a single line
         */
        private boolean compressionEnabled = false;
    }

    @Getter
    @Setter
    public static class Syslog {
        private boolean enabled = false;
    }
}
