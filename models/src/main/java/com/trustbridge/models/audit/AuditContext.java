package com.trustbridge.models.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Who and where an audited operation came from. Every field is optional.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditContext {
    private String userId;
    private String sessionId;
    private String ipAddress;
    private String userAgent;
    private String environment;
    private String serviceName;
    private String requestId;
    private String traceId;

    public static AuditContext system(String serviceName, String environment) {
        return AuditContext.builder().userId("SYSTEM").serviceName(serviceName).environment(environment).build();
    }
}
