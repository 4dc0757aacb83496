package com.trustbridge.models.rotation;

import com.trustbridge.models.enums.RotationType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RotationPolicyTest {

    @Test
    void shouldApplyDefaults() {
        RotationPolicy policy = RotationPolicy.builder().secretKey("jwt_secret").rotationType(RotationType.TOKEN).build();

        assertThat(policy.getIntervalDays()).isEqualTo(30);
        assertThat(policy.getMaxAgeDays()).isEqualTo(90);
        assertThat(policy.getGracePeriodHours()).isEqualTo(24);
        assertThat(policy.getRollbackTimeoutMinutes()).isEqualTo(60);
        assertThat(policy.isAutoRotate()).isTrue();
        assertThat(policy.isValidationRequired()).isTrue();
        assertThat(policy.getEnvironments()).containsExactly("dev", "staging", "prod");
        assertThatCode(policy::validate).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectPolicyWithoutKeyOrType() {
        assertThatThrownBy(() -> RotationPolicy.builder().rotationType(RotationType.TOKEN).build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RotationPolicy.builder().secretKey("jwt_secret").build().validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jwt_secret");
    }

    @Test
    void shouldRejectMaxAgeBelowInterval() {
        RotationPolicy policy = RotationPolicy.builder()
                .secretKey("db_password")
                .rotationType(RotationType.DB_PASSWORD)
                .intervalDays(30)
                .maxAgeDays(7)
                .build();

        assertThatThrownBy(policy::validate).hasMessageContaining("maxAgeDays");
    }

    @Test
    void shouldRejectEmptyEnvironments() {
        RotationPolicy policy = RotationPolicy.builder()
                .secretKey("db_password")
                .rotationType(RotationType.DB_PASSWORD)
                .environments(List.of())
                .build();

        assertThatThrownBy(policy::validate).hasMessageContaining("no environments");
    }

    @Test
    void shouldApplyToListedEnvironmentsOnly() {
        RotationPolicy policy = RotationPolicy.builder()
                .secretKey("db_password")
                .rotationType(RotationType.DB_PASSWORD)
                .environments(List.of("prod"))
                .build();

        assertThat(policy.appliesTo("prod")).isTrue();
        assertThat(policy.appliesTo("dev")).isFalse();
    }
}
