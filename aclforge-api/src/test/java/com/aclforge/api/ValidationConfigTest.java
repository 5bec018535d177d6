package com.aclforge.api;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Period;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationConfigTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty("ACLFORGE_EXPIRY_WARN_WEEKS");
    }

    @Test
    @DisplayName("Warn horizon is today plus the warn window")
    void shouldComputeWarnHorizon() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);

        ValidationConfig config = ValidationConfig.of(clock, 2);

        assertThat(config.today()).isEqualTo(LocalDate.of(2025, 3, 1));
        assertThat(config.warnHorizon()).isEqualTo(LocalDate.of(2025, 3, 15));
    }

    @Test
    @DisplayName("Should read the warn window from a system property")
    void shouldReadWarnWeeksFromProperty() {
        System.setProperty("ACLFORGE_EXPIRY_WARN_WEEKS", "4");

        assertThat(ValidationConfig.fromEnvironment().warnWindow()).isEqualTo(Period.ofWeeks(4));
    }

    @Test
    @DisplayName("Should reject a non-numeric or negative warn window")
    void shouldRejectInvalidWarnWindow() {
        System.setProperty("ACLFORGE_EXPIRY_WARN_WEEKS", "soon");

        assertThatThrownBy(ValidationConfig::fromEnvironment)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ACLFORGE_EXPIRY_WARN_WEEKS");
        assertThatThrownBy(() -> new ValidationConfig(LocalDate.now(), Period.ofWeeks(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
