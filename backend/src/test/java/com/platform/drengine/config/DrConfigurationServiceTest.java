package com.platform.drengine.config;

import com.platform.drengine.MutableClock;
import com.platform.drengine.error.ConfigurationLockedException;
import com.platform.drengine.error.ErrorCode;
import com.platform.drengine.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DrConfigurationServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
    private final DrConfigurationService service =
        new DrConfigurationService(new InMemoryDrConfigurationRepository(), clock);

    @Test
    void systemScopeFallsBackToBuiltInDefaults() {
        DrConfiguration configuration = service.get(null);

        assertThat(configuration.getScopeKey()).isEqualTo(DrConfiguration.SYSTEM_SCOPE);
        assertThat(configuration.getRtoMinutes()).isEqualTo(240);
        assertThat(configuration.getRpoMinutes()).isEqualTo(15);
        assertThat(configuration.isAutoFailover()).isFalse();
        assertThat(configuration.isApprovalRequired()).isTrue();
    }

    @Test
    void tenantWithoutOwnConfigurationInheritsTheSystemOne() {
        service.update(DrConfiguration.defaults(DrConfiguration.SYSTEM_SCOPE).toBuilder().rpoMinutes(5).build());
        String tenant = DrConfiguration.tenantScope("acme");

        assertThat(service.get(tenant).getRpoMinutes()).isEqualTo(5);
        assertThat(service.get(tenant).getScopeKey()).isEqualTo(DrConfiguration.SYSTEM_SCOPE);

        service.update(DrConfiguration.defaults(tenant).toBuilder().rpoMinutes(1).build());
        assertThat(service.get(tenant).getRpoMinutes()).isEqualTo(1);
        assertThat(service.get(tenant).getUpdatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void leasedConfigurationCannotBeEditedUntilReleased() {
        DrConfiguration system = DrConfiguration.defaults(DrConfiguration.SYSTEM_SCOPE);
        DrConfigurationService.Lease first = service.acquire(null);
        DrConfigurationService.Lease second = service.acquire(DrConfiguration.tenantScope("acme"));

        assertThat(service.references(DrConfiguration.SYSTEM_SCOPE)).isEqualTo(2);
        assertThatThrownBy(() -> service.update(system))
            .isInstanceOfSatisfying(ConfigurationLockedException.class,
                e -> assertThat(e.getInFlightReferences()).isEqualTo(2));

        first.close();
        first.close();
        assertThat(service.references(DrConfiguration.SYSTEM_SCOPE)).isEqualTo(1);

        second.close();
        assertThat(service.update(system.toBuilder().rtoMinutes(60).build()).getRtoMinutes()).isEqualTo(60);
    }

    @Test
    void leaseKeepsTheConfigurationItWasTakenWith() {
        try (DrConfigurationService.Lease lease = service.acquire("tenant:other")) {
            assertThat(lease.configuration().getRtoMinutes()).isEqualTo(240);
            service.update(DrConfiguration.defaults("tenant:other").toBuilder().rtoMinutes(30).build());
            assertThat(lease.configuration().getRtoMinutes()).isEqualTo(240);
        }
    }

    @Test
    void invalidConfigurationsAreRejected() {
        DrConfiguration base = DrConfiguration.defaults("tenant:acme");

        assertThatThrownBy(() -> service.update(base.toBuilder().rtoMinutes(0).build()))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.update(base.toBuilder().rpoMinutes(-1).build()))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.update(base.toBuilder().scopeKey(" ").build()))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.update(base.toBuilder().backupSchedule("daily").build()))
            .isInstanceOfSatisfying(ValidationException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_SCHEDULE));
        assertThat(service.list()).isEmpty();
    }
}
