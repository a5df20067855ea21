package com.my.offers.adapter.out.health;

import com.my.offers.adapter.in.relay.RelayRuntime;
import com.my.offers.config.AppConfig;
import com.my.offers.domain.model.RelayTargets;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class RelayReadinessCheck implements HealthCheck {

    private final RelayRuntime runtime;
    private final RelayTargets targets;
    private final AppConfig appConfig;

    public RelayReadinessCheck(RelayRuntime runtime, RelayTargets targets, AppConfig appConfig) {
        this.runtime = runtime;
        this.targets = targets;
        this.appConfig = appConfig;
    }

    @Override
    public HealthCheckResponse call() {
        RelayRuntime.Status status = runtime.status();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("relay-readiness")
                .withData("destination", targets.destinationChat())
                .withData("dryRun", targets.dryRun())
                .withData("telegramConfigured", appConfig.telegram().botToken().filter(token -> !token.isBlank()).isPresent())
                .withData("sources", status.sources())
                .withData("queued", status.queued())
                .withData("pendingRedeliveries", status.pending())
                .status(status.running());
        if (status.fatalError() != null) {
            builder.withData("fatalError", status.fatalError());
        }
        return builder.build();
    }
}
