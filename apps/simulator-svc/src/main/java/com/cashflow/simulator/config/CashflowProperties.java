package com.cashflow.simulator.config;

import com.cashflow.simulator.simulation.DecisionPointPolicy;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "cashflow")
public record CashflowProperties(
        String usersDir,
        String zone,
        Simulation simulation,
        Cli cli
) {

    @ConstructorBinding
    public CashflowProperties {
        if (usersDir == null || usersDir.isBlank()) {
            throw new IllegalArgumentException("usersDir must be provided");
        }
        if (simulation == null) {
            throw new IllegalArgumentException("simulation configuration must be provided");
        }
        if (zone != null && !zone.isBlank()) {
            try {
                ZoneId.of(zone);
            } catch (DateTimeException ex) {
                throw new IllegalArgumentException("zone is not a valid time zone id: " + zone, ex);
            }
        }
        // cli may be omitted when the service only runs as a web app
    }

    public Cli cli() {
        return cli != null ? cli : new Cli(null);
    }

    public Path usersPath() {
        return Path.of(usersDir);
    }

    public ZoneId zoneId() {
        return (zone != null && !zone.isBlank()) ? ZoneId.of(zone) : ZoneOffset.UTC;
    }

    public record Simulation(
            Integer defaultWindowDays,
            Integer lookAheadDays,
            DecisionPointPolicy decisionPoint,
            String transferDescription,
            String transferCategory
    ) {
        public static final int DEFAULT_WINDOW_DAYS = 60;
        public static final int DEFAULT_LOOK_AHEAD_DAYS = 30;

        public Simulation {
            if (defaultWindowDays == null) {
                defaultWindowDays = DEFAULT_WINDOW_DAYS;
            }
            if (defaultWindowDays <= 0) {
                throw new IllegalArgumentException("defaultWindowDays must be positive");
            }
            if (lookAheadDays == null) {
                lookAheadDays = DEFAULT_LOOK_AHEAD_DAYS;
            }
            if (lookAheadDays <= 0) {
                throw new IllegalArgumentException("lookAheadDays must be positive");
            }
            if (decisionPoint == null) {
                decisionPoint = DecisionPointPolicy.LAST_CALENDAR_DAY;
            }
            if (transferDescription == null || transferDescription.isBlank()) {
                transferDescription = "Surplus Transfer";
            }
            if (transferCategory == null || transferCategory.isBlank()) {
                transferCategory = "System";
            }
        }
    }

    public record Cli(Boolean enabled) {
        public boolean enabledFlag() {
            return enabled != null && enabled;
        }
    }
}
