package com.cashflow.simulator.config;

import com.cashflow.simulator.simulation.DecisionPointPolicy;
import jakarta.annotation.PostConstruct;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final CashflowProperties props;

    public StartupDiagnostics(CashflowProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        Path usersPath = props.usersPath().toAbsolutePath().normalize();
        log.info("Startup diagnostics: usersDir='{}', usersDirExists={}, zone='{}', cliEnabled={}",
                usersPath, Files.isDirectory(usersPath), props.zoneId(), props.cli().enabledFlag());

        var simulation = props.simulation();
        log.info("Simulation config: defaultWindowDays={}, lookAheadDays={}, decisionPoint={}, transferDescription='{}'",
                simulation.defaultWindowDays(), simulation.lookAheadDays(), simulation.decisionPoint(),
                simulation.transferDescription());
        if (simulation.decisionPoint() == DecisionPointPolicy.LAST_BUSINESS_DAY) {
            log.info("Decision points use the last weekday of each month; no holiday calendar is applied");
        }
    }
}
