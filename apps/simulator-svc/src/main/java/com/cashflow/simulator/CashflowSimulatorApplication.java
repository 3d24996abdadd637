package com.cashflow.simulator;

import com.cashflow.simulator.config.CashflowProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@EnableConfigurationProperties(CashflowProperties.class)
public class CashflowSimulatorApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(CashflowSimulatorApplication.class, args);
        // one-shot command runs exit with the runner's status; the web service keeps running
        if (context.getEnvironment().getProperty("cashflow.cli.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
