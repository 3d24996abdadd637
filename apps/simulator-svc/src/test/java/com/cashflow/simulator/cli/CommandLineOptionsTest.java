package com.cashflow.simulator.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.YearMonth;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

class CommandLineOptionsTest {

    @Test
    void parsesSummarize() {
        CommandLineOptions options = parse("summarize", "--user=alice", "--month=202312");

        assertThat(options.command()).isEqualTo(CommandLineOptions.Command.SUMMARIZE);
        assertThat(options.user()).isEqualTo("alice");
        assertThat(options.month()).isEqualTo(YearMonth.of(2023, 12));
    }

    @Test
    void simulatorFallsBackToDefaultWindow() {
        assertThat(parse("simulator", "--user=alice").windowDays()).isEqualTo(60);
        assertThat(parse("simulator", "--user=alice", "--window=90").windowDays()).isEqualTo(90);
    }

    @Test
    void passesNonPositiveWindowThroughForTheSimulationToReject() {
        assertThat(parse("simulator", "--user=alice", "--window=0").windowDays()).isZero();
    }

    @Test
    void rejectsIncompleteCommands() {
        assertThatThrownBy(() -> parse()).isInstanceOf(CliUsageException.class).hasMessage("a command is required");
        assertThatThrownBy(() -> parse("forecast", "--user=alice"))
                .isInstanceOf(CliUsageException.class)
                .hasMessageContaining("unknown command 'forecast'");
        assertThatThrownBy(() -> parse("simulator")).isInstanceOf(CliUsageException.class).hasMessage("--user is required");
        assertThatThrownBy(() -> parse("summarize", "--user=alice")).hasMessage("--month is required");
        assertThatThrownBy(() -> parse("summarize", "--user=alice", "--month=2023-12"))
                .isInstanceOf(CliUsageException.class);
        assertThatThrownBy(() -> parse("simulator", "--user=alice", "--window=soon"))
                .isInstanceOf(CliUsageException.class)
                .hasMessageContaining("--window");
    }

    private static CommandLineOptions parse(String... args) {
        return CommandLineOptions.parse(new DefaultApplicationArguments(args), 60);
    }
}
