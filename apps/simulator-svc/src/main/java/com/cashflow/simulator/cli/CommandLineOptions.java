package com.cashflow.simulator.cli;

import com.cashflow.simulator.summary.ProfitAndLossCalculator;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import org.springframework.boot.ApplicationArguments;

/**
 * Parsed form of {@code summarize --user=<name> --month=<YYYYMM>} and
 * {@code simulator --user=<name> [--window=<days>]}.
 */
public record CommandLineOptions(Command command, String user, YearMonth month, int windowDays) {

    public static final String USAGE = String.join("\n",
            "Usage:",
            "  summarize --user=<name> --month=<YYYYMM>   Generate a P&L summary for a specific month.",
            "  simulator --user=<name> [--window=<days>]  Project cash flow over a given time window.");

    public enum Command {
        SUMMARIZE("summarize"),
        SIMULATOR("simulator");

        private final String commandName;

        Command(String commandName) {
            this.commandName = commandName;
        }

        public String commandName() {
            return commandName;
        }

        static Optional<Command> fromName(String name) {
            for (Command command : values()) {
                if (command.commandName.equals(name)) {
                    return Optional.of(command);
                }
            }
            return Optional.empty();
        }
    }

    public static CommandLineOptions parse(ApplicationArguments args, int defaultWindowDays) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            throw new CliUsageException("a command is required");
        }
        String name = positional.get(0);
        Command command = Command.fromName(name)
                .orElseThrow(() -> new CliUsageException("unknown command '" + name + "'"));

        String user = requireOption(args, "user");
        return switch (command) {
            case SUMMARIZE -> {
                String month = requireOption(args, "month");
                try {
                    yield new CommandLineOptions(command, user, ProfitAndLossCalculator.parseMonth(month), defaultWindowDays);
                } catch (IllegalArgumentException ex) {
                    throw new CliUsageException(ex.getMessage(), ex);
                }
            }
            case SIMULATOR -> new CommandLineOptions(command, user, null, windowOption(args, defaultWindowDays));
        };
    }

    private static String requireOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new CliUsageException("--" + name + " is required");
        }
        return values.get(0).trim();
    }

    private static int windowOption(ApplicationArguments args, int defaultWindowDays) {
        List<String> values = args.getOptionValues("window");
        if (values == null || values.isEmpty()) {
            return defaultWindowDays;
        }
        try {
            return Integer.parseInt(values.get(0).trim());
        } catch (NumberFormatException ex) {
            throw new CliUsageException("--window must be an integer but was '" + values.get(0) + "'", ex);
        }
    }
}
