package com.cashflow.simulator.repository;

import com.cashflow.simulator.config.CashflowProperties;
import com.cashflow.simulator.exception.LedgerFormatException;
import com.cashflow.simulator.exception.UserDataNotFoundException;
import com.cashflow.simulator.model.Transaction;
import com.cashflow.simulator.model.UserConfig;
import com.cashflow.simulator.simulation.SimulationPreconditions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Reads {@code config.yaml} and {@code ledger.csv} from {@code <users-dir>/<user>/}.
 */
@Repository
public class FileSystemUserLedgerRepository implements UserLedgerRepository {

    private static final Logger log = LoggerFactory.getLogger(FileSystemUserLedgerRepository.class);

    public static final String CONFIG_FILE = "config.yaml";
    public static final String LEDGER_FILE = "ledger.csv";
    public static final List<String> LEDGER_COLUMNS = List.of("date", "amount", "description", "category", "forecast");

    private final Path usersRoot;
    private final ObjectMapper yamlMapper = new YAMLMapper();

    public FileSystemUserLedgerRepository(CashflowProperties properties) {
        this.usersRoot = properties.usersPath();
    }

    @Override
    public Path userDirectory(String user) {
        if (user == null || user.isBlank()) {
            throw new IllegalArgumentException("user must be provided");
        }
        String trimmed = user.trim();
        if (trimmed.contains("/") || trimmed.contains("\\") || trimmed.equals(".") || trimmed.equals("..")) {
            throw new IllegalArgumentException("user must be a plain directory name: " + user);
        }
        return usersRoot.resolve(trimmed);
    }

    @Override
    public UserConfig loadConfig(String user) {
        Path path = userDirectory(user).resolve(CONFIG_FILE);
        if (!Files.isRegularFile(path)) {
            throw new UserDataNotFoundException("Config", path);
        }
        JsonNode root;
        try {
            root = yamlMapper.readTree(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + path, ex);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException(CONFIG_FILE + " must contain a mapping: " + path);
        }

        BigDecimal currentBalance = SimulationPreconditions.parseBalance("current_balance", scalar(root.get("current_balance")));
        BigDecimal targetBalance = SimulationPreconditions.parseBalance("target_balance", scalar(root.get("target_balance")));
        String nickname = root.hasNonNull("account_nickname") ? root.get("account_nickname").asText() : null;
        List<String> categories = new ArrayList<>();
        JsonNode categoriesNode = root.get("categories");
        if (categoriesNode != null && categoriesNode.isArray()) {
            categoriesNode.forEach(node -> categories.add(node.asText()));
        }
        log.debug("Loaded config for user '{}': currentBalance={}, targetBalance={}, categories={}",
                user, currentBalance, targetBalance, categories.size());
        return new UserConfig(nickname, currentBalance, targetBalance, categories);
    }

    @Override
    public List<Transaction> loadLedger(String user) {
        Path path = userDirectory(user).resolve(LEDGER_FILE);
        if (!Files.isRegularFile(path)) {
            throw new UserDataNotFoundException("Ledger", path);
        }
        String content;
        try {
            content = stripBom(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + path, ex);
        }
        if (content.isBlank()) {
            log.warn("Ledger {} is empty; treating it as having no transactions", path);
            return List.of();
        }

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();
        List<Transaction> transactions = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(new StringReader(content), format)) {
            for (String column : LEDGER_COLUMNS) {
                if (!parser.getHeaderMap().containsKey(column)) {
                    throw new LedgerFormatException(1, "missing column '" + column + "'");
                }
            }
            for (CSVRecord record : parser) {
                transactions.add(toTransaction(record));
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to parse " + path, ex);
        }
        log.debug("Loaded {} ledger rows for user '{}'", transactions.size(), user);
        return transactions;
    }

    private Transaction toTransaction(CSVRecord record) {
        // header occupies line 1
        long line = record.getRecordNumber() + 1;
        if (!record.isConsistent()) {
            throw new LedgerFormatException(line, "expected " + LEDGER_COLUMNS.size() + " columns but found " + record.size());
        }
        LocalDate date;
        try {
            date = LocalDate.parse(record.get("date"));
        } catch (DateTimeParseException ex) {
            throw new LedgerFormatException(line, "invalid date '" + record.get("date") + "'", ex);
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(record.get("amount"));
        } catch (NumberFormatException ex) {
            throw new LedgerFormatException(line, "invalid amount '" + record.get("amount") + "'", ex);
        }
        return new Transaction(
                date,
                amount,
                record.get("description"),
                record.get("category"),
                parseForecastFlag(line, record.get("forecast"))
        );
    }

    private static boolean parseForecastFlag(long line, String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "1", "true", "yes", "y" -> true;
            case "0", "false", "no", "n", "" -> false;
            default -> throw new LedgerFormatException(line, "invalid forecast flag '" + raw + "'");
        };
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        return node.toString();
    }

    private static String stripBom(String value) {
        if (!value.isEmpty() && value.charAt(0) == '\uFEFF') {
            return value.substring(1);
        }
        return value;
    }
}
