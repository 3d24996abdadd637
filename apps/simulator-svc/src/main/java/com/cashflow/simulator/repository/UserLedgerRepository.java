package com.cashflow.simulator.repository;

import com.cashflow.simulator.model.Transaction;
import com.cashflow.simulator.model.UserConfig;
import java.nio.file.Path;
import java.util.List;

public interface UserLedgerRepository {

    UserConfig loadConfig(String user);

    List<Transaction> loadLedger(String user);

    Path userDirectory(String user);
}
