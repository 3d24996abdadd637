package com.cashflow.simulator.report;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Amounts {

    private Amounts() {
    }

    static String format(BigDecimal amount) {
        if (amount == null) {
            return "";
        }
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
