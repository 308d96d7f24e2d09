package com.mirrortrader.broker;

import java.math.BigDecimal;

/** Reports the same fixed balance for every asset. Paired with {@link PaperExecutionClient}. */
public class StaticBalanceSource implements BalanceSource {

    private final BigDecimal balance;

    public StaticBalanceSource(BigDecimal balance) {
        this.balance = balance;
    }

    @Override
    public BigDecimal currentBalance(String asset) {
        return balance;
    }
}
