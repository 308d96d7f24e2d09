package com.mirrortrader.broker;

import java.math.BigDecimal;

/** Available margin per collateral asset. */
public interface BalanceSource {

    BigDecimal currentBalance(String asset);
}
