package com.mirrortrader.risk;

import java.math.BigDecimal;

/** Available balance of one collateral asset, read once per validation. */
public record BalanceSnapshot(String asset, BigDecimal available) {}
