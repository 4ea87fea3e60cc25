package com.crosslend.core.events.payload;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

public record LiquidationEvent(
    String user,
    String liquidator,
    String debtAsset,
    BigInteger debtRepaid,
    String collateralAsset,
    BigInteger collateralSeized,
    BigDecimal healthFactorBefore,
    Instant at
) {
}
