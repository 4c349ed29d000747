package com.warehouse.requisitions.service;

import java.math.BigDecimal;

// Quantity and stock columns are precision 14, scale 3
final class Quantities {

    static final int FRACTION_DIGITS = 3;
    static final int INTEGER_DIGITS = 11;

    private Quantities() {
    }

    static boolean fitsColumn(BigDecimal qty) {
        BigDecimal stripped = qty.stripTrailingZeros();
        return stripped.scale() <= FRACTION_DIGITS
                && stripped.precision() - stripped.scale() <= INTEGER_DIGITS;
    }
}
