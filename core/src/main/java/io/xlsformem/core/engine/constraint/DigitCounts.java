package io.xlsformem.core.engine.constraint;

import java.math.BigInteger;

final class DigitCounts {

    private DigitCounts() {}

    /** Number of digits in the decimal integer {@code digits}, ignoring leading zeros. */
    static int of(String digits) {
        return new BigInteger(digits).toString().length();
    }
}
