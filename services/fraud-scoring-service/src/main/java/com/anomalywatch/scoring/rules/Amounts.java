package com.anomalywatch.scoring.rules;

import java.util.Locale;

final class Amounts {

    private Amounts() {
    }

    static String format(double amount) {
        return String.format(Locale.US, "%,.2f", amount);
    }

    static String percent(double ratio) {
        return String.format(Locale.US, "%.1f%%", ratio * 100);
    }
}
