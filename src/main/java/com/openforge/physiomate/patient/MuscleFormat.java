package com.openforge.physiomate.patient;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Single-line rendering of a muscle state, shared by prompt context and tools. */
public final class MuscleFormat {

    private MuscleFormat() {}

    /** {@code <meshId>: condition=tight, pain=6/10, strength=80%, mobility=70%[, notes="..."][, summary="..."]} */
    public static String describe(MuscleState m) {
        List<String> parts = new ArrayList<>();
        parts.add("condition=" + m.condition());
        parts.add("pain=" + number(m.pain()) + "/10");
        parts.add(String.format(Locale.ROOT, "strength=%.0f%%", m.strength() * 100));
        parts.add(String.format(Locale.ROOT, "mobility=%.0f%%", m.mobility() * 100));
        if (m.notes() != null && !m.notes().isEmpty()) {
            parts.add("notes=\"" + m.notes() + "\"");
        }
        if (m.summary() != null && !m.summary().isEmpty()) {
            parts.add("summary=\"" + m.summary() + "\"");
        }
        return m.meshId() + ": " + String.join(", ", parts);
    }

    /** 6.0 → "6", 6.5 → "6.5". */
    public static String number(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
