package io.github.samzhu.reach.anomaly;

import java.util.Locale;

/**
 * 異常嚴重程度。
 *
 * <p>{@link #value()} 為儲存在告警文件中的字串值。
 */
public enum Severity {
    NONE,
    WARNING,
    CRITICAL;

    /**
     * @return 小寫字串，例如 {@code warning}
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 由儲存的字串值還原，不分大小寫。
     *
     * @param value 字串值
     * @return 對應的嚴重程度，null 或空字串回傳 {@link #NONE}
     */
    public static Severity fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isMoreSevereThan(Severity other) {
        return ordinal() > other.ordinal();
    }
}
