package Frontend.Detector;

import java.util.Locale;

/**
 * 识别结果的可信度，按声明顺序从低到高
 */
public enum Confidence {
    NONE,
    LOW,
    MEDIUM,
    HIGH;

    boolean atLeast(Confidence other) {
        return compareTo(other) >= 0;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
