package ai.framekit.frames;

import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Construction-time settings of a {@link ScrollFrame}.
 *
 * @param maxWidth upper bound of the preferred viewport width, or null for "as wide as the content"
 * @param maxHeight upper bound of the preferred viewport height, or null for "as tall as the content"
 * @param wheelUnit pixels scrolled per mouse wheel notch
 */
public record ScrollFrameConfig(
        int initialContentWidth,
        int initialContentHeight,
        ScrollbarPolicy horizontalPolicy,
        ScrollbarPolicy verticalPolicy,
        @Nullable Integer maxWidth,
        @Nullable Integer maxHeight,
        int wheelUnit) {
    private static final Logger logger = LogManager.getLogger(ScrollFrameConfig.class);

    public static final String WHEEL_UNIT_PROPERTY = "framekit.scroll.wheelUnit";
    public static final int DEFAULT_WHEEL_UNIT = 16;

    public ScrollFrameConfig {
        Objects.requireNonNull(horizontalPolicy, "horizontalPolicy");
        Objects.requireNonNull(verticalPolicy, "verticalPolicy");
        if (initialContentWidth < 0 || initialContentHeight < 0) {
            throw new IllegalArgumentException(
                    "Initial content size must not be negative: " + initialContentWidth + "x" + initialContentHeight);
        }
        if (maxWidth != null && maxWidth < 0) {
            throw new IllegalArgumentException("maxWidth must not be negative: " + maxWidth);
        }
        if (maxHeight != null && maxHeight < 0) {
            throw new IllegalArgumentException("maxHeight must not be negative: " + maxHeight);
        }
        if (wheelUnit <= 0) {
            throw new IllegalArgumentException("wheelUnit must be positive: " + wheelUnit);
        }
    }

    /** Empty content, auto-hiding scrollbars, no maximum viewport size. */
    public static ScrollFrameConfig defaults() {
        return new ScrollFrameConfig(0, 0, ScrollbarPolicy.AUTO, ScrollbarPolicy.AUTO, null, null, wheelUnitFromSystem());
    }

    public ScrollFrameConfig withContentSize(int width, int height) {
        return new ScrollFrameConfig(width, height, horizontalPolicy, verticalPolicy, maxWidth, maxHeight, wheelUnit);
    }

    public ScrollFrameConfig withPolicies(ScrollbarPolicy horizontal, ScrollbarPolicy vertical) {
        return new ScrollFrameConfig(
                initialContentWidth, initialContentHeight, horizontal, vertical, maxWidth, maxHeight, wheelUnit);
    }

    public ScrollFrameConfig withMaxSize(@Nullable Integer width, @Nullable Integer height) {
        return new ScrollFrameConfig(
                initialContentWidth, initialContentHeight, horizontalPolicy, verticalPolicy, width, height, wheelUnit);
    }

    public ScrollbarPolicy policy(ScrollAxis axis) {
        return axis == ScrollAxis.HORIZONTAL ? horizontalPolicy : verticalPolicy;
    }

    /** Reads {@value #WHEEL_UNIT_PROPERTY}, falling back to {@value #DEFAULT_WHEEL_UNIT} on blank or bad values. */
    static int wheelUnitFromSystem() {
        String v = System.getProperty(WHEEL_UNIT_PROPERTY);
        if (v == null || v.isBlank()) return DEFAULT_WHEEL_UNIT;
        try {
            int parsed = Integer.parseInt(v.trim());
            return parsed > 0 ? parsed : DEFAULT_WHEEL_UNIT;
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid {}={}", WHEEL_UNIT_PROPERTY, v);
            return DEFAULT_WHEEL_UNIT;
        }
    }
}
