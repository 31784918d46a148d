package com.nei10u.panchanga.calc;

/**
 * 把连续角度切分成等宽分段：得到分段下标、段内进度和距下一段的剩余度数。
 * 所有历法单位（Tithi、Nakshatra、Yoga、Karana）都基于它。
 */
public final class AngularSegmenter {

    public static final double FULL_CIRCLE = 360.0;

    private AngularSegmenter() {
    }

    /**
     * @param index            0 .. segmentCount-1
     * @param progressFraction [0, 1)
     * @param remainingDegrees (0, span]
     */
    public record Segment(int index, double progressFraction, double remainingDegrees) {
    }

    /**
     * 归一化到 [0, 360)。幂等；NaN、无穷和 -0.0 都得到 0。
     */
    public static double normalize(double degrees) {
        if (!Double.isFinite(degrees)) {
            return 0.0;
        }
        double normalized = degrees % FULL_CIRCLE;
        if (normalized < 0.0) {
            normalized += FULL_CIRCLE;
        }
        // 极小负数加 360 后可能被舍入成 360
        if (normalized >= FULL_CIRCLE) {
            normalized = 0.0;
        }
        return normalized + 0.0;
    }

    /**
     * 对任意 {@code value}（含 NaN、无穷和任意量级）都给出结果。
     * {@code span} 与 {@code segmentCount} 是各历法的固定常量，调用方须保证两者为正，
     * 否则抛出 {@link IllegalArgumentException}。
     */
    public static Segment segment(double value, double span, int segmentCount) {
        if (!(span > 0.0) || segmentCount < 1) {
            throw new IllegalArgumentException("span and segmentCount must be positive: span=" + span
                    + " segmentCount=" + segmentCount);
        }
        double angle = normalize(value);
        int raw = (int) Math.floor(angle / span);
        int index = Math.max(0, Math.min(segmentCount - 1, raw));

        double offset = raw == index ? angle % span : angle - index * span;
        offset = Math.max(0.0, Math.min(offset, Math.nextDown(span)));

        return new Segment(index, offset / span, span - offset);
    }
}
