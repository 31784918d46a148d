package com.nei10u.panchanga.ephemeris;

import com.nei10u.panchanga.exception.ComputationException;

import java.util.OptionalDouble;

/**
 * 星历计算资源。实现不保证线程安全，由持有它的引擎串行调用；{@link #close()} 之后的任何调用都应抛出
 * {@link com.nei10u.panchanga.exception.ClosedResourceException}。
 */
public interface EphemerisProvider extends AutoCloseable {

    /**
     * @return 黄经，[0, 360)
     * @throws ComputationException 计算失败
     */
    double longitude(Body body, double julianDay, boolean sidereal);

    /**
     * 在 [{@code julianDay}, {@code julianDay} + 1) 内搜索天体的第一次升起或落下。
     *
     * @return 事件时刻的儒略日（UT）；窗口内没有该事件（极昼、极夜，或月亮当天不升/不落）时为空
     */
    OptionalDouble riseSet(Body body, double julianDay, double latitude, double longitude, RiseSetEvent event);

    double ayanamsa(double julianDay);

    SiderealMode siderealMode();

    /**
     * 释放资源，幂等。
     */
    @Override
    void close();
}
