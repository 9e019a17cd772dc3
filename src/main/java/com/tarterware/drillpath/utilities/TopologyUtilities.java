package com.tarterware.drillpath.utilities;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.tarterware.drillpath.models.PlaneCoordinate;

public class TopologyUtilities
{
    public static double MILLIMETERS_PER_METER = 1000.0;

    /**
     * Get the planar position reached by travelling range meters from the origin
     * along a borehole drilled at the given angle.
     *
     * @param origin   Start of the hole.
     * @param range    Distance along the hole in meters.
     * @param degAngle Hole direction in degrees.
     * @return destination position
     */
    static public PlaneCoordinate getCoordinateAtBearingAndRange(PlaneCoordinate origin, double range,
            double degAngle)
    {
        double radAngle = degAngle * Math.PI / 180;

        double x = origin.getX() - range * Math.sin(radAngle);
        double y = origin.getY() + range * Math.cos(radAngle);

        return new PlaneCoordinate(x, y);
    }

    /**
     * Round a value to a fixed number of decimal places, half to even on the exact
     * binary value. This matches the rounding of the tunnel progress spreadsheet
     * that the coordinate tables were derived from.
     *
     * @param value Value to round.
     * @param scale Number of decimal places to keep.
     * @return Rounded value.
     */
    static public double roundToScale(double value, int scale)
    {
        if (!Double.isFinite(value))
        {
            throw new IllegalArgumentException("Cannot round a non-finite value: " + value);
        }

        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * Convert a length in millimeters to meters. Divides rather than multiplying
     * by 0.001 so results match the spreadsheet bit for bit.
     * @param millimeters Length in millimeters.
     * @return Length in meters.
     */
    static public double convertMillimetersToMeters(double millimeters)
    {
        return millimeters / MILLIMETERS_PER_METER;
    }

    /**
     * Convert a length in meters to millimeters.
     * @param meters Length in meters.
     * @return Length in millimeters.
     */
    static public double convertMetersToMillimeters(double meters)
    {
        return meters * MILLIMETERS_PER_METER;
    }
}
