package com.tarterware.drillpath.components;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.tarterware.drillpath.models.PlaneCoordinate;
import com.tarterware.drillpath.models.ReferenceFrame;
import com.tarterware.drillpath.models.Side;
import com.tarterware.drillpath.models.SideCoordinates;
import com.tarterware.drillpath.utilities.TopologyUtilities;

/**
 * Computes the start coordinates of the L, M and R boreholes at a given
 * distance from the tunnel entrance.
 *
 * <p>
 * The reference frame holds the borehole start positions (in millimeters) at a
 * reference cross-section. Moving along the tunnel by
 * {@code distance - referenceDistance} meters shifts every start position by
 * the same vector, rotated by {@code 90 - directionAngle} degrees. Results are
 * in meters, rounded to the millimeter, exactly as the tunnel progress
 * spreadsheet computes them:
 *
 * <pre>
 * X = ROUND((-(I - I974) * 1000 * COS((90 - W) * PI() / 180) + Q974) / 1000, 3)
 * Y = ROUND(( (I - I974) * 1000 * SIN((90 - W) * PI() / 180) + R974) / 1000, 3)
 * </pre>
 * </p>
 */
@Component
public class CoordinateTransformer
{
    public static final int DECIMAL_PLACES = 3;

    public static final double DEFAULT_TOLERANCE = 0.001;

    /**
     * Compute the borehole start coordinates using the frame's own direction
     * angle and reference distance.
     *
     * @param distanceFromEntrance Distance from the entrance in meters.
     * @param frame                Reference frame.
     * @return L/M/R coordinates in meters.
     */
    public SideCoordinates calculate(double distanceFromEntrance, ReferenceFrame frame)
    {
        return calculate(distanceFromEntrance, frame.getDirectionAngle(), frame.getReferenceDistance(), frame);
    }

    /**
     * Compute the borehole start coordinates with an explicit direction angle and
     * reference distance, keeping the frame's base coordinates.
     *
     * @param distanceFromEntrance Distance from the entrance in meters.
     * @param directionAngle       Tunnel direction in degrees.
     * @param referenceDistance    Distance of the reference cross-section in
     *                             meters.
     * @param frame                Reference frame supplying base coordinates.
     * @return L/M/R coordinates in meters.
     */
    public SideCoordinates calculate(double distanceFromEntrance, double directionAngle, double referenceDistance,
            ReferenceFrame frame)
    {
        double mmDifference = TopologyUtilities.convertMetersToMillimeters(distanceFromEntrance - referenceDistance);
        double radAngle = (90 - directionAngle) * Math.PI / 180;
        double cos = Math.cos(radAngle);
        double sin = Math.sin(radAngle);

        Map<Side, PlaneCoordinate> coordinates = new EnumMap<>(Side.class);
        for (Side side : Side.values())
        {
            PlaneCoordinate base = frame.getBaseCoordinate(side);
            double x = TopologyUtilities.roundToScale(
                    TopologyUtilities.convertMillimetersToMeters(-mmDifference * cos + base.getX()), DECIMAL_PLACES);
            double y = TopologyUtilities.roundToScale(
                    TopologyUtilities.convertMillimetersToMeters(mmDifference * sin + base.getY()), DECIMAL_PLACES);
            coordinates.put(side, new PlaneCoordinate(x, y));
        }

        return new SideCoordinates(distanceFromEntrance, directionAngle, coordinates);
    }

    /**
     * Compute the borehole start coordinates for several distances.
     *
     * @param distances Distances from the entrance in meters.
     * @param frame     Reference frame.
     * @return one result per distance, in the same order.
     */
    public List<SideCoordinates> calculateBatch(List<Double> distances, ReferenceFrame frame)
    {
        List<SideCoordinates> results = new ArrayList<>(distances.size());
        for (Double distance : distances)
        {
            results.add(calculate(distance, frame));
        }

        return results;
    }

    /**
     * Check computed coordinates against expected values with the default
     * tolerance of one millimeter.
     *
     * @see #validate(Map, Map, double)
     */
    public boolean validate(Map<Side, PlaneCoordinate> expected, Map<Side, PlaneCoordinate> actual)
    {
        return validate(expected, actual, DEFAULT_TOLERANCE);
    }

    /**
     * Check computed coordinates against expected values. Sides present in only
     * one of the maps are not compared.
     *
     * @param expected  Expected coordinates.
     * @param actual    Computed coordinates.
     * @param tolerance Largest allowed absolute difference per axis, in meters.
     * @return true if every compared X and Y is within tolerance.
     */
    public boolean validate(Map<Side, PlaneCoordinate> expected, Map<Side, PlaneCoordinate> actual, double tolerance)
    {
        for (Map.Entry<Side, PlaneCoordinate> entry : expected.entrySet())
        {
            PlaneCoordinate computed = actual.get(entry.getKey());
            if (computed == null)
            {
                continue;
            }

            if ((Math.abs(entry.getValue().getX() - computed.getX()) > tolerance)
                    || (Math.abs(entry.getValue().getY() - computed.getY()) > tolerance))
            {
                return false;
            }
        }

        return true;
    }
}
