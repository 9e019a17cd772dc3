package com.tarterware.drillpath.models;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import lombok.Value;

/**
 * Base X/Y of the L, M and R boreholes at one chainage distance, in meters,
 * rounded to the millimeter.
 */
@Value
public class SideCoordinates
{
    // Distance from the tunnel entrance these coordinates were computed for.
    double distanceFromEntrance;

    // Direction angle used for the computation, in degrees.
    double directionAngle;

    Map<Side, PlaneCoordinate> coordinates;

    public SideCoordinates(double distanceFromEntrance, double directionAngle, Map<Side, PlaneCoordinate> coordinates)
    {
        this.distanceFromEntrance = distanceFromEntrance;
        this.directionAngle = directionAngle;
        this.coordinates = Collections.unmodifiableMap(new EnumMap<>(coordinates));
    }

    public PlaneCoordinate get(Side side)
    {
        return coordinates.get(side);
    }
}
