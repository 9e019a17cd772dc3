package com.tarterware.drillpath.models;

import lombok.Value;

/**
 * A borehole vertex in tunnel coordinates, carrying the measured value at that
 * vertex.
 */
@Value
public class TrajectoryPoint
{
    double x;

    double y;

    double z;

    double scalar;
}
