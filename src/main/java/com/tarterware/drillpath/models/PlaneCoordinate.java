package com.tarterware.drillpath.models;

import lombok.Value;

/**
 * Immutable planar X/Y pair, in whatever unit the owner states.
 */
@Value
public class PlaneCoordinate
{
    double x;

    double y;
}
