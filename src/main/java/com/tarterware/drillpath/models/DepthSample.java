package com.tarterware.drillpath.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Value;

/**
 * One measurement taken along a borehole.
 */
@Value
public class DepthSample
{
    // Distance drilled from the hole mouth, in meters.
    double depth;

    // Measured value at that depth, e.g. drilling energy.
    double value;

    @JsonCreator
    public DepthSample(@JsonProperty("depth") double depth, @JsonProperty("value") double value)
    {
        this.depth = depth;
        this.value = value;
    }
}
