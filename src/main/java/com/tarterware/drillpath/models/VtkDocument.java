package com.tarterware.drillpath.models;

import java.util.List;

import lombok.Value;

/**
 * Everything needed to write one borehole trajectory as a legacy VTK PolyData
 * file: a title line, the ordered vertices, and the name of the point scalar
 * array.
 */
@Value
public class VtkDocument
{
    public static final String DEFAULT_TITLE = "Drill path data";

    public static final String DEFAULT_SCALAR_FIELD_NAME = "Energy";

    String title;

    List<TrajectoryPoint> points;

    String scalarFieldName;

    public VtkDocument(String title, List<TrajectoryPoint> points, String scalarFieldName)
    {
        this.title = title;
        this.points = List.copyOf(points);
        this.scalarFieldName = scalarFieldName;
    }

    public VtkDocument(List<TrajectoryPoint> points)
    {
        this(DEFAULT_TITLE, points, DEFAULT_SCALAR_FIELD_NAME);
    }

    public int getPointCount()
    {
        return points.size();
    }
}
