package com.tarterware.drillpath.models;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Geometry and scalars recovered from a legacy VTK file, or the reason they
 * could not be recovered.
 */
@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class VtkPreview
{
    // False when the file could not be parsed; message says why.
    private boolean ok;

    private String message;

    // Each point is {x, y, z}.
    private List<List<Double>> points = new ArrayList<List<Double>>();

    // Vertex indices of each polyline.
    private List<List<Integer>> lines = new ArrayList<List<Integer>>();

    // Name of the first point scalar array found, or null.
    private String scalarName;

    private List<Double> scalars = new ArrayList<Double>();

    private BoundingBox bounds;

    public int getPointCount()
    {
        return points.size();
    }

    public int getLineCount()
    {
        return lines.size();
    }

    public static VtkPreview failure(String message)
    {
        VtkPreview preview = new VtkPreview();
        preview.setOk(false);
        preview.setMessage(message);
        return preview;
    }
}
