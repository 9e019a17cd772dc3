package com.tarterware.drillpath.models;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Axis-aligned extent of a set of 3D points.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoundingBox
{
    private double minX;
    private double minY;
    private double minZ;
    private double maxX;
    private double maxY;
    private double maxZ;

    /**
     * Compute the extent of a list of {x, y, z} triples.
     * 
     * @param points list of 3-element coordinate lists.
     * @return the bounding box, or null if the list is empty.
     */
    public static BoundingBox of(Iterable<? extends List<Double>> points)
    {
        BoundingBox box = null;
        for (List<Double> p : points)
        {
            double x = p.get(0);
            double y = p.get(1);
            double z = p.get(2);
            if (box == null)
            {
                box = new BoundingBox(x, y, z, x, y, z);
            }
            else
            {
                box.minX = Math.min(box.minX, x);
                box.minY = Math.min(box.minY, y);
                box.minZ = Math.min(box.minZ, z);
                box.maxX = Math.max(box.maxX, x);
                box.maxY = Math.max(box.maxY, y);
                box.maxZ = Math.max(box.maxZ, z);
            }
        }

        return box;
    }
}
