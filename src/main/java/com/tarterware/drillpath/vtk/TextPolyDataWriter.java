package com.tarterware.drillpath.vtk;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

import com.tarterware.drillpath.exceptions.InsufficientDataException;
import com.tarterware.drillpath.models.TrajectoryPoint;
import com.tarterware.drillpath.models.VtkDocument;

/**
 * Writes legacy VTK text directly from the document's points, with no geometry
 * library involved.
 */
public class TextPolyDataWriter implements PolyDataWriter
{
    public static final String NAME = "text";

    @Override
    public String getName()
    {
        return NAME;
    }

    @Override
    public void write(VtkDocument document, Writer out) throws IOException
    {
        List<TrajectoryPoint> points = document.getPoints();
        InsufficientDataException.check(points.size());
        int n = points.size();

        // Header
        out.write(VtkFormat.VERSION_LINE + VtkFormat.NEWLINE);
        out.write(VtkFormat.titleLine(document.getTitle()) + VtkFormat.NEWLINE);
        out.write(VtkFormat.ASCII + VtkFormat.NEWLINE);
        out.write(VtkFormat.DATASET_POLYDATA + VtkFormat.NEWLINE);

        // Points
        out.write(VtkFormat.pointsLine(n) + VtkFormat.NEWLINE);
        for (TrajectoryPoint p : points)
        {
            out.write(VtkFormat.formatNumber(p.getX()));
            out.write(' ');
            out.write(VtkFormat.formatNumber(p.getY()));
            out.write(' ');
            out.write(VtkFormat.formatNumber(p.getZ()));
            out.write(VtkFormat.NEWLINE);
        }

        // One polyline through every point, in order
        out.write(VtkFormat.linesLine(n) + VtkFormat.NEWLINE);
        out.write(Integer.toString(n));
        for (int i = 0; i < n; ++i)
        {
            out.write(' ');
            out.write(Integer.toString(i));
        }
        out.write(VtkFormat.NEWLINE);

        // Scalars
        out.write(VtkFormat.pointDataLine(n) + VtkFormat.NEWLINE);
        out.write(VtkFormat.scalarsLine(VtkFormat.scalarName(document.getScalarFieldName())) + VtkFormat.NEWLINE);
        out.write(VtkFormat.lookupTableLine() + VtkFormat.NEWLINE);
        for (TrajectoryPoint p : points)
        {
            out.write(VtkFormat.formatNumber(p.getScalar()));
            out.write(VtkFormat.NEWLINE);
        }

        out.flush();
    }
}
