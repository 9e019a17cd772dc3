package com.tarterware.drillpath.vtk;

import java.io.IOException;
import java.io.Writer;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateXYZM;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.impl.CoordinateArraySequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tarterware.drillpath.exceptions.InsufficientDataException;
import com.tarterware.drillpath.models.VtkDocument;

/**
 * Writes legacy VTK text from a JTS geometry model of the trajectory.
 *
 * <p>
 * The document is first turned into a {@link LineString} of XYZM coordinates,
 * the measure of each vertex holding its scalar value. The file is then
 * emitted by walking the line's {@link CoordinateSequence}: points from X/Y/Z,
 * connectivity from the vertex order, and the scalar array from M.
 * </p>
 */
public class GeometryPolyDataWriter implements PolyDataWriter
{
    public static final String NAME = "geometry";

    // X, Y, Z and M.
    private static final int DIMENSION = 4;
    private static final int MEASURES = 1;

    private final GeometryFactory geometryFactory = new GeometryFactory();

    private static final Logger logger = LoggerFactory.getLogger(GeometryPolyDataWriter.class);

    @Override
    public String getName()
    {
        return NAME;
    }

    @Override
    public void write(VtkDocument document, Writer out) throws IOException
    {
        LineString line = toLineString(document);
        CoordinateSequence sequence = line.getCoordinateSequence();
        int n = sequence.size();

        logger.debug("Writing trajectory of {} vertices, {} m long", n, line.getLength());

        out.write(VtkFormat.VERSION_LINE + VtkFormat.NEWLINE);
        out.write(VtkFormat.titleLine(document.getTitle()) + VtkFormat.NEWLINE);
        out.write(VtkFormat.ASCII + VtkFormat.NEWLINE);
        out.write(VtkFormat.DATASET_POLYDATA + VtkFormat.NEWLINE);

        out.write(VtkFormat.pointsLine(n) + VtkFormat.NEWLINE);
        for (int i = 0; i < n; ++i)
        {
            out.write(VtkFormat.formatNumber(sequence.getX(i)) + " " + VtkFormat.formatNumber(sequence.getY(i)) + " "
                    + VtkFormat.formatNumber(sequence.getZ(i)) + VtkFormat.NEWLINE);
        }

        StringBuilder cell = new StringBuilder().append(n);
        for (int i = 0; i < n; ++i)
        {
            cell.append(' ').append(i);
        }
        out.write(VtkFormat.linesLine(n) + VtkFormat.NEWLINE);
        out.write(cell.append(VtkFormat.NEWLINE).toString());

        out.write(VtkFormat.pointDataLine(n) + VtkFormat.NEWLINE);
        out.write(VtkFormat.scalarsLine(VtkFormat.scalarName(document.getScalarFieldName())) + VtkFormat.NEWLINE);
        out.write(VtkFormat.lookupTableLine() + VtkFormat.NEWLINE);
        for (int i = 0; i < n; ++i)
        {
            out.write(VtkFormat.formatNumber(sequence.getM(i)) + VtkFormat.NEWLINE);
        }

        out.flush();
    }

    /**
     * Build the geometry model of a document.
     *
     * @param document Document with at least two points.
     * @return a LineString whose vertices carry the scalars as measures.
     */
    public LineString toLineString(VtkDocument document)
    {
        // JTS would reject a one-point LineString with its own message; report ours.
        InsufficientDataException.check(document.getPointCount());

        Coordinate[] coordinates = document.getPoints().stream()
                .map(p -> new CoordinateXYZM(p.getX(), p.getY(), p.getZ(), p.getScalar()))
                .toArray(Coordinate[]::new);
        CoordinateSequence sequence = new CoordinateArraySequence(coordinates, DIMENSION, MEASURES);

        return geometryFactory.createLineString(sequence);
    }
}
