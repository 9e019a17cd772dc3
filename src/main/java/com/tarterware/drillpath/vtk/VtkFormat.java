package com.tarterware.drillpath.vtk;

/**
 * Keywords and number rendering of the legacy ASCII VTK PolyData format, shared
 * by every writer so their output stays byte-identical.
 *
 * <pre>
 * # vtk DataFile Version 3.0
 * title
 * ASCII
 * DATASET POLYDATA
 * POINTS n float
 * x y z                  (n lines)
 * LINES 1 n+1
 * n 0 1 2 ... n-1
 * POINT_DATA n
 * SCALARS name float 1
 * LOOKUP_TABLE default
 * value                  (n lines)
 * </pre>
 *
 * see: https://www.vtk.org/wp-content/uploads/2015/04/file-formats.pdf
 */
public final class VtkFormat
{
    public static final String VERSION_LINE = "# vtk DataFile Version 3.0";
    public static final String VERSION_PREFIX = "# vtk";
    public static final String ASCII = "ASCII";
    public static final String BINARY = "BINARY";
    public static final String DATASET_POLYDATA = "DATASET POLYDATA";
    public static final String POINTS = "POINTS";
    public static final String LINES = "LINES";
    public static final String POINT_DATA = "POINT_DATA";
    public static final String CELL_DATA = "CELL_DATA";
    public static final String SCALARS = "SCALARS";
    public static final String FIELD = "FIELD";
    public static final String LOOKUP_TABLE = "LOOKUP_TABLE";
    public static final String DEFAULT_LOOKUP_TABLE = "default";
    public static final String FLOAT = "float";

    public static final String NEWLINE = "\n";

    private VtkFormat()
    {
    }

    public static String pointsLine(int count)
    {
        return POINTS + " " + count + " " + FLOAT;
    }

    public static String linesLine(int count)
    {
        return LINES + " 1 " + (count + 1);
    }

    public static String pointDataLine(int count)
    {
        return POINT_DATA + " " + count;
    }

    public static String scalarsLine(String name)
    {
        return SCALARS + " " + name + " " + FLOAT + " 1";
    }

    public static String lookupTableLine()
    {
        return LOOKUP_TABLE + " " + DEFAULT_LOOKUP_TABLE;
    }

    /**
     * Render a coordinate or scalar value.
     *
     * @param value Finite value.
     * @return the shortest decimal text that parses back to value.
     * @throws IllegalArgumentException for NaN and infinities, which legacy readers
     *                                  cannot load.
     */
    public static String formatNumber(double value)
    {
        if (!Double.isFinite(value))
        {
            throw new IllegalArgumentException("VTK files cannot hold non-finite value " + value);
        }

        return Double.toString(value);
    }

    /**
     * Check that a title fits on the single title line.
     *
     * @param title Title text, or null.
     * @return the title, or a default when null or blank.
     */
    public static String titleLine(String title)
    {
        if ((title == null) || title.isBlank())
        {
            return "vtk output";
        }
        if (title.indexOf('\n') >= 0 || title.indexOf('\r') >= 0)
        {
            throw new IllegalArgumentException("VTK title must be a single line: " + title);
        }

        return title;
    }

    /**
     * Check that a scalar array name is a single token.
     *
     * @param name Array name.
     * @return the name.
     */
    public static String scalarName(String name)
    {
        if ((name == null) || name.isBlank() || name.chars().anyMatch(Character::isWhitespace))
        {
            throw new IllegalArgumentException("Scalar field name must be a single non-empty token: '" + name + "'");
        }

        return name;
    }
}
