package com.tarterware.drillpath.vtk;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.tarterware.drillpath.models.BoundingBox;
import com.tarterware.drillpath.models.VtkPreview;

/**
 * Recovers points, polylines and the first point scalar array from a legacy
 * ASCII VTK PolyData file, without any VTK library.
 *
 * <p>
 * The body of the file is read as a stream of whitespace separated tokens, so
 * values may be packed several to a line or written one per line. Parsing is a
 * small state machine:
 *
 * <pre>
 * SEEK_POINTS -> READ_POINTS -> SEEK_LINES -> READ_LINES -> SEEK_SCALARS -> READ_SCALARS -> DONE
 * </pre>
 *
 * Both the classic {@code LINES n size} cell layout and the
 * {@code OFFSETS}/{@code CONNECTIVITY} layout of version 5 files are understood.
 * Point data may be a {@code SCALARS} block or a one-component array of a
 * {@code FIELD} block.
 * </p>
 *
 * <p>
 * The reader never throws: anything it cannot make sense of is reported
 * through {@link VtkPreview#isOk()} and {@link VtkPreview#getMessage()}.
 * </p>
 */
@Component
public class PolyDataReader
{
    private static final String OFFSETS = "OFFSETS";
    private static final String CONNECTIVITY = "CONNECTIVITY";

    private static final Logger logger = LoggerFactory.getLogger(PolyDataReader.class);

    private enum State
    {
        SEEK_POINTS, READ_POINTS, SEEK_LINES, READ_LINES, SEEK_SCALARS, READ_SCALARS, DONE
    }

    /**
     * Read a VTK file from disk. Bytes that are not valid UTF-8 are replaced
     * rather than rejected.
     *
     * @param path File to read.
     * @return the preview; not ok if the file cannot be read or parsed.
     */
    public VtkPreview read(Path path)
    {
        String content;
        try
        {
            content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        }
        catch (IOException ex)
        {
            logger.warn("Could not read VTK file {}: {}", path, ex.getMessage());
            return VtkPreview.failure("Could not read " + path + ": " + ex.getMessage());
        }

        return read(content);
    }

    /**
     * Read VTK text from a stream. The reader is consumed but not closed.
     *
     * @param in Source of the text.
     * @return the preview; not ok if the stream fails or the text cannot be
     *         parsed.
     */
    public VtkPreview read(Reader in)
    {
        StringWriter content = new StringWriter();
        try
        {
            in.transferTo(content);
        }
        catch (IOException ex)
        {
            logger.warn("Could not read VTK stream: {}", ex.getMessage());
            return VtkPreview.failure("Could not read VTK stream: " + ex.getMessage());
        }

        return read(content.toString());
    }

    /**
     * Parse VTK text.
     *
     * @param content Whole file content.
     * @return the preview.
     */
    public VtkPreview read(String content)
    {
        if (content == null)
        {
            return VtkPreview.failure("No VTK content");
        }

        try
        {
            VtkPreview preview = parse(new TokenCursor(body(content)));
            logger.debug("Read {} points and {} lines from VTK content", preview.getPointCount(),
                    preview.getLineCount());
            return preview;
        }
        catch (IllegalArgumentException ex)
        {
            logger.warn("Could not parse VTK content: {}", ex.getMessage());
            return VtkPreview.failure(ex.getMessage());
        }
    }

    // The title line is free text and may hold anything, keywords included.
    private static String body(String content)
    {
        if (!content.startsWith(VtkFormat.VERSION_PREFIX))
        {
            return content;
        }

        int versionEnd = content.indexOf('\n');
        if (versionEnd < 0)
        {
            return "";
        }
        int titleEnd = content.indexOf('\n', versionEnd + 1);
        return (titleEnd < 0) ? "" : content.substring(titleEnd + 1);
    }

    private VtkPreview parse(TokenCursor cursor)
    {
        List<List<Double>> points = new ArrayList<List<Double>>();
        List<List<Integer>> lines = new ArrayList<List<Integer>>();
        List<Double> scalars = new ArrayList<Double>();
        String scalarName = null;

        int pointCount = 0;
        int cellCount = 0;
        int cellSize = 0;
        int pointDataCount = -1;
        int scalarComponents = 1;
        boolean cellSection = false;

        State state = State.SEEK_POINTS;
        while (state != State.DONE)
        {
            switch (state)
            {
            case SEEK_POINTS:
            {
                if (!cursor.hasNext())
                {
                    throw new IllegalArgumentException("No POINTS section found");
                }
                String token = cursor.next();
                if (VtkFormat.BINARY.equalsIgnoreCase(token))
                {
                    throw new IllegalArgumentException("Binary VTK files are not supported");
                }
                if (VtkFormat.POINTS.equalsIgnoreCase(token))
                {
                    pointCount = cursor.nextCount(VtkFormat.POINTS);
                    cursor.next(VtkFormat.POINTS); // data type
                    cursor.require(3L * pointCount, VtkFormat.POINTS);
                    state = State.READ_POINTS;
                }
                break;
            }

            case READ_POINTS:
                for (int i = 0; i < pointCount; ++i)
                {
                    double x = cursor.nextDouble(VtkFormat.POINTS);
                    double y = cursor.nextDouble(VtkFormat.POINTS);
                    double z = cursor.nextDouble(VtkFormat.POINTS);
                    points.add(List.of(x, y, z));
                }
                state = State.SEEK_LINES;
                break;

            case SEEK_LINES:
            {
                if (!cursor.hasNext())
                {
                    state = State.DONE;
                    break;
                }
                String token = cursor.peek();
                if (VtkFormat.LINES.equalsIgnoreCase(token))
                {
                    cursor.next();
                    cellCount = cursor.nextCount(VtkFormat.LINES);
                    cellSize = cursor.nextCount(VtkFormat.LINES);
                    cursor.require(cellCount, VtkFormat.LINES);
                    state = State.READ_LINES;
                }
                else if (isAttributeKeyword(token))
                {
                    state = State.SEEK_SCALARS;
                }
                else
                {
                    // VERTICES, POLYGONS and the like are skipped token by token.
                    cursor.next();
                }
                break;
            }

            case READ_LINES:
                if (cursor.hasNext() && OFFSETS.equalsIgnoreCase(cursor.peek()))
                {
                    readOffsetCells(cursor, cellCount, cellSize, pointCount, lines);
                }
                else
                {
                    for (int c = 0; c < cellCount; ++c)
                    {
                        int size = cursor.nextCount(VtkFormat.LINES);
                        cursor.require(size, VtkFormat.LINES);
                        List<Integer> cell = new ArrayList<Integer>();
                        for (int i = 0; i < size; ++i)
                        {
                            cell.add(cursor.nextIndex(VtkFormat.LINES, pointCount));
                        }
                        lines.add(cell);
                    }
                }
                state = State.SEEK_SCALARS;
                break;

            case SEEK_SCALARS:
            {
                if (!cursor.hasNext())
                {
                    state = State.DONE;
                    break;
                }
                String token = cursor.next();
                if (VtkFormat.POINT_DATA.equalsIgnoreCase(token))
                {
                    pointDataCount = cursor.nextCount(VtkFormat.POINT_DATA);
                    cellSection = false;
                }
                else if (VtkFormat.CELL_DATA.equalsIgnoreCase(token))
                {
                    cursor.nextCount(VtkFormat.CELL_DATA);
                    cellSection = true;
                }
                else if (!cellSection && VtkFormat.SCALARS.equalsIgnoreCase(token))
                {
                    scalarName = cursor.next(VtkFormat.SCALARS);
                    cursor.next(VtkFormat.SCALARS); // data type
                    if (cursor.hasNext() && isInteger(cursor.peek()))
                    {
                        scalarComponents = Math.max(1, cursor.nextCount(VtkFormat.SCALARS));
                    }
                    if (cursor.hasNext() && VtkFormat.LOOKUP_TABLE.equalsIgnoreCase(cursor.peek()))
                    {
                        cursor.next();
                        cursor.next(VtkFormat.LOOKUP_TABLE);
                    }
                    state = State.READ_SCALARS;
                }
                else if (!cellSection && VtkFormat.FIELD.equalsIgnoreCase(token))
                {
                    String fieldArray = readField(cursor, (pointDataCount < 0) ? pointCount : pointDataCount,
                            scalars);
                    if (fieldArray != null)
                    {
                        scalarName = fieldArray;
                        state = State.DONE;
                    }
                }
                break;
            }

            case READ_SCALARS:
            {
                int count = (pointDataCount < 0) ? pointCount : pointDataCount;
                cursor.require((long) count * scalarComponents, VtkFormat.SCALARS);
                for (int i = 0; i < count; ++i)
                {
                    scalars.add(cursor.nextDouble(VtkFormat.SCALARS));
                    for (int c = 1; c < scalarComponents; ++c)
                    {
                        cursor.nextDouble(VtkFormat.SCALARS);
                    }
                }
                state = State.DONE;
                break;
            }

            default:
                state = State.DONE;
                break;
            }
        }

        VtkPreview preview = new VtkPreview();
        preview.setOk(true);
        preview.setPoints(points);
        preview.setLines(lines);
        preview.setScalarName(scalarName);
        preview.setScalars(scalars);
        preview.setBounds(BoundingBox.of(points));
        preview.setMessage("Read " + points.size() + " points and " + lines.size() + " lines");

        return preview;
    }

    private static void readOffsetCells(TokenCursor cursor, int offsetCount, int connectivitySize, int pointCount,
            List<List<Integer>> lines)
    {
        cursor.next();
        cursor.next(OFFSETS); // data type
        cursor.require(offsetCount, OFFSETS);
        int[] offsets = new int[offsetCount];
        for (int i = 0; i < offsetCount; ++i)
        {
            offsets[i] = cursor.nextCount(OFFSETS);
        }

        if (!CONNECTIVITY.equalsIgnoreCase(cursor.next(CONNECTIVITY)))
        {
            throw new IllegalArgumentException("Expected CONNECTIVITY after OFFSETS");
        }
        cursor.next(CONNECTIVITY); // data type
        cursor.require(connectivitySize, CONNECTIVITY);
        int[] connectivity = new int[connectivitySize];
        for (int i = 0; i < connectivitySize; ++i)
        {
            connectivity[i] = cursor.nextIndex(CONNECTIVITY, pointCount);
        }

        for (int c = 0; c + 1 < offsetCount; ++c)
        {
            if ((offsets[c] > offsets[c + 1]) || (offsets[c + 1] > connectivitySize))
            {
                throw new IllegalArgumentException("Cell offsets are out of range");
            }
            List<Integer> cell = new ArrayList<Integer>();
            for (int i = offsets[c]; i < offsets[c + 1]; ++i)
            {
                cell.add(connectivity[i]);
            }
            lines.add(cell);
        }
    }

    /**
     * Read a FIELD block, keeping the first one-component array that has a value
     * per point.
     *
     * @return the name of the kept array, or null if none qualified.
     */
    private static String readField(TokenCursor cursor, int pointDataCount, List<Double> scalars)
    {
        cursor.next(VtkFormat.FIELD); // field name
        int arrayCount = cursor.nextCount(VtkFormat.FIELD);

        String kept = null;
        for (int a = 0; a < arrayCount; ++a)
        {
            String arrayName = cursor.next(VtkFormat.FIELD);
            int components = cursor.nextCount(arrayName);
            int tuples = cursor.nextCount(arrayName);
            cursor.next(arrayName); // data type
            long values = (long) components * tuples;
            cursor.require(values, arrayName);

            boolean keep = (kept == null) && (components == 1) && (tuples == pointDataCount);
            for (long i = 0; i < values; ++i)
            {
                double value = cursor.nextDouble(arrayName);
                if (keep)
                {
                    scalars.add(value);
                }
            }
            if (keep)
            {
                kept = arrayName;
            }
        }

        return kept;
    }

    private static boolean isAttributeKeyword(String token)
    {
        return VtkFormat.POINT_DATA.equalsIgnoreCase(token) || VtkFormat.CELL_DATA.equalsIgnoreCase(token)
                || VtkFormat.SCALARS.equalsIgnoreCase(token) || VtkFormat.FIELD.equalsIgnoreCase(token);
    }

    private static boolean isInteger(String token)
    {
        return !token.isEmpty() && token.chars().allMatch(Character::isDigit);
    }

    /**
     * Cursor over the whitespace separated tokens of a file body. Every read
     * names the block being read, so failures say where the file went wrong.
     */
    private static class TokenCursor
    {
        private final String[] tokens;
        private int position;

        TokenCursor(String text)
        {
            String trimmed = text.strip();
            tokens = trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
        }

        boolean hasNext()
        {
            return position < tokens.length;
        }

        /**
         * Fail unless at least count more tokens remain. Counts declared by the
         * file are checked here before anything is sized from them.
         */
        void require(long count, String block)
        {
            if (count > tokens.length - position)
            {
                throw new IllegalArgumentException("File is truncated inside the " + block + " section: "
                        + count + " values declared, " + (tokens.length - position) + " present");
            }
        }

        String peek()
        {
            return tokens[position];
        }

        String next()
        {
            return tokens[position++];
        }

        String next(String block)
        {
            if (!hasNext())
            {
                throw new IllegalArgumentException("File is truncated inside the " + block + " section");
            }
            return next();
        }

        double nextDouble(String block)
        {
            String token = next(block);
            try
            {
                return Double.parseDouble(token);
            }
            catch (NumberFormatException ex)
            {
                throw new IllegalArgumentException("Non-numeric value '" + token + "' in the " + block + " section",
                        ex);
            }
        }

        int nextCount(String block)
        {
            String token = next(block);
            try
            {
                int value = Integer.parseInt(token);
                if (value < 0)
                {
                    throw new IllegalArgumentException("Negative count " + value + " in the " + block + " section");
                }
                return value;
            }
            catch (NumberFormatException ex)
            {
                throw new IllegalArgumentException("Expected an integer in the " + block + " section but found '"
                        + token + "'", ex);
            }
        }

        int nextIndex(String block, int pointCount)
        {
            int index = nextCount(block);
            if (index >= pointCount)
            {
                throw new IllegalArgumentException(
                        "Point index " + index + " in the " + block + " section is out of range for " + pointCount
                                + " points");
            }
            return index;
        }
    }
}
