package com.tarterware.drillpath.vtk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tarterware.drillpath.models.TrajectoryPoint;
import com.tarterware.drillpath.models.VtkDocument;
import com.tarterware.drillpath.models.VtkPreview;

import utils.TestUtils;

class PolyDataReaderTest
{
    private final PolyDataReader reader = new PolyDataReader();

    private static List<TrajectoryPoint> points(int n)
    {
        List<TrajectoryPoint> points = new ArrayList<>();
        for (int i = 0; i < n; ++i)
        {
            points.add(new TrajectoryPoint(-907.462 - i * 0.45, 845.15 + i * 0.2, 17.3, 10.0 + i));
        }
        return points;
    }

    @Test
    void testRoundTrip(@TempDir Path tempDir)
    {
        List<TrajectoryPoint> points = points(6);
        Path file = tempDir.resolve("trip.vtk");
        new GeometryPolyDataWriter().write(new VtkDocument(points), file);

        VtkPreview preview = reader.read(file);

        assertTrue(preview.isOk(), preview.getMessage());
        assertEquals(6, preview.getPointCount());
        assertEquals(1, preview.getLineCount());
        assertEquals(List.of(0, 1, 2, 3, 4, 5), preview.getLines().get(0));
        assertEquals("Energy", preview.getScalarName());
        for (int i = 0; i < points.size(); ++i)
        {
            assertEquals(points.get(i).getX(), preview.getPoints().get(i).get(0), 0.0);
            assertEquals(points.get(i).getY(), preview.getPoints().get(i).get(1), 0.0);
            assertEquals(points.get(i).getZ(), preview.getPoints().get(i).get(2), 0.0);
            assertEquals(points.get(i).getScalar(), preview.getScalars().get(i), 0.0);
        }

        assertEquals(-907.462 - 5 * 0.45, preview.getBounds().getMinX(), 0.0);
        assertEquals(-907.462, preview.getBounds().getMaxX(), 0.0);
        assertEquals(845.15, preview.getBounds().getMinY(), 0.0);
        assertEquals(17.3, preview.getBounds().getMinZ(), 0.0);
        assertEquals(17.3, preview.getBounds().getMaxZ(), 0.0);
    }

    @Test
    void testPackedAndOnePerLineLayoutsAgree()
    {
        String header = "# vtk DataFile Version 3.0\nt\nASCII\nDATASET POLYDATA\n";
        String body = "POINTS 3 float\n0 0 0 1 1 1 2 2 2\n"
                + "LINES 1 4\n3 0 1 2\n"
                + "POINT_DATA 3\nSCALARS v float\nLOOKUP_TABLE default\n7 8 9\n";
        String packed = header + body;
        String onePerLine = header + body.replace(' ', '\n');

        VtkPreview a = reader.read(packed);
        VtkPreview b = reader.read(onePerLine);

        assertTrue(a.isOk(), a.getMessage());
        assertTrue(b.isOk(), b.getMessage());
        assertEquals(a.getPoints(), b.getPoints());
        assertEquals(a.getLines(), b.getLines());
        assertEquals(a.getScalars(), b.getScalars());
        assertEquals(List.of(7.0, 8.0, 9.0), a.getScalars());
        assertEquals("v", a.getScalarName());
    }

    @Test
    void testFieldData()
    {
        VtkPreview preview = reader.read(TestUtils.fixture("vtk/field_data.vtk"));

        assertTrue(preview.isOk(), preview.getMessage());
        assertEquals(3, preview.getPointCount());
        assertEquals(List.of(List.of(0, 1, 2)), preview.getLines());
        assertEquals("Energy", preview.getScalarName());
        assertEquals(List.of(10.5, 11.0, 12.5), preview.getScalars());
        assertEquals(-907.462, preview.getPoints().get(0).get(0), 0.0);
    }

    @Test
    void testOffsetsLayoutWithSeveralFieldArrays()
    {
        VtkPreview preview = reader.read(TestUtils.fixture("vtk/offsets_layout.vtk"));

        assertTrue(preview.isOk(), preview.getMessage());
        assertEquals(4, preview.getPointCount());
        assertEquals(List.of(List.of(0, 1, 2, 3)), preview.getLines());

        // Flags has two components, so the one-component Energy array is used
        assertEquals("Energy", preview.getScalarName());
        assertEquals(List.of(1.5, 2.5, 3.5, 4.5), preview.getScalars());
        assertEquals(5.0, preview.getBounds().getMaxZ(), 0.0);
    }

    @Test
    void testTitleMayContainKeywords()
    {
        String content = "# vtk DataFile Version 3.0\nPOINTS LINES SCALARS BINARY\nASCII\nDATASET POLYDATA\n"
                + "POINTS 2 float\n0 0 0\n1 0 0\nLINES 1 3\n2 0 1\n";

        VtkPreview preview = reader.read(content);

        assertTrue(preview.isOk(), preview.getMessage());
        assertEquals(2, preview.getPointCount());
        assertNull(preview.getScalarName());
        assertTrue(preview.getScalars().isEmpty());
    }

    @Test
    void testScalarsWithoutLines()
    {
        VtkPreview preview = reader.read("POINTS 2 float 0 0 0 1 1 1 POINT_DATA 2 SCALARS s float 1 3.5 4.5");

        assertTrue(preview.isOk(), preview.getMessage());
        assertEquals(0, preview.getLineCount());
        assertEquals(List.of(3.5, 4.5), preview.getScalars());
    }

    @Test
    void testCellScalarsAreIgnored()
    {
        String content = "POINTS 2 float 0 0 0 1 1 1 LINES 1 3 2 0 1 "
                + "CELL_DATA 1 SCALARS c float 1 LOOKUP_TABLE default 99 "
                + "POINT_DATA 2 SCALARS p float 1 LOOKUP_TABLE default 5 6";

        VtkPreview preview = reader.read(content);

        assertTrue(preview.isOk(), preview.getMessage());
        assertEquals("p", preview.getScalarName());
        assertEquals(List.of(5.0, 6.0), preview.getScalars());
    }

    @Test
    void testMissingPoints()
    {
        VtkPreview preview = reader.read("# vtk DataFile Version 3.0\nt\nASCII\nDATASET POLYDATA\n");

        assertFalse(preview.isOk());
        assertTrue(preview.getMessage().contains("POINTS"), preview.getMessage());
        assertTrue(preview.getPoints().isEmpty());
    }

    @Test
    void testTruncatedPoints()
    {
        VtkPreview preview = reader.read("POINTS 3 float\n0 0 0\n1 1");

        assertFalse(preview.isOk());
        assertTrue(preview.getMessage().contains("truncated"), preview.getMessage());
    }

    @Test
    void testTruncatedScalars()
    {
        VtkPreview preview = reader.read("POINTS 2 float 0 0 0 1 1 1 POINT_DATA 2 SCALARS s float 1 3.5");

        assertFalse(preview.isOk());
        assertTrue(preview.getMessage().contains("truncated"), preview.getMessage());
    }

    @Test
    void testNonNumericToken()
    {
        VtkPreview preview = reader.read("POINTS 2 float 0 0 zero 1 1 1");

        assertFalse(preview.isOk());
        assertTrue(preview.getMessage().contains("zero"), preview.getMessage());
    }

    @Test
    void testIndexOutOfRange()
    {
        VtkPreview preview = reader.read("POINTS 2 float 0 0 0 1 1 1 LINES 1 3 2 0 2");

        assertFalse(preview.isOk());
        assertTrue(preview.getMessage().contains("out of range"), preview.getMessage());
    }

    @Test
    void testHugeDeclaredCountsAreTruncation()
    {
        // Counts far beyond the tokens present must fail without sizing anything from them.
        VtkPreview lines = reader.read("POINTS 2 float 0 0 0 1 1 1 LINES 2000000000 2 OFFSETS vtktypeint64 0 2");
        assertFalse(lines.isOk());
        assertTrue(lines.getMessage().contains("truncated inside the LINES"), lines.getMessage());

        VtkPreview offsets = reader.read(
                "POINTS 2 float 0 0 0 1 1 1 LINES 2 2000000000 OFFSETS vtktypeint64 0 2 CONNECTIVITY vtktypeint64 0 1");
        assertFalse(offsets.isOk());
        assertTrue(offsets.getMessage().contains("truncated inside the CONNECTIVITY"), offsets.getMessage());

        VtkPreview cell = reader.read("POINTS 2 float 0 0 0 1 1 1 LINES 1 3 2000000000 0 1");
        assertFalse(cell.isOk());
        assertTrue(cell.getMessage().contains("truncated"), cell.getMessage());

        VtkPreview points = reader.read("POINTS 2147483647 float 0 0 0");
        assertFalse(points.isOk());
        assertTrue(points.getMessage().contains("truncated inside the POINTS"), points.getMessage());

        VtkPreview field = reader.read("POINTS 1 float 0 0 0 POINT_DATA 1 FIELD f 1 big 2000000000 2000000000 double 1");
        assertFalse(field.isOk());
        assertTrue(field.getMessage().contains("truncated inside the big"), field.getMessage());
    }

    @Test
    void testLinesHeaderAtEndOfFile()
    {
        VtkPreview preview = reader.read("POINTS 1 float 0 0 0 LINES 0 0");

        assertTrue(preview.isOk(), preview.getMessage());
        assertTrue(preview.getLines().isEmpty());
    }

    @Test
    void testBinaryIsRejected()
    {
        VtkPreview preview = reader.read("# vtk DataFile Version 3.0\nt\nBINARY\nDATASET POLYDATA\nPOINTS 2 float\n");

        assertFalse(preview.isOk());
        assertTrue(preview.getMessage().contains("Binary"), preview.getMessage());
    }

    @Test
    void testUnreadableSources(@TempDir Path tempDir)
    {
        assertFalse(reader.read(tempDir.resolve("missing.vtk")).isOk());
        assertFalse(reader.read((String) null).isOk());

        Reader failing = new StringReader("POINTS 1 float 0 0 0")
        {
            @Override
            public int read(char[] cbuf, int off, int len) throws IOException
            {
                throw new IOException("disk on fire");
            }
        };
        VtkPreview preview = reader.read(failing);
        assertFalse(preview.isOk());
        assertTrue(preview.getMessage().contains("disk on fire"));
    }

    @Test
    void testReadFromReader()
    {
        VtkPreview preview = reader.read(new StringReader("POINTS 2 float 0 0 0 3 4 5"));

        assertTrue(preview.isOk(), preview.getMessage());
        assertEquals(5.0, preview.getBounds().getMaxZ(), 0.0);
        assertEquals(0.0, preview.getBounds().getMinX(), 0.0);
    }
}
