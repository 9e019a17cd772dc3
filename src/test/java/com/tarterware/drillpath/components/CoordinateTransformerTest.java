package com.tarterware.drillpath.components;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.tarterware.drillpath.models.PlaneCoordinate;
import com.tarterware.drillpath.models.ReferenceFrame;
import com.tarterware.drillpath.models.Side;
import com.tarterware.drillpath.models.SideCoordinates;

class CoordinateTransformerTest
{
    private final CoordinateTransformer transformer = new CoordinateTransformer();

    private final ReferenceFrame frame = ReferenceFrame.defaults();

    private static Map<Side, PlaneCoordinate> expectedAt1238()
    {
        Map<Side, PlaneCoordinate> expected = new EnumMap<>(Side.class);
        expected.put(Side.L, new PlaneCoordinate(-907.462, 845.150));
        expected.put(Side.M, new PlaneCoordinate(-905.395, 849.703));
        expected.put(Side.R, new PlaneCoordinate(-903.329, 854.256));
        return expected;
    }

    @Test
    void testRegressionFixture()
    {
        SideCoordinates coordinates = transformer.calculate(1238, frame);

        for (Map.Entry<Side, PlaneCoordinate> entry : expectedAt1238().entrySet())
        {
            assertEquals(entry.getValue().getX(), coordinates.get(entry.getKey()).getX(), 0.001);
            assertEquals(entry.getValue().getY(), coordinates.get(entry.getKey()).getY(), 0.001);
        }
        assertEquals(1238.0, coordinates.getDistanceFromEntrance(), 0.0);
        assertEquals(ReferenceFrame.DEFAULT_DIRECTION_ANGLE, coordinates.getDirectionAngle(), 0.0);
        assertTrue(transformer.validate(expectedAt1238(), coordinates.getCoordinates()));
    }

    @Test
    void testReferenceDistanceGivesBaseCoordinates()
    {
        SideCoordinates coordinates = transformer.calculate(ReferenceFrame.DEFAULT_REFERENCE_DISTANCE, frame);

        // Base values are millimeters; results are meters rounded to the millimeter
        assertEquals(-660.690, coordinates.get(Side.L).getX(), 1e-9);
        assertEquals(733.147, coordinates.get(Side.L).getY(), 1e-9);
        assertEquals(-658.623, coordinates.get(Side.M).getX(), 1e-9);
        assertEquals(737.700, coordinates.get(Side.M).getY(), 1e-9);
    }

    @Test
    void testResultsAreRoundedToThreeDecimals()
    {
        SideCoordinates coordinates = transformer.calculate(1111.111, frame);
        for (Side side : Side.values())
        {
            double x = coordinates.get(side).getX();
            double y = coordinates.get(side).getY();
            assertEquals(Math.round(x * 1000) / 1000.0, x, 1e-9);
            assertEquals(Math.round(y * 1000) / 1000.0, y, 1e-9);
        }
    }

    @Test
    void testAffinity()
    {
        // Moving d meters along the tunnel shifts every side by d * (-cos a, sin a), a = 90 - angle.
        double radAngle = (90 - frame.getDirectionAngle()) * Math.PI / 180;
        SideCoordinates near = transformer.calculate(1000, frame);
        SideCoordinates far = transformer.calculate(1100, frame);

        for (Side side : Side.values())
        {
            double dx = far.get(side).getX() - near.get(side).getX();
            double dy = far.get(side).getY() - near.get(side).getY();
            assertEquals(-100 * Math.cos(radAngle), dx, 0.002);
            assertEquals(100 * Math.sin(radAngle), dy, 0.002);
        }
    }

    @Test
    void testExplicitAngleAndReferenceDistance()
    {
        // Same angle and reference distance as the frame gives the same answer
        SideCoordinates explicit = transformer.calculate(1238, 65.588, 967, frame);
        assertEquals(transformer.calculate(1238, frame), explicit);

        // Direction 90 degrees means no rotation: the tunnel runs along -X
        SideCoordinates straight = transformer.calculate(1067, 90.0, 967, frame);
        assertEquals(-660.690 - 100, straight.get(Side.L).getX(), 1e-9);
        assertEquals(733.147, straight.get(Side.L).getY(), 1e-9);
    }

    @Test
    void testCalculateBatch()
    {
        List<SideCoordinates> results = transformer.calculateBatch(List.of(1238.0, 967.0), frame);

        assertEquals(2, results.size());
        assertEquals(1238.0, results.get(0).getDistanceFromEntrance(), 0.0);
        assertEquals(-907.462, results.get(0).get(Side.L).getX(), 0.001);
        assertEquals(967.0, results.get(1).getDistanceFromEntrance(), 0.0);
    }

    @Test
    void testValidate()
    {
        Map<Side, PlaneCoordinate> actual = new EnumMap<>(expectedAt1238());
        assertTrue(transformer.validate(expectedAt1238(), actual));

        // Within tolerance
        actual.put(Side.M, new PlaneCoordinate(-905.3955, 849.703));
        assertTrue(transformer.validate(expectedAt1238(), actual));

        // Outside tolerance
        actual.put(Side.M, new PlaneCoordinate(-905.400, 849.703));
        assertFalse(transformer.validate(expectedAt1238(), actual));
        assertTrue(transformer.validate(expectedAt1238(), actual, 0.01));

        // Sides missing from either map are not compared
        actual.remove(Side.M);
        assertTrue(transformer.validate(expectedAt1238(), actual));
    }
}
