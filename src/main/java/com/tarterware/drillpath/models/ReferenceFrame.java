package com.tarterware.drillpath.models;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable description of where a tunnel sits in the site coordinate system.
 *
 * <p>
 * A ReferenceFrame carries:
 * <ul>
 * <li>The chainage distance of the reference cross-section and the tunnel
 * direction angle at that section.</li>
 * <li>The base X/Y of the L, M and R boreholes at the reference cross-section,
 * in millimeters of the site plane system.</li>
 * <li>The constant elevation (Z, meters) of each borehole.</li>
 * <li>The survey point that chainage text is measured against.</li>
 * </ul>
 * </p>
 *
 * <p>
 * Instances are built once from configuration and passed explicitly into every
 * transform; nothing in the conversion pipeline changes them.
 * </p>
 */
@Value
public class ReferenceFrame
{
    public static final double DEFAULT_REFERENCE_DISTANCE = 967.0;

    public static final double DEFAULT_DIRECTION_ANGLE = 65.588;

    // Chainage distance of the reference cross-section, in meters.
    double referenceDistance;

    // Tunnel direction angle in degrees.
    double directionAngle;

    // Base X/Y of each borehole at the reference cross-section, in millimeters.
    Map<Side, PlaneCoordinate> baseCoordinates;

    // Elevation of each borehole, in meters.
    Map<Side, Double> elevations;

    SurveyReference surveyReference;

    @Builder(toBuilder = true)
    private ReferenceFrame(double referenceDistance, double directionAngle, Map<Side, PlaneCoordinate> baseCoordinates,
            Map<Side, Double> elevations, SurveyReference surveyReference)
    {
        requireAllSides(baseCoordinates, "baseCoordinates");
        requireAllSides(elevations, "elevations");

        this.referenceDistance = referenceDistance;
        this.directionAngle = directionAngle;
        this.baseCoordinates = Collections.unmodifiableMap(new EnumMap<>(baseCoordinates));
        this.elevations = Collections.unmodifiableMap(new EnumMap<>(elevations));
        this.surveyReference = (surveyReference != null) ? surveyReference : SurveyReference.DEFAULT;
    }

    /**
     * Get the base position of one borehole at the reference cross-section.
     *
     * @param side borehole side.
     * @return base X/Y in millimeters.
     */
    public PlaneCoordinate getBaseCoordinate(Side side)
    {
        return baseCoordinates.get(side);
    }

    /**
     * Get the constant elevation of one borehole.
     *
     * @param side borehole side.
     * @return elevation in meters.
     */
    public double getElevation(Side side)
    {
        return elevations.get(side);
    }

    /**
     * The frame used by the tunnel progress spreadsheet.
     *
     * @return a ReferenceFrame holding the spreadsheet's fixed values.
     */
    public static ReferenceFrame defaults()
    {
        Map<Side, PlaneCoordinate> baseCoordinates = new EnumMap<>(Side.class);
        baseCoordinates.put(Side.L, new PlaneCoordinate(-660689.7596, 733147.0996));
        baseCoordinates.put(Side.M, new PlaneCoordinate(-658622.871, 737699.9102));
        baseCoordinates.put(Side.R, new PlaneCoordinate(-656556.8108, 742253.072));

        Map<Side, Double> elevations = new EnumMap<>(Side.class);
        elevations.put(Side.L, 17.3);
        elevations.put(Side.M, 21.3);
        elevations.put(Side.R, 17.3);

        return ReferenceFrame.builder()
                .referenceDistance(DEFAULT_REFERENCE_DISTANCE)
                .directionAngle(DEFAULT_DIRECTION_ANGLE)
                .baseCoordinates(baseCoordinates)
                .elevations(elevations)
                .surveyReference(SurveyReference.DEFAULT)
                .build();
    }

    private static void requireAllSides(Map<Side, ?> map, String name)
    {
        if (map == null)
        {
            throw new IllegalArgumentException(name + " cannot be null!");
        }
        for (Side side : Side.values())
        {
            if (map.get(side) == null)
            {
                throw new IllegalArgumentException(name + " is missing a value for side " + side);
            }
        }
    }
}
