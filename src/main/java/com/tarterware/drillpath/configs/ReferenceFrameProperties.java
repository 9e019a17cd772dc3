package com.tarterware.drillpath.configs;

import java.util.EnumMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.tarterware.drillpath.models.PlaneCoordinate;
import com.tarterware.drillpath.models.ReferenceFrame;
import com.tarterware.drillpath.models.Side;
import com.tarterware.drillpath.models.SurveyReference;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tunnel reference frame settings ({@code com.tarterware.drillpath.reference-frame.*}).
 *
 * <p>
 * Every value defaults to the tunnel progress spreadsheet's, so only the keys
 * that differ need to be configured. Map entries are merged per side:
 *
 * <pre>
 * com.tarterware.drillpath.reference-frame:
 *   reference-distance: 967
 *   direction-angle: 65.588
 *   base-coordinates:
 *     L: { x: -660689.7596, y: 733147.0996 }
 *   elevations:
 *     M: 21.3
 *   survey-reference: { major: 255, minor: 4, conversion-factor: 20 }
 * </pre>
 * </p>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "com.tarterware.drillpath.reference-frame")
public class ReferenceFrameProperties
{
    // Chainage distance of the reference cross-section, in meters.
    private double referenceDistance = ReferenceFrame.DEFAULT_REFERENCE_DISTANCE;

    // Tunnel direction angle, in degrees.
    @DecimalMin("-360.0")
    @DecimalMax("360.0")
    private double directionAngle = ReferenceFrame.DEFAULT_DIRECTION_ANGLE;

    // Borehole base X/Y at the reference cross-section, in millimeters.
    @NotNull
    @Valid
    private Map<Side, Position> baseCoordinates = defaultBaseCoordinates();

    // Constant borehole elevations, in meters.
    @NotNull
    private Map<Side, Double> elevations = new EnumMap<>(ReferenceFrame.defaults().getElevations());

    @NotNull
    @Valid
    private Survey surveyReference = new Survey();

    @Data
    @NoArgsConstructor
    public static class Position
    {
        private double x;
        private double y;

        public Position(PlaneCoordinate coordinate)
        {
            this.x = coordinate.getX();
            this.y = coordinate.getY();
        }
    }

    @Data
    public static class Survey
    {
        private double major = SurveyReference.DEFAULT.getMajor();

        private double minor = SurveyReference.DEFAULT.getMinor();

        // Meters between major stations.
        @Positive
        private double conversionFactor = SurveyReference.DEFAULT.getConversionFactor();
    }

    /**
     * Build the immutable frame described by these settings.
     *
     * @return a new ReferenceFrame.
     * @throws IllegalArgumentException if a side has no base coordinate or
     *                                  elevation.
     */
    public ReferenceFrame toReferenceFrame()
    {
        Map<Side, PlaneCoordinate> coordinates = new EnumMap<>(Side.class);
        baseCoordinates.forEach((side, p) -> coordinates.put(side, new PlaneCoordinate(p.getX(), p.getY())));

        return ReferenceFrame.builder()
                .referenceDistance(referenceDistance)
                .directionAngle(directionAngle)
                .baseCoordinates(coordinates)
                .elevations(elevations)
                .surveyReference(new SurveyReference(surveyReference.getMajor(), surveyReference.getMinor(),
                        surveyReference.getConversionFactor()))
                .build();
    }

    private static Map<Side, Position> defaultBaseCoordinates()
    {
        Map<Side, Position> positions = new EnumMap<>(Side.class);
        ReferenceFrame.defaults().getBaseCoordinates().forEach((side, c) -> positions.put(side, new Position(c)));
        return positions;
    }
}
