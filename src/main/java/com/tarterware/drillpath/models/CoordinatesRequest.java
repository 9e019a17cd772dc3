package com.tarterware.drillpath.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Asks for the L/M/R base coordinates at one cross-section, given either as a
 * distance from the entrance or as a survey point. Direction angle and
 * reference distance override the configured frame when set.
 */
@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CoordinatesRequest
{
    Double distanceFromEntrance;

    String surveyPoint;

    Double directionAngle;

    Double referenceDistance;
}
