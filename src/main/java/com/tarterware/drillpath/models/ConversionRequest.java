package com.tarterware.drillpath.models;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Converts one in-memory series. The cross-section is given either as a
 * distance from the entrance or as a survey point; output paths default to
 * the configured output directory.
 */
@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConversionRequest
{
    Side side;

    Double distanceFromEntrance;

    String surveyPoint;

    List<DepthSample> samples = new ArrayList<DepthSample>();

    String vtkPath;

    String csvPath;
}
