package com.tarterware.drillpath.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SurveyResponse
{
    boolean valid;

    String message;

    // Canonical form of the requested survey point.
    String surveyPoint;

    double distanceFromEntrance;
}
