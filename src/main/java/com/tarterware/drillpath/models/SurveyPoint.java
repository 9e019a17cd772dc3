package com.tarterware.drillpath.models;

import lombok.Value;

/**
 * A tunnel chainage position written as {@code major+minor}, e.g. "254+19.4".
 */
@Value
public class SurveyPoint
{
    // Station number; always integral.
    double major;

    // Offset past the station in meters.
    double minor;
}
