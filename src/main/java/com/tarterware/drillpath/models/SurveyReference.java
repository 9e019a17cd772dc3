package com.tarterware.drillpath.models;

import lombok.Value;

/**
 * The survey point that chainage distances are measured against, plus the number
 * of meters between consecutive major stations.
 */
@Value
public class SurveyReference
{
    public static final SurveyReference DEFAULT = new SurveyReference(255, 4, 20);

    double major;

    double minor;

    double conversionFactor;
}
