package com.tarterware.drillpath.controllers;

import com.tarterware.drillpath.components.SurveyPointLocator;
import com.tarterware.drillpath.models.ReferenceFrame;
import com.tarterware.drillpath.utilities.StringUtilities;

/**
 * Picks the cross-section distance out of a request that may give it directly
 * or as a survey point. A survey point wins when both are present.
 */
final class DistanceResolver
{
    private DistanceResolver()
    {
    }

    static double resolve(SurveyPointLocator locator, ReferenceFrame frame, String surveyPoint,
            Double distanceFromEntrance)
    {
        if (!StringUtilities.isNullEmptyOrBlank(surveyPoint))
        {
            return locator.distanceFromEntrance(surveyPoint, frame);
        }
        if (distanceFromEntrance == null)
        {
            throw new IllegalArgumentException("Either surveyPoint or distanceFromEntrance is required!");
        }
        if (!Double.isFinite(distanceFromEntrance))
        {
            throw new IllegalArgumentException("distanceFromEntrance must be a finite number!");
        }

        return distanceFromEntrance;
    }
}
