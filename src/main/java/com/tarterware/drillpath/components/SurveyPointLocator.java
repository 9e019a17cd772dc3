package com.tarterware.drillpath.components;

import java.math.BigDecimal;

import org.springframework.stereotype.Component;

import com.tarterware.drillpath.exceptions.SurveyPointFormatException;
import com.tarterware.drillpath.models.ReferenceFrame;
import com.tarterware.drillpath.models.SurveyPoint;
import com.tarterware.drillpath.models.SurveyReference;
import com.tarterware.drillpath.utilities.StringUtilities;

/**
 * Converts tunnel chainage notation ({@code major+minor}) into a linear
 * distance from the tunnel entrance.
 *
 * <p>
 * A survey point's linear value is {@code major * factor + minor}, where factor
 * is the number of meters between major stations. Chainage counts down towards
 * the entrance, so the distance from the entrance is the reference survey
 * point's linear value minus the point's own.
 * </p>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * SurveyPoint point = locator.parse("254+19.4");
 * double meters = locator.distanceFromEntrance(point, referenceFrame); // 4.6
 * </pre>
 * </p>
 */
@Component
public class SurveyPointLocator
{
    public static final char SEPARATOR = '+';

    /**
     * Parse chainage text.
     *
     * @param text Text such as "254+19.4".
     * @return the parsed SurveyPoint.
     * @throws SurveyPointFormatException if the text does not hold exactly one '+'
     *                                    between two numbers, or the major part is
     *                                    not a whole number.
     */
    public SurveyPoint parse(String text)
    {
        if (StringUtilities.isNullEmptyOrBlank(text))
        {
            throw new SurveyPointFormatException(text, "Survey point cannot be empty!");
        }

        int separator = text.indexOf(SEPARATOR);
        if ((separator < 0) || (text.indexOf(SEPARATOR, separator + 1) >= 0))
        {
            throw new SurveyPointFormatException(text, "Invalid survey point format: " + text);
        }

        double major = parseNumber(text, text.substring(0, separator));
        double minor = parseNumber(text, text.substring(separator + 1));

        if (major != Math.rint(major))
        {
            throw new SurveyPointFormatException(text, "Major station must be a whole number: " + text);
        }

        return new SurveyPoint(major, minor);
    }

    /**
     * Render a survey point in canonical form. A whole minor part is written
     * without a decimal point ("254+19"); a fractional one as-is ("254+19.4").
     *
     * @param point Point to render.
     * @return canonical chainage text.
     */
    public String format(SurveyPoint point)
    {
        return StringUtilities.toPlainDecimal(point.getMajor()) + SEPARATOR
                + StringUtilities.toPlainDecimal(point.getMinor());
    }

    /**
     * Linear value of a survey point for a given station spacing.
     *
     * @param point  Survey point.
     * @param factor Meters between major stations.
     * @return major * factor + minor.
     */
    public double linearValue(SurveyPoint point, double factor)
    {
        return point.getMajor() * factor + point.getMinor();
    }

    /**
     * Linear value of the frame's reference survey point, 5104 for the default
     * reference of 255+4.
     *
     * @param frame Reference frame.
     * @return the reference linear value.
     */
    public double referenceValue(ReferenceFrame frame)
    {
        SurveyReference reference = frame.getSurveyReference();
        return reference.getMajor() * reference.getConversionFactor() + reference.getMinor();
    }

    /**
     * Distance of a survey point from the tunnel entrance.
     *
     * @param point Survey point.
     * @param frame Reference frame supplying the reference point and station
     *              spacing.
     * @return distance in meters.
     */
    public double distanceFromEntrance(SurveyPoint point, ReferenceFrame frame)
    {
        double factor = frame.getSurveyReference().getConversionFactor();
        return referenceValue(frame) - linearValue(point, factor);
    }

    /**
     * Parse chainage text and return its distance from the tunnel entrance.
     *
     * @param text  Text such as "254+19.4".
     * @param frame Reference frame.
     * @return distance in meters.
     * @throws SurveyPointFormatException if the text cannot be parsed.
     */
    public double distanceFromEntrance(String text, ReferenceFrame frame)
    {
        return distanceFromEntrance(parse(text), frame);
    }

    private static double parseNumber(String text, String part)
    {
        try
        {
            // BigDecimal refuses NaN, Infinity and hex forms that Double accepts.
            return new BigDecimal(part.trim()).doubleValue();
        }
        catch (NumberFormatException ex)
        {
            throw new SurveyPointFormatException(text, "Survey point parts must be numeric: " + text, ex);
        }
    }
}
