package com.tarterware.drillpath.components;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.tarterware.drillpath.exceptions.InsufficientDataException;
import com.tarterware.drillpath.models.DepthSample;
import com.tarterware.drillpath.models.PlaneCoordinate;
import com.tarterware.drillpath.models.ReferenceFrame;
import com.tarterware.drillpath.models.Side;
import com.tarterware.drillpath.models.SideCoordinates;
import com.tarterware.drillpath.models.TrajectoryPoint;
import com.tarterware.drillpath.utilities.TopologyUtilities;

/**
 * Projects the samples of one borehole from its start coordinate along the
 * tunnel direction, producing the borehole's 3D trajectory.
 *
 * <p>
 * Each sample at depth d lands at
 * {@code (baseX - d * sin(angle), baseY + d * cos(angle), elevation)}. The hole
 * is treated as horizontal, so every vertex shares the side's elevation.
 * </p>
 */
@Component
public class TrajectoryBuilder
{
    private static final Logger logger = LoggerFactory.getLogger(TrajectoryBuilder.class);

    /**
     * Build the trajectory of one borehole.
     *
     * @param base           Start of the hole, in meters.
     * @param elevation      Constant elevation of the hole, in meters.
     * @param directionAngle Hole direction in degrees.
     * @param samples        Depth-ordered samples; at least two.
     * @return one TrajectoryPoint per sample, in sample order.
     * @throws InsufficientDataException if fewer than two samples are supplied.
     * @throws IllegalArgumentException  if a sample is null or its depth is
     *                                   negative or not finite.
     */
    public List<TrajectoryPoint> build(PlaneCoordinate base, double elevation, double directionAngle,
            List<DepthSample> samples)
    {
        if (samples == null)
        {
            throw new InsufficientDataException(0);
        }
        InsufficientDataException.check(samples.size());

        List<TrajectoryPoint> points = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); ++i)
        {
            DepthSample sample = checkSample(samples.get(i), i);
            PlaneCoordinate p = TopologyUtilities.getCoordinateAtBearingAndRange(base, sample.getDepth(),
                    directionAngle);
            points.add(new TrajectoryPoint(p.getX(), p.getY(), elevation, sample.getValue()));
        }

        logger.debug("Built trajectory of {} points from ({}, {}) at {} degrees", points.size(), base.getX(),
                base.getY(), directionAngle);

        return points;
    }

    private static DepthSample checkSample(DepthSample sample, int index)
    {
        if (sample == null)
        {
            throw new IllegalArgumentException("Sample " + index + " is null");
        }
        if (!Double.isFinite(sample.getDepth()) || (sample.getDepth() < 0))
        {
            throw new IllegalArgumentException(
                    "Sample " + index + " has depth " + sample.getDepth() + "; depths must be finite and not negative");
        }

        return sample;
    }

    /**
     * Build the trajectory of one side, taking its start from computed side
     * coordinates and its elevation from the reference frame.
     *
     * @param side        Borehole side.
     * @param coordinates Start coordinates at the borehole's cross-section.
     * @param frame       Reference frame supplying the elevation.
     * @param samples     Depth-ordered samples; at least two.
     * @return one TrajectoryPoint per sample, in sample order.
     */
    public List<TrajectoryPoint> build(Side side, SideCoordinates coordinates, ReferenceFrame frame,
            List<DepthSample> samples)
    {
        return build(coordinates.get(side), frame.getElevation(side), coordinates.getDirectionAngle(), samples);
    }
}
