package com.tarterware.drillpath.exceptions;

/**
 * Thrown when a borehole series has fewer samples than a polyline needs.
 */
public class InsufficientDataException extends IllegalArgumentException
{
    private static final long serialVersionUID = 1L;

    public static final int MINIMUM_POINTS = 2;

    private final int found;

    public InsufficientDataException(int found)
    {
        super("At least " + MINIMUM_POINTS + " data points are required, found " + found);
        this.found = found;
    }

    public int getFound()
    {
        return found;
    }

    /**
     * Throw unless count is large enough to form a polyline.
     * 
     * @param count number of samples or points available.
     */
    public static void check(int count)
    {
        if (count < MINIMUM_POINTS)
        {
            throw new InsufficientDataException(count);
        }
    }
}
