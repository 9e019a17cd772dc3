package com.tarterware.drillpath.exceptions;

import java.util.List;

/**
 * Thrown when an input table has no column for the depth or the measured
 * value.
 */
public class MissingColumnException extends IllegalArgumentException
{
    private static final long serialVersionUID = 1L;

    private final String column;

    private final List<String> header;

    public MissingColumnException(String column, List<String> header)
    {
        super("Required column '" + column + "' not found in header " + header);
        this.column = column;
        this.header = List.copyOf(header);
    }

    public String getColumn()
    {
        return column;
    }

    public List<String> getHeader()
    {
        return header;
    }
}
