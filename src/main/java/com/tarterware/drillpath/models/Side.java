package com.tarterware.drillpath.models;

import java.util.Optional;

/**
 * The three parallel boreholes drilled from one tunnel-face cross-section.
 */
public enum Side
{
    // Left wall
    L,

    // Middle (crown)
    M,

    // Right wall
    R;

    /**
     * Resolve a side from a single letter, ignoring case.
     * 
     * @param letter "L", "M" or "R" in any case.
     * @return the matching Side, or empty if the text is not a side letter.
     */
    public static Optional<Side> fromLetter(String letter)
    {
        if (letter == null)
        {
            return Optional.empty();
        }

        switch (letter.trim().toUpperCase())
        {
        case "L":
            return Optional.of(L);
        case "M":
            return Optional.of(M);
        case "R":
            return Optional.of(R);
        default:
            return Optional.empty();
        }
    }
}
