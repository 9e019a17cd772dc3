package com.tarterware.drillpath.models;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Optional;

import org.junit.jupiter.api.Test;

class SideTest
{
    @Test
    void testFromLetter()
    {
        assertEquals(Optional.of(Side.L), Side.fromLetter("L"));
        assertEquals(Optional.of(Side.M), Side.fromLetter("m"));
        assertEquals(Optional.of(Side.R), Side.fromLetter(" r "));

        assertEquals(Optional.empty(), Side.fromLetter("X"));
        assertEquals(Optional.empty(), Side.fromLetter("LM"));
        assertEquals(Optional.empty(), Side.fromLetter(""));
        assertEquals(Optional.empty(), Side.fromLetter(null));
    }
}
