package com.tarterware.drillpath.controllers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RequestPathResolverTest
{
    @TempDir
    Path tempDir;

    private Path outputRoot;

    private Path inputRoot;

    private RequestPathResolver resolver;

    @BeforeEach
    void setUp() throws IOException
    {
        outputRoot = Files.createDirectories(tempDir.resolve("out"));
        inputRoot = Files.createDirectories(tempDir.resolve("in"));
        resolver = new RequestPathResolver(outputRoot.toString(), inputRoot.toString());
    }

    @Test
    void testRelativePathsResolveUnderRoots()
    {
        assertEquals(outputRoot.resolve("a/b.vtk"), resolver.output("a/b.vtk"));
        assertEquals(outputRoot.resolve("b.vtk"), resolver.output("a/../b.vtk"));
        assertEquals(inputRoot.resolve("csv/x.csv"), resolver.input("csv/x.csv"));
        assertEquals(outputRoot, resolver.output("."));
    }

    @Test
    void testAbsolutePathInsideRootIsAccepted()
    {
        Path inside = outputRoot.resolve("deep/file.vtk");

        assertEquals(inside, resolver.output(inside.toString()));
    }

    @Test
    void testEscapesAreRejected()
    {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> resolver.output("../in/x.vtk"));
        assertTrue(ex.getMessage().contains("outside the output directory"), ex.getMessage());

        assertThrows(IllegalArgumentException.class, () -> resolver.output("a/../../x.vtk"));
        assertThrows(IllegalArgumentException.class, () -> resolver.output(tempDir.resolve("x.vtk").toString()));
        assertThrows(IllegalArgumentException.class, () -> resolver.input("../out/x.csv"));

        // A sibling sharing the root's name as a prefix is still outside.
        assertThrows(IllegalArgumentException.class, () -> resolver.output("../out2/x.vtk"));
    }

    @Test
    void testBlankPathsAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> resolver.output(null));
        assertThrows(IllegalArgumentException.class, () -> resolver.input(" "));
        assertThrows(IllegalArgumentException.class, () -> resolver.readable(""));
    }

    @Test
    void testReadablePrefersExistingOutput() throws IOException
    {
        // Missing everywhere: the input directory is where it would be read from.
        assertEquals(inputRoot.resolve("t.vtk"), resolver.readable("t.vtk"));

        Files.writeString(outputRoot.resolve("t.vtk"), "POINTS 0 float");
        assertEquals(outputRoot.resolve("t.vtk"), resolver.readable("t.vtk"));

        // Only inside the output directory.
        assertEquals(outputRoot.resolve("u.vtk"), resolver.readable(outputRoot.resolve("u.vtk").toString()));
        assertEquals(inputRoot.resolve("v.vtk"), resolver.readable(inputRoot.resolve("v.vtk").toString()));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> resolver.readable("../../t.vtk"));
        assertTrue(ex.getMessage().contains("outside the input and output directories"), ex.getMessage());
    }
}
