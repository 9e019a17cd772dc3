package com.tarterware.drillpath.controllers;

import java.nio.file.Files;
import java.nio.file.Path;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.tarterware.drillpath.utilities.StringUtilities;

/**
 * Maps file paths named in requests onto the server's own directories.
 *
 * <p>
 * Files are written only under the configured output directory and read only
 * under the input or output directory. A relative request path is taken
 * relative to that directory; an absolute one must already lie inside it. Any
 * path that normalizes to somewhere else is rejected.
 * </p>
 */
@Component
public class RequestPathResolver
{
    private final Path outputRoot;

    private final Path inputRoot;

    public RequestPathResolver(@Value("${com.tarterware.drillpath.output-dir:output}") String outputDir,
            @Value("${com.tarterware.drillpath.input-dir:input}") String inputDir)
    {
        this.outputRoot = root(outputDir);
        this.inputRoot = root(inputDir);
    }

    public Path getOutputRoot()
    {
        return outputRoot;
    }

    public Path getInputRoot()
    {
        return inputRoot;
    }

    /**
     * Resolve a path the request wants written.
     *
     * @param requested Path from the request.
     * @return the absolute path under the output directory.
     * @throws IllegalArgumentException if the path is blank or leaves the output
     *                                  directory.
     */
    public Path output(String requested)
    {
        return confine(outputRoot, requested, "output");
    }

    /**
     * Resolve a CSV path the request wants read.
     *
     * @param requested Path from the request.
     * @return the absolute path under the input directory.
     * @throws IllegalArgumentException if the path is blank or leaves the input
     *                                  directory.
     */
    public Path input(String requested)
    {
        return confine(inputRoot, requested, "input");
    }

    /**
     * Resolve a file the request wants previewed. Generated files are looked up
     * in the output directory first, then in the input directory.
     *
     * @param requested Path from the request.
     * @return the absolute path under the output or input directory.
     * @throws IllegalArgumentException if the path is blank or lies under
     *                                  neither directory.
     */
    public Path readable(String requested)
    {
        requireText(requested);

        Path output = outputRoot.resolve(requested).normalize();
        Path input = inputRoot.resolve(requested).normalize();
        boolean inOutput = output.startsWith(outputRoot);
        boolean inInput = input.startsWith(inputRoot);

        if (inOutput && (Files.exists(output) || !inInput))
        {
            return output;
        }
        if (inInput)
        {
            return input;
        }

        throw new IllegalArgumentException(
                "Path '" + requested + "' is outside the input and output directories");
    }

    private static Path confine(Path root, String requested, String kind)
    {
        requireText(requested);

        Path resolved = root.resolve(requested).normalize();
        if (!resolved.startsWith(root))
        {
            throw new IllegalArgumentException("Path '" + requested + "' is outside the " + kind + " directory");
        }

        return resolved;
    }

    private static void requireText(String requested)
    {
        if (StringUtilities.isNullEmptyOrBlank(requested))
        {
            throw new IllegalArgumentException("Path cannot be empty!");
        }
    }

    private static Path root(String dir)
    {
        return Path.of(dir).toAbsolutePath().normalize();
    }
}
