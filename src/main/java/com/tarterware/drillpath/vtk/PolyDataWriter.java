package com.tarterware.drillpath.vtk;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.tarterware.drillpath.exceptions.InsufficientDataException;
import com.tarterware.drillpath.models.VtkDocument;

/**
 * Serializes a borehole trajectory to the legacy ASCII VTK PolyData format.
 * Every implementation writes the grammar described in {@link VtkFormat} so
 * downstream readers behave the same whichever one produced a file.
 */
public interface PolyDataWriter
{
    /**
     * @return short name of this implementation, for logging.
     */
    String getName();

    /**
     * Write a document.
     *
     * @param document Document with at least two points.
     * @param out      Destination; not closed.
     * @throws IOException               if out fails.
     * @throws InsufficientDataException if the document has fewer than two
     *                                   points.
     */
    void write(VtkDocument document, Writer out) throws IOException;

    /**
     * Serialize a document in memory.
     *
     * @param document Document with at least two points.
     * @return UTF-8 bytes of the file.
     */
    default byte[] write(VtkDocument document)
    {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (Writer out = new OutputStreamWriter(bytes, StandardCharsets.UTF_8))
        {
            write(document, out);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException(e);
        }

        return bytes.toByteArray();
    }

    /**
     * Write a document to a file, replacing any existing file.
     *
     * @param document Document with at least two points.
     * @param path     File to write.
     */
    default void write(VtkDocument document, Path path)
    {
        // Serialize first so a bad document never leaves a partial file behind.
        byte[] content = write(document);
        try
        {
            Files.write(path, content);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Unable to write VTK file " + path, e);
        }
    }
}
