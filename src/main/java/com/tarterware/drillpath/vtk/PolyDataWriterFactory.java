package com.tarterware.drillpath.vtk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

/**
 * Chooses the PolyDataWriter used for every conversion.
 *
 * <p>
 * The choice is made once, at construction, from the configured mode and from
 * whether the JTS geometry library can be loaded:
 * <ul>
 * <li>{@code auto}: the geometry writer when JTS is present, else the text
 * writer.</li>
 * <li>{@code geometry}: the geometry writer; falls back to the text writer, with
 * a warning, when JTS is absent.</li>
 * <li>{@code text}: always the text writer.</li>
 * </ul>
 * Both writers emit the same bytes, so the choice never changes the output.
 * </p>
 */
@Component
public class PolyDataWriterFactory
{
    public static final String MODE_AUTO = "auto";
    public static final String MODE_GEOMETRY = GeometryPolyDataWriter.NAME;
    public static final String MODE_TEXT = TextPolyDataWriter.NAME;

    static final String GEOMETRY_LIBRARY_CLASS = "org.locationtech.jts.geom.GeometryFactory";

    private final PolyDataWriter writer;

    private static final Logger logger = LoggerFactory.getLogger(PolyDataWriterFactory.class);

    @Autowired
    public PolyDataWriterFactory(@Value("${com.tarterware.drillpath.vtk.writer:auto}") String mode)
    {
        this(mode, isGeometryLibraryPresent());
    }

    PolyDataWriterFactory(String mode, boolean geometryLibraryPresent)
    {
        this.writer = select(mode, geometryLibraryPresent);
        logger.info("Using the '{}' VTK writer (mode '{}', geometry library {})", writer.getName(), mode,
                geometryLibraryPresent ? "present" : "absent");
    }

    /**
     * @return the writer selected at construction.
     */
    public PolyDataWriter getWriter()
    {
        return writer;
    }

    /**
     * Check the classpath for the JTS geometry library.
     *
     * @return true if JTS can be loaded.
     */
    public static boolean isGeometryLibraryPresent()
    {
        return ClassUtils.isPresent(GEOMETRY_LIBRARY_CLASS, PolyDataWriterFactory.class.getClassLoader());
    }

    private static PolyDataWriter select(String mode, boolean geometryLibraryPresent)
    {
        String normalized = (mode == null) ? MODE_AUTO : mode.trim().toLowerCase();
        switch (normalized)
        {
        case MODE_TEXT:
            return new TextPolyDataWriter();

        case MODE_GEOMETRY:
            if (!geometryLibraryPresent)
            {
                logger.warn("Geometry VTK writer requested but {} is not on the classpath; using the text writer",
                        GEOMETRY_LIBRARY_CLASS);
                return new TextPolyDataWriter();
            }
            return createGeometryWriter();

        case "":
        case MODE_AUTO:
            return geometryLibraryPresent ? createGeometryWriter() : new TextPolyDataWriter();

        default:
            throw new IllegalArgumentException(
                    "Unknown VTK writer mode '" + mode + "', expected auto, geometry or text");
        }
    }

    // GeometryPolyDataWriter is the only class linked against JTS; it is loaded
    // here, after the classpath check, and nowhere else.
    private static PolyDataWriter createGeometryWriter()
    {
        return new GeometryPolyDataWriter();
    }
}
