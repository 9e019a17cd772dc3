package com.tarterware.drillpath;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import com.tarterware.drillpath.models.ReferenceFrame;
import com.tarterware.drillpath.vtk.GeometryPolyDataWriter;
import com.tarterware.drillpath.vtk.PolyDataWriterFactory;

@SpringBootTest
@ActiveProfiles("test")
class DrillpathApplicationTests
{
    @Autowired
    private ReferenceFrame referenceFrame;

    @Autowired
    private PolyDataWriterFactory writerFactory;

    @Test
    void contextLoads()
    {
    }

    @Test
    void testConfiguredReferenceFrame()
    {
        assertEquals(ReferenceFrame.defaults(), referenceFrame);
    }

    @Test
    void testAutoSelectsGeometryWriter()
    {
        assertEquals(GeometryPolyDataWriter.NAME, writerFactory.getWriter().getName());
    }
}
