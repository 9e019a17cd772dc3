package com.tarterware.drillpath.utilities;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.LocalDate;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.tarterware.drillpath.models.Side;

class FileNameUtilitiesTest
{
    @Test
    void testGenerateFileName()
    {
        assertEquals("Drill-L_ana_25.08.27.vtk", FileNameUtilities.generateFileName("2025_08_27_07_24_47_L.csv"));
        assertEquals("Drill-R_ana_24.01.05.vtk", FileNameUtilities.generateFileName("data/2024_1_5_r.csv"));
        assertEquals("Drill-X_ana_00.00.00.vtk", FileNameUtilities.generateFileName("random.csv"));
    }

    @Test
    void testGenerateFileNameRejectsInvalidDates()
    {
        assertEquals("Drill-M_ana_00.00.00.vtk", FileNameUtilities.generateFileName("2025_13_01_M.csv"));
        assertEquals("Drill-M_ana_00.00.00.vtk", FileNameUtilities.generateFileName("2025_12_32_M.csv"));
        assertEquals("Drill-M_ana_00.00.00.vtk", FileNameUtilities.generateFileName("25_12_01_M.csv"));
        assertEquals("Drill-M_ana_00.00.00.vtk", FileNameUtilities.generateFileName("2025_00_01_M.csv"));
        assertEquals("Drill-M_ana_00.00.00.vtk", FileNameUtilities.generateFileName("2025_x1_01_M.csv"));
        assertEquals("Drill-X_ana_00.00.00.vtk", FileNameUtilities.generateFileName(null));
    }

    @Test
    void testGenerateFileNameForSideAndDate()
    {
        assertEquals("Drill-M_ana_25.09.01.vtk", FileNameUtilities.generateFileName(Side.M, LocalDate.of(2025, 9, 1)));
    }

    @Test
    void testDetectSide()
    {
        assertEquals(Optional.of(Side.L), FileNameUtilities.detectSide("2025_08_27_07_24_47_L.csv"));
        assertEquals(Optional.of(Side.M), FileNameUtilities.detectSide("hole-m-03.csv"));
        assertEquals(Optional.of(Side.R), FileNameUtilities.detectSide("/tmp/x/face_R"));
        assertEquals(Optional.empty(), FileNameUtilities.detectSide("LMR.csv"));
        assertEquals(Optional.empty(), FileNameUtilities.detectSide(""));
    }

    @Test
    void testBatchAndCompanionNames()
    {
        String vtkName = FileNameUtilities.batchVtkName("2025_08_27_L.csv", LocalDate.of(2025, 9, 1));
        assertEquals("20250901_2025_08_27_L.vtk", vtkName);
        assertEquals("20250901_2025_08_27_L_3d.csv", FileNameUtilities.companionCsvName(vtkName));
    }
}
