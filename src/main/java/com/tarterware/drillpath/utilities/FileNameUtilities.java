package com.tarterware.drillpath.utilities;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

import com.tarterware.drillpath.models.Side;

/**
 * Naming rules shared by every producer of trajectory files.
 *
 * <p>
 * Logger exports are named like {@code 2025_08_27_07_24_47_L.csv}: a
 * year/month/day/time prefix followed by the borehole side. Trajectory files
 * derived from them are named {@code Drill-L_ana_25.08.27.vtk}.
 * </p>
 */
public class FileNameUtilities
{
    public static final String UNKNOWN_SIDE = "X";

    public static final String UNKNOWN_DATE = "00.00.00";

    public static final String VTK_EXTENSION = ".vtk";

    public static final String COMPANION_CSV_SUFFIX = "_3d.csv";

    private static final DateTimeFormatter SHORT_DATE = DateTimeFormatter.ofPattern("yy.MM.dd");

    private static final DateTimeFormatter BATCH_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    /**
     * Detect the borehole side from a file name. The name (without directory and
     * extension) is split on underscores, then on hyphens, and the first token
     * that is a side letter wins.
     *
     * @param fileName File name or path.
     * @return the side, or empty if no token names one.
     */
    public static Optional<Side> detectSide(String fileName)
    {
        if (StringUtilities.isNullEmptyOrBlank(fileName))
        {
            return Optional.empty();
        }

        String name = StringUtilities.baseName(fileName);
        for (String separator : new String[] { "_", "-" })
        {
            for (String part : name.split(separator))
            {
                Optional<Side> side = Side.fromLetter(part);
                if (side.isPresent())
                {
                    return side;
                }
            }
        }

        return Optional.empty();
    }

    /**
     * Build the standard VTK file name for a logger export.
     *
     * @param csvName Name of the source CSV file.
     * @return {@code Drill-<side>_ana_<YY.MM.DD>.vtk}, with side "X" and date
     *         "00.00.00" when they cannot be determined.
     */
    public static String generateFileName(String csvName)
    {
        String side = detectSide(csvName).map(Side::name).orElse(UNKNOWN_SIDE);
        String date = UNKNOWN_DATE;

        if (!StringUtilities.isNullEmptyOrBlank(csvName))
        {
            String[] parts = StringUtilities.baseName(csvName).split("_");
            if (parts.length >= 3 && isDate(parts[0], parts[1], parts[2]))
            {
                date = parts[0].substring(2) + "." + zeroPad(parts[1]) + "." + zeroPad(parts[2]);
            }
        }

        return drillFileName(side, date);
    }

    /**
     * Build the standard VTK file name for a side and analysis date.
     *
     * @param side Borehole side.
     * @param date Analysis date.
     * @return {@code Drill-<side>_ana_<YY.MM.DD>.vtk}.
     */
    public static String generateFileName(Side side, LocalDate date)
    {
        return drillFileName(side.name(), date.format(SHORT_DATE));
    }

    /**
     * Name of the VTK file a batch writes for one input.
     *
     * @param inputName   Input file name.
     * @param projectDate Date prefixed to the name.
     * @return {@code <yyyyMMdd>_<input base name>.vtk}.
     */
    public static String batchVtkName(String inputName, LocalDate projectDate)
    {
        return projectDate.format(BATCH_DATE) + "_" + StringUtilities.baseName(inputName) + VTK_EXTENSION;
    }

    /**
     * Name of the companion CSV written next to a VTK file.
     *
     * @param vtkFileName VTK file name.
     * @return the VTK base name followed by {@code _3d.csv}.
     */
    public static String companionCsvName(String vtkFileName)
    {
        return StringUtilities.baseName(vtkFileName) + COMPANION_CSV_SUFFIX;
    }

    private static String drillFileName(String side, String date)
    {
        return "Drill-" + side + "_ana_" + date + VTK_EXTENSION;
    }

    private static boolean isDate(String year, String month, String day)
    {
        if (year.length() != 4 || !isDigits(year) || !isDigits(month) || !isDigits(day))
        {
            return false;
        }

        // Digit strings can still overflow an int.
        if (month.length() > 2 || day.length() > 2)
        {
            return false;
        }

        int m = Integer.parseInt(month);
        int d = Integer.parseInt(day);
        return (m >= 1) && (m <= 12) && (d >= 1) && (d <= 31);
    }

    private static boolean isDigits(String s)
    {
        if (s.isEmpty())
        {
            return false;
        }
        for (int i = 0; i < s.length(); ++i)
        {
            if (s.charAt(i) < '0' || s.charAt(i) > '9')
            {
                return false;
            }
        }
        return true;
    }

    private static String zeroPad(String s)
    {
        return (s.length() < 2) ? "0" + s : s;
    }
}
