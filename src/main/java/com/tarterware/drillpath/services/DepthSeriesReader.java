package com.tarterware.drillpath.services;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.tarterware.drillpath.exceptions.MissingColumnException;
import com.tarterware.drillpath.models.BoreholeSeries;
import com.tarterware.drillpath.models.DepthSample;
import com.tarterware.drillpath.utilities.FileNameUtilities;

/**
 * Reads the depth/value series of one borehole from a logger export CSV.
 *
 * <p>
 * The first row is the header. The depth and value columns are found by their
 * exact configured names; rows whose depth or value is missing or not a finite
 * number, and rows with a negative depth, are skipped.
 * </p>
 */
@Service
public class DepthSeriesReader
{
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final CsvMapper csvMapper = new CsvMapper();

    private final Charset charset;

    private final String depthColumn;

    private final String scalarColumn;

    private static final Logger logger = LoggerFactory.getLogger(DepthSeriesReader.class);

    public DepthSeriesReader(@Value("${com.tarterware.drillpath.csv.charset:Shift_JIS}") String charset,
            @Value("${com.tarterware.drillpath.csv.depth-column:穿孔長}") String depthColumn,
            @Value("${com.tarterware.drillpath.csv.scalar-column:Lowess_Trend}") String scalarColumn)
    {
        this.charset = Charset.forName(charset);
        this.depthColumn = depthColumn;
        this.scalarColumn = scalarColumn;
    }

    /**
     * Read a CSV file into a series named after the file. The side is taken from
     * the file name when it names one, and left null otherwise.
     *
     * @param csvFile Logger export.
     * @return the series.
     * @throws MissingColumnException if the depth or value column is absent.
     * @throws UncheckedIOException   if the file cannot be read.
     */
    public BoreholeSeries readSeries(Path csvFile)
    {
        String name = csvFile.getFileName().toString();
        List<DepthSample> samples = read(csvFile);
        return new BoreholeSeries(name, FileNameUtilities.detectSide(name).orElse(null), samples);
    }

    /**
     * Read the samples of a CSV file in the configured charset.
     *
     * @param csvFile Logger export.
     * @return the samples in file order.
     */
    public List<DepthSample> read(Path csvFile)
    {
        try (Reader in = Files.newBufferedReader(csvFile, charset))
        {
            return read(in);
        }
        catch (IOException ex)
        {
            throw new UncheckedIOException("Could not read " + csvFile, ex);
        }
    }

    /**
     * Read samples from CSV text.
     *
     * @param in CSV text, header first.
     * @return the samples in row order.
     * @throws IOException if the stream fails.
     */
    public List<DepthSample> read(Reader in) throws IOException
    {
        List<DepthSample> samples = new ArrayList<DepthSample>();

        try (MappingIterator<String[]> rows = csvMapper.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY).readValues(in))
        {
            if (!rows.hasNextValue())
            {
                throw new MissingColumnException(depthColumn, List.of());
            }

            List<String> header = header(rows.nextValue());
            int depthIndex = indexOf(header, depthColumn);
            int scalarIndex = indexOf(header, scalarColumn);

            int skipped = 0;
            while (rows.hasNextValue())
            {
                String[] row = rows.nextValue();
                Double depth = parseCell(row, depthIndex);
                Double value = parseCell(row, scalarIndex);
                // Depths are measured from the hole mouth, so a negative one is not a sample.
                if ((depth == null) || (value == null) || (depth < 0))
                {
                    skipped++;
                    continue;
                }
                samples.add(new DepthSample(depth, value));
            }

            if (skipped > 0)
            {
                logger.debug("Skipped {} rows without a usable {} and {}", skipped, depthColumn, scalarColumn);
            }
        }

        return samples;
    }

    private static List<String> header(String[] row)
    {
        List<String> header = new ArrayList<String>(Arrays.asList(row));
        if (!header.isEmpty() && header.get(0).startsWith(BYTE_ORDER_MARK))
        {
            header.set(0, header.get(0).substring(1));
        }

        return header;
    }

    private static int indexOf(List<String> header, String column)
    {
        for (int i = 0; i < header.size(); ++i)
        {
            if (header.get(i).trim().equals(column))
            {
                return i;
            }
        }

        throw new MissingColumnException(column, header);
    }

    private static Double parseCell(String[] row, int index)
    {
        if (index >= row.length)
        {
            return null;
        }

        try
        {
            double value = Double.parseDouble(row[index].trim());
            return Double.isFinite(value) ? value : null;
        }
        catch (NumberFormatException ex)
        {
            return null;
        }
    }
}
