package com.tarterware.drillpath.services;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.tarterware.drillpath.components.CoordinateTransformer;
import com.tarterware.drillpath.components.TrajectoryBuilder;
import com.tarterware.drillpath.exceptions.InsufficientDataException;
import com.tarterware.drillpath.models.BatchConversionResult;
import com.tarterware.drillpath.models.BoreholeSeries;
import com.tarterware.drillpath.models.ConversionResult;
import com.tarterware.drillpath.models.DepthSample;
import com.tarterware.drillpath.models.FileConversionOutcome;
import com.tarterware.drillpath.models.ReferenceFrame;
import com.tarterware.drillpath.models.Side;
import com.tarterware.drillpath.models.SideCoordinates;
import com.tarterware.drillpath.models.TrajectoryPoint;
import com.tarterware.drillpath.models.VtkDocument;
import com.tarterware.drillpath.utilities.FileNameUtilities;
import com.tarterware.drillpath.utilities.StringUtilities;
import com.tarterware.drillpath.vtk.PolyDataWriter;
import com.tarterware.drillpath.vtk.PolyDataWriterFactory;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;

/**
 * Turns borehole series into VTK trajectory files and their companion CSVs.
 *
 * <p>
 * A conversion places the borehole at its chainage distance, projects every
 * sample along the hole, and writes:
 * <ul>
 * <li>a legacy VTK PolyData file holding one polyline and the sample values as
 * point scalars, and</li>
 * <li>a CSV listing each computed X/Y/Z with its value, preceded by a comment
 * naming the side and distance.</li>
 * </ul>
 * </p>
 *
 * <p>
 * Batches run on a fixed-size worker pool. Each input succeeds or fails on its
 * own, and outcomes are reported in input order.
 * </p>
 */
@Service
public class TrajectoryConversionService
{
    public static final String METER_CONVERSIONS_SUCCEEDED = "drillpath.conversions.succeeded";
    public static final String METER_CONVERSIONS_FAILED = "drillpath.conversions.failed";
    public static final String METER_CONVERSION_TIME = "drillpath.conversion.time";

    static final String CSV_LINE_SEPARATOR = "\r\n";

    private final CoordinateTransformer coordinateTransformer;

    private final TrajectoryBuilder trajectoryBuilder;

    private final PolyDataWriter polyDataWriter;

    private final DepthSeriesReader depthSeriesReader;

    // Quote only cells that need it: the comment line, never the header or numbers.
    private final CsvMapper csvMapper = CsvMapper.builder().enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    private final Counter succeededCounter;
    private final Counter failedCounter;
    private final Timer conversionTimer;

    @Value("${com.tarterware.drillpath.vtk.title:Drill path data}")
    private String vtkTitle = VtkDocument.DEFAULT_TITLE;

    @Value("${com.tarterware.drillpath.vtk.scalar-field-name:Energy}")
    private String scalarFieldName = VtkDocument.DEFAULT_SCALAR_FIELD_NAME;

    @Value("${com.tarterware.drillpath.csv.charset:Shift_JIS}")
    private String csvCharset = "Shift_JIS";

    @Value("${com.tarterware.drillpath.output-dir:output}")
    private String outputDir = "output";

    // Dedicated pool for batch conversions.
    private final ExecutorService conversionExecutor;

    private static final Logger logger = LoggerFactory.getLogger(TrajectoryConversionService.class);

    /**
     * Constructor to initialize the service with its collaborators.
     *
     * @param coordinateTransformer Places boreholes at a chainage distance.
     * @param trajectoryBuilder     Projects samples along a borehole.
     * @param writerFactory         Supplies the VTK writer.
     * @param depthSeriesReader     Reads batch inputs from CSV files.
     * @param meterRegistry         Registry for the conversion meters.
     * @param workerThreads         Size of the batch worker pool.
     */
    public TrajectoryConversionService(CoordinateTransformer coordinateTransformer,
            TrajectoryBuilder trajectoryBuilder, PolyDataWriterFactory writerFactory,
            DepthSeriesReader depthSeriesReader, MeterRegistry meterRegistry,
            @Value("${com.tarterware.drillpath.worker-threads:4}") int workerThreads)
    {
        if (workerThreads < 1)
        {
            throw new IllegalArgumentException("worker-threads must be at least 1, was " + workerThreads);
        }

        this.coordinateTransformer = coordinateTransformer;
        this.trajectoryBuilder = trajectoryBuilder;
        this.polyDataWriter = writerFactory.getWriter();
        this.depthSeriesReader = depthSeriesReader;
        this.conversionExecutor = Executors.newFixedThreadPool(workerThreads);

        this.succeededCounter = Counter.builder(METER_CONVERSIONS_SUCCEEDED)
                .description("Trajectory conversions that wrote their files").register(meterRegistry);
        this.failedCounter = Counter.builder(METER_CONVERSIONS_FAILED)
                .description("Trajectory conversions that failed").register(meterRegistry);
        this.conversionTimer = Timer.builder(METER_CONVERSION_TIME).description("Time taken by one conversion")
                .register(meterRegistry);
    }

    @PreDestroy
    public void shutdown()
    {
        conversionExecutor.shutdown();
    }

    /**
     * Convert a series into files under the configured output directory, named
     * for the side and today's date.
     *
     * @param samples              Depth-ordered samples.
     * @param distanceFromEntrance Chainage distance of the borehole, in meters.
     * @param side                 Borehole side.
     * @param frame                Reference frame.
     * @return the written files.
     */
    public ConversionResult convert(List<DepthSample> samples, double distanceFromEntrance, Side side,
            ReferenceFrame frame)
    {
        Path vtkPath = Path.of(outputDir).resolve(FileNameUtilities.generateFileName(side, LocalDate.now()));
        Path csvPath = vtkPath.resolveSibling(FileNameUtilities.companionCsvName(vtkPath.getFileName().toString()));

        return convert(samples, distanceFromEntrance, side, frame, vtkPath, csvPath);
    }

    /**
     * Convert a series into the given files. Missing parent directories are
     * created; existing files are replaced.
     *
     * @param samples              Depth-ordered samples; at least two.
     * @param distanceFromEntrance Chainage distance of the borehole, in meters.
     * @param side                 Borehole side.
     * @param frame                Reference frame.
     * @param vtkPath              VTK file to write.
     * @param csvPath              Companion CSV to write.
     * @return the written files.
     * @throws InsufficientDataException if fewer than two samples are given.
     * @throws UncheckedIOException      if a file cannot be written.
     */
    public ConversionResult convert(List<DepthSample> samples, double distanceFromEntrance, Side side,
            ReferenceFrame frame, Path vtkPath, Path csvPath)
    {
        if (side == null)
        {
            failedCounter.increment();
            throw new IllegalArgumentException("Borehole side is required");
        }

        Timer.Sample sample = Timer.start();
        try
        {
            SideCoordinates coordinates = coordinateTransformer.calculate(distanceFromEntrance, frame);
            List<TrajectoryPoint> points = trajectoryBuilder.build(side, coordinates, frame, samples);
            VtkDocument document = new VtkDocument(vtkTitle, points, scalarFieldName);

            createParentDirectories(vtkPath);
            createParentDirectories(csvPath);
            polyDataWriter.write(document, vtkPath);
            writeCompanionCsv(csvPath, points, side, distanceFromEntrance);

            succeededCounter.increment();
            logger.info("Wrote {} points for side {} at {} m to {} and {}", points.size(), side,
                    distanceFromEntrance, vtkPath, csvPath);

            return new ConversionResult(side, distanceFromEntrance, points.size(), vtkPath.toString(),
                    csvPath.toString());
        }
        catch (RuntimeException ex)
        {
            failedCounter.increment();
            throw ex;
        }
        finally
        {
            sample.stop(conversionTimer);
        }
    }

    /**
     * Convert several series concurrently. Each series is named by its source;
     * its side is taken from the series or, when absent, detected from the name.
     * Files are written to outputDir as {@code <yyyyMMdd>_<name>.vtk} and
     * {@code <yyyyMMdd>_<name>_3d.csv}.
     *
     * @param series               Inputs to convert.
     * @param distanceFromEntrance Chainage distance shared by every input.
     * @param frame                Reference frame.
     * @param outputDir            Directory for the written files.
     * @param projectDate          Date prefixed to every file name.
     * @return one outcome per input, in input order.
     */
    public BatchConversionResult convertBatch(List<BoreholeSeries> series, double distanceFromEntrance,
            ReferenceFrame frame, Path outputDir, LocalDate projectDate)
    {
        List<Future<ConversionResult>> futures = new ArrayList<Future<ConversionResult>>(series.size());
        for (BoreholeSeries s : series)
        {
            futures.add(conversionExecutor.submit(() -> convertSeries(s, distanceFromEntrance, frame, outputDir,
                    projectDate)));
        }

        List<FileConversionOutcome> outcomes = new ArrayList<FileConversionOutcome>(series.size());
        for (int i = 0; i < futures.size(); ++i)
        {
            outcomes.add(outcome(series.get(i).getName(), futures.get(i)));
        }

        BatchConversionResult result = new BatchConversionResult(outcomes);
        logger.info("Batch of {} finished: {} succeeded, {} failed", outcomes.size(), result.getSuccessCount(),
                result.getFailureCount());

        return result;
    }

    /**
     * Read and convert several logger export CSV files concurrently. A file that
     * cannot be read is reported as a failed outcome like any other failure.
     *
     * @param csvFiles             Files to convert.
     * @param distanceFromEntrance Chainage distance shared by every file.
     * @param frame                Reference frame.
     * @param outputDir            Directory for the written files, or null for
     *                             the configured output directory.
     * @param projectDate          Date prefixed to every file name, or null for
     *                             today.
     * @return one outcome per file, in input order.
     */
    public BatchConversionResult convertFiles(List<Path> csvFiles, double distanceFromEntrance, ReferenceFrame frame,
            Path outputDir, LocalDate projectDate)
    {
        Path directory = (outputDir != null) ? outputDir : Path.of(this.outputDir);
        LocalDate date = (projectDate != null) ? projectDate : LocalDate.now();

        List<Future<ConversionResult>> futures = new ArrayList<Future<ConversionResult>>(csvFiles.size());
        for (Path csvFile : csvFiles)
        {
            futures.add(conversionExecutor.submit(() -> convertFile(csvFile, distanceFromEntrance, frame, directory,
                    date)));
        }

        List<FileConversionOutcome> outcomes = new ArrayList<FileConversionOutcome>(csvFiles.size());
        for (int i = 0; i < futures.size(); ++i)
        {
            outcomes.add(outcome(csvFiles.get(i).getFileName().toString(), futures.get(i)));
        }

        BatchConversionResult result = new BatchConversionResult(outcomes);
        logger.info("Converted {} of {} files", result.getSuccessCount(), outcomes.size());

        return result;
    }

    private ConversionResult convertFile(Path csvFile, double distanceFromEntrance, ReferenceFrame frame,
            Path outputDir, LocalDate projectDate)
    {
        BoreholeSeries series;
        try
        {
            series = depthSeriesReader.readSeries(csvFile);
        }
        catch (RuntimeException ex)
        {
            failedCounter.increment();
            throw ex;
        }

        return convertSeries(series, distanceFromEntrance, frame, outputDir, projectDate);
    }

    private ConversionResult convertSeries(BoreholeSeries series, double distanceFromEntrance, ReferenceFrame frame,
            Path outputDir, LocalDate projectDate)
    {
        if (StringUtilities.isNullEmptyOrBlank(series.getName()))
        {
            failedCounter.increment();
            throw new IllegalArgumentException("Every series in a batch needs a name");
        }

        Side side = series.getSide();
        if (side == null)
        {
            side = FileNameUtilities.detectSide(series.getName()).orElse(null);
        }
        if (side == null)
        {
            failedCounter.increment();
            throw new IllegalArgumentException("Could not detect the L/M/R side from '" + series.getName() + "'");
        }

        String vtkName = FileNameUtilities.batchVtkName(series.getName(), projectDate);
        Path vtkPath = outputDir.resolve(vtkName);
        Path csvPath = outputDir.resolve(FileNameUtilities.companionCsvName(vtkName));

        return convert(series.getSamples(), distanceFromEntrance, side, frame, vtkPath, csvPath);
    }

    private static FileConversionOutcome outcome(String name, Future<ConversionResult> future)
    {
        try
        {
            return FileConversionOutcome.succeeded(name, future.get());
        }
        catch (ExecutionException ex)
        {
            Throwable cause = (ex.getCause() != null) ? ex.getCause() : ex;
            logger.warn("Conversion of {} failed: {}", name, cause.getMessage());
            return FileConversionOutcome.failed(name, String.valueOf(cause.getMessage()));
        }
        catch (InterruptedException ex)
        {
            Thread.currentThread().interrupt();
            future.cancel(true);
            logger.warn("Interrupted while waiting for conversion of {}", name);
            return FileConversionOutcome.failed(name, "Interrupted");
        }
    }

    /**
     * Write the companion CSV of a trajectory.
     *
     * @param csvPath              File to write.
     * @param points               Trajectory points.
     * @param side                 Borehole side, named in the comment line.
     * @param distanceFromEntrance Distance named in the comment line.
     */
    void writeCompanionCsv(Path csvPath, List<TrajectoryPoint> points, Side side, double distanceFromEntrance)
    {
        CsvSchema schema = CsvSchema.emptySchema().withLineSeparator(CSV_LINE_SEPARATOR);

        try (Writer out = Files.newBufferedWriter(csvPath, Charset.forName(csvCharset));
                SequenceWriter rows = csvMapper.writerFor(String[].class).with(schema).writeValues(out))
        {
            rows.write(new String[] { companionComment(side, distanceFromEntrance) });
            rows.write(new String[] { "X(m)", "Y(m)", "Z:標高(m)", scalarFieldName });
            for (TrajectoryPoint p : points)
            {
                rows.write(new String[] { Double.toString(p.getX()), Double.toString(p.getY()),
                        Double.toString(p.getZ()), Double.toString(p.getScalar()) });
            }
        }
        catch (IOException ex)
        {
            throw new UncheckedIOException("Could not write " + csvPath, ex);
        }
    }

    static String companionComment(Side side, double distanceFromEntrance)
    {
        return "# LMRタイプ: " + side + ", 坑口からの距離: " + distanceFromEntrance + "m";
    }

    private static void createParentDirectories(Path path)
    {
        Path parent = path.toAbsolutePath().getParent();
        if (parent == null)
        {
            return;
        }

        try
        {
            Files.createDirectories(parent);
        }
        catch (IOException ex)
        {
            throw new UncheckedIOException("Could not create directory " + parent, ex);
        }
    }
}
