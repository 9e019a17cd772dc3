package com.tarterware.drillpath.controllers;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.tarterware.drillpath.components.SurveyPointLocator;
import com.tarterware.drillpath.models.BatchConversionRequest;
import com.tarterware.drillpath.models.BatchConversionResult;
import com.tarterware.drillpath.models.ConversionRequest;
import com.tarterware.drillpath.models.ConversionResponse;
import com.tarterware.drillpath.models.ConversionResult;
import com.tarterware.drillpath.models.PreviewRequest;
import com.tarterware.drillpath.models.ReferenceFrame;
import com.tarterware.drillpath.models.VtkPreview;
import com.tarterware.drillpath.services.TrajectoryConversionService;
import com.tarterware.drillpath.utilities.StringUtilities;
import com.tarterware.drillpath.vtk.PolyDataReader;

@RestController
@RequestMapping("/api/trajectories")
public class TrajectoryController
{
	@Autowired
	TrajectoryConversionService conversionService;

	@Autowired
	SurveyPointLocator surveyPointLocator;

	@Autowired
	PolyDataReader polyDataReader;

	@Autowired
	ReferenceFrame referenceFrame;

	@Autowired
	RequestPathResolver pathResolver;

	@PostMapping("/convert")
	ResponseEntity<ConversionResponse> convert(@RequestBody ConversionRequest conversionRequest)
	{
		ConversionResponse conversionResponse = new ConversionResponse();

		if (conversionRequest == null)
		{
			conversionResponse.setMessage("ConversionRequest body is empty!");
			return new ResponseEntity<ConversionResponse>(conversionResponse, HttpStatus.BAD_REQUEST);
		}

		// Output paths come as a pair or not at all.
		boolean hasVtkPath = !StringUtilities.isNullEmptyOrBlank(conversionRequest.getVtkPath());
		boolean hasCsvPath = !StringUtilities.isNullEmptyOrBlank(conversionRequest.getCsvPath());
		if (hasVtkPath != hasCsvPath)
		{
			conversionResponse.setMessage("vtkPath and csvPath must be given together!");
			return new ResponseEntity<ConversionResponse>(conversionResponse, HttpStatus.BAD_REQUEST);
		}

		try
		{
			double distance = DistanceResolver.resolve(surveyPointLocator, referenceFrame,
					conversionRequest.getSurveyPoint(), conversionRequest.getDistanceFromEntrance());

			ConversionResult result;
			if (hasVtkPath)
			{
				Path vtkPath = pathResolver.output(conversionRequest.getVtkPath());
				Path csvPath = pathResolver.output(conversionRequest.getCsvPath());
				result = conversionService.convert(conversionRequest.getSamples(), distance,
						conversionRequest.getSide(), referenceFrame, vtkPath, csvPath);
			}
			else
			{
				result = conversionService.convert(conversionRequest.getSamples(), distance,
						conversionRequest.getSide(), referenceFrame);
			}
			conversionResponse.setResult(result);
		}
		catch (IllegalArgumentException ex)
		{
			conversionResponse.setMessage(ex.getMessage());
			return new ResponseEntity<ConversionResponse>(conversionResponse, HttpStatus.BAD_REQUEST);
		}
		catch (UncheckedIOException ex)
		{
			conversionResponse.setMessage(ex.getMessage());
			return new ResponseEntity<ConversionResponse>(conversionResponse, HttpStatus.INTERNAL_SERVER_ERROR);
		}

		conversionResponse.setValid(true);
		return new ResponseEntity<ConversionResponse>(conversionResponse, HttpStatus.OK);
	}

	@PostMapping("/batch")
	ResponseEntity<BatchConversionResult> convertBatch(@RequestBody BatchConversionRequest batchRequest)
	{
		if ((batchRequest == null) || (batchRequest.getCsvFiles() == null) || batchRequest.getCsvFiles().isEmpty())
		{
			BatchConversionResult result = new BatchConversionResult();
			result.setMessage("csvFiles must list at least one file!");
			return new ResponseEntity<BatchConversionResult>(result, HttpStatus.BAD_REQUEST);
		}

		BatchConversionResult result;
		try
		{
			double distance = DistanceResolver.resolve(surveyPointLocator, referenceFrame,
					batchRequest.getSurveyPoint(), batchRequest.getDistanceFromEntrance());

			List<Path> csvFiles = batchRequest.getCsvFiles().stream().map(pathResolver::input)
					.collect(Collectors.toList());
			Path outputDir = StringUtilities.isNullEmptyOrBlank(batchRequest.getOutputDir())
					? pathResolver.getOutputRoot()
					: pathResolver.output(batchRequest.getOutputDir());

			result = conversionService.convertFiles(csvFiles, distance, referenceFrame, outputDir,
					batchRequest.getProjectDate());
		}
		catch (IllegalArgumentException ex)
		{
			result = new BatchConversionResult();
			result.setMessage(ex.getMessage());
			return new ResponseEntity<BatchConversionResult>(result, HttpStatus.BAD_REQUEST);
		}

		return new ResponseEntity<BatchConversionResult>(result, HttpStatus.OK);
	}

	@PostMapping("/preview")
	ResponseEntity<VtkPreview> preview(@RequestBody PreviewRequest previewRequest)
	{
		if ((previewRequest == null) || StringUtilities.isNullEmptyOrBlank(previewRequest.getPath()))
		{
			return new ResponseEntity<VtkPreview>(VtkPreview.failure("path is required!"), HttpStatus.BAD_REQUEST);
		}

		Path path;
		try
		{
			path = pathResolver.readable(previewRequest.getPath());
		}
		catch (IllegalArgumentException ex)
		{
			return new ResponseEntity<VtkPreview>(VtkPreview.failure(ex.getMessage()), HttpStatus.BAD_REQUEST);
		}

		VtkPreview preview = polyDataReader.read(path);
		HttpStatus status = preview.isOk() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;

		return new ResponseEntity<VtkPreview>(preview, status);
	}
}
