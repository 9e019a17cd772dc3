package com.tarterware.drillpath.controllers;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.tarterware.drillpath.components.CoordinateTransformer;
import com.tarterware.drillpath.components.SurveyPointLocator;
import com.tarterware.drillpath.models.CoordinatesRequest;
import com.tarterware.drillpath.models.CoordinatesResponse;
import com.tarterware.drillpath.models.ReferenceFrame;
import com.tarterware.drillpath.models.SideCoordinates;
import com.tarterware.drillpath.models.SurveyPoint;
import com.tarterware.drillpath.models.SurveyRequest;
import com.tarterware.drillpath.models.SurveyResponse;
import com.tarterware.drillpath.utilities.StringUtilities;

@RestController
@RequestMapping("/api/survey")
public class SurveyController
{
	@Autowired
	SurveyPointLocator surveyPointLocator;

	@Autowired
	CoordinateTransformer coordinateTransformer;

	@Autowired
	ReferenceFrame referenceFrame;

	@PostMapping("/distance")
	ResponseEntity<SurveyResponse> getDistance(@RequestBody SurveyRequest surveyRequest)
	{
		SurveyResponse surveyResponse = new SurveyResponse();

		if ((surveyRequest == null) || StringUtilities.isNullEmptyOrBlank(surveyRequest.getSurveyPoint()))
		{
			surveyResponse.setMessage("surveyPoint is required!");
			return new ResponseEntity<SurveyResponse>(surveyResponse, HttpStatus.BAD_REQUEST);
		}

		try
		{
			SurveyPoint point = surveyPointLocator.parse(surveyRequest.getSurveyPoint());
			surveyResponse.setSurveyPoint(surveyPointLocator.format(point));
			surveyResponse.setDistanceFromEntrance(surveyPointLocator.distanceFromEntrance(point, referenceFrame));
		}
		catch (IllegalArgumentException ex)
		{
			surveyResponse.setMessage(ex.getMessage());
			return new ResponseEntity<SurveyResponse>(surveyResponse, HttpStatus.BAD_REQUEST);
		}

		surveyResponse.setValid(true);
		return new ResponseEntity<SurveyResponse>(surveyResponse, HttpStatus.OK);
	}

	@PostMapping("/coordinates")
	ResponseEntity<CoordinatesResponse> getCoordinates(@RequestBody CoordinatesRequest coordinatesRequest)
	{
		CoordinatesResponse coordinatesResponse = new CoordinatesResponse();

		if (coordinatesRequest == null)
		{
			coordinatesResponse.setMessage("CoordinatesRequest body is empty!");
			return new ResponseEntity<CoordinatesResponse>(coordinatesResponse, HttpStatus.BAD_REQUEST);
		}

		try
		{
			double distance = DistanceResolver.resolve(surveyPointLocator, referenceFrame,
					coordinatesRequest.getSurveyPoint(), coordinatesRequest.getDistanceFromEntrance());

			double directionAngle = (coordinatesRequest.getDirectionAngle() != null)
					? coordinatesRequest.getDirectionAngle()
					: referenceFrame.getDirectionAngle();
			double referenceDistance = (coordinatesRequest.getReferenceDistance() != null)
					? coordinatesRequest.getReferenceDistance()
					: referenceFrame.getReferenceDistance();

			SideCoordinates coordinates = coordinateTransformer.calculate(distance, directionAngle,
					referenceDistance, referenceFrame);
			coordinatesResponse.setCoordinates(coordinates);
		}
		catch (IllegalArgumentException ex)
		{
			coordinatesResponse.setMessage(ex.getMessage());
			return new ResponseEntity<CoordinatesResponse>(coordinatesResponse, HttpStatus.BAD_REQUEST);
		}

		coordinatesResponse.setValid(true);
		return new ResponseEntity<CoordinatesResponse>(coordinatesResponse, HttpStatus.OK);
	}
}
