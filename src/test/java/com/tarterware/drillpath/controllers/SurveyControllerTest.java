package com.tarterware.drillpath.controllers;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SurveyControllerTest
{
	@Autowired
	private MockMvc mockMvc;

	@Test
	void testDistance() throws Exception
	{
		mockMvc.perform(post("/api/survey/distance").contentType(MediaType.APPLICATION_JSON)
				.content("{\"surveyPoint\":\"254+19.4\"}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.valid").value(true))
				.andExpect(jsonPath("$.surveyPoint").value("254+19.4"))
				.andExpect(jsonPath("$.distanceFromEntrance", closeTo(4.6, 1e-9)));
	}

	@Test
	void testDistanceBadSurveyPoint() throws Exception
	{
		mockMvc.perform(post("/api/survey/distance").contentType(MediaType.APPLICATION_JSON)
				.content("{\"surveyPoint\":\"254-19\"}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.valid").value(false))
				.andExpect(jsonPath("$.message", containsString("254-19")));

		mockMvc.perform(post("/api/survey/distance").contentType(MediaType.APPLICATION_JSON).content("{}"))
				.andExpect(status().isBadRequest());
	}

	@Test
	void testCoordinatesFromDistance() throws Exception
	{
		mockMvc.perform(post("/api/survey/coordinates").contentType(MediaType.APPLICATION_JSON)
				.content("{\"distanceFromEntrance\":1238}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.valid").value(true))
				.andExpect(jsonPath("$.coordinates.coordinates.L.x", closeTo(-907.462, 0.001)))
				.andExpect(jsonPath("$.coordinates.coordinates.L.y", closeTo(845.150, 0.001)))
				.andExpect(jsonPath("$.coordinates.coordinates.M.x", closeTo(-905.395, 0.001)))
				.andExpect(jsonPath("$.coordinates.coordinates.R.y", closeTo(854.256, 0.001)));
	}

	@Test
	void testCoordinatesFromSurveyPoint() throws Exception
	{
		// 193+6 is 1238 m from the entrance
		mockMvc.perform(post("/api/survey/coordinates").contentType(MediaType.APPLICATION_JSON)
				.content("{\"surveyPoint\":\"193+6\"}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.coordinates.distanceFromEntrance", closeTo(1238.0, 1e-9)))
				.andExpect(jsonPath("$.coordinates.coordinates.L.x", closeTo(-907.462, 0.001)));
	}

	@Test
	void testCoordinatesNeedDistanceOrSurveyPoint() throws Exception
	{
		mockMvc.perform(post("/api/survey/coordinates").contentType(MediaType.APPLICATION_JSON).content("{}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.valid").value(false));
	}
}
