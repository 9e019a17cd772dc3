package com.tarterware.drillpath.models;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchConversionRequest
{
    // Logger export CSV files to convert.
    List<String> csvFiles = new ArrayList<String>();

    Double distanceFromEntrance;

    String surveyPoint;

    // Defaults to the configured output directory.
    String outputDir;

    // Prefixed to every output name; defaults to today.
    LocalDate projectDate;
}
