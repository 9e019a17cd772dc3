package com.tarterware.drillpath.models;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The depth-ordered samples of one borehole, as handed over by the input
 * collaborators.
 */
@NoArgsConstructor
@AllArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BoreholeSeries
{
    // Name of the source, usually the input file name.
    private String name;

    // Borehole side; when null it is detected from the name.
    private Side side;

    private List<DepthSample> samples = new ArrayList<DepthSample>();
}
