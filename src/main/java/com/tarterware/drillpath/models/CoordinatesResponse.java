package com.tarterware.drillpath.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CoordinatesResponse
{
    boolean valid;

    String message;

    SideCoordinates coordinates;
}
