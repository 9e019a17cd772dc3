package com.tarterware.drillpath.models;

import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Files written by one successful conversion.
 */
@NoArgsConstructor
@AllArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConversionResult
{
    private Side side;

    private double distanceFromEntrance;

    private int pointCount;

    private String vtkPath;

    private String csvPath;

    @JsonIgnore
    public Path getVtkFile()
    {
        return Path.of(vtkPath);
    }

    @JsonIgnore
    public Path getCsvFile()
    {
        return Path.of(csvPath);
    }
}
