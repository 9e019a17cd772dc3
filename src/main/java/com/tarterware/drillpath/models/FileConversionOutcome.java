package com.tarterware.drillpath.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of converting one input within a batch. Exactly one of result and
 * error is set.
 */
@NoArgsConstructor
@AllArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FileConversionOutcome
{
    private String name;

    private boolean success;

    private String error;

    private ConversionResult result;

    public static FileConversionOutcome succeeded(String name, ConversionResult result)
    {
        return new FileConversionOutcome(name, true, null, result);
    }

    public static FileConversionOutcome failed(String name, String error)
    {
        return new FileConversionOutcome(name, false, error, null);
    }
}
