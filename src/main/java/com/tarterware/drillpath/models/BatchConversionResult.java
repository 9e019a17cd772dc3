package com.tarterware.drillpath.models;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-input outcomes of a batch conversion, in input order.
 */
@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchConversionResult
{
    private List<FileConversionOutcome> outcomes = new ArrayList<FileConversionOutcome>();

    // Set when the batch as a whole was rejected.
    private String message;

    public BatchConversionResult(List<FileConversionOutcome> outcomes)
    {
        this.outcomes = outcomes;
    }

    public long getSuccessCount()
    {
        return outcomes.stream().filter(FileConversionOutcome::isSuccess).count();
    }

    public long getFailureCount()
    {
        return outcomes.size() - getSuccessCount();
    }
}
