package com.tarterware.devicewatch.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@AllArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class IngestResponse
{
    public static final String STATUS_ACCEPTED = "accepted";
    public static final String STATUS_REJECTED = "rejected";

    String status;

    String message;

    public static IngestResponse accepted()
    {
        return new IngestResponse(STATUS_ACCEPTED, "Metric received and queued for processing");
    }

    public static IngestResponse rejected(String reason)
    {
        return new IngestResponse(STATUS_REJECTED, reason);
    }
}
