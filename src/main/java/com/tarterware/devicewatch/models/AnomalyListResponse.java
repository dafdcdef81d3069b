package com.tarterware.devicewatch.models;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@NoArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnomalyListResponse
{
    int count;

    List<AnalyticsResult> anomalies = new ArrayList<AnalyticsResult>();

    public AnomalyListResponse(List<AnalyticsResult> anomalies)
    {
        this.anomalies = anomalies;
        this.count = anomalies.size();
    }
}
