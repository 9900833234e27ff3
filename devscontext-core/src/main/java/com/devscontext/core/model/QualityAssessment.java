package com.devscontext.core.model;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class QualityAssessment {

    double score;
    List<Gap> gaps;

    public List<String> gapDescriptions() {
        return gaps.stream().map(Gap::getDescription).collect(Collectors.toList());
    }
}
