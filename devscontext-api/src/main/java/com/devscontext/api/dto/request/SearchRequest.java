package com.devscontext.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SearchRequest {

    @NotBlank(message = "Query is required")
    private String q;

    @Min(1)
    @Max(50)
    private int maxResults = 10;
}
