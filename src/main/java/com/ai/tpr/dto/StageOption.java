package com.ai.tpr.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * One numbered choice at a selection stage. {@code value} is what a selection
 * must carry (the number works too).
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StageOption {

    int number;
    String value;
    String label;
    String detail;
    boolean recommended;
}
