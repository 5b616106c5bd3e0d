package com.openforge.physiomate.patient;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Tracked state of one muscle of a patient's body model, as stored by the
 * front end and sent along with each chat request.
 *
 * @param meshId    mesh name in the 3D model; "_1" suffix marks the right side
 * @param condition healthy, tight, knotted, strained, torn, recovering, inflamed, weak or fatigued
 * @param pain      0 – 10
 * @param strength  0 – 1
 * @param mobility  0 – 1
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record MuscleState(
        String meshId,
        String condition,
        double pain,
        double strength,
        double mobility,
        String notes,
        String summary
) {

    public static final String HEALTHY = "healthy";

    /** Anything other than healthy and pain-free. */
    public boolean hasIssues() {
        return !HEALTHY.equals(condition) || pain > 0;
    }
}
