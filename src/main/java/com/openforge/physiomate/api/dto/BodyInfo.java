package com.openforge.physiomate.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Profile of the body being discussed. Every field is optional.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record BodyInfo(
        String sex,
        Double weightKg,
        Double heightCm,
        Double birthDate,
        List<String> equipment,
        String fitnessGoals
) {}
