package com.trainingplan.generator.regeneration;

import com.trainingplan.generator.model.Severity;

import lombok.NonNull;
import lombok.Value;

/**
 * One configuration field that differs between the old and new configuration. Values may be null.
 */
@Value
public class ConfigurationChange {

    @NonNull
    ConfigurationField field;

    Object oldValue;

    Object newValue;

    @NonNull
    Severity impact;

    @NonNull
    String description;
}
