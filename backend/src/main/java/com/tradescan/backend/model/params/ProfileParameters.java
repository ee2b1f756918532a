package com.tradescan.backend.model.params;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Filter set of a screening profile. Stored as JSON tagged by {@code kind} and carrying a {@code schemaVersion}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StockParameters.class, name = "stock"),
        @JsonSubTypes.Type(value = OptionParameters.class, name = "option")
})
public interface ProfileParameters {

    int CURRENT_SCHEMA_VERSION = 1;

    int getSchemaVersion();

    /**
     * @return human readable problems, empty when the parameter set is usable
     */
    List<String> validate();
}
