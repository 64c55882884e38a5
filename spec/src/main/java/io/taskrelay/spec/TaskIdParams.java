package io.taskrelay.spec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.taskrelay.util.Assert;

/**
 * Identifies a task for the cancel and resubscribe operations.
 *
 * @param id the task identifier
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskIdParams(@JsonProperty("id") String id) {

    @JsonCreator
    public TaskIdParams {
        Assert.checkNotNullParam("id", id);
    }
}
