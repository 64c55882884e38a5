package io.taskrelay.spec;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.taskrelay.util.Assert;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * A capability an agent advertises in its {@link AgentCard}.
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentSkill(@JsonProperty("id") String id,
                         @JsonProperty("name") String name,
                         @JsonProperty("description") @Nullable String description,
                         @JsonProperty("tags") List<String> tags,
                         @JsonProperty("examples") List<String> examples) {

    @JsonCreator
    public AgentSkill {
        Assert.checkNotNullParam("id", id);
        Assert.checkNotNullParam("name", name);
        tags = Utils.copyOrEmpty(tags);
        examples = Utils.copyOrEmpty(examples);
    }
}
