package io.taskrelay.spec;

import static io.taskrelay.spec.DataPart.DATA;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import io.taskrelay.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * A structured data content part, used when content is meant to be processed
 * programmatically rather than displayed.
 * <pre>{@code
 * DataPart result = new DataPart(Map.of("amount", 79.0, "currency", "GBP"));
 * }</pre>
 */
@JsonTypeName(DATA)
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DataPart(@JsonProperty("data") Map<String, Object> data,
                       @JsonProperty("metadata") @Nullable Map<String, Object> metadata) implements Part<Map<String, Object>> {

    public static final String DATA = "data";

    @JsonCreator
    public DataPart {
        Assert.checkNotNullParam("data", data);
        data = Map.copyOf(data);
        metadata = (metadata != null) ? Map.copyOf(metadata) : null;
    }

    public DataPart(Map<String, Object> data) {
        this(data, null);
    }

    @Override
    @JsonProperty("kind")
    public Kind kind() {
        return Kind.DATA;
    }
}
