package work.lcod.markup.shared;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

/**
 * Shared Jackson mappers. Nesting limits are raised because serialized trees are as deep as the markup they came
 * from; the integrity verifier is the place that rejects pathological depth.
 */
public final class Json {
    public static final int MAX_NESTING_DEPTH = 1_000_000;

    public static final ObjectMapper MAPPER = new ObjectMapper(JsonFactory.builder()
        .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(MAX_NESTING_DEPTH).build())
        .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(MAX_NESTING_DEPTH).build())
        .build());

    public static final ObjectWriter PRETTY = MAPPER.writerWithDefaultPrettyPrinter();

    public static final ObjectMapper YAML = new ObjectMapper(YAMLFactory.builder()
        .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(MAX_NESTING_DEPTH).build())
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .build());

    private Json() {}
}
