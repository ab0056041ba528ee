package work.lcod.markup.sandbox;

import com.fasterxml.jackson.annotation.JsonInclude;
import work.lcod.markup.tree.SerializedNode;

/**
 * Single message a worker writes to its standard output before exiting.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
record WorkerEnvelope(boolean success, SerializedNode tree, String error) {
    static WorkerEnvelope completed(SerializedNode tree) {
        return new WorkerEnvelope(true, tree, null);
    }

    static WorkerEnvelope failed(String error) {
        return new WorkerEnvelope(false, null, error);
    }
}
