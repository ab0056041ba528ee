package work.lcod.markup.tree;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Streaming Jackson codec for {@link SerializedNode}.
 *
 * <p>Both directions walk the token stream with an explicit stack; call depth stays constant however deep the tree
 * is.
 */
public final class SerializedNodeJson {
    static final String NAME = "name";
    static final String ATTRIBUTES = "attributes";
    static final String TEXT_CONTENT = "text_content";
    static final String CHILDREN = "children";

    private SerializedNodeJson() {}

    public static final class Writer extends StdSerializer<SerializedNode> {
        public Writer() {
            super(SerializedNode.class);
        }

        @Override
        public void serialize(SerializedNode root, JsonGenerator gen, SerializerProvider provider) throws IOException {
            Deque<Iterator<SerializedNode>> pending = new ArrayDeque<>();
            pending.push(open(root, gen));
            while (!pending.isEmpty()) {
                Iterator<SerializedNode> children = pending.peek();
                if (children.hasNext()) {
                    pending.push(open(children.next(), gen));
                } else {
                    pending.pop();
                    gen.writeEndArray();
                    gen.writeEndObject();
                }
            }
        }

        /**
         * Writes everything up to and including the opening bracket of the children array.
         */
        private static Iterator<SerializedNode> open(SerializedNode node, JsonGenerator gen) throws IOException {
            gen.writeStartObject();
            gen.writeStringField(NAME, node.name());
            gen.writeObjectFieldStart(ATTRIBUTES);
            for (Map.Entry<String, String> attribute : node.attributes().entrySet()) {
                gen.writeStringField(attribute.getKey(), attribute.getValue());
            }
            gen.writeEndObject();
            gen.writeStringField(TEXT_CONTENT, node.textContent());
            gen.writeArrayFieldStart(CHILDREN);
            return node.children().iterator();
        }
    }

    public static final class Reader extends StdDeserializer<SerializedNode> {
        public Reader() {
            super(SerializedNode.class);
        }

        @Override
        public SerializedNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonToken token = p.currentToken();
            if (token == JsonToken.START_OBJECT) {
                token = p.nextToken();
            } else if (token != JsonToken.FIELD_NAME && token != JsonToken.END_OBJECT) {
                throw mismatch(p, "Expected a node object but found " + token);
            }
            Deque<PendingNode> open = new ArrayDeque<>();
            open.push(new PendingNode());
            while (true) {
                if (token == JsonToken.FIELD_NAME) {
                    PendingNode node = open.peek();
                    String field = p.currentName();
                    JsonToken value = p.nextToken();
                    switch (field) {
                        case NAME -> node.name = scalar(p, value, field);
                        case TEXT_CONTENT -> node.text = scalar(p, value, field);
                        case ATTRIBUTES -> readAttributes(p, value, node.attributes);
                        case CHILDREN -> {
                            if (value == JsonToken.START_ARRAY) {
                                JsonToken first = p.nextToken();
                                if (first == JsonToken.START_OBJECT) {
                                    open.push(new PendingNode());
                                } else if (first != JsonToken.END_ARRAY) {
                                    throw mismatch(p, "Node children must be objects");
                                }
                            } else if (value != JsonToken.VALUE_NULL) {
                                throw mismatch(p, "Node children must be an array");
                            }
                        }
                        default -> p.skipChildren();
                    }
                    token = p.nextToken();
                } else if (token == JsonToken.END_OBJECT) {
                    SerializedNode done = open.pop().build(p);
                    if (open.isEmpty()) {
                        return done;
                    }
                    open.peek().children.add(done);
                    JsonToken next = p.nextToken();
                    if (next == JsonToken.START_OBJECT) {
                        open.push(new PendingNode());
                    } else if (next != JsonToken.END_ARRAY) {
                        throw mismatch(p, "Node children must be objects");
                    }
                    token = p.nextToken();
                } else {
                    throw mismatch(p, "Unexpected " + token + " inside node object");
                }
            }
        }

        private static String scalar(JsonParser p, JsonToken value, String field) throws IOException {
            if (value == JsonToken.VALUE_NULL) {
                return null;
            }
            if (value == null || !value.isScalarValue()) {
                throw mismatch(p, "Field '" + field + "' must be a string");
            }
            return p.getValueAsString();
        }

        private static void readAttributes(JsonParser p, JsonToken value, Map<String, String> into) throws IOException {
            if (value == JsonToken.VALUE_NULL) {
                return;
            }
            if (value != JsonToken.START_OBJECT) {
                throw mismatch(p, "Node attributes must be an object");
            }
            while (p.nextToken() == JsonToken.FIELD_NAME) {
                String key = p.currentName();
                JsonToken attributeValue = p.nextToken();
                if (attributeValue == JsonToken.VALUE_NULL) {
                    continue;
                }
                into.put(key, scalar(p, attributeValue, key));
            }
        }

        private static MismatchedInputException mismatch(JsonParser p, String message) {
            return MismatchedInputException.from(p, SerializedNode.class, message);
        }
    }

    private static final class PendingNode {
        private String name;
        private String text;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<SerializedNode> children = new ArrayList<>();

        private SerializedNode build(JsonParser p) throws MismatchedInputException {
            if (name == null) {
                throw MismatchedInputException.from(p, SerializedNode.class, "Node is missing its name");
            }
            return new SerializedNode(name, attributes, text, children);
        }
    }
}
