package com.spocparser.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.spocparser.ast.Node;
import com.spocparser.ast.Toplevel;
import com.spocparser.json.AstJsonDeserializer;
import com.spocparser.json.AstJsonException;
import com.spocparser.json.AstJsonProvider;
import com.spocparser.json.AstJsonSerializer;

import java.util.List;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private static final TypeReference<List<Toplevel>> TOPLEVELS = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(SpocJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectWriter nodeWriter;
        private final ObjectWriter listWriter;

        JacksonSerializer(ObjectMapper mapper) {
            this.nodeWriter = mapper.writerFor(Node.class);
            this.listWriter = mapper.writerFor(TOPLEVELS);
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            return write(nodeWriter, node);
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            return write(nodeWriter.withDefaultPrettyPrinter(), node);
        }

        @Override
        public String serializeToplevels(List<? extends Toplevel> toplevels, boolean pretty) throws AstJsonException {
            return write(pretty ? listWriter.withDefaultPrettyPrinter() : listWriter, toplevels);
        }

        private static String write(ObjectWriter writer, Object value) {
            try {
                return writer.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize AST", e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;
        private final ObjectReader listReader;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
            this.listReader = mapper.readerFor(TOPLEVELS);
        }

        @Override
        public List<Toplevel> deserializeToplevels(String json) throws AstJsonException {
            try {
                return listReader.readValue(json);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize definitions", e);
            }
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
