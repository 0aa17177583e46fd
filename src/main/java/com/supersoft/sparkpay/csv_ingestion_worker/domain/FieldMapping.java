package com.supersoft.sparkpay.csv_ingestion_worker.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;

/**
 * Where a canonical field comes from and which coercions were declared for it.
 * Accepts either a bare header name ({@code "E-mail"}) or an object with transforms.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_DEFAULT)
@JsonDeserialize(using = FieldMapping.Deserializer.class)
public class FieldMapping {

    @JsonProperty("source")
    private String source;

    @JsonProperty("strip_thousands_separator")
    private boolean stripThousandsSeparator;

    @JsonProperty("date_format")
    private String dateFormat;

    public static FieldMapping of(String source) {
        return FieldMapping.builder().source(source).build();
    }

    public static class Deserializer extends StdDeserializer<FieldMapping> {

        public Deserializer() {
            super(FieldMapping.class);
        }

        @Override
        public FieldMapping deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() == JsonToken.VALUE_STRING) {
                return FieldMapping.of(p.getText());
            }
            JsonNode node = p.readValueAsTree();
            if (node == null || !node.isObject()) {
                return (FieldMapping) ctxt.handleUnexpectedToken(FieldMapping.class, p);
            }
            return FieldMapping.builder()
                    .source(node.hasNonNull("source") ? node.get("source").asText() : null)
                    .stripThousandsSeparator(node.path("strip_thousands_separator").asBoolean(false))
                    .dateFormat(node.hasNonNull("date_format") ? node.get("date_format").asText() : null)
                    .build();
        }
    }
}
