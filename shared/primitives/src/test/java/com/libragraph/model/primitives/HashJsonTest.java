package com.libragraph.model.primitives;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.JsonMappingException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class HashJsonTest {

    private static final String AB_HEX = "ab" + "00".repeat(31);

    private final ObjectMapper mapper = new ObjectMapper();

    record Document(Hash hash) {
    }

    @Test
    void shouldSerializeAsPlainHexString() throws Exception {
        Hash hash = Hash.parse(AB_HEX);

        assertThat(mapper.writeValueAsString(Map.of("hash", hash)))
                .isEqualTo("{\"hash\":\"" + AB_HEX + "\"}");
        assertThat(hash.toJson()).isEqualTo(hash.toString());
    }

    @Test
    void shouldSerializeInsideRecord() throws Exception {
        String json = mapper.writeValueAsString(new Document(Hash.parse(AB_HEX)));

        assertThat(json).isEqualTo("{\"hash\":\"" + AB_HEX + "\"}");
    }

    @Test
    void shouldDeserializeFromHexString() throws Exception {
        Document doc = mapper.readValue("{\"hash\":\"0x" + AB_HEX + "\"}", Document.class);

        assertThat(doc.hash()).isEqualTo(Hash.parse(AB_HEX));
    }

    @Test
    void shouldRejectMalformedHexInJson() {
        assertThatThrownBy(() -> mapper.readValue("{\"hash\":\"abcd\"}", Document.class))
                .isInstanceOf(JsonMappingException.class)
                .hasRootCauseInstanceOf(InvalidHashHexException.class);
    }
}
