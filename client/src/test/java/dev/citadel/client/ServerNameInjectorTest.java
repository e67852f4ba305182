package dev.citadel.client;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class ServerNameInjectorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ServerNameInjector injector = new ServerNameInjector("github", mapper);

    @Test
    void addsServerToExistingParams() throws Exception {
        JsonNode out = mapper.readTree(injector.inject(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\",\"params\":{\"name\":\"search\"}}"));

        assertThat(out.at("/params/server").asText()).isEqualTo("github");
        assertThat(out.at("/params/name").asText()).isEqualTo("search");
    }

    @Test
    void createsParamsWhenMissing() throws Exception {
        JsonNode out = mapper.readTree(injector.inject("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}"));

        assertThat(out.at("/params/server").asText()).isEqualTo("github");
    }

    @Test
    void overridesServerChosenByClient() throws Exception {
        JsonNode out = mapper.readTree(injector.inject(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\",\"params\":{\"server\":\"other\"}}"));

        assertThat(out.at("/params/server").asText()).isEqualTo("github");
    }

    @Test
    void leavesResponsesAndNonJsonUntouched() {
        String response = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}";

        assertThat(injector.inject(response)).isEqualTo(response);
        assertThat(injector.inject("not json")).isEqualTo("not json");
        assertThat(injector.inject("[1]")).isEqualTo("[1]");
    }

    @Test
    void leavesPositionalParamsUntouched() {
        String line = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"x\",\"params\":[1]}";

        assertThat(injector.inject(line)).isEqualTo(line);
    }
}
