package dev.citadel.gateway.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.observability.AutoConfigureObservability;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import dev.citadel.gateway.backend.BackendConnector;
import dev.citadel.gateway.backend.FakeConnector;

@SpringBootTest(properties = { "gateway.unix-socket.enabled=false", "gateway.servers.github.command=fake-github" })
@AutoConfigureMockMvc
@AutoConfigureObservability
class PrometheusEndpointTest {

	@Autowired
	private MockMvc mockMvc;

	@Test
	void scrapeShowsGatewayMeters() throws Exception {
		this.mockMvc
			.perform(post("/mcp").contentType(MediaType.APPLICATION_JSON)
				.content("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":"
						+ "{\"server\":\"github\",\"protocolVersion\":\"2025-06-18\"}}"))
			.andExpect(status().isOk());
		this.mockMvc.perform(post("/mcp").contentType(MediaType.APPLICATION_JSON).content("{oops"))
			.andExpect(status().isBadRequest());

		String scrape = this.mockMvc.perform(get("/actuator/prometheus"))
			.andExpect(status().isOk())
			.andReturn()
			.getResponse()
			.getContentAsString();

		assertThat(scrape).contains("citadel_sessions_created_total{")
			.contains("transport=\"http\"")
			.contains("citadel_sessions_active{")
			.contains("citadel_backends_connected")
			.contains("citadel_errors_total{")
			.contains("kind=\"malformed\"");
	}

	@TestConfiguration
	static class FakeBackends {

		@Bean
		@Primary
		BackendConnector fakeBackendConnector() {
			return new FakeConnector();
		}

	}

}
