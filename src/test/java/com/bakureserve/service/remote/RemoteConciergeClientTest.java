package com.bakureserve.service.remote;

import com.bakureserve.config.ConciergeProperties;
import com.bakureserve.dto.remote.RemoteConciergeResponse;
import com.bakureserve.exception.RemoteConciergeException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RemoteConciergeClientTest {

    private static final String URL = "http://ranker.test/concierge/recommendations";

    private MockRestServiceServer server;
    private RemoteConciergeClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        ConciergeProperties properties = new ConciergeProperties();
        properties.getRemote().setBaseUrl("http://ranker.test");
        client = new RemoteConciergeClient(restTemplate, new ObjectMapper(), properties);
    }

    @Test
    void postsPromptAndLimitAndParsesResults() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"prompt\":\"seafood\",\"limit\":3}"))
                .andRespond(withSuccess("{\"results\":[{\"id\":\"sahil\",\"name\":\"Sahil\",\"price_label\":\"AZN 3/4\","
                        + "\"area\":\"Boulevard\",\"score\":0.93}],\"message\":\"Try Sahil.\",\"mode\":\"ai\"}",
                        MediaType.APPLICATION_JSON));

        RemoteConciergeResponse response = client.fetchConcierge("seafood", 3);

        assertThat(response.getResults()).hasSize(1);
        assertThat(response.getResults().get(0).getPriceLabel()).isEqualTo("AZN 3/4");
        assertThat(response.getMessage()).isEqualTo("Try Sahil.");
        server.verify();
    }

    @Test
    void serverErrorIsWrapped() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchConcierge("seafood", 3))
                .isInstanceOf(RemoteConciergeException.class)
                .hasMessageContaining("500");
    }

    @Test
    void malformedJsonIsRejected() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"results\": [", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchConcierge("seafood", 3))
                .isInstanceOf(RemoteConciergeException.class)
                .hasMessageContaining("malformed");
    }

    @Test
    void payloadWithoutResultsIsRejected() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"message\":\"hi\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchConcierge("seafood", 3))
                .isInstanceOf(RemoteConciergeException.class)
                .hasMessageContaining("no results");
    }

    @Test
    void resultWithoutIdIsRejected() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"results\":[{\"name\":\"Nameless\"}]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchConcierge("seafood", 3))
                .isInstanceOf(RemoteConciergeException.class)
                .hasMessageContaining("missing id or name");
    }
}
