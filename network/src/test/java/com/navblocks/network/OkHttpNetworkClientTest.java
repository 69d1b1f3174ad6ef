package com.navblocks.network;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import com.navblocks.network.exception.NoConnectionException;
import com.navblocks.network.exception.ResponseStatusException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OkHttpNetworkClient")
class OkHttpNetworkClientTest {

    @RegisterExtension
    static WireMockExtension wireMock = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private String baseUrl;

    @BeforeEach
    void setUp() {
        baseUrl = "http://localhost:" + wireMock.getPort();
    }

    @Test
    @DisplayName("returns the body of a successful response")
    void returnsBodyOnSuccess() {
        wireMock.stubFor(get(urlPathEqualTo("/items"))
                .willReturn(aResponse().withStatus(200).withBody("{\"value\":[]}")));

        byte[] body = new OkHttpNetworkClient().execute(baseUrl + "/items", "GET", null, null, null);

        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("{\"value\":[]}");
    }

    @Test
    @DisplayName("returns an empty array for a bodiless success")
    void returnsEmptyArrayOnNoContent() {
        wireMock.stubFor(delete(urlPathEqualTo("/items"))
                .willReturn(aResponse().withStatus(204)));

        byte[] body = new OkHttpNetworkClient().execute(baseUrl + "/items", "DELETE", null, null, null);

        assertThat(body).isEmpty();
    }

    @Test
    @DisplayName("sends default headers, request headers, payload and content type")
    void sendsHeadersAndPayload() {
        wireMock.stubFor(post(urlPathEqualTo("/items"))
                .willReturn(aResponse().withStatus(201).withBody("ok")));

        OkHttpNetworkClient.Settings settings = new OkHttpNetworkClient.Settings()
                .withDefaultHeader("Authorization", "Bearer abc");
        List<NetworkClient.Header> headers = Collections.singletonList(
                new NetworkClient.Header("SOAPAction", "urn:test/page/Create"));

        new OkHttpNetworkClient(settings).execute(baseUrl + "/items", "POST", headers,
                "<x/>".getBytes(StandardCharsets.UTF_8), "text/xml; charset=utf-8");

        wireMock.verify(postRequestedFor(urlPathEqualTo("/items"))
                .withHeader("Authorization", equalTo("Bearer abc"))
                .withHeader("SOAPAction", equalTo("urn:test/page/Create"))
                .withHeader("Content-Type", containing("text/xml"))
                .withRequestBody(equalTo("<x/>")));
    }

    @Test
    @DisplayName("PATCH without payload still sends an empty body")
    void patchWithoutPayload() {
        wireMock.stubFor(patch(urlPathEqualTo("/items"))
                .willReturn(aResponse().withStatus(200).withBody("{}")));

        byte[] body = new OkHttpNetworkClient().execute(baseUrl + "/items", "PATCH", null, null, null);

        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("{}");
    }

    @Test
    @DisplayName("non-2xx status keeps code and body")
    void failsOnErrorStatus() {
        wireMock.stubFor(get(urlPathEqualTo("/items"))
                .willReturn(aResponse().withStatus(500).withBody("<faultstring>boom</faultstring>")));

        OkHttpNetworkClient client = new OkHttpNetworkClient();

        assertThatThrownBy(() -> client.execute(baseUrl + "/items", "GET", null, null, null))
                .isInstanceOf(ResponseStatusException.class)
                .satisfies(e -> {
                    ResponseStatusException status = (ResponseStatusException) e;
                    assertThat(status.code()).isEqualTo(500);
                    assertThat(status.body()).contains("boom");
                });
    }

    @Test
    @DisplayName("refused connection becomes NoConnectionException")
    void failsWithoutConnection() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        OkHttpNetworkClient client = new OkHttpNetworkClient();
        String url = "http://localhost:" + port + "/items";

        assertThatThrownBy(() -> client.execute(url, "GET", null, null, null))
                .isInstanceOf(NoConnectionException.class)
                .hasCauseInstanceOf(java.io.IOException.class);
    }

    @Test
    @DisplayName("execute after shutdownNow is rejected")
    void rejectsAfterShutdown() {
        OkHttpNetworkClient client = new OkHttpNetworkClient();
        client.shutdownNow();

        assertThatThrownBy(() -> client.execute(baseUrl + "/items", "GET", null, null, null))
                .isInstanceOf(IllegalStateException.class);
    }

}
