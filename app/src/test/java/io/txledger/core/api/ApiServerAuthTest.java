package io.txledger.core.api;

import io.txledger.core.node.Genesis;
import io.txledger.core.node.LedgerConfig;
import io.txledger.core.node.TransactionLedger;
import io.txledger.core.testing.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApiServerAuthTest {

    private ApiServer server;
    private TransactionLedger ledger;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.stop();
        }
        if (ledger != null) {
            ledger.close();
        }
    }

    @Test
    void updatesEndpointRequiresAuth() throws Exception {
        Genesis genesis = new Genesis(List.of(), Fixtures.governance().keys(), Fixtures.chainParameters());
        ledger = TransactionLedger.open(LedgerConfig.defaultLocal(), genesis);
        ledger.start(genesis);

        server = new ApiServer(ledger, "127.0.0.1", 0, "secret-token");
        server.start();

        HttpClient client = HttpClient.newHttpClient();
        URI uri = new URI("http://127.0.0.1:" + server.boundPort() + "/updates");

        HttpResponse<String> unauthorized = client.send(HttpRequest.newBuilder(uri).GET().build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(401, unauthorized.statusCode());
        assertTrue(unauthorized.headers().firstValue("WWW-Authenticate").isPresent());

        HttpRequest wrongToken = HttpRequest.newBuilder(uri)
                .header("Authorization", "Bearer nope")
                .GET()
                .build();
        assertEquals(401, client.send(wrongToken, HttpResponse.BodyHandlers.ofString()).statusCode());

        HttpRequest bearer = HttpRequest.newBuilder(uri)
                .header("Authorization", "Bearer secret-token")
                .GET()
                .build();
        HttpResponse<String> authorized = client.send(bearer, HttpResponse.BodyHandlers.ofString());
        assertEquals(200, authorized.statusCode());
        assertTrue(authorized.body().contains("\"chainParameters\""));

        HttpRequest apiKey = HttpRequest.newBuilder(uri)
                .header("X-API-Key", "secret-token")
                .GET()
                .build();
        assertEquals(200, client.send(apiKey, HttpResponse.BodyHandlers.ofString()).statusCode());
    }
}
