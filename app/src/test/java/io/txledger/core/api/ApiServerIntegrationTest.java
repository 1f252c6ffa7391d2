package io.txledger.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.txledger.core.ledger.PendingTransactionTable;
import io.txledger.core.node.CandidateBlock;
import io.txledger.core.node.Genesis;
import io.txledger.core.node.LedgerConfig;
import io.txledger.core.node.TransactionLedger;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.Transaction;
import io.txledger.core.testing.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApiServerIntegrationTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();
    private final Fixtures.TestAccount alice = Fixtures.account("alice");

    private ApiServer server;
    private TransactionLedger ledger;

    @BeforeEach
    void setUp() throws Exception {
        Genesis genesis = new Genesis(List.of(new Genesis.Account(alice.address(), alice.keys())),
                Fixtures.governance().keys(), Fixtures.chainParameters());
        ledger = TransactionLedger.open(LedgerConfig.defaultLocal(), genesis);
        ledger.start(genesis);
        server = new ApiServer(ledger, "127.0.0.1", 0, null);
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.stop();
        ledger.close();
    }

    private URI uri(String pathAndQuery) {
        return URI.create("http://127.0.0.1:" + server.boundPort() + pathAndQuery);
    }

    private HttpResponse<String> get(String pathAndQuery) throws Exception {
        return http.send(HttpRequest.newBuilder(uri(pathAndQuery)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> submit(String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri("/transactions"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static String submission(Transaction tx) {
        return "{\"transaction\":\"" + Bytes.toHex(tx.serialize()) + "\"}";
    }

    @Test
    void submittedTransactionBecomesQueryable() throws Exception {
        Transaction tx = alice.tx(1);

        HttpResponse<String> accepted = submit(submission(tx));
        assertEquals(202, accepted.statusCode());
        JsonNode body = mapper.readTree(accepted.body());
        assertEquals(tx.hash().hex(), body.get("hash").asText());
        assertEquals("accepted", body.get("result").asText());

        HttpResponse<String> duplicate = submit(submission(tx));
        assertEquals(200, duplicate.statusCode());
        assertEquals("duplicate", mapper.readTree(duplicate.body()).get("result").asText());

        JsonNode status = mapper.readTree(get("/transactions/status?hash=" + tx.hash().hex()).body());
        assertEquals("received", status.get("status").asText());

        JsonNode nonce = mapper.readTree(get("/accounts/nonce?address=" + alice.address().hex()).body());
        assertEquals(1, nonce.get("nextNonce").asLong());
        assertEquals(1, nonce.get("nonFinalized").asInt());
    }

    @Test
    void statusReflectsFinalization() throws Exception {
        Transaction tx = alice.tx(1);
        ledger.receive(tx, 1);
        CandidateBlock b = new CandidateBlock(Fixtures.blockHash("b"), 2, 100, List.of(tx));
        ledger.executeBlock(b, ledger.addPending(PendingTransactionTable.empty(), tx), ledger.lastFinalizedUpdates().orElseThrow());

        JsonNode committed = mapper.readTree(get("/transactions/status?hash=" + tx.hash().hex()).body());
        assertEquals("committed", committed.get("status").asText());
        assertEquals(0, committed.get("blocks").get(b.hash().hex()).asLong());

        ledger.finalizeBlock(b);
        JsonNode finalized = mapper.readTree(get("/transactions/status?hash=" + tx.hash().hex()).body());
        assertEquals("finalized", finalized.get("status").asText());
        assertEquals(b.hash().hex(), finalized.get("blockHash").asText());
        assertEquals(2, finalized.get("slot").asLong());
    }

    @Test
    void badRequestsAreRejected() throws Exception {
        assertEquals(400, submit("{\"transaction\":\"00\"}").statusCode());
        assertEquals(400, submit("not json").statusCode());
        assertEquals(400, submit("{}").statusCode());
        assertEquals(400, get("/transactions/status").statusCode());
        assertEquals(400, get("/transactions/status?hash=zz").statusCode());
        assertEquals(404, get("/transactions/status?hash=" + "00".repeat(32)).statusCode());
        assertEquals(405, get("/transactions").statusCode());

        HttpResponse<String> unknownSender = submit(submission(Fixtures.account("mallory").tx(1)));
        assertEquals(400, unknownSender.statusCode());
        assertEquals("unknown_sender", mapper.readTree(unknownSender.body()).get("result").asText());
    }

    @Test
    void metricsAreExposed() throws Exception {
        submit(submission(alice.tx(1)));
        HttpResponse<String> metrics = get("/metrics");
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("transactions.received"));
        assertTrue(metrics.body().contains("http.server.requests"));
    }

    @Test
    void serverRestartsAfterStop() throws Exception {
        assertEquals(200, get("/updates").statusCode());
        server.stop();
        server.stop();

        server.start();
        assertEquals(200, get("/updates").statusCode());
    }
}
