package io.governance.core.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.governance.core.node.GovernanceNode;
import io.governance.core.node.NodeConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;

class RpcServerIntegrationTest {

    private static final String TOKEN = "rpc-secret";
    private static final String ALICE = "alice123456";

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();

    private GovernanceNode node;
    private RpcServer server;
    private int port;

    @BeforeEach
    void setUp() throws Exception {
        port = freePort();
        node = GovernanceNode.inMemory(NodeConfig.defaultLocal());
        node.start();
        server = new RpcServer(node, "127.0.0.1", port, TOKEN);
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        if (node != null) {
            node.close();
        }
    }

    @Test
    void statusRequiresAuth() throws Exception {
        HttpResponse<String> unauthorized = client.send(
                HttpRequest.newBuilder(uri("/status")).GET().build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(401, unauthorized.statusCode());

        HttpResponse<String> viaApiKey = client.send(
                HttpRequest.newBuilder(uri("/status")).header("X-API-Key", TOKEN).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals(200, viaApiKey.statusCode());

        JsonNode status = mapper.readTree(get("/status").body());
        assertEquals("gov-contract", status.get("contract").asText());
        assertTrue(status.get("height").asLong() >= 1);
    }

    @Test
    void stakeThenQueryStaker() throws Exception {
        HttpResponse<String> staked = post("/token/send",
                "{\"from\":\"" + ALICE + "\",\"amount\":1000,\"msg\":{\"stake_voting_tokens\":{}}}");
        assertEquals(200, staked.statusCode(), staked.body());
        JsonNode attrs = mapper.readTree(staked.body()).get("attributes");
        assertEquals("staking", attrs.get("action").asText());
        assertEquals("1000", attrs.get("share").asText());

        JsonNode staker = mapper.readTree(get("/staker?address=" + ALICE).body());
        assertEquals(1000L, staker.get("balance").asLong());
        assertEquals(1000L, staker.get("share").asLong());

        JsonNode state = mapper.readTree(get("/state").body());
        assertEquals(1000L, state.get("totalShare").asLong());
    }

    @Test
    void createPollAndVote() throws Exception {
        post("/token/send", "{\"from\":\"" + ALICE + "\",\"amount\":1000,\"msg\":{\"stake_voting_tokens\":{}}}");
        HttpResponse<String> created = post("/token/send",
                "{\"from\":\"" + ALICE + "\",\"amount\":100,\"msg\":{\"create_poll\":{\"title\":\"test\",\"description\":\"test\"}}}");
        assertEquals(200, created.statusCode(), created.body());
        assertEquals("1", mapper.readTree(created.body()).get("attributes").get("poll_id").asText());

        HttpResponse<String> voted = post("/vote",
                "{\"sender\":\"" + ALICE + "\",\"pollId\":1,\"vote\":\"yes\",\"amount\":400}");
        assertEquals(200, voted.statusCode(), voted.body());

        JsonNode voters = mapper.readTree(get("/voters?poll_id=1").body()).get("voters");
        assertEquals(1, voters.size());
        assertEquals(ALICE, voters.get(0).get("voter").asText());
        assertEquals("yes", voters.get(0).get("vote").asText());
        assertEquals(400L, voters.get(0).get("balance").asLong());

        JsonNode polls = mapper.readTree(get("/polls?filter=in_progress").body()).get("polls");
        assertEquals(1, polls.size());

        HttpResponse<String> again = post("/vote",
                "{\"sender\":\"" + ALICE + "\",\"pollId\":1,\"vote\":\"no\",\"amount\":1}");
        assertEquals(409, again.statusCode());
        assertEquals("already_voted", mapper.readTree(again.body()).get("error").asText());
    }

    @Test
    void mapsGovernanceErrorsToStatusCodes() throws Exception {
        HttpResponse<String> missing = get("/poll?id=42");
        assertEquals(404, missing.statusCode());
        assertEquals("poll_not_found", mapper.readTree(missing.body()).get("error").asText());

        HttpResponse<String> lowDeposit = post("/token/send",
                "{\"from\":\"" + ALICE + "\",\"amount\":5,\"msg\":{\"create_poll\":{\"title\":\"test\",\"description\":\"test\"}}}");
        assertEquals(422, lowDeposit.statusCode());

        HttpResponse<String> notOwner = post("/update-config", "{\"sender\":\"bob654321\",\"quorum\":0.1}");
        assertEquals(403, notOwner.statusCode());

        HttpResponse<String> noSender = post("/withdraw", "{}");
        assertEquals(400, noSender.statusCode());
        assertEquals("missing_sender", mapper.readTree(noSender.body()).get("error").asText());
    }

    @Test
    void rejectsWrongMethodAndUnknownPath() throws Exception {
        HttpResponse<String> wrongMethod = post("/status", "{}");
        assertEquals(405, wrongMethod.statusCode());

        HttpResponse<String> unknown = get("/status/extra");
        assertEquals(404, unknown.statusCode());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Authorization", "Bearer " + TOKEN)
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Authorization", "Bearer " + TOKEN)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + port + path);
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
