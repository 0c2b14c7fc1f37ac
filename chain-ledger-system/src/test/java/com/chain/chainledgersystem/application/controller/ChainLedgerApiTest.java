package com.chain.chainledgersystem.application.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public class ChainLedgerApiTest {

    @Autowired
    private MockMvc mockMvc;

    @DynamicPropertySource
    static void systemProperties(DynamicPropertyRegistry registry) {
        String storagePath;
        try {
            storagePath = Files.createTempDirectory("chainledger-api").toString();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        registry.add("system.storage-path", () -> storagePath);
        registry.add("system.node-id", () -> "api_node");
        registry.add("system.sync.enabled", () -> "false");
        registry.add("system.peer.timeout-ms", () -> "1000");
    }

    @Test
    void pingAndInfo() throws Exception {
        mockMvc.perform(get("/ping"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("online"))
                .andExpect(jsonPath("$.node_id").value("api_node"));
        mockMvc.perform(get("/node/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.node_id").value("api_node"))
                .andExpect(jsonPath("$.chain_length").value(greaterThanOrEqualTo(1)));
    }

    @Test
    void custodyLifecycle() throws Exception {
        String itemId = "EV-" + UUID.randomUUID();

        postJson("/items", "{\"item_id\":\"" + itemId + "\",\"description\":\"knife\",\"actor\":\"Officer A\","
                + "\"location\":\"scene\",\"item_type\":\"Physical\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transaction.type").value("item_creation"))
                .andExpect(jsonPath("$.transaction.action").value("Created"))
                .andExpect(jsonPath("$.transaction.node_id").value("api_node"))
                .andExpect(jsonPath("$.block.previous_hash").isString())
                .andExpect(jsonPath("$.block.payload[0].item_id").value(itemId));

        postJson("/transfers", "{\"item_id\":\"" + itemId + "\",\"from_actor\":\"Officer A\","
                + "\"to_actor\":\"Lab B\",\"reason\":\"analysis\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transaction.type").value("item_transfer"));

        mockMvc.perform(get("/items/" + itemId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current_custodian").value("Lab B"))
                .andExpect(jsonPath("$.created_by").value("Officer A"))
                .andExpect(jsonPath("$.last_action").value("Transferred"));
        mockMvc.perform(get("/items/" + itemId + "/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.item_id").value(itemId))
                .andExpect(jsonPath("$.history.length()").value(2))
                .andExpect(jsonPath("$.history[0].action").value("Created"))
                .andExpect(jsonPath("$.history[1].custodian").value("Lab B"));
        mockMvc.perform(get("/items/" + itemId + "/transfers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].to_actor").value("Lab B"));
        mockMvc.perform(get("/items"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[*].item_id").value(hasItem(itemId)));
        mockMvc.perform(get("/validate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true));
    }

    @Test
    void chainEndpointReportsLength() throws Exception {
        mockMvc.perform(get("/chain"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chain[0].index").value(0))
                .andExpect(jsonPath("$.chain[0].previous_hash").value("0"));
        mockMvc.perform(get("/blocks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(greaterThanOrEqualTo(1)));
        mockMvc.perform(get("/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.blocks").value(greaterThanOrEqualTo(1)));
    }

    @Test
    void missingFieldIsBadRequest() throws Exception {
        postJson("/items", "{\"item_id\":\"EV-bad\",\"description\":\"knife\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400));
        mockMvc.perform(get("/items/EV-bad"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        postJson("/items", "{not json")
                .andExpect(status().isBadRequest());
        postJson("/transaction/receive", "{\"transaction\":{\"type\":\"item_burned\",\"item_id\":\"EV-x\"}}")
                .andExpect(status().isBadRequest());
        postJson("/transaction/receive", "{}")
                .andExpect(status().isBadRequest());
    }

    @Test
    void receivedTransactionIsSealed() throws Exception {
        String itemId = "EV-" + UUID.randomUUID();

        postJson("/transaction/receive", "{\"transaction\":{\"type\":\"item_creation\",\"item_id\":\"" + itemId + "\","
                + "\"description\":\"gun\",\"actor\":\"Officer C\",\"location\":\"locker\",\"item_type\":\"Physical\","
                + "\"action\":\"Created\",\"timestamp\":\"2024-01-01T10:00:00\",\"node_id\":\"remote_node\","
                + "\"content_hash\":\"abc\"}}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("Transaction received"));

        mockMvc.perform(get("/items/" + itemId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current_custodian").value("Officer C"))
                .andExpect(jsonPath("$.content_hash").value("abc"));
    }

    @Test
    void peerManagement() throws Exception {
        postJson("/peers/add", "{\"peer_url\":\"http://peer-x.invalid:5000/\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.peers").value(hasItem("http://peer-x.invalid:5000")));
        mockMvc.perform(get("/peers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.peers").value(hasItem("http://peer-x.invalid:5000")));
        postJson("/peers/remove", "{\"peer_url\":\"http://peer-x.invalid:5000\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.peers").value(not(hasItem("http://peer-x.invalid:5000"))));
        postJson("/peers/add", "{\"peer_url\":\"\"}")
                .andExpect(status().isBadRequest());
    }

    @Test
    void connectToUnreachablePeer() throws Exception {
        postJson("/peers/connect", "{\"peer_url\":\"http://127.0.0.1:1\"}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.connected").value(false))
                .andExpect(jsonPath("$.peers").value(not(hasItem("http://127.0.0.1:1"))));
    }

    @Test
    void syncWithoutPeersIsUpToDate() throws Exception {
        postJson("/sync", "")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Chain is up to date"))
                .andExpect(jsonPath("$.synced").value(false));
    }

    @Test
    void backupReturnsItsPath() throws Exception {
        postJson("/backup", "")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("Backup created"))
                .andExpect(jsonPath("$.backup_path").value(containsString("chainledger_backup_")));
    }

    private ResultActions postJson(String path, String body) throws Exception {
        return mockMvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body));
    }
}
