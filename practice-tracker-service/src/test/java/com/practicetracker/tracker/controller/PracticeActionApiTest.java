package com.practicetracker.tracker.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.practicetracker.tracker.repository.PracticeRecordRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class PracticeActionApiTest {

    @Autowired
    private MockMvc mvc;
    @Autowired
    private ObjectMapper objectMapper;
    @Autowired
    private PracticeRecordRepository recordRepository;

    private static String uniqueName(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static String credentials(String username, String password) {
        return "{\"username\":\"" + username + "\",\"password\":\"" + password + "\"}";
    }

    private String register(String username) throws Exception {
        MvcResult res = mvc.perform(post("/api/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(username, "s3cret")))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(res.getResponse().getContentAsString()).get("token").asText();
    }

    private long createAction(String token, String name) throws Exception {
        MvcResult res = mvc.perform(post("/api/actions")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"" + name + "\"}"))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(res.getResponse().getContentAsString()).get("id").asLong();
    }

    @Test
    void register_returnsTokenAndUserWithoutPassword() throws Exception {
        String username = uniqueName("reg");

        MvcResult res = mvc.perform(post("/api/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(username, "pw")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").isString())
                .andExpect(jsonPath("$.user.username").value(username))
                .andExpect(jsonPath("$.user.password_hash").doesNotExist())
                .andExpect(jsonPath("$.user.create_time").isNumber())
                .andReturn();

        long created = objectMapper.readTree(res.getResponse().getContentAsString())
                .get("user").get("create_time").asLong();
        assertThat(created).isCloseTo(Instant.now().getEpochSecond(), within(120L));
    }

    @Test
    void duplicateUsername_isConflict_andFirstAccountStillLogsIn() throws Exception {
        String username = uniqueName("dup");
        register(username);

        mvc.perform(post("/api/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(username, "other")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONFLICT"));

        mvc.perform(post("/api/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(username, "s3cret")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.username").value(username));
    }

    @Test
    void login_wrongPasswordOrUnknownUser_isUnauthorized() throws Exception {
        String username = uniqueName("login");
        register(username);

        mvc.perform(post("/api/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(username, "wrong")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid credentials"));

        mvc.perform(post("/api/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(uniqueName("nobody"), "s3cret")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid credentials"));
    }

    @Test
    void actionsRequireBearerToken() throws Exception {
        mvc.perform(get("/api/actions"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));

        mvc.perform(get("/api/actions").header(HttpHeaders.AUTHORIZATION, "Bearer garbage"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void finishTwiceSameDay_secondIsConflict_andOneRecordRemains() throws Exception {
        String token = register(uniqueName("finisher"));
        long actionId = createAction(token, "Meditate");

        mvc.perform(post("/api/actions/" + actionId + "/finish")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"note\":\"10 minutes\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action_id").value(actionId))
                .andExpect(jsonPath("$.finish_time").isNumber())
                .andExpect(jsonPath("$.note").value("10 minutes"))
                .andExpect(jsonPath("$.finish_day").doesNotExist());

        mvc.perform(post("/api/actions/" + actionId + "/finish")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Already completed today"));

        assertThat(recordRepository.findByActionIdOrderByFinishTimeDesc(actionId)).hasSize(1);

        mvc.perform(get("/api/actions/" + actionId + "/records")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));

        mvc.perform(get("/api/actions/" + actionId)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.last_finish_time").isNumber());
    }

    @Test
    void listActions_reportsStatsAndPutsPendingFirst() throws Exception {
        String token = register(uniqueName("lister"));
        long done = createAction(token, "Done today");
        long pending = createAction(token, "Still pending");

        mvc.perform(post("/api/actions/" + done + "/finish")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk());

        MvcResult res = mvc.perform(get("/api/actions")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andReturn();

        JsonNode list = objectMapper.readTree(res.getResponse().getContentAsString());
        assertThat(list).hasSize(2);
        assertThat(list.get(0).get("id").asLong()).isEqualTo(pending);
        assertThat(list.get(0).get("finished_today").asBoolean()).isFalse();
        assertThat(list.get(0).get("total_finished").asLong()).isZero();
        assertThat(list.get(0).get("last_finish_time").isNull()).isTrue();
        assertThat(list.get(1).get("id").asLong()).isEqualTo(done);
        assertThat(list.get(1).get("finished_today").asBoolean()).isTrue();
        assertThat(list.get(1).get("total_finished").asLong()).isEqualTo(1L);
    }

    @Test
    void otherUsersAction_isInvisible() throws Exception {
        String owner = register(uniqueName("owner"));
        String intruder = register(uniqueName("intruder"));
        long actionId = createAction(owner, "Journal");

        mvc.perform(post("/api/actions/" + actionId + "/finish")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + intruder))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));

        mvc.perform(get("/api/actions/" + actionId)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + intruder))
                .andExpect(status().isOk())
                .andExpect(content().string("null"));

        mvc.perform(get("/api/actions/" + actionId + "/records")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + intruder))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        assertThat(recordRepository.findByActionIdOrderByFinishTimeDesc(actionId)).isEmpty();
    }

    @Test
    void malformedIdOrBlankName_areRejected() throws Exception {
        String token = register(uniqueName("bad"));

        mvc.perform(post("/api/actions/abc/finish")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isNotFound());

        mvc.perform(post("/api/actions")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }
}
