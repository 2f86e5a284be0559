package com.centralbot.controller;

import com.centralbot.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.Duration;
import java.time.Instant;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class FleetApiIntegrationTest {

    @TestConfiguration
    static class FixedClockConfig {

        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(Instant.parse("2025-06-01T12:00:00Z"));
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MutableClock clock;

    @Test
    void heartbeatRegistersDeviceInFleetStatus() throws Exception {
        heartbeat("bot_alice", """
                {"uptime_hours": 3, "cpu_usage": 12.5, "actions_today": {"tweets": 2},
                 "content_version": "v7", "twitter_logged_in": true}
                """)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.timestamp").exists());

        mockMvc.perform(get("/api/status/all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_devices").value(1))
                .andExpect(jsonPath("$.online_devices").value(1))
                .andExpect(jsonPath("$.devices.bot_alice.status").value("online"))
                .andExpect(jsonPath("$.devices.bot_alice.last_seen").value(startsWith("2025-06-01T12:00")))
                .andExpect(jsonPath("$.devices.bot_alice.uptime_hours").value(3))
                .andExpect(jsonPath("$.devices.bot_alice.actions_today.tweets").value(2))
                .andExpect(jsonPath("$.devices.bot_alice.content_version").value("v7"))
                .andExpect(jsonPath("$.devices.bot_alice.twitter_logged_in").value(true))
                .andExpect(jsonPath("$.devices.bot_alice.last_activity").value("Never"))
                .andExpect(jsonPath("$.devices.bot_alice.device_id").doesNotExist());
    }

    @Test
    void heartbeatWithoutBodyStillSucceeds() throws Exception {
        mockMvc.perform(post("/api/device/bot_silent/heartbeat"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        mockMvc.perform(get("/api/status/all"))
                .andExpect(jsonPath("$.devices.bot_silent.content_version").value("unknown"))
                .andExpect(jsonPath("$.devices.bot_silent.uptime_hours").value(0));
    }

    @Test
    void activityIsRecordedAndShownInRecentActivities() throws Exception {
        heartbeat("bot_alice", "{}");
        clock.advance(Duration.ofSeconds(5));

        mockMvc.perform(post("/api/device/bot_alice/activity")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\": \"tweet\", \"success\": true, \"content_preview\": \"" + "y".repeat(150) + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.timestamp").doesNotExist());

        mockMvc.perform(get("/api/status/all"))
                .andExpect(jsonPath("$.recent_activities.bot_alice", hasSize(1)))
                .andExpect(jsonPath("$.recent_activities.bot_alice[0].action").value("tweet"))
                .andExpect(jsonPath("$.recent_activities.bot_alice[0].content_preview").value("y".repeat(100)))
                .andExpect(jsonPath("$.devices.bot_alice.last_activity").value("2025-06-01T12:00:05"));
    }

    @Test
    void stopCommandIsDeliveredOnNextPollOnly() throws Exception {
        mockMvc.perform(post("/api/control/stop/bot_alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Stop command sent to bot_alice"));

        mockMvc.perform(get("/api/device/bot_alice/commands"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.commands", hasSize(1)))
                .andExpect(jsonPath("$.commands[0].action").value("stop_bot"))
                .andExpect(jsonPath("$.commands[0].command_id").value(startsWith("stop_bot_")))
                .andExpect(jsonPath("$.commands[0].parameters.reason").value("Manual stop from Control Room"))
                .andExpect(jsonPath("$.timestamp").exists());

        mockMvc.perform(get("/api/device/bot_alice/commands"))
                .andExpect(jsonPath("$.commands", hasSize(0)));
    }

    @Test
    void restartCarriesOperatorParameters() throws Exception {
        mockMvc.perform(post("/api/control/restart/bot_bob")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"delay_seconds\": 30}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Restart command sent to bot_bob"));

        mockMvc.perform(get("/api/device/bot_bob/commands"))
                .andExpect(jsonPath("$.commands[0].action").value("restart_bot"))
                .andExpect(jsonPath("$.commands[0].parameters.delay_seconds").value(30));
    }

    @Test
    void emergencyStopReachesEveryRegisteredDevice() throws Exception {
        heartbeat("bot_1", "{}");
        heartbeat("bot_2", "{}");

        mockMvc.perform(post("/api/control/emergency_stop_all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Emergency stop sent to 2 devices"))
                .andExpect(jsonPath("$.devices", hasSize(2)))
                .andExpect(jsonPath("$.devices[0]").value("bot_1"));

        mockMvc.perform(get("/api/device/bot_2/commands"))
                .andExpect(jsonPath("$.commands[0].action").value("emergency_stop"))
                .andExpect(jsonPath("$.commands[0].parameters.priority").value("critical"));
    }

    @Test
    void staleDevicesDisappearFromStatus() throws Exception {
        heartbeat("bot_old", "{}");
        clock.advance(Duration.ofMinutes(11));

        mockMvc.perform(get("/api/status/all"))
                .andExpect(jsonPath("$.total_devices").value(0))
                .andExpect(jsonPath("$.devices.bot_old").doesNotExist());
    }

    @Test
    void analyticsReportsBreakdownAndTopPerformers() throws Exception {
        heartbeat("bot_a", "{\"uptime_hours\": 4, \"actions_today\": {\"tweets\": 5}}");
        heartbeat("bot_b", "{\"actions_today\": {\"replies\": 2, \"retweets\": 1}}");
        heartbeat("bot_c", "{}");

        mockMvc.perform(get("/api/status/analytics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.timestamp").exists())
                .andExpect(jsonPath("$.analytics.fleet_overview.total_devices").value(3))
                .andExpect(jsonPath("$.analytics.fleet_overview.offline_devices").value(0))
                .andExpect(jsonPath("$.analytics.action_breakdown.total_actions").value(8))
                .andExpect(jsonPath("$.analytics.action_breakdown.tweet_percentage").value(62.5))
                .andExpect(jsonPath("$.analytics.performance_metrics.action_efficiency").value(2.0))
                .andExpect(jsonPath("$.analytics.device_details", hasSize(3)))
                .andExpect(jsonPath("$.analytics.top_performers[0].id").value("bot_a"))
                .andExpect(jsonPath("$.analytics.top_performers[0].name").value("a"))
                .andExpect(jsonPath("$.analytics.top_performers[0].memory_usage").value(0));
    }

    @Test
    void malformedJsonIsRejectedWithStructuredError() throws Exception {
        mockMvc.perform(post("/api/device/bot_alice/heartbeat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void nonJsonHeartbeatGetsStructuredError() throws Exception {
        mockMvc.perform(post("/api/device/bot_x/heartbeat")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("{\"uptime_hours\": 1}"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").isNotEmpty())
                .andExpect(jsonPath("$.title").doesNotExist());

        mockMvc.perform(post("/api/device/bot_x/heartbeat")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .content("uptime_hours=1"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void wrongMethodGetsStructuredError() throws Exception {
        mockMvc.perform(get("/api/device/bot_x/heartbeat"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(header().exists("Allow"))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").isNotEmpty());
    }

    @Test
    void infoAndHealthEndpoints() throws Exception {
        heartbeat("bot_1", "{}");

        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("Central Bot API"))
                .andExpect(jsonPath("$.version").value("1.0.0"))
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.connected_devices").value(1))
                .andExpect(jsonPath("$.endpoints.fleet_status").value("/api/status/all [GET]"));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }

    @Test
    void allowsCrossOriginCalls() throws Exception {
        mockMvc.perform(get("/api/status/all").header("Origin", "http://control-room.example"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"));

        mockMvc.perform(get("/api/device/bot_x/commands").header("Origin", "http://control-room.example"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"));
    }

    private ResultActions heartbeat(String deviceId, String body) throws Exception {
        return mockMvc.perform(post("/api/device/" + deviceId + "/heartbeat")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }
}
