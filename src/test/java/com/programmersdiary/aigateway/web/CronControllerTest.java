package com.programmersdiary.aigateway.web;

import com.programmersdiary.aigateway.cron.CronAnnouncement;
import com.programmersdiary.aigateway.cron.CronJob;
import com.programmersdiary.aigateway.cron.CronJobDraft;
import com.programmersdiary.aigateway.cron.CronPayload;
import com.programmersdiary.aigateway.cron.CronSchedule;
import com.programmersdiary.aigateway.cron.CronScheduleException;
import com.programmersdiary.aigateway.cron.CronService;
import com.programmersdiary.aigateway.cron.CronStoreCorruptException;
import com.programmersdiary.aigateway.cron.ManualRunResult;
import com.programmersdiary.aigateway.cron.PayloadKind;
import com.programmersdiary.aigateway.cron.RunStatus;
import com.programmersdiary.aigateway.cron.ScheduleKind;
import com.programmersdiary.aigateway.delivery.AnnouncementQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class CronControllerTest {

    private CronService cronService;
    private AnnouncementQueue announcementQueue;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        cronService = mock(CronService.class);
        announcementQueue = new AnnouncementQueue(10);
        mockMvc = MockMvcBuilders.standaloneSetup(new CronController(cronService, announcementQueue)).build();
    }

    private static CronJob job(String id) {
        return new CronJob(id, "daily digest", null, true, false, 0, 0, CronSchedule.cron("0 9 * * *", null),
                null, null, CronPayload.agentTurn("Summarize my inbox"), null, null);
    }

    @Test
    void listJobs_usesWireNames() throws Exception {
        when(cronService.list(false)).thenReturn(List.of(job("j1")));

        mockMvc.perform(get("/api/cron/jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("j1"))
                .andExpect(jsonPath("$[0].schedule.kind").value("cron"))
                .andExpect(jsonPath("$[0].payload.kind").value("agentTurn"))
                .andExpect(jsonPath("$[0].wakeMode").value("next-heartbeat"));
    }

    @Test
    void getJob_missingIsNotFound() throws Exception {
        when(cronService.get("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/cron/jobs/nope")).andExpect(status().isNotFound());
    }

    @Test
    void createJob_bindsDraft() throws Exception {
        when(cronService.add(any())).thenReturn(job("j1"));

        mockMvc.perform(post("/api/cron/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "daily digest", "deleteAfterRun": true,
                                 "schedule": {"kind": "cron", "expr": "0 9 * * *", "tz": "Europe/Vilnius"},
                                 "payload": {"kind": "agentTurn", "message": "Summarize my inbox"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("j1"));

        var draft = ArgumentCaptor.forClass(CronJobDraft.class);
        verify(cronService).add(draft.capture());
        assertThat(draft.getValue().name()).isEqualTo("daily digest");
        assertThat(draft.getValue().deleteAfterRun()).isTrue();
        assertThat(draft.getValue().schedule().kind()).isEqualTo(ScheduleKind.CRON);
        assertThat(draft.getValue().schedule().tz()).isEqualTo("Europe/Vilnius");
        assertThat(draft.getValue().payload().kind()).isEqualTo(PayloadKind.AGENT_TURN);
    }

    @Test
    void createJob_invalidScheduleIsBadRequest() throws Exception {
        when(cronService.add(any())).thenThrow(new CronScheduleException("Invalid cron expression 'bogus'"));

        mockMvc.perform(post("/api/cron/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"schedule": {"kind": "cron", "expr": "bogus"},
                                 "payload": {"kind": "agentTurn", "message": "hi"}}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void setEnabled_requiresFlag() throws Exception {
        mockMvc.perform(put("/api/cron/jobs/j1/enabled")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(cronService);
    }

    @Test
    void setEnabled_unknownJobIsNotFound() throws Exception {
        when(cronService.setEnabled("j1", false)).thenReturn(Optional.empty());

        mockMvc.perform(put("/api/cron/jobs/j1/enabled")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"enabled\": false}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void deleteJob() throws Exception {
        when(cronService.remove("j1")).thenReturn(true);
        when(cronService.remove("j2")).thenReturn(false);

        mockMvc.perform(delete("/api/cron/jobs/j1")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/cron/jobs/j2")).andExpect(status().isNotFound());
    }

    @Test
    void runJob_notFoundMapsTo404ButOtherRefusalsAreReturned() throws Exception {
        when(cronService.runNow("gone", false)).thenReturn(ManualRunResult.notRun("not-found"));
        when(cronService.runNow("later", true)).thenReturn(ManualRunResult.notRun("refire-gap"));

        mockMvc.perform(post("/api/cron/jobs/gone/run")).andExpect(status().isNotFound());
        mockMvc.perform(post("/api/cron/jobs/later/run").param("force", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ran").value(false))
                .andExpect(jsonPath("$.reason").value("refire-gap"));
    }

    @Test
    void runs_defaultLimit() throws Exception {
        when(cronService.runs("j1", 50)).thenReturn(List.of());

        mockMvc.perform(get("/api/cron/jobs/j1/runs")).andExpect(status().isOk());

        verify(cronService).runs("j1", 50);
    }

    @Test
    void announcements_drainQueue() throws Exception {
        announcementQueue.announce(new CronAnnouncement("j1", "digest", RunStatus.OK, "done", "telegram", "42", 1L));

        mockMvc.perform(get("/api/cron/announcements"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].jobId").value("j1"))
                .andExpect(jsonPath("$[0].status").value("ok"));
        assertThat(announcementQueue.size()).isZero();
    }

    @Test
    void corruptStoreIsServiceUnavailable() throws Exception {
        when(cronService.list(true)).thenThrow(new CronStoreCorruptException(Path.of("jobs.json"), "bad json"));

        mockMvc.perform(get("/api/cron/jobs").param("includeDisabled", "true"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value(containsString("bad json")));
    }
}
