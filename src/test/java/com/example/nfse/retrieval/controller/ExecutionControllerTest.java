package com.example.nfse.retrieval.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.nfse.retrieval.model.BillingPeriod;
import com.example.nfse.retrieval.model.Company;
import com.example.nfse.retrieval.model.CompanyRegime;
import com.example.nfse.retrieval.model.DirectionFilter;
import com.example.nfse.retrieval.model.DownloadVerificationReport;
import com.example.nfse.retrieval.model.JobSnapshot;
import com.example.nfse.retrieval.model.JobStage;
import com.example.nfse.retrieval.model.JobStatus;
import com.example.nfse.retrieval.model.VerifiedFile;
import com.example.nfse.retrieval.service.DownloadVerificationService;
import com.example.nfse.retrieval.service.JobOrchestrator;
import com.example.nfse.retrieval.support.AlreadyRunningException;
import com.example.nfse.retrieval.support.CompanyNotFoundException;
import com.example.nfse.retrieval.support.InvalidPeriodException;
import com.example.nfse.retrieval.support.JobNotFoundException;
import com.example.nfse.retrieval.support.QueueFullException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ExecutionController.class)
@DisplayName("ExecutionController")
class ExecutionControllerTest {

    private static final Instant CREATED = Instant.parse("2025-12-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JobOrchestrator orchestrator;

    @MockBean
    private DownloadVerificationService verificationService;

    private JobSnapshot pending() {
        Company company = new Company("c-1", "12345678000199", "Padaria Central", CompanyRegime.SIMPLES);
        return JobSnapshot.pending("job-1", company, BillingPeriod.parse("112025"), DirectionFilter.AMBAS, true,
                CREATED);
    }

    @Test
    @DisplayName("Should accept a job and point to its status")
    void acceptsJob() throws Exception {
        when(orchestrator.submit("c-1", "112025", "ambas", null)).thenReturn(pending());

        mockMvc.perform(post("/api/execucao/c-1").param("competencia", "112025"))
                .andExpect(status().isAccepted())
                .andExpect(header().string("Location", "http://localhost/api/execucao/job-1/status"))
                .andExpect(jsonPath("$.execucao_id").value("job-1"))
                .andExpect(jsonPath("$.empresa_id").value("c-1"))
                .andExpect(jsonPath("$.status").value("pendente"))
                .andExpect(jsonPath("$.etapa_atual").value("inicio"))
                .andExpect(jsonPath("$.progresso").value(0));
    }

    @Test
    @DisplayName("Should pass the headless override through")
    void forwardsHeadless() throws Exception {
        when(orchestrator.submit(eq("c-1"), eq("112025"), eq("emitidas"), eq(false))).thenReturn(pending());

        mockMvc.perform(post("/api/execucao/c-1")
                        .param("competencia", "112025")
                        .param("tipo", "emitidas")
                        .param("headless", "false"))
                .andExpect(status().isAccepted());

        verify(orchestrator).submit("c-1", "112025", "emitidas", false);
    }

    @Test
    @DisplayName("Should answer 400 for a malformed period")
    void rejectsInvalidPeriod() throws Exception {
        when(orchestrator.submit(any(), eq("13-2025"), any(), isNull()))
                .thenThrow(new InvalidPeriodException("Invalid competencia '13-2025'"));

        mockMvc.perform(post("/api/execucao/c-1").param("competencia", "13-2025"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.erro").value("InvalidPeriod"));
    }

    @Test
    @DisplayName("Should answer 400 when the period is missing")
    void rejectsMissingPeriod() throws Exception {
        mockMvc.perform(post("/api/execucao/c-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.erro").value("InvalidRequest"));
    }

    @Test
    @DisplayName("Should answer 404 for an unknown company")
    void rejectsUnknownCompany() throws Exception {
        when(orchestrator.submit(eq("nope"), any(), any(), isNull()))
                .thenThrow(new CompanyNotFoundException("Company 'nope' not found"));

        mockMvc.perform(post("/api/execucao/nope").param("competencia", "112025"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.erro").value("CompanyNotFound"));
    }

    @Test
    @DisplayName("Should answer 409 while the company already has a job")
    void rejectsConcurrentJob() throws Exception {
        when(orchestrator.submit(any(), any(), any(), isNull()))
                .thenThrow(new AlreadyRunningException("A job is already pending or running for company c-1"));

        mockMvc.perform(post("/api/execucao/c-1").param("competencia", "112025"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.erro").value("AlreadyRunning"));
    }

    @Test
    @DisplayName("Should answer 503 when the queue is full")
    void rejectsWhenQueueFull() throws Exception {
        when(orchestrator.submit(any(), any(), any(), isNull()))
                .thenThrow(new QueueFullException("The retrieval queue is full, try again later"));

        mockMvc.perform(post("/api/execucao/c-1").param("competencia", "112025"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.erro").value("QueueFull"));
    }

    @Test
    @DisplayName("Should report a finished job with its end time")
    void reportsStatus() throws Exception {
        JobSnapshot done = pending().toBuilder()
                .status(JobStatus.SUCCEEDED)
                .stage(JobStage.FINALIZE)
                .progressPercent(100)
                .startedAt(CREATED.plusSeconds(1))
                .finishedAt(CREATED.plusSeconds(30))
                .artifactsWritten(6)
                .message("Completed: 6 files saved")
                .build();
        when(orchestrator.lookup("job-1")).thenReturn(done);

        mockMvc.perform(get("/api/execucao/job-1/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("concluido"))
                .andExpect(jsonPath("$.progresso").value(100))
                .andExpect(jsonPath("$.competencia").value("112025"))
                .andExpect(jsonPath("$.arquivos_gravados").value(6))
                .andExpect(jsonPath("$.data_fim").exists());
    }

    @Test
    @DisplayName("Should answer 404 when no job is known")
    void reportsUnknownJob() throws Exception {
        when(orchestrator.lookup("missing")).thenThrow(new JobNotFoundException("Job missing not found"));

        mockMvc.perform(get("/api/execucao/missing/status"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.erro").value("JobNotFound"));
    }

    @Test
    @DisplayName("Should cancel the job found for the identifier")
    void cancelsJob() throws Exception {
        JobSnapshot job = pending();
        when(orchestrator.lookup("c-1")).thenReturn(job);
        when(orchestrator.cancel("job-1")).thenReturn(job.toBuilder().status(JobStatus.CANCELLED).build());

        mockMvc.perform(post("/api/execucao/c-1/cancelar"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.execucao_id").value("job-1"))
                .andExpect(jsonPath("$.status").value("cancelado"));
    }

    @Test
    @DisplayName("Should refuse to evict an active job")
    void refusesActiveEviction() throws Exception {
        when(orchestrator.lookup("job-1")).thenReturn(pending());
        when(orchestrator.evict("job-1")).thenThrow(new AlreadyRunningException("Job job-1 is still pendente"));

        mockMvc.perform(delete("/api/execucao/job-1"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Should list the verified downloads of a period")
    void verifiesDownloads() throws Exception {
        when(verificationService.verify("c-1", "112025", "ambas")).thenReturn(new DownloadVerificationReport(
                "c-1", "112025", "11-2025/Padaria Central", 1, 1, 0, 0, List.of(
                        new VerifiedFile("11-2025/Padaria Central/Emitidas/K1.xml", "emitidas", 120, true, "ok"),
                        new VerifiedFile("11-2025/Padaria Central/Emitidas/K1.pdf", "emitidas", 900, true, "ok"))));

        mockMvc.perform(get("/api/execucao/c-1/downloads").param("competencia", "112025"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_xml").value(1))
                .andExpect(jsonPath("$.arquivos.length()").value(2))
                .andExpect(jsonPath("$.arquivos[0].valido").value(true));
    }
}
