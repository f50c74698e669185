package com.example.nfse.retrieval.controller;

import com.example.nfse.retrieval.model.CancelResponse;
import com.example.nfse.retrieval.model.DownloadVerificationReport;
import com.example.nfse.retrieval.model.ExecutionCreatedResponse;
import com.example.nfse.retrieval.model.ExecutionStatusResponse;
import com.example.nfse.retrieval.model.JobSnapshot;
import com.example.nfse.retrieval.service.DownloadVerificationService;
import com.example.nfse.retrieval.service.JobOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@Slf4j
@RestController
@RequestMapping("/api/execucao")
@RequiredArgsConstructor
public class ExecutionController {

    private final JobOrchestrator orchestrator;
    private final DownloadVerificationService verificationService;

    @PostMapping("/{companyIdentifier}")
    public ResponseEntity<ExecutionCreatedResponse> start(@PathVariable String companyIdentifier,
                                                          @RequestParam("competencia") String competencia,
                                                          @RequestParam(value = "tipo", defaultValue = "ambas")
                                                          String tipo,
                                                          @RequestParam(value = "headless", required = false)
                                                          Boolean headless) {
        JobSnapshot job = orchestrator.submit(companyIdentifier, competencia, tipo, headless);
        log.info("Accepted execution job={} company={} competencia={} tipo={}",
            job.jobId(), job.companyId(), competencia, tipo);

        return ResponseEntity.accepted()
            .location(ServletUriComponentsBuilder.fromCurrentContextPath()
                .path("/api/execucao/{jobId}/status")
                .buildAndExpand(job.jobId())
                .toUri())
            .body(ExecutionCreatedResponse.from(job));
    }

    @GetMapping("/{identifier}/status")
    public ResponseEntity<ExecutionStatusResponse> status(@PathVariable String identifier) {
        return ResponseEntity.ok(ExecutionStatusResponse.from(orchestrator.lookup(identifier)));
    }

    @PostMapping("/{identifier}/cancelar")
    public ResponseEntity<CancelResponse> cancel(@PathVariable String identifier) {
        JobSnapshot job = orchestrator.cancel(orchestrator.lookup(identifier).jobId());
        return ResponseEntity.accepted().body(CancelResponse.from(job));
    }

    @DeleteMapping("/{identifier}")
    public ResponseEntity<ExecutionStatusResponse> evict(@PathVariable String identifier) {
        JobSnapshot job = orchestrator.evict(orchestrator.lookup(identifier).jobId());
        return ResponseEntity.ok(ExecutionStatusResponse.from(job));
    }

    @GetMapping("/{companyIdentifier}/downloads")
    public ResponseEntity<DownloadVerificationReport> downloads(@PathVariable String companyIdentifier,
                                                                @RequestParam("competencia") String competencia,
                                                                @RequestParam(value = "tipo", defaultValue = "ambas")
                                                                String tipo) {
        return ResponseEntity.ok(verificationService.verify(companyIdentifier, competencia, tipo));
    }
}
