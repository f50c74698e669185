package com.example.nfse.retrieval.controller;

import com.example.nfse.retrieval.model.Company;
import com.example.nfse.retrieval.model.CompanyRequest;
import com.example.nfse.retrieval.model.CompanyResponse;
import com.example.nfse.retrieval.service.CompanyDirectory;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@RestController
@RequestMapping("/api/empresas")
@RequiredArgsConstructor
public class CompanyController {

    private final CompanyDirectory companies;

    @GetMapping
    public List<CompanyResponse> list() {
        return companies.findAll().stream().map(CompanyResponse::from).toList();
    }

    @GetMapping("/{identifier}")
    public CompanyResponse get(@PathVariable String identifier) {
        return CompanyResponse.from(companies.resolve(identifier));
    }

    @PostMapping
    public ResponseEntity<CompanyResponse> register(@RequestBody CompanyRequest request) {
        Company company = companies.register(request);
        return ResponseEntity.created(ServletUriComponentsBuilder.fromCurrentRequest()
                .path("/{id}")
                .buildAndExpand(company.getId())
                .toUri())
            .body(CompanyResponse.from(company));
    }
}
