package com.example.nfse.retrieval.service;

import com.example.nfse.retrieval.model.Company;
import com.example.nfse.retrieval.model.CompanyRequest;
import com.example.nfse.retrieval.support.CompanyNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

/** Company registry backed by the {@code empresas} collection. */
@Slf4j
@Service
public class CompanyDirectory {

    private static final int CNPJ_LENGTH = 14;

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    @Autowired
    public CompanyDirectory(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC());
    }

    CompanyDirectory(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    /** Looks a company up by id, then by CNPJ with formatting characters removed. */
    public Company resolve(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new CompanyNotFoundException("Company identifier is required");
        }
        String trimmed = identifier.trim();
        Company byId = mongoTemplate.findById(trimmed, Company.class);
        if (byId != null) {
            return byId;
        }
        String cnpj = Company.normalizeCnpj(trimmed);
        return findByCnpj(cnpj)
                .orElseThrow(() -> new CompanyNotFoundException("Company '%s' not found".formatted(identifier)));
    }

    public List<Company> findAll() {
        return mongoTemplate.find(new Query().with(Sort.by("razaoSocial")), Company.class);
    }

    public Company register(CompanyRequest request) {
        String cnpj = Company.normalizeCnpj(request.cnpj());
        if (cnpj.length() != CNPJ_LENGTH || !cnpj.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("CNPJ must have 14 digits");
        }
        if (request.razaoSocial() == null || request.razaoSocial().isBlank()) {
            throw new IllegalArgumentException("razao_social is required");
        }
        if (request.regime() == null) {
            throw new IllegalArgumentException("regime must be MEI, SIMPLES or PRESUMIDO");
        }
        if (findByCnpj(cnpj).isPresent()) {
            throw new IllegalArgumentException("CNPJ %s is already registered".formatted(cnpj));
        }

        Company company = new Company(UUID.randomUUID().toString(), cnpj, request.razaoSocial().trim(),
                request.regime());
        company.setCreatedAt(Instant.now(clock));
        try {
            mongoTemplate.insert(company);
        } catch (DuplicateKeyException ex) {
            throw new IllegalArgumentException("CNPJ %s is already registered".formatted(cnpj), ex);
        }
        log.info("Registered company id={} cnpj={} regime={}", company.getId(), cnpj, company.getRegime());
        return company;
    }

    private Optional<Company> findByCnpj(String cnpj) {
        if (cnpj.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findOne(Query.query(Criteria.where("cnpj").is(cnpj)),
                Company.class));
    }
}
