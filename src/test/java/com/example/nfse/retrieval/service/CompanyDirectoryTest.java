package com.example.nfse.retrieval.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.nfse.retrieval.model.Company;
import com.example.nfse.retrieval.model.CompanyRegime;
import com.example.nfse.retrieval.model.CompanyRequest;
import com.example.nfse.retrieval.support.CompanyNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

@DisplayName("CompanyDirectory")
class CompanyDirectoryTest {

    private static final Instant NOW = Instant.parse("2025-12-01T10:00:00Z");

    private MongoTemplate mongoTemplate;
    private CompanyDirectory directory;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        directory = new CompanyDirectory(mongoTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should resolve a company by id first")
    void resolvesById() {
        Company company = new Company("c-1", "12345678000199", "Padaria Central", CompanyRegime.MEI);
        when(mongoTemplate.findById("c-1", Company.class)).thenReturn(company);

        assertSame(company, directory.resolve(" c-1 "));
    }

    @Test
    @DisplayName("Should fall back to the formatted CNPJ")
    void resolvesByCnpj() {
        Company company = new Company("c-1", "12345678000199", "Padaria Central", CompanyRegime.MEI);
        when(mongoTemplate.findOne(any(Query.class), eq(Company.class))).thenReturn(company);

        assertSame(company, directory.resolve("12.345.678/0001-99"));
    }

    @Test
    @DisplayName("Should fail for unknown identifiers")
    void failsForUnknown() {
        assertThrows(CompanyNotFoundException.class, () -> directory.resolve("nope"));
        assertThrows(CompanyNotFoundException.class, () -> directory.resolve(" "));
    }

    @Test
    @DisplayName("Should register a company with a normalized CNPJ")
    void registersCompany() {
        Company company = directory.register(
                new CompanyRequest("12.345.678/0001-99", " Padaria Central ", CompanyRegime.SIMPLES));

        assertEquals("12345678000199", company.getCnpj());
        assertEquals("Padaria Central", company.getRazaoSocial());
        assertEquals(NOW, company.getCreatedAt());
        assertTrue(company.isAtivo());
        verify(mongoTemplate).insert(company);
    }

    @Test
    @DisplayName("Should reject malformed or duplicate CNPJs")
    void rejectsInvalidRegistrations() {
        assertThrows(IllegalArgumentException.class,
                () -> directory.register(new CompanyRequest("123", "X", CompanyRegime.MEI)));

        when(mongoTemplate.findOne(any(Query.class), eq(Company.class)))
                .thenReturn(new Company("c-1", "12345678000199", "Padaria Central", CompanyRegime.MEI));
        assertThrows(IllegalArgumentException.class,
                () -> directory.register(new CompanyRequest("12345678000199", "Outra", CompanyRegime.MEI)));
        verify(mongoTemplate, never()).insert(any(Company.class));
    }
}
