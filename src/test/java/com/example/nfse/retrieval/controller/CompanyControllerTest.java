package com.example.nfse.retrieval.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.nfse.retrieval.model.Company;
import com.example.nfse.retrieval.model.CompanyRegime;
import com.example.nfse.retrieval.model.CompanyRequest;
import com.example.nfse.retrieval.service.CompanyDirectory;
import com.example.nfse.retrieval.support.CompanyNotFoundException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(CompanyController.class)
@DisplayName("CompanyController")
class CompanyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CompanyDirectory companies;

    private final Company company = new Company("c-1", "12345678000199", "Padaria Central", CompanyRegime.SIMPLES);

    @Test
    @DisplayName("Should list registered companies")
    void listsCompanies() throws Exception {
        when(companies.findAll()).thenReturn(List.of(company));

        mockMvc.perform(get("/api/empresas"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("c-1"))
                .andExpect(jsonPath("$[0].razao_social").value("Padaria Central"))
                .andExpect(jsonPath("$[0].ativo").value(true));
    }

    @Test
    @DisplayName("Should answer 404 for an unknown company")
    void rejectsUnknownCompany() throws Exception {
        when(companies.resolve("nope")).thenThrow(new CompanyNotFoundException("Company 'nope' not found"));

        mockMvc.perform(get("/api/empresas/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should register a company and return its location")
    void registersCompany() throws Exception {
        when(companies.register(any(CompanyRequest.class))).thenReturn(company);

        mockMvc.perform(post("/api/empresas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"cnpj": "12.345.678/0001-99", "razao_social": "Padaria Central", "regime": "SIMPLES"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "http://localhost/api/empresas/c-1"))
                .andExpect(jsonPath("$.cnpj").value("12345678000199"));
    }

    @Test
    @DisplayName("Should answer 400 for an invalid registration")
    void rejectsInvalidRegistration() throws Exception {
        when(companies.register(any(CompanyRequest.class)))
                .thenThrow(new IllegalArgumentException("CNPJ must have 14 digits"));

        mockMvc.perform(post("/api/empresas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cnpj\": \"123\", \"razao_social\": \"X\", \"regime\": \"MEI\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.erro").value("InvalidRequest"));
    }
}
