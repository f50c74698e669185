package com.example.nfse.retrieval.model;

import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Getter
@Setter
@ToString
@NoArgsConstructor
@Document(collection = "empresas")
public class Company {

    @Id
    private String id;
    @Indexed(unique = true)
    private String cnpj;
    private String razaoSocial;
    private CompanyRegime regime;
    private boolean ativo;
    private Instant createdAt;

    public Company(String id, String cnpj, String razaoSocial, CompanyRegime regime) {
        this.id = id;
        this.cnpj = cnpj;
        this.razaoSocial = razaoSocial;
        this.regime = regime;
        this.ativo = true;
    }

    public static String normalizeCnpj(String value) {
        return value == null ? "" : value.replaceAll("[.\\-/\\s]", "");
    }
}
