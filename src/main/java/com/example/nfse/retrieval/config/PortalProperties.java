package com.example.nfse.retrieval.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Selectors, link markers and timeouts for the national NFS-e portal. */
@Data
@Component
@ConfigurationProperties(prefix = "app.portal")
public class PortalProperties {

    private String baseUrl = "https://www.nfse.gov.br/EmissorNacional/";

    /** Origin the client certificate is presented to. */
    private String certificateOrigin = "https://www.nfse.gov.br";

    private List<String> loginSelectors = new ArrayList<>(List.of(
            "button:has-text(\"Certificado\")",
            "a:has-text(\"Certificado\")",
            "input[type=\"button\"][value*=\"ertificado\"]",
            "#btnCertificado",
            ".btn-certificado"));

    private List<String> dashboardSelectors = new ArrayList<>(List.of(
            "text=Dashboard",
            "text=Painel",
            "[href*=\"Dashboard\"]",
            ".dashboard",
            "#dashboard"));

    private String outgoingMenuSelector = "li:nth-of-type(3) img";

    private String incomingMenuSelector = "li:nth-of-type(4) img";

    private String sortHeaderSelector = "th.td-competencia";

    private String rowSelector = "table tbody tr";

    private String nextPageSelector = "li:nth-of-type(8) i";

    private String actionIconSelector = "div a i, a i";

    private String menuContainerSelector = ".menu-suspenso-tabela";

    private int periodColumn = 2;

    private int statusColumn = 5;

    private int outgoingActionColumn = 6;

    private int incomingActionColumn = 5;

    /** Substrings of the status icon's alt or src that mark a cancelled or invalid note. */
    private List<String> invalidStatusMarkers = new ArrayList<>(List.of("cancel", "invalid", "inválida"));

    private String primaryHrefFragment = "/Download/NFSe/";

    private String companionHrefFragment = "/Download/DANFSe/";

    private String primaryLabel = "Download XML";

    private String companionLabel = "Download DANFS-e";

    private int primaryMenuOffset = 0;

    private int companionMenuOffset = 1;

    private Duration navigationTimeout = Duration.ofSeconds(30);

    private Duration authenticationTimeout = Duration.ofSeconds(60);

    private Duration tableTimeout = Duration.ofSeconds(10);

    private Duration menuTimeout = Duration.ofSeconds(3);

    private Duration downloadTimeout = Duration.ofSeconds(30);
}
