package com.example.nfse.retrieval.portal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.nfse.retrieval.config.AutomationProperties;
import com.example.nfse.retrieval.model.Company;
import com.example.nfse.retrieval.model.CompanyRegime;
import com.example.nfse.retrieval.support.AuthenticationFailedException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DirectoryCredentialProvider")
class DirectoryCredentialProviderTest {

    @TempDir
    Path tempDir;

    private DirectoryCredentialProvider provider;
    private final Company company = new Company("c-1", "12.345.678/0001-99", "Padaria Central", CompanyRegime.MEI);

    @BeforeEach
    void setUp() {
        AutomationProperties properties = new AutomationProperties();
        properties.setCredentialsPath(tempDir.toString());
        provider = new DirectoryCredentialProvider(properties);
    }

    @Test
    @DisplayName("Should pair the certificate with its passphrase by CNPJ")
    void loadsCredential() throws IOException {
        Files.write(tempDir.resolve("12345678000199.pfx"), new byte[] {0x30, (byte) 0x82, 0x01});
        Files.writeString(tempDir.resolve("12345678000199.senha"), "s3cret\n");

        PortalCredential credential = provider.credentialFor(company);

        assertEquals(tempDir.resolve("12345678000199.pfx"), credential.pfxPath());
        assertEquals("s3cret", credential.passphrase());
        assertFalse(credential.toString().contains("s3cret"));
    }

    @Test
    @DisplayName("Should fail authentication when the passphrase file is missing")
    void failsWithoutPassphrase() throws IOException {
        Files.write(tempDir.resolve("12345678000199.pfx"), new byte[] {0x30});

        assertThrows(AuthenticationFailedException.class, () -> provider.credentialFor(company));
    }
}
