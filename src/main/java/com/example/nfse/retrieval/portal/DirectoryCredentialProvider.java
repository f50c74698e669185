package com.example.nfse.retrieval.portal;

import com.example.nfse.retrieval.config.AutomationProperties;
import com.example.nfse.retrieval.model.Company;
import com.example.nfse.retrieval.support.AuthenticationFailedException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Looks up {@code <credentials-path>/<cnpj>.pfx} and its passphrase in
 * {@code <cnpj>.senha}. Certificate import and encryption at rest belong to
 * another service; this reader only hands the material to the browser.
 */
@Slf4j
@Component
public class DirectoryCredentialProvider implements CredentialProvider {

    private final Path directory;

    public DirectoryCredentialProvider(AutomationProperties properties) {
        this.directory = Path.of(properties.getCredentialsPath()).toAbsolutePath().normalize();
    }

    @Override
    public PortalCredential credentialFor(Company company) {
        String cnpj = Company.normalizeCnpj(company.getCnpj());
        Path pfx = directory.resolve(cnpj + ".pfx");
        Path passphraseFile = directory.resolve(cnpj + ".senha");
        if (!Files.isRegularFile(pfx) || !Files.isRegularFile(passphraseFile)) {
            log.warn("No certificate registered for company={} cnpj={}", company.getId(), cnpj);
            throw new AuthenticationFailedException("No A1 certificate registered for CNPJ %s".formatted(cnpj));
        }
        try {
            String passphrase = Files.readString(passphraseFile, StandardCharsets.UTF_8).strip();
            log.debug("Loaded certificate for company={} file={}", company.getId(), pfx.getFileName());
            return new PortalCredential(pfx, passphrase);
        } catch (IOException ex) {
            throw new AuthenticationFailedException("Failed to read certificate passphrase for CNPJ %s".formatted(cnpj),
                    ex);
        }
    }
}
