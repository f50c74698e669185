package com.example.nfse.retrieval.portal;

import java.nio.file.Path;

/** A1 certificate handed to the browser context. Never logged. */
public record PortalCredential(Path pfxPath, String passphrase) {

    @Override
    public String toString() {
        return "PortalCredential[pfxPath=%s, passphrase=****]".formatted(pfxPath.getFileName());
    }
}
