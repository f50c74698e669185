package com.example.nfse.retrieval.portal;

import com.example.nfse.retrieval.model.Company;

@FunctionalInterface
public interface CredentialProvider {

    PortalCredential credentialFor(Company company);
}
