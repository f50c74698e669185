package com.example.nfse.retrieval.portal;

import com.example.nfse.retrieval.model.Company;

public interface PortalSessionFactory {

    PortalSession open(Company company, boolean headless);
}
