package com.example.nfse.retrieval.portal;

import com.example.nfse.retrieval.model.Direction;

/** One browser session bound to one company certificate. Owned by exactly one job. */
public interface PortalSession extends SessionContext, AutoCloseable {

    SessionFacts authenticate();

    PortalTable openTable(Direction direction);

    String title();

    @Override
    void close();
}
