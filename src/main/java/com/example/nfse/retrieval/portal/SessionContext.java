package com.example.nfse.retrieval.portal;

import java.net.URI;
import java.time.Duration;

/** Authenticated request context: cookies and client certificate of the live browser session. */
public interface SessionContext {

    String currentUrl();

    SessionResponse get(URI uri, Duration timeout);
}
