package com.example.nfse.retrieval.portal;

import com.example.nfse.retrieval.model.Direction;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/** In-memory portal: serves XML for NFS-e links and PDF for DANFS-e links. */
public class FakePortalSession implements PortalSession {

    public static final byte[] XML_BODY = ("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<NFSe><infNFSe><nNFSe>1</nNFSe></infNFSe></NFSe>").getBytes(StandardCharsets.UTF_8);
    public static final byte[] PDF_BODY = "%PDF-1.4\n1 0 obj << /Type /Catalog >> endobj\n%%EOF"
            .getBytes(StandardCharsets.US_ASCII);

    private final Map<Direction, PortalTable> tables = new EnumMap<>(Direction.class);
    private final List<URI> requested = new ArrayList<>();
    private Supplier<SessionFacts> authentication = () -> new SessionFacts(
            "https://www.nfse.gov.br/EmissorNacional/Dashboard", "NFS-e Emissor Nacional");
    private Function<URI, SessionResponse> responder = FakePortalSession::defaultResponse;
    private boolean closed;

    public FakePortalSession withTable(Direction direction, PortalTable table) {
        tables.put(direction, table);
        return this;
    }

    public FakePortalSession withAuthentication(Supplier<SessionFacts> authentication) {
        this.authentication = authentication;
        return this;
    }

    public FakePortalSession withResponder(Function<URI, SessionResponse> responder) {
        this.responder = responder;
        return this;
    }

    @Override
    public SessionFacts authenticate() {
        return authentication.get();
    }

    @Override
    public PortalTable openTable(Direction direction) {
        return tables.getOrDefault(direction, FakePortalTable.empty());
    }

    @Override
    public String title() {
        return "NFS-e Emissor Nacional";
    }

    @Override
    public String currentUrl() {
        return PortalFixtures.PAGE_URL;
    }

    @Override
    public synchronized SessionResponse get(URI uri, Duration timeout) {
        requested.add(uri);
        return responder.apply(uri);
    }

    @Override
    public void close() {
        closed = true;
    }

    public synchronized List<URI> requested() {
        return List.copyOf(requested);
    }

    public boolean isClosed() {
        return closed;
    }

    public static SessionResponse defaultResponse(URI uri) {
        if (uri.getPath().contains("/DANFSe/")) {
            return new SessionResponse(200, Map.of("content-type", "application/pdf"), PDF_BODY);
        }
        if (uri.getPath().contains("/NFSe/")) {
            return new SessionResponse(200, Map.of("content-type", "application/xml"), XML_BODY);
        }
        return new SessionResponse(404, Map.of(), new byte[0]);
    }
}
