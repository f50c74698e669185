package com.example.nfse.retrieval.service;

import static com.example.nfse.retrieval.portal.PortalFixtures.noteRow;
import static com.example.nfse.retrieval.portal.PortalFixtures.row;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.nfse.retrieval.config.PortalProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StatusIconRowValidity")
class StatusIconRowValidityTest {

    private final StatusIconRowValidity validity = new StatusIconRowValidity(new PortalProperties());

    @Test
    @DisplayName("Should accept generated notes and reject cancelled ones")
    void readsStatusIcon() {
        assertTrue(validity.isValid(noteRow("K1", "11/2025")));
        assertFalse(validity.isValid(noteRow("K2", "11/2025", false, true)));
    }

    @Test
    @DisplayName("Should treat rows without a status icon as valid")
    void defaultsToValid() {
        assertTrue(validity.isValid(row("<tr><td>K3</td><td>x</td><td>11/2025</td></tr>")));
        assertTrue(validity.isValid(row(
                "<tr><td>1</td><td>2</td><td>3</td><td>4</td><td>5</td><td>Gerada</td></tr>")));
    }

    @Test
    @DisplayName("Should match the marker in the icon source as well")
    void matchesIconSource() {
        assertFalse(validity.isValid(row("<tr><td></td><td></td><td>11/2025</td><td></td><td></td>"
                + "<td><img src=\"/img/nota-invalida.png\"></td></tr>")));
    }
}
