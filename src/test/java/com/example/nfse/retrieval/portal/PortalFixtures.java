package com.example.nfse.retrieval.portal;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

/** Row snapshots shaped like the portal's notes table. */
public final class PortalFixtures {

    public static final String PAGE_URL = "https://www.nfse.gov.br/EmissorNacional/Notas/Emitidas";

    private PortalFixtures() {
    }

    public static Element noteRow(String key, String period) {
        return noteRow(key, period, true, true);
    }

    public static Element noteRow(String key, String period, boolean valid, boolean withCompanion) {
        String status = valid
                ? "alt=\"Gerada\" src=\"/img/nota-gerada.png\""
                : "alt=\"Cancelada\" src=\"/img/cancelada.png\"";
        String companion = withCompanion
                ? "<a href=\"/EmissorNacional/Notas/Download/DANFSe/%s\">Download DANFS-e</a>".formatted(key)
                : "";
        return row("""
                <tr>
                  <td>%s</td>
                  <td>05/11/2025</td>
                  <td>%s</td>
                  <td>Cliente Exemplo Ltda</td>
                  <td>1.500,00</td>
                  <td><img %s></td>
                  <td>
                    <div class="dropdown">
                      <a href="#"><i class="glyphicon glyphicon-option-vertical"></i></a>
                      <div class="menu-suspenso-tabela">
                        <a href="/EmissorNacional/Notas/Download/NFSe/%s">Download XML</a>
                        %s
                      </div>
                    </div>
                  </td>
                </tr>
                """.formatted(key, period, status, key, companion));
    }

    public static Element row(String trHtml) {
        return Jsoup.parse("<table><tbody>" + trHtml + "</tbody></table>").selectFirst("tr");
    }
}
