package com.footballtransfers.infrastructure.scraper.transfermarkt;

import com.footballtransfers.domain.model.LeagueRef;
import com.footballtransfers.domain.model.ScrapeContext;

/**
 * Builds source URLs. Only the international site is supported; query keys are German.
 */
public class TransfermarktUrls {

    private static final String QUERY_SEASON_ID = "saison_id";
    private static final String QUERY_WINDOW = "w_s";
    private static final String QUERY_LOANS = "leihe";
    private static final String QUERY_INTERNAL_MOVEMENTS = "intern";

    private final String baseUrl;

    public TransfermarktUrls(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Transfer page of one club for one season and window, loans included,
     * internal (youth/reserve) movements excluded.
     */
    public String clubTransfers(ScrapeContext context) {
        return baseUrl + "/" + context.club().slug()
            + "/transfers/verein/" + context.club().id()
            + "/plus/1?" + QUERY_SEASON_ID + "=" + context.season()
            + "&" + QUERY_WINDOW + "=" + context.window().getSourceCode()
            + "&" + QUERY_LOANS + "=3"
            + "&" + QUERY_INTERNAL_MOVEMENTS + "=0";
    }

    /** League overview page listing the season's clubs. */
    public String leagueOverview(LeagueRef league, int season) {
        return baseUrl + "/" + league.slug()
            + "/startseite/wettbewerb/" + league.code()
            + "/plus/?" + QUERY_SEASON_ID + "=" + season;
    }
}
