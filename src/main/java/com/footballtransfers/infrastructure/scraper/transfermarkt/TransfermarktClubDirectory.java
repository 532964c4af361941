package com.footballtransfers.infrastructure.scraper.transfermarkt;

import com.footballtransfers.domain.error.ExtractionException;
import com.footballtransfers.domain.error.FetchException;
import com.footballtransfers.domain.model.ClubRef;
import com.footballtransfers.domain.model.LeagueRef;
import com.footballtransfers.domain.ports.ClubDirectory;
import com.footballtransfers.infrastructure.scraper.HttpPageFetcher;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lists a league season's clubs: the configured static list when there is one,
 * otherwise the clubs linked from the league overview page.
 */
public class TransfermarktClubDirectory implements ClubDirectory {

    private static final Logger logger = LoggerFactory.getLogger(TransfermarktClubDirectory.class);

    private static final Pattern CLUB_HREF = Pattern.compile("^/([^/]+)/startseite/verein/(\\d+)");

    private final HttpPageFetcher fetcher;
    private final TransfermarktUrls urls;

    public TransfermarktClubDirectory(HttpPageFetcher fetcher, TransfermarktUrls urls) {
        this.fetcher = fetcher;
        this.urls = urls;
    }

    @Override
    public List<ClubRef> clubsFor(LeagueRef league, int season) throws FetchException, ExtractionException {
        if (!league.clubs().isEmpty()) {
            return league.clubs();
        }
        String url = urls.leagueOverview(league, season);
        List<ClubRef> clubs = parseOverview(fetcher.fetchBody(url), url);
        logger.info("Discovered {} clubs for {} {}", clubs.size(), league.slug(), season);
        return clubs;
    }

    /**
     * Reads club links from the overview table, first occurrence wins.
     */
    public List<ClubRef> parseOverview(String html, String url) throws ExtractionException {
        Document document = Jsoup.parse(html, url);
        Map<String, ClubRef> clubsById = new LinkedHashMap<>();

        for (Element link : document.select("table.items td.hauptlink a[href]")) {
            Matcher matcher = CLUB_HREF.matcher(link.attr("href"));
            if (!matcher.find()) {
                continue;
            }
            String id = matcher.group(2);
            String name = link.hasAttr("title") && !link.attr("title").isBlank()
                ? link.attr("title").trim()
                : link.text().trim();
            if (name.isEmpty() || clubsById.containsKey(id)) {
                continue;
            }
            List<String> aliases = new ArrayList<>();
            String text = link.text().trim();
            if (!text.isEmpty() && !text.equals(name)) {
                aliases.add(text);
            }
            clubsById.put(id, new ClubRef(matcher.group(1), id, name, aliases));
        }

        if (clubsById.isEmpty()) {
            throw new ExtractionException("No club links on league overview " + url);
        }
        return new ArrayList<>(clubsById.values());
    }
}
