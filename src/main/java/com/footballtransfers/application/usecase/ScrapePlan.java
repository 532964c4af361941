package com.footballtransfers.application.usecase;

import com.footballtransfers.domain.model.LeagueRef;
import com.footballtransfers.domain.model.Window;

import java.util.List;

/**
 * What one run scrapes: every league × season × window × club.
 *
 * @param forcePartial write seasons even when cancellation left some of their jobs unrun
 */
public record ScrapePlan(List<LeagueRef> leagues, List<Integer> seasons, List<Window> windows, boolean forcePartial) {

    public ScrapePlan {
        leagues = List.copyOf(leagues);
        seasons = List.copyOf(seasons);
        windows = List.copyOf(windows);
    }
}
