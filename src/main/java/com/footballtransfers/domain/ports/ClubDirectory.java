package com.footballtransfers.domain.ports;

import com.footballtransfers.domain.error.ExtractionException;
import com.footballtransfers.domain.error.FetchException;
import com.footballtransfers.domain.model.ClubRef;
import com.footballtransfers.domain.model.LeagueRef;

import java.util.List;

/**
 * Port for listing the clubs that played in a league season.
 */
public interface ClubDirectory {

    /**
     * @param league league to list
     * @param season year the season begins
     * @return clubs in a stable order
     */
    List<ClubRef> clubsFor(LeagueRef league, int season) throws FetchException, ExtractionException;
}
