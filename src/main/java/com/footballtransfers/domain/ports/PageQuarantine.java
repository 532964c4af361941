package com.footballtransfers.domain.ports;

import com.footballtransfers.domain.model.RawPage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Port for setting aside pages whose layout was not recognized.
 */
public interface PageQuarantine {

    /**
     * Stores the page for manual review.
     *
     * @return where the page was stored
     */
    Path quarantine(RawPage page, String reason) throws IOException;
}
