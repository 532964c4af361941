package com.footballtransfers.domain.ports;

import com.footballtransfers.domain.error.DatasetWriteException;
import com.footballtransfers.domain.model.TransferRecord;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for persisting a season's dataset.
 */
public interface DatasetWriter {

    /**
     * Replaces the dataset file of a (league, season) with the given records.
     * The previous file stays intact if the write fails.
     *
     * @return path of the written file
     */
    Path write(String league, int season, List<TransferRecord> records) throws DatasetWriteException;
}
