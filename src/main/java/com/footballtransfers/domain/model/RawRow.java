package com.footballtransfers.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One transfer row as printed on the page, keyed by the page's own column
 * labels in page order. Missing cells are present as {@link RawCell#EMPTY}.
 */
public class RawRow {

    /** Label of the table section the row was found in, e.g. "Arrivals". */
    private final String section;

    /** Direction implied by the section. */
    private final Movement movement;

    /** Zero-based position of the row among the page's transfer rows. */
    private final int rowIndex;

    private final LinkedHashMap<String, RawCell> cells;

    public RawRow(String section, Movement movement, int rowIndex, Map<String, RawCell> cells) {
        this.section = section;
        this.movement = movement;
        this.rowIndex = rowIndex;
        this.cells = new LinkedHashMap<>(cells);
    }

    public String getSection() {
        return section;
    }

    public Movement getMovement() {
        return movement;
    }

    public int getRowIndex() {
        return rowIndex;
    }

    public List<String> labels() {
        return List.copyOf(cells.keySet());
    }

    public Map<String, RawCell> cells() {
        return Collections.unmodifiableMap(cells);
    }

    public RawCell cell(String label) {
        return cells.getOrDefault(label, RawCell.EMPTY);
    }

    public String text(String label) {
        return cell(label).text();
    }

    /**
     * First cell whose label matches one of the candidates, ignoring case and surrounding blanks.
     */
    public Optional<RawCell> find(List<String> candidateLabels) {
        for (String candidate : candidateLabels) {
            for (Map.Entry<String, RawCell> entry : cells.entrySet()) {
                if (entry.getKey().trim().equalsIgnoreCase(candidate.trim())) {
                    return Optional.of(entry.getValue());
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "RawRow{" + section + "#" + rowIndex + " " + cells.keySet() + "}";
    }
}
