package com.footballtransfers.domain.model;

import java.util.List;

/**
 * Untyped content of one table cell: its visible text plus the links and
 * image titles it carries (club crests and flags hold their names only in
 * the {@code title} attribute).
 */
public record RawCell(String text, List<Link> links, List<String> imageTitles, List<String> flagTitles) {

    public static final RawCell EMPTY = new RawCell("", List.of(), List.of(), List.of());

    public RawCell {
        text = text == null ? "" : text;
        links = links == null ? List.of() : List.copyOf(links);
        imageTitles = imageTitles == null ? List.of() : List.copyOf(imageTitles);
        flagTitles = flagTitles == null ? List.of() : List.copyOf(flagTitles);
    }

    public static RawCell ofText(String text) {
        return new RawCell(text, List.of(), List.of(), List.of());
    }

    public boolean isBlank() {
        return text.isBlank() && links.isEmpty() && imageTitles.isEmpty() && flagTitles.isEmpty();
    }

    public record Link(String text, String href) {
    }
}
