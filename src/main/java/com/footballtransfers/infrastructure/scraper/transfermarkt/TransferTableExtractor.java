package com.footballtransfers.infrastructure.scraper.transfermarkt;

import com.footballtransfers.domain.error.ExtractionException;
import com.footballtransfers.domain.model.Movement;
import com.footballtransfers.domain.model.RawCell;
import com.footballtransfers.domain.model.RawPage;
import com.footballtransfers.domain.model.RawRow;
import com.footballtransfers.domain.ports.TransferExtractor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the arrivals and departures tables of a club transfer page.
 *
 * Cells are keyed by the table's own header labels; a header spanning several
 * columns yields one merged cell. The direction of each table comes from its
 * first header label ("In", "Arrivals", ...), then from the box headline, then
 * from table order (arrivals first) as older league-summary pages alternate.
 */
public class TransferTableExtractor implements TransferExtractor {

    private static final Logger logger = LoggerFactory.getLogger(TransferTableExtractor.class);

    private static final String TABLE_SELECTOR = "div.responsive-table table, table.items";
    private static final String PLAYER_LINK = "a[href*=/spieler/]";

    @Override
    public List<RawRow> extract(RawPage page) throws ExtractionException {
        Document document = Jsoup.parse(page.body(), page.url());
        // Small-screen duplicates of names and clubs would shadow the full ones.
        document.select(".show-for-small").remove();

        Elements tables = document.select(TABLE_SELECTOR);
        if (tables.isEmpty()) {
            throw new ExtractionException("No transfer table on " + page.url());
        }

        List<RawRow> rows = new ArrayList<>();
        int recognizedTables = 0;

        for (Element table : tables) {
            List<HeaderColumn> header = readHeader(table);
            if (header.isEmpty() || header.stream().noneMatch(h -> ColumnRole.PLAYER.matches(h.label()))) {
                continue;
            }
            Movement movement = resolveMovement(header, table, recognizedTables);
            recognizedTables++;
            String section = sectionLabel(header, table);

            for (Element tr : table.select("> tbody > tr")) {
                List<Element> tds = tr.children().stream().filter(e -> e.tagName().equals("td")).toList();
                if (tds.size() <= 1 || tr.select(PLAYER_LINK).isEmpty()) {
                    continue;
                }
                rows.add(new RawRow(section, movement, rows.size(), readCells(header, tds)));
            }
        }

        if (recognizedTables == 0) {
            throw new ExtractionException("No table with a recognized transfer header on " + page.url());
        }
        logger.debug("Extracted {} rows from {} tables on {}", rows.size(), recognizedTables, page.url());
        return rows;
    }

    private record HeaderColumn(String label, int span) {
    }

    private List<HeaderColumn> readHeader(Element table) {
        Element headerRow = table.selectFirst("> thead > tr");
        if (headerRow == null) {
            headerRow = table.select("> tbody > tr").stream()
                .filter(tr -> tr.children().stream().anyMatch(c -> c.tagName().equals("th")))
                .findFirst()
                .orElse(null);
        }
        if (headerRow == null) {
            return List.of();
        }
        List<HeaderColumn> columns = new ArrayList<>();
        Map<String, Integer> seen = new LinkedHashMap<>();
        for (Element th : headerRow.select("> th")) {
            String label = th.text().trim();
            if (label.isEmpty()) {
                label = th.attr("title").trim();
            }
            int count = seen.merge(label, 1, Integer::sum);
            if (count > 1) {
                label = label + " (" + count + ")";
            }
            columns.add(new HeaderColumn(label, span(th)));
        }
        return columns;
    }

    private Movement resolveMovement(List<HeaderColumn> header, Element table, int playerTableIndex) {
        Movement fromLabel = movementOf(header.get(0).label());
        if (fromLabel != null) {
            return fromLabel;
        }
        Movement fromHeadline = movementOf(headline(table));
        if (fromHeadline != null) {
            return fromHeadline;
        }
        return playerTableIndex % 2 == 0 ? Movement.IN : Movement.OUT;
    }

    private static Movement movementOf(String label) {
        if (label == null) {
            return null;
        }
        String lower = label.trim().toLowerCase(Locale.ROOT);
        if (lower.equals("in") || lower.startsWith("arrival") || lower.startsWith("incoming")) {
            return Movement.IN;
        }
        if (lower.equals("out") || lower.startsWith("departure") || lower.startsWith("outgoing")) {
            return Movement.OUT;
        }
        return null;
    }

    private static String headline(Element table) {
        Element box = table.closest("div.box");
        if (box == null) {
            return null;
        }
        Element h2 = box.selectFirst("h2");
        return h2 != null ? h2.text() : null;
    }

    private static String sectionLabel(List<HeaderColumn> header, Element table) {
        String headline = headline(table);
        return headline != null && !headline.isBlank() ? headline.trim() : header.get(0).label();
    }

    /**
     * Walks header columns and data cells side by side, honouring colspans on both.
     * Columns with no cell left become empty cells.
     */
    private Map<String, RawCell> readCells(List<HeaderColumn> header, List<Element> tds) {
        Map<String, RawCell> cells = new LinkedHashMap<>();
        int cellIndex = 0;
        int pendingSpan = 0;

        for (HeaderColumn column : header) {
            List<Element> covered = new ArrayList<>();
            int remaining = column.span();
            if (pendingSpan > 0) {
                // previous cell spanned into this column
                int consumed = Math.min(pendingSpan, remaining);
                pendingSpan -= consumed;
                remaining -= consumed;
            }
            while (remaining > 0 && cellIndex < tds.size()) {
                Element td = tds.get(cellIndex++);
                covered.add(td);
                int span = span(td);
                if (span > remaining) {
                    pendingSpan = span - remaining;
                    remaining = 0;
                } else {
                    remaining -= span;
                }
            }

            if (ColumnRole.PLAYER.matches(column.label())) {
                readPlayerCell(column.label(), covered, header, cells);
            } else {
                cells.put(column.label(), toCell(covered));
            }
        }
        return cells;
    }

    /**
     * The player column nests an inline table holding the name and, on club
     * pages, the position below it. The position is exposed under the
     * "Position" label unless the table has its own position column.
     */
    private void readPlayerCell(String label, List<Element> covered, List<HeaderColumn> header,
                                Map<String, RawCell> cells) {
        Element inline = covered.stream()
            .map(td -> td.selectFirst("table.inline-table"))
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(null);

        if (inline == null) {
            cells.put(label, toCell(covered));
            return;
        }

        Elements inlineRows = inline.select("tr");
        Element nameCell = inline.selectFirst("td.hauptlink");
        if (nameCell == null) {
            nameCell = inlineRows.isEmpty() ? inline : inlineRows.first();
        }
        RawCell whole = toCell(covered);
        cells.put(label, new RawCell(nameCell.text().trim(), whole.links(), whole.imageTitles(), whole.flagTitles()));

        boolean hasPositionColumn = header.stream().anyMatch(h -> ColumnRole.POSITION.matches(h.label()));
        if (!hasPositionColumn && inlineRows.size() > 1) {
            cells.put(ColumnRole.POSITION.primaryLabel(), RawCell.ofText(inlineRows.last().text().trim()));
        }
    }

    private static RawCell toCell(List<Element> elements) {
        if (elements.isEmpty()) {
            return RawCell.EMPTY;
        }
        StringBuilder text = new StringBuilder();
        List<RawCell.Link> links = new ArrayList<>();
        List<String> imageTitles = new ArrayList<>();
        List<String> flagTitles = new ArrayList<>();

        for (Element element : elements) {
            String t = element.text().trim();
            if (!t.isEmpty()) {
                if (text.length() > 0) {
                    text.append(' ');
                }
                text.append(t);
            }
            for (Element a : element.select("a[href]")) {
                links.add(new RawCell.Link(a.text().trim(), a.attr("href")));
            }
            for (Element img : element.select("img")) {
                String title = img.hasAttr("title") ? img.attr("title").trim() : img.attr("alt").trim();
                if (title.isEmpty()) {
                    continue;
                }
                if (img.hasClass("flaggenrahmen")) {
                    flagTitles.add(title);
                } else {
                    imageTitles.add(title);
                }
            }
        }
        return new RawCell(text.toString(), links, imageTitles, flagTitles);
    }

    private static int span(Element cell) {
        String colspan = cell.attr("colspan");
        if (colspan.isEmpty()) {
            return 1;
        }
        try {
            return Math.max(1, Integer.parseInt(colspan.trim()));
        } catch (NumberFormatException e) {
            return 1;
        }
    }
}
