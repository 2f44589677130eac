package org.Aayush.exogenous.io;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.exogenous.ProjectionException;
import org.Aayush.exogenous.table.AdjustmentRow;
import org.Aayush.exogenous.table.BaselineRow;
import org.Aayush.exogenous.table.GrowthRow;
import org.Aayush.exogenous.table.RegionPopulationRow;
import org.Aayush.exogenous.table.ScenarioPopulationRow;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Reads header-addressed CSV reference tables into row records.
 *
 * <p>A leading YAML metadata block delimited by {@code ---} and {@code ...} lines is skipped, as are
 * lines starting with {@code #} before the header. Extra columns are ignored. Blank, {@code NA} and
 * {@code nan} numeric cells read as {@code NaN}.</p>
 */
@Slf4j
public final class CsvTableReader {
    private static final String METADATA_START = "---";
    private static final String METADATA_END = "...";
    private static final String COMMENT_PREFIX = "#";
    private static final int MAX_PREAMBLE_CHARS = 1 << 20;

    public List<BaselineRow> readBaseline(Path path) {
        return read(path, this::readBaseline);
    }

    /**
     * Reads baseline rows from columns {@code model, scenario, iso, year, value}.
     */
    public List<BaselineRow> readBaseline(Reader reader) {
        return read(reader, "baseline", List.of("model", "scenario", "iso", "year", "value"),
                row -> new BaselineRow(
                        row.text("model"), row.text("scenario"), row.text("iso"),
                        row.year("year"), row.number("value")));
    }

    public List<GrowthRow> readGrowth(Path path) {
        return read(path, this::readGrowth);
    }

    /**
     * Reads growth rows from columns {@code model, scenario, iso, year, growth}.
     */
    public List<GrowthRow> readGrowth(Reader reader) {
        return read(reader, "growth", List.of("model", "scenario", "iso", "year", "growth"),
                row -> new GrowthRow(
                        row.text("model"), row.text("scenario"), row.text("iso"),
                        row.year("year"), row.number("growth")));
    }

    public List<AdjustmentRow> readAdjustments(Path path) {
        return read(path, this::readAdjustments);
    }

    /**
     * Reads nightlight ratios from columns {@code hierid, gdppc_ratio}.
     */
    public List<AdjustmentRow> readAdjustments(Reader reader) {
        return read(reader, "nightlights", List.of("hierid", "gdppc_ratio"),
                row -> new AdjustmentRow(row.text("hierid"), row.number("gdppc_ratio")));
    }

    public List<RegionPopulationRow> readRegionPopulation(Path path) {
        return read(path, this::readRegionPopulation);
    }

    /**
     * Reads regional population from columns {@code hierid, year, pop}.
     */
    public List<RegionPopulationRow> readRegionPopulation(Reader reader) {
        return read(reader, "region population", List.of("hierid", "year", "pop"),
                row -> new RegionPopulationRow(row.text("hierid"), row.year("year"), row.number("pop")));
    }

    public List<ScenarioPopulationRow> readScenarioPopulation(Path path) {
        return read(path, this::readScenarioPopulation);
    }

    /**
     * Reads scenario population from columns {@code ISO, year, ssp, population}.
     */
    public List<ScenarioPopulationRow> readScenarioPopulation(Reader reader) {
        return read(reader, "scenario population", List.of("ISO", "year", "ssp", "population"),
                row -> new ScenarioPopulationRow(
                        row.text("ISO"), row.year("year"), row.text("ssp"), row.number("population")));
    }

    private static <T> List<T> read(Path path, Function<Reader, List<T>> parser) {
        Objects.requireNonNull(path, "path");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<T> rows = parser.apply(reader);
            log.info("Read {} rows from {}", rows.size(), path);
            return rows;
        } catch (IOException ex) {
            throw new ProjectionException(
                    ProjectionException.REASON_TABLE_READ_FAILED,
                    "cannot read table " + path,
                    ex
            );
        }
    }

    private static <T> List<T> read(
            Reader source,
            String tableName,
            List<String> requiredColumns,
            Function<CsvRow, T> mapper
    ) {
        Objects.requireNonNull(source, "reader");
        BufferedReader buffered = source instanceof BufferedReader b ? b : new BufferedReader(source);
        try {
            skipPreamble(buffered);
            try (CSVReader csv = new CSVReaderBuilder(buffered).build()) {
                String[] header = csv.readNext();
                if (header == null) {
                    throw new ProjectionException(
                            ProjectionException.REASON_COLUMN_MISSING,
                            tableName + " table has no header row"
                    );
                }
                Map<String, Integer> columns = indexColumns(header);
                for (String column : requiredColumns) {
                    if (!columns.containsKey(column)) {
                        throw new ProjectionException(
                                ProjectionException.REASON_COLUMN_MISSING,
                                tableName + " table is missing required column '" + column + "'"
                        );
                    }
                }

                List<T> rows = new ArrayList<>();
                String[] cells;
                long line = 1;
                while ((cells = csv.readNext()) != null) {
                    line++;
                    if (cells.length == 1 && cells[0].isBlank()) {
                        continue;
                    }
                    try {
                        rows.add(mapper.apply(new CsvRow(columns, cells)));
                    } catch (NumberFormatException | ArrayIndexOutOfBoundsException ex) {
                        throw new ProjectionException(
                                ProjectionException.REASON_TABLE_READ_FAILED,
                                tableName + " table has a malformed record at data line " + line,
                                ex
                        );
                    }
                }
                return rows;
            }
        } catch (IOException | CsvValidationException ex) {
            throw new ProjectionException(
                    ProjectionException.REASON_TABLE_READ_FAILED,
                    "cannot parse " + tableName + " table",
                    ex
            );
        }
    }

    private static void skipPreamble(BufferedReader reader) throws IOException {
        boolean inMetadata = false;
        while (true) {
            reader.mark(MAX_PREAMBLE_CHARS);
            String line = reader.readLine();
            if (line == null) {
                return;
            }
            String trimmed = line.trim();
            if (inMetadata) {
                if (trimmed.equals(METADATA_END)) {
                    inMetadata = false;
                }
                continue;
            }
            if (trimmed.equals(METADATA_START)) {
                inMetadata = true;
                continue;
            }
            if (trimmed.isEmpty() || trimmed.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            reader.reset();
            return;
        }
    }

    private static Map<String, Integer> indexColumns(String[] header) {
        Map<String, Integer> columns = new HashMap<>(header.length * 2);
        for (int i = 0; i < header.length; i++) {
            String name = header[i].trim();
            if (i == 0 && !name.isEmpty() && name.charAt(0) == '\uFEFF') {
                name = name.substring(1);
            }
            columns.putIfAbsent(name, i);
        }
        return columns;
    }

    private static final class CsvRow {
        private final Map<String, Integer> columns;
        private final String[] cells;

        private CsvRow(Map<String, Integer> columns, String[] cells) {
            this.columns = columns;
            this.cells = cells;
        }

        String text(String column) {
            return cells[columns.get(column)].trim();
        }

        int year(String column) {
            String value = text(column);
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException ex) {
                return (int) Double.parseDouble(value);
            }
        }

        double number(String column) {
            String value = text(column);
            if (value.isEmpty() || value.equalsIgnoreCase("NA") || value.equalsIgnoreCase("nan")) {
                return Double.NaN;
            }
            return Double.parseDouble(value);
        }
    }
}
