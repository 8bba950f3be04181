package org.carma.influence.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.carma.influence.model.GridPoint;
import org.carma.influence.model.ResultRow;
import org.carma.influence.model.RowStatus;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CSV mapping of {@link ResultRow}s for one column layout.
 *
 * Doubles are written with {@link Double#toString(double)} so they read back to the
 * identical value; missing values are empty cells; the adversarial flag is 0/1.
 * Reading is lenient about the spellings other tools use for missing values
 * ({@code nan}, {@code None}) and booleans ({@code True}/{@code False}).
 */
public class ResultRowCodec {

    public static final String BETA = "beta";
    public static final String K = "k";
    public static final String TAU = "tau";
    public static final String ALPHA = "alpha";
    public static final String SEED = "seed";
    public static final String ADVERSARIAL = "adversarial";
    public static final String MU_PLANNER = "mu_planner";
    public static final String MU_RESEARCHER = "mu_researcher";
    public static final String MU_CRITIC = "mu_critic";
    public static final String RTA_BASELINE = "RoundsToApproval_baseline";
    public static final String RTA_INFLUENCE = "RoundsToApproval_influence";
    public static final String AGREEMENT_BASELINE = "AgreementRate_baseline";
    public static final String AGREEMENT_INFLUENCE = "AgreementRate_influence";
    public static final String REVISION_DEPTH = "RevisionDepth_between_rounds";
    public static final String CANONICAL_BASELINE = "PlannerResearcher_Canonical_baseline";
    public static final String CANONICAL_INFLUENCE = "PlannerResearcher_Canonical_influence";
    public static final String PLANNER_SELF = "Planner_SelfAgreement";
    public static final String RESEARCHER_SELF = "Researcher_SelfAgreement";
    public static final String STATUS = "status";
    public static final String FAILURE_REASON = "failure_reason";

    /** Key columns: the grid point identity. */
    public static final List<String> KEY_COLUMNS = List.of(BETA, K, TAU, ALPHA, SEED, ADVERSARIAL);

    /** Column layout without audit columns, as written by earlier sweeps. */
    public static final List<String> LEGACY_COLUMNS = List.of(
        BETA, K, TAU, ALPHA, SEED, ADVERSARIAL,
        MU_PLANNER, MU_RESEARCHER, MU_CRITIC,
        RTA_BASELINE, RTA_INFLUENCE,
        AGREEMENT_BASELINE, AGREEMENT_INFLUENCE,
        REVISION_DEPTH,
        CANONICAL_BASELINE, CANONICAL_INFLUENCE,
        PLANNER_SELF, RESEARCHER_SELF);

    /** Column layout of newly created ledgers. */
    public static final List<String> COLUMNS;

    static {
        List<String> columns = new ArrayList<>(LEGACY_COLUMNS);
        columns.add(STATUS);
        columns.add(FAILURE_REASON);
        COLUMNS = List.copyOf(columns);
    }

    private static final int MAX_REASON_LENGTH = 500;

    private final List<String> columns;
    private final ObjectWriter rowWriter;
    private final ObjectReader rowReader;

    public ResultRowCodec(List<String> columns) {
        for (String key : KEY_COLUMNS) {
            if (!columns.contains(key)) {
                throw new IllegalArgumentException("Ledger columns lack key column '" + key + "': " + columns);
            }
        }
        this.columns = List.copyOf(columns);

        CsvMapper mapper = new CsvMapper();
        CsvSchema.Builder schema = CsvSchema.builder();
        for (String column : columns) {
            schema.addColumn(column);
        }
        CsvSchema rowSchema = schema.build().withoutHeader();
        this.rowWriter = mapper.writerFor(Map.class).with(rowSchema);
        this.rowReader = mapper.readerFor(Map.class).with(rowSchema);
    }

    public static ResultRowCodec standard() {
        return new ResultRowCodec(COLUMNS);
    }

    public List<String> getColumns() {
        return columns;
    }

    public String header() {
        return String.join(",", columns) + "\n";
    }

    /**
     * Split a header line into column names.
     */
    public static List<String> parseHeader(String line) throws IOException {
        CsvMapper mapper = new CsvMapper();
        try (MappingIterator<String[]> it = mapper.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(line)) {
            if (!it.hasNext()) {
                return List.of();
            }
            String[] names = it.next();
            for (int i = 0; i < names.length; i++) {
                names[i] = names[i].trim();
            }
            return List.of(names);
        }
    }

    // ========================================================================
    // ENCODING
    // ========================================================================

    /**
     * One CSV line, newline included, holding exactly this codec's columns.
     */
    public String encode(ResultRow row) {
        Map<String, String> all = new LinkedHashMap<>();
        GridPoint p = row.gridPoint();
        all.put(BETA, Double.toString(p.beta()));
        all.put(K, Double.toString(p.k()));
        all.put(TAU, Double.toString(p.tau()));
        all.put(ALPHA, Double.toString(p.alpha()));
        all.put(SEED, Integer.toString(p.seed()));
        all.put(ADVERSARIAL, p.adversarial() ? "1" : "0");
        all.put(MU_PLANNER, cell(row.muPlanner()));
        all.put(MU_RESEARCHER, cell(row.muResearcher()));
        all.put(MU_CRITIC, cell(row.muCritic()));
        all.put(RTA_BASELINE, cell(row.roundsToApprovalBaseline()));
        all.put(RTA_INFLUENCE, cell(row.roundsToApprovalInfluence()));
        all.put(AGREEMENT_BASELINE, cell(row.agreementRateBaseline()));
        all.put(AGREEMENT_INFLUENCE, cell(row.agreementRateInfluence()));
        all.put(REVISION_DEPTH, cell(row.revisionDepth()));
        all.put(CANONICAL_BASELINE, cell(row.canonicalOverlapBaseline()));
        all.put(CANONICAL_INFLUENCE, cell(row.canonicalOverlapInfluence()));
        all.put(PLANNER_SELF, cell(row.plannerSelfAgreement()));
        all.put(RESEARCHER_SELF, cell(row.researcherSelfAgreement()));
        all.put(STATUS, row.status().name());
        all.put(FAILURE_REASON, sanitize(row.failureReason()));

        Map<String, String> values = new LinkedHashMap<>();
        for (String column : columns) {
            values.put(column, all.getOrDefault(column, ""));
        }
        try {
            String line = rowWriter.writeValueAsString(values);
            return line.endsWith("\n") ? line : line + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode ledger row for " + p, e);
        }
    }

    static String sanitize(String reason) {
        if (reason == null) {
            return "";
        }
        String single = reason.replaceAll("[\\r\\n]+", " ").trim();
        return single.length() <= MAX_REASON_LENGTH ? single : single.substring(0, MAX_REASON_LENGTH);
    }

    private static String cell(double value) {
        return Double.isNaN(value) ? "" : Double.toString(value);
    }

    private static String cell(Integer value) {
        return value == null ? "" : value.toString();
    }

    // ========================================================================
    // DECODING
    // ========================================================================

    /**
     * Parse one data line (without its newline).
     *
     * @throws IllegalArgumentException if the line does not hold a complete, readable row
     */
    public ResultRow decode(String line) {
        Map<String, String> values;
        try {
            values = rowReader.readValue(line);
        } catch (IOException | RuntimeException e) {
            throw new IllegalArgumentException("Unreadable ledger row: " + line, e);
        }
        if (values == null || values.size() != columns.size()) {
            throw new IllegalArgumentException("Expected " + columns.size() + " columns: " + line);
        }

        GridPoint point = new GridPoint(
            parseKeyDouble(values, ALPHA),
            parseKeyDouble(values, BETA),
            parseKeyDouble(values, K),
            parseKeyDouble(values, TAU),
            (int) parseKeyDouble(values, SEED),
            parseBoolean(values.get(ADVERSARIAL)));

        return new ResultRow(point,
            parseDouble(values.get(MU_PLANNER)),
            parseDouble(values.get(MU_RESEARCHER)),
            parseDouble(values.get(MU_CRITIC)),
            parseInteger(values.get(RTA_BASELINE)),
            parseInteger(values.get(RTA_INFLUENCE)),
            parseDouble(values.get(AGREEMENT_BASELINE)),
            parseDouble(values.get(AGREEMENT_INFLUENCE)),
            parseInteger(values.get(REVISION_DEPTH)),
            parseDouble(values.get(CANONICAL_BASELINE)),
            parseDouble(values.get(CANONICAL_INFLUENCE)),
            parseDouble(values.get(PLANNER_SELF)),
            parseDouble(values.get(RESEARCHER_SELF)),
            RowStatus.parse(values.get(STATUS)),
            blankToNull(values.get(FAILURE_REASON)));
    }

    private static double parseKeyDouble(Map<String, String> values, String column) {
        double value = parseDouble(values.get(column));
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Missing key column " + column);
        }
        return value;
    }

    static double parseDouble(String text) {
        if (isMissing(text)) {
            return Double.NaN;
        }
        return Double.parseDouble(text.trim());
    }

    static Integer parseInteger(String text) {
        if (isMissing(text)) {
            return null;
        }
        double value = Double.parseDouble(text.trim());
        return (int) value;
    }

    static boolean parseBoolean(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Missing adversarial flag");
        }
        switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "1":
            case "true":
                return true;
            case "0":
            case "false":
                return false;
            default:
                throw new IllegalArgumentException("Not a boolean: " + text);
        }
    }

    private static boolean isMissing(String text) {
        if (text == null) {
            return true;
        }
        String t = text.trim().toLowerCase(Locale.ROOT);
        return t.isEmpty() || t.equals("nan") || t.equals("none") || t.equals("null");
    }

    private static String blankToNull(String text) {
        return text == null || text.isBlank() ? null : text;
    }
}
