package io.github.yok.certdump.core;

import com.google.common.collect.ImmutableList;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * Default values for missing text cells, chosen by column name.
 *
 * <p>
 * Rules are evaluated in declaration order against the lower-cased, accent-stripped column name;
 * the first matching rule wins and {@link #FALLBACK} matches everything. A rule matches when the
 * name contains any of its keywords, or all of them for {@link #PROCESS_NUMBER}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum TextImputationRule {

    PERSON_NAME("Nome não informado", false, "nome", "cliente", "advogado", "juiz"),
    CPF("000.000.000-00", false, "cpf"),
    ADDRESS("Endereço não informado", false, "endereco"),
    CITY("Cidade não informada", false, "cidade"),
    STATE("XX", false, "estado"),
    BAR_REGISTRATION("OAB não informada", false, "oab"),
    COURT_CHAMBER("Vara não informada", false, "vara"),
    PROCESS_NUMBER(null, true, "numero", "processo"),
    FALLBACK("Não informado", false);

    private static final DateTimeFormatter PROCESS_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final String defaultValue;
    private final boolean requireAll;
    private final List<String> keywords;

    TextImputationRule(String defaultValue, boolean requireAll, String... keywords) {
        this.defaultValue = defaultValue;
        this.requireAll = requireAll;
        this.keywords = ImmutableList.copyOf(keywords);
    }

    /**
     * Returns whether this rule applies to the given column.
     *
     * @param columnName column name as reported by the driver
     * @return {@code true} if the rule matches
     */
    public boolean matches(String columnName) {
        if (keywords.isEmpty()) {
            return true;
        }
        String normalized = normalize(columnName);
        if (requireAll) {
            return keywords.stream().allMatch(normalized::contains);
        }
        return keywords.stream().anyMatch(normalized::contains);
    }

    /**
     * Returns the value for a missing cell.
     *
     * <p>
     * {@link #PROCESS_NUMBER} synthesizes {@code PROC-<yyyyMMdd>-<row>} from the run date and the
     * 1-based row position, which is unique within one dataset of one run.
     * </p>
     *
     * @param rowIndex zero-based row position in the dataset being treated
     * @param today run date
     * @return replacement value
     */
    public String valueFor(int rowIndex, LocalDate today) {
        if (this == PROCESS_NUMBER) {
            return "PROC-" + today.format(PROCESS_DATE) + "-" + (rowIndex + 1);
        }
        return defaultValue;
    }

    /**
     * Finds the first rule matching the column name.
     *
     * @param columnName column name
     * @return matching rule, {@link #FALLBACK} when nothing else matches
     */
    public static TextImputationRule forColumn(String columnName) {
        for (TextImputationRule rule : values()) {
            if (rule.matches(columnName)) {
                return rule;
            }
        }
        return FALLBACK;
    }

    /**
     * Checks the rule table: every rule except {@link #FALLBACK} needs keywords, and
     * {@link #FALLBACK} must be evaluated last.
     *
     * @throws IllegalStateException if the table is inconsistent
     */
    public static void validateRuleTable() {
        TextImputationRule[] rules = values();
        if (rules[rules.length - 1] != FALLBACK) {
            throw new IllegalStateException("FALLBACK must be the last text imputation rule");
        }
        for (TextImputationRule rule : rules) {
            if (rule != FALLBACK && rule.keywords.isEmpty()) {
                throw new IllegalStateException(
                        "Text imputation rule " + rule + " has no keywords");
            }
            if (rule != PROCESS_NUMBER && rule.defaultValue == null) {
                throw new IllegalStateException("Text imputation rule " + rule + " has no value");
            }
        }
    }

    private static String normalize(String columnName) {
        return StringUtils.stripAccents(StringUtils.defaultString(columnName))
                .toLowerCase(Locale.ROOT);
    }
}
