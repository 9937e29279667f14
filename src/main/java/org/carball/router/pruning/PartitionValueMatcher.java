package org.carball.router.pruning;

import org.carball.router.model.query.Literal;
import org.carball.router.model.query.LiteralType;
import org.carball.router.model.query.Predicate;
import org.carball.router.model.query.PredicateOperator;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Compares a partition's string value with a predicate's literals.
 *
 * <p>Coercion rules:
 * <ul>
 *   <li>NUMBER literals compare as {@link BigDecimal}.</li>
 *   <li>DATE literals compare as ISO-8601 {@link LocalDate}; TIMESTAMP literals as
 *       {@link LocalDateTime} ({@code 'T'} or space separator, a bare date means midnight).</li>
 *   <li>For typed literals, a partition value or literal that does not parse gives
 *       {@link MatchResult#AMBIGUOUS}.</li>
 *   <li>STRING literals are untyped: the values are compared as ISO dates, as decimals
 *       and as raw strings, wherever both sides parse, and the partition matches if any
 *       interpretation matches.</li>
 * </ul>
 * A missing (NULL / Hive default) partition value is always AMBIGUOUS.
 */
public final class PartitionValueMatcher {

    private static final DateTimeFormatter SPACE_SEPARATED_TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter(Locale.ROOT);

    private PartitionValueMatcher() {
        // Utility class - prevent instantiation
    }

    public static MatchResult match(String partitionValue, Predicate predicate) {
        if (partitionValue == null) {
            return MatchResult.AMBIGUOUS;
        }
        List<Literal> operands = predicate.operands();
        LiteralType type = operands.get(0).type();
        if (operands.stream().anyMatch(o -> o.type() != type)) {
            return matchUntyped(partitionValue, predicate);
        }

        switch (type) {
            case NUMBER:
                return matchTyped(partitionValue, predicate, PartitionValueMatcher::parseDecimal);
            case DATE:
                return matchTyped(partitionValue, predicate, PartitionValueMatcher::parseDate);
            case TIMESTAMP:
                return matchTyped(partitionValue, predicate, PartitionValueMatcher::parseTimestamp);
            case BOOLEAN:
                return matchTyped(partitionValue, predicate, PartitionValueMatcher::parseBoolean);
            default:
                return matchUntyped(partitionValue, predicate);
        }
    }

    private static <T extends Comparable<? super T>> MatchResult matchTyped(String partitionValue, Predicate predicate,
                                                                    Function<String, Optional<T>> parser) {
        Optional<T> value = parser.apply(partitionValue);
        Optional<List<T>> operands = parseAll(predicate.operands(), parser);
        if (value.isEmpty() || operands.isEmpty()) {
            return MatchResult.AMBIGUOUS;
        }
        return evaluate(predicate.operator(), value.get(), operands.get()) ? MatchResult.MATCH : MatchResult.NO_MATCH;
    }

    private static MatchResult matchUntyped(String partitionValue, Predicate predicate) {
        PredicateOperator operator = predicate.operator();
        List<String> raw = new ArrayList<>();
        predicate.operands().forEach(o -> raw.add(o.value()));
        if (evaluate(operator, partitionValue, raw)) {
            return MatchResult.MATCH;
        }
        if (matchesIfParsed(partitionValue, predicate, PartitionValueMatcher::parseDate)
                || matchesIfParsed(partitionValue, predicate, PartitionValueMatcher::parseTimestamp)
                || matchesIfParsed(partitionValue, predicate, PartitionValueMatcher::parseDecimal)) {
            return MatchResult.MATCH;
        }
        return MatchResult.NO_MATCH;
    }

    private static <T extends Comparable<? super T>> boolean matchesIfParsed(String partitionValue, Predicate predicate,
                                                                     Function<String, Optional<T>> parser) {
        Optional<T> value = parser.apply(partitionValue);
        Optional<List<T>> operands = parseAll(predicate.operands(), parser);
        return value.isPresent() && operands.isPresent()
                && evaluate(predicate.operator(), value.get(), operands.get());
    }

    private static <T> Optional<List<T>> parseAll(List<Literal> literals, Function<String, Optional<T>> parser) {
        List<T> parsed = new ArrayList<>(literals.size());
        for (Literal literal : literals) {
            Optional<T> value = parser.apply(literal.value());
            if (value.isEmpty()) {
                return Optional.empty();
            }
            parsed.add(value.get());
        }
        return Optional.of(parsed);
    }

    static <T extends Comparable<? super T>> boolean evaluate(PredicateOperator operator, T value, List<T> operands) {
        switch (operator) {
            case EQ:
                return value.compareTo(operands.get(0)) == 0;
            case NEQ:
                return value.compareTo(operands.get(0)) != 0;
            case LT:
                return value.compareTo(operands.get(0)) < 0;
            case LTE:
                return value.compareTo(operands.get(0)) <= 0;
            case GT:
                return value.compareTo(operands.get(0)) > 0;
            case GTE:
                return value.compareTo(operands.get(0)) >= 0;
            case IN:
                return operands.stream().anyMatch(o -> value.compareTo(o) == 0);
            case BETWEEN:
                return value.compareTo(operands.get(0)) >= 0 && value.compareTo(operands.get(1)) <= 0;
            default:
                throw new IllegalArgumentException("Unsupported operator " + operator);
        }
    }

    static Optional<BigDecimal> parseDecimal(String text) {
        try {
            return Optional.of(new BigDecimal(text.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    static Optional<LocalDate> parseDate(String text) {
        try {
            return Optional.of(LocalDate.parse(text.trim()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static Optional<LocalDateTime> parseTimestamp(String text) {
        String trimmed = text.trim();
        if (trimmed.length() <= 10) {
            return parseDate(trimmed).map(LocalDate::atStartOfDay);
        }
        DateTimeFormatter formatter = trimmed.charAt(10) == 'T'
                ? DateTimeFormatter.ISO_LOCAL_DATE_TIME
                : SPACE_SEPARATED_TIMESTAMP;
        try {
            return Optional.of(LocalDateTime.parse(trimmed, formatter));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static Optional<Boolean> parseBoolean(String text) {
        String trimmed = text.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return Optional.of(Boolean.TRUE);
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }
}
