package lroi.proms.converter.model;

import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * A single cell read from a spreadsheet or CSV export.
 *
 * The kind of value is resolved once when the file is read, so conversion logic
 * never has to guess whether it is looking at text, a number or a date.
 */
@EqualsAndHashCode
public final class CellValue {

    public enum Kind {
        TEXT,
        NUMBER,
        DATE,
        EMPTY
    }

    private static final CellValue EMPTY = new CellValue(Kind.EMPTY, null, null, null);

    private final Kind kind;
    private final String text;
    private final Double number;
    private final LocalDateTime dateTime;

    private CellValue(Kind kind, String text, Double number, LocalDateTime dateTime) {
        this.kind = kind;
        this.text = text;
        this.number = number;
        this.dateTime = dateTime;
    }

    public static CellValue text(String text) {
        return text == null ? EMPTY : new CellValue(Kind.TEXT, text, null, null);
    }

    public static CellValue number(double number) {
        return new CellValue(Kind.NUMBER, null, number, null);
    }

    public static CellValue date(LocalDateTime dateTime) {
        return dateTime == null ? EMPTY : new CellValue(Kind.DATE, null, null, dateTime);
    }

    public static CellValue date(LocalDate date) {
        return date == null ? EMPTY : date(date.atStartOfDay());
    }

    public static CellValue empty() {
        return EMPTY;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isDate() {
        return kind == Kind.DATE;
    }

    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }

    /**
     * True for EMPTY cells and for text/number/date cells that render as
     * whitespace only.
     */
    public boolean isBlank() {
        return asText().trim().isEmpty();
    }

    /**
     * Calendar date of a DATE cell as {@code yyyy-MM-dd}, time component dropped.
     *
     * @throws IllegalStateException if this cell is not a date
     */
    public String asDateString() {
        if (kind != Kind.DATE) {
            throw new IllegalStateException("Cell is not a date: " + kind);
        }
        return dateTime.toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    /**
     * Text form of the value. Integral numbers have no decimal part
     * (45.0 renders as "45"); empty cells render as "".
     */
    public String asText() {
        switch (kind) {
            case TEXT:
                return text;
            case NUMBER:
                return formatNumber(number);
            case DATE:
                return dateTime.toLocalTime().equals(LocalTime.MIDNIGHT)
                        ? asDateString()
                        : dateTime.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            default:
                return "";
        }
    }

    private static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return kind + "(" + asText() + ")";
    }
}
