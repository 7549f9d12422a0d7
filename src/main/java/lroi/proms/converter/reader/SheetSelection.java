package lroi.proms.converter.reader;

/**
 * Which sheet of a workbook to read. Ignored for single-table formats such as CSV.
 */
public enum SheetSelection {
    /** The sheet that was active when the workbook was saved (source exports). */
    ACTIVE,
    /** The first sheet (lookup tables). */
    FIRST
}
