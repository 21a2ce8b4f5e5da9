package eu.virtualparadox.finrag.ingest.model;

/**
 * Identity of one source document, derived from its location under the input root.
 *
 * @param sourceFile path relative to the input root, always {@code /}-separated
 * @param company    company directory, or {@link #UNKNOWN}
 * @param region     region directory, or {@link #UNKNOWN}
 * @param reportType report category directory (e.g. {@code annual}), or {@link #UNKNOWN}
 * @param year       four-digit report year from the file name, or {@link #UNKNOWN}
 * @param resolved   whether the path followed the {@code region/category/company/file} convention
 *                   and the file name carried a year
 */
public record DocumentMetadata(String sourceFile,
                               String company,
                               String region,
                               String reportType,
                               String year,
                               boolean resolved) {

    public static final String UNKNOWN = "unknown";
}
