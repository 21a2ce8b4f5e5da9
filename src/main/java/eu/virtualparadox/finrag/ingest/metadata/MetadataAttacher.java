package eu.virtualparadox.finrag.ingest.metadata;

import eu.virtualparadox.finrag.ingest.chunker.ChunkSpan;
import eu.virtualparadox.finrag.ingest.model.Chunk;
import eu.virtualparadox.finrag.ingest.model.DocumentMetadata;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import static eu.virtualparadox.finrag.ingest.model.DocumentMetadata.UNKNOWN;

/**
 * Derives document identity from the source path and stamps it onto every chunk.
 *
 * <p>Expected layout under the input root:</p>
 * <pre>
 *     us/annual/nvidia/nvidia_2024_annual.pdf
 *     region/category/company/file-with-year
 * </pre>
 * <p>When the path is deeper, the last four elements are used. A path that does not fit is
 * not an error: the missing fields become {@code unknown} and the document is still processed.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
@Component
@Slf4j
public class MetadataAttacher {

    private static final int CONVENTION_DEPTH = 4;

    private static final Pattern NAME_SEPARATORS = Pattern.compile("[_\\-.\\s]+");

    private static final Pattern YEAR = Pattern.compile("(19|20)\\d{2}");

    private static final Pattern NON_ID_CHARS = Pattern.compile("[^a-z0-9]+");

    /**
     * Resolves company, region, report category and year for a source document.
     *
     * @param inputRoot root directory the document was discovered under
     * @param source    path of the document
     * @return metadata, with {@code unknown} fields where the convention did not match
     */
    public DocumentMetadata resolve(final Path inputRoot, final Path source) {
        final Path relative = relativize(inputRoot, source);
        final String sourceFile = toPortable(relative);
        final int depth = relative.getNameCount();

        String region = UNKNOWN;
        String reportType = UNKNOWN;
        String company = UNKNOWN;
        if (depth >= CONVENTION_DEPTH) {
            region = relative.getName(depth - 4).toString();
            reportType = relative.getName(depth - 3).toString();
            company = relative.getName(depth - 2).toString();
        }

        final String year = yearOf(stem(source));
        final boolean resolved = depth >= CONVENTION_DEPTH && !UNKNOWN.equals(year);

        if (!resolved) {
            log.warn("Could not resolve metadata from path {} (company={}, region={}, year={})",
                    sourceFile, company, region, year);
        }

        return new DocumentMetadata(sourceFile, company, region, reportType, year, resolved);
    }

    /**
     * Path of the document relative to the input root, {@code /}-separated on every platform.
     */
    public String sourceFile(final Path inputRoot, final Path source) {
        return toPortable(relativize(inputRoot, source));
    }

    /**
     * Stable document identifier: the path relative to the input root without its extension,
     * lower-cased, with every run of non-alphanumerics replaced by {@code _}.
     * <p>{@code us/annual/acme/acme_2024_annual.pdf} becomes {@code us_annual_acme_acme_2024_annual},
     * so reports sharing a file name in different folders never share chunk ids.</p>
     */
    public String documentId(final Path inputRoot, final Path source) {
        final String relative = toPortable(relativize(inputRoot, source));
        final String withoutExtension = relative.substring(0, relative.length() - source.getFileName().toString().length())
                + stem(source);
        final String normalized = NON_ID_CHARS.matcher(withoutExtension.toLowerCase(Locale.ROOT)).replaceAll("_");
        return StringUtils.defaultIfEmpty(StringUtils.strip(normalized, "_"), "document");
    }

    /**
     * Turns chunk spans into {@link Chunk}s carrying text, identity and statistics.
     *
     * @param documentId     prefix of every chunk id
     * @param metadata       document identity
     * @param normalizedText text the spans point into
     * @param spans          spans in index order
     * @return one chunk per span, same order
     */
    public List<Chunk> attach(final String documentId,
                              final DocumentMetadata metadata,
                              final String normalizedText,
                              final List<ChunkSpan> spans) {
        final List<Chunk> chunks = new ArrayList<>(spans.size());
        for (ChunkSpan span : spans) {
            final String text = normalizedText.substring(span.start(), span.end());
            chunks.add(new Chunk(
                    buildChunkId(documentId, span.index()),
                    span.index(),
                    span.start(),
                    span.end(),
                    text,
                    metadata.company(),
                    metadata.region(),
                    metadata.reportType(),
                    metadata.year(),
                    text.length()
            ));
        }
        return chunks;
    }

    /**
     * Builds a stable chunk identifier: {@code {documentId}_{index(5 digits)}}.
     */
    static String buildChunkId(final String documentId, final int index) {
        return documentId + "_" + String.format(Locale.ROOT, "%05d", index);
    }

    private static String yearOf(final String stem) {
        for (String token : NAME_SEPARATORS.split(stem)) {
            if (YEAR.matcher(token).matches()) {
                return token;
            }
        }
        return UNKNOWN;
    }

    private static Path relativize(final Path inputRoot, final Path source) {
        final Path root = inputRoot.toAbsolutePath().normalize();
        final Path file = source.toAbsolutePath().normalize();
        return file.startsWith(root) ? root.relativize(file) : file.getFileName();
    }

    private static String toPortable(final Path relative) {
        final List<String> parts = new ArrayList<>(relative.getNameCount());
        for (Path part : relative) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }

    private static String stem(final Path source) {
        final String name = source.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
