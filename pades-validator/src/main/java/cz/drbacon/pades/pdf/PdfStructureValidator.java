package cz.drbacon.pades.pdf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual well-formedness checks on raw PDF bytes: header, trailer, cross-reference tables, objects.
 *
 * This is a scan, not a parser. It tolerates cross-reference streams and compressed object
 * streams (reported as warnings) and bounds all scanning work.
 */
public class PdfStructureValidator {

    private static final Logger LOG = LoggerFactory.getLogger(PdfStructureValidator.class);

    static final int HEADER_SEARCH_WINDOW = 1024;
    static final int MAX_OBJECT_SCAN = 500_000;
    static final int MAX_XREF_SECTIONS = 64;
    static final int XREF_SAMPLE_SIZE = 8;

    private static final double MIN_VERSION = 1.0;
    private static final double MAX_VERSION = 2.0;

    private static final Pattern HEADER = Pattern.compile("%PDF-(\\d+)\\.(\\d+)");
    private static final Pattern XREF_KEYWORD = Pattern.compile("(?m)^xref[ \\t]*$");
    private static final Pattern XREF_SUBSECTION = Pattern.compile("^\\d+ \\d+\\s*$");
    private static final Pattern XREF_ENTRY = Pattern.compile("^\\d{10} \\d{5} [nf]\\s*$");
    private static final Pattern OBJ = Pattern.compile("(?<![0-9])\\d+\\s+\\d+\\s+obj\\b");
    private static final Pattern ENDOBJ = Pattern.compile("\\bendobj\\b");
    private static final Pattern CATALOG = Pattern.compile("/Type\\s*/Catalog\\b");
    private static final Pattern PAGES = Pattern.compile("/Type\\s*/Pages\\b");
    private static final Pattern STARTXREF_OFFSET = Pattern.compile("startxref\\s+(\\d+)");

    public StructureValidationResult validate(byte[] pdf) {
        if (pdf == null || pdf.length == 0) {
            List<String> errors = new ArrayList<>();
            errors.add("Document is empty");
            return new StructureValidationResult(null, false, false, false, false, 0, errors, new ArrayList<>());
        }

        // ISO-8859-1 maps every byte to one char, so string offsets equal byte offsets
        String text = new String(pdf, StandardCharsets.ISO_8859_1);
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        String version = checkHeader(text, errors, warnings);
        boolean headerValid = errors.isEmpty();

        int errorsBefore = errors.size();
        checkTrailer(text, pdf.length, errors, warnings);
        boolean trailerValid = errors.size() == errorsBefore;

        boolean crossReferenceValid = checkCrossReference(text, warnings);

        errorsBefore = errors.size();
        int objectCount = checkObjects(text, errors, warnings);
        boolean objectsValid = errors.size() == errorsBefore;

        StructureValidationResult result = new StructureValidationResult(version, headerValid, crossReferenceValid,
            trailerValid, objectsValid, objectCount, errors, warnings);
        if (result.isValid()) {
            LOG.debug("STRUCTURE_OK: PDF {} with {} objects, {} warnings", version, objectCount, warnings.size());
        } else {
            LOG.info("STRUCTURE_FAIL: {}", errors);
        }
        return result;
    }

    private String checkHeader(String text, List<String> errors, List<String> warnings) {
        Matcher matcher = HEADER.matcher(text);
        matcher.region(0, Math.min(text.length(), HEADER_SEARCH_WINDOW));
        if (!matcher.find()) {
            errors.add("Invalid PDF header: %PDF-x.y not found");
            return null;
        }
        if (matcher.start() > 0) {
            warnings.add("PDF header found at offset " + matcher.start() + " instead of 0");
        }
        String version = matcher.group(1) + "." + matcher.group(2);
        double numeric;
        try {
            numeric = Double.parseDouble(version);
        } catch (NumberFormatException e) {
            errors.add("Invalid PDF header: unreadable version " + version);
            return version;
        }
        if (numeric < MIN_VERSION || numeric > MAX_VERSION) {
            errors.add("Invalid PDF header: unsupported version " + version);
        }
        return version;
    }

    private void checkTrailer(String text, int length, List<String> errors, List<String> warnings) {
        int startxref = text.lastIndexOf("startxref");
        int eof = text.lastIndexOf("%%EOF");
        int trailer = text.lastIndexOf("trailer");

        if (startxref < 0) {
            errors.add("Missing startxref marker");
        }
        if (eof < 0) {
            errors.add("Missing %%EOF marker");
        }
        if (trailer < 0) {
            warnings.add("Traditional trailer not found (may use cross-reference streams)");
        } else if (startxref >= 0 && trailer > startxref) {
            warnings.add("Trailer appears after startxref");
        }

        if (startxref >= 0) {
            Matcher offset = STARTXREF_OFFSET.matcher(text);
            if (!offset.find(startxref)) {
                warnings.add("startxref is not followed by a byte offset");
            } else {
                long value;
                try {
                    value = Long.parseLong(offset.group(1));
                } catch (NumberFormatException e) {
                    value = -1;
                }
                if (value <= 0 || value >= length) {
                    warnings.add("startxref offset out of range: " + offset.group(1));
                } else if (!pointsAtCrossReference(text, (int) value)) {
                    warnings.add("startxref offset " + value + " does not point to a cross-reference section");
                }
            }
        }
    }

    private static boolean pointsAtCrossReference(String text, int offset) {
        int end = Math.min(text.length(), offset + 32);
        String probe = text.substring(offset, end).trim();
        return probe.startsWith("xref") || probe.matches("(?s)^\\d+\\s+\\d+\\s+obj.*");
    }

    private boolean checkCrossReference(String text, List<String> warnings) {
        Matcher matcher = XREF_KEYWORD.matcher(text);
        int sections = 0;
        boolean allValid = true;
        while (matcher.find()) {
            if (++sections > MAX_XREF_SECTIONS) {
                warnings.add("More than " + MAX_XREF_SECTIONS + " cross-reference sections, remaining ones not checked");
                break;
            }
            int validEntries = sampleEntries(text, matcher.end());
            if (validEntries == 0) {
                warnings.add("Cross-reference section at offset " + matcher.start() + " has no valid entries");
                allValid = false;
            }
        }
        if (sections == 0) {
            warnings.add("No classic cross-reference table found (may use cross-reference streams)");
        }
        return allValid;
    }

    private static int sampleEntries(String text, int from) {
        int valid = 0;
        int sampled = 0;
        int position = from;
        while (sampled < XREF_SAMPLE_SIZE && position < text.length()) {
            int lineEnd = nextLineEnd(text, position);
            String line = text.substring(position, lineEnd).trim();
            position = skipLineBreaks(text, lineEnd);
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith("trailer")) {
                break;
            }
            if (XREF_SUBSECTION.matcher(line).matches()) {
                continue;
            }
            sampled++;
            if (XREF_ENTRY.matcher(line).matches()) {
                valid++;
            }
        }
        return valid;
    }

    private static int nextLineEnd(String text, int from) {
        int i = from;
        while (i < text.length() && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
            i++;
        }
        return i;
    }

    private static int skipLineBreaks(String text, int from) {
        int i = from;
        while (i < text.length() && (text.charAt(i) == '\n' || text.charAt(i) == '\r')) {
            i++;
        }
        return i;
    }

    private int checkObjects(String text, List<String> errors, List<String> warnings) {
        int objects = count(OBJ, text);
        int ends = count(ENDOBJ, text);
        if (objects >= MAX_OBJECT_SCAN || ends >= MAX_OBJECT_SCAN) {
            warnings.add("Object scan stopped after " + MAX_OBJECT_SCAN + " matches, object count not compared");
        } else if (objects != ends) {
            errors.add(String.format("Object count mismatch: %d obj vs %d endobj", objects, ends));
        }
        if (objects == 0) {
            warnings.add("No indirect objects found");
        }
        if (!CATALOG.matcher(text).find()) {
            warnings.add("Root catalog object not clearly identified (may be compressed)");
        }
        if (!PAGES.matcher(text).find()) {
            warnings.add("Pages tree object not clearly identified (may be compressed)");
        }
        return objects;
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (count < MAX_OBJECT_SCAN && matcher.find()) {
            count++;
        }
        return count;
    }
}
