package cz.drbacon.pades.cms;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The /ByteRange of a PDF signature: ascending, non-overlapping (offset, length) pairs.
 * The bytes between two pairs (the gap) hold the signature's own /Contents placeholder.
 */
public final class ByteRange {

    private final long[] offsets;
    private final long[] lengths;

    private ByteRange(long[] offsets, long[] lengths) {
        this.offsets = offsets;
        this.lengths = lengths;
    }

    /**
     * @param raw        the /ByteRange array as read from the signature dictionary
     * @param fileLength length of the document the range refers to
     * @throws IllegalArgumentException when the array is malformed or points outside the file
     */
    public static ByteRange parse(int[] raw, long fileLength) {
        if (raw == null || raw.length == 0) {
            throw new IllegalArgumentException("ByteRange is missing");
        }
        if (raw.length % 2 != 0) {
            throw new IllegalArgumentException("ByteRange has an odd number of entries: " + raw.length);
        }
        int pairs = raw.length / 2;
        long[] offsets = new long[pairs];
        long[] lengths = new long[pairs];
        long previousEnd = -1;
        for (int i = 0; i < pairs; i++) {
            long offset = raw[2 * i];
            long length = raw[2 * i + 1];
            if (offset < 0 || length < 0) {
                throw new IllegalArgumentException("ByteRange has negative values: " + Arrays.toString(raw));
            }
            if (offset + length > fileLength) {
                throw new IllegalArgumentException(String.format(
                    "ByteRange segment [%d, %d) exceeds file length %d", offset, offset + length, fileLength));
            }
            if (i > 0 && offset < previousEnd) {
                throw new IllegalArgumentException("ByteRange segments overlap or are out of order: " + Arrays.toString(raw));
            }
            offsets[i] = offset;
            lengths[i] = length;
            previousEnd = offset + length;
        }
        return new ByteRange(offsets, lengths);
    }

    public int gapCount() {
        int gaps = 0;
        for (int i = 1; i < offsets.length; i++) {
            if (offsets[i] > offsets[i - 1] + lengths[i - 1]) {
                gaps++;
            }
        }
        return gaps;
    }

    /**
     * The covered bytes, concatenated in order.
     */
    public byte[] signedContent(byte[] document) {
        ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(Integer.MAX_VALUE, coveredLength()));
        for (int i = 0; i < offsets.length; i++) {
            out.write(document, (int) offsets[i], (int) lengths[i]);
        }
        return out.toByteArray();
    }

    public long coveredLength() {
        long total = 0;
        for (long length : lengths) {
            total += length;
        }
        return total;
    }

    /**
     * True when the range starts at byte 0 and ends at the last byte of the file.
     * A signature followed by incremental updates covers an earlier revision only.
     */
    public boolean coversWholeDocument(long fileLength) {
        int last = offsets.length - 1;
        return offsets[0] == 0 && offsets[last] + lengths[last] == fileLength;
    }

    /**
     * Gaps whose bytes are not a single {@code <hex>} string. Each entry describes the gap.
     */
    public List<String> suspiciousGaps(byte[] document) {
        List<String> problems = new ArrayList<>();
        for (int i = 1; i < offsets.length; i++) {
            long gapStart = offsets[i - 1] + lengths[i - 1];
            long gapEnd = offsets[i];
            if (gapEnd <= gapStart) {
                continue;
            }
            if (document[(int) gapStart] != '<' || document[(int) gapEnd - 1] != '>') {
                problems.add(String.format("Excluded bytes [%d, %d) do not hold the signature contents", gapStart, gapEnd));
            }
        }
        return problems;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < offsets.length; i++) {
            if (i > 0) sb.append(' ');
            sb.append(offsets[i]).append(' ').append(lengths[i]);
        }
        return sb.append(']').toString();
    }
}
