package org.iceforge.imgcache.cache;

import org.iceforge.imgcache.transform.TransformationType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One ledger line per record:
 * <pre>
 *   key;fileName;timestamp;(t1,t2,...)
 * </pre>
 * The three trailing fields never contain ';', so they are parsed from the right and
 * a key containing ';' still round-trips. Sizes are not part of the line; the store
 * reads them from the file system.
 */
public final class CacheLedgerCodec {
    static final char SEPARATOR = ';';

    private CacheLedgerCodec() {}

    public static String encode(CacheRecord r) {
        StringBuilder sb = new StringBuilder();
        sb.append(r.key()).append(SEPARATOR)
                .append(r.fileName()).append(SEPARATOR)
                .append(r.timestamp()).append(SEPARATOR)
                .append('(');
        List<TransformationType> applied = r.appliedTransformations();
        for (int i = 0; i < applied.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(applied.get(i).id());
        }
        return sb.append(')').toString();
    }

    /**
     * Decodes a ledger line. The returned record has size 0 until the caller resolves it.
     *
     * @return empty when the line is malformed
     */
    public static Optional<CacheRecord> decode(String line) {
        if (line == null) return Optional.empty();

        int transformSep = line.lastIndexOf(SEPARATOR);
        if (transformSep < 0) return Optional.empty();
        int timestampSep = line.lastIndexOf(SEPARATOR, transformSep - 1);
        if (timestampSep < 0) return Optional.empty();
        int fileSep = line.lastIndexOf(SEPARATOR, timestampSep - 1);
        if (fileSep < 0) return Optional.empty();

        String key = line.substring(0, fileSep);
        String fileName = line.substring(fileSep + 1, timestampSep);
        String timestampStr = line.substring(timestampSep + 1, transformSep);
        String transformStr = line.substring(transformSep + 1);

        if (key.isEmpty() || fileName.isEmpty()) return Optional.empty();

        long timestamp;
        try {
            timestamp = Long.parseLong(timestampStr);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }

        Optional<List<TransformationType>> applied = decodeTransformations(transformStr);
        if (applied.isEmpty()) return Optional.empty();

        return Optional.of(new CacheRecord(key, fileName, 0L, timestamp, applied.get()));
    }

    private static Optional<List<TransformationType>> decodeTransformations(String s) {
        if (s.length() < 2 || s.charAt(0) != '(' || s.charAt(s.length() - 1) != ')') {
            return Optional.empty();
        }
        String body = s.substring(1, s.length() - 1);
        if (body.isEmpty()) return Optional.of(List.of());

        List<TransformationType> out = new ArrayList<>();
        for (String part : body.split(",", -1)) {
            try {
                Optional<TransformationType> t = TransformationType.fromId(Integer.parseInt(part.trim()));
                if (t.isEmpty() || out.contains(t.get())) return Optional.empty();
                out.add(t.get());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.of(out);
    }
}
